/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.streamingrcf.examples.serialization;

import java.nio.charset.StandardCharsets;

import com.amazon.streamingrcf.RandomCutForest;
import com.amazon.streamingrcf.examples.Example;
import com.amazon.streamingrcf.state.RandomCutForestMapper;
import com.amazon.streamingrcf.state.RandomCutForestState;
import com.amazon.streamingrcf.testutils.NormalMixtureTestData;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Serialize a Random Cut Forest to JSON using
 * <a href="https://github.com/FasterXML/jackson">Jackson</a>.
 */
public class JsonExample implements Example {

    public static void main(String[] args) throws Exception {
        new JsonExample().run();
    }

    @Override
    public String command() {
        return "json";
    }

    @Override
    public String description() {
        return "serialize a Random Cut Forest as a JSON string";
    }

    @Override
    public void run() throws Exception {
        // Create and populate a random cut forest

        int dimensions = 4;
        int numberOfTrees = 50;
        int sampleSize = 256;

        RandomCutForest forest = RandomCutForest.builder().dimensions(dimensions).numberOfTrees(numberOfTrees)
                .sampleSize(sampleSize).randomSeed(17).build();

        int dataSize = 4 * sampleSize;
        NormalMixtureTestData testData = new NormalMixtureTestData();
        for (double[] point : testData.generateTestData(dataSize, dimensions, 0)) {
            forest.update(point);
        }

        // Convert to JSON and print the number of bytes

        RandomCutForestMapper mapper = new RandomCutForestMapper();
        ObjectMapper jsonMapper = new ObjectMapper();

        String json = jsonMapper.writeValueAsString(mapper.toState(forest));

        System.out.printf("dimensions = %d, numberOfTrees = %d, sampleSize = %d%n", dimensions, numberOfTrees,
                sampleSize);
        System.out.printf("JSON size = %d bytes%n", json.getBytes(StandardCharsets.UTF_8).length);

        // Restore from JSON. The tree structure is saved, so both forests score and
        // update identically.

        RandomCutForest forest2 = mapper.toModel(jsonMapper.readValue(json, RandomCutForestState.class));
        compare(forest, forest2, testData.generateTestData(100, dimensions, 1));

        System.out.println("Looks good!");
    }

    static void compare(RandomCutForest forest, RandomCutForest forest2, double[][] points) {
        for (double[] point : points) {
            double score = forest.observe(point).getScore();
            double score2 = forest2.observe(point).getScore();
            if (score != score2) {
                throw new IllegalStateException(
                        String.format("restored forest scores %f where the original scores %f", score2, score));
            }
        }
    }
}

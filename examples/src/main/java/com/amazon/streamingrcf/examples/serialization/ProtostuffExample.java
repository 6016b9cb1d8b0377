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

import com.amazon.streamingrcf.RandomCutForest;
import com.amazon.streamingrcf.examples.Example;
import com.amazon.streamingrcf.state.RandomCutForestMapper;
import com.amazon.streamingrcf.state.RandomCutForestState;
import com.amazon.streamingrcf.testutils.NormalMixtureTestData;

import io.protostuff.LinkedBuffer;
import io.protostuff.ProtostuffIOUtil;
import io.protostuff.Schema;
import io.protostuff.runtime.RuntimeSchema;

/**
 * Serialize a Random Cut Forest using the
 * <a href="https://github.com/protostuff/protostuff">protostuff</a> library.
 */
public class ProtostuffExample implements Example {

    public static void main(String[] args) throws Exception {
        new ProtostuffExample().run();
    }

    @Override
    public String command() {
        return "protostuff";
    }

    @Override
    public String description() {
        return "serialize a Random Cut Forest with the protostuff library";
    }

    @Override
    public void run() throws Exception {
        // Create and populate a random cut forest

        int dimensions = 10;
        int numberOfTrees = 50;
        int sampleSize = 256;

        RandomCutForest forest = RandomCutForest.builder().dimensions(dimensions).numberOfTrees(numberOfTrees)
                .sampleSize(sampleSize).randomSeed(23).build();

        int dataSize = 100 * sampleSize;
        NormalMixtureTestData testData = new NormalMixtureTestData();
        for (double[] point : testData.generateTestData(dataSize, dimensions, 0)) {
            forest.update(point);
        }

        // Convert to an array of bytes and print the size

        RandomCutForestMapper mapper = new RandomCutForestMapper();

        Schema<RandomCutForestState> schema = RuntimeSchema.getSchema(RandomCutForestState.class);
        LinkedBuffer buffer = LinkedBuffer.allocate(512);
        byte[] bytes;
        try {
            RandomCutForestState state = mapper.toState(forest);
            bytes = ProtostuffIOUtil.toByteArray(state, schema, buffer);
        } finally {
            buffer.clear();
        }

        System.out.printf("dimensions = %d, numberOfTrees = %d, sampleSize = %d%n", dimensions, numberOfTrees,
                sampleSize);
        System.out.printf("protostuff size = %d bytes%n", bytes.length);

        // Restore from protostuff and compare anomaly scores produced by the two
        // forests

        RandomCutForestState state2 = schema.newMessage();
        ProtostuffIOUtil.mergeFrom(bytes, state2, schema);
        RandomCutForest forest2 = mapper.toModel(state2);
        JsonExample.compare(forest, forest2, testData.generateTestData(100, dimensions, 1));

        System.out.println("Looks good!");
    }
}

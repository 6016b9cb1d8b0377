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

package com.amazon.streamingrcf.examples.detection;

import java.util.Arrays;
import java.util.List;

import com.amazon.streamingrcf.RandomCutForest;
import com.amazon.streamingrcf.examples.Example;
import com.amazon.streamingrcf.testutils.SpikeTestData;
import com.amazon.streamingrcf.threshold.AnomalyScorer;

/**
 * Trains a forest on a short series with a single spike, scores every value
 * against the trained forest and classifies the scores in order.
 */
public class BatchTrainingExample implements Example {

    public static void main(String[] args) throws Exception {
        new BatchTrainingExample().run();
    }

    @Override
    public String command() {
        return "batch_training";
    }

    @Override
    public String description() {
        return "train a forest on a batch and find the spike in it";
    }

    @Override
    public void run() throws Exception {
        double[] series = SpikeTestData.singleSpike();
        List<double[]> points = Arrays.asList(SpikeTestData.asPoints(series));

        RandomCutForest forest = RandomCutForest.builder().dimensions(1).numberOfTrees(50).sampleSize(10)
                .randomSeed(2024).build();
        forest.train(points);
        double[] scores = forest.score(points);

        AnomalyScorer scorer = AnomalyScorer.builder().deviationMultiplier(3.0).minimumObservations(5).build();
        for (int i = 0; i < scores.length; i++) {
            boolean anomalous = scorer.process(scores[i]).isAnomalous();
            System.out.printf("%2d value %6.1f score %.4f%s%n", i, series[i], scores[i], anomalous ? " ANOMALY" : "");
        }
    }
}

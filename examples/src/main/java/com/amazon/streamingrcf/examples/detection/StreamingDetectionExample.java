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

import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.amazon.streamingrcf.RandomCutForest;
import com.amazon.streamingrcf.examples.Example;
import com.amazon.streamingrcf.examples.datasets.ShingledData;
import com.amazon.streamingrcf.returntypes.AnomalyDescriptor;
import com.amazon.streamingrcf.returntypes.ScoreResult;
import com.amazon.streamingrcf.threshold.AnomalyScorer;
import com.amazon.streamingrcf.util.ShingleBuffer;

/**
 * Shingles a noisy periodic series, streams each shingle through a forest and
 * flags scores that stand out from the recent scores.
 */
public class StreamingDetectionExample implements Example {

    private static final Logger log = LogManager.getLogger(StreamingDetectionExample.class);

    public static void main(String[] args) throws Exception {
        new StreamingDetectionExample().run();
    }

    @Override
    public String command() {
        return "streaming_detection";
    }

    @Override
    public String description() {
        return "flag anomalies in a shingled periodic stream";
    }

    @Override
    public void run() throws Exception {
        int shingleSize = 4;
        int numberOfTrees = 50;
        int sampleSize = 256;
        int dataSize = 8 * sampleSize;

        ShingleBuffer shingleBuffer = new ShingleBuffer(shingleSize);
        RandomCutForest forest = RandomCutForest.builder().dimensions(shingleBuffer.getShingledPointSize())
                .numberOfTrees(numberOfTrees).sampleSize(sampleSize).randomSeed(0).build();
        AnomalyScorer scorer = AnomalyScorer.builder().forest(forest).deviationMultiplier(3.0)
                .windowSize(4 * sampleSize).build();

        double[] series = ShingledData.generateSeries(dataSize, 50, 100, 5, 0);
        int anomalies = 0;
        for (int i = 0; i < series.length; i++) {
            Optional<double[]> shingle = shingleBuffer.push(series[i]);
            if (!shingle.isPresent()) {
                continue;
            }
            ScoreResult result = forest.observe(shingle.get());
            if (!forest.isOutputReady()) {
                continue;
            }
            AnomalyDescriptor descriptor = scorer.process(result.getScore());
            if (descriptor.isAnomalous()) {
                anomalies++;
                System.out.printf("%d value %.3f score %.3f threshold %.3f%n", i, series[i], descriptor.getScore(),
                        descriptor.getThreshold());
            }
        }
        log.info("flagged {} of {} values", anomalies, series.length);
    }
}

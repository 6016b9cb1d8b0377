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

package com.amazon.streamingrcf.runner;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.amazon.streamingrcf.NonFiniteValueException;
import com.amazon.streamingrcf.RandomCutForest;
import com.amazon.streamingrcf.returntypes.AnomalyDescriptor;
import com.amazon.streamingrcf.threshold.AnomalyScorer;

/**
 * Streams rows through a forest and an anomaly scorer and appends the score of
 * each row and whether it is anomalous.
 */
public class AnomalyScoreRunner extends SimpleRunner {

    private static final Logger log = LogManager.getLogger(AnomalyScoreRunner.class);

    public AnomalyScoreRunner() {
        super(AnomalyScoreRunner.class.getName(),
                "Compute anomaly scores and verdicts from the input rows and append them to the output rows.",
                AnomalyScoreTransformer::create);
    }

    public static void main(String... args) throws IOException {
        AnomalyScoreRunner runner = new AnomalyScoreRunner();
        runner.parse(args);
        log.info("reading from stdin");
        runner.run(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
                new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8)));
    }

    public static class AnomalyScoreTransformer implements LineTransformer {
        private final RandomCutForest forest;
        private final AnomalyScorer scorer;

        public AnomalyScoreTransformer(RandomCutForest forest, AnomalyScorer scorer) {
            this.forest = forest;
            this.scorer = scorer;
        }

        static AnomalyScoreTransformer create(RandomCutForest forest, ArgumentParser argumentParser) {
            AnomalyScorer scorer = AnomalyScorer.builder().forest(forest)
                    .deviationMultiplier(argumentParser.getDeviationMultiplier())
                    .minimumObservations(argumentParser.getMinimumObservations())
                    .windowSize(argumentParser.getWindowSize()).build();
            return new AnomalyScoreTransformer(forest, scorer);
        }

        @Override
        public List<String> getResultValues(double... point) {
            try {
                double score = forest.observe(point).getScore();
                AnomalyDescriptor descriptor = scorer.process(score);
                return Arrays.asList(Double.toString(score), Boolean.toString(descriptor.isAnomalous()));
            } catch (NonFiniteValueException e) {
                log.warn("skipping point with a non-finite value at coordinate {}", e.getCoordinate());
                return getEmptyResultValue();
            }
        }

        @Override
        public List<String> getEmptyResultValue() {
            return Arrays.asList("NA", "NA");
        }

        @Override
        public List<String> getResultColumnNames() {
            return Arrays.asList("anomaly_score", "anomalous");
        }

        public RandomCutForest getForest() {
            return forest;
        }

        public AnomalyScorer getScorer() {
            return scorer;
        }
    }
}

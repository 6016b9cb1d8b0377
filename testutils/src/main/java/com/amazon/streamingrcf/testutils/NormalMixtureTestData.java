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

package com.amazon.streamingrcf.testutils;

import java.util.Arrays;
import java.util.Random;

/**
 * Samples points from a mixture of two multivariate normal distributions with
 * covariance matrices of the form sigma * I. The first distribution is the base
 * distribution, the second is the anomaly distribution, and the generator moves
 * between them at random. All draws, including the transitions, come from one
 * seeded source so a given seed always produces the same data.
 */
public class NormalMixtureTestData {

    private final double baseMu;
    private final double baseSigma;
    private final double anomalyMu;
    private final double anomalySigma;
    private final double transitionToAnomalyProbability;
    private final double transitionToBaseProbability;

    public NormalMixtureTestData(double baseMu, double baseSigma, double anomalyMu, double anomalySigma,
            double transitionToAnomalyProbability, double transitionToBaseProbability) {
        this.baseMu = baseMu;
        this.baseSigma = baseSigma;
        this.anomalyMu = anomalyMu;
        this.anomalySigma = anomalySigma;
        this.transitionToAnomalyProbability = transitionToAnomalyProbability;
        this.transitionToBaseProbability = transitionToBaseProbability;
    }

    public NormalMixtureTestData() {
        this(0.0, 1.0, 4.0, 2.0, 0.01, 0.3);
    }

    public NormalMixtureTestData(double baseMu, double anomalyMu) {
        this(baseMu, 1.0, anomalyMu, 2.0, 0.01, 0.3);
    }

    public double[][] generateTestData(int numberOfRows, int numberOfColumns, long seed) {
        return generateTestDataWithKey(numberOfRows, numberOfColumns, seed).getData();
    }

    /**
     * Draws rows from the base distribution only, never switching to the anomaly
     * distribution.
     *
     * @param numberOfRows    number of points
     * @param numberOfColumns dimension of each point
     * @param seed            random seed
     * @return the generated points
     */
    public double[][] generateBaseData(int numberOfRows, int numberOfColumns, long seed) {
        double[][] result = new double[numberOfRows][numberOfColumns];
        NormalDistribution dist = new NormalDistribution(new Random(seed));
        for (int i = 0; i < numberOfRows; i++) {
            fillRow(result[i], dist, baseMu, baseSigma);
        }
        return result;
    }

    public LabeledTestData generateTestDataWithKey(int numberOfRows, int numberOfColumns, long seed) {
        double[][] resultData = new double[numberOfRows][numberOfColumns];
        int[] change = new int[numberOfRows];
        int numberOfChanges = 0;
        boolean anomaly = false;

        Random random = new Random(seed);
        NormalDistribution dist = new NormalDistribution(random);

        for (int i = 0; i < numberOfRows; i++) {
            if (!anomaly) {
                fillRow(resultData[i], dist, baseMu, baseSigma);
                if (random.nextDouble() < transitionToAnomalyProbability) {
                    change[numberOfChanges++] = i + 1; // next item is different
                    anomaly = true;
                }
            } else {
                fillRow(resultData[i], dist, anomalyMu, anomalySigma);
                if (random.nextDouble() < transitionToBaseProbability) {
                    anomaly = false;
                    change[numberOfChanges++] = i + 1;
                }
            }
        }

        return new LabeledTestData(resultData, Arrays.copyOf(change, numberOfChanges));
    }

    private void fillRow(double[] row, NormalDistribution dist, double mu, double sigma) {
        for (int j = 0; j < row.length; j++) {
            row[j] = dist.nextDouble(mu, sigma);
        }
    }

    static class NormalDistribution {
        private final Random rng;
        private final double[] buffer;
        private int index;

        NormalDistribution(Random rng) {
            this.rng = rng;
            buffer = new double[2];
            index = 0;
        }

        double nextDouble() {
            if (index == 0) {
                // Box-Muller
                double u = 1.0 - rng.nextDouble();
                double v = rng.nextDouble();
                double r = Math.sqrt(-2 * Math.log(u));
                buffer[0] = r * Math.cos(2 * Math.PI * v);
                buffer[1] = r * Math.sin(2 * Math.PI * v);
            }

            double result = buffer[index];
            index = (index + 1) % 2;

            return result;
        }

        double nextDouble(double mu, double sigma) {
            return mu + sigma * nextDouble();
        }
    }
}

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

package com.amazon.streamingrcf.examples.datasets;

import static java.lang.Math.PI;

import java.util.Random;

/**
 * A noisy cosine wave with occasional level spikes, for streaming examples.
 */
public class ShingledData {

    private ShingledData() {
    }

    /**
     * @param size      number of values
     * @param period    period of the wave
     * @param amplitude amplitude of the wave
     * @param noise     scale of the uniform noise and of the spikes
     * @param seed      random seed
     * @return the series
     */
    public static double[] generateSeries(int size, int period, double amplitude, double noise, long seed) {
        double[] data = new double[size];
        Random prg = new Random(seed);
        Random noisePrg = new Random(prg.nextLong());
        double phase = prg.nextInt(period);
        double amp = (1 + 0.2 * prg.nextDouble()) * amplitude;

        for (int i = 0; i < size; i++) {
            data[i] = amp * Math.cos(2 * PI * (i + phase) / period) + noise * noisePrg.nextDouble();
            if (noisePrg.nextDouble() < 0.01) {
                data[i] += noisePrg.nextDouble() < 0.5 ? 10 * noise : -10 * noise;
            }
        }
        return data;
    }
}

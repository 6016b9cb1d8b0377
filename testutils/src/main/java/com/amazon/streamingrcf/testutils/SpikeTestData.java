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

/**
 * Constant one-dimensional sequences with isolated spikes.
 */
public class SpikeTestData {

    private SpikeTestData() {
    }

    /**
     * @param length     length of the sequence
     * @param baseline   value at every position that is not a spike
     * @param spike      value at the spike positions
     * @param spikeIndex positions holding the spike
     * @return the sequence
     */
    public static double[] generate(int length, double baseline, double spike, int... spikeIndex) {
        double[] result = new double[length];
        Arrays.fill(result, baseline);
        for (int i : spikeIndex) {
            result[i] = spike;
        }
        return result;
    }

    /**
     * The fifteen point sequence of ones with a single value of 100 at index 9.
     *
     * @return the sequence
     */
    public static double[] singleSpike() {
        return generate(15, 1.0, 100.0, 9);
    }

    public static double[][] asPoints(double[] sequence) {
        double[][] result = new double[sequence.length][];
        for (int i = 0; i < sequence.length; i++) {
            result[i] = new double[] { sequence[i] };
        }
        return result;
    }
}

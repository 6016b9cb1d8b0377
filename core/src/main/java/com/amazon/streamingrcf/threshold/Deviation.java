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

package com.amazon.streamingrcf.threshold;

import static com.amazon.streamingrcf.CommonUtils.checkArgument;
import static com.amazon.streamingrcf.CommonUtils.checkState;

/**
 * Running mean and population standard deviation of a stream of values, kept
 * with Welford's algorithm. A stream of identical values has a deviation of
 * exactly zero.
 */
public class Deviation {

    protected long count = 0;

    protected double mean = 0;

    // sum of squared differences from the current mean
    protected double sumSquaredDifferences = 0;

    public Deviation() {
    }

    /**
     * Recreates a deviation from its saved statistics.
     */
    public Deviation(long count, double mean, double sumSquaredDifferences) {
        checkArgument(count >= 0, "count cannot be negative");
        checkArgument(sumSquaredDifferences >= 0, "sum of squared differences cannot be negative");
        this.count = count;
        this.mean = count == 0 ? 0 : mean;
        this.sumSquaredDifferences = count == 0 ? 0 : sumSquaredDifferences;
    }

    public void update(double value) {
        ++count;
        double delta = value - mean;
        mean += delta / count;
        sumSquaredDifferences += delta * (value - mean);
    }

    /**
     * Removes a value that was previously added.
     *
     * @param value the value to remove
     */
    protected void remove(double value) {
        checkState(count > 0, "nothing to remove");
        if (count == 1) {
            count = 0;
            mean = 0;
            sumSquaredDifferences = 0;
            return;
        }
        double oldMean = mean;
        --count;
        mean = oldMean - (value - oldMean) / count;
        sumSquaredDifferences = Math.max(0, sumSquaredDifferences - (value - oldMean) * (value - mean));
    }

    public double getMean() {
        checkState(count > 0, "incorrect invocation for mean");
        return mean;
    }

    public double getDeviation() {
        checkState(count > 0, "incorrect invocation for standard deviation");
        return Math.sqrt(sumSquaredDifferences / count);
    }

    /**
     * @return the number of values the statistics are computed over
     */
    public long getCount() {
        return count;
    }

    public double getSumSquaredDifferences() {
        return sumSquaredDifferences;
    }

    public boolean isEmpty() {
        return count == 0;
    }
}

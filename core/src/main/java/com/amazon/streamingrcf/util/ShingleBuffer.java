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

package com.amazon.streamingrcf.util;

import static com.amazon.streamingrcf.CommonUtils.checkArgument;
import static com.amazon.streamingrcf.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Turns a stream of values into shingles: overlapping windows of the last
 * {@code shingleSize} inputs, oldest first, concatenated into one point. Each
 * input may itself be a vector of {@code dimensions} values.
 */
public class ShingleBuffer {

    /**
     * Number of dimensions of each input.
     */
    private final int dimensions;

    /**
     * Number of inputs in the shingle.
     */
    private final int shingleSize;

    /**
     * A ring buffer containing inputs recently added to the shingle.
     */
    private final double[][] recentPoints;

    /**
     * The index where the next input will be copied to. Once the buffer is full
     * this is also the index of the oldest input.
     */
    private int shingleIndex;

    /**
     * A flag indicating whether the shingle has been completely filled once.
     */
    private boolean full;

    public ShingleBuffer(int dimensions, int shingleSize) {
        checkArgument(dimensions > 0, "dimensions must be greater than 0");
        checkArgument(shingleSize > 0, "shingleSize must be greater than 0");
        this.dimensions = dimensions;
        this.shingleSize = shingleSize;
        recentPoints = new double[shingleSize][dimensions];
        shingleIndex = 0;
        full = false;
    }

    public ShingleBuffer(int shingleSize) {
        this(1, shingleSize);
    }

    /**
     * Adds a scalar. Only valid for a buffer of one-dimensional inputs.
     *
     * @param value the newest value
     * @return the current shingle, once {@code shingleSize} values have arrived
     */
    public Optional<double[]> push(double value) {
        checkArgument(dimensions == 1, "scalar input requires a one-dimensional buffer");
        return push(new double[] { value });
    }

    /**
     * Adds an input, evicting the oldest one once the buffer is full.
     *
     * @param point the newest input
     * @return the current shingle with {@code point} as its last entry, once
     *         {@code shingleSize} inputs have arrived; empty before that
     */
    public Optional<double[]> push(double[] point) {
        checkNotNull(point, "point must not be null");
        checkArgument(point.length == dimensions, () -> String.format("point.length must equal %d", dimensions));
        System.arraycopy(point, 0, recentPoints[shingleIndex], 0, dimensions);

        shingleIndex = (shingleIndex + 1) % shingleSize;
        if (!full && shingleIndex == 0) {
            full = true;
        }
        return full ? Optional.of(getShingle()) : Optional.empty();
    }

    private double[] getShingle() {
        double[] shingle = new double[shingleSize * dimensions];
        for (int i = 0; i < shingleSize; i++) {
            System.arraycopy(recentPoints[(shingleIndex + i) % shingleSize], 0, shingle, i * dimensions, dimensions);
        }
        return shingle;
    }

    /**
     * Batch shingling of a scalar sequence. The result holds
     * {@code max(sequence.length - shingleSize, 0)} windows and the i-th window
     * is {@code sequence[i .. i + shingleSize - 1]}. The window ending at the
     * last value is not included, so a sequence no longer than the shingle size
     * yields nothing.
     *
     * @param sequence    the values
     * @param shingleSize the window length
     * @return the windows in order
     */
    public static List<double[]> shingle(double[] sequence, int shingleSize) {
        checkNotNull(sequence, "sequence must not be null");
        checkArgument(shingleSize > 0, "shingleSize must be greater than 0");
        int count = Math.max(sequence.length - shingleSize, 0);
        List<double[]> shingles = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            shingles.add(Arrays.copyOfRange(sequence, i, i + shingleSize));
        }
        return shingles;
    }

    public boolean isFull() {
        return full;
    }

    public int getDimensions() {
        return dimensions;
    }

    public int getShingleSize() {
        return shingleSize;
    }

    /**
     * @return the number of values in a shingle
     */
    public int getShingledPointSize() {
        return dimensions * shingleSize;
    }
}

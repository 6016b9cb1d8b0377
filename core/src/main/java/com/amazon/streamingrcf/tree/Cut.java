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

package com.amazon.streamingrcf.tree;

/**
 * A Cut represents a division of space into two half-spaces. Cuts define the
 * structure of a {@link RandomCutTree}, and they determine the traversal path
 * followed by {@link RandomCutTree#traverse}.
 */
public class Cut {

    private final int dimension;
    private final double value;

    /**
     * Create a new Cut with the given dimension and value.
     *
     * @param dimension The 0-based index of the dimension that the cut is made in.
     * @param value     The spatial value of the cut.
     */
    public Cut(int dimension, double value) {
        this.dimension = dimension;
        this.value = value;
    }

    /**
     * For the given point, this method compares the value of that point in the cut
     * dimension to the cut value. The name is a mnemonic: in one dimension the
     * method returns 'true' if the point lies to the left of the cut on the number
     * line.
     *
     * @param point A point that we are testing in relation to the cut
     * @param cut   A Cut instance.
     * @return true if the value of the point coordinate corresponding to the cut
     *         dimension is less than or equal to the cut value, false otherwise.
     */
    public static boolean isLeftOf(double[] point, Cut cut) {
        return point[cut.getDimension()] <= cut.getValue();
    }

    /**
     * @return the 0-based index of the dimension that this cut was made in.
     */
    public int getDimension() {
        return dimension;
    }

    /**
     * @return the value of the cut.
     */
    public double getValue() {
        return value;
    }

    @Override
    public String toString() {
        return String.format("Cut(%d, %f)", dimension, value);
    }
}

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

import static com.amazon.streamingrcf.CommonUtils.checkArgument;
import static com.amazon.streamingrcf.CommonUtils.checkState;

import java.util.Arrays;

/**
 * An axis-aligned box given by a minimum and a maximum value in every
 * dimension. A box built from a single point shares the point array and is
 * read-only; boxes built from two points, from another box, or via
 * {@link #copy()} own their arrays and can be grown in place.
 */
public class BoundingBox {

    /**
     * An array containing the minimum value corresponding to each dimension.
     */
    protected final double[] minValues;

    /**
     * An array containing the maximum value corresponding to each dimension.
     */
    protected final double[] maxValues;

    /**
     * The sum of side lengths defined by this bounding box.
     */
    protected double rangeSum;

    public BoundingBox(double[] point) {
        minValues = maxValues = point;
        rangeSum = 0.0;
    }

    /**
     * Create a new BoundingBox with the given minimum values and maximum values.
     *
     * @param minValues The minimum values for each coordinate.
     * @param maxValues The maximum values for each coordinate
     * @param sum       The sum of side lengths
     */
    public BoundingBox(final double[] minValues, final double[] maxValues, double sum) {
        this.minValues = minValues;
        this.maxValues = maxValues;
        rangeSum = sum;
    }

    public BoundingBox(final double[] first, final double[] second) {
        checkArgument(first.length == second.length, " incorrect lengths in box");
        minValues = new double[first.length];
        maxValues = new double[first.length];
        rangeSum = 0;
        for (int i = 0; i < minValues.length; ++i) {
            minValues[i] = Math.min(first[i], second[i]);
            maxValues[i] = Math.max(first[i], second[i]);
            rangeSum += maxValues[i] - minValues[i];
        }
    }

    public BoundingBox copy() {
        return new BoundingBox(Arrays.copyOf(minValues, minValues.length), Arrays.copyOf(maxValues, maxValues.length),
                rangeSum);
    }

    public BoundingBox getMergedBox(BoundingBox otherBox) {
        checkArgument(otherBox.getDimensions() == minValues.length, "incorrect length");
        double[] minValuesMerged = new double[minValues.length];
        double[] maxValuesMerged = new double[minValues.length];
        double sum = 0.0;

        for (int i = 0; i < minValues.length; ++i) {
            minValuesMerged[i] = Math.min(minValues[i], otherBox.minValues[i]);
            maxValuesMerged[i] = Math.max(maxValues[i], otherBox.maxValues[i]);
            sum += maxValuesMerged[i] - minValuesMerged[i];
        }
        return new BoundingBox(minValuesMerged, maxValuesMerged, sum);
    }

    public BoundingBox getMergedBox(double[] point) {
        checkArgument(point.length == minValues.length, "incorrect length");
        return copy().addPoint(point);
    }

    /**
     * The probability that a cut drawn uniformly over the union of this box and
     * the point separates the point from the box. This is the total amount by
     * which the point stretches the box, divided by the range sum of the union.
     *
     * @param point the query point
     * @return a value in [0, 1]; 0 when the box contains the point
     */
    public double probabilityOfCut(double[] point) {
        double range = 0;
        for (int i = 0; i < point.length; i++) {
            range += Math.max(minValues[i] - point[i], 0);
        }
        for (int i = 0; i < point.length; i++) {
            range += Math.max(point[i] - maxValues[i], 0);
        }
        if (range == 0) {
            return 0;
        } else if (rangeSum == 0) {
            return 1;
        } else {
            return range / (range + rangeSum);
        }
    }

    public double[] getMaxValues() {
        return maxValues;
    }

    public double[] getMinValues() {
        return minValues;
    }

    public BoundingBox addPoint(double[] point) {
        checkArgument(minValues.length == point.length, "incorrect length");
        checkState(minValues != maxValues, "not a mutable box");
        rangeSum = 0;
        for (int i = 0; i < point.length; ++i) {
            minValues[i] = Math.min(minValues[i], point[i]);
            maxValues[i] = Math.max(maxValues[i], point[i]);
            rangeSum += maxValues[i] - minValues[i];
        }
        return this;
    }

    public BoundingBox addBox(BoundingBox otherBox) {
        checkState(minValues != maxValues, "not a mutable box");
        rangeSum = 0;
        for (int i = 0; i < minValues.length; ++i) {
            minValues[i] = Math.min(minValues[i], otherBox.minValues[i]);
            maxValues[i] = Math.max(maxValues[i], otherBox.maxValues[i]);
            rangeSum += maxValues[i] - minValues[i];
        }
        return this;
    }

    public int getDimensions() {
        return minValues.length;
    }

    /**
     * @return the sum of side lengths for this BoundingBox.
     */
    public double getRangeSum() {
        return rangeSum;
    }

    public double getMaxValue(final int dimension) {
        return maxValues[dimension];
    }

    public double getMinValue(final int dimension) {
        return minValues[dimension];
    }

    /**
     * Returns true if the given point is contained in this bounding box. This is
     * equivalent to the point being a member of the set defined by this bounding
     * box.
     *
     * @param point with which we're performing the comparison
     * @return whether the point is contained by the bounding box
     */
    public boolean contains(double[] point) {
        checkArgument(point.length == minValues.length, " incorrect lengths");
        for (int i = 0; i < minValues.length; i++) {
            if (minValues[i] > point[i] || maxValues[i] < point[i]) {
                return false;
            }
        }
        return true;
    }

    public boolean contains(BoundingBox otherBox) {
        checkArgument(otherBox.minValues.length == minValues.length, " incorrect lengths");
        return contains(otherBox.minValues) && contains(otherBox.maxValues);
    }

    public double getRange(final int dimension) {
        return maxValues[dimension] - minValues[dimension];
    }

    @Override
    public String toString() {
        return String.format("BoundingBox(%s, %s)", Arrays.toString(minValues), Arrays.toString(maxValues));
    }

    /**
     * Two bounding boxes are considered equal if they have the same dimensions and
     * all their min values and max values are the same. Values are compared
     * exactly, so two boxes whose corners are merely close are not equal.
     *
     * @param other An object to test for equality
     * @return true if other is a bounding box with the same min and max values
     */
    @Override
    public boolean equals(Object other) {
        if (!(other instanceof BoundingBox)) {
            return false;
        }

        BoundingBox otherBox = (BoundingBox) other;
        return Arrays.equals(minValues, otherBox.minValues) && Arrays.equals(maxValues, otherBox.maxValues);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(minValues) + Arrays.hashCode(maxValues);
    }
}

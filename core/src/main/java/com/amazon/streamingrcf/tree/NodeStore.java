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

import com.amazon.streamingrcf.store.IndexIntervalManager;

/**
 * Column-oriented storage for the nodes of one {@link RandomCutTree}. Leaves
 * and internal nodes share one index space; a node is a leaf when its cut
 * dimension is {@link #LEAF}. A leaf's bounding box is its point, so both box
 * corners of a leaf reference the same array.
 *
 * The store grows by doubling when it runs out of slots, and released slots are
 * recycled through an {@link IndexIntervalManager}.
 */
public class NodeStore {

    public static final int NULL = -1;

    public static final int LEAF = -1;

    public static final int DEFAULT_INITIAL_CAPACITY = 16;

    private int[] parentIndex;
    private int[] leftIndex;
    private int[] rightIndex;
    private int[] cutDimension;
    private double[] cutValue;
    private int[] mass;
    private double[][] minValues;
    private double[][] maxValues;
    private double[] rangeSum;
    private final IndexIntervalManager freeIndexManager;
    private int nodesInUse;

    public NodeStore(int initialCapacity) {
        checkArgument(initialCapacity > 0, "capacity must be positive");
        freeIndexManager = new IndexIntervalManager(initialCapacity);
        parentIndex = new int[initialCapacity];
        leftIndex = new int[initialCapacity];
        rightIndex = new int[initialCapacity];
        cutDimension = new int[initialCapacity];
        cutValue = new double[initialCapacity];
        mass = new int[initialCapacity];
        minValues = new double[initialCapacity][];
        maxValues = new double[initialCapacity][];
        rangeSum = new double[initialCapacity];
        Arrays.fill(parentIndex, NULL);
        Arrays.fill(leftIndex, NULL);
        Arrays.fill(rightIndex, NULL);
        Arrays.fill(cutDimension, LEAF);
    }

    private int takeIndex() {
        if (freeIndexManager.isEmpty()) {
            int oldCapacity = freeIndexManager.getCapacity();
            int newCapacity = 2 * oldCapacity;
            parentIndex = Arrays.copyOf(parentIndex, newCapacity);
            leftIndex = Arrays.copyOf(leftIndex, newCapacity);
            rightIndex = Arrays.copyOf(rightIndex, newCapacity);
            cutDimension = Arrays.copyOf(cutDimension, newCapacity);
            cutValue = Arrays.copyOf(cutValue, newCapacity);
            mass = Arrays.copyOf(mass, newCapacity);
            minValues = Arrays.copyOf(minValues, newCapacity);
            maxValues = Arrays.copyOf(maxValues, newCapacity);
            rangeSum = Arrays.copyOf(rangeSum, newCapacity);
            Arrays.fill(parentIndex, oldCapacity, newCapacity, NULL);
            Arrays.fill(leftIndex, oldCapacity, newCapacity, NULL);
            Arrays.fill(rightIndex, oldCapacity, newCapacity, NULL);
            Arrays.fill(cutDimension, oldCapacity, newCapacity, LEAF);
            freeIndexManager.extendCapacity(newCapacity);
        }
        ++nodesInUse;
        return freeIndexManager.takeIndex();
    }

    /**
     * Stores a new leaf with mass 1. The store keeps a reference to the array, so
     * callers pass a private copy.
     *
     * @param point the leaf point
     * @return the index of the leaf
     */
    public int addLeaf(double[] point) {
        return addLeaf(point, 1);
    }

    /**
     * Stores a new leaf holding {@code leafMass} copies of the point.
     *
     * @return the index of the leaf
     */
    public int addLeaf(double[] point, int leafMass) {
        checkArgument(leafMass > 0, "leaf mass must be positive");
        int index = takeIndex();
        cutDimension[index] = LEAF;
        mass[index] = leafMass;
        minValues[index] = maxValues[index] = point;
        rangeSum[index] = 0;
        return index;
    }

    /**
     * Stores a new internal node and points both children at it.
     *
     * @return the index of the new node
     */
    public int addNode(int parent, int left, int right, int dimension, double value, BoundingBox box, int nodeMass) {
        checkArgument(dimension >= 0, "incorrect cut dimension");
        int index = takeIndex();
        parentIndex[index] = parent;
        leftIndex[index] = left;
        rightIndex[index] = right;
        cutDimension[index] = dimension;
        cutValue[index] = value;
        mass[index] = nodeMass;
        minValues[index] = box.getMinValues();
        maxValues[index] = box.getMaxValues();
        rangeSum[index] = box.getRangeSum();
        parentIndex[left] = index;
        parentIndex[right] = index;
        return index;
    }

    public void releaseNode(int index) {
        checkState(minValues[index] != null, "releasing a free node");
        parentIndex[index] = NULL;
        leftIndex[index] = NULL;
        rightIndex[index] = NULL;
        cutDimension[index] = LEAF;
        mass[index] = 0;
        minValues[index] = maxValues[index] = null;
        --nodesInUse;
        freeIndexManager.releaseIndex(index);
    }

    public boolean isLeaf(int index) {
        return cutDimension[index] == LEAF;
    }

    public int getParent(int index) {
        return parentIndex[index];
    }

    public void setParent(int index, int parent) {
        parentIndex[index] = parent;
    }

    public int getLeftIndex(int index) {
        return leftIndex[index];
    }

    public int getRightIndex(int index) {
        return rightIndex[index];
    }

    public int getSibling(int parent, int child) {
        checkArgument(leftIndex[parent] == child || rightIndex[parent] == child, "not a child of the node");
        return leftIndex[parent] == child ? rightIndex[parent] : leftIndex[parent];
    }

    public void replaceChild(int parent, int oldChild, int newChild) {
        if (leftIndex[parent] == oldChild) {
            leftIndex[parent] = newChild;
        } else {
            checkArgument(rightIndex[parent] == oldChild, "not a child of the node");
            rightIndex[parent] = newChild;
        }
        parentIndex[newChild] = parent;
    }

    public int getCutDimension(int index) {
        return cutDimension[index];
    }

    public double getCutValue(int index) {
        return cutValue[index];
    }

    public int getMass(int index) {
        return mass[index];
    }

    public void incrementMass(int index) {
        ++mass[index];
    }

    public void decrementMass(int index) {
        --mass[index];
    }

    public double[] getLeafPoint(int index) {
        checkArgument(isLeaf(index), "not a leaf");
        return minValues[index];
    }

    /**
     * @return a box view over the stored corners; callers must not mutate it
     */
    public BoundingBox getBoundingBox(int index) {
        if (isLeaf(index)) {
            return new BoundingBox(minValues[index]);
        }
        return new BoundingBox(minValues[index], maxValues[index], rangeSum[index]);
    }

    /**
     * Grows the box of an internal node to contain the point.
     */
    public void extendBox(int index, double[] point) {
        checkArgument(!isLeaf(index), "leaf boxes are fixed");
        double sum = 0;
        for (int i = 0; i < point.length; i++) {
            minValues[index][i] = Math.min(minValues[index][i], point[i]);
            maxValues[index][i] = Math.max(maxValues[index][i], point[i]);
            sum += maxValues[index][i] - minValues[index][i];
        }
        rangeSum[index] = sum;
    }

    /**
     * Recomputes the box of an internal node as the union of its children's boxes.
     */
    public void recomputeBox(int index) {
        checkArgument(!isLeaf(index), "leaf boxes are fixed");
        int left = leftIndex[index];
        int right = rightIndex[index];
        double sum = 0;
        for (int i = 0; i < minValues[index].length; i++) {
            minValues[index][i] = Math.min(minValues[left][i], minValues[right][i]);
            maxValues[index][i] = Math.max(maxValues[left][i], maxValues[right][i]);
            sum += maxValues[index][i] - minValues[index][i];
        }
        rangeSum[index] = sum;
    }

    /**
     * @return the number of nodes, leaves included, currently stored
     */
    public int size() {
        return nodesInUse;
    }

    public int getCapacity() {
        return freeIndexManager.getCapacity();
    }
}

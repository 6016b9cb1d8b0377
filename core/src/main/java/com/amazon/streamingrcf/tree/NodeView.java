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

import static com.amazon.streamingrcf.CommonUtils.checkState;

import java.util.Arrays;

/**
 * A cursor over a {@link NodeStore}. The view points at one node at a time and
 * is re-targeted with {@link #setCurrentNode(int)} as a traversal moves up the
 * tree, so a single instance serves a whole traversal.
 */
public class NodeView implements INodeView {

    private final NodeStore nodeStore;
    private int currentNodeOffset;

    public NodeView(NodeStore nodeStore, int root) {
        this.nodeStore = nodeStore;
        this.currentNodeOffset = root;
    }

    public void setCurrentNode(int newNode) {
        currentNodeOffset = newNode;
    }

    public int getCurrentNode() {
        return currentNodeOffset;
    }

    @Override
    public boolean isLeaf() {
        return nodeStore.isLeaf(currentNodeOffset);
    }

    @Override
    public int getMass() {
        return nodeStore.getMass(currentNodeOffset);
    }

    @Override
    public BoundingBox getBoundingBox() {
        return nodeStore.getBoundingBox(currentNodeOffset);
    }

    @Override
    public double probabilityOfSeparation(double[] point) {
        return nodeStore.getBoundingBox(currentNodeOffset).probabilityOfCut(point);
    }

    @Override
    public double[] getLeafPoint() {
        checkState(isLeaf(), "not a leaf");
        double[] point = nodeStore.getLeafPoint(currentNodeOffset);
        return Arrays.copyOf(point, point.length);
    }

    @Override
    public int getCutDimension() {
        return nodeStore.getCutDimension(currentNodeOffset);
    }

    @Override
    public double getCutValue() {
        return nodeStore.getCutValue(currentNodeOffset);
    }
}

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
 * A read-only view of a single node, handed to visitors during a traversal.
 */
public interface INodeView {

    boolean isLeaf();

    /**
     * @return the number of points in the subtree rooted at this node, counting
     *         duplicates
     */
    int getMass();

    BoundingBox getBoundingBox();

    /**
     * @param point a query point
     * @return the probability that a random cut over the union of this node's box
     *         and the point separates the point from the box
     */
    double probabilityOfSeparation(double[] point);

    /**
     * @return the point stored at a leaf; throws for internal nodes
     */
    double[] getLeafPoint();

    int getCutDimension();

    double getCutValue();
}

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

package com.amazon.streamingrcf.state.tree;

import static com.amazon.streamingrcf.state.Version.V1_0;

import java.io.Serializable;

import lombok.Data;

/**
 * The nodes of a tree, numbered in pre-order so that the root is node 0 and
 * every child has a larger number than its parent. Leaves have cut dimension
 * -1, no children, and a box whose two corners are the leaf point. The mass of
 * a leaf is one more than the number of duplicates it holds. Box corners are
 * flattened: the corner of node i occupies entries
 * {@code [i * dimensions, (i + 1) * dimensions)}.
 * <p>
 * When only the random seed is present, the tree is rebuilt from its sampler.
 */
@Data
public class RandomCutTreeState implements Serializable {

    private static final long serialVersionUID = 1L;

    private String version = V1_0;

    private int dimensions;

    private long randomSeed;

    private int nodeCount;

    private int[] leftIndex;

    private int[] rightIndex;

    private int[] cutDimension;

    private double[] cutValue;

    private int[] mass;

    private double[] minValues;

    private double[] maxValues;
}

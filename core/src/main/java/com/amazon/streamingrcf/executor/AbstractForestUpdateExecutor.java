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

package com.amazon.streamingrcf.executor;

import java.util.List;

import lombok.Getter;

import com.amazon.streamingrcf.ComponentList;

/**
 * Submits points to every sampler and tree pair of a forest. Points reaching an
 * executor have already been validated; a point is offered to all pairs or to
 * none.
 */
@Getter
public abstract class AbstractForestUpdateExecutor {

    protected final ComponentList components;

    protected AbstractForestUpdateExecutor(ComponentList components) {
        this.components = components;
    }

    /**
     * Update the forest with the given point. The point is submitted to each
     * sampler in the forest. If the sampler accepts the point, the point is
     * inserted into the corresponding tree.
     *
     * @param point The point used to update the forest.
     * @return the per-tree results, indexed by tree
     */
    public abstract List<UpdateResult> update(double[] point);

    /**
     * Builds every tree from its own subsample of the training points.
     *
     * @param points the training set
     */
    public abstract void train(List<double[]> points);

    public void startNewEpoch() {
        components.forEach(SamplerPlusTree::startNewEpoch);
    }
}

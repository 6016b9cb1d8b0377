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

import com.amazon.streamingrcf.ComponentList;
import com.amazon.streamingrcf.VisitorFactory;

/**
 * Runs read-only queries over every tree of a forest. Implementations may
 * visit trees in any order or in parallel, but always return per-tree results
 * in tree-index order so that callers reduce them deterministically.
 */
public abstract class AbstractForestTraversalExecutor {

    protected final ComponentList components;

    protected AbstractForestTraversalExecutor(ComponentList components) {
        this.components = components;
    }

    /**
     * @param point the query point
     * @return the score of the point in every tree, indexed by tree
     */
    public abstract double[] scoreForest(double[] point);

    /**
     * Visit each of the trees in the forest and return the visitor results.
     *
     * @param point          The point that defines the traversal path.
     * @param visitorFactory A factory method which is invoked for each tree to
     *                       construct a visitor.
     * @param <R>            The visitor result type.
     * @return the visitor results, indexed by tree
     */
    public abstract <R> List<R> traverseForest(double[] point, VisitorFactory<R> visitorFactory);
}

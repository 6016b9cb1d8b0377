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

import java.util.ArrayList;
import java.util.List;

import com.amazon.streamingrcf.ComponentList;
import com.amazon.streamingrcf.VisitorFactory;

/**
 * Traverses the trees one after another on the calling thread.
 */
public class SequentialForestTraversalExecutor extends AbstractForestTraversalExecutor {

    public SequentialForestTraversalExecutor(ComponentList components) {
        super(components);
    }

    @Override
    public double[] scoreForest(double[] point) {
        double[] scores = new double[components.size()];
        for (int i = 0; i < scores.length; i++) {
            scores[i] = components.get(i).score(point);
        }
        return scores;
    }

    @Override
    public <R> List<R> traverseForest(double[] point, VisitorFactory<R> visitorFactory) {
        List<R> results = new ArrayList<>(components.size());
        for (SamplerPlusTree component : components) {
            results.add(component.traverse(point, visitorFactory));
        }
        return results;
    }
}

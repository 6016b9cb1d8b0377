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
import java.util.concurrent.Callable;
import java.util.concurrent.ForkJoinPool;
import java.util.stream.Collectors;

import com.amazon.streamingrcf.ComponentList;
import com.amazon.streamingrcf.VisitorFactory;

/**
 * An implementation of forest traversal methods that uses a private thread pool
 * to visit trees in parallel. Ordered streams keep the results in tree-index
 * order whichever worker finishes first.
 */
public class ParallelForestTraversalExecutor extends AbstractForestTraversalExecutor {

    private ForkJoinPool forkJoinPool;
    private final int threadPoolSize;

    public ParallelForestTraversalExecutor(ComponentList components, int threadPoolSize) {
        super(components);
        this.threadPoolSize = threadPoolSize;
        forkJoinPool = new ForkJoinPool(threadPoolSize);
    }

    @Override
    public double[] scoreForest(double[] point) {
        return submitAndJoin(() -> components.parallelStream().mapToDouble(c -> c.score(point)).toArray());
    }

    @Override
    public <R> List<R> traverseForest(double[] point, VisitorFactory<R> visitorFactory) {
        return submitAndJoin(() -> components.parallelStream().map(c -> c.traverse(point, visitorFactory))
                .collect(Collectors.toList()));
    }

    private <T> T submitAndJoin(Callable<T> callable) {
        if (forkJoinPool == null) {
            forkJoinPool = new ForkJoinPool(threadPoolSize);
        }
        return forkJoinPool.submit(callable).join();
    }
}

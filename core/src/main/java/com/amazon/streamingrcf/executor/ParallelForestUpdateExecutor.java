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

/**
 * An implementation of forest updates that uses a private thread pool to update
 * and train the pairs in parallel. Each pair owns its random sources, so the
 * resulting trees do not depend on how the work is scheduled.
 */
public class ParallelForestUpdateExecutor extends AbstractForestUpdateExecutor {

    private ForkJoinPool forkJoinPool;
    private final int threadPoolSize;

    public ParallelForestUpdateExecutor(ComponentList components, int threadPoolSize) {
        super(components);
        this.threadPoolSize = threadPoolSize;
        forkJoinPool = new ForkJoinPool(threadPoolSize);
    }

    @Override
    public List<UpdateResult> update(double[] point) {
        return submitAndJoin(
                () -> components.parallelStream().map(c -> c.update(point)).collect(Collectors.toList()));
    }

    @Override
    public void train(List<double[]> points) {
        submitAndJoin(() -> {
            components.parallelStream().forEach(c -> c.train(points));
            return null;
        });
    }

    private <T> T submitAndJoin(Callable<T> callable) {
        if (forkJoinPool == null) {
            forkJoinPool = new ForkJoinPool(threadPoolSize);
        }
        return forkJoinPool.submit(callable).join();
    }
}

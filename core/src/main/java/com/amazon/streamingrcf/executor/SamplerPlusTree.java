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

import static com.amazon.streamingrcf.CommonUtils.checkArgument;
import static com.amazon.streamingrcf.CommonUtils.checkNotNull;
import static com.amazon.streamingrcf.CommonUtils.checkState;

import java.util.List;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

import lombok.Getter;

import com.amazon.streamingrcf.VisitorFactory;
import com.amazon.streamingrcf.sampler.ReservoirSampler;
import com.amazon.streamingrcf.sampler.SampleUpdate;
import com.amazon.streamingrcf.tree.RandomCutTree;

/**
 * A sampler and the tree built over its sample. The sampler is in the driver's
 * seat: it accepts or rejects each point independently of the tree, and the
 * tree follows so that it always holds exactly the sampled multiset.
 * <p>
 * Mutations hold the pair's write lock; scores and traversals share its read
 * lock.
 */
public class SamplerPlusTree {

    @Getter
    private final RandomCutTree tree;
    @Getter
    private final ReservoirSampler sampler;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public SamplerPlusTree(ReservoirSampler sampler, RandomCutTree tree) {
        checkNotNull(sampler, "sampler must not be null");
        checkNotNull(tree, "tree must not be null");
        checkArgument(sampler.getDimensions() == tree.getDimensions(), "sampler and tree dimensions differ");
        this.sampler = sampler;
        this.tree = tree;
    }

    /**
     * Offers the point to the sampler. If admitted, the evicted point (if any) is
     * deleted from the tree and then the new point is inserted.
     *
     * @param point the observed point
     * @return the points added to and deleted from the tree
     */
    public UpdateResult update(double[] point) {
        return write(() -> {
            SampleUpdate sampleUpdate = sampler.observe(point);
            if (!sampleUpdate.isAdmitted()) {
                return UpdateResult.noop();
            }
            double[] deleted = null;
            if (sampleUpdate.getEvicted().isPresent()) {
                deleted = sampleUpdate.getEvicted().get();
                tree.delete(deleted);
            }
            tree.insert(sampleUpdate.getAdmittedPoint());
            return UpdateResult.builder().addedPoint(sampleUpdate.getAdmittedPoint()).deletedPoint(deleted).build();
        });
    }

    /**
     * Draws this pair's training sample from the points and builds the tree from
     * it by repeated insertion. The pair must be empty.
     *
     * @param points the training set
     */
    public void train(List<double[]> points) {
        write(() -> {
            checkState(tree.isEmpty(), "tree is not empty");
            for (double[] point : sampler.sampleFrom(points)) {
                tree.insert(point);
            }
            return null;
        });
    }

    public double score(double[] point) {
        return read(() -> tree.score(point));
    }

    public <R> R traverse(double[] point, VisitorFactory<R> visitorFactory) {
        return read(() -> tree.traverse(point, visitorFactory));
    }

    public void startNewEpoch() {
        write(() -> {
            sampler.startNewEpoch();
            return null;
        });
    }

    public int getSampleSize() {
        return read(sampler::size);
    }

    public boolean isFull() {
        return read(sampler::isFull);
    }

    /**
     * Runs an action, such as taking a snapshot of the pair, under the read lock.
     */
    public <T> T read(Supplier<T> action) {
        lock.readLock().lock();
        try {
            return action.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    private <T> T write(Supplier<T> action) {
        lock.writeLock().lock();
        try {
            return action.get();
        } finally {
            lock.writeLock().unlock();
        }
    }
}

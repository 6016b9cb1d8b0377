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

package com.amazon.streamingrcf;

import static com.amazon.streamingrcf.CommonUtils.checkArgument;
import static com.amazon.streamingrcf.CommonUtils.checkConfiguration;
import static com.amazon.streamingrcf.CommonUtils.checkNotNull;
import static com.amazon.streamingrcf.CommonUtils.checkPoint;
import static com.amazon.streamingrcf.CommonUtils.checkState;

import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.amazon.streamingrcf.executor.AbstractForestTraversalExecutor;
import com.amazon.streamingrcf.executor.AbstractForestUpdateExecutor;
import com.amazon.streamingrcf.executor.ParallelForestTraversalExecutor;
import com.amazon.streamingrcf.executor.ParallelForestUpdateExecutor;
import com.amazon.streamingrcf.executor.SamplerPlusTree;
import com.amazon.streamingrcf.executor.SequentialForestTraversalExecutor;
import com.amazon.streamingrcf.executor.SequentialForestUpdateExecutor;
import com.amazon.streamingrcf.executor.UpdateResult;
import com.amazon.streamingrcf.returntypes.ScoreResult;
import com.amazon.streamingrcf.sampler.ReservoirSampler;
import com.amazon.streamingrcf.tree.RandomCutTree;

/**
 * The RandomCutForest class is the interface to the algorithms in this package,
 * and includes methods for anomaly detection and for training a model on a
 * batch of points. A forest is an ensemble of independent sampler and tree
 * pairs; each sampler keeps a uniform sample of the points seen so far and its
 * tree is a random cut tree over that sample.
 * <p>
 * A forest is either trained in one pass with {@link #train(List)} or built up
 * point by point with {@link #observe(double[])} and {@link #update(double[])}.
 * The score of a point is the mean, over trees in tree-index order, of its
 * expected displacement in each tree. Larger scores indicate points that sit in
 * sparser regions relative to the sample.
 * <p>
 * Every point is validated before any state changes: a point with the wrong
 * number of coordinates or a non-finite coordinate is rejected as a whole and
 * no sampler sees it. Mutating calls take the forest's write lock and reads
 * share its read lock, so a forest can be used from several threads.
 */
public class RandomCutForest {

    private static final Logger log = LogManager.getLogger(RandomCutForest.class);

    /**
     * Default sample size. This is the number of points retained by the stream
     * sampler.
     */
    public static final int DEFAULT_SAMPLE_SIZE = ReservoirSampler.DEFAULT_SAMPLE_SIZE;

    /**
     * Default fraction used to compute the amount of points required by stream
     * samplers before results are returned.
     */
    public static final double DEFAULT_OUTPUT_AFTER_FRACTION = 0.25;

    /**
     * Default number of trees to use in the forest.
     */
    public static final int DEFAULT_NUMBER_OF_TREES = 50;

    /**
     * Parallel execution is disabled by default.
     */
    public static final boolean DEFAULT_PARALLEL_EXECUTION_ENABLED = false;

    /**
     * Number of dimensions in each point.
     */
    private final int dimensions;

    /**
     * Number of points retained by each sampler.
     */
    private final int sampleSize;

    /**
     * Number of points that every sampler must hold before
     * {@link #isOutputReady()} returns true.
     */
    private final int outputAfter;

    /**
     * Number of trees in the forest.
     */
    private final int numberOfTrees;

    /**
     * Enable parallel execution.
     */
    private final boolean parallelExecutionEnabled;

    /**
     * Number of threads to use in the thread pool if parallel execution is
     * enabled.
     */
    private final int threadPoolSize;

    private final ComponentList components;

    private final AbstractForestTraversalExecutor traversalExecutor;

    private final AbstractForestUpdateExecutor updateExecutor;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * The number of points submitted through {@link #observe} or {@link #update}.
     */
    private long totalUpdates;

    protected RandomCutForest(Builder<?> builder) {
        this(builder, null, 0L);
    }

    /**
     * Creates a forest around existing components, as done when a forest is
     * restored from its state. When {@code components} is null, fresh empty pairs
     * are created with seeds derived from the builder's random seed.
     *
     * @param builder      the forest configuration
     * @param components   the sampler and tree pairs, in tree-index order, or null
     * @param totalUpdates the number of streaming updates already applied
     */
    public RandomCutForest(Builder<?> builder, ComponentList components, long totalUpdates) {
        checkConfiguration(builder.numberOfTrees > 0, "numberOfTrees must be greater than 0");
        checkConfiguration(builder.sampleSize > 0, "sampleSize must be greater than 0");
        checkConfiguration(builder.dimensions > 0, "dimensions must be greater than 0");
        builder.outputAfter.ifPresent(n -> {
            checkConfiguration(n > 0, "outputAfter must be greater than 0");
            checkConfiguration(n <= builder.sampleSize, "outputAfter must be smaller or equal to sampleSize");
        });
        builder.threadPoolSize.ifPresent(n -> checkConfiguration(
                (n > 0) || ((n == 0) && !builder.parallelExecutionEnabled),
                "threadPoolSize must be greater/equal than 0. To disable thread pool, set parallel execution to 'false'."));
        checkArgument(totalUpdates >= 0, "totalUpdates cannot be negative");

        dimensions = builder.dimensions;
        sampleSize = builder.sampleSize;
        numberOfTrees = builder.numberOfTrees;
        outputAfter = builder.outputAfter.orElse(Math.max(1, (int) (sampleSize * DEFAULT_OUTPUT_AFTER_FRACTION)));
        parallelExecutionEnabled = builder.parallelExecutionEnabled;
        if (parallelExecutionEnabled) {
            threadPoolSize = builder.threadPoolSize
                    .orElse(Math.max(1, Runtime.getRuntime().availableProcessors() - 1));
        } else {
            threadPoolSize = 0;
        }

        if (components == null) {
            Random random = builder.randomSeed.map(Random::new).orElseGet(Random::new);
            this.components = new ComponentList(numberOfTrees);
            for (int i = 0; i < numberOfTrees; i++) {
                ReservoirSampler sampler = ReservoirSampler.builder().capacity(sampleSize).dimension(dimensions)
                        .randomSeed(random.nextLong()).build();
                RandomCutTree tree = RandomCutTree.builder().dimension(dimensions).randomSeed(random.nextLong())
                        .build();
                this.components.add(new SamplerPlusTree(sampler, tree));
            }
        } else {
            checkArgument(components.size() == numberOfTrees, "number of components must equal numberOfTrees");
            for (SamplerPlusTree component : components) {
                checkArgument(component.getTree().getDimensions() == dimensions, "component dimension mismatch");
                checkArgument(component.getSampler().getCapacity() == sampleSize, "component sample size mismatch");
            }
            this.components = components;
        }
        this.totalUpdates = totalUpdates;

        if (parallelExecutionEnabled) {
            traversalExecutor = new ParallelForestTraversalExecutor(this.components, threadPoolSize);
            updateExecutor = new ParallelForestUpdateExecutor(this.components, threadPoolSize);
        } else {
            traversalExecutor = new SequentialForestTraversalExecutor(this.components);
            updateExecutor = new SequentialForestUpdateExecutor(this.components);
        }
    }

    /**
     * @return a new RandomCutForest builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Create a new RandomCutForest with optional arguments set to default values.
     *
     * @param dimensions The number of dimension in the input data.
     * @param randomSeed The random seed to use to create the forest random number
     *                   generator
     * @return a new RandomCutForest with optional arguments set to default values.
     */
    public static RandomCutForest defaultForest(int dimensions, long randomSeed) {
        return builder().dimensions(dimensions).randomSeed(randomSeed).build();
    }

    /**
     * Creates a forest and trains it on a batch of points.
     *
     * @param points            the training set
     * @param numberOfTrees     the number of trees
     * @param sampleSize        the number of points each tree is built from
     * @param dimensions        the number of coordinates of every point
     * @return the trained forest
     * @throws ConfigurationException if a hyperparameter is not positive or the
     *                                training set is empty
     */
    public static RandomCutForest train(List<double[]> points, int numberOfTrees, int sampleSize, int dimensions) {
        RandomCutForest forest = builder().numberOfTrees(numberOfTrees).sampleSize(sampleSize).dimensions(dimensions)
                .build();
        forest.train(points);
        return forest;
    }

    /**
     * Builds every tree from its own uniform subsample, drawn without
     * replacement, of {@code min(sampleSize, points.size())} training points.
     * Each sampler is left as if it had observed every training point, so
     * streaming updates can follow. The forest must not hold any points yet.
     *
     * @param points the training set
     * @throws ConfigurationException if the training set is null or empty
     */
    public void train(List<double[]> points) {
        checkConfiguration(points != null && !points.isEmpty(), "training set must not be empty");
        for (double[] point : points) {
            validatePoint(point);
        }
        lock.writeLock().lock();
        try {
            checkState(totalUpdates == 0 && components.stream().allMatch(c -> c.getSampleSize() == 0),
                    "forest already holds points");
            updateExecutor.train(points);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("trained {} trees with sample size {} on {} points of dimension {}", numberOfTrees, sampleSize,
                points.size(), dimensions);
    }

    /**
     * Scores a point against the current trees and then offers it to every
     * sampler. The score does not include the point's own admission.
     *
     * @param point the observed point
     * @return the pre-update score and update summary
     * @throws DimensionMismatchException if the point has the wrong length
     * @throws NonFiniteValueException    if a coordinate is NaN or infinite
     */
    public ScoreResult observe(double[] point) {
        validatePoint(point);
        lock.writeLock().lock();
        try {
            double score = mean(traversalExecutor.scoreForest(point));
            int treesUpdated = applyUpdate(point);
            return ScoreResult.builder().score(score).sequenceIndex(totalUpdates).treesUpdated(treesUpdated).build();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Offers a point to every sampler without scoring it.
     *
     * @param point the observed point
     */
    public void update(double[] point) {
        validatePoint(point);
        lock.writeLock().lock();
        try {
            applyUpdate(point);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private int applyUpdate(double[] point) {
        List<UpdateResult> results = updateExecutor.update(point);
        ++totalUpdates;
        return (int) results.stream().filter(UpdateResult::isStateChange).count();
    }

    /**
     * @param point the query point
     * @return the mean displacement score of the point over all trees
     */
    public double score(double[] point) {
        validatePoint(point);
        lock.readLock().lock();
        try {
            return mean(traversalExecutor.scoreForest(point));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Scores a batch of points against one consistent state of the forest. All
     * points are validated before any is scored.
     *
     * @param points the query points
     * @return the scores, in the order of the points
     */
    public double[] score(List<double[]> points) {
        checkNotNull(points, "points must not be null");
        for (double[] point : points) {
            validatePoint(point);
        }
        lock.readLock().lock();
        try {
            double[] scores = new double[points.size()];
            for (int i = 0; i < scores.length; i++) {
                scores[i] = mean(traversalExecutor.scoreForest(points.get(i)));
            }
            return scores;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Runs a visitor over every tree.
     *
     * @return the visitor results, indexed by tree
     */
    public <R> List<R> traverseForest(double[] point, VisitorFactory<R> visitorFactory) {
        validatePoint(point);
        lock.readLock().lock();
        try {
            return traversalExecutor.traverseForest(point, visitorFactory);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Restarts the count of observed points in every sampler, so that the
     * following points form a new sampling epoch. Trees keep their points until
     * the samplers replace them.
     */
    public void startNewEpoch() {
        lock.writeLock().lock();
        try {
            updateExecutor.startNewEpoch();
        } finally {
            lock.writeLock().unlock();
        }
        log.info("started a new sampling epoch after {} updates", totalUpdates);
    }

    // fixed order, so parallel and sequential runs agree bit for bit
    private double mean(double[] treeScores) {
        double sum = 0.0;
        for (double treeScore : treeScores) {
            sum += treeScore;
        }
        return sum / treeScores.length;
    }

    private void validatePoint(double[] point) {
        try {
            checkPoint(point, dimensions);
        } catch (IllegalArgumentException | NullPointerException e) {
            log.debug("rejected point: {}", e.getMessage());
            throw e;
        }
    }

    /**
     * @return true when every sampler holds at least {@code outputAfter} points.
     */
    public boolean isOutputReady() {
        return components.stream().allMatch(c -> c.getSampleSize() >= outputAfter);
    }

    public boolean samplersFull() {
        return components.stream().allMatch(SamplerPlusTree::isFull);
    }

    public long getTotalUpdates() {
        lock.readLock().lock();
        try {
            return totalUpdates;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int getDimensions() {
        return dimensions;
    }

    public int getSampleSize() {
        return sampleSize;
    }

    public int getOutputAfter() {
        return outputAfter;
    }

    public int getNumberOfTrees() {
        return numberOfTrees;
    }

    public boolean isParallelExecutionEnabled() {
        return parallelExecutionEnabled;
    }

    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    /**
     * Applies an action to the forest while holding its read lock, so the action
     * sees no concurrent updates. Used to take consistent snapshots.
     */
    public <T> T withReadLock(Function<ComponentList, T> action) {
        lock.readLock().lock();
        try {
            return action.apply(components);
        } finally {
            lock.readLock().unlock();
        }
    }

    public static class Builder<T extends Builder<T>> {

        // We use Optional types for optional primitive fields when it doesn't make
        // sense to use a constant default.

        private int dimensions;
        private int sampleSize = DEFAULT_SAMPLE_SIZE;
        private Optional<Integer> outputAfter = Optional.empty();
        private int numberOfTrees = DEFAULT_NUMBER_OF_TREES;
        private Optional<Long> randomSeed = Optional.empty();
        private boolean parallelExecutionEnabled = DEFAULT_PARALLEL_EXECUTION_ENABLED;
        private Optional<Integer> threadPoolSize = Optional.empty();

        public T dimensions(int dimensions) {
            this.dimensions = dimensions;
            return (T) this;
        }

        public T sampleSize(int sampleSize) {
            this.sampleSize = sampleSize;
            return (T) this;
        }

        public T outputAfter(int outputAfter) {
            this.outputAfter = Optional.of(outputAfter);
            return (T) this;
        }

        public T numberOfTrees(int numberOfTrees) {
            this.numberOfTrees = numberOfTrees;
            return (T) this;
        }

        public T randomSeed(long randomSeed) {
            this.randomSeed = Optional.of(randomSeed);
            return (T) this;
        }

        public T parallelExecutionEnabled(boolean parallelExecutionEnabled) {
            this.parallelExecutionEnabled = parallelExecutionEnabled;
            return (T) this;
        }

        public T threadPoolSize(int threadPoolSize) {
            this.threadPoolSize = Optional.of(threadPoolSize);
            return (T) this;
        }

        public RandomCutForest build() {
            return new RandomCutForest(this);
        }
    }
}

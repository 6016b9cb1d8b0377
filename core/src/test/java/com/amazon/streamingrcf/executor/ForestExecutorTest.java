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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Random;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.ArgumentsProvider;
import org.junit.jupiter.params.provider.ArgumentsSource;

import com.amazon.streamingrcf.ComponentList;
import com.amazon.streamingrcf.sampler.ReservoirSampler;
import com.amazon.streamingrcf.tree.RandomCutTree;

public class ForestExecutorTest {

    private static final int numberOfTrees = 10;
    private static final int threadPoolSize = 2;

    private static class TestExecutorProvider implements ArgumentsProvider {
        @Override
        public Stream<? extends Arguments> provideArguments(ExtensionContext context) {
            ComponentList sequentialComponents = new ComponentList();
            ComponentList parallelComponents = new ComponentList();
            for (int i = 0; i < numberOfTrees; i++) {
                sequentialComponents.add(mock(SamplerPlusTree.class));
                parallelComponents.add(mock(SamplerPlusTree.class));
            }
            return Stream.of(
                    Arguments.of(new SequentialForestTraversalExecutor(sequentialComponents),
                            new SequentialForestUpdateExecutor(sequentialComponents)),
                    Arguments.of(new ParallelForestTraversalExecutor(parallelComponents, threadPoolSize),
                            new ParallelForestUpdateExecutor(parallelComponents, threadPoolSize)));
        }
    }

    @ParameterizedTest
    @ArgumentsSource(TestExecutorProvider.class)
    public void testScoreForestKeepsTreeOrder(AbstractForestTraversalExecutor traversalExecutor,
            AbstractForestUpdateExecutor updateExecutor) {
        double[] point = new double[] { 1.0 };
        ComponentList components = traversalExecutor.components;
        for (int i = 0; i < numberOfTrees; i++) {
            when(components.get(i).score(point)).thenReturn((double) i);
        }
        double[] scores = traversalExecutor.scoreForest(point);
        for (int i = 0; i < numberOfTrees; i++) {
            assertEquals(i, scores[i]);
        }
    }

    @ParameterizedTest
    @ArgumentsSource(TestExecutorProvider.class)
    public void testTraverseForestKeepsTreeOrder(AbstractForestTraversalExecutor traversalExecutor,
            AbstractForestUpdateExecutor updateExecutor) {
        double[] point = new double[] { 1.0 };
        ComponentList components = traversalExecutor.components;
        for (int i = 0; i < numberOfTrees; i++) {
            when(components.get(i).traverse(any(), any())).thenReturn(i);
        }
        List<Object> results = traversalExecutor.traverseForest(point, (tree, x) -> null);
        assertEquals(numberOfTrees, results.size());
        for (int i = 0; i < numberOfTrees; i++) {
            assertEquals(i, results.get(i));
        }
    }

    @ParameterizedTest
    @ArgumentsSource(TestExecutorProvider.class)
    public void testUpdate(AbstractForestTraversalExecutor traversalExecutor,
            AbstractForestUpdateExecutor updateExecutor) {
        int addAndDelete = 4;
        int addOnly = 4;
        double[] point = new double[] { 1.0 };

        ComponentList components = updateExecutor.getComponents();
        for (int i = 0; i < numberOfTrees; i++) {
            UpdateResult result;
            if (i < addAndDelete) {
                result = UpdateResult.builder().addedPoint(point).deletedPoint(new double[] { i }).build();
            } else if (i < addAndDelete + addOnly) {
                result = UpdateResult.builder().addedPoint(point).build();
            } else {
                result = UpdateResult.noop();
            }
            when(components.get(i).update(point)).thenReturn(result);
        }

        List<UpdateResult> results = updateExecutor.update(point);
        assertEquals(numberOfTrees, results.size());
        for (int i = 0; i < numberOfTrees; i++) {
            verify(components.get(i)).update(point);
            assertEquals(i < addAndDelete, results.get(i).getDeletedPoint().isPresent());
            assertEquals(i < addAndDelete + addOnly, results.get(i).isStateChange());
        }
    }

    @ParameterizedTest
    @ArgumentsSource(TestExecutorProvider.class)
    public void testTrainAndEpoch(AbstractForestTraversalExecutor traversalExecutor,
            AbstractForestUpdateExecutor updateExecutor) {
        List<double[]> points = List.of(new double[] { 1.0 });
        updateExecutor.train(points);
        updateExecutor.startNewEpoch();
        for (SamplerPlusTree component : updateExecutor.getComponents()) {
            verify(component).train(points);
            verify(component).startNewEpoch();
        }
    }

    @Test
    public void testParallelMatchesSequential() {
        ComponentList sequential = components(7L);
        ComponentList parallel = components(7L);
        SequentialForestUpdateExecutor sequentialUpdate = new SequentialForestUpdateExecutor(sequential);
        ParallelForestUpdateExecutor parallelUpdate = new ParallelForestUpdateExecutor(parallel, 3);
        SequentialForestTraversalExecutor sequentialTraversal = new SequentialForestTraversalExecutor(sequential);
        ParallelForestTraversalExecutor parallelTraversal = new ParallelForestTraversalExecutor(parallel, 3);

        Random data = new Random(1);
        for (int i = 0; i < 500; i++) {
            double[] point = new double[] { data.nextGaussian(), data.nextGaussian() };
            assertArrayEquals(sequentialTraversal.scoreForest(point), parallelTraversal.scoreForest(point));
            sequentialUpdate.update(point);
            parallelUpdate.update(point);
        }
        double[] query = new double[] { 4.0, -4.0 };
        assertArrayEquals(sequentialTraversal.scoreForest(query), parallelTraversal.scoreForest(query));
        assertTrue(sequentialTraversal.scoreForest(query)[0] > 0);
    }

    private static ComponentList components(long seed) {
        Random random = new Random(seed);
        ComponentList components = new ComponentList();
        for (int i = 0; i < numberOfTrees; i++) {
            ReservoirSampler sampler = ReservoirSampler.builder().capacity(32).dimension(2)
                    .randomSeed(random.nextLong()).build();
            RandomCutTree tree = RandomCutTree.builder().dimension(2).randomSeed(random.nextLong()).build();
            components.add(new SamplerPlusTree(sampler, tree));
        }
        return components;
    }
}

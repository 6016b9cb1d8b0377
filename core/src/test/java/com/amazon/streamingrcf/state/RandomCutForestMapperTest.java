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

package com.amazon.streamingrcf.state;

import static com.amazon.streamingrcf.TestUtils.toPoints;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.amazon.streamingrcf.RandomCutForest;
import com.amazon.streamingrcf.SerializationException;
import com.amazon.streamingrcf.executor.SamplerPlusTree;
import com.amazon.streamingrcf.state.tree.RandomCutTreeState;
import com.amazon.streamingrcf.testutils.NormalMixtureTestData;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

public class RandomCutForestMapperTest {

    private static final int dimensions = 3;
    private static final int sampleSize = 64;

    private RandomCutForest forest;
    private RandomCutForestMapper mapper;
    private List<double[]> heldOut;

    @BeforeEach
    public void setUp() {
        forest = RandomCutForest.builder().dimensions(dimensions).sampleSize(sampleSize).numberOfTrees(20)
                .randomSeed(99L).build();
        NormalMixtureTestData generator = new NormalMixtureTestData();
        for (double[] point : generator.generateTestData(500, dimensions, 1L)) {
            forest.update(point);
        }
        heldOut = toPoints(generator.generateTestData(100, dimensions, 2L));
        mapper = new RandomCutForestMapper();
    }

    private void assertForestEquals(RandomCutForest expected, RandomCutForest actual) {
        assertEquals(expected.getDimensions(), actual.getDimensions());
        assertEquals(expected.getSampleSize(), actual.getSampleSize());
        assertEquals(expected.getNumberOfTrees(), actual.getNumberOfTrees());
        assertEquals(expected.getOutputAfter(), actual.getOutputAfter());
        assertEquals(expected.getTotalUpdates(), actual.getTotalUpdates());
        assertEquals(expected.isParallelExecutionEnabled(), actual.isParallelExecutionEnabled());
        assertEquals(expected.getThreadPoolSize(), actual.getThreadPoolSize());
    }

    @Test
    public void testRoundTripScoresIdentically() {
        RandomCutForest restored = mapper.toModel(mapper.toState(forest));
        assertForestEquals(forest, restored);
        assertArrayEquals(forest.score(heldOut), restored.score(heldOut));

        // streaming continues identically as samplers and trees resume their seeds
        for (double[] point : new NormalMixtureTestData().generateTestData(200, dimensions, 3L)) {
            assertEquals(forest.observe(point).getScore(), restored.observe(point).getScore());
        }
        assertArrayEquals(forest.score(heldOut), restored.score(heldOut));
    }

    @ParameterizedTest
    @ValueSource(booleans = { true, false })
    public void testJsonRoundTrip(boolean parallel) throws JsonProcessingException {
        RandomCutForest source = forest;
        if (parallel) {
            source = RandomCutForest.builder().dimensions(dimensions).sampleSize(sampleSize).numberOfTrees(20)
                    .randomSeed(99L).parallelExecutionEnabled(true).threadPoolSize(2).build();
            source.train(heldOut);
        }
        ObjectMapper jsonMapper = new ObjectMapper();
        String json = jsonMapper.writeValueAsString(mapper.toState(source));
        RandomCutForestState state = jsonMapper.readValue(json, RandomCutForestState.class);
        RandomCutForest restored = mapper.toModel(state);

        assertForestEquals(source, restored);
        assertArrayEquals(source.score(heldOut), restored.score(heldOut));
    }

    @Test
    public void testRoundTripWithoutTreeState() {
        mapper.setSaveTreeStateEnabled(false);
        RandomCutForestState state = mapper.toState(forest);
        assertFalse(state.isSaveTreeStateEnabled());
        RandomCutForest restored = mapper.toModel(state);
        assertForestEquals(forest, restored);
        restored.withReadLock(components -> {
            for (SamplerPlusTree component : components) {
                assertEquals(component.getSampleSize(), component.getTree().getMass());
                component.getTree().validate();
            }
            return null;
        });
        assertTrue(restored.isOutputReady());
    }

    @Test
    public void testEmptyForest() {
        RandomCutForest empty = RandomCutForest.builder().dimensions(2).randomSeed(0L).build();
        RandomCutForest restored = mapper.toModel(mapper.toState(empty));
        assertEquals(0.0, restored.score(new double[] { 1, 1 }));
        restored.train(Collections.singletonList(new double[] { 1, 1 }));
    }

    @Test
    public void testMismatchedTreeIsRejected() {
        RandomCutForestState state = mapper.toState(forest);
        List<RandomCutTreeState> treeStates = new ArrayList<>(state.getTreeStates());
        Collections.swap(treeStates, 0, 1);
        state.setTreeStates(treeStates);
        assertThrows(SerializationException.class, () -> mapper.toModel(state));
    }

    @Test
    public void testTreeWithWrongCopyCountsIsRejected() {
        RandomCutForest small = RandomCutForest.builder().dimensions(1).sampleSize(8).numberOfTrees(1)
                .randomSeed(5L).build();
        small.update(new double[] { 1.0 });
        small.update(new double[] { 2.0 });
        small.update(new double[] { 2.0 });
        assertEquals(1, mapper.toModel(mapper.toState(small)).getNumberOfTrees());

        // the sample becomes [1, 1, 2] while the tree still holds {1: 1, 2: 2}
        RandomCutForestState state = mapper.toState(small);
        double[] sample = state.getSamplerStates().get(0).getSample();
        for (int i = 0; i < sample.length; i++) {
            if (sample[i] == 2.0) {
                sample[i] = 1.0;
                break;
            }
        }
        assertThrows(SerializationException.class, () -> mapper.toModel(state));
    }

    @Test
    public void testCorruptStateIsRejected() {
        RandomCutForestState missingTree = mapper.toState(forest);
        missingTree.setTreeStates(missingTree.getTreeStates().subList(0, 19));
        assertThrows(SerializationException.class, () -> mapper.toModel(missingTree));

        RandomCutForestState badVersion = mapper.toState(forest);
        badVersion.setVersion("9.9");
        assertThrows(SerializationException.class, () -> mapper.toModel(badVersion));

        RandomCutForestState badSampleSize = mapper.toState(forest);
        badSampleSize.setSampleSize(sampleSize + 1);
        assertThrows(SerializationException.class, () -> mapper.toModel(badSampleSize));

        RandomCutForestState badOutputAfter = mapper.toState(forest);
        badOutputAfter.setOutputAfter(0);
        assertThrows(SerializationException.class, () -> mapper.toModel(badOutputAfter));

        RandomCutForestState badTree = mapper.toState(forest);
        badTree.getTreeStates().get(3).getMass()[0] = -5;
        assertThrows(SerializationException.class, () -> mapper.toModel(badTree));

        RandomCutForestState missingSamplers = mapper.toState(forest);
        missingSamplers.setSamplerStates(null);
        assertThrows(SerializationException.class, () -> mapper.toModel(missingSamplers));
    }
}

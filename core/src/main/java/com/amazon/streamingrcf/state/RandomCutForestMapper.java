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

import static com.amazon.streamingrcf.CommonUtils.checkArgument;
import static com.amazon.streamingrcf.CommonUtils.checkNotNull;
import static com.amazon.streamingrcf.CommonUtils.cleanCopy;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import lombok.Getter;
import lombok.Setter;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.amazon.streamingrcf.ComponentList;
import com.amazon.streamingrcf.RandomCutForest;
import com.amazon.streamingrcf.SerializationException;
import com.amazon.streamingrcf.executor.SamplerPlusTree;
import com.amazon.streamingrcf.sampler.ReservoirSampler;
import com.amazon.streamingrcf.state.sampler.ReservoirSamplerMapper;
import com.amazon.streamingrcf.state.sampler.ReservoirSamplerState;
import com.amazon.streamingrcf.state.tree.RandomCutTreeMapper;
import com.amazon.streamingrcf.state.tree.RandomCutTreeState;
import com.amazon.streamingrcf.tree.RandomCutTree;

/**
 * A utility class for creating a {@link RandomCutForestState} instance from a
 * {@link RandomCutForest} instance and vice versa.
 */
@Getter
@Setter
public class RandomCutForestMapper implements IStateMapper<RandomCutForest, RandomCutForestState> {

    private static final Logger log = LogManager.getLogger(RandomCutForestMapper.class);

    /**
     * A flag indicating whether the structure of the trees in the forest should be
     * included in the state object. If true, then the nodes, cuts and bounding
     * boxes of each tree are written, and a loaded forest scores every point
     * exactly as the saved one. If false, only the samplers and the tree seeds are
     * written and the trees are rebuilt from the samples on load, which gives a
     * smaller state but different trees.
     */
    private boolean saveTreeStateEnabled = true;

    /**
     * Create a {@link RandomCutForestState} object representing the state of the
     * given forest. The forest is read under its read lock, so the state reflects
     * a single point in the update stream.
     *
     * @param forest A Random Cut Forest whose state we want to capture.
     * @return a {@link RandomCutForestState} object representing the state of the
     *         given forest.
     */
    @Override
    public RandomCutForestState toState(RandomCutForest forest) {
        RandomCutForestState state = new RandomCutForestState();
        state.setNumberOfTrees(forest.getNumberOfTrees());
        state.setDimensions(forest.getDimensions());
        state.setSampleSize(forest.getSampleSize());
        state.setOutputAfter(forest.getOutputAfter());
        state.setParallelExecutionEnabled(forest.isParallelExecutionEnabled());
        state.setThreadPoolSize(forest.getThreadPoolSize());
        state.setSaveTreeStateEnabled(saveTreeStateEnabled);

        ReservoirSamplerMapper samplerMapper = new ReservoirSamplerMapper();
        RandomCutTreeMapper treeMapper = new RandomCutTreeMapper();
        treeMapper.setSaveTreeStateEnabled(saveTreeStateEnabled);
        List<ReservoirSamplerState> samplerStates = new ArrayList<>();
        List<RandomCutTreeState> treeStates = new ArrayList<>();

        forest.withReadLock(components -> {
            state.setTotalUpdates(forest.getTotalUpdates());
            for (SamplerPlusTree component : components) {
                component.read(() -> {
                    samplerStates.add(samplerMapper.toState(component.getSampler()));
                    treeStates.add(treeMapper.toState(component.getTree()));
                    return null;
                });
            }
            return null;
        });
        state.setSamplerStates(samplerStates);
        state.setTreeStates(treeStates);
        return state;
    }

    /**
     * Create a {@link RandomCutForest} instance from a
     * {@link RandomCutForestState}. Every sampler and tree is validated, and each
     * tree must hold exactly the points of its sampler.
     *
     * @param state A state object.
     * @return A new RandomCutForest instance based on the given state.
     * @throws SerializationException if the state is inconsistent
     */
    @Override
    public RandomCutForest toModel(RandomCutForestState state) {
        try {
            return buildForest(state);
        } catch (SerializationException e) {
            throw e;
        } catch (IllegalArgumentException | IllegalStateException | NullPointerException e) {
            log.warn("rejected forest state: {}", e.getMessage());
            throw new SerializationException("inconsistent forest state: " + e.getMessage(), e);
        }
    }

    private RandomCutForest buildForest(RandomCutForestState state) {
        checkArgument(Version.V1_0.equals(state.getVersion()), "unsupported version " + state.getVersion());
        checkNotNull(state.getSamplerStates(), "missing sampler states");
        checkNotNull(state.getTreeStates(), "missing tree states");
        checkArgument(state.getSamplerStates().size() == state.getNumberOfTrees()
                && state.getTreeStates().size() == state.getNumberOfTrees(), "number of trees does not match");

        ReservoirSamplerMapper samplerMapper = new ReservoirSamplerMapper();
        RandomCutTreeMapper treeMapper = new RandomCutTreeMapper();
        ComponentList components = new ComponentList(state.getNumberOfTrees());
        for (int i = 0; i < state.getNumberOfTrees(); i++) {
            ReservoirSampler sampler = samplerMapper.toModel(state.getSamplerStates().get(i));
            RandomCutTreeState treeState = state.getTreeStates().get(i);
            RandomCutTree tree = treeMapper.toModel(treeState);
            List<double[]> sample = sampler.getSample();
            if (RandomCutTreeMapper.hasNodes(treeState)) {
                checkArgument(tree.getMass() == sample.size(), "tree " + i + " does not match its sampler");
                for (Map.Entry<List<Double>, Integer> entry : countCopies(sample).entrySet()) {
                    double[] point = entry.getKey().stream().mapToDouble(Double::doubleValue).toArray();
                    checkArgument(tree.getPointMass(point) == entry.getValue(),
                            "tree " + i + " does not hold the sampled copies of a point");
                }
            } else {
                sample.forEach(tree::insert);
            }
            components.add(new SamplerPlusTree(sampler, tree));
        }

        RandomCutForest.Builder<?> builder = RandomCutForest.builder().numberOfTrees(state.getNumberOfTrees())
                .dimensions(state.getDimensions()).sampleSize(state.getSampleSize())
                .outputAfter(state.getOutputAfter()).parallelExecutionEnabled(state.isParallelExecutionEnabled());
        if (state.isParallelExecutionEnabled()) {
            builder.threadPoolSize(state.getThreadPoolSize());
        }
        RandomCutForest forest = new RandomCutForest(builder, components, state.getTotalUpdates());
        log.debug("loaded forest with {} trees, {} updates", state.getNumberOfTrees(), state.getTotalUpdates());
        return forest;
    }

    // number of copies of each distinct point, compared by value
    private static Map<List<Double>, Integer> countCopies(List<double[]> sample) {
        Map<List<Double>, Integer> copies = new HashMap<>();
        for (double[] point : sample) {
            List<Double> key = Arrays.stream(cleanCopy(point)).boxed().collect(Collectors.toList());
            copies.merge(key, 1, Integer::sum);
        }
        return copies;
    }
}

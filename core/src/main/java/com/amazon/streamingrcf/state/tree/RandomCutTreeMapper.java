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

package com.amazon.streamingrcf.state.tree;

import static com.amazon.streamingrcf.CommonUtils.checkArgument;
import static com.amazon.streamingrcf.CommonUtils.checkPoint;
import static com.amazon.streamingrcf.tree.NodeStore.LEAF;
import static com.amazon.streamingrcf.tree.NodeStore.NULL;

import java.util.Arrays;

import lombok.Getter;
import lombok.Setter;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.amazon.streamingrcf.SerializationException;
import com.amazon.streamingrcf.state.IStateMapper;
import com.amazon.streamingrcf.state.Version;
import com.amazon.streamingrcf.tree.BoundingBox;
import com.amazon.streamingrcf.tree.NodeStore;
import com.amazon.streamingrcf.tree.RandomCutTree;

/**
 * Maps a {@link RandomCutTree} to an explicit node list and back. Loading
 * checks the numbering, the child links and every structural invariant of the
 * tree before returning it; an inconsistent state raises
 * {@link SerializationException}.
 */
@Getter
@Setter
public class RandomCutTreeMapper implements IStateMapper<RandomCutTree, RandomCutTreeState> {

    private static final Logger log = LogManager.getLogger(RandomCutTreeMapper.class);

    /**
     * If false, only the dimensions and the random seed are saved, and the tree
     * has to be rebuilt from its sampler after loading.
     */
    private boolean saveTreeStateEnabled = true;

    @Override
    public RandomCutTreeState toState(RandomCutTree tree) {
        RandomCutTreeState state = new RandomCutTreeState();
        state.setDimensions(tree.getDimensions());
        state.setRandomSeed(tree.getRandomSeed());
        if (!saveTreeStateEnabled) {
            return state;
        }

        int nodeCount = tree.getNodeCount();
        int dimensions = tree.getDimensions();
        state.setNodeCount(nodeCount);
        state.setLeftIndex(new int[nodeCount]);
        state.setRightIndex(new int[nodeCount]);
        state.setCutDimension(new int[nodeCount]);
        state.setCutValue(new double[nodeCount]);
        state.setMass(new int[nodeCount]);
        state.setMinValues(new double[nodeCount * dimensions]);
        state.setMaxValues(new double[nodeCount * dimensions]);
        if (!tree.isEmpty()) {
            int[] next = new int[1];
            writeNode(tree.getNodeStore(), tree.getRoot(), state, next);
            checkArgument(next[0] == nodeCount, "node count changed while saving");
        }
        return state;
    }

    private int writeNode(NodeStore nodeStore, int node, RandomCutTreeState state, int[] next) {
        int index = next[0]++;
        int dimensions = state.getDimensions();
        BoundingBox box = nodeStore.getBoundingBox(node);
        System.arraycopy(box.getMinValues(), 0, state.getMinValues(), index * dimensions, dimensions);
        System.arraycopy(box.getMaxValues(), 0, state.getMaxValues(), index * dimensions, dimensions);
        state.getMass()[index] = nodeStore.getMass(node);
        if (nodeStore.isLeaf(node)) {
            state.getCutDimension()[index] = LEAF;
            state.getLeftIndex()[index] = NULL;
            state.getRightIndex()[index] = NULL;
        } else {
            state.getCutDimension()[index] = nodeStore.getCutDimension(node);
            state.getCutValue()[index] = nodeStore.getCutValue(node);
            state.getLeftIndex()[index] = writeNode(nodeStore, nodeStore.getLeftIndex(node), state, next);
            state.getRightIndex()[index] = writeNode(nodeStore, nodeStore.getRightIndex(node), state, next);
        }
        return index;
    }

    /**
     * @return true if the state carries the node list, false if it only carries
     *         the random seed
     */
    public static boolean hasNodes(RandomCutTreeState state) {
        return state.getLeftIndex() != null;
    }

    @Override
    public RandomCutTree toModel(RandomCutTreeState state) {
        try {
            return buildTree(state);
        } catch (IllegalArgumentException | IllegalStateException | NullPointerException
                | ArrayIndexOutOfBoundsException e) {
            log.warn("rejected tree state: {}", e.getMessage());
            throw new SerializationException("inconsistent tree state: " + e.getMessage(), e);
        }
    }

    private RandomCutTree buildTree(RandomCutTreeState state) {
        checkArgument(Version.V1_0.equals(state.getVersion()), "unsupported version " + state.getVersion());
        int dimensions = state.getDimensions();
        checkArgument(dimensions > 0, "dimensions must be positive");
        RandomCutTree.Builder builder = RandomCutTree.builder().dimension(dimensions).randomSeed(state.getRandomSeed());
        if (!hasNodes(state)) {
            return builder.build();
        }

        int nodeCount = state.getNodeCount();
        checkArgument(nodeCount >= 0, "negative node count");
        checkArgument(state.getLeftIndex().length == nodeCount && state.getRightIndex().length == nodeCount
                && state.getCutDimension().length == nodeCount && state.getCutValue().length == nodeCount
                && state.getMass().length == nodeCount, "node arrays do not match the node count");
        checkArgument(state.getMinValues().length == nodeCount * dimensions
                && state.getMaxValues().length == nodeCount * dimensions, "box arrays do not match the node count");
        if (nodeCount == 0) {
            return builder.build();
        }

        // pre-order numbering: children come after their parent and every node but
        // the root is the child of exactly one node
        boolean[] referenced = new boolean[nodeCount];
        for (int i = 0; i < nodeCount; i++) {
            if (state.getCutDimension()[i] == LEAF) {
                checkArgument(state.getLeftIndex()[i] == NULL && state.getRightIndex()[i] == NULL,
                        "leaf " + i + " has children");
            } else {
                checkArgument(state.getCutDimension()[i] >= 0 && state.getCutDimension()[i] < dimensions,
                        "node " + i + " has an invalid cut dimension");
                checkArgument(Double.isFinite(state.getCutValue()[i]), "node " + i + " has a non-finite cut");
                for (int child : new int[] { state.getLeftIndex()[i], state.getRightIndex()[i] }) {
                    checkArgument(child > i && child < nodeCount, "node " + i + " has an invalid child " + child);
                    checkArgument(!referenced[child], "node " + child + " has two parents");
                    referenced[child] = true;
                }
            }
        }
        for (int i = 1; i < nodeCount; i++) {
            checkArgument(referenced[i], "node " + i + " is unreachable");
        }

        NodeStore nodeStore = new NodeStore(2 * nodeCount);
        int[] storeIndex = new int[nodeCount];
        for (int i = nodeCount - 1; i >= 0; i--) {
            double[] min = Arrays.copyOfRange(state.getMinValues(), i * dimensions, (i + 1) * dimensions);
            double[] max = Arrays.copyOfRange(state.getMaxValues(), i * dimensions, (i + 1) * dimensions);
            if (state.getCutDimension()[i] == LEAF) {
                checkPoint(min, dimensions);
                checkArgument(Arrays.equals(min, max), "leaf " + i + " has a box that is not a point");
                storeIndex[i] = nodeStore.addLeaf(min, state.getMass()[i]);
            } else {
                double rangeSum = 0;
                for (int j = 0; j < dimensions; j++) {
                    rangeSum += max[j] - min[j];
                }
                storeIndex[i] = nodeStore.addNode(NULL, storeIndex[state.getLeftIndex()[i]],
                        storeIndex[state.getRightIndex()[i]], state.getCutDimension()[i], state.getCutValue()[i],
                        new BoundingBox(min, max, rangeSum), state.getMass()[i]);
            }
        }

        RandomCutTree tree = builder.nodeStore(nodeStore).setRoot(storeIndex[0]).build();
        tree.validate();
        log.debug("loaded tree with {} nodes and mass {}", nodeCount, tree.getMass());
        return tree;
    }
}

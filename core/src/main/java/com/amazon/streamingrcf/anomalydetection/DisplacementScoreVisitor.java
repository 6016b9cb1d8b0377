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

package com.amazon.streamingrcf.anomalydetection;

import java.util.ArrayList;
import java.util.List;

import com.amazon.streamingrcf.Visitor;
import com.amazon.streamingrcf.tree.INodeView;

/**
 * Computes the displacement of a query point in one tree.
 * <p>
 * When the point is added, every ancestor on its path gets a subtree that is
 * one point heavier. At an ancestor of mass n whose child on the path has mass
 * c, the point displaces the sibling, and the ratio is {@code (n - c) / (n + 1)}:
 * the sibling's mass over the mass the ancestor would have with the point. If
 * the point is split off above a node of mass n, that node becomes its
 * sibling and the ratio is {@code n / (n + 1)}. The displacement of one
 * insertion outcome is the largest ratio on its path.
 * <p>
 * The result is the expected displacement, where the point is split off at
 * node j with probability p_j times the probability that no node above j split
 * it off. A point that reaches a leaf collides with the m points stored there
 * and its displacement is divided by m + 1. Every ratio is below 1, so the
 * score lies in [0, 1). A tree holding a single leaf has no structure to
 * displace and scores 0.
 */
public class DisplacementScoreVisitor implements Visitor<Double> {

    private final double[] pointToScore;

    // filled from the leaf upwards
    private final List<Integer> masses = new ArrayList<>();
    private final List<Double> separationProbabilities = new ArrayList<>();

    public DisplacementScoreVisitor(double[] pointToScore) {
        this.pointToScore = pointToScore;
    }

    @Override
    public void acceptLeaf(INodeView leafNode, int depthOfNode) {
        accept(leafNode, depthOfNode);
    }

    @Override
    public void accept(INodeView node, int depthOfNode) {
        masses.add(node.getMass());
        separationProbabilities.add(node.probabilityOfSeparation(pointToScore));
    }

    @Override
    public Double getResult() {
        int pathLength = masses.size();
        if (pathLength <= 1) {
            return 0.0;
        }

        double survive = 1.0;
        double prefixMax = 0.0;
        double expected = 0.0;
        // j walks from the root (last entry) to the leaf (entry 0)
        for (int j = pathLength - 1; j >= 0; j--) {
            int mass = masses.get(j);
            double probability = separationProbabilities.get(j);
            expected += survive * probability * Math.max(prefixMax, mass / (mass + 1.0));
            survive *= 1.0 - probability;
            if (j > 0) {
                int childMass = masses.get(j - 1);
                prefixMax = Math.max(prefixMax, (mass - childMass) / (mass + 1.0));
            }
        }
        // the point reaches the leaf and becomes a duplicate
        expected += survive * prefixMax / (masses.get(0) + 1.0);
        return expected;
    }
}

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

package com.amazon.streamingrcf.tree;

import static com.amazon.streamingrcf.CommonUtils.checkArgument;
import static com.amazon.streamingrcf.CommonUtils.checkPoint;
import static com.amazon.streamingrcf.CommonUtils.cleanCopy;
import static com.amazon.streamingrcf.CommonUtils.validateInternalState;
import static com.amazon.streamingrcf.tree.NodeStore.NULL;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import com.amazon.streamingrcf.PointNotFoundException;
import com.amazon.streamingrcf.Visitor;
import com.amazon.streamingrcf.VisitorFactory;
import com.amazon.streamingrcf.anomalydetection.DisplacementScoreVisitor;
import com.amazon.streamingrcf.util.ReplayableRandom;

/**
 * A Random Cut Tree is a binary space partitioning tree over a multiset of
 * points. Every internal node holds a cut (dimension, value) and the bounding
 * box of all points below it; points with {@code x[dimension] <= value} go to
 * the left child. Leaves hold one distinct point together with its
 * multiplicity, which is the leaf's mass.
 * <p>
 * Insertion follows the dynamic update rule: at each node on the way down, a
 * cut is drawn uniformly (by side length) over the union of the node's box and
 * the new point; if it separates the point from the box, the point becomes a
 * new leaf next to that node. Deletion removes one copy of a point and, when
 * the last copy goes, splices the leaf's sibling into its grandparent. These
 * rules keep the tree distributed as if it had been built from scratch on the
 * current multiset.
 * <p>
 * A tree is not thread safe; see
 * {@link com.amazon.streamingrcf.executor.SamplerPlusTree} for the locked
 * pairing used by the forest.
 */
public class RandomCutTree {

    private final int dimensions;
    private final NodeStore nodeStore;
    private final ReplayableRandom random;
    private int root;

    protected RandomCutTree(Builder builder) {
        checkArgument(builder.dimension > 0, "dimension must be positive");
        this.dimensions = builder.dimension;
        if (builder.random != null) {
            this.random = new ReplayableRandom(builder.random);
        } else {
            this.random = new ReplayableRandom(builder.randomSeed);
        }
        if (builder.nodeStore != null) {
            this.nodeStore = builder.nodeStore;
            this.root = builder.root;
        } else {
            this.nodeStore = new NodeStore(builder.initialCapacity);
            this.root = NULL;
        }
    }

    /**
     * Draws a cut uniformly over the union of the box and the point: a dimension
     * is chosen with probability proportional to its side length and the value is
     * uniform over that side. Cut values always lie in the half-open interval
     * [min, max) of the chosen side.
     *
     * @param factor a uniform draw in [0, 1)
     * @param point  the point whose union is taken with the box
     * @param box    A bounding box that we want to find a random cut for.
     * @return A new Cut corresponding to a random cut in the bounding box.
     */
    protected static Cut randomCut(double factor, double[] point, BoundingBox box) {
        double range = 0.0;
        for (int i = 0; i < point.length; i++) {
            range += Math.max(box.getMaxValue(i), point[i]) - Math.min(box.getMinValue(i), point[i]);
        }
        checkArgument(range > 0, () -> " the union is a single point " + Arrays.toString(point) + " box " + box);

        double breakPoint = factor * range;
        for (int i = 0; i < point.length; i++) {
            double minValue = Math.min(box.getMinValue(i), point[i]);
            double maxValue = Math.max(box.getMaxValue(i), point[i]);
            double gap = maxValue - minValue;
            if (breakPoint <= gap && gap > 0) {
                double cutValue = minValue + breakPoint;
                if (cutValue >= maxValue) {
                    cutValue = Math.nextAfter(maxValue, minValue);
                }
                return new Cut(i, cutValue);
            }
            breakPoint -= gap;
        }

        // rounding pushed the break point past the last side; cut just below the top
        // of the last dimension with positive length
        for (int i = point.length - 1; i >= 0; i--) {
            double minValue = Math.min(box.getMinValue(i), point[i]);
            double maxValue = Math.max(box.getMaxValue(i), point[i]);
            if (maxValue > minValue) {
                return new Cut(i, Math.nextAfter(maxValue, minValue));
            }
        }
        throw new IllegalStateException("The break point did not lie inside the expected range; factor " + factor
                + ", point " + Arrays.toString(point) + " box " + box);
    }

    static boolean separates(Cut cut, double[] point, BoundingBox box) {
        int dim = cut.getDimension();
        double value = cut.getValue();
        return point[dim] <= value && value < box.getMinValue(dim)
                || point[dim] > value && value >= box.getMaxValue(dim);
    }

    /**
     * Inserts one copy of the point. A point equal to an existing leaf increases
     * that leaf's mass and leaves the shape of the tree unchanged.
     *
     * @param point the point to insert
     */
    public void insert(double[] point) {
        checkPoint(point, dimensions);
        double[] pointCopy = cleanCopy(point);
        if (root == NULL) {
            root = nodeStore.addLeaf(pointCopy);
            return;
        }

        int node = root;
        while (true) {
            if (nodeStore.isLeaf(node) && Arrays.equals(nodeStore.getLeafPoint(node), pointCopy)) {
                nodeStore.incrementMass(node);
                growAncestors(nodeStore.getParent(node), pointCopy);
                return;
            }
            BoundingBox box = nodeStore.getBoundingBox(node);
            if (!box.contains(pointCopy)) {
                Cut cut = randomCut(random.nextDouble(), pointCopy, box);
                if (separates(cut, pointCopy, box)) {
                    int parent = nodeStore.getParent(node);
                    int leaf = nodeStore.addLeaf(pointCopy);
                    boolean leafOnLeft = Cut.isLeftOf(pointCopy, cut);
                    int newNode = nodeStore.addNode(parent, leafOnLeft ? leaf : node, leafOnLeft ? node : leaf,
                            cut.getDimension(), cut.getValue(), box.getMergedBox(pointCopy),
                            nodeStore.getMass(node) + 1);
                    if (parent == NULL) {
                        root = newNode;
                    } else {
                        nodeStore.replaceChild(parent, node, newNode);
                    }
                    growAncestors(parent, pointCopy);
                    return;
                }
            }
            validateInternalState(!nodeStore.isLeaf(node), "a distinct point was not separated from a leaf");
            node = childFor(node, pointCopy);
        }
    }

    private void growAncestors(int node, double[] point) {
        while (node != NULL) {
            nodeStore.incrementMass(node);
            nodeStore.extendBox(node, point);
            node = nodeStore.getParent(node);
        }
    }

    private int childFor(int node, double[] point) {
        if (point[nodeStore.getCutDimension(node)] <= nodeStore.getCutValue(node)) {
            return nodeStore.getLeftIndex(node);
        }
        return nodeStore.getRightIndex(node);
    }

    private int findLeaf(double[] point) {
        int node = root;
        while (!nodeStore.isLeaf(node)) {
            node = childFor(node, point);
        }
        return node;
    }

    /**
     * Removes one copy of the point, compared by value.
     *
     * @param point the point to remove
     * @throws PointNotFoundException if the tree holds no copy of the point
     */
    public void delete(double[] point) {
        checkPoint(point, dimensions);
        if (root == NULL) {
            throw new PointNotFoundException(point);
        }
        double[] target = cleanCopy(point);
        int leaf = findLeaf(target);
        if (!Arrays.equals(nodeStore.getLeafPoint(leaf), target)) {
            throw new PointNotFoundException(point);
        }

        if (nodeStore.getMass(leaf) > 1) {
            nodeStore.decrementMass(leaf);
            for (int node = nodeStore.getParent(leaf); node != NULL; node = nodeStore.getParent(node)) {
                nodeStore.decrementMass(node);
            }
            return;
        }

        int parent = nodeStore.getParent(leaf);
        if (parent == NULL) {
            nodeStore.releaseNode(leaf);
            root = NULL;
            return;
        }

        int sibling = nodeStore.getSibling(parent, leaf);
        int grandParent = nodeStore.getParent(parent);
        if (grandParent == NULL) {
            root = sibling;
            nodeStore.setParent(sibling, NULL);
        } else {
            nodeStore.replaceChild(grandParent, parent, sibling);
        }
        nodeStore.releaseNode(leaf);
        nodeStore.releaseNode(parent);

        for (int node = grandParent; node != NULL; node = nodeStore.getParent(node)) {
            nodeStore.decrementMass(node);
            nodeStore.recomputeBox(node);
        }
    }

    /**
     * Walks from the root to the leaf the point would fall into, then hands the
     * leaf and each ancestor (deepest first) to a visitor.
     *
     * @param point          the query point
     * @param visitorFactory creates the visitor for this tree and point
     * @param <R>            the visitor result type
     * @return the visitor's result
     */
    public <R> R traverse(double[] point, VisitorFactory<R> visitorFactory) {
        checkPoint(point, dimensions);
        Visitor<R> visitor = visitorFactory.newVisitor(this, point);
        if (root == NULL) {
            return visitor.getResult();
        }
        int node = root;
        int depth = 0;
        while (!nodeStore.isLeaf(node)) {
            node = childFor(node, point);
            ++depth;
        }
        NodeView view = new NodeView(nodeStore, node);
        visitor.acceptLeaf(view, depth);
        node = nodeStore.getParent(node);
        while (node != NULL) {
            --depth;
            view.setCurrentNode(node);
            visitor.accept(view, depth);
            node = nodeStore.getParent(node);
        }
        return visitor.getResult();
    }

    /**
     * @param point the query point
     * @return the expected displacement of the point; 0 for an empty tree or a
     *         tree with a single distinct point
     */
    public double score(double[] point) {
        checkPoint(point, dimensions);
        if (root == NULL) {
            return 0.0;
        }
        return traverse(point, (tree, x) -> new DisplacementScoreVisitor(x));
    }

    /**
     * Checks the structural invariants of the tree: parent links, masses, boxes
     * equal to the union of the children's boxes, and cuts strictly inside the
     * box and separating the two children.
     *
     * @throws IllegalStateException describing the first violation found
     */
    public void validate() {
        if (root == NULL) {
            validateInternalState(nodeStore.size() == 0, "empty tree with stored nodes");
            return;
        }
        validateInternalState(nodeStore.getParent(root) == NULL, "root has a parent");
        int count = validate(root);
        validateInternalState(count == nodeStore.size(), "unreachable nodes in store");
    }

    private int validate(int node) {
        if (nodeStore.isLeaf(node)) {
            validateInternalState(nodeStore.getMass(node) >= 1, "leaf with non-positive mass");
            return 1;
        }
        int left = nodeStore.getLeftIndex(node);
        int right = nodeStore.getRightIndex(node);
        validateInternalState(left != NULL && right != NULL, "internal node missing a child");
        validateInternalState(nodeStore.getParent(left) == node && nodeStore.getParent(right) == node,
                "incorrect parent link");
        validateInternalState(nodeStore.getMass(node) == nodeStore.getMass(left) + nodeStore.getMass(right),
                "mass is not the sum of child masses");
        BoundingBox box = nodeStore.getBoundingBox(node);
        BoundingBox leftBox = nodeStore.getBoundingBox(left);
        BoundingBox rightBox = nodeStore.getBoundingBox(right);
        validateInternalState(box.equals(leftBox.getMergedBox(rightBox)), "box is not the union of child boxes");
        int dim = nodeStore.getCutDimension(node);
        double value = nodeStore.getCutValue(node);
        validateInternalState(dim < dimensions, "cut dimension out of range");
        validateInternalState(box.getMinValue(dim) <= value && value < box.getMaxValue(dim),
                "cut is not strictly inside the box");
        validateInternalState(leftBox.getMaxValue(dim) <= value && rightBox.getMinValue(dim) > value,
                "cut does not separate the children");
        return 1 + validate(left) + validate(right);
    }

    /**
     * @return the number of points in the tree, counting duplicates
     */
    public int getMass() {
        return root == NULL ? 0 : nodeStore.getMass(root);
    }

    public boolean isEmpty() {
        return root == NULL;
    }

    /**
     * @return the number of stored nodes, leaves included
     */
    public int getNodeCount() {
        return nodeStore.size();
    }

    /**
     * @return the number of copies of the point held by the tree
     */
    public int getPointMass(double[] point) {
        checkPoint(point, dimensions);
        if (root == NULL) {
            return 0;
        }
        double[] target = cleanCopy(point);
        int leaf = findLeaf(target);
        return Arrays.equals(nodeStore.getLeafPoint(leaf), target) ? nodeStore.getMass(leaf) : 0;
    }

    /**
     * @return every point in the tree, repeated according to its multiplicity, in
     *         left to right leaf order
     */
    public List<double[]> getPoints() {
        List<double[]> points = new ArrayList<>();
        if (root != NULL) {
            collectPoints(root, points);
        }
        return points;
    }

    private void collectPoints(int node, List<double[]> points) {
        if (nodeStore.isLeaf(node)) {
            double[] point = nodeStore.getLeafPoint(node);
            for (int i = 0; i < nodeStore.getMass(node); i++) {
                points.add(Arrays.copyOf(point, point.length));
            }
        } else {
            collectPoints(nodeStore.getLeftIndex(node), points);
            collectPoints(nodeStore.getRightIndex(node), points);
        }
    }

    /**
     * @return the bounding box of the whole tree, or null when empty
     */
    public BoundingBox getBoundingBox() {
        return root == NULL ? null : nodeStore.getBoundingBox(root).copy();
    }

    public int getRoot() {
        return root;
    }

    public NodeStore getNodeStore() {
        return nodeStore;
    }

    public int getDimensions() {
        return dimensions;
    }

    /**
     * @return the current state of the random source, which is all that is needed
     *         to resume it
     */
    public long getRandomSeed() {
        return random.getSeed();
    }

    public boolean isRandomReplayable() {
        return random.isReplayable();
    }

    public static class Builder {
        protected long randomSeed = new Random().nextLong();
        protected Random random = null;
        protected int dimension;
        protected int initialCapacity = NodeStore.DEFAULT_INITIAL_CAPACITY;
        protected NodeStore nodeStore;
        protected int root = NULL;

        public Builder dimension(int dimension) {
            this.dimension = dimension;
            return this;
        }

        public Builder randomSeed(long randomSeed) {
            this.randomSeed = randomSeed;
            return this;
        }

        public Builder random(Random random) {
            this.random = random;
            return this;
        }

        public Builder initialCapacity(int initialCapacity) {
            this.initialCapacity = initialCapacity;
            return this;
        }

        public Builder nodeStore(NodeStore nodeStore) {
            this.nodeStore = nodeStore;
            return this;
        }

        public Builder setRoot(int root) {
            this.root = root;
            return this;
        }

        public RandomCutTree build() {
            return new RandomCutTree(this);
        }
    }

    public static Builder builder() {
        return new Builder();
    }
}

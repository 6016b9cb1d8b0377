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

import static com.amazon.streamingrcf.TestUtils.EPSILON;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThan;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.Random;

import org.junit.jupiter.api.Test;

import com.amazon.streamingrcf.tree.INodeView;

public class DisplacementScoreVisitorTest {

    private static INodeView node(int mass, double probabilityOfSeparation) {
        INodeView node = mock(INodeView.class);
        when(node.getMass()).thenReturn(mass);
        when(node.probabilityOfSeparation(any(double[].class))).thenReturn(probabilityOfSeparation);
        return node;
    }

    @Test
    public void testEmptyAndSingleLeafPaths() {
        DisplacementScoreVisitor visitor = new DisplacementScoreVisitor(new double[] { 1.0 });
        assertThat(visitor.getResult(), is(0.0));

        visitor.acceptLeaf(node(10, 1.0), 0);
        assertThat(visitor.getResult(), is(0.0));
    }

    @Test
    public void testPointInsideEveryBox() {
        // masses from the root: 10, 4, 1; the point reaches the leaf
        DisplacementScoreVisitor visitor = new DisplacementScoreVisitor(new double[] { 1.0 });
        visitor.acceptLeaf(node(1, 0.0), 2);
        visitor.accept(node(4, 0.0), 1);
        visitor.accept(node(10, 0.0), 0);

        // max of 6/11 and 3/5, shared with the one point already in the leaf
        assertThat(visitor.getResult(), closeTo(0.3, EPSILON));
    }

    @Test
    public void testCollisionIsDiscountedByLeafMass() {
        DisplacementScoreVisitor single = new DisplacementScoreVisitor(new double[] { 1.0 });
        single.acceptLeaf(node(1, 0.0), 1);
        single.accept(node(5, 0.0), 0);

        DisplacementScoreVisitor repeated = new DisplacementScoreVisitor(new double[] { 1.0 });
        repeated.acceptLeaf(node(4, 0.0), 1);
        repeated.accept(node(8, 0.0), 0);

        // root ratios 4/6 and 4/9, divided by the leaf masses plus one
        assertThat(single.getResult(), closeTo(4.0 / 6 / 2, EPSILON));
        assertThat(repeated.getResult(), closeTo(4.0 / 9 / 5, EPSILON));
    }

    @Test
    public void testSeparationWeightsOutcomes() {
        DisplacementScoreVisitor visitor = new DisplacementScoreVisitor(new double[] { 1.0 });
        visitor.acceptLeaf(node(2, 1.0), 2);
        visitor.accept(node(6, 0.5), 1);
        visitor.accept(node(8, 0.25), 0);

        // root: 0.25 * 8/9
        // middle: 0.75 * 0.5 * max(2/9, 6/7)
        // leaf: 0.375 * 1.0 * max(2/9, 4/7, 2/3)
        double expected = 0.25 * 8 / 9 + 0.375 * 6 / 7 + 0.375 * 2 / 3;
        assertThat(visitor.getResult(), closeTo(expected, EPSILON));
    }

    @Test
    public void testSeparationAtRoot() {
        DisplacementScoreVisitor visitor = new DisplacementScoreVisitor(new double[] { 100.0 });
        visitor.acceptLeaf(node(1, 1.0), 1);
        visitor.accept(node(7, 1.0), 0);
        assertThat(visitor.getResult(), closeTo(7.0 / 8, EPSILON));
    }

    @Test
    public void testResultStaysBelowOne() {
        Random random = new Random(3L);
        for (int trial = 0; trial < 100; trial++) {
            DisplacementScoreVisitor visitor = new DisplacementScoreVisitor(new double[] { 1.0 });
            int depth = 1 + random.nextInt(12);
            int mass = 1 + random.nextInt(5);
            visitor.acceptLeaf(node(mass, random.nextDouble()), depth);
            for (int d = depth - 1; d >= 0; d--) {
                mass += 1 + random.nextInt(1000);
                visitor.accept(node(mass, random.nextDouble()), d);
            }
            double result = visitor.getResult();
            assertThat(result, greaterThanOrEqualTo(0.0));
            assertThat(result, lessThan(1.0));
        }
    }
}

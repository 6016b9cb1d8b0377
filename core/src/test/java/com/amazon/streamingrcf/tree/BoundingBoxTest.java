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

import static com.amazon.streamingrcf.TestUtils.EPSILON;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class BoundingBoxTest {

    private double[] point1;
    private double[] point2;
    private BoundingBox box1;
    private BoundingBox box2;

    @BeforeEach
    public void setUp() {
        point1 = new double[] { 1.5, 2.7 };
        point2 = new double[] { 3.0, 1.2 };
        box1 = new BoundingBox(point1);
        box2 = new BoundingBox(point2);
    }

    @Test
    public void testNewFromSinglePoint() {
        assertThat(box1.getDimensions(), is(2));
        assertThat(box1.getMinValue(0), is(point1[0]));
        assertThat(box1.getMaxValue(0), is(point1[0]));
        assertThat(box1.getRange(0), is(0.0));
        assertThat(box1.getMinValue(1), is(point1[1]));
        assertThat(box1.getMaxValue(1), is(point1[1]));
        assertThat(box1.getRangeSum(), is(0.0));
    }

    @Test
    public void testGetMergedBoxWithOtherBox() {
        BoundingBox mergedBox = box1.getMergedBox(box2);

        assertThat(mergedBox.getDimensions(), is(2));
        assertThat(mergedBox.getMinValue(0), is(1.5));
        assertThat(mergedBox.getMaxValue(0), is(3.0));
        assertThat(mergedBox.getMinValue(1), is(1.2));
        assertThat(mergedBox.getMaxValue(1), is(2.7));
        assertThat(mergedBox.getRangeSum(), closeTo((3.0 - 1.5) + (2.7 - 1.2), EPSILON));

        // the operands are unchanged
        assertThat(box1.getRangeSum(), is(0.0));
        assertThat(box2.getRangeSum(), is(0.0));
        assertArrayEquals(new double[] { 1.5, 2.7 }, point1);
    }

    @Test
    public void testGetMergedBoxWithPoint() {
        BoundingBox mergedBox = box1.getMergedBox(point2);
        assertEquals(box1.getMergedBox(box2), mergedBox);
        assertThat(mergedBox.getRangeSum(), closeTo(3.0, EPSILON));
        assertArrayEquals(new double[] { 1.5, 2.7 }, point1);
        assertThrows(IllegalArgumentException.class, () -> box1.getMergedBox(new double[] { 1.0 }));
    }

    @Test
    public void testPointBoxIsImmutable() {
        assertThrows(IllegalStateException.class, () -> box1.addPoint(point2));
        assertThrows(IllegalStateException.class, () -> box1.addBox(box2));
    }

    @Test
    public void testContainsBoundingBox() {
        BoundingBox outer = new BoundingBox(new double[] { 0.0, 0.0 }, new double[] { 10.0, 10.0 });
        BoundingBox inner = new BoundingBox(new double[] { 2.0, 2.0 }, new double[] { 8.0, 8.0 });
        BoundingBox disjoint = new BoundingBox(new double[] { -4.0, -4.0 }, new double[] { -1.0, -1.0 });
        BoundingBox overlapping = new BoundingBox(new double[] { 1.0, -1.0 }, new double[] { 5.0, 5.0 });

        assertTrue(outer.contains(inner));
        assertFalse(inner.contains(outer));
        assertFalse(outer.contains(disjoint));
        assertFalse(disjoint.contains(outer));
        assertFalse(outer.contains(overlapping));
        assertFalse(overlapping.contains(outer));
        assertTrue(outer.contains(outer));
    }

    @Test
    public void testContainsPoint() {
        BoundingBox box = new BoundingBox(new double[] { 0.0, 0.0 }, new double[] { 10.0, 10.0 });
        assertTrue(box.contains(new double[] { 0.0, 10.0 }));
        assertTrue(box.contains(new double[] { 5.0, 5.0 }));
        assertFalse(box.contains(new double[] { -0.1, 5.0 }));
        assertFalse(box.contains(new double[] { 5.0, 10.1 }));
    }

    @Test
    public void testProbabilityOfCut() {
        BoundingBox box = new BoundingBox(new double[] { 0.0, 0.0 }, new double[] { 2.0, 2.0 });
        assertThat(box.probabilityOfCut(new double[] { 1.0, 1.0 }), is(0.0));
        // stretches the box by 1 in each dimension, union has range sum 6
        assertThat(box.probabilityOfCut(new double[] { 3.0, -1.0 }), closeTo(2.0 / 6.0, EPSILON));
        assertThat(box1.probabilityOfCut(point2), is(1.0));
        assertThat(box1.probabilityOfCut(point1), is(0.0));
    }

    @Test
    public void testEqualsAndHashCode() {
        BoundingBox box = new BoundingBox(point1, point2);
        BoundingBox same = new BoundingBox(point2, point1);
        assertEquals(box, same);
        assertEquals(box.hashCode(), same.hashCode());
        assertNotEquals(box, box1);
        assertNotEquals(box, "box");
        assertEquals(box, box.copy());
    }
}

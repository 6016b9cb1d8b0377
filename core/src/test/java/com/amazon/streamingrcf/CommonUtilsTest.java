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
import static com.amazon.streamingrcf.CommonUtils.cleanCopy;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

public class CommonUtilsTest {

    @Test
    public void testChecks() {
        assertThrows(IllegalArgumentException.class, () -> checkArgument(false, "error"));
        assertThrows(IllegalArgumentException.class, () -> checkArgument(false, () -> "error"));
        assertThrows(IllegalStateException.class, () -> checkState(false, "error"));
        assertThrows(NullPointerException.class, () -> checkNotNull(null, "error"));
        assertThrows(ConfigurationException.class, () -> checkConfiguration(false, "error"));
        assertDoesNotThrow(() -> checkArgument(true, "error"));
        assertEquals("a", checkNotNull("a", "error"));
    }

    @Test
    public void testCheckPoint() {
        DimensionMismatchException mismatch = assertThrows(DimensionMismatchException.class,
                () -> checkPoint(new double[] { 1, 2 }, 3));
        assertEquals(3, mismatch.getExpected());
        assertEquals(2, mismatch.getActual());

        NonFiniteValueException nonFinite = assertThrows(NonFiniteValueException.class,
                () -> checkPoint(new double[] { 1, Double.POSITIVE_INFINITY, Double.NaN }, 3));
        assertEquals(1, nonFinite.getCoordinate());

        assertThrows(NullPointerException.class, () -> checkPoint(null, 3));
        assertDoesNotThrow(() -> checkPoint(new double[] { 0, -0.0, Double.MAX_VALUE }, 3));
    }

    @Test
    public void testCleanCopy() {
        double[] point = new double[] { -0.0, 1.5, 0.0 };
        double[] copy = cleanCopy(point);
        assertNotSame(point, copy);
        assertArrayEquals(new double[] { 0.0, 1.5, 0.0 }, copy);
        assertEquals(Double.doubleToRawLongBits(-0.0), Double.doubleToRawLongBits(point[0]));
        assertEquals(Double.doubleToRawLongBits(0.0), Double.doubleToRawLongBits(copy[0]));
    }
}

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

package com.amazon.streamingrcf.sampler;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.amazon.streamingrcf.ConfigurationException;
import com.amazon.streamingrcf.DimensionMismatchException;
import com.amazon.streamingrcf.NonFiniteValueException;

public class ReservoirSamplerTest {

    private Random random;
    private ReservoirSampler sampler;

    @BeforeEach
    public void setUp() {
        random = mock(Random.class);
        sampler = ReservoirSampler.builder().capacity(2).dimension(1).random(random).build();
    }

    @Test
    public void testFillsBeforeSampling() {
        SampleUpdate first = sampler.observe(new double[] { 1 });
        assertSame(SampleUpdate.Type.ADMITTED, first.getType());
        assertFalse(first.getEvicted().isPresent());
        assertFalse(sampler.isFull());

        sampler.observe(new double[] { 2 });
        assertTrue(sampler.isFull());
        assertEquals(2, sampler.getEntriesSeen());
        verify(random, never()).nextDouble();
    }

    @Test
    public void testReplacementAndRejection() {
        sampler.observe(new double[] { 1 });
        sampler.observe(new double[] { 2 });

        // third entry: slot floor(0.5 * 3) = 1 replaces the second point
        when(random.nextDouble()).thenReturn(0.5);
        SampleUpdate update = sampler.observe(new double[] { 3 });
        assertSame(SampleUpdate.Type.ADMITTED_REPLACING, update.getType());
        assertArrayEquals(new double[] { 3 }, update.getAdmittedPoint());
        assertArrayEquals(new double[] { 2 }, update.getEvicted().get());

        // fourth entry: slot floor(0.75 * 4) = 3 lies past the sample
        when(random.nextDouble()).thenReturn(0.75);
        update = sampler.observe(new double[] { 4 });
        assertSame(SampleUpdate.Type.REJECTED, update.getType());
        assertFalse(update.isAdmitted());

        List<double[]> sample = sampler.getSample();
        assertArrayEquals(new double[] { 1 }, sample.get(0));
        assertArrayEquals(new double[] { 3 }, sample.get(1));
        assertEquals(4, sampler.getEntriesSeen());
    }

    @Test
    public void testStartNewEpoch() {
        sampler.observe(new double[] { 1 });
        sampler.observe(new double[] { 2 });
        sampler.startNewEpoch();
        assertEquals(0, sampler.getEntriesSeen());
        assertEquals(2, sampler.size());

        // the first entry of an epoch always replaces a sample point
        when(random.nextDouble()).thenReturn(0.9);
        SampleUpdate update = sampler.observe(new double[] { 5 });
        assertTrue(update.isAdmitted());
        assertArrayEquals(new double[] { 1 }, update.getEvicted().get());
    }

    @Test
    public void testRejectedPointLeavesSamplerUnchanged() {
        sampler.observe(new double[] { 1 });
        assertThrows(DimensionMismatchException.class, () -> sampler.observe(new double[] { 1, 2 }));
        assertThrows(NonFiniteValueException.class, () -> sampler.observe(new double[] { Double.NaN }));
        assertEquals(1, sampler.getEntriesSeen());
        assertEquals(1, sampler.size());
    }

    @Test
    public void testSampleFromDrawsWithoutReplacement() {
        ReservoirSampler seeded = ReservoirSampler.builder().capacity(10).dimension(1).randomSeed(3L).build();
        List<double[]> points = new ArrayList<>();
        for (int i = 0; i < 25; i++) {
            points.add(new double[] { i });
        }
        List<double[]> drawn = seeded.sampleFrom(points);
        assertEquals(10, drawn.size());
        Set<Double> distinct = new HashSet<>();
        drawn.forEach(p -> distinct.add(p[0]));
        assertEquals(10, distinct.size());
        assertEquals(25, seeded.getEntriesSeen());
        assertTrue(seeded.isFull());

        assertThrows(IllegalStateException.class, () -> seeded.sampleFrom(points));
    }

    @Test
    public void testSampleFromSmallTrainingSet() {
        ReservoirSampler seeded = ReservoirSampler.builder().capacity(10).dimension(1).randomSeed(3L).build();
        List<double[]> points = List.of(new double[] { 1 }, new double[] { 2 }, new double[] { 3 });
        assertEquals(3, seeded.sampleFrom(points).size());
        assertFalse(seeded.isFull());
        assertEquals(3, seeded.getEntriesSeen());
    }

    @Test
    public void testUniformAdmission() {
        // every position of a long stream should end up in the sample about equally
        // often
        int capacity = 5;
        int length = 50;
        int trials = 4000;
        int[] counts = new int[length];
        Random seeds = new Random(0);
        for (int t = 0; t < trials; t++) {
            ReservoirSampler s = ReservoirSampler.builder().capacity(capacity).dimension(1)
                    .randomSeed(seeds.nextLong()).build();
            for (int i = 0; i < length; i++) {
                s.observe(new double[] { i });
            }
            for (double[] point : s.getSample()) {
                counts[(int) point[0]]++;
            }
        }
        double expected = (double) trials * capacity / length;
        for (int count : counts) {
            assertTrue(Math.abs(count - expected) < 0.35 * expected, "count " + count);
        }
    }

    @Test
    public void testRestoreFromSample() {
        List<double[]> sample = List.of(new double[] { 1 }, new double[] { 2 });
        ReservoirSampler restored = ReservoirSampler.builder().capacity(3).dimension(1).randomSeed(1L)
                .initialSample(sample).entriesSeen(10).build();
        assertEquals(2, restored.size());
        assertEquals(10, restored.getEntriesSeen());

        assertThrows(IllegalArgumentException.class, () -> ReservoirSampler.builder().capacity(3).dimension(1)
                .initialSample(sample).entriesSeen(1).build());
        assertThrows(IllegalArgumentException.class, () -> ReservoirSampler.builder().capacity(1).dimension(1)
                .initialSample(sample).entriesSeen(2).build());
    }

    @Test
    public void testConfiguration() {
        assertThrows(ConfigurationException.class, () -> ReservoirSampler.builder().capacity(0).dimension(1).build());
        assertThrows(ConfigurationException.class, () -> ReservoirSampler.builder().capacity(1).build());
    }
}

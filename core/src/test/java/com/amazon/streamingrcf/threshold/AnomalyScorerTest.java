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

package com.amazon.streamingrcf.threshold;

import static com.amazon.streamingrcf.TestUtils.EPSILON;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.amazon.streamingrcf.ConfigurationException;
import com.amazon.streamingrcf.RandomCutForest;
import com.amazon.streamingrcf.returntypes.AnomalyDescriptor;

public class AnomalyScorerTest {

    @ParameterizedTest
    @ValueSource(ints = { 0, 1, 5, 20 })
    public void testColdStart(int minimumObservations) {
        AnomalyScorer scorer = AnomalyScorer.builder().minimumObservations(minimumObservations).build();
        for (int i = 0; i < minimumObservations; i++) {
            // an absurd score is never anomalous while cold
            AnomalyDescriptor descriptor = scorer.process(i % 2 == 0 ? 1.0 : 1e9);
            assertFalse(descriptor.isAnomalous());
            assertTrue(Double.isNaN(descriptor.getThreshold()));
        }
        assertEquals(minimumObservations, scorer.getObservations());
    }

    @Test
    public void testMinimumObservationsFollowForestSampleSize() {
        RandomCutForest forest = RandomCutForest.builder().dimensions(1).sampleSize(10).build();
        AnomalyScorer scorer = AnomalyScorer.builder().forest(forest).build();
        assertEquals(10, scorer.getMinimumObservations());

        for (int i = 0; i < 9; i++) {
            scorer.update(1.0 + (i % 2));
        }
        assertFalse(scorer.classify(1e9));
        scorer.update(1.0);
        assertTrue(scorer.classify(1e9));

        // an explicit value wins over the forest, in either order
        assertEquals(3, AnomalyScorer.builder().forest(forest).minimumObservations(3).build()
                .getMinimumObservations());
        assertEquals(3, AnomalyScorer.builder().minimumObservations(3).forest(forest).build()
                .getMinimumObservations());
        assertEquals(AnomalyScorer.DEFAULT_MINIMUM_OBSERVATIONS,
                AnomalyScorer.builder().build().getMinimumObservations());
        assertThrows(NullPointerException.class, () -> AnomalyScorer.builder().forest(null));
    }

    @Test
    public void testEmptyStatisticsNeverClassify() {
        AnomalyScorer scorer = AnomalyScorer.builder().minimumObservations(0).build();
        assertFalse(scorer.classify(1e6));
        assertTrue(Double.isNaN(scorer.getThreshold()));
        assertTrue(Double.isNaN(scorer.getMean()));
    }

    @Test
    public void testClassifyAgainstThreshold() {
        AnomalyScorer scorer = AnomalyScorer.builder().deviationMultiplier(2.0).minimumObservations(4).build();
        for (double value : new double[] { 2, 4, 4, 4, 5, 5, 7, 9 }) {
            scorer.update(value);
        }
        // mean 5, deviation 2
        assertThat(scorer.getThreshold(), closeTo(9.0, EPSILON));
        assertFalse(scorer.classify(8.99));
        assertTrue(scorer.classify(9.01));
        assertEquals(8, scorer.getObservations());
    }

    @Test
    public void testProcessClassifiesBeforeUpdating() {
        AnomalyScorer scorer = AnomalyScorer.builder().deviationMultiplier(3.0).minimumObservations(3).build();
        for (int i = 0; i < 3; i++) {
            assertFalse(scorer.process(1.0).isAnomalous());
        }
        AnomalyDescriptor descriptor = scorer.process(5.0);
        assertTrue(descriptor.isAnomalous());
        assertThat(descriptor.getThreshold(), closeTo(1.0, EPSILON));
        assertEquals(3, descriptor.getObservations());
        assertEquals(4, scorer.getObservations());
        assertThat(scorer.getMean(), closeTo(2.0, EPSILON));
    }

    @Test
    public void testConstantScoresAreNotAnomalous() {
        AnomalyScorer scorer = AnomalyScorer.builder().minimumObservations(2).build();
        for (int i = 0; i < 50; i++) {
            assertFalse(scorer.process(0.3).isAnomalous());
        }
    }

    @Test
    public void testWindow() {
        AnomalyScorer scorer = AnomalyScorer.builder().minimumObservations(2).windowSize(3).build();
        for (double value : new double[] { 100, 100, 1, 1, 1 }) {
            scorer.update(value);
        }
        // the large scores have left the window
        assertThat(scorer.getMean(), closeTo(1.0, EPSILON));
        assertEquals(5, scorer.getObservations());
        assertTrue(scorer.classify(2.0));
    }

    @Test
    public void testReset() {
        AnomalyScorer scorer = AnomalyScorer.builder().minimumObservations(2).build();
        scorer.update(1.0);
        scorer.update(1.0);
        assertTrue(scorer.classify(2.0));
        scorer.reset();
        assertEquals(0, scorer.getObservations());
        assertFalse(scorer.classify(2.0));
    }

    @Test
    public void testIncorrectArguments() {
        assertThrows(ConfigurationException.class, () -> AnomalyScorer.builder().deviationMultiplier(-1).build());
        assertThrows(ConfigurationException.class,
                () -> AnomalyScorer.builder().deviationMultiplier(Double.POSITIVE_INFINITY).build());
        assertThrows(ConfigurationException.class, () -> AnomalyScorer.builder().minimumObservations(-1).build());
        assertThrows(ConfigurationException.class, () -> AnomalyScorer.builder().windowSize(-1).build());
        assertThrows(IllegalArgumentException.class,
                () -> AnomalyScorer.builder().windowSize(3).deviation(new Deviation()).build());
        assertThrows(IllegalArgumentException.class,
                () -> AnomalyScorer.builder().deviation(new Deviation(5, 1, 1)).observations(2).build());

        AnomalyScorer scorer = AnomalyScorer.builder().build();
        assertThrows(IllegalArgumentException.class, () -> scorer.update(Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> scorer.classify(Double.POSITIVE_INFINITY));
        assertEquals(AnomalyScorer.DEFAULT_DEVIATION_MULTIPLIER, scorer.getDeviationMultiplier());
    }
}

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

import static com.amazon.streamingrcf.CommonUtils.checkArgument;
import static com.amazon.streamingrcf.CommonUtils.checkConfiguration;
import static com.amazon.streamingrcf.CommonUtils.checkNotNull;

import java.util.Optional;
import java.util.function.Function;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.amazon.streamingrcf.RandomCutForest;
import com.amazon.streamingrcf.returntypes.AnomalyDescriptor;

/**
 * Turns a stream of forest scores into anomaly verdicts. A score is anomalous
 * when it exceeds {@code mean + deviationMultiplier * deviation} of the scores
 * seen before it. Until {@code minimumObservations} scores have been folded in,
 * every score is classified as normal.
 * <p>
 * The statistics cover every score since the last {@link #reset()}, or only
 * the most recent {@code windowSize} scores when a window is configured. The
 * scorer is thread safe.
 */
public class AnomalyScorer {

    private static final Logger log = LogManager.getLogger(AnomalyScorer.class);

    public static final double DEFAULT_DEVIATION_MULTIPLIER = 3.0;

    /**
     * Minimum number of observations for a scorer that is not tied to a forest.
     * A scorer built with {@link Builder#forest(RandomCutForest)} defaults to the
     * sample size of that forest instead.
     */
    public static final int DEFAULT_MINIMUM_OBSERVATIONS = RandomCutForest.DEFAULT_SAMPLE_SIZE;

    /**
     * A window size of 0 keeps statistics over all scores.
     */
    public static final int DEFAULT_WINDOW_SIZE = 0;

    private final double deviationMultiplier;

    private final int minimumObservations;

    private final int windowSize;

    private Deviation deviation;

    /**
     * The number of scores folded in since the last reset. With a window this
     * keeps counting after the window is full.
     */
    private long observations;

    protected AnomalyScorer(Builder builder) {
        checkConfiguration(builder.deviationMultiplier >= 0 && Double.isFinite(builder.deviationMultiplier),
                "deviationMultiplier must be a non-negative finite number");
        int minimumObservations = builder.minimumObservations
                .orElse(builder.forestSampleSize.orElse(DEFAULT_MINIMUM_OBSERVATIONS));
        checkConfiguration(minimumObservations >= 0, "minimumObservations cannot be negative");
        checkConfiguration(builder.windowSize >= 0, "windowSize cannot be negative");
        deviationMultiplier = builder.deviationMultiplier;
        this.minimumObservations = minimumObservations;
        windowSize = builder.windowSize;
        deviation = builder.deviation != null ? builder.deviation : newDeviation();
        observations = builder.observations;
        checkArgument(observations >= deviation.getCount(), "fewer observations than values in the statistics");
        boolean windowMatches = (deviation instanceof WindowedDeviation)
                ? ((WindowedDeviation) deviation).getWindowSize() == windowSize
                : windowSize == 0;
        checkArgument(windowMatches, "statistics do not match the window");
    }

    private Deviation newDeviation() {
        return windowSize > 0 ? new WindowedDeviation(windowSize) : new Deviation();
    }

    /**
     * Classifies a score against the statistics of the scores seen so far. The
     * statistics are not changed.
     *
     * @param score a forest score
     * @return true if the scorer has enough history and the score exceeds the
     *         threshold
     */
    public synchronized boolean classify(double score) {
        checkScore(score);
        return observations >= minimumObservations && !deviation.isEmpty() && score > threshold();
    }

    /**
     * Folds a score into the statistics.
     *
     * @param score a forest score
     */
    public synchronized void update(double score) {
        checkScore(score);
        deviation.update(score);
        ++observations;
    }

    /**
     * Classifies the score against the statistics as they were before it, then
     * folds it in.
     *
     * @param score a forest score
     * @return the verdict, along with the threshold that was applied
     */
    public synchronized AnomalyDescriptor process(double score) {
        boolean anomalous = classify(score);
        double threshold = getThreshold();
        long before = observations;
        update(score);
        return AnomalyDescriptor.builder().score(score).anomalous(anomalous).threshold(threshold).observations(before)
                .build();
    }

    /**
     * Discards all statistics. Typically paired with
     * {@link RandomCutForest#startNewEpoch()}.
     */
    public synchronized void reset() {
        log.info("resetting score statistics after {} observations", observations);
        deviation = newDeviation();
        observations = 0;
    }

    private double threshold() {
        return deviation.getMean() + deviationMultiplier * deviation.getDeviation();
    }

    private static void checkScore(double score) {
        checkArgument(Double.isFinite(score), "score must be finite");
    }

    /**
     * @return the current threshold, or NaN while the scorer is still cold
     */
    public synchronized double getThreshold() {
        if (observations < minimumObservations || deviation.isEmpty()) {
            return Double.NaN;
        }
        return threshold();
    }

    public synchronized long getObservations() {
        return observations;
    }

    /**
     * @return the mean of the scores in the statistics, or NaN if there are none
     */
    public synchronized double getMean() {
        return deviation.isEmpty() ? Double.NaN : deviation.getMean();
    }

    /**
     * @return the population standard deviation of the scores in the statistics,
     *         or NaN if there are none
     */
    public synchronized double getDeviation() {
        return deviation.isEmpty() ? Double.NaN : deviation.getDeviation();
    }

    public double getDeviationMultiplier() {
        return deviationMultiplier;
    }

    public int getMinimumObservations() {
        return minimumObservations;
    }

    public int getWindowSize() {
        return windowSize;
    }

    /**
     * Applies an action to the underlying statistics under the scorer's lock.
     */
    public synchronized <T> T withStatistics(Function<Deviation, T> action) {
        return action.apply(deviation);
    }

    public static class Builder {
        private double deviationMultiplier = DEFAULT_DEVIATION_MULTIPLIER;
        private Optional<Integer> minimumObservations = Optional.empty();
        private Optional<Integer> forestSampleSize = Optional.empty();
        private int windowSize = DEFAULT_WINDOW_SIZE;
        private Deviation deviation = null;
        private long observations = 0;

        public Builder deviationMultiplier(double deviationMultiplier) {
            this.deviationMultiplier = deviationMultiplier;
            return this;
        }

        public Builder minimumObservations(int minimumObservations) {
            this.minimumObservations = Optional.of(minimumObservations);
            return this;
        }

        /**
         * Ties the scorer to the forest whose scores it classifies. Unless
         * {@link #minimumObservations(int)} is given, the scorer stays quiet until
         * it has seen as many scores as the forest keeps points per tree.
         *
         * @param forest the forest producing the scores
         * @return this builder
         */
        public Builder forest(RandomCutForest forest) {
            checkNotNull(forest, "forest must not be null");
            this.forestSampleSize = Optional.of(forest.getSampleSize());
            return this;
        }

        public Builder windowSize(int windowSize) {
            this.windowSize = windowSize;
            return this;
        }

        public Builder deviation(Deviation deviation) {
            this.deviation = deviation;
            return this;
        }

        public Builder observations(long observations) {
            this.observations = observations;
            return this;
        }

        public AnomalyScorer build() {
            return new AnomalyScorer(this);
        }
    }

    public static Builder builder() {
        return new Builder();
    }
}

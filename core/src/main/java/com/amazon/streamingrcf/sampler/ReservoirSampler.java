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

import static com.amazon.streamingrcf.CommonUtils.checkArgument;
import static com.amazon.streamingrcf.CommonUtils.checkConfiguration;
import static com.amazon.streamingrcf.CommonUtils.checkPoint;
import static com.amazon.streamingrcf.CommonUtils.cleanCopy;
import static com.amazon.streamingrcf.CommonUtils.checkState;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.amazon.streamingrcf.util.ReplayableRandom;

/**
 * Maintains a uniform random sample of bounded size over the points observed
 * in the current sampling epoch (classic reservoir sampling). Until the sample
 * is full every point is admitted. After that the n-th point of the epoch is
 * admitted with probability capacity / n and replaces a uniformly chosen
 * member of the sample.
 * <p>
 * A new epoch starts with {@link #startNewEpoch()}: the current sample is kept
 * but the count of observed points restarts, so the next points displace the
 * old sample quickly.
 */
public class ReservoirSampler {

    private static final Logger log = LogManager.getLogger(ReservoirSampler.class);

    public static final int DEFAULT_SAMPLE_SIZE = 256;

    private final int capacity;

    private final int dimensions;

    private final List<double[]> sample;

    /**
     * The number of points observed in the current epoch, including points that
     * were rejected.
     */
    private long entriesSeen;

    private final ReplayableRandom random;

    protected ReservoirSampler(Builder builder) {
        checkConfiguration(builder.capacity > 0, "capacity must be positive");
        checkConfiguration(builder.dimension > 0, "dimension must be positive");
        this.capacity = builder.capacity;
        this.dimensions = builder.dimension;
        this.random = builder.random != null ? new ReplayableRandom(builder.random)
                : new ReplayableRandom(builder.randomSeed);
        this.sample = new ArrayList<>(capacity);
        if (builder.initialSample != null) {
            checkArgument(builder.initialSample.size() <= capacity, "sample larger than capacity");
            checkArgument(builder.entriesSeen >= builder.initialSample.size(),
                    "fewer entries seen than points in the sample");
            for (double[] point : builder.initialSample) {
                checkPoint(point, dimensions);
                sample.add(cleanCopy(point));
            }
            this.entriesSeen = builder.entriesSeen;
        }
    }

    /**
     * Offers a point to the sampler. A point that fails validation leaves the
     * sampler unchanged.
     *
     * @param point the observed point
     * @return whether the point was admitted and which point, if any, it replaced
     */
    public SampleUpdate observe(double[] point) {
        checkPoint(point, dimensions);
        double[] pointCopy = cleanCopy(point);
        ++entriesSeen;
        if (sample.size() < capacity) {
            sample.add(pointCopy);
            return SampleUpdate.admitted(pointCopy);
        }
        // a uniform slot in [0, entriesSeen); slots past the sample reject the point
        long slot = (long) (random.nextDouble() * entriesSeen);
        if (slot < capacity) {
            double[] evicted = sample.set((int) slot, pointCopy);
            return SampleUpdate.admittedReplacing(pointCopy, evicted);
        }
        return SampleUpdate.rejected();
    }

    /**
     * Fills an empty sampler with a uniform sample, drawn without replacement, of
     * {@code min(capacity, points.size())} points, as if every point had been
     * observed in order.
     *
     * @param points the training points
     * @return the admitted points, in the order they were drawn
     */
    public List<double[]> sampleFrom(List<double[]> points) {
        checkState(sample.isEmpty() && entriesSeen == 0, "sampler is not empty");
        int n = points.size();
        int size = Math.min(capacity, n);
        int[] indices = new int[n];
        for (int i = 0; i < n; i++) {
            indices[i] = i;
        }
        // partial Fisher-Yates shuffle
        for (int i = 0; i < size; i++) {
            int j = i + (int) (random.nextDouble() * (n - i));
            int swap = indices[i];
            indices[i] = indices[j];
            indices[j] = swap;
            double[] point = points.get(indices[i]);
            checkPoint(point, dimensions);
            sample.add(cleanCopy(point));
        }
        entriesSeen = n;
        return getSample();
    }

    public void startNewEpoch() {
        log.debug("starting a new sampling epoch after {} entries", entriesSeen);
        entriesSeen = 0;
    }

    /**
     * @return copies of the points in the sample
     */
    public List<double[]> getSample() {
        List<double[]> copy = new ArrayList<>(sample.size());
        for (double[] point : sample) {
            copy.add(Arrays.copyOf(point, point.length));
        }
        return copy;
    }

    public int size() {
        return sample.size();
    }

    public int getCapacity() {
        return capacity;
    }

    public int getDimensions() {
        return dimensions;
    }

    public long getEntriesSeen() {
        return entriesSeen;
    }

    public boolean isFull() {
        return sample.size() == capacity;
    }

    public long getRandomSeed() {
        return random.getSeed();
    }

    public boolean isRandomReplayable() {
        return random.isReplayable();
    }

    public static class Builder {
        protected int capacity = DEFAULT_SAMPLE_SIZE;
        protected int dimension;
        protected long randomSeed = new Random().nextLong();
        protected Random random = null;
        protected List<double[]> initialSample = null;
        protected long entriesSeen = 0;

        public Builder capacity(int capacity) {
            this.capacity = capacity;
            return this;
        }

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

        public Builder initialSample(List<double[]> initialSample) {
            this.initialSample = initialSample;
            return this;
        }

        public Builder entriesSeen(long entriesSeen) {
            this.entriesSeen = entriesSeen;
            return this;
        }

        public ReservoirSampler build() {
            return new ReservoirSampler(this);
        }
    }

    public static Builder builder() {
        return new Builder();
    }
}

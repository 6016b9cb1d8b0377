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

package com.amazon.streamingrcf.util;

import java.util.Random;

/**
 * A source of random doubles whose entire state is one long. Every draw seeds
 * a new {@link Random}, takes the next seed from it and then the value, so the
 * sequence can be resumed from {@link #getSeed()} after serialization.
 *
 * A {@link Random} can be injected for tests; such an instance has no
 * replayable state.
 */
public class ReplayableRandom {

    private long seed;
    private final Random testRandom;

    public ReplayableRandom(long seed) {
        this.seed = seed;
        this.testRandom = null;
    }

    public ReplayableRandom(Random random) {
        this.testRandom = random;
    }

    public double nextDouble() {
        if (testRandom != null) {
            return testRandom.nextDouble();
        }
        Random newRandom = new Random(seed);
        seed = newRandom.nextLong();
        return newRandom.nextDouble();
    }

    public long nextLong() {
        if (testRandom != null) {
            return testRandom.nextLong();
        }
        Random newRandom = new Random(seed);
        seed = newRandom.nextLong();
        return newRandom.nextLong();
    }

    public long getSeed() {
        return seed;
    }

    public boolean isReplayable() {
        return testRandom == null;
    }
}

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

import java.util.Optional;

import lombok.Getter;

/**
 * The outcome of offering one point to a {@link ReservoirSampler}.
 */
@Getter
public class SampleUpdate {

    public enum Type {
        /** The sample had room and the point was added. */
        ADMITTED,
        /** The sample was full; the point replaced a uniformly chosen member. */
        ADMITTED_REPLACING,
        /** The point was not added. */
        REJECTED
    }

    private static final SampleUpdate REJECTED = new SampleUpdate(Type.REJECTED, null, null);

    private final Type type;

    private final double[] admittedPoint;

    private final double[] evictedPoint;

    private SampleUpdate(Type type, double[] admittedPoint, double[] evictedPoint) {
        this.type = type;
        this.admittedPoint = admittedPoint;
        this.evictedPoint = evictedPoint;
    }

    public static SampleUpdate admitted(double[] point) {
        return new SampleUpdate(Type.ADMITTED, point, null);
    }

    public static SampleUpdate admittedReplacing(double[] point, double[] evicted) {
        return new SampleUpdate(Type.ADMITTED_REPLACING, point, evicted);
    }

    public static SampleUpdate rejected() {
        return REJECTED;
    }

    public boolean isAdmitted() {
        return type != Type.REJECTED;
    }

    public Optional<double[]> getEvicted() {
        return Optional.ofNullable(evictedPoint);
    }
}

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

package com.amazon.streamingrcf.executor;

import java.util.Optional;

import lombok.Builder;

/**
 * The effect of one streaming update on a single sampler and tree pair: the
 * point added to the tree, if the sampler admitted it, and the point removed
 * from the tree, if the admission evicted one.
 */
@Builder
public class UpdateResult {

    private static final UpdateResult NOOP = builder().build();

    private final double[] addedPoint;

    private final double[] deletedPoint;

    /**
     * @return an {@code UpdateResult} representing an update that did not change
     *         the sampler or the tree.
     */
    public static UpdateResult noop() {
        return NOOP;
    }

    public Optional<double[]> getAddedPoint() {
        return Optional.ofNullable(addedPoint);
    }

    public Optional<double[]> getDeletedPoint() {
        return Optional.ofNullable(deletedPoint);
    }

    /**
     * @return true if a point was added, and possibly another deleted
     */
    public boolean isStateChange() {
        return addedPoint != null || deletedPoint != null;
    }
}

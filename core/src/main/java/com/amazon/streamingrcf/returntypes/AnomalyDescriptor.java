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

package com.amazon.streamingrcf.returntypes;

import lombok.Builder;
import lombok.Getter;

/**
 * The verdict of an {@link com.amazon.streamingrcf.threshold.AnomalyScorer} on
 * one score.
 */
@Getter
@Builder
public class AnomalyDescriptor {

    private final double score;

    private final boolean anomalous;

    /**
     * The threshold the score was compared against; NaN while the scorer has
     * fewer observations than it needs to judge.
     */
    private final double threshold;

    /**
     * The number of scores folded into the statistics before this one.
     */
    private final long observations;
}

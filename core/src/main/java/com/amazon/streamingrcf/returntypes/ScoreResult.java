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
 * The result of observing one point in streaming mode.
 */
@Getter
@Builder
public class ScoreResult {

    /**
     * The mean displacement score of the point over all trees, computed before
     * the point was offered to the samplers.
     */
    private final double score;

    /**
     * The 1-based position of the point in the stream of updates seen by the
     * forest.
     */
    private final long sequenceIndex;

    /**
     * The number of trees whose sampler admitted the point.
     */
    private final int treesUpdated;
}

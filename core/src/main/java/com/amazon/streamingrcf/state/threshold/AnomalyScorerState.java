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

package com.amazon.streamingrcf.state.threshold;

import static com.amazon.streamingrcf.state.Version.V1_0;

import java.io.Serializable;

import lombok.Data;

/**
 * The configuration and running statistics of an anomaly scorer. For a
 * windowed scorer the window contents are saved and the statistics are
 * recomputed from them on load.
 */
@Data
public class AnomalyScorerState implements Serializable {

    private static final long serialVersionUID = 1L;

    private String version = V1_0;

    private double deviationMultiplier;

    private int minimumObservations;

    private int windowSize;

    private long observations;

    private long count;

    private double mean;

    private double sumSquaredDifferences;

    private double[] windowValues;
}

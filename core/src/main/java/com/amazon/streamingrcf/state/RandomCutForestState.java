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

package com.amazon.streamingrcf.state;

import static com.amazon.streamingrcf.state.Version.V1_0;

import java.io.Serializable;
import java.util.List;

import lombok.Data;

import com.amazon.streamingrcf.state.sampler.ReservoirSamplerState;
import com.amazon.streamingrcf.state.tree.RandomCutTreeState;

/**
 * A class that encapsulates the data used in a RandomCutForest such that the
 * forest can be serialized and deserialized. Sampler and tree states are listed
 * in tree-index order.
 */
@Data
public class RandomCutForestState implements Serializable {

    private static final long serialVersionUID = 1L;

    private String version = V1_0;

    private long totalUpdates;

    private int numberOfTrees;

    private int sampleSize;

    private int dimensions;

    private int outputAfter;

    private boolean parallelExecutionEnabled;

    private int threadPoolSize;

    private boolean saveTreeStateEnabled;

    private List<ReservoirSamplerState> samplerStates;

    private List<RandomCutTreeState> treeStates;
}

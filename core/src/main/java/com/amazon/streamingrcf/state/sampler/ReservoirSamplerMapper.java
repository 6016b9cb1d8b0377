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

package com.amazon.streamingrcf.state.sampler;

import static com.amazon.streamingrcf.CommonUtils.checkArgument;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.amazon.streamingrcf.SerializationException;
import com.amazon.streamingrcf.sampler.ReservoirSampler;
import com.amazon.streamingrcf.state.IStateMapper;
import com.amazon.streamingrcf.state.Version;

public class ReservoirSamplerMapper implements IStateMapper<ReservoirSampler, ReservoirSamplerState> {

    private static final Logger log = LogManager.getLogger(ReservoirSamplerMapper.class);

    @Override
    public ReservoirSamplerState toState(ReservoirSampler sampler) {
        ReservoirSamplerState state = new ReservoirSamplerState();
        state.setCapacity(sampler.getCapacity());
        state.setDimensions(sampler.getDimensions());
        state.setRandomSeed(sampler.getRandomSeed());
        state.setEntriesSeen(sampler.getEntriesSeen());
        List<double[]> sample = sampler.getSample();
        int dimensions = sampler.getDimensions();
        double[] flattened = new double[sample.size() * dimensions];
        for (int i = 0; i < sample.size(); i++) {
            System.arraycopy(sample.get(i), 0, flattened, i * dimensions, dimensions);
        }
        state.setSize(sample.size());
        state.setSample(flattened);
        return state;
    }

    @Override
    public ReservoirSampler toModel(ReservoirSamplerState state) {
        try {
            checkArgument(Version.V1_0.equals(state.getVersion()), "unsupported version " + state.getVersion());
            int dimensions = state.getDimensions();
            checkArgument(dimensions > 0, "dimensions must be positive");
            checkArgument(state.getSize() >= 0 && state.getSample() != null
                    && state.getSample().length == state.getSize() * dimensions, "sample does not match its size");
            List<double[]> sample = new ArrayList<>(state.getSize());
            for (int i = 0; i < state.getSize(); i++) {
                sample.add(Arrays.copyOfRange(state.getSample(), i * dimensions, (i + 1) * dimensions));
            }
            return ReservoirSampler.builder().capacity(state.getCapacity()).dimension(dimensions)
                    .randomSeed(state.getRandomSeed()).initialSample(sample).entriesSeen(state.getEntriesSeen())
                    .build();
        } catch (IllegalArgumentException | NullPointerException e) {
            log.warn("rejected sampler state: {}", e.getMessage());
            throw new SerializationException("inconsistent sampler state: " + e.getMessage(), e);
        }
    }
}

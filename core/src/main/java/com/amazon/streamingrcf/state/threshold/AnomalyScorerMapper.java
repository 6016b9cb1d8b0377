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

import static com.amazon.streamingrcf.CommonUtils.checkArgument;

import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.amazon.streamingrcf.SerializationException;
import com.amazon.streamingrcf.state.IStateMapper;
import com.amazon.streamingrcf.state.Version;
import com.amazon.streamingrcf.threshold.AnomalyScorer;
import com.amazon.streamingrcf.threshold.Deviation;
import com.amazon.streamingrcf.threshold.WindowedDeviation;

public class AnomalyScorerMapper implements IStateMapper<AnomalyScorer, AnomalyScorerState> {

    private static final Logger log = LogManager.getLogger(AnomalyScorerMapper.class);

    @Override
    public AnomalyScorerState toState(AnomalyScorer scorer) {
        AnomalyScorerState state = new AnomalyScorerState();
        state.setDeviationMultiplier(scorer.getDeviationMultiplier());
        state.setMinimumObservations(scorer.getMinimumObservations());
        state.setWindowSize(scorer.getWindowSize());
        // one lock acquisition, so the counters and statistics agree
        scorer.withStatistics(deviation -> {
            state.setObservations(scorer.getObservations());
            state.setCount(deviation.getCount());
            state.setMean(deviation.isEmpty() ? 0 : deviation.getMean());
            state.setSumSquaredDifferences(deviation.getSumSquaredDifferences());
            if (deviation instanceof WindowedDeviation) {
                state.setWindowValues(((WindowedDeviation) deviation).getValues().stream()
                        .mapToDouble(Double::doubleValue).toArray());
            }
            return null;
        });
        return state;
    }

    @Override
    public AnomalyScorer toModel(AnomalyScorerState state) {
        try {
            checkArgument(Version.V1_0.equals(state.getVersion()), "unsupported version " + state.getVersion());
            final Deviation deviation;
            if (state.getWindowSize() > 0) {
                checkArgument(state.getWindowValues() != null, "missing window values");
                List<Double> values = new ArrayList<>(state.getWindowValues().length);
                for (double value : state.getWindowValues()) {
                    checkArgument(Double.isFinite(value), "non-finite value in window");
                    values.add(value);
                }
                deviation = new WindowedDeviation(state.getWindowSize(), values);
            } else {
                checkArgument(Double.isFinite(state.getMean()) && Double.isFinite(state.getSumSquaredDifferences()),
                        "non-finite statistics");
                deviation = new Deviation(state.getCount(), state.getMean(), state.getSumSquaredDifferences());
            }
            return AnomalyScorer.builder().deviationMultiplier(state.getDeviationMultiplier())
                    .minimumObservations(state.getMinimumObservations()).windowSize(state.getWindowSize())
                    .deviation(deviation).observations(state.getObservations()).build();
        } catch (IllegalArgumentException | NullPointerException e) {
            log.warn("rejected scorer state: {}", e.getMessage());
            throw new SerializationException("inconsistent scorer state: " + e.getMessage(), e);
        }
    }
}

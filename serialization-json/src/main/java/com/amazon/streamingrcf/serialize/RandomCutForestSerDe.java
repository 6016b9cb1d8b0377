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

package com.amazon.streamingrcf.serialize;

import lombok.Getter;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.amazon.streamingrcf.RandomCutForest;
import com.amazon.streamingrcf.SerializationException;
import com.amazon.streamingrcf.state.RandomCutForestMapper;
import com.amazon.streamingrcf.state.RandomCutForestState;
import com.amazon.streamingrcf.state.threshold.AnomalyScorerMapper;
import com.amazon.streamingrcf.state.threshold.AnomalyScorerState;
import com.amazon.streamingrcf.threshold.AnomalyScorer;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;

/**
 * {@link RandomCutForest} serialization. Internally we use the
 * {@link RandomCutForestMapper} class to convert a RandomCutForest into a
 * corresponding state object, and we use
 * <a href="https://github.com/google/gson">Gson</a> to write the state object
 * as a JSON string. The Gson instance is exposed so users can customize the
 * output (e.g., by enabling pretty printing).
 */
@Getter
public class RandomCutForestSerDe {

    private static final Logger log = LogManager.getLogger(RandomCutForestSerDe.class);

    private final RandomCutForestMapper mapper;
    private final AnomalyScorerMapper scorerMapper;
    private final Gson gson;

    /**
     * Constructor instantiating objects for default serialization.
     */
    public RandomCutForestSerDe() {
        this(new RandomCutForestMapper(), new Gson());
    }

    /**
     * Create a SerDe instance using the provided mapper and Gson objects.
     *
     * @param mapper A RandomCutForestMapper instance, used to convert a
     *               RandomCutForest to a corresponding state object.
     * @param gson   A Gson instance that will be used to generate JSON for a given
     *               {@link RandomCutForestState} object.
     */
    public RandomCutForestSerDe(RandomCutForestMapper mapper, Gson gson) {
        this.mapper = mapper;
        this.scorerMapper = new AnomalyScorerMapper();
        this.gson = gson;
    }

    /**
     * Serializes a forest to a JSON string.
     *
     * @param forest A Random Cut Forest
     * @return a JSON string serialized from the forest.
     */
    public String toJson(RandomCutForest forest) {
        return gson.toJson(mapper.toState(forest));
    }

    /**
     * Deserializes a JSON string written by {@link #toJson(RandomCutForest)}.
     *
     * @param json a JSON string serialized from a forest
     * @return a forest deserialized from the string
     * @throws SerializationException if the string is not valid JSON or describes
     *                                an inconsistent forest
     */
    public RandomCutForest fromJson(String json) {
        return mapper.toModel(parse(json, RandomCutForestState.class));
    }

    public String toJson(AnomalyScorer scorer) {
        return gson.toJson(scorerMapper.toState(scorer));
    }

    public AnomalyScorer scorerFromJson(String json) {
        return scorerMapper.toModel(parse(json, AnomalyScorerState.class));
    }

    private <T> T parse(String json, Class<T> type) {
        T state;
        try {
            state = gson.fromJson(json, type);
        } catch (JsonParseException e) {
            log.warn("could not parse {}: {}", type.getSimpleName(), e.getMessage());
            throw new SerializationException("malformed " + type.getSimpleName() + " JSON", e);
        }
        if (state == null) {
            throw new SerializationException("empty " + type.getSimpleName() + " JSON");
        }
        return state;
    }
}

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

/**
 * Converts between a model and a plain state object holding everything needed
 * to recreate it. State objects are simple beans so that any serialization
 * library can write them.
 *
 * @param <Model> the model type
 * @param <State> the state type
 */
public interface IStateMapper<Model, State> {

    /**
     * @param model the model to capture
     * @return a state object describing the model
     */
    State toState(Model model);

    /**
     * Recreates a model from its state. Implementations validate the state and
     * throw {@link com.amazon.streamingrcf.SerializationException} rather than
     * return a partially built model.
     *
     * @param state a state object
     * @return the model
     */
    Model toModel(State state);
}

/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.stackml.api.core;

import org.apache.flink.annotation.PublicEvolving;
import org.apache.flink.util.InstantiationUtil;

import org.stackml.param.WithParams;

import java.io.IOException;
import java.io.Serializable;

/**
 * Base interface for every instance that can be placed into an ensemble layer, either as a
 * preprocessing step or as an estimator. The interface is only a concept; what a stage can do is
 * described by the capability interfaces {@link Fittable}, {@link Transformable} and {@link
 * Predictable}.
 *
 * <p>Each stage is with parameters, and requires a public empty constructor.
 *
 * @param <T> The class type of the Stage implementation itself.
 */
@PublicEvolving
public interface Stage<T extends Stage<T>> extends WithParams<T>, Serializable {

    /**
     * Creates an independent deep copy of this stage, including its parameters and any state it
     * holds. The copy shares no mutable state with this instance.
     *
     * <p>The default implementation clones the stage through Java serialization. Subclasses with
     * non-serializable state should override it.
     */
    @SuppressWarnings("unchecked")
    default T copy() {
        try {
            return (T) InstantiationUtil.clone(this);
        } catch (IOException | ClassNotFoundException e) {
            throw new RuntimeException("Failed to copy stage " + getClass().getName() + ".", e);
        }
    }
}

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

import org.stackml.linalg.DenseVector;
import org.stackml.linalg.Matrix;

/**
 * A stage that can be trained on a feature matrix and a target vector.
 *
 * @param <T> The class type of the Stage implementation itself.
 */
@PublicEvolving
public interface Fittable<T extends Stage<T>> extends Stage<T> {
    /**
     * Trains this stage on the given input.
     *
     * @param x the feature matrix, one row per sample
     * @param y the target values, one entry per row of {@code x}
     * @return the fitted stage. Implementations may return {@code this}.
     */
    T fit(Matrix x, DenseVector y) throws Exception;
}

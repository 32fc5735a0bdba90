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

package org.stackml.param;

import org.apache.flink.annotation.PublicEvolving;

import javax.annotation.Nullable;

import java.io.Serializable;

/**
 * Checks the values of a parameter. Validators are serialized together with the stages holding
 * their parameters.
 *
 * @param <T> The class type of the parameter value.
 */
@PublicEvolving
public interface ParamValidator<T> extends Serializable {

    /** Returns whether the value is valid. A null value stands for "not set". */
    boolean validate(@Nullable T value);

    /** Describes the accepted values, e.g. {@code ">= 0"}. Used in error messages. */
    default String describe() {
        return "a valid value";
    }
}

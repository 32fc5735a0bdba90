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

package org.stackml.ensemble.param;

import org.stackml.param.Param;
import org.stackml.param.ParamValidators;
import org.stackml.param.StringParam;
import org.stackml.param.WithParams;

/**
 * Interface for the shared executionMode param.
 *
 * <p>Supported options:
 *
 * <ul>
 *   <li>staged: fits all preprocessing pipelines in one parallel call, then all estimators in a
 *       second one.
 *   <li>combined: submits preprocessing pipelines and estimators in a single parallel call.
 *       Estimators wait for the cached pipeline of their case.
 * </ul>
 */
public interface HasExecutionMode<T> extends WithParams<T> {
    String STAGED_MODE = "staged";
    String COMBINED_MODE = "combined";

    Param<String> EXECUTION_MODE =
            new StringParam(
                    "executionMode",
                    "How preprocessing and estimator fitting are submitted to the parallel engine.",
                    STAGED_MODE,
                    ParamValidators.inArray(STAGED_MODE, COMBINED_MODE));

    default String getExecutionMode() {
        return get(EXECUTION_MODE);
    }

    default T setExecutionMode(String value) {
        return set(EXECUTION_MODE, value);
    }
}

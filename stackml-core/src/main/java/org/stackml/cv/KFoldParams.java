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

package org.stackml.cv;

import org.stackml.param.IntParam;
import org.stackml.param.Param;
import org.stackml.param.ParamValidators;
import org.stackml.param.WithParams;

/**
 * Params of {@link KFold}.
 *
 * @param <T> The class type of this instance.
 */
public interface KFoldParams<T> extends WithParams<T> {
    Param<Integer> NUM_FOLDS =
            new IntParam(
                    "numFolds",
                    "The number of folds. Must be at least 2.",
                    2,
                    ParamValidators.gtEq(2));

    default T setNumFolds(int value) {
        return set(NUM_FOLDS, value);
    }

    default int getNumFolds() {
        return get(NUM_FOLDS);
    }
}

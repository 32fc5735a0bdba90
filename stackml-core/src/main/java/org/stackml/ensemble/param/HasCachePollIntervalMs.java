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

import org.stackml.param.LongParam;
import org.stackml.param.Param;
import org.stackml.param.ParamValidators;
import org.stackml.param.WithParams;

/** Interface for the shared cachePollIntervalMs param. */
public interface HasCachePollIntervalMs<T> extends WithParams<T> {
    Param<Long> CACHE_POLL_INTERVAL_MS =
            new LongParam(
                    "cachePollIntervalMs",
                    "Interval in milliseconds between two checks for a missing cache entry.",
                    100L,
                    ParamValidators.gt(0));

    default long getCachePollIntervalMs() {
        return get(CACHE_POLL_INTERVAL_MS);
    }

    default T setCachePollIntervalMs(long value) {
        return set(CACHE_POLL_INTERVAL_MS, value);
    }
}

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

package org.stackml.ensemble.parallel;

import org.apache.flink.util.function.ThrowingConsumer;

/**
 * Executes a batch of independent calls, in parallel or sequentially.
 *
 * <p>Calls must not depend on each other's in-memory state; they may only exchange data through a
 * {@link org.stackml.ensemble.cache.CacheStore} and through disjoint writes to a shared prediction
 * matrix. Once submitted, a call runs until it completes or fails.
 */
public interface ParallelEngine {

    /**
     * Invokes the call once per argument and returns when all invocations have finished.
     *
     * @param arguments the argument of every invocation, in submission order
     * @param call the call to invoke
     * @throws Exception the first failure of an invocation, with later failures suppressed
     */
    <T> void invokeAll(
            Iterable<T> arguments, ThrowingConsumer<? super T, ? extends Exception> call)
            throws Exception;
}

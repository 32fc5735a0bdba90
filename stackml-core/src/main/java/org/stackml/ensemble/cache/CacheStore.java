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

package org.stackml.ensemble.cache;

import java.io.IOException;
import java.io.Serializable;
import java.time.Duration;

/**
 * A write-once store for the fitted artifacts of a layer, shared by all tasks of a fit call.
 *
 * <p>Readers never observe a partially written entry: an entry is either absent or complete. Every
 * key is written by at most one task. Entries are never modified and are removed only when the
 * owner of the store discards it as a whole.
 */
public interface CacheStore {

    /**
     * Stores the given value.
     *
     * @throws IOException if the value cannot be written, or the key already has a value
     */
    void save(CacheKey key, Serializable value) throws IOException;

    /**
     * Loads the value stored under the given key.
     *
     * @throws CacheEntryNotFoundException if the key has no value
     */
    <T> T load(CacheKey key) throws IOException;

    /** Returns whether the given key has a value. */
    boolean contains(CacheKey key);

    /**
     * Blocks until the given key has a value or the timeout elapsed, checking at least once per
     * poll interval.
     *
     * @return {@link WaitResult#FOUND} if the key has a value, {@link WaitResult#TIMED_OUT}
     *     otherwise
     */
    WaitResult waitFor(CacheKey key, Duration pollInterval, Duration timeout)
            throws InterruptedException;
}

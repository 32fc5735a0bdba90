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

import org.apache.flink.util.Preconditions;

import org.stackml.ensemble.fault.FaultPolicy;
import org.stackml.ensemble.fault.ParallelProcessingException;
import org.stackml.ensemble.fault.ParallelProcessingWarning;
import org.stackml.ensemble.fault.WarningSink;

import javax.annotation.Nullable;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads cache entries that another task may still be producing.
 *
 * <p>A missing entry is waited for during one timeout period. If it is still missing afterwards,
 * the read fails right away when {@code raiseOnException} is set. Otherwise a {@link
 * ParallelProcessingWarning} is reported and a second period of the same length is granted, after
 * which the read fails.
 *
 * <p>Producers that fail report it through {@link #producerFailed}. Reads waiting for the entries
 * of a failed producer then fail within one poll interval, without a warning.
 */
public class AwaitingCacheReader {

    private final CacheStore store;
    private final Duration pollInterval;
    private final Duration timeout;
    private final WarningSink warningSink;

    /** Keys whose producer failed, mapped to the failure. */
    private final ConcurrentHashMap<CacheKey, Throwable> failedProducers =
            new ConcurrentHashMap<>();

    public AwaitingCacheReader(
            CacheStore store, Duration pollInterval, Duration timeout, WarningSink warningSink) {
        Preconditions.checkArgument(!pollInterval.isNegative() && !pollInterval.isZero());
        Preconditions.checkArgument(!timeout.isNegative() && !timeout.isZero());
        this.store = Preconditions.checkNotNull(store);
        this.pollInterval = pollInterval;
        this.timeout = timeout;
        this.warningSink = Preconditions.checkNotNull(warningSink);
    }

    /**
     * Waits for the entry of the given key and loads it.
     *
     * @param key the key to load
     * @param layerName the layer name used in messages, may be null
     * @param raiseOnException whether to fail after the first period instead of warning
     * @return the loaded value
     * @throws ParallelProcessingException if the entry did not appear in time, or its producer
     *     failed
     */
    public <T> T load(CacheKey key, @Nullable String layerName, boolean raiseOnException)
            throws IOException, InterruptedException {
        String prefix = FaultPolicy.messagePrefix(layerName, key.getCaseId());
        if (await(key, prefix) == WaitResult.TIMED_OUT) {
            if (raiseOnException) {
                throw new ParallelProcessingException(notFoundMessage(prefix, key, timeout));
            }

            warningSink.warn(
                    new ParallelProcessingWarning(
                            String.format(
                                    "%sCache entry %s not found after %d ms. Will check every "
                                            + "%d ms for another %d ms before aborting.",
                                    prefix,
                                    key,
                                    timeout.toMillis(),
                                    pollInterval.toMillis(),
                                    timeout.toMillis())));

            if (await(key, prefix) == WaitResult.TIMED_OUT) {
                throw new ParallelProcessingException(
                        notFoundMessage(prefix, key, timeout.multipliedBy(2)));
            }
        }
        return store.load(key);
    }

    /**
     * Records that the entry of the given key will never be saved. Pending and later reads of the
     * key fail with a {@link ParallelProcessingException} caused by the given failure.
     */
    public void producerFailed(CacheKey key, Throwable cause) {
        failedProducers.putIfAbsent(key, Preconditions.checkNotNull(cause));
    }

    private WaitResult await(CacheKey key, String prefix) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            Throwable failure = failedProducers.get(key);
            if (failure != null && !store.contains(key)) {
                throw new ParallelProcessingException(
                        String.format(
                                "%sCache entry %s will not be written, its producer failed.",
                                prefix, key),
                        failure);
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return WaitResult.TIMED_OUT;
            }
            Duration window = Duration.ofNanos(Math.min(remaining, pollInterval.toNanos()));
            if (store.waitFor(key, pollInterval, window) == WaitResult.FOUND) {
                return WaitResult.FOUND;
            }
        }
    }

    private static String notFoundMessage(String prefix, CacheKey key, Duration waited) {
        return String.format(
                "%sCache entry %s was not found after %d ms of waiting. Check that the "
                        + "preprocessing pipelines finish fitting before the estimators need "
                        + "them. Consider reducing the preprocessing load of the layer, or "
                        + "increasing the cache wait timeout.",
                prefix, key, waited.toMillis());
    }
}

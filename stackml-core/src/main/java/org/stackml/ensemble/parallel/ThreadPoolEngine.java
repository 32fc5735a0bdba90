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

import org.apache.flink.util.ExceptionUtils;
import org.apache.flink.util.ExecutorUtils;
import org.apache.flink.util.Preconditions;
import org.apache.flink.util.concurrent.ExecutorThreadFactory;
import org.apache.flink.util.function.ThrowingConsumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * A {@link ParallelEngine} backed by a fixed pool of worker threads.
 *
 * <p>Calls are queued in submission order, so calls submitted earlier start no later than calls
 * submitted after them. A failing call does not cancel the others; the engine waits for all of
 * them before rethrowing the first failure.
 */
public class ThreadPoolEngine implements ParallelEngine, AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(ThreadPoolEngine.class);

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 30L;

    private final int parallelism;
    private final ExecutorService executor;

    public ThreadPoolEngine(int parallelism) {
        Preconditions.checkArgument(parallelism > 0, "Parallelism must be positive.");
        this.parallelism = parallelism;
        this.executor =
                Executors.newFixedThreadPool(
                        parallelism, new ExecutorThreadFactory("stackml-worker"));
    }

    public int getParallelism() {
        return parallelism;
    }

    @Override
    public <T> void invokeAll(
            Iterable<T> arguments, ThrowingConsumer<? super T, ? extends Exception> call)
            throws Exception {
        List<Future<?>> futures = new ArrayList<>();
        for (T argument : arguments) {
            futures.add(
                    executor.submit(
                            () -> {
                                call.accept(argument);
                                return null;
                            }));
        }
        LOG.debug("Submitted {} call(s) to {} worker(s).", futures.size(), parallelism);

        Throwable failure = null;
        for (Future<?> future : futures) {
            try {
                future.get();
            } catch (ExecutionException e) {
                failure = ExceptionUtils.firstOrSuppressed(e.getCause(), failure);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw e;
            }
        }
        if (failure != null) {
            ExceptionUtils.rethrowException(failure);
        }
    }

    @Override
    public void close() {
        ExecutorUtils.gracefulShutdown(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS, executor);
    }
}

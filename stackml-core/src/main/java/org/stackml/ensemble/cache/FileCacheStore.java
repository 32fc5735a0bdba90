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

import org.apache.flink.annotation.VisibleForTesting;
import org.apache.flink.util.InstantiationUtil;
import org.apache.flink.util.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.Serializable;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * A {@link CacheStore} keeping every entry as one file in a directory.
 *
 * <p>Entries are serialized into a temporary file of the same directory and then moved to their
 * final name atomically. Waiters in the same process are woken as soon as the entry is saved
 * through this instance. Entries written by other processes or other instances are discovered by
 * checking the directory once per poll interval.
 */
public class FileCacheStore implements CacheStore {
    private static final Logger LOG = LoggerFactory.getLogger(FileCacheStore.class);

    private static final String TEMP_FILE_PREFIX = ".";
    private static final String TEMP_FILE_SUFFIX = ".tmp";

    private final Path directory;
    private final ClassLoader classLoader;

    /**
     * Count-down latches released when the entry of the key is saved. A latch is removed once its
     * entry exists.
     */
    private final ConcurrentHashMap<CacheKey, CountDownLatch> publications =
            new ConcurrentHashMap<>();

    public FileCacheStore(Path directory) throws IOException {
        this(directory, Thread.currentThread().getContextClassLoader());
    }

    public FileCacheStore(Path directory, ClassLoader classLoader) throws IOException {
        this.directory = Files.createDirectories(Preconditions.checkNotNull(directory));
        this.classLoader = Preconditions.checkNotNull(classLoader);
    }

    public Path getDirectory() {
        return directory;
    }

    /** Returns the file holding the entry of the given key. */
    public Path pathOf(CacheKey key) {
        return directory.resolve(key.fileName());
    }

    @Override
    public void save(CacheKey key, Serializable value) throws IOException {
        Path target = pathOf(key);
        if (Files.exists(target)) {
            throw new IOException("Cache entry " + key + " already exists at " + target + ".");
        }

        Path temp = Files.createTempFile(directory, TEMP_FILE_PREFIX, TEMP_FILE_SUFFIX);
        try {
            try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(temp))) {
                InstantiationUtil.serializeObject(out, value);
            }
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            Files.deleteIfExists(temp);
            throw e;
        }

        LOG.debug("Saved cache entry {} to {}.", key, target);
        CountDownLatch published = publications.remove(key);
        if (published != null) {
            published.countDown();
        }
    }

    @Override
    public <T> T load(CacheKey key) throws IOException {
        Path path = pathOf(key);
        try (InputStream in = new BufferedInputStream(Files.newInputStream(path))) {
            return InstantiationUtil.deserializeObject(in, classLoader);
        } catch (NoSuchFileException e) {
            throw new CacheEntryNotFoundException(key, path.toString());
        } catch (ClassNotFoundException e) {
            throw new IOException("Failed to deserialize cache entry " + key + ".", e);
        }
    }

    @Override
    public boolean contains(CacheKey key) {
        return Files.exists(pathOf(key));
    }

    @Override
    public WaitResult waitFor(CacheKey key, Duration pollInterval, Duration timeout)
            throws InterruptedException {
        Preconditions.checkArgument(!pollInterval.isNegative() && !pollInterval.isZero());
        long deadline = System.nanoTime() + timeout.toNanos();
        CountDownLatch published = publication(key);
        while (!contains(key)) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                LOG.trace("Timed out after {} waiting for cache entry {}.", timeout, key);
                return WaitResult.TIMED_OUT;
            }
            long waitNanos = Math.min(remaining, pollInterval.toNanos());
            if (published.getCount() > 0) {
                published.await(waitNanos, TimeUnit.NANOSECONDS);
            } else {
                TimeUnit.NANOSECONDS.sleep(waitNanos);
            }
        }
        publications.remove(key, published);
        return WaitResult.FOUND;
    }

    @VisibleForTesting
    int numPendingPublications() {
        return publications.size();
    }

    private CountDownLatch publication(CacheKey key) {
        return publications.computeIfAbsent(key, k -> new CountDownLatch(1));
    }
}

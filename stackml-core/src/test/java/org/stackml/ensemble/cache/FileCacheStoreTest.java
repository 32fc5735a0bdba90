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

import org.stackml.ensemble.task.CaseId;
import org.stackml.ensemble.task.InstanceId;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

/** Tests {@link FileCacheStore} and {@link CacheKey}. */
public class FileCacheStoreTest {
    @Rule public final TemporaryFolder tempFolder = new TemporaryFolder();

    private FileCacheStore store;

    @Before
    public void before() throws IOException {
        store = new FileCacheStore(tempFolder.newFolder().toPath());
    }

    @Test
    public void testFileNames() {
        assertEquals("a__t", CacheKey.transformers(CaseId.of("a")).fileName());
        assertEquals("default__t", CacheKey.transformers(CaseId.ABSENT).fileName());
        assertEquals("0__t", CacheKey.transformers(CaseId.ABSENT.forFold(0)).fileName());
        assertEquals(
                "a__1__mean__1__e",
                CacheKey.estimator(CaseId.of("a").forFold(1), InstanceId.of("mean").forFold(1))
                        .fileName());
        assertEquals(
                "default__mean__e",
                CacheKey.estimator(CaseId.ABSENT, InstanceId.of("mean")).fileName());
    }

    @Test
    public void testSaveAndLoad() throws Exception {
        CacheKey key = CacheKey.transformers(CaseId.of("a"));
        assertFalse(store.contains(key));

        store.save(key, new ArrayList<>(Arrays.asList("x", "y")));

        assertTrue(store.contains(key));
        assertTrue(store.pathOf(key).toFile().exists());
        ArrayList<String> loaded = store.load(key);
        assertEquals(Arrays.asList("x", "y"), loaded);

        // Only the entry itself remains in the directory.
        File[] files = store.getDirectory().toFile().listFiles();
        assertArrayEquals(new File[] {store.pathOf(key).toFile()}, files);
    }

    @Test
    public void testLoadMissingEntry() throws Exception {
        CacheKey key = CacheKey.estimator(CaseId.of("a"), InstanceId.of("mean"));
        try {
            store.load(key);
            Assert.fail("Expected CacheEntryNotFoundException");
        } catch (CacheEntryNotFoundException e) {
            assertEquals(key, e.getKey());
            assertTrue(e.getMessage().startsWith("Cache entry a__mean__e not found at "));
        }
    }

    @Test
    public void testEntriesAreWrittenOnce() throws Exception {
        CacheKey key = CacheKey.transformers(CaseId.of("a"));
        store.save(key, "first");
        try {
            store.save(key, "second");
            Assert.fail("Expected IOException");
        } catch (IOException e) {
            assertTrue(e.getMessage().startsWith("Cache entry a__t already exists"));
        }
        assertEquals("first", store.load(key));
    }

    @Test
    public void testWaitForTimesOut() throws Exception {
        CacheKey key = CacheKey.transformers(CaseId.of("a"));
        long start = System.currentTimeMillis();
        WaitResult result = store.waitFor(key, Duration.ofMillis(10), Duration.ofMillis(100));
        assertEquals(WaitResult.TIMED_OUT, result);
        assertTrue(System.currentTimeMillis() - start >= 100);
    }

    @Test
    public void testWaitForReturnsImmediatelyIfPresent() throws Exception {
        CacheKey key = CacheKey.transformers(CaseId.of("a"));
        store.save(key, "value");
        assertEquals(
                WaitResult.FOUND,
                store.waitFor(key, Duration.ofMillis(10), Duration.ofMillis(10)));
    }

    @Test
    public void testWaitForWakesUpOnSave() throws Exception {
        CacheKey key = CacheKey.transformers(CaseId.of("a"));
        Thread saver = delayedSave(store, key, 100);

        long start = System.currentTimeMillis();
        // The poll interval is far longer than the delay, so only the save can end the wait.
        WaitResult result = store.waitFor(key, Duration.ofSeconds(20), Duration.ofSeconds(30));
        saver.join();

        assertEquals(WaitResult.FOUND, result);
        assertTrue(System.currentTimeMillis() - start < 20_000);
        assertEquals("value", store.load(key));
        assertEquals(0, store.numPendingPublications());
    }

    @Test
    public void testPublicationsAreReleased() throws Exception {
        CacheKey first = CacheKey.transformers(CaseId.of("a"));
        CacheKey second = CacheKey.transformers(CaseId.of("b"));

        assertEquals(
                WaitResult.TIMED_OUT,
                store.waitFor(first, Duration.ofMillis(10), Duration.ofMillis(20)));
        assertEquals(1, store.numPendingPublications());
        store.save(first, "value");
        assertEquals(0, store.numPendingPublications());

        store.save(second, "value");
        assertEquals(
                WaitResult.FOUND,
                store.waitFor(second, Duration.ofMillis(10), Duration.ofMillis(20)));
        assertEquals(0, store.numPendingPublications());
    }

    @Test
    public void testWaitForDiscoversEntriesOfOtherStores() throws Exception {
        FileCacheStore other = new FileCacheStore(store.getDirectory());
        CacheKey key = CacheKey.estimator(CaseId.ABSENT, InstanceId.of("mean"));
        Thread saver = delayedSave(other, key, 100);

        WaitResult result = store.waitFor(key, Duration.ofMillis(20), Duration.ofSeconds(30));
        saver.join();

        assertEquals(WaitResult.FOUND, result);
        assertEquals("value", store.load(key));
    }

    static Thread delayedSave(CacheStore store, CacheKey key, long delayMs) {
        Thread thread =
                new Thread(
                        () -> {
                            try {
                                Thread.sleep(delayMs);
                                store.save(key, "value");
                            } catch (Exception e) {
                                throw new RuntimeException(e);
                            }
                        });
        thread.start();
        return thread;
    }
}

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

import org.stackml.ensemble.fault.CollectingWarningSink;
import org.stackml.ensemble.fault.ParallelProcessingException;
import org.stackml.ensemble.fault.ParallelProcessingWarning;
import org.stackml.ensemble.task.CaseId;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.stackml.ensemble.cache.FileCacheStoreTest.delayedSave;

/** Tests the two waiting periods of {@link AwaitingCacheReader}. */
public class AwaitingCacheReaderTest {
    @Rule public final TemporaryFolder tempFolder = new TemporaryFolder();

    private static final CacheKey KEY = CacheKey.transformers(CaseId.of("a"));

    private FileCacheStore store;
    private CollectingWarningSink warnings;

    @Before
    public void before() throws IOException {
        store = new FileCacheStore(tempFolder.newFolder().toPath());
        warnings = new CollectingWarningSink();
    }

    private AwaitingCacheReader reader(long timeoutMs) {
        return new AwaitingCacheReader(
                store, Duration.ofMillis(10), Duration.ofMillis(timeoutMs), warnings);
    }

    @Test
    public void testLoadPresentEntry() throws Exception {
        store.save(KEY, "value");
        String value = reader(100).load(KEY, "layer", true);
        assertEquals("value", value);
        assertTrue(warnings.getWarnings().isEmpty());
    }

    @Test
    public void testEntryAppearsWithinFirstPeriod() throws Exception {
        Thread saver = delayedSave(store, KEY, 50);
        String value = reader(5_000).load(KEY, "layer", true);
        saver.join();

        assertEquals("value", value);
        assertTrue(warnings.getWarnings().isEmpty());
    }

    @Test
    public void testRaiseAfterFirstPeriod() throws Exception {
        try {
            reader(100).load(KEY, "layer", true);
            Assert.fail("Expected ParallelProcessingException");
        } catch (ParallelProcessingException e) {
            assertTrue(
                    e.getMessage(),
                    e.getMessage()
                            .startsWith(
                                    "[layer | a] Cache entry a__t was not found after 100 ms"));
        }
        assertTrue(warnings.getWarnings().isEmpty());
    }

    @Test
    public void testWarnThenLoadInSecondPeriod() throws Exception {
        Thread saver = delayedSave(store, KEY, 750);
        String value = reader(500).load(KEY, null, false);
        saver.join();

        assertEquals("value", value);
        List<ParallelProcessingWarning> received =
                warnings.getWarnings(ParallelProcessingWarning.class);
        assertEquals(1, received.size());
        assertEquals(
                "[a] Cache entry a__t not found after 500 ms. Will check every 10 ms for another "
                        + "500 ms before aborting.",
                received.get(0).getMessage());
    }

    @Test
    public void testWarnThenFailAfterSecondPeriod() throws Exception {
        try {
            reader(50).load(KEY, null, false);
            Assert.fail("Expected ParallelProcessingException");
        } catch (ParallelProcessingException e) {
            assertTrue(
                    e.getMessage(),
                    e.getMessage().startsWith("[a] Cache entry a__t was not found after 100 ms"));
        }
        assertEquals(1, warnings.getWarnings(ParallelProcessingWarning.class).size());
    }

    @Test
    public void testStopWaitingWhenProducerFails() throws Exception {
        AwaitingCacheReader reader = reader(60_000);
        IllegalStateException failure = new IllegalStateException("broken pipeline");
        Thread producer =
                new Thread(
                        () -> {
                            try {
                                Thread.sleep(50);
                            } catch (InterruptedException e) {
                                Thread.currentThread().interrupt();
                            }
                            reader.producerFailed(KEY, failure);
                        });
        producer.start();

        long start = System.currentTimeMillis();
        try {
            reader.load(KEY, null, false);
            Assert.fail("Expected ParallelProcessingException");
        } catch (ParallelProcessingException e) {
            assertEquals(
                    "[a] Cache entry a__t will not be written, its producer failed.",
                    e.getMessage());
            assertSame(failure, e.getCause());
        }
        producer.join();

        assertTrue(System.currentTimeMillis() - start < 30_000);
        assertTrue(warnings.getWarnings().isEmpty());
    }

    @Test
    public void testProducerFailureOfOtherKey() throws Exception {
        AwaitingCacheReader reader = reader(5_000);
        reader.producerFailed(CacheKey.transformers(CaseId.of("b")), new IllegalStateException());
        store.save(KEY, "value");

        String value = reader.load(KEY, null, true);
        assertEquals("value", value);
    }
}

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

package org.stackml.ensemble.layer;

import org.stackml.cv.KFold;
import org.stackml.ensemble.ExampleStages.AddTransformer;
import org.stackml.ensemble.ExampleStages.MeanEstimator;
import org.stackml.ensemble.task.CaseId;
import org.stackml.ensemble.task.NamedInstance;

import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

/** Tests {@link Instances} and {@link LayerConfig}. */
public class LayerConfigTest {

    private static Instances cases(String... caseNames) {
        Map<String, List<NamedInstance>> cases = new HashMap<>();
        for (String caseName : caseNames) {
            cases.put(
                    caseName,
                    Collections.singletonList(NamedInstance.of("m", new MeanEstimator())));
        }
        return Instances.cases(cases);
    }

    @Test
    public void testCaseNamesAreSorted() {
        Instances instances = cases("c", "a", "b");
        assertTrue(instances.isPartitioned());
        assertEquals(Arrays.asList("a", "b", "c"), instances.caseNames());
        assertEquals(
                Arrays.asList(CaseId.of("a"), CaseId.of("b"), CaseId.of("c")),
                Arrays.asList(instances.caseIds().toArray()));
    }

    @Test
    public void testFlatInstances() {
        Instances instances = Instances.flat(NamedInstance.of("m", new MeanEstimator()));
        assertFalse(instances.isPartitioned());
        assertEquals(Collections.singletonList(null), instances.caseNames());
        assertEquals(1, instances.get(null).size());
        assertTrue(Instances.empty().isEmpty());
    }

    @Test
    public void testDuplicateNames() {
        try {
            Instances.flat(
                    NamedInstance.of("m", new MeanEstimator()),
                    NamedInstance.of("m", new MeanEstimator()));
            Assert.fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertEquals("Duplicate instance name 'm' in case null.", e.getMessage());
        }
    }

    @Test
    public void testInvalidNames() {
        try {
            NamedInstance.of("a__0", new MeanEstimator());
            Assert.fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertEquals(
                    "Instance name 'a__0' must be non-empty and must not contain '__'.",
                    e.getMessage());
        }

        try {
            cases("x__1");
            Assert.fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertEquals(
                    "Case name 'x__1' must be non-empty and must not contain '__'.",
                    e.getMessage());
        }
    }

    @Test
    public void testDefaultParams() {
        LayerConfig layer = new LayerConfig(cases("a"));
        assertNull(layer.getLayerName());
        assertTrue(layer.getRaiseOnException());
        assertEquals(0, layer.getVerbose());
        assertNull(layer.getFoldGenerator());
        assertFalse(layer.getPreprocessing().isPartitioned());
    }

    @Test
    public void testSetParams() {
        LayerConfig layer =
                new LayerConfig(
                                Instances.empty(),
                                Instances.flat(NamedInstance.of("m", new MeanEstimator())),
                                new KFold(3))
                        .setLayerName("layer-1")
                        .setRaiseOnException(false)
                        .setVerbose(2);
        assertEquals("layer-1", layer.getLayerName());
        assertFalse(layer.getRaiseOnException());
        assertEquals(2, layer.getVerbose());

        try {
            layer.setVerbose(-1);
            Assert.fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertEquals(
                    "Parameter verbose is given an invalid value -1, expected >= 0.",
                    e.getMessage());
        }
    }

    @Test
    public void testMismatchedShapes() {
        try {
            new LayerConfig(
                    Instances.flat(NamedInstance.of("t", new AddTransformer())), cases("a"), null);
            Assert.fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertEquals(
                    "Preprocessing and estimators must both be partitioned into cases or both be flat.",
                    e.getMessage());
        }

        Map<String, List<NamedInstance>> preprocessing = new HashMap<>();
        preprocessing.put("b", Collections.emptyList());
        try {
            new LayerConfig(Instances.cases(preprocessing), cases("a"), null);
            Assert.fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertEquals(
                    "Preprocessing cases [b] do not match estimator cases [a].", e.getMessage());
        }
    }

    @Test
    public void testCaseWithoutEstimators() {
        Map<String, List<NamedInstance>> estimators = new HashMap<>();
        estimators.put("a", Collections.emptyList());
        Map<String, List<NamedInstance>> preprocessing = new HashMap<>();
        preprocessing.put("a", Collections.emptyList());
        try {
            new LayerConfig(Instances.cases(preprocessing), Instances.cases(estimators), null);
            Assert.fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertEquals("Case a has no estimators.", e.getMessage());
        }
    }
}

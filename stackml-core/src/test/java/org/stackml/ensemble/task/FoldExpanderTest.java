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

package org.stackml.ensemble.task;

import org.stackml.api.core.Capability;
import org.stackml.cv.KFold;
import org.stackml.ensemble.ExampleStages.FirstFeatureEstimator;
import org.stackml.ensemble.ExampleStages.MeanEstimator;
import org.stackml.ensemble.ExampleStages.TransformOnlyStage;
import org.stackml.ensemble.layer.Instances;
import org.stackml.linalg.DenseMatrix;

import org.junit.Assert;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.stackml.ensemble.ExampleStages.rangeMatrix;

/** Tests {@link FoldExpander}. */
public class FoldExpanderTest {

    private static Instances partitionedEstimators() {
        Map<String, List<NamedInstance>> cases = new LinkedHashMap<>();
        cases.put(
                "b", Arrays.asList(NamedInstance.of("mean", new MeanEstimator())));
        cases.put(
                "a",
                Arrays.asList(
                        NamedInstance.of("mean", new MeanEstimator()),
                        NamedInstance.of("first", new FirstFeatureEstimator())));
        return Instances.cases(cases);
    }

    @Test
    public void testFlatWithoutFolds() {
        Instances estimators =
                Instances.flat(
                        NamedInstance.of("x", new MeanEstimator()),
                        NamedInstance.of("y", new MeanEstimator()));
        List<Task> tasks = FoldExpander.expand(estimators, null, null);

        assertEquals(1, tasks.size());
        Task task = tasks.get(0);
        assertEquals(CaseId.ABSENT, task.getCaseId());
        assertNull(task.getCaseId().displayName());
        assertTrue(task.isFullData());
        assertNull(task.getTrainRange());
        assertNull(task.getTestRange());
        assertEquals(2, task.getInstances().size());
        assertEquals("x", task.getInstances().get(0).getName());
        assertEquals("y", task.getInstances().get(1).getName());
    }

    @Test
    public void testFlatWithFolds() {
        Instances estimators =
                Instances.flat(
                        NamedInstance.of("x", new MeanEstimator()),
                        NamedInstance.of("y", new MeanEstimator()));
        List<Task> tasks = FoldExpander.expand(estimators, new KFold(2), rangeMatrix(4));

        assertEquals(3, tasks.size());
        assertTrue(tasks.get(0).isFullData());

        Task first = tasks.get(1);
        assertEquals("0", first.getCaseId().displayName());
        assertEquals(new RowRange(2, 4), first.getTrainRange());
        assertEquals(new RowRange(0, 2), first.getTestRange());
        assertEquals("x__0", first.getInstances().get(0).getName());
        assertEquals("y__0", first.getInstances().get(1).getName());

        Task second = tasks.get(2);
        assertEquals("1", second.getCaseId().displayName());
        assertEquals(new RowRange(0, 2), second.getTrainRange());
        assertEquals(new RowRange(2, 4), second.getTestRange());
        assertEquals("x__1", second.getInstances().get(0).getName());
    }

    @Test
    public void testPartitionedTaskCount() {
        Instances estimators = partitionedEstimators();
        int numFolds = 3;
        List<Task> tasks =
                FoldExpander.expand(estimators, new KFold(numFolds), rangeMatrix(6));

        // one full-data task per case, then one task per case and fold
        assertEquals(2 + 2 * numFolds, tasks.size());

        List<String> caseNames = new ArrayList<>();
        for (Task task : tasks) {
            caseNames.add(task.getCaseId().displayName());
        }
        assertEquals(
                Arrays.asList("a", "b", "a__0", "a__1", "a__2", "b__0", "b__1", "b__2"),
                caseNames);

        Task foldTask = tasks.get(3);
        assertEquals("a", foldTask.getCaseId().getBaseName());
        assertEquals(1, (int) foldTask.getCaseId().getFoldIndex());
        assertEquals("mean__1", foldTask.getInstances().get(0).getName());
        assertEquals("first__1", foldTask.getInstances().get(1).getName());
    }

    @Test
    public void testTasksHoldIndependentCopies() {
        MeanEstimator estimator = new MeanEstimator();
        Instances estimators = Instances.flat(NamedInstance.of("mean", estimator));
        List<Task> tasks = FoldExpander.expand(estimators, new KFold(2), rangeMatrix(4));

        Set<Object> stages = new HashSet<>();
        for (Task task : tasks) {
            Object stage = task.getInstances().get(0).getStage();
            assertNotSame(estimator, stage);
            stages.add(stage);
        }
        assertEquals(tasks.size(), stages.size());

        ((MeanEstimator) tasks.get(1).getInstances().get(0).getStage()).mean = 5.0;
        assertEquals(0.0, estimator.mean, 0.0);
    }

    @Test
    public void testDeterministicOrder() {
        DenseMatrix x = rangeMatrix(6);
        List<Task> first = FoldExpander.expand(partitionedEstimators(), new KFold(3), x);
        List<Task> second = FoldExpander.expand(partitionedEstimators(), new KFold(3), x);
        assertEquals(first.size(), second.size());
        for (int i = 0; i < first.size(); i++) {
            assertEquals(first.get(i).getCaseId(), second.get(i).getCaseId());
            assertEquals(first.get(i).getTestRange(), second.get(i).getTestRange());
        }
    }

    @Test
    public void testMissingCapability() {
        Instances estimators = Instances.flat(NamedInstance.of("t", new TransformOnlyStage()));
        try {
            FoldExpander.expand(estimators, null, null, Capability.FITTABLE);
            Assert.fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertEquals(
                    "Instance 't' of type "
                            + TransformOnlyStage.class.getName()
                            + " does not support FITTABLE, which is required here.",
                    e.getMessage());
        }
    }

    @Test
    public void testFoldsRequireData() {
        Instances estimators = Instances.flat(NamedInstance.of("mean", new MeanEstimator()));
        try {
            FoldExpander.expand(estimators, new KFold(2), null);
            Assert.fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertEquals("Splitting into folds requires the training data.", e.getMessage());
        }
    }
}

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

import org.apache.flink.util.Preconditions;

import org.stackml.api.core.Capability;
import org.stackml.api.cv.Fold;
import org.stackml.api.cv.FoldGenerator;
import org.stackml.ensemble.layer.Instances;
import org.stackml.linalg.Matrix;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Expands the instances of a layer into fit tasks.
 *
 * <p>Every case yields one full-data task holding fresh copies of its instances under their
 * declared names. With a fold generator, every fold of every case additionally yields a fold task
 * whose case and instances carry the fold index. The emitted order is all full-data tasks in case
 * order, followed by the fold tasks of each case in case order and then in the fold order of the
 * generator. Column assignment and result assembly rely on this order.
 */
public class FoldExpander {
    private static final Logger LOG = LoggerFactory.getLogger(FoldExpander.class);

    /**
     * Builds the task list.
     *
     * @param instances the instances to expand
     * @param foldGenerator the fold generator, or null to build full-data tasks only
     * @param x the training data the fold generator splits
     * @param required capabilities every instance must implement
     * @return the tasks in deterministic order
     * @throws IllegalArgumentException if an instance lacks one of the required capabilities
     */
    public static List<Task> expand(
            Instances instances,
            @Nullable FoldGenerator foldGenerator,
            @Nullable Matrix x,
            Capability... required) {
        for (String caseName : instances.caseNames()) {
            for (NamedInstance instance : instances.get(caseName)) {
                String name =
                        caseName == null
                                ? instance.getName()
                                : caseName + "/" + instance.getName();
                Capability.checkSupported(instance.getStage(), name, required);
            }
        }

        List<Task> tasks = new ArrayList<>();
        for (String caseName : instances.caseNames()) {
            List<NamedInstance> copies = new ArrayList<>();
            for (NamedInstance instance : instances.get(caseName)) {
                copies.add(instance.copy());
            }
            tasks.add(new Task(CaseId.of(caseName), null, null, copies));
        }

        if (foldGenerator == null) {
            return tasks;
        }

        Preconditions.checkArgument(
                x != null, "Splitting into folds requires the training data.");
        List<Fold> folds = foldGenerator.split(x);
        for (String caseName : instances.caseNames()) {
            CaseId caseId = CaseId.of(caseName);
            for (int i = 0; i < folds.size(); i++) {
                Fold fold = folds.get(i);
                List<NamedInstance> copies = new ArrayList<>();
                for (NamedInstance instance : instances.get(caseName)) {
                    copies.add(instance.copyForFold(i));
                }
                tasks.add(
                        new Task(
                                caseId.forFold(i),
                                RowRange.spanOf(fold.getTrainIndices()),
                                RowRange.spanOf(fold.getTestIndices()),
                                copies));
            }
        }
        LOG.debug(
                "Expanded {} case(s) over {} fold(s) into {} task(s).",
                instances.caseNames().size(),
                folds.size(),
                tasks.size());
        return tasks;
    }
}

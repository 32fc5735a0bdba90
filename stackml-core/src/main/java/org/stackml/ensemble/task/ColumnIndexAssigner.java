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

import org.stackml.ensemble.layer.Instances;

import javax.annotation.Nullable;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Assigns every estimator of a layer the prediction column it writes to. */
public class ColumnIndexAssigner {

    /**
     * Builds the column map of a layer.
     *
     * <p>The full-data estimators are numbered consecutively from 0, in sorted case order and
     * within a case in declared order. Flat layers have the absent case only. Every estimator of a
     * fold task then receives the column of the full-data estimator it was copied from.
     *
     * @param preprocessing the preprocessing of the layer, deciding its cases. May be null for a
     *     flat layer.
     * @param estimators the estimators of the layer
     * @param estimatorTasks the tasks built from the estimators by {@link FoldExpander}
     * @return the column map
     */
    public static ColumnMap assign(
            @Nullable Instances preprocessing,
            Instances estimators,
            List<Task> estimatorTasks) {
        Instances cases = preprocessing == null ? estimators : preprocessing;
        Preconditions.checkArgument(
                cases.isPartitioned() == estimators.isPartitioned(),
                "Preprocessing and estimators must both be partitioned into cases or both be flat.");
        List<String> caseNames = cases.caseNames();

        Map<ColumnKey, Integer> base = new LinkedHashMap<>();
        Set<CaseId> baseCases = new HashSet<>();
        int column = 0;
        for (String caseName : caseNames) {
            CaseId caseId = CaseId.of(caseName);
            baseCases.add(caseId);
            for (NamedInstance instance : estimators.get(caseName)) {
                base.put(new ColumnKey(caseId, instance.getId()), column++);
            }
        }

        Map<ColumnKey, Integer> all = new LinkedHashMap<>(base);
        for (Task task : estimatorTasks) {
            if (baseCases.contains(task.getCaseId())) {
                // Full-data tasks own their columns already.
                continue;
            }
            for (NamedInstance instance : task.getInstances()) {
                ColumnKey key = new ColumnKey(task.getCaseId(), instance.getId());
                Integer parentColumn = base.get(key.parent());
                Preconditions.checkState(
                        parentColumn != null, "Estimator %s has no full-data estimator.", key);
                all.put(key, parentColumn);
            }
        }
        return new ColumnMap(base, all);
    }
}

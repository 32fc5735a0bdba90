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

import javax.annotation.Nullable;

import java.util.Collections;
import java.util.List;

/**
 * A unit of fitting work: the instances of one case, to be fitted on the rows of the training
 * range and, for fold tasks, evaluated on the rows of the test range.
 *
 * <p>A full-data task has neither range and fits on all rows without held-out predictions.
 */
public final class Task {

    private final CaseId caseId;
    @Nullable private final RowRange trainRange;
    @Nullable private final RowRange testRange;
    private final List<NamedInstance> instances;

    public Task(
            CaseId caseId,
            @Nullable RowRange trainRange,
            @Nullable RowRange testRange,
            List<NamedInstance> instances) {
        Preconditions.checkArgument(
                (trainRange == null) == (testRange == null),
                "Train and test ranges must both be present or both be absent.");
        Preconditions.checkArgument(
                caseId.isFoldVariant() == (trainRange != null),
                "Only fold tasks carry row ranges.");
        this.caseId = caseId;
        this.trainRange = trainRange;
        this.testRange = testRange;
        this.instances = Collections.unmodifiableList(instances);
    }

    public CaseId getCaseId() {
        return caseId;
    }

    @Nullable
    public RowRange getTrainRange() {
        return trainRange;
    }

    @Nullable
    public RowRange getTestRange() {
        return testRange;
    }

    public List<NamedInstance> getInstances() {
        return instances;
    }

    public boolean isFullData() {
        return trainRange == null;
    }

    @Override
    public String toString() {
        return "Task{case="
                + caseId
                + ", train="
                + trainRange
                + ", test="
                + testRange
                + ", instances="
                + instances
                + '}';
    }
}

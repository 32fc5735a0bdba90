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

package org.stackml.ensemble.fit;

import org.apache.flink.util.Preconditions;

import org.stackml.api.core.Stage;
import org.stackml.ensemble.task.CaseId;
import org.stackml.ensemble.task.InstanceId;
import org.stackml.ensemble.task.NamedInstance;
import org.stackml.ensemble.task.RowRange;

import javax.annotation.Nullable;

import java.io.Serializable;

/**
 * A fitted estimator together with where its predictions go: the prediction column and, for fold
 * estimators, the rows it predicted during fitting.
 *
 * <p>An estimator that failed to fit is kept as a dropped bundle without an estimator, so that
 * every estimator task leaves exactly one cache entry.
 */
public final class FittedEstimator implements Serializable {
    private static final long serialVersionUID = 1L;

    private final CaseId caseId;
    private final InstanceId instanceId;
    @Nullable private final Stage<?> estimator;
    @Nullable private final RowRange testRange;
    private final int column;

    public FittedEstimator(
            CaseId caseId,
            InstanceId instanceId,
            @Nullable Stage<?> estimator,
            @Nullable RowRange testRange,
            int column) {
        Preconditions.checkArgument(column >= 0, "Column must be non-negative.");
        this.caseId = Preconditions.checkNotNull(caseId);
        this.instanceId = Preconditions.checkNotNull(instanceId);
        this.estimator = estimator;
        this.testRange = testRange;
        this.column = column;
    }

    /** Creates the bundle of an estimator that failed to fit. */
    public static FittedEstimator dropped(
            CaseId caseId, InstanceId instanceId, @Nullable RowRange testRange, int column) {
        return new FittedEstimator(caseId, instanceId, null, testRange, column);
    }

    public CaseId getCaseId() {
        return caseId;
    }

    public InstanceId getInstanceId() {
        return instanceId;
    }

    /** Returns the fitted estimator, or null if it was dropped. */
    @Nullable
    public Stage<?> getEstimator() {
        return estimator;
    }

    public boolean isDropped() {
        return estimator == null;
    }

    @Nullable
    public RowRange getTestRange() {
        return testRange;
    }

    public int getColumn() {
        return column;
    }

    NamedInstance asNamedInstance() {
        Preconditions.checkState(estimator != null, "Estimator %s was dropped.", instanceId);
        return new NamedInstance(instanceId, estimator);
    }

    @Override
    public String toString() {
        return "FittedEstimator{case="
                + caseId
                + ", instance="
                + instanceId
                + ", estimator="
                + (estimator == null ? "dropped" : estimator.getClass().getSimpleName())
                + ", testRange="
                + testRange
                + ", column="
                + column
                + '}';
    }
}

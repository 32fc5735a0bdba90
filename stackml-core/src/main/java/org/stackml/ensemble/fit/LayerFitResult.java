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

import org.stackml.ensemble.task.CaseId;
import org.stackml.ensemble.task.ColumnMap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The artifacts of a fitted layer, read back from the cache in task order. Both the full-data and
 * the fold artifacts are included. Dropped estimators are left out.
 */
public final class LayerFitResult {

    private final List<FittedTransformers> transformers;
    private final List<FittedEstimator> estimators;
    private final ColumnMap columnMap;

    public LayerFitResult(
            List<FittedTransformers> transformers,
            List<FittedEstimator> estimators,
            ColumnMap columnMap) {
        this.transformers = Collections.unmodifiableList(new ArrayList<>(transformers));
        this.estimators = Collections.unmodifiableList(new ArrayList<>(estimators));
        this.columnMap = columnMap;
    }

    public List<FittedTransformers> getTransformers() {
        return transformers;
    }

    public List<FittedEstimator> getEstimators() {
        return estimators;
    }

    /** Returns the estimators fitted in the given case or fold. */
    public List<FittedEstimator> getEstimators(CaseId caseId) {
        List<FittedEstimator> result = new ArrayList<>();
        for (FittedEstimator estimator : estimators) {
            if (estimator.getCaseId().equals(caseId)) {
                result.add(estimator);
            }
        }
        return result;
    }

    public ColumnMap getColumnMap() {
        return columnMap;
    }
}

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

import org.stackml.api.core.Stage;
import org.stackml.ensemble.cache.CacheKey;
import org.stackml.ensemble.fault.FaultPolicy;
import org.stackml.ensemble.task.CaseId;
import org.stackml.ensemble.task.NamedInstance;
import org.stackml.ensemble.task.RowRange;
import org.stackml.ensemble.task.Task;
import org.stackml.linalg.DenseVector;
import org.stackml.linalg.Matrix;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fits one estimator of a task on the preprocessed training rows. Fold estimators also predict
 * their test rows into their column of the prediction matrix. The fitted estimator is cached.
 *
 * <p>The fitted pipeline of the case is read from the cache, waiting for it if the transformer job
 * of the case has not finished yet.
 */
class EstimatorFitJob implements FitJob {
    private static final Logger LOG = LoggerFactory.getLogger(EstimatorFitJob.class);

    private final LayerFitContext context;
    private final Task task;
    private final NamedInstance estimator;
    private final int column;

    EstimatorFitJob(LayerFitContext context, Task task, NamedInstance estimator, int column) {
        this.context = context;
        this.task = task;
        this.estimator = estimator;
        this.column = column;
    }

    @Override
    public void run() throws Exception {
        CaseId caseId = task.getCaseId();
        FaultPolicy faultPolicy = context.faultPolicy;
        Matrix x = DataSlices.rows(context.x, task.getTrainRange());
        DenseVector y = DataSlices.rows(context.y, task.getTrainRange());

        FittedTransformers pipeline =
                context.cacheReader.load(
                        CacheKey.transformers(caseId),
                        faultPolicy.getLayerName(),
                        faultPolicy.isRaiseOnException());
        x = faultPolicy.transformAll(x, pipeline.getTransformers(), caseId);

        CacheKey key = CacheKey.estimator(caseId, estimator.getId());
        RowRange testRange = task.getTestRange();
        Stage<?> fitted = faultPolicy.fitEstimator(x, y, estimator, caseId);
        if (fitted == null) {
            context.cache.save(
                    key, FittedEstimator.dropped(caseId, estimator.getId(), testRange, column));
            return;
        }

        if (testRange != null) {
            Matrix test = DataSlices.rows(context.x, testRange);
            test = faultPolicy.transformAll(test, pipeline.getTransformers(), caseId);
            DenseVector prediction =
                    faultPolicy.predict(
                            test, new NamedInstance(estimator.getId(), fitted), caseId);
            if (prediction != null) {
                context.predictions.setColumn(column, testRange.getStart(), prediction);
            }
        }

        context.cache.save(
                key, new FittedEstimator(caseId, estimator.getId(), fitted, testRange, column));
        LOG.debug("Fitted estimator {} of case {} into column {}.", estimator, caseId, column);
    }

    @Override
    public String toString() {
        return "EstimatorFitJob{case=" + task.getCaseId() + ", estimator=" + estimator + '}';
    }
}

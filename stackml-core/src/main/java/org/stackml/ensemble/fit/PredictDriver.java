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

import org.stackml.ensemble.cache.CacheKey;
import org.stackml.ensemble.cache.CacheStore;
import org.stackml.ensemble.fault.FaultPolicy;
import org.stackml.ensemble.fault.LoggingWarningSink;
import org.stackml.ensemble.fault.WarningSink;
import org.stackml.ensemble.layer.Instances;
import org.stackml.ensemble.layer.LayerConfig;
import org.stackml.ensemble.parallel.ParallelEngine;
import org.stackml.ensemble.task.CaseId;
import org.stackml.ensemble.task.NamedInstance;
import org.stackml.linalg.DenseMatrix;
import org.stackml.linalg.DenseVector;
import org.stackml.linalg.Matrix;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Predicts with a fitted layer on new data.
 *
 * <p>Only the full-data artifacts are used. Fold artifacts are stripped, dropped estimators are
 * skipped and their columns keep their previous values. Every estimator writes the whole of its
 * column, so predicting twice on the same input yields the same matrix.
 */
public class PredictDriver {
    private static final Logger LOG = LoggerFactory.getLogger(PredictDriver.class);

    private final WarningSink warningSink;

    public PredictDriver() {
        this(new LoggingWarningSink());
    }

    public PredictDriver(WarningSink warningSink) {
        this.warningSink = Preconditions.checkNotNull(warningSink);
    }

    /** Predicts with the full-data artifacts the given cache holds for the layer. */
    public void predict(
            LayerConfig layer,
            Matrix x,
            DenseMatrix predictions,
            CacheStore cache,
            ParallelEngine engine)
            throws Exception {
        List<FittedTransformers> transformers = new ArrayList<>();
        for (String caseName : layer.getPreprocessing().caseNames()) {
            transformers.add(cache.load(CacheKey.transformers(CaseId.of(caseName))));
        }

        Instances estimatorInstances = layer.getEstimators();
        List<FittedEstimator> estimators = new ArrayList<>();
        for (String caseName : estimatorInstances.caseNames()) {
            for (NamedInstance estimator : estimatorInstances.get(caseName)) {
                FittedEstimator fitted =
                        cache.load(CacheKey.estimator(CaseId.of(caseName), estimator.getId()));
                if (!fitted.isDropped()) {
                    estimators.add(fitted);
                }
            }
        }
        predict(layer, transformers, estimators, x, predictions, engine);
    }

    /** Predicts with the artifacts of a previous {@link FitDriver#fit} call. */
    public void predict(
            LayerConfig layer,
            LayerFitResult fitResult,
            Matrix x,
            DenseMatrix predictions,
            ParallelEngine engine)
            throws Exception {
        predict(
                layer,
                fitResult.getTransformers(),
                fitResult.getEstimators(),
                x,
                predictions,
                engine);
    }

    private void predict(
            LayerConfig layer,
            List<FittedTransformers> transformers,
            List<FittedEstimator> estimators,
            Matrix x,
            DenseMatrix predictions,
            ParallelEngine engine)
            throws Exception {
        long start = System.currentTimeMillis();
        String prefix = FaultPolicy.messagePrefix(layer.getLayerName(), null);
        Set<CaseId> cases = layer.getEstimators().caseIds();

        Map<CaseId, List<NamedInstance>> pipelines = new HashMap<>();
        for (FittedTransformers fitted : transformers) {
            if (cases.contains(fitted.getCaseId())) {
                pipelines.put(fitted.getCaseId(), fitted.getTransformers());
            }
        }
        List<FittedEstimator> retained = new ArrayList<>();
        int numColumns = 0;
        for (FittedEstimator fitted : estimators) {
            if (cases.contains(fitted.getCaseId()) && !fitted.isDropped()) {
                retained.add(fitted);
                numColumns = Math.max(numColumns, fitted.getColumn() + 1);
            }
        }
        Preconditions.checkArgument(
                predictions.numRows() == x.numRows() && predictions.numCols() >= numColumns,
                "%sThe prediction matrix must be of shape (%s, >= %s), got (%s, %s).",
                prefix,
                x.numRows(),
                numColumns,
                predictions.numRows(),
                predictions.numCols());

        FaultPolicy faultPolicy =
                new FaultPolicy(layer.getLayerName(), layer.getRaiseOnException(), warningSink);
        engine.invokeAll(
                retained,
                estimator -> {
                    CaseId caseId = estimator.getCaseId();
                    List<NamedInstance> pipeline = pipelines.get(caseId);
                    Preconditions.checkState(
                            pipeline != null, "%sNo fitted pipeline for case %s.", prefix, caseId);
                    // Estimators of a case run concurrently, each on its own pipeline copy.
                    List<NamedInstance> pipelineCopy = new ArrayList<>(pipeline.size());
                    for (NamedInstance transformer : pipeline) {
                        pipelineCopy.add(transformer.copy());
                    }
                    Matrix transformed = faultPolicy.transformAll(x, pipelineCopy, caseId);
                    DenseVector prediction =
                            faultPolicy.predict(transformed, estimator.asNamedInstance(), caseId);
                    if (prediction != null) {
                        predictions.setColumn(estimator.getColumn(), 0, prediction);
                    }
                });

        if (layer.getVerbose() > 0) {
            LOG.info(
                    "{}Predicted with {} estimator(s) in {} ms.",
                    prefix,
                    retained.size(),
                    System.currentTimeMillis() - start);
        }
    }
}

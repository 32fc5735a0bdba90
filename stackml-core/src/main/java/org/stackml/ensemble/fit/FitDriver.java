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

import org.stackml.api.core.Capability;
import org.stackml.api.cv.FoldGenerator;
import org.stackml.ensemble.cache.AwaitingCacheReader;
import org.stackml.ensemble.cache.CacheKey;
import org.stackml.ensemble.cache.CacheStore;
import org.stackml.ensemble.fault.FaultPolicy;
import org.stackml.ensemble.fault.LoggingWarningSink;
import org.stackml.ensemble.fault.WarningSink;
import org.stackml.ensemble.layer.LayerConfig;
import org.stackml.ensemble.parallel.ParallelEngine;
import org.stackml.ensemble.param.HasCachePollIntervalMs;
import org.stackml.ensemble.param.HasCacheWaitTimeoutMs;
import org.stackml.ensemble.param.HasExecutionMode;
import org.stackml.ensemble.task.ColumnIndexAssigner;
import org.stackml.ensemble.task.ColumnMap;
import org.stackml.ensemble.task.FoldExpander;
import org.stackml.ensemble.task.NamedInstance;
import org.stackml.ensemble.task.Task;
import org.stackml.linalg.DenseMatrix;
import org.stackml.linalg.DenseVector;
import org.stackml.linalg.Matrix;
import org.stackml.param.Param;
import org.stackml.util.ParamUtils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Fits one ensemble layer.
 *
 * <p>The preprocessing pipelines and estimators of the layer are expanded into full-data and fold
 * tasks. Every pipeline task fits its transformers on its training rows and caches them. Every
 * estimator task loads the pipeline of its case from the cache, fits a copy of the estimator and
 * caches it. Fold estimators additionally write their out-of-fold predictions into the prediction
 * matrix, at the column assigned to their full-data counterpart.
 *
 * <p>In {@link #STAGED_MODE} the pipelines and the estimators are submitted in two consecutive
 * parallel calls. In {@link #COMBINED_MODE} both are submitted in a single call, pipelines first,
 * and estimators wait for the pipelines they need. See {@link AwaitingCacheReader}.
 *
 * <p>After fitting, the artifacts are read back from the cache in task order.
 */
public class FitDriver
        implements HasExecutionMode<FitDriver>,
                HasCachePollIntervalMs<FitDriver>,
                HasCacheWaitTimeoutMs<FitDriver> {
    private static final Logger LOG = LoggerFactory.getLogger(FitDriver.class);

    private final Map<Param<?>, Object> paramMap = new HashMap<>();

    private final WarningSink warningSink;

    public FitDriver() {
        this(new LoggingWarningSink());
    }

    public FitDriver(WarningSink warningSink) {
        this.warningSink = Preconditions.checkNotNull(warningSink);
        ParamUtils.initializeMapWithDefaultValues(paramMap, this);
    }

    /**
     * Fits the layer on the given data.
     *
     * @param layer the layer to fit
     * @param x the layer input
     * @param y the targets, one per row of {@code x}
     * @param predictions the matrix receiving the out-of-fold predictions. It must have as many
     *     rows as {@code x} and at least one column per full-data estimator.
     * @param cache the cache the fitted artifacts are written to. It must not hold entries of a
     *     previous fit of the same layer.
     * @param engine the engine running the tasks
     * @return the fitted artifacts of the layer
     */
    public LayerFitResult fit(
            LayerConfig layer,
            Matrix x,
            DenseVector y,
            DenseMatrix predictions,
            CacheStore cache,
            ParallelEngine engine)
            throws Exception {
        Preconditions.checkArgument(
                y.size() == x.numRows(),
                "Expected %s targets, got %s.",
                x.numRows(),
                y.size());
        long start = System.currentTimeMillis();
        String prefix = FaultPolicy.messagePrefix(layer.getLayerName(), null);

        FoldGenerator foldGenerator = layer.getFoldGenerator();
        List<Task> estimatorTasks =
                FoldExpander.expand(
                        layer.getEstimators(),
                        foldGenerator,
                        x,
                        Capability.FITTABLE,
                        Capability.PREDICTABLE);
        List<Task> preprocessingTasks =
                FoldExpander.expand(
                        layer.getPreprocessing(),
                        foldGenerator,
                        x,
                        Capability.FITTABLE,
                        Capability.TRANSFORMABLE);
        ColumnMap columnMap =
                ColumnIndexAssigner.assign(
                        layer.getPreprocessing(), layer.getEstimators(), estimatorTasks);
        Preconditions.checkArgument(
                predictions.numRows() == x.numRows()
                        && predictions.numCols() >= columnMap.numColumns(),
                "%sThe prediction matrix must be of shape (%s, >= %s), got (%s, %s).",
                prefix,
                x.numRows(),
                columnMap.numColumns(),
                predictions.numRows(),
                predictions.numCols());

        FaultPolicy faultPolicy =
                new FaultPolicy(layer.getLayerName(), layer.getRaiseOnException(), warningSink);
        AwaitingCacheReader cacheReader =
                new AwaitingCacheReader(
                        cache,
                        Duration.ofMillis(getCachePollIntervalMs()),
                        Duration.ofMillis(getCacheWaitTimeoutMs()),
                        warningSink);
        LayerFitContext context =
                new LayerFitContext(x, y, predictions, cache, cacheReader, faultPolicy);

        List<FitJob> preprocessingJobs = new ArrayList<>(preprocessingTasks.size());
        for (Task task : preprocessingTasks) {
            preprocessingJobs.add(new TransformerFitJob(context, task));
        }
        List<FitJob> estimatorJobs = new ArrayList<>();
        for (Task task : estimatorTasks) {
            for (NamedInstance estimator : task.getInstances()) {
                int column = columnMap.get(task.getCaseId(), estimator.getId());
                estimatorJobs.add(new EstimatorFitJob(context, task, estimator, column));
            }
        }

        logProgress(
                layer,
                "{}Fitting {} preprocessing pipeline(s) and {} estimator(s) in {} mode.",
                prefix,
                preprocessingJobs.size(),
                estimatorJobs.size(),
                getExecutionMode());

        if (COMBINED_MODE.equals(getExecutionMode())) {
            List<FitJob> jobs = new ArrayList<>(preprocessingJobs);
            jobs.addAll(estimatorJobs);
            engine.invokeAll(jobs, FitJob::run);
        } else {
            engine.invokeAll(preprocessingJobs, FitJob::run);
            logProgress(
                    layer,
                    "{}Preprocessing done after {} ms.",
                    prefix,
                    System.currentTimeMillis() - start);
            engine.invokeAll(estimatorJobs, FitJob::run);
        }

        LayerFitResult result = assemble(preprocessingTasks, estimatorTasks, columnMap, cache);
        logProgress(
                layer,
                "{}Fitted {} transformer pipeline(s) and {} estimator(s) in {} ms.",
                prefix,
                result.getTransformers().size(),
                result.getEstimators().size(),
                System.currentTimeMillis() - start);
        return result;
    }

    private static LayerFitResult assemble(
            List<Task> preprocessingTasks,
            List<Task> estimatorTasks,
            ColumnMap columnMap,
            CacheStore cache)
            throws Exception {
        List<FittedTransformers> transformers = new ArrayList<>(preprocessingTasks.size());
        for (Task task : preprocessingTasks) {
            transformers.add(cache.load(CacheKey.transformers(task.getCaseId())));
        }

        List<FittedEstimator> estimators = new ArrayList<>();
        for (Task task : estimatorTasks) {
            for (NamedInstance estimator : task.getInstances()) {
                FittedEstimator fitted =
                        cache.load(CacheKey.estimator(task.getCaseId(), estimator.getId()));
                if (!fitted.isDropped()) {
                    estimators.add(fitted);
                }
            }
        }
        return new LayerFitResult(transformers, estimators, columnMap);
    }

    private static void logProgress(LayerConfig layer, String message, Object... args) {
        if (layer.getVerbose() > 0) {
            LOG.info(message, args);
        } else {
            LOG.debug(message, args);
        }
    }

    @Override
    public Map<Param<?>, Object> getParamMap() {
        return paramMap;
    }
}

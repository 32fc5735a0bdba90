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

package org.stackml.ensemble.fault;

import org.apache.flink.util.Preconditions;

import org.stackml.api.core.Fittable;
import org.stackml.api.core.Predictable;
import org.stackml.api.core.Stage;
import org.stackml.api.core.Transformable;
import org.stackml.ensemble.task.CaseId;
import org.stackml.ensemble.task.NamedInstance;
import org.stackml.linalg.DenseVector;
import org.stackml.linalg.Matrix;

import javax.annotation.Nullable;

import java.util.List;

/**
 * Runs the fit, transform and predict calls of a layer and decides how their failures surface.
 *
 * <p>Transformer failures are always fatal, as every estimator of the case consumes the broken
 * pipeline. Estimator failures abort the call if {@code raiseOnException} is set. Otherwise they
 * are reported to the {@link WarningSink} and the estimator is dropped, or its predictions are
 * left at zero.
 *
 * <p>Every message starts with a prefix naming the layer and the case.
 */
public class FaultPolicy {

    @Nullable private final String layerName;
    private final boolean raiseOnException;
    private final WarningSink warningSink;

    public FaultPolicy(
            @Nullable String layerName, boolean raiseOnException, WarningSink warningSink) {
        this.layerName = layerName;
        this.raiseOnException = raiseOnException;
        this.warningSink = Preconditions.checkNotNull(warningSink);
    }

    @Nullable
    public String getLayerName() {
        return layerName;
    }

    public boolean isRaiseOnException() {
        return raiseOnException;
    }

    /** Fits a transformer. Failures always throw. */
    public Stage<?> fitTransformer(
            Matrix x, DenseVector y, NamedInstance transformer, CaseId caseId) {
        try {
            return checkFitted(((Fittable<?>) transformer.getStage()).fit(x, y));
        } catch (Exception e) {
            throw new FitFailedException(
                    String.format(
                            "%sFitting transformer [%s] failed: %s",
                            messagePrefix(layerName, caseId), transformer.getName(), e),
                    e);
        }
    }

    /** Transforms the input with one transformer. Failures always throw. */
    public Matrix transform(Matrix x, NamedInstance transformer, CaseId caseId) {
        Stage<?> stage = transformer.getStage();
        try {
            return ((Transformable<?>) stage).transform(x);
        } catch (Exception e) {
            throw new FitFailedException(
                    String.format(
                            "%sTransformation with transformer [%s] of type (%s) failed: %s",
                            messagePrefix(layerName, caseId),
                            transformer.getName(),
                            stage.getClass().getName(),
                            e),
                    e);
        }
    }

    /** Runs the input through the given transformers in order. Failures always throw. */
    public Matrix transformAll(Matrix x, List<NamedInstance> transformers, CaseId caseId) {
        for (NamedInstance transformer : transformers) {
            x = transform(x, transformer, caseId);
        }
        return x;
    }

    /**
     * Fits an estimator.
     *
     * @return the fitted estimator, or null if fitting failed and the estimator is to be dropped
     */
    @Nullable
    public Stage<?> fitEstimator(Matrix x, DenseVector y, NamedInstance estimator, CaseId caseId) {
        try {
            return checkFitted(((Fittable<?>) estimator.getStage()).fit(x, y));
        } catch (Exception e) {
            String prefix = messagePrefix(layerName, caseId);
            if (raiseOnException) {
                throw new FitFailedException(
                        String.format(
                                "%sCould not fit estimator '%s': %s",
                                prefix, estimator.getName(), e),
                        e);
            }
            warningSink.warn(
                    new FitFailedWarning(
                            String.format(
                                    "%sCould not fit estimator '%s'. It is dropped from the "
                                            + "layer. Details: %s",
                                    prefix, estimator.getName(), e),
                            e));
            return null;
        }
    }

    /**
     * Predicts with a fitted estimator. A prediction with a row count different from the input is
     * handled as a failure.
     *
     * @return the predictions, or null if predicting failed and the predictions are to be left at
     *     zero
     */
    @Nullable
    public DenseVector predict(Matrix x, NamedInstance estimator, CaseId caseId) {
        try {
            DenseVector prediction = ((Predictable<?>) estimator.getStage()).predict(x);
            Preconditions.checkState(
                    prediction != null && prediction.size() == x.numRows(),
                    "Expected %s predictions, got %s.",
                    x.numRows(),
                    prediction == null ? null : prediction.size());
            return prediction;
        } catch (Exception e) {
            String prefix = messagePrefix(layerName, caseId);
            if (raiseOnException) {
                throw new FitFailedException(
                        String.format(
                                "%sCould not predict with estimator '%s': %s",
                                prefix, estimator.getName(), e),
                        e);
            }
            warningSink.warn(
                    new FitFailedWarning(
                            String.format(
                                    "%sCould not predict with estimator '%s'. Its predictions "
                                            + "are left at 0. Details: %s",
                                    prefix, estimator.getName(), e),
                            e));
            return null;
        }
    }

    private static Stage<?> checkFitted(@Nullable Stage<?> fitted) {
        Preconditions.checkState(fitted != null, "fit() returned null.");
        return fitted;
    }

    /**
     * Returns the prefix of error and warning messages: {@code "[layer | case] "}, {@code "[layer]
     * "}, {@code "[case] "}, or an empty string if neither is known.
     */
    public static String messagePrefix(@Nullable String layerName, @Nullable CaseId caseId) {
        String caseName = caseId == null ? null : caseId.displayName();
        if (layerName == null && caseName == null) {
            return "";
        } else if (layerName != null && caseName != null) {
            return "[" + layerName + " | " + caseName + "] ";
        } else if (caseName == null) {
            return "[" + layerName + "] ";
        } else {
            return "[" + caseName + "] ";
        }
    }
}

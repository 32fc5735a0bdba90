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

package org.stackml.ensemble.layer;

import org.apache.flink.util.Preconditions;

import org.stackml.api.cv.FoldGenerator;
import org.stackml.ensemble.param.HasLayerName;
import org.stackml.ensemble.param.HasRaiseOnException;
import org.stackml.ensemble.param.HasVerbose;
import org.stackml.param.Param;
import org.stackml.util.ParamUtils;

import javax.annotation.Nullable;

import java.util.HashMap;
import java.util.Map;

/**
 * Configuration of one ensemble layer: the preprocessing pipelines, the estimators fitted on their
 * output, and the fold generator producing the out-of-fold predictions.
 *
 * <p>Estimators and preprocessing must have the same shape. Case-partitioned estimators need
 * case-partitioned preprocessing over the same case names, where a case without preprocessing is
 * given an empty pipeline. Flat estimators need flat, possibly empty, preprocessing.
 */
public class LayerConfig
        implements HasLayerName<LayerConfig>,
                HasRaiseOnException<LayerConfig>,
                HasVerbose<LayerConfig> {

    private final Map<Param<?>, Object> paramMap = new HashMap<>();

    private final Instances preprocessing;
    private final Instances estimators;
    @Nullable private final FoldGenerator foldGenerator;

    public LayerConfig(Instances estimators) {
        this(Instances.empty(), estimators, null);
    }

    public LayerConfig(
            Instances preprocessing,
            Instances estimators,
            @Nullable FoldGenerator foldGenerator) {
        Preconditions.checkNotNull(preprocessing);
        Preconditions.checkNotNull(estimators);
        Preconditions.checkArgument(
                preprocessing.isPartitioned() == estimators.isPartitioned(),
                "Preprocessing and estimators must both be partitioned into cases or both be flat.");
        if (estimators.isPartitioned()) {
            Preconditions.checkArgument(
                    preprocessing.caseNames().equals(estimators.caseNames()),
                    "Preprocessing cases %s do not match estimator cases %s.",
                    preprocessing.caseNames(),
                    estimators.caseNames());
        }
        for (String caseName : estimators.caseNames()) {
            Preconditions.checkArgument(
                    !estimators.get(caseName).isEmpty(), "Case %s has no estimators.", caseName);
        }
        this.preprocessing = preprocessing;
        this.estimators = estimators;
        this.foldGenerator = foldGenerator;
        ParamUtils.initializeMapWithDefaultValues(paramMap, this);
    }

    public Instances getPreprocessing() {
        return preprocessing;
    }

    public Instances getEstimators() {
        return estimators;
    }

    @Nullable
    public FoldGenerator getFoldGenerator() {
        return foldGenerator;
    }

    @Override
    public Map<Param<?>, Object> getParamMap() {
        return paramMap;
    }
}

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
import org.stackml.ensemble.task.Task;
import org.stackml.linalg.DenseVector;
import org.stackml.linalg.Matrix;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Fits the preprocessing pipeline of one task on its training rows and caches the fitted
 * transformers. Each transformer is fitted on the output of the transformers before it.
 */
class TransformerFitJob implements FitJob {
    private static final Logger LOG = LoggerFactory.getLogger(TransformerFitJob.class);

    private final LayerFitContext context;
    private final Task task;

    TransformerFitJob(LayerFitContext context, Task task) {
        this.context = context;
        this.task = task;
    }

    @Override
    public void run() throws Exception {
        CacheKey key = CacheKey.transformers(task.getCaseId());
        try {
            fitPipeline(key);
        } catch (Exception e) {
            context.cacheReader.producerFailed(key, e);
            throw e;
        }
    }

    private void fitPipeline(CacheKey key) throws Exception {
        CaseId caseId = task.getCaseId();
        FaultPolicy faultPolicy = context.faultPolicy;
        Matrix x = DataSlices.rows(context.x, task.getTrainRange());
        DenseVector y = DataSlices.rows(context.y, task.getTrainRange());

        List<NamedInstance> pipeline = task.getInstances();
        List<NamedInstance> fitted = new ArrayList<>(pipeline.size());
        for (int i = 0; i < pipeline.size(); i++) {
            NamedInstance transformer = pipeline.get(i);
            Stage<?> stage = faultPolicy.fitTransformer(x, y, transformer, caseId);
            NamedInstance fittedTransformer = new NamedInstance(transformer.getId(), stage);
            if (i < pipeline.size() - 1) {
                x = faultPolicy.transform(x, fittedTransformer, caseId);
            }
            fitted.add(fittedTransformer);
        }

        context.cache.save(key, new FittedTransformers(caseId, fitted));
        LOG.debug("Fitted {} transformer(s) of case {}.", fitted.size(), caseId);
    }

    @Override
    public String toString() {
        return "TransformerFitJob{" + task + '}';
    }
}

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

import org.stackml.ensemble.task.CaseId;
import org.stackml.ensemble.task.NamedInstance;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** The fitted preprocessing pipeline of one case, in application order. */
public final class FittedTransformers implements Serializable {
    private static final long serialVersionUID = 1L;

    private final CaseId caseId;
    private final List<NamedInstance> transformers;

    public FittedTransformers(CaseId caseId, List<NamedInstance> transformers) {
        this.caseId = Preconditions.checkNotNull(caseId);
        this.transformers = Collections.unmodifiableList(new ArrayList<>(transformers));
    }

    public CaseId getCaseId() {
        return caseId;
    }

    public List<NamedInstance> getTransformers() {
        return transformers;
    }

    @Override
    public String toString() {
        return "FittedTransformers{case=" + caseId + ", transformers=" + transformers + '}';
    }
}

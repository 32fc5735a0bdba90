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

package org.stackml.ensemble.cache;

import org.apache.flink.util.Preconditions;

import org.stackml.ensemble.task.CaseId;
import org.stackml.ensemble.task.InstanceId;

import javax.annotation.Nullable;

import java.util.Objects;

/**
 * Key of a cache entry: the fitted transformer list of a case, or the fitted estimator bundle of
 * an instance within a case.
 */
public final class CacheKey {

    private static final String TRANSFORMERS_SUFFIX = "t";
    private static final String ESTIMATOR_SUFFIX = "e";

    private final CaseId caseId;
    @Nullable private final InstanceId instanceId;

    private CacheKey(CaseId caseId, @Nullable InstanceId instanceId) {
        this.caseId = Preconditions.checkNotNull(caseId);
        this.instanceId = instanceId;
    }

    /** Returns the key of the fitted transformer list of the given case. */
    public static CacheKey transformers(CaseId caseId) {
        return new CacheKey(caseId, null);
    }

    /** Returns the key of the fitted estimator bundle of the given instance. */
    public static CacheKey estimator(CaseId caseId, InstanceId instanceId) {
        return new CacheKey(caseId, Preconditions.checkNotNull(instanceId));
    }

    public CaseId getCaseId() {
        return caseId;
    }

    @Nullable
    public InstanceId getInstanceId() {
        return instanceId;
    }

    /** Returns the file name of the entry: {@code case__t} or {@code case__instance__e}. */
    public String fileName() {
        return instanceId == null
                ? caseId.fileToken() + "__" + TRANSFORMERS_SUFFIX
                : caseId.fileToken() + "__" + instanceId + "__" + ESTIMATOR_SUFFIX;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CacheKey)) {
            return false;
        }
        CacheKey that = (CacheKey) o;
        return caseId.equals(that.caseId) && Objects.equals(instanceId, that.instanceId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(caseId, instanceId);
    }

    @Override
    public String toString() {
        return fileName();
    }
}

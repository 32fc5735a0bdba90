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

package org.stackml.ensemble.task;

import org.apache.flink.util.Preconditions;

import java.io.Serializable;
import java.util.Objects;

/** Identifies the estimator that owns a prediction column: an instance within a case. */
public final class ColumnKey implements Serializable {
    private static final long serialVersionUID = 1L;

    private final CaseId caseId;
    private final InstanceId instanceId;

    public ColumnKey(CaseId caseId, InstanceId instanceId) {
        this.caseId = Preconditions.checkNotNull(caseId);
        this.instanceId = Preconditions.checkNotNull(instanceId);
    }

    public CaseId getCaseId() {
        return caseId;
    }

    public InstanceId getInstanceId() {
        return instanceId;
    }

    /** Returns the key of the full-data estimator this key was derived from. */
    public ColumnKey parent() {
        return new ColumnKey(caseId.parent(), instanceId.parent());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ColumnKey)) {
            return false;
        }
        ColumnKey that = (ColumnKey) o;
        return caseId.equals(that.caseId) && instanceId.equals(that.instanceId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(caseId, instanceId);
    }

    @Override
    public String toString() {
        return "(" + caseId + ", " + instanceId + ")";
    }
}

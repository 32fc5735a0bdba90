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

import javax.annotation.Nullable;

import java.io.Serializable;
import java.util.Objects;

/** Name of an instance within a case, optionally narrowed to one cross-validation fold. */
public final class InstanceId implements Serializable {
    private static final long serialVersionUID = 1L;

    private final String baseName;
    @Nullable private final Integer foldIndex;

    private InstanceId(String baseName, @Nullable Integer foldIndex) {
        this.baseName = baseName;
        this.foldIndex = foldIndex;
    }

    public static InstanceId of(String name) {
        Preconditions.checkNotNull(name, "Instance name must not be null.");
        Preconditions.checkArgument(
                !name.isEmpty() && !name.contains(CaseId.SEPARATOR),
                "Instance name '%s' must be non-empty and must not contain '%s'.",
                name,
                CaseId.SEPARATOR);
        return new InstanceId(name, null);
    }

    public InstanceId forFold(int foldIndex) {
        Preconditions.checkState(this.foldIndex == null, "%s is already a fold variant.", this);
        Preconditions.checkArgument(foldIndex >= 0, "Fold index must be non-negative.");
        return new InstanceId(baseName, foldIndex);
    }

    public InstanceId parent() {
        return foldIndex == null ? this : new InstanceId(baseName, null);
    }

    public boolean isFoldVariant() {
        return foldIndex != null;
    }

    public String getBaseName() {
        return baseName;
    }

    @Nullable
    public Integer getFoldIndex() {
        return foldIndex;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof InstanceId)) {
            return false;
        }
        InstanceId that = (InstanceId) o;
        return baseName.equals(that.baseName) && Objects.equals(foldIndex, that.foldIndex);
    }

    @Override
    public int hashCode() {
        return Objects.hash(baseName, foldIndex);
    }

    @Override
    public String toString() {
        return foldIndex == null ? baseName : baseName + CaseId.SEPARATOR + foldIndex;
    }
}

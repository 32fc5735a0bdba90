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

/**
 * Identifies the data partition a task works on: a case of a case-partitioned layer, or the
 * absent case of a flat layer, optionally narrowed to one cross-validation fold.
 *
 * <p>The string form joins the case name and the fold index with {@code __}. A fold of a flat
 * layer is displayed as the bare fold index.
 */
public final class CaseId implements Serializable {
    private static final long serialVersionUID = 1L;

    /** The full-data case of a flat layer. */
    public static final CaseId ABSENT = new CaseId(null, null);

    static final String SEPARATOR = "__";

    private static final String ABSENT_FILE_TOKEN = "default";

    @Nullable private final String baseName;
    @Nullable private final Integer foldIndex;

    private CaseId(@Nullable String baseName, @Nullable Integer foldIndex) {
        this.baseName = baseName;
        this.foldIndex = foldIndex;
    }

    /** Returns the full-data id of the given case, or {@link #ABSENT} for a null case name. */
    public static CaseId of(@Nullable String caseName) {
        return caseName == null ? ABSENT : new CaseId(caseName, null);
    }

    /** Returns the id of the given fold of this case. */
    public CaseId forFold(int foldIndex) {
        Preconditions.checkState(this.foldIndex == null, "%s is already a fold variant.", this);
        Preconditions.checkArgument(foldIndex >= 0, "Fold index must be non-negative.");
        return new CaseId(baseName, foldIndex);
    }

    /** Returns the full-data id this fold variant was derived from. */
    public CaseId parent() {
        return foldIndex == null ? this : of(baseName);
    }

    public boolean isFoldVariant() {
        return foldIndex != null;
    }

    @Nullable
    public String getBaseName() {
        return baseName;
    }

    @Nullable
    public Integer getFoldIndex() {
        return foldIndex;
    }

    /** Returns the display name, or null for the full-data case of a flat layer. */
    @Nullable
    public String displayName() {
        if (foldIndex == null) {
            return baseName;
        }
        return baseName == null ? String.valueOf(foldIndex) : baseName + SEPARATOR + foldIndex;
    }

    /** Returns the token used for this case in cache file names. */
    public String fileToken() {
        String name = displayName();
        return name == null ? ABSENT_FILE_TOKEN : name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CaseId)) {
            return false;
        }
        CaseId caseId = (CaseId) o;
        return Objects.equals(baseName, caseId.baseName)
                && Objects.equals(foldIndex, caseId.foldIndex);
    }

    @Override
    public int hashCode() {
        return Objects.hash(baseName, foldIndex);
    }

    @Override
    public String toString() {
        return String.valueOf(displayName());
    }
}

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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps every estimator that writes predictions to its column of the prediction matrix.
 *
 * <p>Full-data entries own the columns {@code 0 .. numColumns() - 1}, one each. Fold-variant
 * entries resolve to the column of the full-data estimator they were derived from.
 */
public final class ColumnMap implements Serializable {
    private static final long serialVersionUID = 1L;

    private final Map<ColumnKey, Integer> baseEntries;
    private final Map<ColumnKey, Integer> entries;

    ColumnMap(Map<ColumnKey, Integer> baseEntries, Map<ColumnKey, Integer> entries) {
        this.baseEntries = Collections.unmodifiableMap(new LinkedHashMap<>(baseEntries));
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    /**
     * Returns the column of the given estimator.
     *
     * @throws IllegalArgumentException if the estimator has no column
     */
    public int get(CaseId caseId, InstanceId instanceId) {
        Integer column = entries.get(new ColumnKey(caseId, instanceId));
        Preconditions.checkArgument(
                column != null, "No prediction column for (%s, %s).", caseId, instanceId);
        return column;
    }

    public boolean contains(CaseId caseId, InstanceId instanceId) {
        return entries.containsKey(new ColumnKey(caseId, instanceId));
    }

    /** Returns the number of columns, which is the number of full-data estimators. */
    public int numColumns() {
        return baseEntries.size();
    }

    /** Returns the number of entries, including fold variants. */
    public int size() {
        return entries.size();
    }

    /** Returns the full-data entries in column order. */
    public Map<ColumnKey, Integer> baseEntries() {
        return baseEntries;
    }

    /** Returns all entries: full-data entries in column order, then the fold variants. */
    public Map<ColumnKey, Integer> entries() {
        return entries;
    }

    @Override
    public String toString() {
        return "ColumnMap" + entries;
    }
}

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

import org.stackml.ensemble.task.CaseId;
import org.stackml.ensemble.task.InstanceId;
import org.stackml.ensemble.task.NamedInstance;

import javax.annotation.Nullable;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * The instances of a layer, either partitioned into named cases or given as one flat list.
 *
 * <p>Both shapes are held case-keyed: case names are kept in sorted order, and a flat list is
 * stored as the single group of the absent case, whose name is {@code null}.
 */
public final class Instances implements Serializable {
    private static final long serialVersionUID = 1L;

    private final boolean partitioned;
    private final SortedMap<String, List<NamedInstance>> cases;
    private final List<NamedInstance> flat;

    private Instances(
            boolean partitioned,
            SortedMap<String, List<NamedInstance>> cases,
            List<NamedInstance> flat) {
        this.partitioned = partitioned;
        this.cases = cases;
        this.flat = flat;
    }

    /** Creates case-partitioned instances. */
    public static Instances cases(Map<String, List<NamedInstance>> instancesByCase) {
        SortedMap<String, List<NamedInstance>> sorted = new TreeMap<>();
        for (Map.Entry<String, List<NamedInstance>> entry : instancesByCase.entrySet()) {
            String caseName = entry.getKey();
            Preconditions.checkArgument(caseName != null, "Case names must not be null.");
            Preconditions.checkArgument(
                    !caseName.isEmpty() && !caseName.contains("__"),
                    "Case name '%s' must be non-empty and must not contain '__'.",
                    caseName);
            sorted.put(caseName, checkUniqueNames(caseName, entry.getValue()));
        }
        return new Instances(true, Collections.unmodifiableSortedMap(sorted), null);
    }

    /** Creates a flat list of instances that are not partitioned into cases. */
    public static Instances flat(List<NamedInstance> instances) {
        return new Instances(false, null, checkUniqueNames(null, instances));
    }

    public static Instances flat(NamedInstance... instances) {
        return flat(Arrays.asList(instances));
    }

    /** Creates an empty flat list, e.g. for a layer without preprocessing. */
    public static Instances empty() {
        return flat(Collections.emptyList());
    }

    public boolean isPartitioned() {
        return partitioned;
    }

    /** Returns the sorted case names, or a single {@code null} entry for flat instances. */
    public List<String> caseNames() {
        return partitioned
                ? new ArrayList<>(cases.keySet())
                : Collections.singletonList((String) null);
    }

    /** Returns the full-data case ids, in sorted case order. */
    public Set<CaseId> caseIds() {
        Set<CaseId> result = new LinkedHashSet<>();
        for (String caseName : caseNames()) {
            result.add(CaseId.of(caseName));
        }
        return result;
    }

    /**
     * Returns the instances of the given case, in declared order. For flat instances the case
     * name must be {@code null}. Unknown cases have no instances.
     */
    public List<NamedInstance> get(@Nullable String caseName) {
        if (!partitioned) {
            Preconditions.checkArgument(
                    caseName == null, "Flat instances have no case '%s'.", caseName);
            return flat;
        }
        List<NamedInstance> instances = caseName == null ? null : cases.get(caseName);
        return instances == null ? Collections.emptyList() : instances;
    }

    public boolean isEmpty() {
        for (String caseName : caseNames()) {
            if (!get(caseName).isEmpty()) {
                return false;
            }
        }
        return true;
    }

    private static List<NamedInstance> checkUniqueNames(
            @Nullable String caseName, List<NamedInstance> instances) {
        Preconditions.checkNotNull(instances, "Instances of case %s must not be null.", caseName);
        Set<InstanceId> seen = new HashSet<>();
        for (NamedInstance instance : instances) {
            Preconditions.checkNotNull(
                    instance, "Instances of case %s must not be null.", caseName);
            Preconditions.checkArgument(
                    !instance.getId().isFoldVariant(),
                    "Instance %s must not be a fold variant.",
                    instance.getId());
            Preconditions.checkArgument(
                    seen.add(instance.getId()),
                    "Duplicate instance name '%s' in case %s.",
                    instance.getId(),
                    caseName);
        }
        return Collections.unmodifiableList(new ArrayList<>(instances));
    }

    @Override
    public String toString() {
        return partitioned ? "Instances" + cases : "Instances" + flat;
    }
}

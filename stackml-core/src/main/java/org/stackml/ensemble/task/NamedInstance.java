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

import org.stackml.api.core.Stage;

import java.io.Serializable;

/** A stage together with the name it is known by inside its case. */
public final class NamedInstance implements Serializable {
    private static final long serialVersionUID = 1L;

    private final InstanceId id;
    private final Stage<?> stage;

    public NamedInstance(InstanceId id, Stage<?> stage) {
        this.id = Preconditions.checkNotNull(id);
        this.stage = Preconditions.checkNotNull(stage, "Instance %s has no stage.", id);
    }

    public static NamedInstance of(String name, Stage<?> stage) {
        return new NamedInstance(InstanceId.of(name), stage);
    }

    public InstanceId getId() {
        return id;
    }

    public String getName() {
        return id.toString();
    }

    public Stage<?> getStage() {
        return stage;
    }

    /** Returns an instance with the same name and an independent copy of the stage. */
    public NamedInstance copy() {
        return new NamedInstance(id, stage.copy());
    }

    /** Returns an instance renamed for the given fold, with an independent copy of the stage. */
    public NamedInstance copyForFold(int foldIndex) {
        return new NamedInstance(id.forFold(foldIndex), stage.copy());
    }

    @Override
    public String toString() {
        return id + "=" + stage.getClass().getSimpleName();
    }
}

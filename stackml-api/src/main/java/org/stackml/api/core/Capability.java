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

package org.stackml.api.core;

import org.apache.flink.annotation.PublicEvolving;

import java.util.EnumSet;
import java.util.Set;

/** The operations a {@link Stage} can take part in. */
@PublicEvolving
public enum Capability {
    FITTABLE(Fittable.class),
    TRANSFORMABLE(Transformable.class),
    PREDICTABLE(Predictable.class);

    private final Class<?> capabilityClass;

    Capability(Class<?> capabilityClass) {
        this.capabilityClass = capabilityClass;
    }

    /** Returns whether the given stage implements this capability. */
    public boolean isSupportedBy(Stage<?> stage) {
        return capabilityClass.isInstance(stage);
    }

    /** Returns all capabilities implemented by the given stage. */
    public static Set<Capability> of(Stage<?> stage) {
        Set<Capability> result = EnumSet.noneOf(Capability.class);
        for (Capability capability : values()) {
            if (capability.isSupportedBy(stage)) {
                result.add(capability);
            }
        }
        return result;
    }

    /**
     * Checks that the given stage implements every required capability.
     *
     * @param stage the stage to check
     * @param name the name of the stage, used in the error message
     * @param required the capabilities the stage must implement
     * @throws IllegalArgumentException if one of the required capabilities is missing
     */
    public static void checkSupported(Stage<?> stage, String name, Capability... required) {
        for (Capability capability : required) {
            if (!capability.isSupportedBy(stage)) {
                throw new IllegalArgumentException(
                        String.format(
                                "Instance '%s' of type %s does not support %s, which is required here.",
                                name, stage.getClass().getName(), capability));
            }
        }
    }
}

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

package org.stackml.util;

import org.apache.flink.util.Preconditions;

import org.stackml.param.Param;
import org.stackml.param.WithParams;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Utility methods for parameter handling. */
public class ParamUtils {

    /**
     * Puts the default value of every param declared on the given instance into the param map.
     * Params already present in the map keep their value.
     *
     * <p>Must be called once all public final Param fields of the instance are assigned, typically
     * at the end of its constructor.
     */
    public static void initializeMapWithDefaultValues(
            Map<Param<?>, Object> paramMap, WithParams<?> instance) {
        for (Param<?> param : getDeclaredParams(instance)) {
            paramMap.putIfAbsent(param, param.defaultValue);
        }
    }

    /**
     * Returns the params declared as public final fields of the object's class, its super-classes
     * and every interface they implement, in the order the classes are visited.
     *
     * @throws IllegalStateException if two different params share a name
     */
    public static List<Param<?>> getDeclaredParams(Object object) {
        Map<String, Param<?>> params = new LinkedHashMap<>();
        Set<Class<?>> visited = new HashSet<>();
        Deque<Class<?>> pending = new ArrayDeque<>();
        pending.add(object.getClass());

        while (!pending.isEmpty()) {
            Class<?> clazz = pending.poll();
            if (!visited.add(clazz)) {
                continue;
            }
            for (Field field : clazz.getDeclaredFields()) {
                if (!isParamField(field)) {
                    continue;
                }
                Param<?> param = readField(object, field);
                Param<?> previous = params.putIfAbsent(param.name, param);
                Preconditions.checkState(
                        previous == null || previous == param,
                        "Param %s is declared twice on %s.",
                        param.name,
                        object.getClass().getName());
            }
            if (clazz.getSuperclass() != null) {
                pending.add(clazz.getSuperclass());
            }
            for (Class<?> anInterface : clazz.getInterfaces()) {
                pending.add(anInterface);
            }
        }
        return new ArrayList<>(params.values());
    }

    private static boolean isParamField(Field field) {
        int modifiers = field.getModifiers();
        return Param.class.isAssignableFrom(field.getType())
                && Modifier.isPublic(modifiers)
                && Modifier.isFinal(modifiers);
    }

    private static Param<?> readField(Object object, Field field) {
        try {
            field.setAccessible(true);
            Param<?> param = (Param<?>) field.get(object);
            return Preconditions.checkNotNull(
                    param, "Param field %s must be assigned.", field.getName());
        } catch (IllegalAccessException e) {
            throw new RuntimeException("Failed to read param field " + field.getName() + ".", e);
        }
    }
}

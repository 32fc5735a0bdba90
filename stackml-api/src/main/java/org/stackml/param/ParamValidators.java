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

package org.stackml.param;

import org.apache.commons.lang3.ArrayUtils;

import java.util.Arrays;

/** Factory methods of common {@link ParamValidator}s. */
public class ParamValidators {

    // Always return true.
    public static <T> ParamValidator<T> alwaysTrue() {
        return new AlwaysTrue<>();
    }

    // Checks if the parameter value is greater than lowerBound.
    public static <T> ParamValidator<T> gt(double lowerBound) {
        return new Bound<>(lowerBound, Bound.Kind.GT);
    }

    // Checks if the parameter value is greater than or equal to lowerBound.
    public static <T> ParamValidator<T> gtEq(double lowerBound) {
        return new Bound<>(lowerBound, Bound.Kind.GT_EQ);
    }

    // Checks if the parameter value is less than upperBound.
    public static <T> ParamValidator<T> lt(double upperBound) {
        return new Bound<>(upperBound, Bound.Kind.LT);
    }

    // Checks if the parameter value is in the array of allowed values.
    @SafeVarargs
    public static <T> ParamValidator<T> inArray(T... allowed) {
        return new InArray<>(allowed);
    }

    // Checks if the parameter value is not null.
    public static <T> ParamValidator<T> notNull() {
        return new NotNull<>();
    }

    private static class AlwaysTrue<T> implements ParamValidator<T> {
        private static final long serialVersionUID = 1L;

        @Override
        public boolean validate(T value) {
            return true;
        }

        @Override
        public String describe() {
            return "any value";
        }
    }

    private static class NotNull<T> implements ParamValidator<T> {
        private static final long serialVersionUID = 1L;

        @Override
        public boolean validate(T value) {
            return value != null;
        }

        @Override
        public String describe() {
            return "a non-null value";
        }
    }

    private static class Bound<T> implements ParamValidator<T> {
        private static final long serialVersionUID = 1L;

        enum Kind {
            GT(">"),
            GT_EQ(">="),
            LT("<");

            private final String symbol;

            Kind(String symbol) {
                this.symbol = symbol;
            }
        }

        private final double bound;
        private final Kind kind;

        Bound(double bound, Kind kind) {
            this.bound = bound;
            this.kind = kind;
        }

        @Override
        public boolean validate(T value) {
            if (value == null) {
                return false;
            }
            double number = ((Number) value).doubleValue();
            switch (kind) {
                case GT:
                    return number > bound;
                case GT_EQ:
                    return number >= bound;
                default:
                    return number < bound;
            }
        }

        @Override
        public String describe() {
            String formatted =
                    bound == Math.rint(bound) && !Double.isInfinite(bound)
                            ? String.valueOf((long) bound)
                            : String.valueOf(bound);
            return kind.symbol + " " + formatted;
        }
    }

    private static class InArray<T> implements ParamValidator<T> {
        private static final long serialVersionUID = 1L;

        private final T[] allowed;

        InArray(T[] allowed) {
            this.allowed = allowed;
        }

        @Override
        public boolean validate(T value) {
            return value != null && ArrayUtils.contains(allowed, value);
        }

        @Override
        public String describe() {
            return "one of " + Arrays.toString(allowed);
        }
    }
}

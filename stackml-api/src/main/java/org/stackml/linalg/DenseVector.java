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

package org.stackml.linalg;

import org.apache.flink.annotation.PublicEvolving;
import org.apache.flink.util.Preconditions;

import java.io.Serializable;
import java.util.Arrays;

/** A dense vector of double values. */
@PublicEvolving
public class DenseVector implements Serializable {
    private static final long serialVersionUID = 1L;

    public final double[] values;

    public DenseVector(int size) {
        this(new double[size]);
    }

    public DenseVector(double[] values) {
        this.values = Preconditions.checkNotNull(values);
    }

    public static DenseVector of(double... values) {
        return new DenseVector(values);
    }

    public int size() {
        return values.length;
    }

    public double get(int i) {
        return values[i];
    }

    public void set(int i, double value) {
        values[i] = value;
    }

    /** Returns a copy of the entries in {@code [start, end)}. */
    public DenseVector slice(int start, int end) {
        Preconditions.checkArgument(
                start >= 0 && start <= end && end <= values.length,
                "Invalid range [%s, %s) for a vector of size %s.",
                start,
                end,
                values.length);
        return new DenseVector(Arrays.copyOfRange(values, start, end));
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof DenseVector)) {
            return false;
        }
        return Arrays.equals(values, ((DenseVector) obj).values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return Arrays.toString(values);
    }
}

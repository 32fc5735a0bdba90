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

/** A half-open interval {@code [start, end)} of row indices. */
public final class RowRange implements Serializable {
    private static final long serialVersionUID = 1L;

    private final int start;
    private final int end;

    public RowRange(int start, int end) {
        Preconditions.checkArgument(
                0 <= start && start < end, "Invalid row range [%s, %s).", start, end);
        this.start = start;
        this.end = end;
    }

    /** Returns the range from the first index up to and excluding the last index plus one. */
    public static RowRange spanOf(int[] indices) {
        Preconditions.checkArgument(indices.length > 0, "Cannot span an empty index list.");
        return new RowRange(indices[0], indices[indices.length - 1] + 1);
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public int length() {
        return end - start;
    }

    public boolean overlaps(RowRange other) {
        return start < other.end && other.start < end;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RowRange)) {
            return false;
        }
        RowRange that = (RowRange) o;
        return start == that.start && end == that.end;
    }

    @Override
    public int hashCode() {
        return 31 * start + end;
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}

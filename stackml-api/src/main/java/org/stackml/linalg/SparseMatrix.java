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

import java.util.Arrays;

/**
 * Sparse matrix in compressed sparse row format. The column indices and values of row {@code i}
 * are stored in {@code colIndices} and {@code values} between {@code rowPtr[i]} (inclusive) and
 * {@code rowPtr[i + 1]} (exclusive). Column indices are ascending within a row.
 */
@PublicEvolving
public class SparseMatrix implements Matrix {
    private static final long serialVersionUID = 1L;

    private final int numRows;
    private final int numCols;
    public final int[] rowPtr;
    public final int[] colIndices;
    public final double[] values;

    public SparseMatrix(
            int numRows, int numCols, int[] rowPtr, int[] colIndices, double[] values) {
        Preconditions.checkArgument(
                rowPtr.length == numRows + 1, "rowPtr must have numRows + 1 entries.");
        Preconditions.checkArgument(rowPtr[0] == 0, "rowPtr must start at 0.");
        Preconditions.checkArgument(
                colIndices.length == values.length && rowPtr[numRows] == values.length,
                "Indices and values do not match.");
        for (int i = 0; i < numRows; i++) {
            Preconditions.checkArgument(rowPtr[i] <= rowPtr[i + 1], "rowPtr must be ascending.");
            for (int k = rowPtr[i]; k < rowPtr[i + 1]; k++) {
                Preconditions.checkArgument(
                        colIndices[k] >= 0 && colIndices[k] < numCols,
                        "Column index %s out of bounds.",
                        colIndices[k]);
                Preconditions.checkArgument(
                        k == rowPtr[i] || colIndices[k - 1] < colIndices[k],
                        "Column indices must be strictly ascending within a row.");
            }
        }
        this.numRows = numRows;
        this.numCols = numCols;
        this.rowPtr = rowPtr;
        this.colIndices = colIndices;
        this.values = values;
    }

    @Override
    public int numRows() {
        return numRows;
    }

    @Override
    public int numCols() {
        return numCols;
    }

    /** Gets the number of stored entries. */
    public int numNonZeros() {
        return values.length;
    }

    @Override
    public double get(int i, int j) {
        Preconditions.checkArgument(i >= 0 && i < numRows && j >= 0 && j < numCols);
        int pos = Arrays.binarySearch(colIndices, rowPtr[i], rowPtr[i + 1], j);
        return pos >= 0 ? values[pos] : 0.0;
    }

    @Override
    public boolean isSparse() {
        return true;
    }

    @Override
    public SparseMatrix sliceRows(int start, int end) {
        Preconditions.checkArgument(
                start >= 0 && start <= end && end <= numRows,
                "Invalid row range [%s, %s) for a matrix with %s rows.",
                start,
                end,
                numRows);
        int from = rowPtr[start];
        int to = rowPtr[end];
        int[] slicedRowPtr = new int[end - start + 1];
        for (int i = start; i <= end; i++) {
            slicedRowPtr[i - start] = rowPtr[i] - from;
        }
        return new SparseMatrix(
                end - start,
                numCols,
                slicedRowPtr,
                Arrays.copyOfRange(colIndices, from, to),
                Arrays.copyOfRange(values, from, to));
    }

    @Override
    public DenseMatrix toDense() {
        DenseMatrix dense = new DenseMatrix(numRows, numCols);
        for (int i = 0; i < numRows; i++) {
            for (int k = rowPtr[i]; k < rowPtr[i + 1]; k++) {
                dense.set(i, colIndices[k], values[k]);
            }
        }
        return dense;
    }
}

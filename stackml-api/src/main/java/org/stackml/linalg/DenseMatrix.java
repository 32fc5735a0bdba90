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
 * Column-major dense matrix. The entry values are stored in a single array of doubles with columns
 * listed in sequence.
 *
 * <p>Writes to disjoint cells may happen from different threads concurrently; publishing the
 * written values to other threads is up to the caller.
 */
@PublicEvolving
public class DenseMatrix implements Matrix {
    private static final long serialVersionUID = 1L;

    /** Row dimension. */
    private final int numRows;

    /** Column dimension. */
    private final int numCols;

    /**
     * Array for internal storage of elements.
     *
     * <p>The matrix data is stored in column major format internally.
     */
    public final double[] values;

    /**
     * Constructs an m-by-n matrix of zeros.
     *
     * @param numRows Number of rows.
     * @param numCols Number of columns.
     */
    public DenseMatrix(int numRows, int numCols) {
        this(numRows, numCols, new double[numRows * numCols]);
    }

    /**
     * Constructs a matrix from a 1-D array. The data in the array should be organized in column
     * major.
     *
     * @param numRows Number of rows.
     * @param numCols Number of cols.
     * @param values One-dimensional array of doubles.
     */
    public DenseMatrix(int numRows, int numCols, double[] values) {
        Preconditions.checkArgument(values.length == numRows * numCols);
        this.numRows = numRows;
        this.numCols = numCols;
        this.values = values;
    }

    /** Constructs a matrix from row-major nested arrays. All rows must have the same length. */
    public static DenseMatrix fromRows(double[][] rows) {
        int numRows = rows.length;
        int numCols = numRows == 0 ? 0 : rows[0].length;
        DenseMatrix matrix = new DenseMatrix(numRows, numCols);
        for (int i = 0; i < numRows; i++) {
            Preconditions.checkArgument(rows[i].length == numCols, "Rows differ in length.");
            for (int j = 0; j < numCols; j++) {
                matrix.values[numRows * j + i] = rows[i][j];
            }
        }
        return matrix;
    }

    @Override
    public int numRows() {
        return numRows;
    }

    @Override
    public int numCols() {
        return numCols;
    }

    @Override
    public double get(int i, int j) {
        Preconditions.checkArgument(i >= 0 && i < numRows && j >= 0 && j < numCols);
        return values[numRows * j + i];
    }

    public double set(int i, int j, double value) {
        Preconditions.checkArgument(i >= 0 && i < numRows && j >= 0 && j < numCols);
        return values[numRows * j + i] = value;
    }

    /** Returns a copy of the j-th column. */
    public DenseVector getColumn(int j) {
        Preconditions.checkArgument(j >= 0 && j < numCols);
        return new DenseVector(Arrays.copyOfRange(values, numRows * j, numRows * (j + 1)));
    }

    /**
     * Writes the given values into column {@code j}, starting at row {@code rowOffset}. Only the
     * cells {@code [rowOffset, rowOffset + column.size())} of column {@code j} are touched.
     */
    public void setColumn(int j, int rowOffset, DenseVector column) {
        Preconditions.checkArgument(j >= 0 && j < numCols, "Column %s out of bounds.", j);
        Preconditions.checkArgument(
                rowOffset >= 0 && rowOffset + column.size() <= numRows,
                "Rows [%s, %s) out of bounds for a matrix with %s rows.",
                rowOffset,
                rowOffset + column.size(),
                numRows);
        System.arraycopy(column.values, 0, values, numRows * j + rowOffset, column.size());
    }

    @Override
    public boolean isSparse() {
        return false;
    }

    @Override
    public DenseMatrix sliceRows(int start, int end) {
        Preconditions.checkArgument(
                start >= 0 && start <= end && end <= numRows,
                "Invalid row range [%s, %s) for a matrix with %s rows.",
                start,
                end,
                numRows);
        int sliceRows = end - start;
        double[] sliced = new double[sliceRows * numCols];
        for (int j = 0; j < numCols; j++) {
            System.arraycopy(values, numRows * j + start, sliced, sliceRows * j, sliceRows);
        }
        return new DenseMatrix(sliceRows, numCols, sliced);
    }

    @Override
    public DenseMatrix toDense() {
        return this;
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof DenseMatrix)) {
            return false;
        }
        DenseMatrix that = (DenseMatrix) obj;
        return numRows == that.numRows
                && numCols == that.numCols
                && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        int result = 31 * numRows + numCols;
        return 31 * result + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("DenseMatrix(").append(numRows).append('x');
        sb.append(numCols).append(")[");
        for (int i = 0; i < numRows; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append('[');
            for (int j = 0; j < numCols; j++) {
                if (j > 0) {
                    sb.append(", ");
                }
                sb.append(values[numRows * j + i]);
            }
            sb.append(']');
        }
        return sb.append(']').toString();
    }
}

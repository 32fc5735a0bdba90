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

import org.junit.Assert;
import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

/** Tests the behavior of {@link SparseMatrix}. */
public class SparseMatrixTest {
    private static final double TOLERANCE = 1e-7;

    // [[1, 0, 2], [0, 0, 0], [0, 3, 0]]
    private static SparseMatrix createMatrix() {
        return new SparseMatrix(
                3,
                3,
                new int[] {0, 2, 2, 3},
                new int[] {0, 2, 1},
                new double[] {1.0, 2.0, 3.0});
    }

    @Test
    public void testGet() {
        SparseMatrix matrix = createMatrix();
        assertTrue(matrix.isSparse());
        assertEquals(3, matrix.numNonZeros());
        assertEquals(1.0, matrix.get(0, 0), TOLERANCE);
        assertEquals(0.0, matrix.get(0, 1), TOLERANCE);
        assertEquals(2.0, matrix.get(0, 2), TOLERANCE);
        assertEquals(0.0, matrix.get(1, 1), TOLERANCE);
        assertEquals(3.0, matrix.get(2, 1), TOLERANCE);
    }

    @Test
    public void testSliceRows() {
        SparseMatrix sliced = createMatrix().sliceRows(1, 3);
        assertEquals(2, sliced.numRows());
        assertEquals(3, sliced.numCols());
        assertArrayEquals(new int[] {0, 0, 1}, sliced.rowPtr);
        assertArrayEquals(new int[] {1}, sliced.colIndices);
        assertEquals(3.0, sliced.get(1, 1), TOLERANCE);
    }

    @Test
    public void testToDense() {
        assertEquals(
                DenseMatrix.fromRows(
                        new double[][] {
                            {1.0, 0.0, 2.0},
                            {0.0, 0.0, 0.0},
                            {0.0, 3.0, 0.0}
                        }),
                createMatrix().toDense());
    }

    @Test
    public void testUnsortedColumnIndices() {
        try {
            new SparseMatrix(1, 3, new int[] {0, 2}, new int[] {2, 0}, new double[] {1.0, 2.0});
            Assert.fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertEquals(
                    "Column indices must be strictly ascending within a row.", e.getMessage());
        }
    }
}

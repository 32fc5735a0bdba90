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

import java.io.Serializable;

/** A matrix of double values. */
@PublicEvolving
public interface Matrix extends Serializable {

    /** Gets number of rows. */
    int numRows();

    /** Gets number of columns. */
    int numCols();

    /** Gets value of the (i,j) element. */
    double get(int i, int j);

    /** Returns whether the matrix only stores its non-zero entries. */
    boolean isSparse();

    /**
     * Returns a new matrix holding a copy of the rows in {@code [start, end)}. The result has the
     * same representation as this matrix and does not share storage with it.
     */
    Matrix sliceRows(int start, int end);

    /** Converts the instance to a dense matrix. */
    DenseMatrix toDense();
}

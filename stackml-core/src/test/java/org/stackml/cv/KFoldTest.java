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

package org.stackml.cv;

import org.stackml.api.cv.Fold;
import org.stackml.linalg.DenseMatrix;

import org.junit.Assert;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

/** Tests {@link KFold}. */
public class KFoldTest {

    @Test
    public void testParam() {
        KFold kFold = new KFold();
        assertEquals(2, kFold.getNumFolds());

        kFold.setNumFolds(5);
        assertEquals(5, kFold.getNumFolds());

        try {
            kFold.setNumFolds(1);
            Assert.fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertEquals(
                    "Parameter numFolds is given an invalid value 1, expected >= 2.",
                    e.getMessage());
        }
    }

    @Test
    public void testSplit() {
        List<Fold> folds = new KFold(3).split(new DenseMatrix(7, 1));
        assertEquals(3, folds.size());

        // The first 7 % 3 folds hold one extra row.
        assertArrayEquals(new int[] {0, 1, 2}, folds.get(0).getTestIndices());
        assertArrayEquals(new int[] {3, 4, 5, 6}, folds.get(0).getTrainIndices());
        assertArrayEquals(new int[] {3, 4}, folds.get(1).getTestIndices());
        assertArrayEquals(new int[] {0, 1, 2, 5, 6}, folds.get(1).getTrainIndices());
        assertArrayEquals(new int[] {5, 6}, folds.get(2).getTestIndices());
        assertArrayEquals(new int[] {0, 1, 2, 3, 4}, folds.get(2).getTrainIndices());
    }

    @Test
    public void testSplitIsRepeatable() {
        DenseMatrix x = new DenseMatrix(10, 2);
        KFold kFold = new KFold(4);
        List<Fold> first = kFold.split(x);
        List<Fold> second = kFold.split(x);
        for (int i = 0; i < first.size(); i++) {
            assertArrayEquals(first.get(i).getTestIndices(), second.get(i).getTestIndices());
        }
    }

    @Test
    public void testTooFewRows() {
        try {
            new KFold(3).split(new DenseMatrix(2, 1));
            Assert.fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertEquals("Cannot split 2 rows into 3 folds.", e.getMessage());
        }
    }
}

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

package org.stackml.api.cv;

import org.apache.flink.annotation.PublicEvolving;
import org.apache.flink.util.Preconditions;

import java.io.Serializable;
import java.util.Arrays;

/** One train/test split of the rows of a training matrix, as ascending row indices. */
@PublicEvolving
public class Fold implements Serializable {
    private static final long serialVersionUID = 1L;

    private final int[] trainIndices;
    private final int[] testIndices;

    public Fold(int[] trainIndices, int[] testIndices) {
        Preconditions.checkArgument(trainIndices.length > 0, "A fold needs training rows.");
        Preconditions.checkArgument(testIndices.length > 0, "A fold needs test rows.");
        this.trainIndices = trainIndices;
        this.testIndices = testIndices;
    }

    public int[] getTrainIndices() {
        return trainIndices;
    }

    public int[] getTestIndices() {
        return testIndices;
    }

    @Override
    public String toString() {
        return "Fold{train="
                + Arrays.toString(trainIndices)
                + ", test="
                + Arrays.toString(testIndices)
                + '}';
    }
}

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

import org.apache.flink.util.Preconditions;

import org.stackml.api.cv.Fold;
import org.stackml.api.cv.FoldGenerator;
import org.stackml.linalg.Matrix;
import org.stackml.param.Param;
import org.stackml.util.ParamUtils;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A fold generator splitting the rows into {@code numFolds} contiguous, unshuffled test blocks.
 * The first {@code numRows % numFolds} blocks hold one extra row. The training rows of a fold are
 * all rows outside its test block.
 */
public class KFold implements FoldGenerator, KFoldParams<KFold> {
    private static final long serialVersionUID = 1L;

    private final Map<Param<?>, Object> paramMap = new HashMap<>();

    public KFold() {
        ParamUtils.initializeMapWithDefaultValues(paramMap, this);
    }

    public KFold(int numFolds) {
        this();
        setNumFolds(numFolds);
    }

    @Override
    public List<Fold> split(Matrix x) {
        int numRows = x.numRows();
        int numFolds = getNumFolds();
        Preconditions.checkArgument(
                numRows >= numFolds,
                "Cannot split %s rows into %s folds.",
                numRows,
                numFolds);

        List<Fold> folds = new ArrayList<>(numFolds);
        int testStart = 0;
        for (int i = 0; i < numFolds; i++) {
            int testSize = numRows / numFolds + (i < numRows % numFolds ? 1 : 0);
            int testEnd = testStart + testSize;
            int[] train = new int[numRows - testSize];
            int[] test = new int[testSize];
            for (int row = 0, k = 0; row < numRows; row++) {
                if (row >= testStart && row < testEnd) {
                    test[row - testStart] = row;
                } else {
                    train[k++] = row;
                }
            }
            folds.add(new Fold(train, test));
            testStart = testEnd;
        }
        return folds;
    }

    @Override
    public Map<Param<?>, Object> getParamMap() {
        return paramMap;
    }
}

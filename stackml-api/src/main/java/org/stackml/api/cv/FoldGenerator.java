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

import org.stackml.linalg.Matrix;

import java.io.Serializable;
import java.util.List;

/**
 * Splits the rows of a training matrix into cross-validation folds. The order of the returned
 * folds defines the fold indices, and must be the same for repeated calls on the same input.
 */
@PublicEvolving
public interface FoldGenerator extends Serializable {
    List<Fold> split(Matrix x);
}

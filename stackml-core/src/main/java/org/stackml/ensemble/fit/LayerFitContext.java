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

package org.stackml.ensemble.fit;

import org.stackml.ensemble.cache.AwaitingCacheReader;
import org.stackml.ensemble.cache.CacheStore;
import org.stackml.ensemble.fault.FaultPolicy;
import org.stackml.linalg.DenseMatrix;
import org.stackml.linalg.DenseVector;
import org.stackml.linalg.Matrix;

/** The state shared by all jobs of one fit call. */
class LayerFitContext {
    final Matrix x;
    final DenseVector y;
    final DenseMatrix predictions;
    final CacheStore cache;
    final AwaitingCacheReader cacheReader;
    final FaultPolicy faultPolicy;

    LayerFitContext(
            Matrix x,
            DenseVector y,
            DenseMatrix predictions,
            CacheStore cache,
            AwaitingCacheReader cacheReader,
            FaultPolicy faultPolicy) {
        this.x = x;
        this.y = y;
        this.predictions = predictions;
        this.cache = cache;
        this.cacheReader = cacheReader;
        this.faultPolicy = faultPolicy;
    }
}

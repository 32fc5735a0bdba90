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

package org.stackml.api.core;

import org.stackml.linalg.DenseVector;
import org.stackml.linalg.Matrix;
import org.stackml.param.Param;
import org.stackml.util.ParamUtils;

import org.junit.Assert;
import org.junit.Test;

import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

/** Tests {@link Capability}. */
public class CapabilityTest {

    /** A stage that can be fitted and can predict, but cannot transform. */
    public static class Regressor implements Fittable<Regressor>, Predictable<Regressor> {
        private final Map<Param<?>, Object> paramMap = new HashMap<>();

        public Regressor() {
            ParamUtils.initializeMapWithDefaultValues(paramMap, this);
        }

        @Override
        public Regressor fit(Matrix x, DenseVector y) {
            return this;
        }

        @Override
        public DenseVector predict(Matrix x) {
            return new DenseVector(x.numRows());
        }

        @Override
        public Map<Param<?>, Object> getParamMap() {
            return paramMap;
        }
    }

    @Test
    public void testOf() {
        Regressor regressor = new Regressor();
        assertEquals(
                EnumSet.of(Capability.FITTABLE, Capability.PREDICTABLE),
                Capability.of(regressor));
        assertTrue(Capability.PREDICTABLE.isSupportedBy(regressor));
        assertFalse(Capability.TRANSFORMABLE.isSupportedBy(regressor));
    }

    @Test
    public void testCheckSupported() {
        Capability.checkSupported(
                new Regressor(), "reg", Capability.FITTABLE, Capability.PREDICTABLE);

        try {
            Capability.checkSupported(
                    new Regressor(), "reg", Capability.FITTABLE, Capability.TRANSFORMABLE);
            Assert.fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertEquals(
                    "Instance 'reg' of type "
                            + Regressor.class.getName()
                            + " does not support TRANSFORMABLE, which is required here.",
                    e.getMessage());
        }
    }
}

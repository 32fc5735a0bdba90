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

package org.stackml.ensemble.fault;

import java.util.ArrayList;
import java.util.List;

/** A {@link LoggingWarningSink} that also keeps the warnings it received. */
public class CollectingWarningSink extends LoggingWarningSink {

    private final List<EnsembleWarning> warnings = new ArrayList<>();

    @Override
    public void warn(EnsembleWarning warning) {
        super.warn(warning);
        synchronized (warnings) {
            warnings.add(warning);
        }
    }

    /** Returns a snapshot of the warnings received so far, in arrival order. */
    public List<EnsembleWarning> getWarnings() {
        synchronized (warnings) {
            return new ArrayList<>(warnings);
        }
    }

    /** Returns the received warnings of the given type. */
    public <W extends EnsembleWarning> List<W> getWarnings(Class<W> type) {
        List<W> result = new ArrayList<>();
        for (EnsembleWarning warning : getWarnings()) {
            if (type.isInstance(warning)) {
                result.add(type.cast(warning));
            }
        }
        return result;
    }
}

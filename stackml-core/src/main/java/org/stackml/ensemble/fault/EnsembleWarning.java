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

import org.apache.flink.util.Preconditions;

import javax.annotation.Nullable;

import java.io.Serializable;

/** A recoverable problem that did not abort the call, but degraded its result. */
public abstract class EnsembleWarning implements Serializable {
    private static final long serialVersionUID = 1L;

    private final String message;
    @Nullable private final Throwable cause;

    protected EnsembleWarning(String message, @Nullable Throwable cause) {
        this.message = Preconditions.checkNotNull(message);
        this.cause = cause;
    }

    public String getMessage() {
        return message;
    }

    @Nullable
    public Throwable getCause() {
        return cause;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + ": " + message;
    }
}

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

package org.stackml.ensemble.cache;

import java.io.FileNotFoundException;

/** Thrown when loading a cache entry that has not been saved. */
public class CacheEntryNotFoundException extends FileNotFoundException {
    private static final long serialVersionUID = 1L;

    private final transient CacheKey key;

    public CacheEntryNotFoundException(CacheKey key, String location) {
        super("Cache entry " + key + " not found at " + location + ".");
        this.key = key;
    }

    public CacheKey getKey() {
        return key;
    }
}

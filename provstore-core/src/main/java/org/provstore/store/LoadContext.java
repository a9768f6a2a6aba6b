/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package org.provstore.store;

import java.util.HashMap;
import java.util.Map;

import org.jetbrains.annotations.Nullable;

/**
 * Objects whose records are being read, keyed by object id. Loads nest when
 * a {@code setState} touches a ghost, so an entry lives until the outermost
 * read of its object returns. A record that references an object currently
 * being loaded (including itself) resolves to the instance in here instead
 * of creating a second one.
 */
final class LoadContext {

    private final Map<String, Persistent> objects = new HashMap<>();

    void put(String oid, Persistent object) {
        objects.put(oid, object);
    }

    void remove(String oid, Persistent object) {
        objects.remove(oid, object);
    }

    @Nullable
    Persistent get(String oid) {
        return objects.get(oid);
    }
}

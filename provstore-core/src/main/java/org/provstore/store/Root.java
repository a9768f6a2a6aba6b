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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The entry point of a database: the indexes and singleton objects by name,
 * stored under {@link Database#ROOT_OID}.
 */
final class Root extends Persistent {

    private TreeMap<String, Persistent> objects = new TreeMap<>();

    boolean contains(@NotNull String name) {
        activate();
        return objects.containsKey(name);
    }

    @Nullable
    Persistent get(@NotNull String name) {
        activate();
        return objects.get(name);
    }

    void put(@NotNull String name, @NotNull Persistent object) {
        activate();
        objects.put(name, object);
        changed();
    }

    @Nullable
    Persistent remove(@NotNull String name) {
        activate();
        Persistent removed = objects.remove(name);
        changed();
        return removed;
    }

    Set<String> names() {
        activate();
        return Collections.unmodifiableSet(objects.keySet());
    }

    void clear() {
        activate();
        objects.clear();
        changed();
    }

    @NotNull
    @Override
    protected Map<String, Object> getState() {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("objects", new LinkedHashMap<String, Object>(objects));
        return state;
    }

    @SuppressWarnings("unchecked")
    @Override
    protected void setState(@NotNull Map<String, Object> state) {
        objects = new TreeMap<>();
        Map<String, Object> stored = (Map<String, Object>) state.get("objects");
        if (stored != null) {
            for (Map.Entry<String, Object> entry : stored.entrySet()) {
                objects.put(entry.getKey(), (Persistent) entry.getValue());
            }
        }
    }
}

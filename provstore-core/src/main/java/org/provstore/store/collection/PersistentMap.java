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
package org.provstore.store.collection;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.provstore.store.Persistent;

/**
 * A map with string keys, sorted by key, stored as its own record.
 *
 * @param <V> the value type
 */
public class PersistentMap<V> extends Persistent {

    private TreeMap<String, V> data = new TreeMap<>();

    public PersistentMap() {
    }

    public PersistentMap(@NotNull Map<String, ? extends V> entries) {
        data.putAll(entries);
    }

    public int size() {
        activate();
        return data.size();
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public boolean containsKey(@NotNull String key) {
        activate();
        return data.containsKey(key);
    }

    @Nullable
    public V get(@NotNull String key) {
        activate();
        return data.get(key);
    }

    @Nullable
    public V put(@NotNull String key, V value) {
        activate();
        V previous = data.put(key, value);
        changed();
        return previous;
    }

    @Nullable
    public V remove(@NotNull String key) {
        activate();
        if (!data.containsKey(key)) {
            return null;
        }
        V removed = data.remove(key);
        changed();
        return removed;
    }

    public void clear() {
        activate();
        data.clear();
        changed();
    }

    @NotNull
    public Set<String> keySet() {
        activate();
        return Collections.unmodifiableSet(data.keySet());
    }

    @NotNull
    public Collection<V> values() {
        activate();
        return Collections.unmodifiableCollection(data.values());
    }

    @NotNull
    public Set<Map.Entry<String, V>> entrySet() {
        activate();
        return Collections.unmodifiableMap(data).entrySet();
    }

    @NotNull
    @Override
    protected Map<String, Object> getState() {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("data", new LinkedHashMap<String, Object>(data));
        return state;
    }

    @SuppressWarnings("unchecked")
    @Override
    protected void setState(@NotNull Map<String, Object> state) {
        data = new TreeMap<>();
        Map<String, V> stored = (Map<String, V>) state.get("data");
        if (stored != null) {
            data.putAll(stored);
        }
    }
}

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
package org.provstore.store.storage;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import com.fasterxml.jackson.databind.node.ObjectNode;

import org.jetbrains.annotations.NotNull;
import org.provstore.store.NotFoundException;

/**
 * Keeps records in memory. Records are copied on the way in and out, so a
 * caller modifying a record does not change what is stored.
 */
public class MemoryStorage implements Storage {

    private final Map<String, ObjectNode> records = Collections.synchronizedMap(new HashMap<String, ObjectNode>());

    @Override
    public void store(@NotNull String key, @NotNull ObjectNode record) {
        records.put(key, record.deepCopy());
    }

    @NotNull
    @Override
    public ObjectNode load(@NotNull String key) throws NotFoundException {
        ObjectNode record = records.get(key);
        if (record == null) {
            throw new NotFoundException(key);
        }
        return record.deepCopy();
    }

    @Override
    public boolean exists(@NotNull String key) {
        return records.containsKey(key);
    }

    public int size() {
        return records.size();
    }

    public Set<String> keys() {
        synchronized (records) {
            return Collections.unmodifiableSet(new TreeSet<>(records.keySet()));
        }
    }
}

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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import java.util.HashMap;
import java.util.Map;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Identity map of the live objects of a {@link Database}, keyed by object id.
 * Holds clean objects and ghosts; objects waiting to be written are tracked
 * by the database until the commit moves them in here.
 */
public class Cache {

    private final Database database;

    private final Map<String, Persistent> entries = new HashMap<>();

    Cache(@NotNull Database database) {
        this.database = checkNotNull(database);
    }

    @Nullable
    public Persistent get(@NotNull String oid) {
        return entries.get(oid);
    }

    public boolean contains(@NotNull String oid) {
        return entries.containsKey(oid);
    }

    /**
     * Caches a loaded or written object.
     *
     * @throws IllegalArgumentException if {@code oid} is not the object id of
     *         {@code object} or the object belongs to another database
     * @throws IllegalStateException if another instance is cached under the same id
     */
    public void put(@NotNull String oid, @NotNull Persistent object) {
        checkArgument(object.getDatabase() == database, "Cached object jar missing: %s", object);
        checkArgument(oid.equals(object.getOid()), "Cache key does not match oid: %s != %s", oid, object.getOid());
        Persistent existing = entries.get(oid);
        checkState(existing == null || existing == object, "The same oid exists: %s != %s", existing, object);
        entries.put(oid, object);
    }

    /**
     * Caches a placeholder for an object whose record has not been read yet.
     *
     * @throws IllegalStateException if the object already has an id or the id is already cached
     */
    public void newGhost(@NotNull String oid, @NotNull Persistent object) {
        checkState(object.getOid() == null, "Object already has an oid: %s", object);
        checkState(object.getDatabase() == database, "Object does not have a jar: %s", object);
        checkState(!entries.containsKey(oid), "Duplicate oid: %s", oid);
        object.assignOid(oid);
        object.setObjectState(ObjectState.GHOST);
        entries.put(oid, object);
    }

    /**
     * @return the removed object, or {@code null} if none was cached under the id
     */
    @Nullable
    public Persistent pop(@NotNull String oid) {
        return entries.remove(oid);
    }

    public int size() {
        return entries.size();
    }

    public void clear() {
        entries.clear();
    }
}

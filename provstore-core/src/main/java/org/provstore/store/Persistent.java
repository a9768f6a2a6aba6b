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

import java.util.Map;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Base class of every object stored as its own record.
 * <p>
 * A persistent object exposes its state as a flat field map through
 * {@link #getState()} and {@link #setState(Map)}. Subclasses call
 * {@link #activate()} at the start of every accessor so that a ghost loads
 * its fields on first use, and {@link #changed()} after every mutation so
 * that the owning {@link Database} writes it on the next commit.
 * <p>
 * Persistent objects are compared by identity: within one database there is
 * at most one instance per object id.
 */
public abstract class Persistent {

    private String oid;

    private Database database;

    private ObjectState objectState = ObjectState.UNSAVED;

    /**
     * The application level identifier the object id is derived from, or
     * {@code null} for objects that get a random object id.
     */
    @Nullable
    public String getId() {
        return null;
    }

    /**
     * @return the storage key of this object, {@code null} until registered
     */
    @Nullable
    public final String getOid() {
        return oid;
    }

    @Nullable
    public final Database getDatabase() {
        return database;
    }

    @NotNull
    public final ObjectState getObjectState() {
        return objectState;
    }

    /**
     * Loads the fields of this object if it is still a ghost.
     *
     * @throws StoreException if the record of a ghost can not be loaded
     */
    protected final void activate() {
        if (objectState == ObjectState.GHOST) {
            database.loadGhost(this);
        }
    }

    /**
     * Signals a mutation. Objects not yet owned by a database are picked up
     * when a registered object referencing them is written.
     */
    protected final void changed() {
        if (database != null) {
            database.register(this);
        }
    }

    /**
     * @return the fields to store, keyed by name; names must not start with {@code @}
     */
    @NotNull
    protected abstract Map<String, Object> getState();

    /**
     * Restores the fields of this object from a stored field map. Called on
     * a freshly allocated instance or a ghost, never on a loaded object.
     */
    protected abstract void setState(@NotNull Map<String, Object> state);

    Map<String, Object> exportState() {
        activate();
        return getState();
    }

    void assignOid(String oid) {
        this.oid = oid;
    }

    void bind(Database database) {
        this.database = database;
    }

    void setObjectState(ObjectState objectState) {
        this.objectState = objectState;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{oid=" + oid + ", state=" + objectState + "}";
    }
}

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

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.LinkedHashMap;
import java.util.Map;

import org.jetbrains.annotations.NotNull;

/**
 * A structured value that is fully defined by its fields and never changes
 * after construction. Two immutable values with the same id are
 * interchangeable, so the reader hands out a single instance per id while
 * that instance is still referenced (see {@link ImmutableValueRegistry}).
 * <p>
 * A value qualifies only if all of its fields are reflected in its id: a
 * value that would differ between two versions of the same logical record
 * must not be modelled as immutable.
 */
public abstract class ImmutableValue implements Structured {

    private final String id;

    protected ImmutableValue(@NotNull String id) {
        this.id = checkNotNull(id, "id");
    }

    @NotNull
    public final String getId() {
        return id;
    }

    @NotNull
    @Override
    public final Map<String, Object> toFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(ID, id);
        writeFields(fields);
        return fields;
    }

    /**
     * Adds the fields other than the id.
     */
    protected abstract void writeFields(@NotNull Map<String, Object> fields);

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || obj.getClass() != getClass()) {
            return false;
        }
        return id.equals(((ImmutableValue) obj).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{id=" + id + "}";
    }
}

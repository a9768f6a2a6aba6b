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

import static com.google.common.base.Preconditions.checkState;

import java.util.function.Supplier;

import com.google.common.cache.CacheBuilder;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Hands out one instance per immutable value id.
 * <p>
 * Entries are weakly referenced: a value is evicted as soon as no loaded
 * object holds it any more, and the next load of the same id builds a new
 * instance.
 */
public class ImmutableValueRegistry {

    private final com.google.common.cache.Cache<String, ImmutableValue> values = CacheBuilder.newBuilder()
            .weakValues()
            .build();

    /**
     * Returns the registered instance for the id if it is of the requested
     * type, otherwise builds one through {@code factory} and registers it.
     */
    @NotNull
    public ImmutableValue intern(@NotNull String id, @NotNull Class<? extends ImmutableValue> type,
                                 @NotNull Supplier<? extends ImmutableValue> factory) {
        ImmutableValue existing = values.getIfPresent(id);
        if (type.isInstance(existing)) {
            return existing;
        }
        ImmutableValue value = factory.get();
        checkState(id.equals(value.getId()), "Value built for id '%s' has id '%s'", id, value.getId());
        values.put(id, value);
        return value;
    }

    @Nullable
    public ImmutableValue get(@NotNull String id) {
        return values.getIfPresent(id);
    }

    public long size() {
        values.cleanUp();
        return values.size();
    }

    public void clear() {
        values.invalidateAll();
    }
}

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

import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import com.google.common.base.Joiner;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A fixed size, ordered sequence of values. Unlike a {@link List} it is
 * stored with a type tag and read back as a tuple.
 */
public final class Tuple implements Iterable<Object> {

    private final Object[] values;

    private Tuple(Object[] values) {
        this.values = values;
    }

    @NotNull
    public static Tuple of(Object... values) {
        return new Tuple(values.clone());
    }

    @NotNull
    public static Tuple copyOf(List<?> values) {
        return new Tuple(values.toArray());
    }

    public int size() {
        return values.length;
    }

    @Nullable
    public Object get(int index) {
        return values[index];
    }

    @NotNull
    public List<Object> asList() {
        return Collections.unmodifiableList(Arrays.asList(values));
    }

    @Override
    public Iterator<Object> iterator() {
        return asList().iterator();
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof Tuple && Arrays.equals(values, ((Tuple) obj).values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "(" + Joiner.on(", ").useForNull("null").join(values) + ")";
    }
}

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.provstore.store.Persistent;

/**
 * A list stored as its own record. Elements can be any storable value;
 * persistent elements are stored as references.
 *
 * @param <E> the element type
 */
public class PersistentList<E> extends Persistent implements Iterable<E> {

    private List<E> data = new ArrayList<>();

    public PersistentList() {
    }

    public PersistentList(@NotNull Iterable<? extends E> elements) {
        for (E element : elements) {
            data.add(element);
        }
    }

    public int size() {
        activate();
        return data.size();
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public E get(int index) {
        activate();
        return data.get(index);
    }

    public boolean contains(@Nullable Object element) {
        activate();
        return data.contains(element);
    }

    public int indexOf(@Nullable Object element) {
        activate();
        return data.indexOf(element);
    }

    public void add(E element) {
        activate();
        data.add(element);
        changed();
    }

    public void add(int index, E element) {
        activate();
        data.add(index, element);
        changed();
    }

    public E set(int index, E element) {
        activate();
        E previous = data.set(index, element);
        changed();
        return previous;
    }

    public E remove(int index) {
        activate();
        E removed = data.remove(index);
        changed();
        return removed;
    }

    public boolean remove(@Nullable Object element) {
        activate();
        boolean removed = data.remove(element);
        if (removed) {
            changed();
        }
        return removed;
    }

    public void clear() {
        activate();
        data.clear();
        changed();
    }

    /**
     * @return a read-only view of the elements
     */
    @NotNull
    public List<E> asList() {
        activate();
        return Collections.unmodifiableList(data);
    }

    @NotNull
    @Override
    public Iterator<E> iterator() {
        return asList().iterator();
    }

    @NotNull
    @Override
    protected Map<String, Object> getState() {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("data", new ArrayList<Object>(data));
        return state;
    }

    @SuppressWarnings("unchecked")
    @Override
    protected void setState(@NotNull Map<String, Object> state) {
        Object stored = state.get("data");
        data = stored == null ? new ArrayList<E>() : new ArrayList<>((List<E>) stored);
    }
}

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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NavigableMap;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.TreeMap;

import com.google.common.base.Splitter;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A named, ordered mapping from string keys to persistent objects of one
 * type.
 * <p>
 * With an attribute path (for example {@code entity.path}) the key of an
 * entry is derived from the stored object, or from a separate key object
 * when the index declares a key type. Without an attribute path every
 * update has to supply the key. Adding an entry under an existing key
 * replaces it.
 * <p>
 * The entries are written inline in the record of the index, as references
 * to the indexed objects. Removing an entry does not delete the record of
 * the removed object.
 *
 * @param <T> the type of the indexed objects
 */
public class Index<T extends Persistent> extends Persistent {

    private static final Splitter PATH_SPLITTER = Splitter.on('.');

    private String name;

    private Class<T> objectType;

    private Class<?> keyType;

    private String attribute;

    private NavigableMap<String, T> entries = new TreeMap<>();

    /**
     * Allocates an index whose state is read from storage.
     */
    Index() {
    }

    Index(@NotNull String name, @NotNull Class<T> objectType,
          @Nullable String attribute, @Nullable Class<?> keyType) {
        checkArgument(!name.isEmpty(), "Index name must not be empty");
        checkArgument(name.equals(name.toLowerCase(Locale.ROOT)),
                "Index name must be all lowercase: '%s'.", name);
        checkArgument(name.indexOf('/') < 0 && name.indexOf('\\') < 0,
                "Index name must not contain path separators: '%s'.", name);
        checkArgument(!Database.ROOT_OID.equals(name), "Index name is reserved: '%s'.", name);
        checkArgument(attribute == null || !attribute.isEmpty(), "Empty attribute path for index '%s'", name);
        this.name = name;
        this.objectType = checkNotNull(objectType);
        this.attribute = attribute;
        this.keyType = keyType;
    }

    @NotNull
    public String getName() {
        activate();
        return name;
    }

    @NotNull
    public Class<T> getObjectType() {
        activate();
        return objectType;
    }

    @Nullable
    public Class<?> getKeyType() {
        activate();
        return keyType;
    }

    @Nullable
    public String getAttribute() {
        activate();
        return attribute;
    }

    public int size() {
        activate();
        return entries.size();
    }

    public boolean containsKey(@NotNull String key) {
        activate();
        return entries.containsKey(key);
    }

    @Nullable
    public T get(@NotNull String key) {
        activate();
        return entries.get(key);
    }

    /**
     * Removes and returns the entry under a key.
     *
     * @throws NoSuchElementException if there is no such entry
     */
    @NotNull
    public T pop(@NotNull String key) {
        activate();
        T object = entries.remove(checkNotNull(key));
        if (object == null) {
            throw new NoSuchElementException(key);
        }
        changed();
        return object;
    }

    /**
     * Removes and returns the entry under a key, or {@code defaultValue} if
     * there is no such entry.
     */
    @Nullable
    public T pop(@NotNull String key, @Nullable T defaultValue) {
        activate();
        if (!entries.containsKey(checkNotNull(key))) {
            return defaultValue;
        }
        T object = entries.remove(key);
        changed();
        return object;
    }

    /**
     * Sets an entry directly. The key is checked against the attribute path,
     * if any, but a key object can not be verified.
     */
    public void put(@NotNull String key, @NotNull T object) {
        activate();
        checkObjectType(object, "add");
        String verified = verifyAndGetKey(object, null, checkNotNull(key), true, true);
        entries.put(verified, object);
        changed();
    }

    public void add(@NotNull T object) {
        add(object, null, null, true);
    }

    public void add(@NotNull T object, @Nullable String key) {
        add(object, key, null, true);
    }

    public void add(@NotNull T object, @Nullable String key, @Nullable Object keyObject) {
        add(object, key, keyObject, true);
    }

    /**
     * Adds or replaces an entry.
     *
     * @param object the object to add
     * @param key the key to use, derived from the attribute path if {@code null}
     * @param keyObject the object to derive the key from instead of {@code object}
     * @param verify whether a supplied key must equal the derived one
     * @throws IllegalArgumentException if the object, the key or the key object does not fit the index
     */
    public void add(@NotNull T object, @Nullable String key, @Nullable Object keyObject, boolean verify) {
        activate();
        checkObjectType(object, "add");
        String verified = verifyAndGetKey(object, keyObject, key, false, verify);
        entries.put(verified, object);
        changed();
    }

    public void remove(@NotNull T object) {
        remove(object, null, null, true);
    }

    public void remove(@NotNull T object, @Nullable String key) {
        remove(object, key, null, true);
    }

    /**
     * Removes the entry of an object, resolving its key the same way as
     * {@link #add(Persistent, String, Object, boolean)}.
     *
     * @throws NoSuchElementException if there is no entry under the resolved key
     */
    public void remove(@NotNull T object, @Nullable String key, @Nullable Object keyObject, boolean verify) {
        activate();
        checkObjectType(object, "remove");
        String verified = verifyAndGetKey(object, keyObject, key, false, verify);
        if (entries.remove(verified) == null) {
            throw new NoSuchElementException(verified);
        }
        changed();
    }

    /**
     * @return the key under which {@code object} would be added
     */
    @NotNull
    public String generateKey(@NotNull T object, @Nullable Object keyObject) {
        activate();
        return verifyAndGetKey(object, keyObject, null, false, true);
    }

    @NotNull
    public List<String> keys() {
        return keys(null, null, false, false);
    }

    /**
     * @return the keys within the inclusive bounds, in ascending order; a
     *         {@code null} bound is unbounded
     */
    @NotNull
    public List<String> keys(@Nullable String min, @Nullable String max) {
        return keys(min, max, false, false);
    }

    @NotNull
    public List<String> keys(@Nullable String min, @Nullable String max, boolean excludeMin, boolean excludeMax) {
        activate();
        NavigableMap<String, T> range = entries;
        if (min != null && max != null && min.compareTo(max) > 0) {
            return Collections.emptyList();
        }
        if (min != null) {
            range = range.tailMap(min, !excludeMin);
        }
        if (max != null) {
            range = range.headMap(max, !excludeMax);
        }
        return new ArrayList<>(range.keySet());
    }

    @NotNull
    public Collection<T> values() {
        activate();
        return Collections.unmodifiableCollection(entries.values());
    }

    @NotNull
    public Set<Map.Entry<String, T>> items() {
        activate();
        return Collections.unmodifiableMap(entries).entrySet();
    }

    private void checkObjectType(Object object, String operation) {
        checkArgument(objectType.isInstance(object),
                "Cannot %s objects of type '%s'", operation, object == null ? null : object.getClass().getName());
    }

    private String verifyAndGetKey(Object object, Object keyObject, String key,
                                   boolean missingKeyObjectOk, boolean verify) {
        if (keyType != null) {
            if (!missingKeyObjectOk) {
                checkArgument(keyType.isInstance(keyObject), "Invalid key type: %s for '%s'",
                        keyObject == null ? null : keyObject.getClass().getName(), name);
            }
        } else {
            checkArgument(keyObject == null, "Index '%s' does not accept 'key_object'", name);
        }

        if (attribute == null) {
            checkArgument(key != null, "No key is provided");
            return key;
        }
        if (keyObject == null) {
            keyObject = object;
        }
        String correctKey = attributeKey(keyObject);
        if (key == null) {
            return correctKey;
        }
        if (verify) {
            checkArgument(key.equals(correctKey), "Incorrect key for index '%s': '%s' != '%s'", name, key, correctKey);
        }
        return key;
    }

    private String attributeKey(Object source) {
        Object value = source;
        for (String part : PATH_SPLITTER.split(attribute)) {
            value = attributeValue(value, part);
        }
        checkArgument(value instanceof String, "Key for index '%s' is not a string: %s", name, value);
        return (String) value;
    }

    private static Object attributeValue(Object source, String name) {
        Map<?, ?> fields;
        if (source instanceof Persistent) {
            fields = ((Persistent) source).exportState();
        } else if (source instanceof Structured) {
            fields = ((Structured) source).toFields();
        } else if (source instanceof Map) {
            fields = (Map<?, ?>) source;
        } else {
            fields = Collections.emptyMap();
        }
        if (source == null || !fields.containsKey(name)) {
            throw new IllegalArgumentException(String.format("'%s' object has no attribute '%s'",
                    source == null ? "null" : source.getClass().getSimpleName(), name));
        }
        return fields.get(name);
    }

    @NotNull
    @Override
    protected Map<String, Object> getState() {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("name", name);
        state.put("objectType", objectType);
        state.put("keyType", keyType);
        state.put("attribute", attribute);
        state.put("entries", new LinkedHashMap<String, Object>(entries));
        return state;
    }

    @SuppressWarnings("unchecked")
    @Override
    protected void setState(@NotNull Map<String, Object> state) {
        name = (String) state.get("name");
        objectType = (Class<T>) state.get("objectType");
        keyType = (Class<?>) state.get("keyType");
        attribute = (String) state.get("attribute");
        entries = new TreeMap<>();
        Map<String, Object> stored = (Map<String, Object>) state.get("entries");
        if (stored != null) {
            for (Map.Entry<String, Object> entry : stored.entrySet()) {
                entries.put(entry.getKey(), objectType.cast(entry.getValue()));
            }
        }
    }

    @Override
    public String toString() {
        return "Index{name=" + name + ", oid=" + getOid() + ", state=" + getObjectState() + "}";
    }
}

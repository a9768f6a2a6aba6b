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

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.function.Supplier;

import com.google.common.collect.ImmutableList;

import org.jetbrains.annotations.NotNull;
import org.provstore.store.collection.PersistentList;
import org.provstore.store.collection.PersistentMap;

/**
 * Closed mapping between the type tags found in stored records and the
 * factories that rebuild instances of those types.
 * <p>
 * Only types inside one of the trusted namespaces (package name prefixes)
 * can be registered, and only registered tags are ever resolved: any other
 * tag read from storage fails with a {@link DisallowedTypeException}. The
 * tag of a type is its fully qualified class name.
 * <p>
 * The tags {@value #SET_TYPE}, {@value #TUPLE_TYPE}, {@value #DATETIME_TYPE},
 * {@value #TYPE_TYPE} and the number tags are reserved for the built-in
 * value shapes, and the engine's own persistent types are always registered.
 */
public final class TypeRegistry {

    public static final String SET_TYPE = "set";

    public static final String TUPLE_TYPE = "tuple";

    public static final String DATETIME_TYPE = "datetime";

    public static final String TYPE_TYPE = "type";

    public static final String LONG_TYPE = "long";

    public static final String SHORT_TYPE = "short";

    public static final String BYTE_TYPE = "byte";

    public static final String FLOAT_TYPE = "float";

    private static final String ENGINE_NAMESPACE = "org.provstore.store";

    private final ImmutableList<String> trustedNamespaces;

    private final Map<String, Binding<?>> bindings = new ConcurrentHashMap<>();

    private final Map<Class<?>, Binding<?>> bindingsByType = new ConcurrentHashMap<>();

    /**
     * @param trustedNamespaces package name prefixes whose types may be
     *        registered, in addition to the engine's own package
     */
    public TypeRegistry(String... trustedNamespaces) {
        ImmutableList.Builder<String> namespaces = ImmutableList.builder();
        namespaces.add(ENGINE_NAMESPACE);
        for (String namespace : trustedNamespaces) {
            checkArgument(namespace != null && !namespace.isEmpty() && !namespace.endsWith("."),
                    "Invalid namespace: '%s'", namespace);
            namespaces.add(namespace);
        }
        this.trustedNamespaces = namespaces.build();

        registerPersistent(Root.class, Root::new);
        registerPersistent(Index.class, Index::new);
        registerPersistent(PersistentList.class, PersistentList::new);
        registerPersistent(PersistentMap.class, PersistentMap::new);
    }

    /**
     * Registers a persistent type, allocated empty through {@code factory}
     * before its state is loaded.
     */
    public <T extends Persistent> TypeRegistry registerPersistent(@NotNull Class<T> type,
                                                                  @NotNull Supplier<? extends T> factory) {
        checkNotNull(factory);
        return add(new Binding<T>(type, Kind.PERSISTENT, factory, null));
    }

    /**
     * Registers a structured value type, rebuilt from its field map through {@code factory}.
     */
    public <T extends Structured> TypeRegistry registerValue(@NotNull Class<T> type,
                                                             @NotNull Function<Map<String, Object>, ? extends T> factory) {
        checkNotNull(factory);
        return add(new Binding<T>(type, Kind.VALUE, null, factory));
    }

    /**
     * Registers an enum type, stored by constant name.
     */
    public <E extends Enum<E>> TypeRegistry registerEnum(@NotNull final Class<E> type) {
        return add(new Binding<E>(type, Kind.ENUM, null, null));
    }

    private TypeRegistry add(Binding<?> binding) {
        if (!isTrusted(binding.tag)) {
            throw new DisallowedTypeException(binding.tag,
                    "Type '" + binding.tag + "' is outside the trusted namespaces " + trustedNamespaces);
        }
        Binding<?> existing = bindingsByType.get(binding.type);
        checkState(existing == null || existing.kind == binding.kind,
                "Type '%s' is already registered as %s", binding.tag, existing == null ? null : existing.kind);
        bindings.put(binding.tag, binding);
        bindingsByType.put(binding.type, binding);
        return this;
    }

    public boolean isTrusted(@NotNull String tag) {
        for (String namespace : trustedNamespaces) {
            if (tag.startsWith(namespace + ".")) {
                return true;
            }
        }
        return false;
    }

    public boolean isRegistered(@NotNull Class<?> type) {
        return bindingsByType.containsKey(type);
    }

    /**
     * @return the tag a registered type is stored with
     * @throws IllegalArgumentException if the type is not registered
     */
    @NotNull
    public String getTag(@NotNull Class<?> type) {
        Binding<?> binding = bindingsByType.get(type);
        checkArgument(binding != null, "Type '%s' is not registered", type.getName());
        return binding.tag;
    }

    /**
     * Resolves a tag read from storage.
     *
     * @throws DisallowedTypeException if the tag is not trusted or not registered
     */
    @NotNull
    Binding<?> resolve(@NotNull String tag) {
        if (!isTrusted(tag)) {
            throw new DisallowedTypeException(tag, "Objects of type '" + tag + "' are not allowed");
        }
        Binding<?> binding = bindings.get(tag);
        if (binding == null) {
            throw new DisallowedTypeException(tag, "Type '" + tag + "' is not registered");
        }
        return binding;
    }

    enum Kind {
        PERSISTENT, VALUE, ENUM
    }

    static final class Binding<T> {

        final String tag;

        final Class<T> type;

        final Kind kind;

        private final Supplier<? extends T> allocator;

        private final Function<Map<String, Object>, ? extends T> valueFactory;

        Binding(Class<T> type, Kind kind,
                Supplier<? extends T> allocator,
                Function<Map<String, Object>, ? extends T> valueFactory) {
            this.tag = checkNotNull(type).getName();
            this.type = type;
            this.kind = kind;
            this.allocator = allocator;
            this.valueFactory = valueFactory;
        }

        Persistent newPersistent() {
            checkState(kind == Kind.PERSISTENT, "Type '%s' is not persistent", tag);
            T instance = allocator.get();
            checkState(type.isInstance(instance), "Factory of '%s' returned %s", tag, instance);
            return (Persistent) instance;
        }

        Structured newValue(Map<String, Object> fields) {
            checkState(kind == Kind.VALUE, "Type '%s' is not a structured value", tag);
            T instance = valueFactory.apply(fields);
            checkState(type.isInstance(instance), "Factory of '%s' returned %s", tag, instance);
            return (Structured) instance;
        }

        @SuppressWarnings({ "unchecked", "rawtypes" })
        Enum<?> enumConstant(String name) {
            checkState(kind == Kind.ENUM, "Type '%s' is not an enum", tag);
            return Enum.valueOf((Class) type, name);
        }

        boolean isImmutableValue() {
            return ImmutableValue.class.isAssignableFrom(type);
        }
    }
}

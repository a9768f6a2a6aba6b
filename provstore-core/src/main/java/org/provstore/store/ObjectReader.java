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
import static org.provstore.store.ObjectWriter.OID;
import static org.provstore.store.ObjectWriter.REFERENCE;
import static org.provstore.store.ObjectWriter.TYPE;
import static org.provstore.store.ObjectWriter.VALUE;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.databind.JsonNode;

import org.jetbrains.annotations.NotNull;

/**
 * Rebuilds persistent objects from their stored records.
 * <p>
 * A reference to an object that is neither being loaded nor known to the
 * database becomes a ghost: an empty instance of the referenced type that
 * loads its fields on first access. Immutable values are shared through the
 * {@link ImmutableValueRegistry} of this reader.
 */
public class ObjectReader {

    private final Database database;

    private final TypeRegistry types;

    private final ImmutableValueRegistry values = new ImmutableValueRegistry();

    private final LoadContext loading = new LoadContext();

    public ObjectReader(@NotNull Database database, @NotNull TypeRegistry types) {
        this.database = checkNotNull(database);
        this.types = checkNotNull(types);
    }

    @NotNull
    public ImmutableValueRegistry getImmutableValues() {
        return values;
    }

    /**
     * Creates and populates the object stored in {@code record}.
     *
     * @throws DisallowedTypeException if the record holds a type that is not registered
     */
    @NotNull
    public Persistent deserialize(@NotNull JsonNode record) {
        String oid = text(record, OID);
        TypeRegistry.Binding<?> binding = types.resolve(text(record, TYPE));
        checkArgument(binding.kind == TypeRegistry.Kind.PERSISTENT,
                "Record '%s' does not hold a persistent object: %s", oid, binding.tag);

        Persistent object = binding.newPersistent();
        object.assignOid(oid);
        object.bind(database);

        populate(object, record);
        return object;
    }

    /**
     * Populates a ghost from its record, keeping the identity of the ghost.
     *
     * @throws IllegalStateException if the record does not belong to the ghost
     */
    public void setGhostState(@NotNull Persistent ghost, @NotNull JsonNode record) {
        checkState(ghost.getObjectState() == ObjectState.GHOST, "Object is not a ghost: %s", ghost);
        String oid = text(record, OID);
        checkState(oid.equals(ghost.getOid()), "Record of '%s' loaded for ghost %s", oid, ghost);
        TypeRegistry.Binding<?> binding = types.resolve(text(record, TYPE));
        checkState(binding.type.equals(ghost.getClass()),
                "Stored type '%s' does not match ghost %s", binding.tag, ghost);

        populate(ghost, record);
    }

    private void populate(Persistent object, JsonNode record) {
        loading.put(object.getOid(), object);
        try {
            populate(object, record, loading);
        } finally {
            loading.remove(object.getOid(), object);
        }
    }

    private void populate(Persistent object, JsonNode record, LoadContext context) {
        Map<String, Object> state = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = record.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getKey().startsWith("@")) {
                state.put(field.getKey(), read(field.getValue(), context));
            }
        }
        ObjectState previous = object.getObjectState();
        object.setObjectState(ObjectState.CLEAN);
        try {
            object.setState(state);
        } catch (RuntimeException e) {
            object.setObjectState(previous);
            throw e;
        }
    }

    private Object read(JsonNode node, LoadContext context) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        } else if (node.isTextual()) {
            return node.textValue();
        } else if (node.isBoolean()) {
            return node.booleanValue();
        } else if (node.isIntegralNumber()) {
            if (node.canConvertToInt()) {
                return node.intValue();
            }
            checkArgument(node.canConvertToLong(), "Number out of range: %s", node);
            return node.longValue();
        } else if (node.isNumber()) {
            return node.doubleValue();
        } else if (node.isArray()) {
            return list(node, context);
        }
        checkArgument(node.isObject(), "Unexpected value: %s", node);

        if (!node.has(TYPE)) {
            checkArgument(!node.has(OID), "Untyped object with an oid: %s", node);
            return map(node, context);
        }
        String tag = text(node, TYPE);
        switch (tag) {
            case TypeRegistry.SET_TYPE:
                Set<Object> set = new LinkedHashSet<>();
                for (JsonNode element : value(node)) {
                    set.add(read(element, context));
                }
                return set;
            case TypeRegistry.TUPLE_TYPE:
                return Tuple.copyOf(list(value(node), context));
            case TypeRegistry.DATETIME_TYPE:
                return OffsetDateTime.parse(value(node).asText());
            case TypeRegistry.TYPE_TYPE:
                return types.resolve(value(node).asText()).type;
            case TypeRegistry.LONG_TYPE:
                return integral(node).longValue();
            case TypeRegistry.SHORT_TYPE:
                JsonNode shortValue = integral(node);
                checkArgument(shortValue.canConvertToInt() && shortValue.intValue() == (short) shortValue.intValue(),
                        "Not a short: %s", shortValue);
                return shortValue.shortValue();
            case TypeRegistry.BYTE_TYPE:
                JsonNode byteValue = integral(node);
                checkArgument(byteValue.canConvertToInt() && byteValue.intValue() == (byte) byteValue.intValue(),
                        "Not a byte: %s", byteValue);
                return (byte) byteValue.intValue();
            case TypeRegistry.FLOAT_TYPE:
                JsonNode floatValue = value(node);
                checkArgument(floatValue.isNumber(), "Not a number: %s", floatValue);
                return floatValue.floatValue();
            default:
                return readTagged(tag, node, context);
        }
    }

    private Object readTagged(String tag, JsonNode node, LoadContext context) {
        TypeRegistry.Binding<?> binding = types.resolve(tag);
        switch (binding.kind) {
            case PERSISTENT:
                checkArgument(node.path(REFERENCE).asBoolean(),
                        "Persistent object '%s' must be stored as a reference", tag);
                return resolveReference(binding, text(node, OID), context);
            case ENUM:
                return binding.enumConstant(value(node).asText());
            default:
                JsonNode value = value(node);
                checkArgument(value.isObject(), "Invalid state of '%s': %s", tag, value);
                JsonNode id = value.get(Structured.ID);
                if (binding.isImmutableValue() && id != null && id.isTextual()) {
                    return values.intern(id.textValue(), binding.type.asSubclass(ImmutableValue.class),
                            () -> (ImmutableValue) binding.newValue(map(value, context)));
                }
                return binding.newValue(map(value, context));
        }
    }

    private Persistent resolveReference(TypeRegistry.Binding<?> binding, String oid, LoadContext context) {
        Persistent object = context.get(oid);
        if (object == null) {
            object = database.getCached(oid);
        }
        if (object != null) {
            checkState(binding.type.isInstance(object),
                    "Reference to '%s' of type '%s' resolves to %s", oid, binding.tag, object);
            return object;
        }
        object = binding.newPersistent();
        database.newGhost(oid, object);
        return object;
    }

    private List<Object> list(JsonNode array, LoadContext context) {
        checkArgument(array.isArray(), "Expected an array: %s", array);
        List<Object> list = new ArrayList<>(array.size());
        for (JsonNode element : array) {
            list.add(read(element, context));
        }
        return list;
    }

    private Map<String, Object> map(JsonNode object, LoadContext context) {
        Map<String, Object> map = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            map.put(field.getKey(), read(field.getValue(), context));
        }
        return map;
    }

    private static JsonNode value(JsonNode node) {
        JsonNode value = node.get(VALUE);
        checkArgument(value != null, "Missing %s in %s", VALUE, node);
        return value;
    }

    private static JsonNode integral(JsonNode node) {
        JsonNode value = value(node);
        checkArgument(value.isIntegralNumber() && value.canConvertToLong(), "Not an integral number: %s", value);
        return value;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        checkArgument(value != null && value.isTextual(), "Missing %s in %s", field, node);
        return value.textValue();
    }
}

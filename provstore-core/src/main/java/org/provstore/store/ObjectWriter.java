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

import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Collection;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.Sets;

import org.jetbrains.annotations.NotNull;

/**
 * Converts a persistent object into the JSON record stored for it.
 * <p>
 * Nested persistent objects are never inlined: the record holds a
 * reference to them, and objects that were never registered are registered
 * with the database as a side effect, so that the running commit writes
 * them as well.
 */
public class ObjectWriter {

    public static final String TYPE = "@type";

    public static final String OID = "@oid";

    public static final String VALUE = "@value";

    public static final String REFERENCE = "@reference";

    private static final JsonNodeFactory FACTORY = JsonNodeFactory.instance;

    private final Database database;

    private final TypeRegistry types;

    public ObjectWriter(@NotNull Database database, @NotNull TypeRegistry types) {
        this.database = checkNotNull(database);
        this.types = checkNotNull(types);
    }

    /**
     * @return the record of {@code object}: its type, its object id and its fields
     * @throws IllegalArgumentException if the object has no id or owner, or
     *         holds a value that can not be stored
     */
    @NotNull
    public ObjectNode serialize(@NotNull Persistent object) {
        checkArgument(object.getOid() != null, "Object does not have an oid: '%s'", object);
        checkArgument(object.getDatabase() != null, "Object is not associated with a Database: '%s'", object);

        ObjectNode record = FACTORY.objectNode();
        record.put(OID, object.getOid());
        record.put(TYPE, types.getTag(object.getClass()));
        Set<Object> visiting = Sets.newIdentityHashSet();
        for (Map.Entry<String, ?> field : sorted(object.exportState()).entrySet()) {
            record.set(field.getKey(), write(field.getValue(), visiting));
        }
        return record;
    }

    private JsonNode write(Object value, Set<Object> visiting) {
        if (value == null) {
            return FACTORY.nullNode();
        } else if (value instanceof String) {
            return FACTORY.textNode((String) value);
        } else if (value instanceof Boolean) {
            return FACTORY.booleanNode((Boolean) value);
        } else if (value instanceof Integer) {
            return FACTORY.numberNode((Integer) value);
        } else if (value instanceof Double) {
            return FACTORY.numberNode((Double) value);
        } else if (value instanceof Long) {
            return tagged(TypeRegistry.LONG_TYPE, FACTORY.numberNode((Long) value));
        } else if (value instanceof Short) {
            return tagged(TypeRegistry.SHORT_TYPE, FACTORY.numberNode((Short) value));
        } else if (value instanceof Byte) {
            return tagged(TypeRegistry.BYTE_TYPE, FACTORY.numberNode(((Byte) value).intValue()));
        } else if (value instanceof Float) {
            return tagged(TypeRegistry.FLOAT_TYPE, FACTORY.numberNode((Float) value));
        } else if (value instanceof Persistent) {
            return reference((Persistent) value);
        } else if (value instanceof Enum) {
            Enum<?> constant = (Enum<?>) value;
            return tagged(types.getTag(constant.getDeclaringClass()), FACTORY.textNode(constant.name()));
        } else if (value instanceof OffsetDateTime) {
            String text = DateTimeFormatter.ISO_OFFSET_DATE_TIME.format((OffsetDateTime) value);
            return tagged(TypeRegistry.DATETIME_TYPE, FACTORY.textNode(text));
        } else if (value instanceof Class) {
            return tagged(TypeRegistry.TYPE_TYPE, FACTORY.textNode(types.getTag((Class<?>) value)));
        }

        checkArgument(visiting.add(value), "Cannot serialize a value that contains itself: %s", value);
        try {
            if (value instanceof Tuple) {
                return tagged(TypeRegistry.TUPLE_TYPE, array(((Tuple) value).asList(), visiting));
            } else if (value instanceof Set) {
                return tagged(TypeRegistry.SET_TYPE, array((Set<?>) value, visiting));
            } else if (value instanceof Collection) {
                return array((Collection<?>) value, visiting);
            } else if (value instanceof Map) {
                return object((Map<?, ?>) value, visiting);
            } else if (value instanceof Structured) {
                Map<String, Object> fields = ((Structured) value).toFields();
                checkArgument(fields.containsKey(Structured.ID), "Invalid object state: %s for %s", fields, value);
                return tagged(types.getTag(value.getClass()), object(fields, visiting));
            }
            throw new IllegalArgumentException(
                    "Cannot serialize object of type '" + value.getClass().getName() + "': " + value);
        } finally {
            visiting.remove(value);
        }
    }

    private JsonNode reference(Persistent object) {
        checkArgument(object.getDatabase() == null || object.getDatabase() == database,
                "Object belongs to another database: %s", object);
        if (object.getObjectState() == ObjectState.UNSAVED) {
            database.register(object);
        }
        ObjectNode reference = FACTORY.objectNode();
        reference.put(OID, object.getOid());
        reference.put(REFERENCE, true);
        reference.put(TYPE, types.getTag(object.getClass()));
        return reference;
    }

    private ArrayNode array(Collection<?> values, Set<Object> visiting) {
        ArrayNode array = FACTORY.arrayNode(values.size());
        for (Object element : values) {
            array.add(write(element, visiting));
        }
        return array;
    }

    private ObjectNode object(Map<?, ?> map, Set<Object> visiting) {
        ObjectNode node = FACTORY.objectNode();
        for (Map.Entry<String, ?> entry : sorted(map).entrySet()) {
            node.set(entry.getKey(), write(entry.getValue(), visiting));
        }
        return node;
    }

    private static ObjectNode tagged(String tag, JsonNode value) {
        ObjectNode node = FACTORY.objectNode();
        node.put(TYPE, tag);
        node.set(VALUE, value);
        return node;
    }

    private static SortedMap<String, ?> sorted(Map<?, ?> map) {
        SortedMap<String, Object> sorted = new TreeMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            checkArgument(entry.getKey() instanceof String, "Map keys must be strings: %s", entry.getKey());
            String key = (String) entry.getKey();
            checkArgument(!key.startsWith("@"), "Field names must not start with '@': %s", key);
            sorted.put(key, entry.getValue());
        }
        return sorted;
    }
}

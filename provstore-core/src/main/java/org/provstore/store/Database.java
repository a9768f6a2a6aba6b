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

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.UUID;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.io.BaseEncoding;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.provstore.store.storage.FileStorage;
import org.provstore.store.storage.Storage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An object database on top of a {@link Storage}.
 * <p>
 * Objects are loaded on demand and cached, so that there is at most one
 * instance per object id. Registered and modified objects are kept pending
 * until {@link #commit()} writes them, together with every new object they
 * reference. The named indexes and singleton objects hang off a root
 * mapping stored under {@link #ROOT_OID}.
 * <p>
 * A database is not thread safe, and nothing prevents two databases from
 * working on the same storage: callers need to ensure exclusive access.
 * A commit that fails part way leaves the objects written so far in
 * storage and the rest pending; there is no rollback.
 */
public class Database {

    private static final Logger LOG = LoggerFactory.getLogger(Database.class);

    /**
     * The object id of the root mapping.
     */
    public static final String ROOT_OID = "root";

    private static final BaseEncoding HEX = BaseEncoding.base16().lowerCase();

    private final Storage storage;

    private final TypeRegistry types;

    private final Cache cache;

    /**
     * Objects to write on the next commit, in registration order.
     */
    private final Map<String, Persistent> pending = new LinkedHashMap<>();

    private final ObjectReader reader;

    private final ObjectWriter writer;

    private final Root root;

    /**
     * Opens the database in {@code storage}, creating an empty root mapping
     * if none is stored yet.
     *
     * @throws StoreException if the root mapping can not be read
     * @throws DisallowedTypeException if the root mapping holds an unregistered type
     */
    public Database(@NotNull Storage storage, @NotNull TypeRegistry types) {
        this.storage = checkNotNull(storage);
        this.types = checkNotNull(types);
        this.cache = new Cache(this);
        this.reader = new ObjectReader(this, types);
        this.writer = new ObjectWriter(this, types);
        this.root = initializeRoot();
    }

    /**
     * Opens the database stored in a directory.
     */
    public static Database open(@NotNull File directory, @NotNull TypeRegistry types) {
        return new Database(new FileStorage(directory), types);
    }

    private Root initializeRoot() {
        try {
            Persistent stored = load(ROOT_OID);
            checkState(stored instanceof Root, "Unexpected root record: %s", stored);
            LOG.debug("Opened database in {}", storage);
            return (Root) stored;
        } catch (NotFoundException e) {
            LOG.debug("Initializing empty database in {}", storage);
            Root created = new Root();
            created.assignOid(ROOT_OID);
            register(created);
            return created;
        }
    }

    /**
     * @return the object id of a domain id: the lowercase hex SHA3-256 digest of its UTF-8 bytes
     */
    @NotNull
    public static String hashId(@NotNull String id) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA3-256");
            return HEX.encode(digest.digest(id.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA3-256 not available", e);
        }
    }

    /**
     * @return a random object id of 64 hex characters
     */
    @NotNull
    public static String newOid() {
        return hex(UUID.randomUUID()) + hex(UUID.randomUUID());
    }

    private static String hex(UUID uuid) {
        return String.format("%016x%016x", uuid.getMostSignificantBits(), uuid.getLeastSignificantBits());
    }

    @NotNull
    static String generateOid(@NotNull Persistent object) {
        if (object.getOid() != null) {
            return object.getOid();
        }
        String id = object.getId();
        return id != null && !id.isEmpty() ? hashId(id) : newOid();
    }

    /**
     * Object ids and root names are case insensitive, like the keys of a
     * {@link FileStorage}.
     */
    private static String normalize(String oid) {
        return checkNotNull(oid).toLowerCase(Locale.ROOT);
    }

    @NotNull
    public Storage getStorage() {
        return storage;
    }

    @NotNull
    public TypeRegistry getTypes() {
        return types;
    }

    //------------------------------------------------------------< root >

    public <T extends Persistent> Index<T> addIndex(@NotNull String name, @NotNull Class<T> objectType) {
        return addIndex(name, objectType, null, null);
    }

    public <T extends Persistent> Index<T> addIndex(@NotNull String name, @NotNull Class<T> objectType,
                                                    @Nullable String attribute) {
        return addIndex(name, objectType, attribute, null);
    }

    /**
     * Creates an index and adds it to the root mapping.
     *
     * @param name the name of the index, lowercase
     * @param objectType the type of the indexed objects
     * @param attribute dotted path of the attribute the keys are derived from,
     *        or {@code null} if keys are always supplied
     * @param keyType type of the objects keys are derived from instead of the
     *        indexed objects, or {@code null}
     * @throws IllegalArgumentException if the name is taken or a type is not registered
     */
    public <T extends Persistent> Index<T> addIndex(@NotNull String name, @NotNull Class<T> objectType,
                                                    @Nullable String attribute, @Nullable Class<?> keyType) {
        checkArgument(!root.contains(name), "Index or object already exists: '%s'", name);
        checkArgument(types.isRegistered(objectType), "Type '%s' is not registered", objectType.getName());
        checkArgument(keyType == null || types.isRegistered(keyType),
                "Type '%s' is not registered", keyType == null ? null : keyType.getName());

        Index<T> index = new Index<>(name, objectType, attribute, keyType);
        index.assignOid(name);
        index.bind(this);
        root.put(name, index);
        register(index);
        LOG.debug("Added index {}", name);
        return index;
    }

    /**
     * Adds a singleton object to the root mapping, stored under {@code name} in lower case.
     *
     * @throws IllegalArgumentException if the name is taken or the object already has another id
     */
    public void add(@NotNull Persistent object, @NotNull String name) {
        String oid = normalize(name);
        checkArgument(!oid.isEmpty() && !ROOT_OID.equals(oid), "Invalid oid: '%s'", oid);
        checkArgument(!root.contains(oid), "Index or object already exists: '%s'", oid);
        checkArgument(object.getOid() == null || oid.equals(object.getOid()),
                "Object already has an oid: %s", object);
        checkArgument(object.getDatabase() == null || object.getDatabase() == this,
                "Object belongs to another database: %s", object);
        object.assignOid(oid);
        object.bind(this);
        root.put(oid, object);
        register(object);
    }

    /**
     * Removes an index or singleton from the root mapping. Its record stays in storage.
     */
    public void removeRootObject(@NotNull String rootName) {
        String name = normalize(rootName);
        checkArgument(root.contains(name), "Index or object doesn't exist in root: '%s'", name);
        Persistent object = root.remove(name);
        if (object != null) {
            removeFromCache(object);
        }
    }

    @Nullable
    public Persistent getRootObject(@NotNull String name) {
        return root.get(normalize(name));
    }

    @NotNull
    public Set<String> getRootNames() {
        return root.names();
    }

    /**
     * @throws NoSuchElementException if there is no root object with that name
     * @throws IllegalArgumentException if the root object is not an index
     */
    @NotNull
    public Index<?> getIndex(@NotNull String name) {
        Persistent object = root.get(normalize(name));
        if (object == null) {
            throw new NoSuchElementException(name);
        }
        checkArgument(object instanceof Index, "Root object '%s' is not an index", name);
        return (Index<?>) object;
    }

    /**
     * @throws IllegalArgumentException if the index holds objects that are not of {@code objectType}
     */
    @SuppressWarnings("unchecked")
    @NotNull
    public <T extends Persistent> Index<T> getIndex(@NotNull String name, @NotNull Class<T> objectType) {
        Index<?> index = getIndex(name);
        checkArgument(objectType.isAssignableFrom(index.getObjectType()),
                "Index '%s' holds %s, not %s", name, index.getObjectType().getName(), objectType.getName());
        return (Index<T>) index;
    }

    //------------------------------------------------------------< objects >

    /**
     * Schedules an object to be written on the next commit, assigning its
     * object id if it has none. Persistent objects call this on every change.
     *
     * @throws IllegalStateException if the object id does not match the domain
     *         id, or another instance with the same object id is known
     */
    public void register(@NotNull Persistent object) {
        checkNotNull(object);
        checkArgument(object.getDatabase() == null || object.getDatabase() == this,
                "Object belongs to another database: %s", object);

        if (object.getOid() == null) {
            object.assignOid(generateOid(object));
        } else if (object.getId() != null && !isRootObject(object)) {
            String expected = hashId(object.getId());
            checkState(expected.equals(object.getOid()),
                    "Object has wrong oid: %s != %s", object.getOid(), expected);
        }
        String oid = object.getOid();
        Persistent known = getCached(oid);
        checkState(known == null || known == object, "The same oid exists: %s != %s", known, object);

        object.bind(this);
        if (object.getObjectState() == ObjectState.UNSAVED) {
            object.setObjectState(ObjectState.PENDING);
        } else if (object.getObjectState() == ObjectState.CLEAN) {
            object.setObjectState(ObjectState.DIRTY);
        }
        pending.put(oid, object);
    }

    private boolean isRootObject(Persistent object) {
        return root != null && root.get(object.getOid()) == object;
    }

    /**
     * Returns the object with the given object id, loading it if it is not known yet.
     *
     * @throws NotFoundException if no such object exists
     * @throws StoreException if the record can not be read
     * @throws DisallowedTypeException if the record holds an unregistered type
     */
    @NotNull
    public Persistent get(@NotNull String key) throws NotFoundException {
        String oid = normalize(key);
        if (!ROOT_OID.equals(oid) && root.contains(oid)) {
            return root.get(oid);
        }
        Persistent object = getCached(oid);
        if (object != null) {
            return object;
        }
        return load(oid);
    }

    /**
     * @throws IllegalArgumentException if the object is not of the given type
     */
    @NotNull
    public <T extends Persistent> T get(@NotNull String oid, @NotNull Class<T> type) throws NotFoundException {
        Persistent object = get(oid);
        checkArgument(type.isInstance(object), "Object '%s' is not a %s: %s", oid, type.getName(), object);
        return type.cast(object);
    }

    /**
     * Returns the object with a domain id, see {@link #hashId(String)}.
     */
    @NotNull
    public Persistent getById(@NotNull String id) throws NotFoundException {
        return get(hashId(id));
    }

    @NotNull
    public <T extends Persistent> T getById(@NotNull String id, @NotNull Class<T> type) throws NotFoundException {
        return get(hashId(id), type);
    }

    private Persistent load(String oid) throws NotFoundException {
        ObjectNode record;
        try {
            record = storage.load(oid);
        } catch (IOException e) {
            throw new StoreException("Failed to load " + oid, e);
        }
        Persistent object = reader.deserialize(record);
        checkState(oid.equals(object.getOid()), "Record %s holds object %s", oid, object.getOid());
        cache.put(oid, object);
        LOG.trace("Loaded {}", object);
        return object;
    }

    /**
     * @return the live instance of an object id, either cached or pending, or {@code null}
     */
    @Nullable
    Persistent getCached(@NotNull String oid) {
        Persistent object = cache.get(oid);
        return object != null ? object : pending.get(oid);
    }

    void newGhost(@NotNull String oid, @NotNull Persistent object) {
        object.bind(this);
        cache.newGhost(oid, object);
    }

    void loadGhost(@NotNull Persistent ghost) {
        String oid = ghost.getOid();
        try {
            reader.setGhostState(ghost, storage.load(oid));
        } catch (NotFoundException e) {
            throw new StoreException("No record for " + ghost, e);
        } catch (IOException e) {
            throw new StoreException("Failed to load " + ghost, e);
        }
        LOG.trace("Activated {}", ghost);
    }

    /**
     * Forgets an object: the next {@link #get(String)} of its object id loads
     * a new instance. Pending changes of the object are dropped.
     */
    public void removeFromCache(@NotNull Persistent object) {
        String oid = object.getOid();
        if (oid == null) {
            return;
        }
        if (cache.get(oid) == object) {
            cache.pop(oid);
        }
        if (pending.get(oid) == object) {
            pending.remove(oid);
        }
    }

    /**
     * Writes all pending objects, including the new objects they reference.
     *
     * @return the number of records written
     * @throws StoreException if a record can not be written; objects not
     *         written yet stay pending
     */
    public int commit() {
        int written = 0;
        while (!pending.isEmpty()) {
            Persistent object = pending.values().iterator().next();
            if (object.getObjectState().needsWrite()) {
                store(object);
                written++;
            }
            pending.remove(object.getOid());
        }
        LOG.debug("Committed {} records", written);
        return written;
    }

    private void store(Persistent object) {
        String oid = object.getOid();
        ObjectNode record = writer.serialize(object);
        try {
            storage.store(oid, record);
        } catch (IOException e) {
            throw new StoreException("Failed to store " + object, e);
        }
        object.setObjectState(ObjectState.CLEAN);
        cache.put(oid, object);
    }

    /**
     * Drops all cached objects, pending changes and the entries of the root
     * mapping. Nothing is deleted from storage, but the next commit writes
     * an empty root mapping.
     */
    public void clear() {
        cache.clear();
        pending.clear();
        reader.getImmutableValues().clear();
        root.clear();
    }

    @NotNull
    Cache getCache() {
        return cache;
    }

    int getPendingCount() {
        return pending.size();
    }

    @Override
    public String toString() {
        return "Database{" + storage + "}";
    }
}

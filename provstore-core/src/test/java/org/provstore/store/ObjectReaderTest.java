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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.File;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.node.ObjectNode;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.provstore.fixture.Association;
import org.provstore.fixture.Entity;
import org.provstore.fixture.Fixtures;
import org.provstore.fixture.Item;
import org.provstore.fixture.Plan;
import org.provstore.fixture.Status;
import org.provstore.store.collection.PersistentMap;
import org.provstore.store.storage.MemoryStorage;

public class ObjectReaderTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder(new File("target"));

    private TypeRegistry types;

    private MemoryStorage storage;

    private Database db;

    @Before
    public void setUp() {
        types = Fixtures.types();
        storage = new MemoryStorage();
        db = new Database(storage, types);
    }

    @SuppressWarnings("unchecked")
    private PersistentMap<Object> roundTrip(PersistentMap<Object> values) throws Exception {
        db.register(values);
        db.commit();
        return new Database(storage, types).get(values.getOid(), PersistentMap.class);
    }

    @Test
    public void scalars() throws Exception {
        PersistentMap<Object> values = new PersistentMap<>();
        values.put("text", "hello");
        values.put("int", 42);
        values.put("long", 1L << 40);
        values.put("double", 1.5);
        values.put("true", true);
        values.put("null", null);

        PersistentMap<Object> loaded = roundTrip(values);
        assertEquals("hello", loaded.get("text"));
        assertEquals(42, loaded.get("int"));
        assertEquals(1L << 40, loaded.get("long"));
        assertEquals(1.5, loaded.get("double"));
        assertEquals(Boolean.TRUE, loaded.get("true"));
        assertTrue(loaded.containsKey("null"));
        assertNull(loaded.get("null"));
    }

    @Test
    public void numberWidthsSurvive() throws Exception {
        PersistentMap<Object> values = new PersistentMap<>();
        values.put("long", 5L);
        values.put("short", (short) 7);
        values.put("byte", (byte) -3);
        values.put("float", 0.25f);
        values.put("int", 5);

        PersistentMap<Object> loaded = roundTrip(values);
        assertEquals(Long.valueOf(5L), loaded.get("long"));
        assertEquals(Short.valueOf((short) 7), loaded.get("short"));
        assertEquals(Byte.valueOf((byte) -3), loaded.get("byte"));
        assertEquals(Float.valueOf(0.25f), loaded.get("float"));
        assertEquals(Integer.valueOf(5), loaded.get("int"));
    }

    @Test
    public void smallLongSurvivesFileStorage() throws Exception {
        File directory = folder.newFolder();
        PersistentMap<Long> counters = new PersistentMap<>();
        counters.put("count", 5L);
        Database.open(directory, types).add(counters, "counters");
        counters.getDatabase().commit();

        PersistentMap<?> loaded = (PersistentMap<?>) Database.open(directory, types).getRootObject("counters");
        assertEquals(Long.valueOf(5L), loaded.get("count"));
    }

    @Test
    public void containers() throws Exception {
        Map<String, Object> nested = new LinkedHashMap<>();
        nested.put("b", 1);
        nested.put("a", Arrays.asList(true, "x"));
        PersistentMap<Object> values = new PersistentMap<>();
        values.put("list", Arrays.asList(1, "two", null));
        values.put("map", nested);
        values.put("set", new HashSet<>(Arrays.asList("x", "y")));
        values.put("tuple", Tuple.of("a", 1, Tuple.of(2.5)));

        PersistentMap<Object> loaded = roundTrip(values);
        assertEquals(Arrays.asList(1, "two", null), loaded.get("list"));
        assertEquals(nested, loaded.get("map"));
        assertEquals(new HashSet<>(Arrays.asList("x", "y")), loaded.get("set"));
        assertEquals(Tuple.of("a", 1, Tuple.of(2.5)), loaded.get("tuple"));
    }

    @Test
    public void taggedScalars() throws Exception {
        OffsetDateTime time = OffsetDateTime.of(2021, 5, 6, 7, 8, 9, 123000000, ZoneOffset.ofHours(2));
        PersistentMap<Object> values = new PersistentMap<>();
        values.put("time", time);
        values.put("type", Item.class);
        values.put("status", Status.RUNNING);

        PersistentMap<Object> loaded = roundTrip(values);
        assertEquals(time, loaded.get("time"));
        assertSame(Item.class, loaded.get("type"));
        assertSame(Status.RUNNING, loaded.get("status"));
    }

    @Test
    public void structuredValuesAndReferences() throws Exception {
        Plan plan = new Plan("/plans/1", "one");
        PersistentMap<Object> values = new PersistentMap<>();
        values.put("association", new Association("/associations/1", "alice", plan));
        values.put("entity", new Entity("a.csv", "1"));
        values.put("plan", plan);

        PersistentMap<Object> loaded = roundTrip(values);
        Association association = (Association) loaded.get("association");
        assertEquals("/associations/1", association.getId());
        assertEquals("alice", association.getAgent());
        assertSame(association.getPlan(), loaded.get("plan"));
        assertEquals("one", association.getPlan().getName());
        assertEquals(new Entity("a.csv", "1"), loaded.get("entity"));
    }

    @Test
    public void referenceToKnownObject() throws Exception {
        Plan plan = new Plan("/plans/1", "one");
        PersistentMap<Object> values = new PersistentMap<>();
        values.put("plan", plan);
        db.register(values);
        db.commit();

        db.removeFromCache(values);
        PersistentMap<?> loaded = db.get(values.getOid(), PersistentMap.class);
        assertSame(plan, loaded.get("plan"));
    }

    @Test
    public void ghostStateMustMatchType() throws Exception {
        Item item = new Item("a");
        db.register(item);
        db.commit();

        Plan ghost = new Plan();
        ((Persistent) ghost).bind(db);
        db.getCache().newGhost("other", ghost);
        ObjectNode record = storage.load(item.getOid());
        record.put("@oid", "other");
        try {
            new ObjectReader(db, types).setGhostState(ghost, record);
            fail("item record applied to a plan");
        } catch (IllegalStateException expected) {
            assertTrue(expected.getMessage().startsWith("Stored type"));
        }
        assertEquals(ObjectState.GHOST, ghost.getObjectState());
    }

    @Test
    public void deserializeRecord() throws Exception {
        Plan plan = new Plan("/plans/1", "one");
        plan.setKeywords(Arrays.asList("x"));
        db.register(plan);
        db.commit();

        Database other = new Database(storage, types);
        Persistent loaded = new ObjectReader(other, types).deserialize(storage.load(plan.getOid()));
        assertTrue(loaded instanceof Plan);
        assertEquals(plan.getOid(), loaded.getOid());
        assertSame(other, loaded.getDatabase());
        assertEquals(ObjectState.CLEAN, loaded.getObjectState());
        List<String> keywords = ((Plan) loaded).getKeywords();
        assertEquals(Arrays.asList("x"), keywords);
    }

    @Test(expected = IllegalArgumentException.class)
    public void inlinePersistentIsRejected() throws Exception {
        Item item = new Item("a");
        db.register(item);
        db.commit();

        ObjectNode record = storage.load(item.getOid());
        ObjectNode inline = record.putObject("description");
        inline.put("@type", Item.class.getName());
        inline.put("@oid", "x");
        new ObjectReader(new Database(storage, types), types).deserialize(record);
    }
}

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
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Collections;
import java.util.concurrent.TimeUnit;

import org.junit.Test;
import org.provstore.fixture.Entity;
import org.provstore.fixture.Fixtures;
import org.provstore.fixture.Item;
import org.provstore.fixture.Status;
import org.provstore.store.collection.PersistentList;
import org.provstore.store.collection.PersistentMap;

public class TypeRegistryTest {

    private final TypeRegistry types = Fixtures.types();

    @Test
    public void engineTypesAreAlwaysRegistered() {
        TypeRegistry empty = new TypeRegistry();
        assertTrue(empty.isRegistered(Index.class));
        assertTrue(empty.isRegistered(Root.class));
        assertTrue(empty.isRegistered(PersistentList.class));
        assertTrue(empty.isRegistered(PersistentMap.class));
        assertFalse(empty.isRegistered(Item.class));
    }

    @Test
    public void tagIsClassName() {
        assertEquals(Item.class.getName(), types.getTag(Item.class));
        assertSame(Item.class, types.resolve(Item.class.getName()).type);
    }

    @Test(expected = IllegalArgumentException.class)
    public void tagOfUnregisteredType() {
        types.getTag(String.class);
    }

    @Test
    public void untrustedTag() {
        try {
            types.resolve("java.lang.Runtime");
            fail("untrusted tag resolved");
        } catch (DisallowedTypeException expected) {
            assertEquals("java.lang.Runtime", expected.getTypeName());
            assertEquals("Objects of type 'java.lang.Runtime' are not allowed", expected.getMessage());
        }
    }

    @Test(expected = DisallowedTypeException.class)
    public void namespaceIsNotAPrefixOfAName() {
        types.resolve("org.provstore.fixtureEvil.Item");
    }

    @Test(expected = DisallowedTypeException.class)
    public void registeringOutsideTrustedNamespaces() {
        new TypeRegistry().registerPersistent(Item.class, Item::new);
    }

    @Test(expected = DisallowedTypeException.class)
    public void registeringJdkEnum() {
        types.registerEnum(TimeUnit.class);
    }

    @Test(expected = IllegalArgumentException.class)
    public void invalidNamespace() {
        new TypeRegistry("org.provstore.");
    }

    @Test
    public void bindings() {
        Persistent item = types.resolve(Item.class.getName()).newPersistent();
        assertTrue(item instanceof Item);
        assertEquals(ObjectState.UNSAVED, item.getObjectState());

        assertSame(Status.RUNNING, types.resolve(Status.class.getName()).enumConstant("RUNNING"));

        TypeRegistry.Binding<?> entity = types.resolve(Entity.class.getName());
        assertTrue(entity.isImmutableValue());
        assertEquals(new Entity("a", "b"), entity.newValue(new Entity("a", "b").toFields()));
    }

    @Test(expected = IllegalStateException.class)
    public void kindIsChecked() {
        types.resolve(Item.class.getName()).newValue(Collections.<String, Object>emptyMap());
    }
}

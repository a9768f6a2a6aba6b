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
package org.provstore.store.storage;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.File;
import java.io.IOException;
import java.util.zip.GZIPInputStream;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.provstore.commons.Compression;
import org.provstore.store.Database;
import org.provstore.store.NotFoundException;

public class FileStorageTest {

    @Rule
    public final TemporaryFolder folder = new TemporaryFolder(new File("target"));

    private File directory;

    private FileStorage storage;

    @Before
    public void setUp() throws IOException {
        directory = folder.newFolder();
        storage = new FileStorage(directory, Compression.NONE, true);
    }

    private static ObjectNode record(String name) {
        ObjectNode record = JsonNodeFactory.instance.objectNode();
        record.put("@type", "test");
        record.put("name", name);
        return record;
    }

    @Test
    public void longKeysAreSharded() throws Exception {
        String oid = Database.hashId("/items/a");
        storage.store(oid, record("a"));

        File file = new File(directory, oid.substring(0, 2) + "/" + oid.substring(2, 4) + "/" + oid);
        assertTrue(file.isFile());
        assertEquals(record("a"), storage.load(oid));
        assertTrue(storage.exists(oid));
    }

    @Test
    public void shortKeysAreFlat() throws Exception {
        storage.store("root", record("root"));
        assertTrue(new File(directory, "root").isFile());
        assertEquals(record("root"), storage.load("root"));
    }

    @Test
    public void keysAreLowercased() throws Exception {
        storage.store("Items", record("items"));
        assertTrue(new File(directory, "items").isFile());
        assertEquals(record("items"), storage.load("ITEMS"));
    }

    @Test
    public void overwrite() throws Exception {
        storage.store("root", record("first"));
        storage.store("root", record("second"));
        assertEquals(record("second"), storage.load("root"));
        assertEquals(1, directory.list().length);
    }

    @Test
    public void missingKey() {
        assertFalse(storage.exists("missing"));
        try {
            storage.load("missing");
            fail("missing record loaded");
        } catch (NotFoundException expected) {
            assertEquals("missing", expected.getMessage());
        } catch (IOException e) {
            throw new AssertionError(e);
        }
    }

    @Test
    public void prettyPrintedJson() throws Exception {
        storage.store("root", record("root"));
        String json = FileUtils.readFileToString(new File(directory, "root"), UTF_8);
        assertTrue(json.startsWith("{"));
        assertTrue(json.contains("\n"));
        assertTrue(json.contains("\"name\" : \"root\""));
    }

    @Test
    public void compressedRecords() throws Exception {
        FileStorage compressed = new FileStorage(directory, Compression.GZIP, false);
        compressed.store("root", record("root"));

        byte[] bytes = FileUtils.readFileToByteArray(new File(directory, "root"));
        assertTrue(Compression.GZIP.matches(bytes));
        try (GZIPInputStream in = new GZIPInputStream(FileUtils.openInputStream(new File(directory, "root")))) {
            assertEquals("{\"@type\":\"test\",\"name\":\"root\"}", IOUtils.toString(in, UTF_8));
        }

        // either storage reads both formats
        storage.store("plain", record("plain"));
        assertEquals(record("root"), storage.load("root"));
        assertEquals(record("plain"), compressed.load("plain"));
    }

    @Test
    public void malformedRecord() throws Exception {
        FileUtils.writeStringToFile(new File(directory, "broken"), "{\"name\": ", UTF_8);
        try {
            storage.load("broken");
            fail("malformed record loaded");
        } catch (IOException expected) {
            assertTrue(expected.getMessage().startsWith("Malformed record broken"));
        }
    }

    @Test(expected = IOException.class)
    public void recordMustBeAnObject() throws Exception {
        FileUtils.writeStringToFile(new File(directory, "array"), "[1, 2]", UTF_8);
        storage.load("array");
    }

    @Test(expected = IOException.class)
    public void emptyRecord() throws Exception {
        FileUtils.writeStringToFile(new File(directory, "empty"), "", UTF_8);
        storage.load("empty");
    }

    @Test
    public void lastModified() throws Exception {
        storage.store("root", record("root"));
        assertEquals(new File(directory, "root").lastModified(), storage.lastModified("root"));
    }

    @Test(expected = NotFoundException.class)
    public void lastModifiedOfMissingKey() throws Exception {
        storage.lastModified("missing");
    }

    @Test(expected = IllegalArgumentException.class)
    public void keysMustNotEscapeTheDirectory() throws Exception {
        storage.store("../outside", record("x"));
    }

    @Test
    public void noTemporaryFilesAreLeft() throws Exception {
        String oid = Database.hashId("/items/a");
        storage.store(oid, record("a"));
        storage.store(oid, record("b"));
        File shard = storage.getFile(oid).getParentFile();
        assertEquals(1, shard.list().length);
    }
}

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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.io.BufferedInputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.util.Locale;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.apache.commons.io.FileUtils;
import org.jetbrains.annotations.NotNull;
import org.provstore.commons.Compression;
import org.provstore.commons.properties.SystemPropertySupplier;
import org.provstore.store.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores records as files below a directory.
 * <p>
 * Keys are lowercased. Keys of {@value #SHARDED_KEY_LENGTH} or more
 * characters are stored as {@code key[0:2]/key[2:4]/key} to bound the number
 * of entries per directory, shorter keys directly in the root directory.
 * Files are written to a temporary file first and then moved into place.
 */
public class FileStorage implements Storage {

    private static final Logger LOG = LoggerFactory.getLogger(FileStorage.class);

    public static final int SHARDED_KEY_LENGTH = 64;

    /**
     * Whether new records are written gzip compressed. Reading detects the
     * compression of each file, whatever the setting.
     */
    static final boolean COMPRESS = SystemPropertySupplier
            .create("provstore.storage.compress", false)
            .loggingTo(LOG).get();

    static final boolean PRETTY_PRINT = SystemPropertySupplier
            .create("provstore.storage.prettyPrint", true)
            .loggingTo(LOG).get();

    private static final int HEADER_LENGTH = 2;

    private final File directory;

    private final Compression compression;

    private final ObjectMapper mapper;

    public FileStorage(@NotNull File directory) {
        this(directory, COMPRESS ? Compression.GZIP : Compression.NONE, PRETTY_PRINT);
    }

    public FileStorage(@NotNull File directory, @NotNull Compression compression, boolean prettyPrint) {
        this.directory = checkNotNull(directory);
        this.compression = checkNotNull(compression);
        this.mapper = new ObjectMapper()
                .configure(SerializationFeature.INDENT_OUTPUT, prettyPrint)
                .configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false);
    }

    @NotNull
    public File getDirectory() {
        return directory;
    }

    @Override
    public void store(@NotNull String key, @NotNull ObjectNode record) throws IOException {
        File file = getFile(key);
        File parent = file.getParentFile();
        FileUtils.forceMkdir(parent);

        File tmp = File.createTempFile("tmp", null, parent);
        try {
            try (OutputStream out = compression.getOutputStream(FileUtils.openOutputStream(tmp))) {
                mapper.writeValue(out, record);
            }
            Files.move(tmp.toPath(), file.toPath(), StandardCopyOption.REPLACE_EXISTING);
        } finally {
            FileUtils.deleteQuietly(tmp);
        }
        LOG.trace("Stored {} ({})", key, compression);
    }

    @NotNull
    @Override
    public ObjectNode load(@NotNull String key) throws NotFoundException, IOException {
        File file = getFile(key);
        if (!file.isFile()) {
            throw new NotFoundException(key);
        }
        try (InputStream in = new BufferedInputStream(FileUtils.openInputStream(file))) {
            in.mark(HEADER_LENGTH);
            byte[] header = new byte[HEADER_LENGTH];
            int read = in.read(header);
            in.reset();
            byte[] detected = read == HEADER_LENGTH ? header : new byte[0];
            JsonNode node;
            try (InputStream data = Compression.detect(detected).getInputStream(in)) {
                node = mapper.readTree(data);
            }
            if (node == null || !node.isObject()) {
                throw new IOException("Record " + key + " is not a JSON object: " + file);
            }
            return (ObjectNode) node;
        } catch (JsonProcessingException e) {
            throw new IOException("Malformed record " + key + ": " + file, e);
        }
    }

    @Override
    public boolean exists(@NotNull String key) {
        return getFile(key).isFile();
    }

    /**
     * @return the time the record was last written, in milliseconds since the epoch
     * @throws NotFoundException if no record is stored under the key
     */
    public long lastModified(@NotNull String key) throws NotFoundException {
        File file = getFile(key);
        if (!file.isFile()) {
            throw new NotFoundException(key);
        }
        return file.lastModified();
    }

    File getFile(String key) {
        checkArgument(!key.isEmpty(), "Empty key");
        checkArgument(key.indexOf('/') < 0 && key.indexOf('\\') < 0 && !key.startsWith("."),
                "Invalid key: '%s'", key);
        String name = key.toLowerCase(Locale.ROOT);
        if (name.length() >= SHARDED_KEY_LENGTH) {
            File shard = new File(new File(directory, name.substring(0, 2)), name.substring(2, 4));
            return new File(shard, name);
        }
        return new File(directory, name);
    }

    @Override
    public String toString() {
        return "FileStorage{" + directory + "}";
    }
}

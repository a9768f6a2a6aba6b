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

import java.io.IOException;

import com.fasterxml.jackson.databind.node.ObjectNode;

import org.jetbrains.annotations.NotNull;
import org.provstore.store.NotFoundException;

/**
 * Durable storage of records, one JSON object per key. Implementations do no
 * locking; callers must ensure exclusive access.
 */
public interface Storage {

    /**
     * Writes a record, replacing the record previously stored under the key.
     */
    void store(@NotNull String key, @NotNull ObjectNode record) throws IOException;

    /**
     * Reads the record stored under a key.
     *
     * @throws NotFoundException if no record is stored under the key
     * @throws IOException if the record can not be read or is not a JSON object
     */
    @NotNull
    ObjectNode load(@NotNull String key) throws NotFoundException, IOException;

    boolean exists(@NotNull String key);
}

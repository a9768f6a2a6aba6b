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

import java.util.Map;

import org.jetbrains.annotations.NotNull;

/**
 * A value stored inline in the record of the object holding it, as a type
 * tagged field map. Structured values must carry an {@value #ID} field.
 * <p>
 * Values are rebuilt from their fields by the factory they were registered
 * with in the {@link TypeRegistry}.
 */
public interface Structured {

    String ID = "id";

    /**
     * @return the fields of this value, including {@value #ID}
     */
    @NotNull
    Map<String, Object> toFields();
}

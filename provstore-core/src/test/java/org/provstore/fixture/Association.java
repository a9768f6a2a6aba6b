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
package org.provstore.fixture;

import java.util.LinkedHashMap;
import java.util.Map;

import org.jetbrains.annotations.NotNull;
import org.provstore.store.Structured;

/**
 * A mutable structured value, stored inline in its activity.
 */
public class Association implements Structured {

    private final String id;

    private String agent;

    private Plan plan;

    public Association(String id, String agent, Plan plan) {
        this.id = id;
        this.agent = agent;
        this.plan = plan;
    }

    public static Association fromFields(Map<String, Object> fields) {
        return new Association((String) fields.get(ID), (String) fields.get("agent"), (Plan) fields.get("plan"));
    }

    public String getId() {
        return id;
    }

    public String getAgent() {
        return agent;
    }

    public Plan getPlan() {
        return plan;
    }

    @NotNull
    @Override
    public Map<String, Object> toFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(ID, id);
        fields.put("agent", agent);
        fields.put("plan", plan);
        return fields;
    }
}

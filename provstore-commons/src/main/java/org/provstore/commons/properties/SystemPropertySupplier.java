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
package org.provstore.commons.properties;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads a boolean switch from a system property, falling back to a default.
 * <p>
 * Only {@code true} and {@code false} (ignoring case) are accepted. Other
 * values are logged at ERROR and ignored, and values that differ from the
 * default are logged at INFO.
 */
public class SystemPropertySupplier implements Supplier<Boolean> {

    private static final Logger LOG = LoggerFactory.getLogger(SystemPropertySupplier.class);

    private final String propName;
    private final boolean defaultValue;

    private Logger log = LOG;
    private Function<String, String> sysPropReader = System::getProperty;

    private SystemPropertySupplier(@NotNull String propName, boolean defaultValue) {
        this.propName = Objects.requireNonNull(propName, "propertyName must be non-null");
        this.defaultValue = defaultValue;
    }

    public static SystemPropertySupplier create(@NotNull String propName, boolean defaultValue) {
        return new SystemPropertySupplier(propName, defaultValue);
    }

    /**
     * Specify the {@link Logger} to log to (defaults to this classes logger otherwise).
     */
    public SystemPropertySupplier loggingTo(@NotNull Logger log) {
        this.log = Objects.requireNonNull(log);
        return this;
    }

    /**
     * <em>For unit testing</em>: specify a function to read system properties
     * (overriding default of {@code System.getProperty(String)}).
     */
    protected SystemPropertySupplier usingSystemPropertyReader(@NotNull Function<String, String> sysPropReader) {
        this.sysPropReader = Objects.requireNonNull(sysPropReader);
        return this;
    }

    @Override
    public Boolean get() {
        String value = sysPropReader.apply(propName);
        if (value == null) {
            log.trace("System property {} not set", propName);
            return defaultValue;
        }

        String trimmed = value.trim();
        boolean result;
        if ("true".equalsIgnoreCase(trimmed)) {
            result = true;
        } else if ("false".equalsIgnoreCase(trimmed)) {
            result = false;
        } else {
            log.error("Ignoring malformed value '{}' for system property {}", value, propName);
            return defaultValue;
        }

        if (result != defaultValue) {
            log.info("System property {} found to be '{}'", propName, result);
        }
        return result;
    }
}

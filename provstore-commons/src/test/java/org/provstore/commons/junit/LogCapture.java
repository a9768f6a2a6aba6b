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
package org.provstore.commons.junit;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

import org.junit.rules.ExternalResource;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.AppenderBase;

/**
 * Rule capturing the messages a logger receives at or above a level while a
 * test runs.
 */
public class LogCapture extends ExternalResource {

    private final Logger logger;

    private final Level level;

    private final List<String> messages = new CopyOnWriteArrayList<>();

    private final AppenderBase<ILoggingEvent> appender = new AppenderBase<ILoggingEvent>() {
        @Override
        protected void append(ILoggingEvent event) {
            if (event.getLevel().isGreaterOrEqual(level)) {
                messages.add(event.getFormattedMessage());
            }
        }
    };

    private Level originalLevel;

    public LogCapture(Class<?> type, Level level) {
        this.logger = ((LoggerContext) LoggerFactory.getILoggerFactory()).getLogger(type.getName());
        this.level = level;
    }

    public List<String> messagesContaining(String text) {
        return messages.stream().filter(m -> m.contains(text)).collect(Collectors.toList());
    }

    @Override
    protected void before() {
        originalLevel = logger.getLevel();
        logger.setLevel(level);
        appender.start();
        logger.addAppender(appender);
    }

    @Override
    protected void after() {
        logger.detachAppender(appender);
        appender.stop();
        logger.setLevel(originalLevel);
        messages.clear();
    }
}

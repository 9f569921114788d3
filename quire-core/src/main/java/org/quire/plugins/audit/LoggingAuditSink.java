/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.quire.plugins.audit;

import javax.annotation.Nonnull;

import org.quire.spi.audit.AuditEvent;
import org.quire.spi.audit.AuditSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes audit events to the {@code org.quire.audit} logger. The level
 * follows the severity of the event; critical events are logged as errors.
 */
public class LoggingAuditSink implements AuditSink {

    public static final String AUDIT_LOGGER = "org.quire.audit";

    private static final Logger audit = LoggerFactory.getLogger(AUDIT_LOGGER);

    @Override
    public void emit(@Nonnull AuditEvent event) {
        String format = "{} {} by {} on {}: {}";
        Object[] args = {event.getSeverity(), event.getAction(), event.getSubjectId(),
                event.getResourceId(), event.getDetails()};
        switch (event.getSeverity()) {
            case INFO:
                audit.info(format, args);
                break;
            case WARN:
                audit.warn(format, args);
                break;
            default:
                audit.error(format, args);
        }
    }
}

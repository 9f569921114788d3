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
package org.quire.spi.audit;

import static com.google.common.base.Preconditions.checkNotNull;

import java.time.Instant;

import javax.annotation.Nonnull;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

/**
 * Immutable audit record. The details never carry block payloads or ACL
 * entries.
 */
public final class AuditEvent {

    private final Instant timestamp;
    private final String subjectId;
    private final AuditAction action;
    private final String resourceId;
    private final String details;
    private final Severity severity;

    public AuditEvent(@Nonnull Instant timestamp, @Nonnull String subjectId, @Nonnull AuditAction action,
                      @Nonnull String resourceId, @Nonnull String details, @Nonnull Severity severity) {
        this.timestamp = checkNotNull(timestamp);
        this.subjectId = checkNotNull(subjectId);
        this.action = checkNotNull(action);
        this.resourceId = checkNotNull(resourceId);
        this.details = checkNotNull(details);
        this.severity = checkNotNull(severity);
    }

    @Nonnull
    public Instant getTimestamp() {
        return timestamp;
    }

    @Nonnull
    public String getSubjectId() {
        return subjectId;
    }

    @Nonnull
    public AuditAction getAction() {
        return action;
    }

    @Nonnull
    public String getResourceId() {
        return resourceId;
    }

    @Nonnull
    public String getDetails() {
        return details;
    }

    @Nonnull
    public Severity getSeverity() {
        return severity;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof AuditEvent)) {
            return false;
        }
        AuditEvent that = (AuditEvent) other;
        return timestamp.equals(that.timestamp)
                && subjectId.equals(that.subjectId)
                && action == that.action
                && resourceId.equals(that.resourceId)
                && details.equals(that.details)
                && severity == that.severity;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(timestamp, subjectId, action, resourceId, details, severity);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("timestamp", timestamp)
                .add("subjectId", subjectId)
                .add("action", action)
                .add("resourceId", resourceId)
                .add("details", details)
                .add("severity", severity)
                .toString();
    }
}

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
package org.quire.api;

import static com.google.common.base.Preconditions.checkNotNull;

import java.time.Instant;

import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

/**
 * Pointer to a block of another document. A reference never holds the
 * content of its target: every resolution goes back to the owning
 * authority.
 */
public final class ExternalReference {

    private final String id;
    private final String targetDocId;
    private final String targetBlockId;
    private final String originUrl;
    private final ReferenceStatus status;
    private final Instant lastVerified;

    public ExternalReference(@Nonnull String id, @Nonnull String targetDocId, @Nonnull String targetBlockId,
                             @Nullable String originUrl, @Nonnull ReferenceStatus status,
                             @Nullable Instant lastVerified) {
        this.id = checkNotNull(id);
        this.targetDocId = checkNotNull(targetDocId);
        this.targetBlockId = checkNotNull(targetBlockId);
        this.originUrl = originUrl;
        this.status = checkNotNull(status);
        this.lastVerified = lastVerified;
    }

    /**
     * Creates a reference that has not been resolved yet. Its status is
     * {@link ReferenceStatus#ACTIVE} until the first resolution says
     * otherwise.
     */
    public ExternalReference(@Nonnull String id, @Nonnull String targetDocId, @Nonnull String targetBlockId,
                             @Nullable String originUrl) {
        this(id, targetDocId, targetBlockId, originUrl, ReferenceStatus.ACTIVE, null);
    }

    @Nonnull
    public String getId() {
        return id;
    }

    @Nonnull
    public String getTargetDocId() {
        return targetDocId;
    }

    @Nonnull
    public String getTargetBlockId() {
        return targetBlockId;
    }

    @CheckForNull
    public String getOriginUrl() {
        return originUrl;
    }

    @Nonnull
    public ReferenceStatus getStatus() {
        return status;
    }

    /**
     * @return when the status was last established, {@code null} if the
     *         reference was never resolved
     */
    @CheckForNull
    public Instant getLastVerified() {
        return lastVerified;
    }

    @Nonnull
    public ExternalReference withStatus(@Nonnull ReferenceStatus status, @Nonnull Instant verifiedAt) {
        return new ExternalReference(id, targetDocId, targetBlockId, originUrl,
                status, checkNotNull(verifiedAt));
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ExternalReference)) {
            return false;
        }
        ExternalReference that = (ExternalReference) other;
        return id.equals(that.id)
                && targetDocId.equals(that.targetDocId)
                && targetBlockId.equals(that.targetBlockId)
                && Objects.equal(originUrl, that.originUrl)
                && status == that.status
                && Objects.equal(lastVerified, that.lastVerified);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(id, targetDocId, targetBlockId, originUrl, status, lastVerified);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", id)
                .add("target", targetDocId + '/' + targetBlockId)
                .add("status", status)
                .add("lastVerified", lastVerified)
                .omitNullValues()
                .toString();
    }
}

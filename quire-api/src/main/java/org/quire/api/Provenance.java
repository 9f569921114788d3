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
 * Where a block came from and, once sealed, who signed it.
 */
public final class Provenance {

    private final String sourceId;
    private final String authorId;
    private final Instant timestamp;
    private final String signature;
    private final String signerId;
    private final String originDocId;
    private final String originUrl;

    private Provenance(Builder b) {
        this.sourceId = b.sourceId;
        this.authorId = b.authorId;
        this.timestamp = b.timestamp;
        this.signature = b.signature;
        this.signerId = b.signerId;
        this.originDocId = b.originDocId;
        this.originUrl = b.originUrl;
    }

    @Nonnull
    public static Builder builder(@Nonnull String sourceId, @Nonnull String authorId, @Nonnull Instant timestamp) {
        return new Builder(sourceId, authorId, timestamp);
    }

    @Nonnull
    public String getSourceId() {
        return sourceId;
    }

    @Nonnull
    public String getAuthorId() {
        return authorId;
    }

    @Nonnull
    public Instant getTimestamp() {
        return timestamp;
    }

    @CheckForNull
    public String getSignature() {
        return signature;
    }

    @CheckForNull
    public String getSignerId() {
        return signerId;
    }

    /**
     * @return the id of the document this block was imported from, or
     *         {@code null} for content authored locally
     */
    @CheckForNull
    public String getOriginDocId() {
        return originDocId;
    }

    @CheckForNull
    public String getOriginUrl() {
        return originUrl;
    }

    public boolean isSigned() {
        return signature != null && !signature.isEmpty();
    }

    /**
     * Returns a copy carrying the given seal. The timestamp becomes the
     * signing time.
     */
    @Nonnull
    public Provenance withSignature(@Nonnull String signature, @Nonnull String signerId, @Nonnull Instant signedAt) {
        return toBuilder()
                .signature(checkNotNull(signature), checkNotNull(signerId))
                .timestamp(signedAt)
                .build();
    }

    @Nonnull
    public Builder toBuilder() {
        return new Builder(sourceId, authorId, timestamp)
                .signature(signature, signerId)
                .origin(originDocId, originUrl);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Provenance)) {
            return false;
        }
        Provenance that = (Provenance) other;
        return sourceId.equals(that.sourceId)
                && authorId.equals(that.authorId)
                && timestamp.equals(that.timestamp)
                && Objects.equal(signature, that.signature)
                && Objects.equal(signerId, that.signerId)
                && Objects.equal(originDocId, that.originDocId)
                && Objects.equal(originUrl, that.originUrl);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(sourceId, authorId, timestamp, signature, signerId, originDocId, originUrl);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("sourceId", sourceId)
                .add("authorId", authorId)
                .add("timestamp", timestamp)
                .add("signed", isSigned())
                .add("signerId", signerId)
                .add("originDocId", originDocId)
                .omitNullValues()
                .toString();
    }

    public static final class Builder {

        private final String sourceId;
        private final String authorId;
        private Instant timestamp;
        private String signature;
        private String signerId;
        private String originDocId;
        private String originUrl;

        private Builder(String sourceId, String authorId, Instant timestamp) {
            this.sourceId = checkNotNull(sourceId);
            this.authorId = checkNotNull(authorId);
            this.timestamp = checkNotNull(timestamp);
        }

        public Builder timestamp(@Nonnull Instant timestamp) {
            this.timestamp = checkNotNull(timestamp);
            return this;
        }

        public Builder signature(@Nullable String signature, @Nullable String signerId) {
            this.signature = signature;
            this.signerId = signerId;
            return this;
        }

        public Builder origin(@Nullable String originDocId, @Nullable String originUrl) {
            this.originDocId = originDocId;
            this.originUrl = originUrl;
            return this;
        }

        public Provenance build() {
            return new Provenance(this);
        }
    }
}

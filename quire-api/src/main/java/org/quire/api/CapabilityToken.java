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

import javax.annotation.Nonnull;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

/**
 * Short-lived signed credential that lets the owning authority of a
 * document skip the full authorization handshake for one
 * {@link TokenScope scope}. Tokens are held in memory only and are never
 * a substitute for authorization: an expired, mismatched or absent token
 * always falls back to full evaluation.
 */
public final class CapabilityToken {

    private final String tokenId;
    private final TokenScope scope;
    private final String signature;
    private final Instant expiresAt;

    public CapabilityToken(@Nonnull String tokenId, @Nonnull TokenScope scope,
                           @Nonnull String signature, @Nonnull Instant expiresAt) {
        this.tokenId = checkNotNull(tokenId);
        this.scope = checkNotNull(scope);
        this.signature = checkNotNull(signature);
        this.expiresAt = checkNotNull(expiresAt);
    }

    @Nonnull
    public String getTokenId() {
        return tokenId;
    }

    @Nonnull
    public TokenScope getScope() {
        return scope;
    }

    @Nonnull
    public String getSignature() {
        return signature;
    }

    @Nonnull
    public Instant getExpiresAt() {
        return expiresAt;
    }

    /**
     * @param now the current time
     * @return {@code true} if this token is past its expiry at {@code now}
     */
    public boolean isExpired(@Nonnull Instant now) {
        return !now.isBefore(expiresAt);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof CapabilityToken)) {
            return false;
        }
        CapabilityToken that = (CapabilityToken) other;
        return tokenId.equals(that.tokenId)
                && scope.equals(that.scope)
                && signature.equals(that.signature)
                && expiresAt.equals(that.expiresAt);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(tokenId, scope, signature, expiresAt);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("tokenId", tokenId)
                .add("scope", scope)
                .add("expiresAt", expiresAt)
                .toString();
    }
}

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
package org.quire.spi.security;

import static com.google.common.base.Preconditions.checkNotNull;

import java.time.Instant;

import javax.annotation.Nonnull;

import com.google.common.base.MoreObjects;

/**
 * Answer of a {@link SigningAuthority} to a signing request.
 */
public final class SignatureResult {

    private final String signature;
    private final String signerId;
    private final Instant timestamp;
    private final String algorithm;

    public SignatureResult(@Nonnull String signature, @Nonnull String signerId,
                           @Nonnull Instant timestamp, @Nonnull String algorithm) {
        this.signature = checkNotNull(signature);
        this.signerId = checkNotNull(signerId);
        this.timestamp = checkNotNull(timestamp);
        this.algorithm = checkNotNull(algorithm);
    }

    @Nonnull
    public String getSignature() {
        return signature;
    }

    @Nonnull
    public String getSignerId() {
        return signerId;
    }

    @Nonnull
    public Instant getTimestamp() {
        return timestamp;
    }

    @Nonnull
    public String getAlgorithm() {
        return algorithm;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("signerId", signerId)
                .add("timestamp", timestamp)
                .add("algorithm", algorithm)
                .toString();
    }
}

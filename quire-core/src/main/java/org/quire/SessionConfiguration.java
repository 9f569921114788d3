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
package org.quire;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.concurrent.TimeUnit;

import javax.annotation.Nonnull;

import com.google.common.base.MoreObjects;
import org.quire.commons.properties.SystemPropertySupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tunables of a {@link SecureDocumentSession}. The defaults can be
 * overridden with system properties:
 * <ul>
 *     <li>{@code quire.token.ttl.seconds}: lifetime of issued capability
 *     tokens, default 300</li>
 *     <li>{@code quire.token.skew.millis}: clock skew tolerated when judging
 *     token expiry locally, default 0</li>
 *     <li>{@code quire.filter.debounce.millis}: coalescing window of the sync
 *     filter, default 50</li>
 *     <li>{@code quire.authority.timeout.millis}: bound on a handshake or
 *     signature round trip, default 5000</li>
 *     <li>{@code quire.prefetch.enabled}: speculative token prefetch,
 *     default true</li>
 * </ul>
 */
public final class SessionConfiguration {

    private static final Logger log = LoggerFactory.getLogger(SessionConfiguration.class);

    public static final String PARAM_TOKEN_TTL_SECONDS = "quire.token.ttl.seconds";
    public static final String PARAM_TOKEN_SKEW_MILLIS = "quire.token.skew.millis";
    public static final String PARAM_DEBOUNCE_MILLIS = "quire.filter.debounce.millis";
    public static final String PARAM_AUTHORITY_TIMEOUT_MILLIS = "quire.authority.timeout.millis";
    public static final String PARAM_PREFETCH_ENABLED = "quire.prefetch.enabled";

    public static final long DEFAULT_TOKEN_TTL_SECONDS = 300;
    public static final long DEFAULT_TOKEN_SKEW_MILLIS = 0;
    public static final long DEFAULT_DEBOUNCE_MILLIS = 50;
    public static final long DEFAULT_AUTHORITY_TIMEOUT_MILLIS = 5000;

    private final long tokenTtlMillis;
    private final long tokenSkewMillis;
    private final long debounceMillis;
    private final long authorityTimeoutMillis;
    private final boolean prefetchEnabled;

    private SessionConfiguration(Builder b) {
        this.tokenTtlMillis = b.tokenTtlMillis;
        this.tokenSkewMillis = b.tokenSkewMillis;
        this.debounceMillis = b.debounceMillis;
        this.authorityTimeoutMillis = b.authorityTimeoutMillis;
        this.prefetchEnabled = b.prefetchEnabled;
    }

    /**
     * @return a configuration with the defaults, overridden by system
     *         properties where set
     */
    @Nonnull
    public static SessionConfiguration fromSystemProperties() {
        return builder().build();
    }

    @Nonnull
    public static Builder builder() {
        return new Builder();
    }

    public long getTokenTtlMillis() {
        return tokenTtlMillis;
    }

    public long getTokenSkewMillis() {
        return tokenSkewMillis;
    }

    public long getDebounceMillis() {
        return debounceMillis;
    }

    public long getAuthorityTimeoutMillis() {
        return authorityTimeoutMillis;
    }

    public boolean isPrefetchEnabled() {
        return prefetchEnabled;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("tokenTtlMillis", tokenTtlMillis)
                .add("tokenSkewMillis", tokenSkewMillis)
                .add("debounceMillis", debounceMillis)
                .add("authorityTimeoutMillis", authorityTimeoutMillis)
                .add("prefetchEnabled", prefetchEnabled)
                .toString();
    }

    public static final class Builder {

        private long tokenTtlMillis = TimeUnit.SECONDS.toMillis(
                SystemPropertySupplier.create(PARAM_TOKEN_TTL_SECONDS, DEFAULT_TOKEN_TTL_SECONDS)
                        .loggingTo(log).validateWith(v -> v > 0).get());
        private long tokenSkewMillis =
                SystemPropertySupplier.create(PARAM_TOKEN_SKEW_MILLIS, DEFAULT_TOKEN_SKEW_MILLIS)
                        .loggingTo(log).validateWith(v -> v >= 0).get();
        private long debounceMillis =
                SystemPropertySupplier.create(PARAM_DEBOUNCE_MILLIS, DEFAULT_DEBOUNCE_MILLIS)
                        .loggingTo(log).validateWith(v -> v >= 0).get();
        private long authorityTimeoutMillis =
                SystemPropertySupplier.create(PARAM_AUTHORITY_TIMEOUT_MILLIS, DEFAULT_AUTHORITY_TIMEOUT_MILLIS)
                        .loggingTo(log).validateWith(v -> v > 0).get();
        private boolean prefetchEnabled =
                SystemPropertySupplier.create(PARAM_PREFETCH_ENABLED, Boolean.TRUE)
                        .loggingTo(log).get();

        private Builder() {
        }

        public Builder tokenTtl(long amount, @Nonnull TimeUnit unit) {
            checkArgument(amount > 0, "token ttl must be positive");
            this.tokenTtlMillis = unit.toMillis(amount);
            return this;
        }

        public Builder tokenSkew(long amount, @Nonnull TimeUnit unit) {
            checkArgument(amount >= 0, "token skew must not be negative");
            this.tokenSkewMillis = unit.toMillis(amount);
            return this;
        }

        public Builder debounce(long amount, @Nonnull TimeUnit unit) {
            checkArgument(amount >= 0, "debounce must not be negative");
            this.debounceMillis = unit.toMillis(amount);
            return this;
        }

        public Builder authorityTimeout(long amount, @Nonnull TimeUnit unit) {
            checkArgument(amount > 0, "authority timeout must be positive");
            this.authorityTimeoutMillis = unit.toMillis(amount);
            return this;
        }

        public Builder prefetch(boolean enabled) {
            this.prefetchEnabled = enabled;
            return this;
        }

        public SessionConfiguration build() {
            return new SessionConfiguration(this);
        }
    }
}

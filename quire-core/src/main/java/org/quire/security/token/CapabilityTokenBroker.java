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
package org.quire.security.token;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import org.quire.SessionConfiguration;
import org.quire.api.AuthorityUnavailableException;
import org.quire.api.CapabilityToken;
import org.quire.api.ExternalReference;
import org.quire.api.Subject;
import org.quire.api.TokenScope;
import org.quire.plugins.metadata.MetadataShadowStore;
import org.quire.spi.reference.AuthorityProvider;
import org.quire.spi.reference.TargetDocumentAuthority;
import org.quire.stats.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Obtains capability tokens from the authorities owning referenced
 * documents and keeps them in the token map of the
 * {@link MetadataShadowStore}, keyed by their (subject, document, block)
 * scope.
 * <p>
 * A token only saves the owning authority a full evaluation; it is never
 * used to decide access locally. Denied or failed handshakes cache
 * nothing. Answers arriving for a request that was superseded by a newer
 * request for the same scope, or that was started before the last
 * {@link #invalidateAll()}, are discarded.
 */
public class CapabilityTokenBroker {

    private static final Logger log = LoggerFactory.getLogger(CapabilityTokenBroker.class);

    private final AuthorityProvider authorities;
    private final MetadataShadowStore store;
    private final Executor executor;
    private final Clock clock;
    private final SessionConfiguration config;

    private final Object lock = new Object();

    private final Map<TokenScope, Long> pending = Maps.newHashMap();

    private long counter;

    private long generation;

    public CapabilityTokenBroker(@Nonnull AuthorityProvider authorities, @Nonnull MetadataShadowStore store,
                                 @Nonnull Executor executor, @Nonnull Clock clock,
                                 @Nonnull SessionConfiguration config) {
        this.authorities = checkNotNull(authorities);
        this.store = checkNotNull(store);
        this.executor = checkNotNull(executor);
        this.clock = checkNotNull(clock);
        this.config = checkNotNull(config);
    }

    /**
     * Runs a full handshake with the authority owning {@code targetDocId}.
     *
     * @return a future completing with the token, or with {@code null} if the
     *         subject was denied, the authority failed or timed out, or the
     *         answer became stale
     */
    @Nonnull
    public CompletableFuture<CapabilityToken> requestToken(@Nonnull final Subject subject,
                                                           @Nonnull final String targetDocId,
                                                           @Nonnull final String targetBlockId) {
        final TokenScope scope = new TokenScope(subject.getId(), targetDocId, targetBlockId);
        final TargetDocumentAuthority authority = authorities.getAuthority(targetDocId);
        if (authority == null) {
            log.warn("No authority for document {}, no token for {}", targetDocId, scope);
            return CompletableFuture.completedFuture(null);
        }
        final long seq;
        final long gen;
        synchronized (lock) {
            seq = ++counter;
            gen = generation;
            pending.put(scope, seq);
        }
        return CompletableFuture
                .supplyAsync(() -> {
                    try {
                        return authority.issueToken(subject, targetDocId, targetBlockId);
                    } catch (AuthorityUnavailableException e) {
                        throw new CompletionException(e);
                    }
                }, executor)
                .orTimeout(config.getAuthorityTimeoutMillis(), TimeUnit.MILLISECONDS)
                .handle((token, t) -> {
                    synchronized (lock) {
                        Long current = pending.get(scope);
                        if (gen != generation || current == null || current != seq) {
                            log.warn("Discarding stale token response for {}", scope);
                            return null;
                        }
                        pending.remove(scope);
                        if (t != null) {
                            log.warn("Token handshake for {} failed", scope, t);
                            return null;
                        }
                        if (token == null) {
                            log.debug("Token for {} denied", scope);
                            return null;
                        }
                        if (!token.getScope().equals(scope)) {
                            log.warn("Authority returned token for {} when asked for {}", token.getScope(), scope);
                            return null;
                        }
                        store.putToken(token);
                        return token;
                    }
                });
    }

    /**
     * @return the cached token for the scope, or {@code null} if there is
     *         none or it is about to expire. Expired tokens are dropped.
     */
    @CheckForNull
    public CapabilityToken getToken(@Nonnull Subject subject, @Nonnull String targetDocId,
                                    @Nonnull String targetBlockId) {
        TokenScope scope = new TokenScope(subject.getId(), targetDocId, targetBlockId);
        CapabilityToken token = store.getToken(scope);
        if (token == null) {
            return null;
        }
        long now = clock.getTime() + config.getTokenSkewMillis();
        if (token.getExpiresAt().toEpochMilli() <= now) {
            store.removeToken(token);
            log.debug("Dropped expired token for {}", scope);
            return null;
        }
        return token;
    }

    /**
     * Drops a cached token the authority no longer accepts.
     */
    public void discard(@Nonnull CapabilityToken token) {
        if (store.removeToken(token)) {
            log.debug("Discarded token for {}", token.getScope());
        }
    }

    /**
     * Invalidates all cached tokens and all handshakes in flight. Called on
     * every change of the local subject.
     *
     * @return the number of cached tokens dropped
     */
    public int invalidateAll() {
        int n;
        synchronized (lock) {
            generation++;
            pending.clear();
            n = store.clearAllTokens();
        }
        log.debug("Invalidated {} tokens", n);
        return n;
    }

    /**
     * Requests tokens for all references that have no usable token yet.
     * Only tokens are fetched: the content of the referenced blocks is
     * neither resolved nor cached.
     */
    @Nonnull
    public CompletableFuture<Void> prefetch(@Nonnull Subject subject,
                                            @Nonnull Collection<ExternalReference> references) {
        if (!config.isPrefetchEnabled()) {
            return CompletableFuture.completedFuture(null);
        }
        List<CompletableFuture<CapabilityToken>> requests = Lists.newArrayList();
        for (ExternalReference ref : references) {
            if (getToken(subject, ref.getTargetDocId(), ref.getTargetBlockId()) == null) {
                requests.add(requestToken(subject, ref.getTargetDocId(), ref.getTargetBlockId()));
            }
        }
        log.debug("Prefetching {} tokens for {}", requests.size(), subject.getId());
        return CompletableFuture.allOf(requests.toArray(new CompletableFuture<?>[0]));
    }
}

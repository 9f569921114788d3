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
package org.quire.plugins.reference;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

import javax.annotation.Nonnull;

import org.quire.api.AuthorityUnavailableException;
import org.quire.api.CapabilityToken;
import org.quire.api.ExternalReference;
import org.quire.api.ReferenceStatus;
import org.quire.api.Subject;
import org.quire.security.token.CapabilityTokenBroker;
import org.quire.spi.audit.AuditAction;
import org.quire.spi.audit.AuditEvent;
import org.quire.spi.audit.AuditSink;
import org.quire.spi.audit.Severity;
import org.quire.spi.reference.AuthorityProvider;
import org.quire.spi.reference.ResolveResult;
import org.quire.spi.reference.TargetDocumentAuthority;
import org.quire.stats.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves external references for display. Every call goes to the owning
 * authority, presenting a cached token if one is held; the content that
 * comes back is handed to the caller and not kept anywhere. The status of
 * the reference is updated with each outcome.
 */
public class TransclusionResolver {

    private static final Logger log = LoggerFactory.getLogger(TransclusionResolver.class);

    private final ExternalReferenceRegistry registry;
    private final CapabilityTokenBroker broker;
    private final AuthorityProvider authorities;
    private final Executor executor;
    private final Clock clock;
    private final AuditSink audit;
    private final long timeoutMillis;

    public TransclusionResolver(@Nonnull ExternalReferenceRegistry registry, @Nonnull CapabilityTokenBroker broker,
                                @Nonnull AuthorityProvider authorities, @Nonnull Executor executor,
                                @Nonnull Clock clock, @Nonnull AuditSink audit, long timeoutMillis) {
        this.registry = checkNotNull(registry);
        this.broker = checkNotNull(broker);
        this.authorities = checkNotNull(authorities);
        this.executor = checkNotNull(executor);
        this.clock = checkNotNull(clock);
        this.audit = checkNotNull(audit);
        this.timeoutMillis = timeoutMillis;
    }

    /**
     * Resolves the reference with the given id for a subject.
     *
     * @return a future with the outcome; an unreachable authority yields a
     *         denied result and marks the reference broken
     * @throws IllegalArgumentException if no such reference is registered
     */
    @Nonnull
    public CompletableFuture<ResolveResult> resolve(@Nonnull final Subject subject, @Nonnull String referenceId) {
        final ExternalReference ref = registry.get(referenceId);
        if (ref == null) {
            throw new IllegalArgumentException("Unknown reference " + referenceId);
        }
        final TargetDocumentAuthority authority = authorities.getAuthority(ref.getTargetDocId());
        if (authority == null) {
            log.warn("No authority for document {}, reference {} is broken", ref.getTargetDocId(), ref.getId());
            registry.updateStatus(ref.getId(), ReferenceStatus.BROKEN);
            return CompletableFuture.completedFuture(ResolveResult.notFound());
        }
        final CapabilityToken token = broker.getToken(subject, ref.getTargetDocId(), ref.getTargetBlockId());

        return CompletableFuture
                .supplyAsync(() -> {
                    try {
                        return authority.resolve(subject, ref.getTargetDocId(), ref.getTargetBlockId(), token);
                    } catch (AuthorityUnavailableException e) {
                        throw new CompletionException(e);
                    }
                }, executor)
                .orTimeout(timeoutMillis, TimeUnit.MILLISECONDS)
                .handle((result, t) -> {
                    if (t != null) {
                        log.warn("Resolving reference {} failed", ref.getId(), t);
                        registry.updateStatus(ref.getId(), ReferenceStatus.BROKEN);
                        return ResolveResult.denied();
                    }
                    if (token != null && !result.isViaToken()) {
                        broker.discard(token);
                    }
                    registry.updateStatus(ref.getId(), statusOf(result));
                    if (result.getStatus() == ResolveResult.Status.DENIED) {
                        audit.emit(new AuditEvent(clock.getInstant(), subject.getId(), AuditAction.REFERENCE_DENIED,
                                ref.getTargetDocId() + '/' + ref.getTargetBlockId(),
                                "reference " + ref.getId(), Severity.WARN));
                    }
                    return result;
                });
    }

    private static ReferenceStatus statusOf(ResolveResult result) {
        switch (result.getStatus()) {
            case GRANTED:
                return ReferenceStatus.ACTIVE;
            case DENIED:
                return ReferenceStatus.DENIED;
            default:
                return ReferenceStatus.BROKEN;
        }
    }
}

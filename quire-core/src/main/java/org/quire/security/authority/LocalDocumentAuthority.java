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
package org.quire.security.authority;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.time.Instant;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;
import org.quire.api.AuthorityUnavailableException;
import org.quire.api.Block;
import org.quire.api.BlockMetadata;
import org.quire.api.CapabilityToken;
import org.quire.api.Subject;
import org.quire.api.TokenScope;
import org.quire.plugins.metadata.MetadataListener;
import org.quire.plugins.metadata.MetadataShadowStore;
import org.quire.spi.audit.AuditAction;
import org.quire.spi.audit.AuditEvent;
import org.quire.spi.audit.AuditSink;
import org.quire.spi.audit.Severity;
import org.quire.spi.reference.ResolveResult;
import org.quire.spi.reference.TargetDocumentAuthority;
import org.quire.spi.security.AccessEvaluator;
import org.quire.spi.state.ContentStore;
import org.quire.stats.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owning authority of a single local document. Serves resolution requests
 * for its blocks and issues capability tokens after a full evaluation.
 * <p>
 * A token binds {@code tokenId:subjectId:docId:blockId:expiresAt} under an
 * Ed25519 signature. A presented token is honoured only if it was issued
 * here and not revoked, has not expired, covers the requested scope and
 * carries a valid signature. Otherwise the request is evaluated in full.
 * <p>
 * When registered as a {@link MetadataListener} on the document's metadata
 * store, the authority revokes all tokens for a block whose metadata
 * changed.
 */
public class LocalDocumentAuthority implements TargetDocumentAuthority, MetadataListener {

    private static final Logger log = LoggerFactory.getLogger(LocalDocumentAuthority.class);

    private final ContentStore store;
    private final MetadataShadowStore metadata;
    private final AccessEvaluator evaluator;
    private final Ed25519Signer signer;
    private final Clock clock;
    private final AuditSink audit;
    private final long ttlMillis;

    /**
     * Tokens issued and neither revoked nor expired, by token id.
     */
    private final Map<String, CapabilityToken> issued = Maps.newHashMap();

    public LocalDocumentAuthority(@Nonnull ContentStore store, @Nonnull MetadataShadowStore metadata,
                                  @Nonnull AccessEvaluator evaluator, @Nonnull KeyPair keyPair,
                                  @Nonnull Clock clock, @Nonnull AuditSink audit, long ttlMillis) {
        checkArgument(ttlMillis > 0, "token ttl must be positive");
        this.store = checkNotNull(store);
        this.metadata = checkNotNull(metadata);
        this.evaluator = checkNotNull(evaluator);
        this.signer = new Ed25519Signer(keyPair);
        this.clock = checkNotNull(clock);
        this.audit = checkNotNull(audit);
        this.ttlMillis = ttlMillis;
    }

    public LocalDocumentAuthority(@Nonnull ContentStore store, @Nonnull MetadataShadowStore metadata,
                                  @Nonnull AccessEvaluator evaluator, @Nonnull Clock clock,
                                  @Nonnull AuditSink audit, long ttlMillis) {
        this(store, metadata, evaluator, Ed25519Signer.generateKeyPair(), clock, audit, ttlMillis);
    }

    @Nonnull
    public String getDocId() {
        return store.getDocId();
    }

    @Nonnull
    @Override
    public ResolveResult resolve(@Nonnull Subject subject, @Nonnull String docId, @Nonnull String blockId,
                                 @Nullable CapabilityToken token) throws AuthorityUnavailableException {
        Block block = find(docId, blockId);
        if (block == null) {
            return ResolveResult.notFound();
        }
        if (token != null) {
            if (isValid(token, subject, docId, blockId)) {
                return ResolveResult.granted(block, true);
            }
            log.debug("Presented token {} not accepted for {}, evaluating in full", token.getTokenId(), blockId);
        }
        if (evaluator.evaluate(subject, metadata.get(blockId).orElse(null))) {
            return ResolveResult.granted(block, false);
        }
        log.warn("Access to {}/{} denied for {}", docId, blockId, subject.getId());
        emit(subject.getId(), AuditAction.ACCESS_DENIED, docId + '/' + blockId, "resolve denied", Severity.WARN);
        return ResolveResult.denied();
    }

    @CheckForNull
    @Override
    public CapabilityToken issueToken(@Nonnull Subject subject, @Nonnull String docId, @Nonnull String blockId)
            throws AuthorityUnavailableException {
        String resource = docId + '/' + blockId;
        Block block = find(docId, blockId);
        if (block == null || !evaluator.evaluate(subject, metadata.get(blockId).orElse(null))) {
            log.warn("Token for {} denied to {}", resource, subject.getId());
            emit(subject.getId(), AuditAction.TOKEN_DENIED, resource, "handshake denied", Severity.WARN);
            return null;
        }

        String tokenId = UUID.randomUUID().toString();
        Instant expiresAt = Instant.ofEpochMilli(clock.getTime() + ttlMillis);
        TokenScope scope = new TokenScope(subject.getId(), docId, blockId);
        String signature;
        try {
            signature = signer.sign(payload(tokenId, scope, expiresAt));
        } catch (GeneralSecurityException e) {
            throw new AuthorityUnavailableException(3, "token signing failed for " + resource, e);
        }
        CapabilityToken token = new CapabilityToken(tokenId, scope, signature, expiresAt);
        synchronized (issued) {
            purgeExpired();
            issued.put(tokenId, token);
        }
        log.info("Issued token {} for {} to {}, expires at {}", tokenId, resource, subject.getId(), expiresAt);
        emit(subject.getId(), AuditAction.TOKEN_ISSUED, resource, "expires " + expiresAt, Severity.INFO);
        return token;
    }

    /**
     * Revokes an issued token.
     *
     * @return {@code true} if the token was known and not revoked before
     */
    public boolean revoke(@Nonnull String tokenId) {
        CapabilityToken token;
        synchronized (issued) {
            token = issued.remove(tokenId);
        }
        if (token == null) {
            return false;
        }
        TokenScope scope = token.getScope();
        log.info("Revoked token {} for {}/{}", tokenId, scope.getDocId(), scope.getBlockId());
        emit(scope.getSubjectId(), AuditAction.TOKEN_REVOKED,
                scope.getDocId() + '/' + scope.getBlockId(), "token " + tokenId, Severity.INFO);
        return true;
    }

    /**
     * Revokes all tokens issued for a block of this document.
     *
     * @return the number of revoked tokens
     */
    public int revokeAll(@Nonnull String blockId) {
        int n = 0;
        for (String tokenId : issuedFor(blockId)) {
            if (revoke(tokenId)) {
                n++;
            }
        }
        return n;
    }

    @Override
    public void metadataChanged(@Nonnull String blockId, @Nullable BlockMetadata md) {
        int n = revokeAll(blockId);
        if (n > 0) {
            log.debug("Metadata of {} changed, revoked {} tokens", blockId, n);
        }
    }

    /**
     * Checks a presented token against the requested scope.
     */
    boolean isValid(@Nonnull CapabilityToken token, @Nonnull Subject subject,
                    @Nonnull String docId, @Nonnull String blockId) throws AuthorityUnavailableException {
        synchronized (issued) {
            if (!token.equals(issued.get(token.getTokenId()))) {
                return false;
            }
        }
        if (token.isExpired(clock.getInstant())) {
            return false;
        }
        if (!token.getScope().covers(subject.getId(), docId, blockId)) {
            return false;
        }
        try {
            return signer.verify(payload(token.getTokenId(), token.getScope(), token.getExpiresAt()),
                    token.getSignature());
        } catch (GeneralSecurityException e) {
            throw new AuthorityUnavailableException(4, "token verification failed", e);
        }
    }

    //------------------------------------------------------------< private >---

    @CheckForNull
    private Block find(String docId, String blockId) {
        if (!store.getDocId().equals(docId)) {
            return null;
        }
        for (Block b : store.getBlocks()) {
            if (b.getId().equals(blockId)) {
                return b;
            }
        }
        return null;
    }

    private List<String> issuedFor(String blockId) {
        synchronized (issued) {
            return ImmutableList.copyOf(Maps.filterValues(issued,
                    t -> t.getScope().getBlockId().equals(blockId)).keySet());
        }
    }

    private void purgeExpired() {
        Instant now = clock.getInstant();
        for (Iterator<CapabilityToken> it = issued.values().iterator(); it.hasNext(); ) {
            if (it.next().isExpired(now)) {
                it.remove();
            }
        }
    }

    private static String payload(String tokenId, TokenScope scope, Instant expiresAt) {
        return tokenId
                + ':' + scope.getSubjectId()
                + ':' + scope.getDocId()
                + ':' + scope.getBlockId()
                + ':' + expiresAt.toEpochMilli();
    }

    private void emit(String subjectId, AuditAction action, String resource, String details, Severity severity) {
        audit.emit(new AuditEvent(clock.getInstant(), subjectId, action, resource, details, severity));
    }
}

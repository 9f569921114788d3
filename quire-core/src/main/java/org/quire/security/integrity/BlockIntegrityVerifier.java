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
package org.quire.security.integrity;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static java.nio.charset.StandardCharsets.UTF_8;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import com.google.common.base.Strings;
import com.google.common.collect.Maps;
import com.google.common.hash.Hashing;
import org.quire.api.AuthorityUnavailableException;
import org.quire.api.Block;
import org.quire.api.BlockMetadata;
import org.quire.api.Provenance;
import org.quire.api.QuireException;
import org.quire.api.SigningRejectedException;
import org.quire.api.Subject;
import org.quire.api.VerificationStatus;
import org.quire.plugins.metadata.MetadataShadowStore;
import org.quire.spi.audit.AuditAction;
import org.quire.spi.audit.AuditEvent;
import org.quire.spi.audit.AuditSink;
import org.quire.spi.audit.Severity;
import org.quire.spi.security.SignatureResult;
import org.quire.spi.security.SigningAuthority;
import org.quire.stats.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Detects changes of block content made after the block was signed.
 * <p>
 * The content of a block is identified by the hex encoded SHA-256 digest of
 * its payload. Verification hands the digest and the stored signature to
 * the {@link SigningAuthority}; signing asks the authority for a signature
 * over the digest, records it in the block's provenance and then verifies
 * the block again.
 * <p>
 * Every block moves through {@code UNKNOWN -> VERIFYING -> VERIFIED |
 * TAMPERED | UNKNOWN}; unsigned blocks are marked {@code UNSIGNED} without
 * a round trip. The status is written to the {@link MetadataShadowStore}.
 * Each request for a block carries a sequence number and the answer of a
 * request that was superseded by a newer one for the same block is
 * discarded.
 */
public class BlockIntegrityVerifier {

    private static final Logger log = LoggerFactory.getLogger(BlockIntegrityVerifier.class);

    private final String docId;
    private final SigningAuthority authority;
    private final MetadataShadowStore store;
    private final Executor executor;
    private final Clock clock;
    private final AuditSink audit;
    private final long timeoutMillis;

    private final Map<String, Long> sequence = Maps.newHashMap();
    private long counter;

    public BlockIntegrityVerifier(@Nonnull String docId, @Nonnull SigningAuthority authority,
                                  @Nonnull MetadataShadowStore store, @Nonnull Executor executor,
                                  @Nonnull Clock clock, @Nonnull AuditSink audit, long timeoutMillis) {
        checkArgument(timeoutMillis > 0);
        this.docId = checkNotNull(docId);
        this.authority = checkNotNull(authority);
        this.store = checkNotNull(store);
        this.executor = checkNotNull(executor);
        this.clock = checkNotNull(clock);
        this.audit = checkNotNull(audit);
        this.timeoutMillis = timeoutMillis;
    }

    /**
     * @return the lower case hex SHA-256 digest of the payload
     */
    @Nonnull
    public static String contentHash(@Nonnull String payload) {
        return Hashing.sha256().hashString(payload, UTF_8).toString();
    }

    /**
     * Verifies the current content of a block against its stored signature.
     * Authority failures and timeouts yield {@link VerificationStatus#UNKNOWN},
     * never {@link VerificationStatus#VERIFIED}.
     *
     * @param storedSignature the signature recorded for the block, or
     *                        {@code null} if it was never signed
     */
    @Nonnull
    public CompletableFuture<VerificationStatus> verify(@Nonnull final String blockId,
                                                        @Nonnull String currentContent,
                                                        @Nullable final String storedSignature) {
        final long seq = next(blockId);
        if (Strings.isNullOrEmpty(storedSignature)) {
            store.setVerificationStatus(blockId, VerificationStatus.UNSIGNED);
            return CompletableFuture.completedFuture(VerificationStatus.UNSIGNED);
        }
        store.setVerificationStatus(blockId, VerificationStatus.VERIFYING);
        final String hash = contentHash(currentContent);
        return CompletableFuture
                .supplyAsync(() -> {
                    try {
                        return authority.verify(blockId, hash, storedSignature);
                    } catch (AuthorityUnavailableException e) {
                        throw new CompletionException(e);
                    }
                }, executor)
                .orTimeout(timeoutMillis, TimeUnit.MILLISECONDS)
                .handle((valid, t) -> {
                    VerificationStatus status;
                    if (t != null) {
                        log.warn("Could not verify block {}: {}", blockId, describe(t));
                        status = VerificationStatus.UNKNOWN;
                    } else {
                        status = valid ? VerificationStatus.VERIFIED : VerificationStatus.TAMPERED;
                    }
                    return complete(blockId, seq, status);
                });
    }

    /**
     * Verifies a block using the signature recorded in its metadata.
     */
    @Nonnull
    public CompletableFuture<VerificationStatus> verify(@Nonnull Block block) {
        Provenance provenance = store.getEffective(block.getId()).getProvenance();
        String signature = provenance == null ? null : provenance.getSignature();
        return verify(block.getId(), block.getPayload(), signature);
    }

    /**
     * Verifies all blocks, as done when a document is loaded.
     */
    @Nonnull
    public CompletableFuture<Void> verifyAll(@Nonnull List<Block> blocks) {
        CompletableFuture<?>[] futures = new CompletableFuture<?>[blocks.size()];
        for (int i = 0; i < futures.length; i++) {
            futures[i] = verify(blocks.get(i));
        }
        return CompletableFuture.allOf(futures);
    }

    /**
     * Signs the current content of a block on behalf of a subject. On
     * success the signature, signer id and signing time are recorded in the
     * block's provenance and the block is verified again.
     * <p>
     * If the authority rejects the subject, the returned future fails with
     * {@link SigningRejectedException}, the provenance is left untouched and
     * the previous verification status is restored.
     */
    @Nonnull
    public CompletableFuture<Provenance> sign(@Nonnull final Block block, @Nonnull final Subject subject) {
        final String blockId = block.getId();
        final long seq = next(blockId);
        final VerificationStatus previous = store.getVerificationStatus(blockId);
        store.setVerificationStatus(blockId, VerificationStatus.VERIFYING);
        final String hash = contentHash(block.getPayload());

        return CompletableFuture
                .supplyAsync(() -> {
                    try {
                        return authority.sign(blockId, hash, subject);
                    } catch (QuireException e) {
                        throw new CompletionException(e);
                    }
                }, executor)
                .orTimeout(timeoutMillis, TimeUnit.MILLISECONDS)
                .handle((result, t) -> {
                    if (t != null) {
                        Throwable cause = unwrap(t);
                        restore(blockId, seq, previous);
                        if (cause instanceof SigningRejectedException) {
                            log.warn("Signing of block {} rejected for {}", blockId, subject.getId());
                            emit(subject.getId(), AuditAction.SIGN_REJECTED, blockId, cause.getMessage(), Severity.WARN);
                        } else {
                            log.warn("Signing of block {} failed: {}", blockId, describe(cause));
                        }
                        throw new CompletionException(cause);
                    }
                    Provenance provenance;
                    synchronized (sequence) {
                        if (!isCurrent(blockId, seq)) {
                            throw new CompletionException(new QuireException(QuireException.STATE, 2,
                                    "signing of block " + blockId + " was superseded by a newer request"));
                        }
                        provenance = record(blockId, subject, result);
                    }
                    log.info("Block {} signed by {} as {}", blockId, subject.getId(), result.getSignerId());
                    emit(subject.getId(), AuditAction.BLOCK_SIGNED, blockId,
                            "signer " + result.getSignerId() + " using " + result.getAlgorithm(), Severity.INFO);
                    return provenance;
                })
                .thenCompose(provenance -> verifyAfterSigning(block, provenance));
    }

    //------------------------------------------------------------< private >---

    private Provenance record(String blockId, Subject subject, SignatureResult result) {
        BlockMetadata md = store.getEffective(blockId);
        Provenance provenance = md.getProvenance();
        if (provenance == null) {
            provenance = Provenance.builder(docId, subject.getId(), result.getTimestamp()).build();
        }
        provenance = provenance.withSignature(result.getSignature(), result.getSignerId(), result.getTimestamp());
        store.set(blockId, md.withProvenance(provenance));
        return provenance;
    }

    private CompletableFuture<Provenance> verifyAfterSigning(Block block, Provenance provenance) {
        return verify(block.getId(), block.getPayload(), provenance.getSignature())
                .thenApply(status -> {
                    if (status != VerificationStatus.VERIFIED) {
                        log.warn("Block {} did not verify after signing: {}", block.getId(), status);
                    }
                    return provenance;
                });
    }

    private VerificationStatus complete(String blockId, long seq, VerificationStatus status) {
        synchronized (sequence) {
            if (!isCurrent(blockId, seq)) {
                log.debug("Discarding stale verification result {} for block {}", status, blockId);
                return status;
            }
            store.setVerificationStatus(blockId, status);
        }
        if (status == VerificationStatus.TAMPERED) {
            log.warn("Block {} of document {} was modified after signing", blockId, docId);
            emit("system", AuditAction.TAMPER_DETECTED, blockId,
                    "content does not match signature", Severity.CRITICAL);
        }
        return status;
    }

    private void restore(String blockId, long seq, VerificationStatus previous) {
        synchronized (sequence) {
            if (isCurrent(blockId, seq)) {
                store.setVerificationStatus(blockId, previous);
            }
        }
    }

    private long next(String blockId) {
        synchronized (sequence) {
            long seq = ++counter;
            sequence.put(blockId, seq);
            return seq;
        }
    }

    private boolean isCurrent(String blockId, long seq) {
        synchronized (sequence) {
            Long current = sequence.get(blockId);
            return current != null && current == seq;
        }
    }

    private void emit(String subjectId, AuditAction action, String blockId, String details, Severity severity) {
        audit.emit(new AuditEvent(clock.getInstant(), subjectId, action, docId + '/' + blockId, details, severity));
    }

    private static Throwable unwrap(Throwable t) {
        return t instanceof CompletionException && t.getCause() != null ? t.getCause() : t;
    }

    private static String describe(Throwable t) {
        Throwable cause = unwrap(t);
        if (cause instanceof TimeoutException) {
            return "timed out";
        }
        return cause.toString();
    }
}

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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;

import com.google.common.collect.ImmutableList;
import org.junit.Before;
import org.junit.Test;
import org.quire.AbstractSecurityTest;
import org.quire.QueueExecutor;
import org.quire.api.AuthorityUnavailableException;
import org.quire.api.Block;
import org.quire.api.Classification;
import org.quire.api.Provenance;
import org.quire.api.SigningRejectedException;
import org.quire.api.VerificationStatus;
import org.quire.security.authority.LocalSigningAuthority;
import org.quire.spi.audit.AuditAction;
import org.quire.spi.audit.AuditEvent;
import org.quire.spi.audit.Severity;
import org.quire.spi.security.SigningAuthority;

public class BlockIntegrityVerifierTest extends AbstractSecurityTest {

    private LocalSigningAuthority signing;

    @Before
    @Override
    public void before() throws Exception {
        super.before();
        signing = new LocalSigningAuthority(clock);
    }

    private BlockIntegrityVerifier verifier(SigningAuthority authority, Executor executor) {
        return new BlockIntegrityVerifier(DOC_ID, authority, metadata, executor, clock, audit, 5000);
    }

    @Test
    public void contentHashIsHexSha256() {
        assertEquals("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855",
                BlockIntegrityVerifier.contentHash(""));
        assertEquals(64, BlockIntegrityVerifier.contentHash("hello").length());
    }

    @Test
    public void signRecordsProvenanceAndVerifies() throws Exception {
        BlockIntegrityVerifier verifier = verifier(signing, DIRECT);
        Block b = block("b1", "the original");

        Provenance provenance = verifier.sign(b, editor).get();

        assertTrue(provenance.isSigned());
        assertEquals(signing.getSignerId(), provenance.getSignerId());
        assertEquals(DOC_ID, provenance.getSourceId());
        assertEquals("eddie", provenance.getAuthorId());
        assertEquals(provenance, metadata.getEffective("b1").getProvenance());
        assertEquals(VerificationStatus.VERIFIED, metadata.getVerificationStatus("b1"));
        assertEquals(1, auditEvents(AuditAction.BLOCK_SIGNED).size());
    }

    @Test
    public void signKeepsOtherMetadata() throws Exception {
        metadata.set("b1", classified(Classification.INTERNAL, "eddie"));
        verifier(signing, DIRECT).sign(block("b1", "text"), editor).get();
        assertEquals(Classification.INTERNAL, metadata.getEffective("b1").getClassification());
        assertEquals(ImmutableList.of("eddie"), metadata.getEffective("b1").getAcl());
    }

    @Test
    public void changedContentIsTampered() throws Exception {
        BlockIntegrityVerifier verifier = verifier(signing, DIRECT);
        Block b = block("b1", "the original");
        verifier.sign(b, editor).get();

        assertEquals(VerificationStatus.TAMPERED, verifier.verify(b.withPayload("the forgery")).get());
        assertEquals(VerificationStatus.TAMPERED, metadata.getVerificationStatus("b1"));

        List<AuditEvent> tampered = auditEvents(AuditAction.TAMPER_DETECTED);
        assertEquals(1, tampered.size());
        assertEquals(Severity.CRITICAL, tampered.get(0).getSeverity());
        assertEquals(DOC_ID + "/b1", tampered.get(0).getResourceId());

        // restoring the content restores the status
        assertEquals(VerificationStatus.VERIFIED, verifier.verify(b).get());
    }

    @Test
    public void unsignedBlockNeedsNoRoundTrip() throws Exception {
        SigningAuthority authority = mock(SigningAuthority.class);
        BlockIntegrityVerifier verifier = verifier(authority, DIRECT);

        assertEquals(VerificationStatus.UNSIGNED, verifier.verify(block("b1", "text")).get());
        assertEquals(VerificationStatus.UNSIGNED, verifier.verify("b2", "text", "").get());
        verify(authority, never()).verify(anyString(), anyString(), anyString());
    }

    @Test
    public void authorityFailureIsUnknown() throws Exception {
        SigningAuthority authority = mock(SigningAuthority.class);
        when(authority.verify(anyString(), anyString(), anyString()))
                .thenThrow(new AuthorityUnavailableException(1, "offline"));

        BlockIntegrityVerifier verifier = verifier(authority, DIRECT);
        assertEquals(VerificationStatus.UNKNOWN, verifier.verify("b1", "text", "c2ln").get());
        assertEquals(VerificationStatus.UNKNOWN, metadata.getVerificationStatus("b1"));
        assertTrue(auditEvents(AuditAction.TAMPER_DETECTED).isEmpty());
    }

    @Test
    public void statusIsVerifyingWhileInFlight() throws Exception {
        QueueExecutor executor = new QueueExecutor();
        BlockIntegrityVerifier verifier = verifier(signing, executor);
        verifier.verify("b1", "text", "c2ln");
        assertEquals(VerificationStatus.VERIFYING, metadata.getVerificationStatus("b1"));
        executor.runAll();
        assertEquals(VerificationStatus.TAMPERED, metadata.getVerificationStatus("b1"));
    }

    @Test
    public void staleResultIsDiscarded() throws Exception {
        BlockIntegrityVerifier direct = verifier(signing, DIRECT);
        Block b = block("b1", "signed text");
        direct.sign(b, editor).get();

        QueueExecutor executor = new QueueExecutor();
        BlockIntegrityVerifier verifier = verifier(signing, executor);
        verifier.verify(b.withPayload("edited text"));
        verifier.verify(b);

        executor.runLast();
        assertEquals(VerificationStatus.VERIFIED, metadata.getVerificationStatus("b1"));
        executor.runNext();
        assertEquals(VerificationStatus.VERIFIED, metadata.getVerificationStatus("b1"));
        assertTrue(auditEvents(AuditAction.TAMPER_DETECTED).isEmpty());
    }

    @Test
    public void signingSupersededByVerifyIsNotRecorded() throws Exception {
        QueueExecutor executor = new QueueExecutor();
        BlockIntegrityVerifier verifier = verifier(signing, executor);
        Block b = block("b1", "text");
        CompletableFuture<Provenance> signed = verifier.sign(b, editor);
        verifier.verify(b);

        executor.runNext();
        assertTrue(signed.isCompletedExceptionally());
        assertNull(metadata.getEffective("b1").getProvenance());
        assertTrue(auditEvents(AuditAction.BLOCK_SIGNED).isEmpty());

        executor.runAll();
        assertEquals(VerificationStatus.UNSIGNED, metadata.getVerificationStatus("b1"));
    }

    @Test
    public void rejectedSigningLeavesProvenanceUntouched() throws Exception {
        BlockIntegrityVerifier verifier = verifier(signing, DIRECT);
        Block b = block("b1", "text");
        verifier.verify(b).get();
        assertEquals(VerificationStatus.UNSIGNED, metadata.getVerificationStatus("b1"));

        try {
            verifier.sign(b, viewer).get();
            fail("viewer must not sign");
        } catch (ExecutionException e) {
            assertTrue(e.getCause() instanceof SigningRejectedException);
        }
        assertNull(metadata.getEffective("b1").getProvenance());
        assertFalse(metadata.contains("b1"));
        assertEquals(VerificationStatus.UNSIGNED, metadata.getVerificationStatus("b1"));

        List<AuditEvent> rejected = auditEvents(AuditAction.SIGN_REJECTED);
        assertEquals(1, rejected.size());
        assertEquals("vera", rejected.get(0).getSubjectId());
        assertTrue(auditEvents(AuditAction.BLOCK_SIGNED).isEmpty());
    }

    @Test
    public void verifyAllCoversEveryBlock() throws Exception {
        BlockIntegrityVerifier verifier = verifier(signing, DIRECT);
        Block signed = block("b1", "one");
        verifier.sign(signed, admin).get();

        verifier.verifyAll(ImmutableList.of(signed, block("b2", "two"))).get();
        assertEquals(VerificationStatus.VERIFIED, metadata.getVerificationStatus("b1"));
        assertEquals(VerificationStatus.UNSIGNED, metadata.getVerificationStatus("b2"));
        assertNotNull(metadata.getVerificationStatuses().get("b2"));
    }
}

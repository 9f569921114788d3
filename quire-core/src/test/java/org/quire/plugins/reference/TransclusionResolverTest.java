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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.concurrent.TimeUnit;

import com.google.common.collect.ImmutableList;
import org.junit.Before;
import org.junit.Test;
import org.quire.AbstractSecurityTest;
import org.quire.SessionConfiguration;
import org.quire.api.AuthorityUnavailableException;
import org.quire.api.Block;
import org.quire.api.CapabilityToken;
import org.quire.api.Classification;
import org.quire.api.ExternalReference;
import org.quire.api.ReferenceStatus;
import org.quire.api.Subject;
import org.quire.plugins.memory.MemoryContentStore;
import org.quire.plugins.metadata.MetadataShadowStore;
import org.quire.security.authority.LocalDocumentAuthority;
import org.quire.security.authorization.AbacEvaluator;
import org.quire.security.token.CapabilityTokenBroker;
import org.quire.spi.audit.AuditAction;
import org.quire.spi.reference.AuthorityProvider;
import org.quire.spi.reference.ResolveResult;
import org.quire.spi.reference.TargetDocumentAuthority;

public class TransclusionResolverTest extends AbstractSecurityTest {

    private static final String TARGET = "doc-2";

    private MetadataShadowStore targetMetadata;

    private LocalDocumentAuthority target;

    private TargetDocumentAuthority failing;

    private ExternalReferenceRegistry registry;

    private CapabilityTokenBroker broker;

    private TransclusionResolver resolver;

    @Before
    @Override
    public void before() throws Exception {
        super.before();
        MemoryContentStore targetStore = new MemoryContentStore(TARGET, ImmutableList.of(
                new Block("quote", "paragraph", "quoted text"),
                new Block("secret", "paragraph", "not for you")));
        targetMetadata = new MetadataShadowStore();
        targetMetadata.set("secret", classified(Classification.CONFIDENTIAL));
        target = new LocalDocumentAuthority(targetStore, targetMetadata, new AbacEvaluator(TARGET),
                clock, audit, TimeUnit.MINUTES.toMillis(5));
        targetMetadata.addListener(target);

        failing = mock(TargetDocumentAuthority.class);
        when(failing.resolve(any(Subject.class), anyString(), anyString(), any()))
                .thenThrow(new AuthorityUnavailableException(1, "unreachable"));

        AuthorityProvider provider = docId -> {
            if (TARGET.equals(docId)) {
                return target;
            }
            return "doc-down".equals(docId) ? failing : null;
        };
        SessionConfiguration config = SessionConfiguration.builder().build();
        registry = new ExternalReferenceRegistry(clock);
        broker = new CapabilityTokenBroker(provider, metadata, DIRECT, clock, config);
        resolver = new TransclusionResolver(registry, broker, provider, DIRECT, clock, audit, 5000);

        registry.register(new ExternalReference("quote", TARGET, "quote", null));
        registry.register(new ExternalReference("secret", TARGET, "secret", null));
        registry.register(new ExternalReference("gone", TARGET, "deleted", null));
        registry.register(new ExternalReference("orphan", "doc-unknown", "b1", null));
        registry.register(new ExternalReference("down", "doc-down", "b1", null));
    }

    @Test
    public void grantedResolutionIsActive() throws Exception {
        ResolveResult result = resolver.resolve(viewer, "quote").get();
        assertTrue(result.isGranted());
        assertFalse(result.isViaToken());
        assertEquals("quoted text", result.getBlock().getPayload());
        assertEquals(ReferenceStatus.ACTIVE, registry.get("quote").getStatus());
        assertEquals(clock.getInstant(), registry.get("quote").getLastVerified());
    }

    @Test
    public void cachedTokenSkipsFullEvaluation() throws Exception {
        assertNotNull(broker.requestToken(editor, TARGET, "secret").get());
        ResolveResult result = resolver.resolve(editor, "secret").get();
        assertTrue(result.isGranted());
        assertTrue(result.isViaToken());
    }

    @Test
    public void rejectedTokenIsDiscarded() throws Exception {
        CapabilityToken token = broker.requestToken(editor, TARGET, "secret").get();
        assertTrue(target.revoke(token.getTokenId()));

        ResolveResult result = resolver.resolve(editor, "secret").get();
        assertTrue(result.isGranted());
        assertFalse(result.isViaToken());
        assertNull(broker.getToken(editor, TARGET, "secret"));
    }

    @Test
    public void revokedPermissionIsDeniedDespiteToken() throws Exception {
        broker.requestToken(editor, TARGET, "secret").get();
        targetMetadata.set("secret", classified(Classification.RESTRICTED));

        ResolveResult result = resolver.resolve(editor, "secret").get();
        assertEquals(ResolveResult.Status.DENIED, result.getStatus());
        assertEquals(ReferenceStatus.DENIED, registry.get("secret").getStatus());
        assertEquals(1, auditEvents(AuditAction.REFERENCE_DENIED).size());
    }

    @Test
    public void deniedResolutionIsDenied() throws Exception {
        ResolveResult result = resolver.resolve(viewer, "secret").get();
        assertEquals(ResolveResult.Status.DENIED, result.getStatus());
        assertNull(result.getBlock());
        assertEquals(ReferenceStatus.DENIED, registry.get("secret").getStatus());
    }

    @Test
    public void missingTargetIsBroken() throws Exception {
        assertEquals(ResolveResult.Status.NOT_FOUND, resolver.resolve(admin, "gone").get().getStatus());
        assertEquals(ReferenceStatus.BROKEN, registry.get("gone").getStatus());

        assertEquals(ResolveResult.Status.NOT_FOUND, resolver.resolve(admin, "orphan").get().getStatus());
        assertEquals(ReferenceStatus.BROKEN, registry.get("orphan").getStatus());
    }

    @Test
    public void unreachableAuthorityIsBrokenAndDenied() throws Exception {
        ResolveResult result = resolver.resolve(admin, "down").get();
        assertEquals(ResolveResult.Status.DENIED, result.getStatus());
        assertEquals(ReferenceStatus.BROKEN, registry.get("down").getStatus());
    }

    @Test(expected = IllegalArgumentException.class)
    public void unknownReference() {
        resolver.resolve(admin, "nope");
    }
}

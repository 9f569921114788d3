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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

import com.google.common.collect.ImmutableList;
import org.junit.Before;
import org.junit.Test;
import org.quire.AbstractSecurityTest;
import org.quire.QueueExecutor;
import org.quire.SessionConfiguration;
import org.quire.api.AuthorityUnavailableException;
import org.quire.api.CapabilityToken;
import org.quire.api.ExternalReference;
import org.quire.api.Subject;
import org.quire.api.TokenScope;
import org.quire.spi.reference.AuthorityProvider;
import org.quire.spi.reference.TargetDocumentAuthority;

public class CapabilityTokenBrokerTest extends AbstractSecurityTest {

    private static final String TARGET = "doc-2";

    private TargetDocumentAuthority authority;

    private AuthorityProvider provider;

    private SessionConfiguration config;

    @Before
    @Override
    public void before() throws Exception {
        super.before();
        authority = mock(TargetDocumentAuthority.class);
        provider = docId -> TARGET.equals(docId) ? authority : null;
        config = SessionConfiguration.builder()
                .tokenTtl(60, TimeUnit.SECONDS)
                .tokenSkew(1, TimeUnit.SECONDS)
                .prefetch(true)
                .build();
    }

    private CapabilityTokenBroker broker(Executor executor) {
        return new CapabilityTokenBroker(provider, metadata, executor, clock, config);
    }

    private CapabilityToken token(String id, Subject subject, String blockId, long ttlMillis) {
        return new CapabilityToken(id, new TokenScope(subject.getId(), TARGET, blockId), "sig-" + id,
                Instant.ofEpochMilli(clock.getTime() + ttlMillis));
    }

    @Test
    public void grantedTokenIsCached() throws Exception {
        CapabilityToken t = token("t1", editor, "b1", 60000);
        when(authority.issueToken(editor, TARGET, "b1")).thenReturn(t);

        CapabilityTokenBroker broker = broker(DIRECT);
        assertSame(t, broker.requestToken(editor, TARGET, "b1").get());
        assertSame(t, broker.getToken(editor, TARGET, "b1"));
        assertEquals(1, metadata.getTokenCount());
    }

    @Test
    public void deniedHandshakeCachesNothing() throws Exception {
        when(authority.issueToken(viewer, TARGET, "b1")).thenReturn(null);

        CapabilityTokenBroker broker = broker(DIRECT);
        assertNull(broker.requestToken(viewer, TARGET, "b1").get());
        assertNull(broker.getToken(viewer, TARGET, "b1"));
        assertEquals(0, metadata.getTokenCount());
    }

    @Test
    public void failedHandshakeCachesNothing() throws Exception {
        when(authority.issueToken(editor, TARGET, "b1"))
                .thenThrow(new AuthorityUnavailableException(1, "down"));

        CapabilityTokenBroker broker = broker(DIRECT);
        assertNull(broker.requestToken(editor, TARGET, "b1").get());
        assertEquals(0, metadata.getTokenCount());
    }

    @Test
    public void tokenForOtherScopeIsRejected() throws Exception {
        when(authority.issueToken(editor, TARGET, "b1")).thenReturn(token("t1", admin, "b1", 60000));

        assertNull(broker(DIRECT).requestToken(editor, TARGET, "b1").get());
        assertEquals(0, metadata.getTokenCount());
    }

    @Test
    public void unknownAuthorityYieldsNoToken() throws Exception {
        assertNull(broker(DIRECT).requestToken(editor, "doc-unknown", "b1").get());
    }

    @Test
    public void olderAnswerForSameScopeIsDiscarded() throws Exception {
        CapabilityToken first = token("t1", editor, "b1", 60000);
        CapabilityToken second = token("t2", editor, "b1", 60000);
        when(authority.issueToken(editor, TARGET, "b1")).thenReturn(first, second);

        QueueExecutor executor = new QueueExecutor();
        CapabilityTokenBroker broker = broker(executor);
        CompletableFuture<CapabilityToken> older = broker.requestToken(editor, TARGET, "b1");
        CompletableFuture<CapabilityToken> newer = broker.requestToken(editor, TARGET, "b1");

        // the newer request reaches the authority first
        executor.runLast();
        executor.runNext();

        assertSame(first, newer.get());
        assertNull(older.get());
        assertSame(first, broker.getToken(editor, TARGET, "b1"));
    }

    @Test
    public void invalidateAllDropsTokensAndPendingHandshakes() throws Exception {
        when(authority.issueToken(editor, TARGET, "b1")).thenReturn(token("t1", editor, "b1", 60000));
        when(authority.issueToken(editor, TARGET, "b2")).thenReturn(token("t2", editor, "b2", 60000));

        QueueExecutor executor = new QueueExecutor();
        CapabilityTokenBroker broker = broker(executor);
        CompletableFuture<CapabilityToken> cached = broker.requestToken(editor, TARGET, "b1");
        executor.runAll();
        assertSame(cached.get(), broker.getToken(editor, TARGET, "b1"));

        CompletableFuture<CapabilityToken> inFlight = broker.requestToken(editor, TARGET, "b2");
        assertEquals(1, broker.invalidateAll());
        executor.runAll();

        assertNull(inFlight.get());
        assertNull(broker.getToken(editor, TARGET, "b1"));
        assertNull(broker.getToken(editor, TARGET, "b2"));
        assertEquals(0, metadata.getTokenCount());
    }

    @Test
    public void tokenCloseToExpiryIsDropped() throws Exception {
        CapabilityToken t = token("t1", editor, "b1", 5000);
        when(authority.issueToken(editor, TARGET, "b1")).thenReturn(t);

        CapabilityTokenBroker broker = broker(DIRECT);
        broker.requestToken(editor, TARGET, "b1").get();
        clock.advance(3500, TimeUnit.MILLISECONDS);
        assertSame(t, broker.getToken(editor, TARGET, "b1"));

        // within the skew of its expiry
        clock.advance(600, TimeUnit.MILLISECONDS);
        assertNull(broker.getToken(editor, TARGET, "b1"));
        assertEquals(0, metadata.getTokenCount());
    }

    @Test
    public void discardRemovesOnlyThatToken() throws Exception {
        CapabilityToken t = token("t1", editor, "b1", 60000);
        when(authority.issueToken(editor, TARGET, "b1")).thenReturn(t);

        CapabilityTokenBroker broker = broker(DIRECT);
        broker.requestToken(editor, TARGET, "b1").get();
        broker.discard(token("other", editor, "b1", 60000));
        assertSame(t, broker.getToken(editor, TARGET, "b1"));
        broker.discard(t);
        assertNull(broker.getToken(editor, TARGET, "b1"));
    }

    @Test
    public void prefetchOnlyFetchesTokens() throws Exception {
        when(authority.issueToken(editor, TARGET, "b1")).thenReturn(token("t1", editor, "b1", 60000));
        when(authority.issueToken(editor, TARGET, "b2")).thenReturn(token("t2", editor, "b2", 60000));

        CapabilityTokenBroker broker = broker(DIRECT);
        broker.requestToken(editor, TARGET, "b1").get();
        broker.prefetch(editor, ImmutableList.of(
                new ExternalReference("r1", TARGET, "b1", null),
                new ExternalReference("r2", TARGET, "b2", null))).get();

        verify(authority, times(1)).issueToken(editor, TARGET, "b1");
        verify(authority, times(1)).issueToken(editor, TARGET, "b2");
        verify(authority, never()).resolve(any(Subject.class), anyString(), anyString(), any());
        assertEquals(2, metadata.getTokenCount());
    }

    @Test
    public void prefetchCanBeDisabled() throws Exception {
        config = SessionConfiguration.builder().prefetch(false).build();
        broker(DIRECT).prefetch(editor, ImmutableList.of(new ExternalReference("r1", TARGET, "b1", null))).get();
        verify(authority, never()).issueToken(any(Subject.class), anyString(), anyString());
    }
}

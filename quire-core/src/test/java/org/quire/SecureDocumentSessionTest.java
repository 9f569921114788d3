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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.ArgumentMatchers.notNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.util.List;
import java.util.concurrent.TimeUnit;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.quire.api.AccessViolationException;
import org.quire.api.Block;
import org.quire.api.BlockMetadata;
import org.quire.api.Classification;
import org.quire.api.ExternalReference;
import org.quire.api.QuireException;
import org.quire.api.ReferenceStatus;
import org.quire.api.VerificationStatus;
import org.quire.plugins.memory.MemoryContentStore;
import org.quire.plugins.memory.MemoryPersistence;
import org.quire.plugins.metadata.MetadataShadowStore;
import org.quire.plugins.redaction.RenderedBlock;
import org.quire.security.authority.LocalDocumentAuthority;
import org.quire.security.authority.LocalSigningAuthority;
import org.quire.security.authorization.AbacEvaluator;
import org.quire.spi.audit.AuditAction;
import org.quire.spi.reference.AuthorityProvider;
import org.quire.spi.reference.ResolveResult;
import org.quire.spi.state.BlockEditor;

public class SecureDocumentSessionTest extends AbstractSecurityTest {

    private static final String OTHER_DOC = "doc-2";

    private MemoryPersistence persistence;

    private LocalDocumentAuthority otherAuthority;

    private SecureDocumentSession session;

    @Before
    @Override
    public void before() throws Exception {
        super.before();
        persistence = new MemoryPersistence();
        persistence.saveSnapshot(DOC_ID, ImmutableList.of(
                block("title", "Quarterly report"),
                block("numbers", "revenue").withMetadata(classified(Classification.CONFIDENTIAL)),
                block("board", "board notes").withMetadata(BlockMetadata.builder()
                        .classification(Classification.INTERNAL).locked(true).build())));

        MetadataShadowStore otherMetadata = new MetadataShadowStore();
        otherMetadata.set("forecast", classified(Classification.INTERNAL));
        otherMetadata.set("risks", classified(Classification.INTERNAL));
        otherMetadata.set("hiring", classified(Classification.INTERNAL));
        otherAuthority = spy(new LocalDocumentAuthority(
                new MemoryContentStore(OTHER_DOC, ImmutableList.of(
                        block("forecast", "up and to the right"),
                        block("risks", "few"),
                        block("hiring", "two engineers"))),
                otherMetadata, new AbacEvaluator(OTHER_DOC), clock, audit, TimeUnit.MINUTES.toMillis(5)));
        otherMetadata.addListener(otherAuthority);
        AuthorityProvider authorities = docId -> OTHER_DOC.equals(docId) ? otherAuthority : null;

        SessionConfiguration config = SessionConfiguration.builder()
                .debounce(0, TimeUnit.MILLISECONDS)
                .build();
        session = new Quire(store)
                .with(evaluator)
                .with(new LocalSigningAuthority(clock))
                .with(authorities)
                .with(persistence)
                .with(audit)
                .with(clock)
                .with(config)
                .with(DIRECT)
                .createSession(editor);
        session.load().get();
    }

    @After
    @Override
    public void after() throws Exception {
        session.close();
        super.after();
    }

    @Test
    public void loadSplitsContentFromMetadata() {
        for (Block b : store.getBlocks()) {
            assertNull(b.getMetadata());
        }
        assertEquals(Classification.CONFIDENTIAL,
                session.getMetadataStore().getEffective("numbers").getClassification());
        assertEquals(ImmutableList.of("title", "numbers", "board"), session.getView().getBlockIds());
        assertEquals(VerificationStatus.UNSIGNED, session.getVerificationStatus("title"));
    }

    @Test
    public void saveWritesMetadataBack() throws Exception {
        session.save();
        List<Block> saved = persistence.loadSnapshot(DOC_ID);
        assertEquals(3, saved.size());
        assertNull(saved.get(0).getMetadata());
        assertEquals(Classification.CONFIDENTIAL, saved.get(1).getMetadata().getClassification());
        assertTrue(saved.get(2).getMetadata().isLocked());
    }

    @Test
    public void switchingSubjectRecomputesView() {
        session.switchSubject(viewer);
        assertEquals(ImmutableList.of("title"), session.getView().getBlockIds());
        assertEquals(viewer, session.getSubject());

        session.switchSubject(null);
        assertTrue(session.getView().getBlocks().isEmpty());
    }

    @Test
    public void switchingSubjectDropsTokens() throws Exception {
        List<String> targets = ImmutableList.of("forecast", "risks", "hiring");
        for (String target : targets) {
            session.addReference(new ExternalReference("ref-" + target, OTHER_DOC, target, null));
        }
        session.prefetchTokens().get();
        assertEquals(3, session.getMetadataStore().getTokenCount());
        for (String target : targets) {
            assertNotNull(session.getTokenBroker().getToken(editor, OTHER_DOC, target));
        }

        session.switchSubject(admin);

        assertEquals(0, session.getMetadataStore().getTokenCount());
        assertEquals(1, auditEvents(AuditAction.TOKENS_INVALIDATED).size());
        assertEquals("eddie", auditEvents(AuditAction.TOKENS_INVALIDATED).get(0).getSubjectId());

        for (String target : targets) {
            ResolveResult result = session.resolveReference("ref-" + target).get();
            assertTrue(result.isGranted());
            assertFalse(result.isViaToken());
        }
        verify(otherAuthority, times(3)).resolve(eq(admin), eq(OTHER_DOC), anyString(), isNull());
        verify(otherAuthority, never()).resolve(eq(admin), eq(OTHER_DOC), anyString(), notNull());
    }

    @Test
    public void lockedBlockEditIsRejected() throws Exception {
        try {
            session.edit(replacing("board", "rewritten"));
            fail("editor must not change a locked block");
        } catch (AccessViolationException e) {
            assertEquals("board", e.getBlockId());
        }
        assertEquals("board notes", store.getBlocks().get(2).getPayload());
        assertEquals(1, auditEvents(AuditAction.EDIT_REJECTED).size());
    }

    @Test
    public void hiddenBlockEditIsRejected() throws Exception {
        session.switchSubject(viewer);
        try {
            session.edit(new BlockEditor() {
                @Override
                public List<Block> edit(List<Block> current) {
                    List<Block> edited = Lists.newArrayList(current);
                    edited.add(block("numbers", "forged"));
                    return edited;
                }
            });
            fail("viewer must not change a block they cannot see");
        } catch (AccessViolationException e) {
            assertEquals("numbers", e.getBlockId());
        }
        assertEquals("revenue", store.getBlocks().get(1).getPayload());
    }

    @Test
    public void editorOfViewerSeesOnlyVisibleBlocks() throws Exception {
        session.switchSubject(viewer);
        final List<String> seen = Lists.newArrayList();
        session.edit(new BlockEditor() {
            @Override
            public List<Block> edit(List<Block> current) {
                for (Block b : current) {
                    seen.add(b.getPayload());
                }
                return current;
            }
        });
        assertEquals(ImmutableList.of("Quarterly report"), seen);
        assertEquals(ImmutableList.of("title", "numbers", "board"), Block.ids(store.getBlocks()));
    }

    @Test
    public void viewerEditKeepsHiddenBlocksInPlace() throws Exception {
        session.switchSubject(viewer);
        session.edit(new BlockEditor() {
            @Override
            public List<Block> edit(List<Block> current) {
                return ImmutableList.of(block("note", "read me first"), current.get(0).withPayload("Q3 report"));
            }
        });
        assertEquals(ImmutableList.of("note", "title", "numbers", "board"), Block.ids(store.getBlocks()));
        assertEquals("Q3 report", store.getBlocks().get(1).getPayload());

        session.edit(new BlockEditor() {
            @Override
            public List<Block> edit(List<Block> current) {
                return ImmutableList.of(current.get(0));
            }
        });
        assertEquals(ImmutableList.of("note", "numbers", "board"), Block.ids(store.getBlocks()));
        assertEquals(ImmutableList.of("note"), session.getView().getBlockIds());
    }

    @Test
    public void rejectedEditLeavesNoMetadata() throws Exception {
        try {
            session.edit(new BlockEditor() {
                @Override
                public List<Block> edit(List<Block> current) {
                    List<Block> edited = Lists.newArrayList(current);
                    edited.add(block("x", "first").withMetadata(classified(Classification.PUBLIC, "eddie")));
                    edited.add(block("x", "second"));
                    return edited;
                }
            });
            fail("duplicate block ids must be rejected");
        } catch (QuireException e) {
            assertTrue(e.isOfType(QuireException.STATE));
        }
        assertFalse(session.getMetadataStore().contains("x"));
        assertEquals(ImmutableList.of("title", "numbers", "board"), Block.ids(store.getBlocks()));
    }

    @Test
    public void addedBlockCarriesMetadataIntoStore() throws Exception {
        session.edit(new BlockEditor() {
            @Override
            public List<Block> edit(List<Block> current) {
                List<Block> edited = Lists.newArrayList(current);
                edited.add(block("salaries", "all of them").withMetadata(classified(Classification.CONFIDENTIAL)));
                return edited;
            }
        });
        assertNull(store.getBlocks().get(3).getMetadata());
        assertEquals(Classification.CONFIDENTIAL,
                session.getMetadataStore().getEffective("salaries").getClassification());
        assertTrue(session.getView().getBlockIds().contains("salaries"));

        session.switchSubject(viewer);
        assertFalse(session.getView().getBlockIds().contains("salaries"));
    }

    @Test
    public void removedBlockKeepsMetadataForUndo() throws Exception {
        final List<Block> before = store.getBlocks();
        session.edit(new BlockEditor() {
            @Override
            public List<Block> edit(List<Block> current) {
                return ImmutableList.of(current.get(0), current.get(2));
            }
        });
        assertEquals(ImmutableList.of("title", "board"), session.getView().getBlockIds());

        session.edit(new BlockEditor() {
            @Override
            public List<Block> edit(List<Block> current) {
                return before;
            }
        });
        session.switchSubject(viewer);
        assertEquals(ImmutableList.of("title"), session.getView().getBlockIds());
    }

    @Test
    public void metadataUpdateNeedsEditRights() throws Exception {
        try {
            session.updateMetadata("board", classified(Classification.PUBLIC));
            fail("locked block metadata is admin only");
        } catch (AccessViolationException e) {
            assertEquals(2, e.getCode());
        }
        session.switchSubject(admin);
        session.updateMetadata("board", classified(Classification.PUBLIC));

        session.switchSubject(viewer);
        assertTrue(session.getView().getBlockIds().contains("board"));
    }

    @Test
    public void tamperingIsDetectedAndRendered() throws Exception {
        session.sign("title").get();
        assertEquals(VerificationStatus.VERIFIED, session.getVerificationStatus("title"));

        session.edit(replacing("title", "Quarterly report (revised)"));
        assertEquals(VerificationStatus.TAMPERED, session.verify("title").get());

        List<RenderedBlock> rendered = session.render();
        assertTrue(rendered.get(0).isTampered());
        assertFalse(rendered.get(1).isTampered());
        assertEquals(1, auditEvents(AuditAction.TAMPER_DETECTED).size());
    }

    @Test
    public void renderRedactsForViewer() {
        session.switchSubject(viewer);
        List<RenderedBlock> rendered = session.render();
        assertFalse(rendered.get(0).isRedacted());
        assertTrue(rendered.get(1).isRedacted());
        assertTrue(rendered.get(2).isRedacted());
    }

    @Test(expected = IllegalStateException.class)
    public void anonymousCannotSign() {
        session.switchSubject(null);
        session.sign("title");
    }

    @Test(expected = IllegalArgumentException.class)
    public void signingUnknownBlock() {
        session.sign("nope");
    }

    @Test
    public void referencesResolveThroughOwningAuthority() throws Exception {
        session.addReference(new ExternalReference("fc", OTHER_DOC, "forecast", null));

        ResolveResult granted = session.resolveReference("fc").get();
        assertTrue(granted.isGranted());
        assertEquals(ReferenceStatus.ACTIVE, session.getReferences().get("fc").getStatus());

        session.switchSubject(viewer);
        assertEquals(ResolveResult.Status.DENIED, session.resolveReference("fc").get().getStatus());
        assertEquals(ReferenceStatus.DENIED, session.getReferences().get("fc").getStatus());

        session.switchSubject(null);
        assertEquals(ResolveResult.Status.DENIED, session.resolveReference("fc").get().getStatus());
    }

    @Test
    public void closedSessionIgnoresStoreAndRejectsCalls() throws Exception {
        session.close();
        store.replace(ImmutableList.of(block("title", "changed")));
        assertEquals("Quarterly report", session.getView().getBlocks().get(0).getPayload());
        try {
            session.switchSubject(viewer);
            fail("session is closed");
        } catch (IllegalStateException expected) {
            // closed
        }
    }

    private static BlockEditor replacing(final String blockId, final String payload) {
        return new BlockEditor() {
            @Override
            public List<Block> edit(List<Block> current) {
                List<Block> edited = Lists.newArrayList();
                for (Block b : current) {
                    edited.add(b.getId().equals(blockId) ? b.withPayload(payload) : b);
                }
                return edited;
            }
        };
    }
}

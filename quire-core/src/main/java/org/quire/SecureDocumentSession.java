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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;

import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import com.google.common.io.Closer;
import org.quire.api.AccessViolationException;
import org.quire.api.Block;
import org.quire.api.BlockMetadata;
import org.quire.api.ExternalReference;
import org.quire.api.Provenance;
import org.quire.api.QuireException;
import org.quire.api.Subject;
import org.quire.api.VerificationStatus;
import org.quire.plugins.metadata.MetadataShadowStore;
import org.quire.plugins.observation.FilteredView;
import org.quire.plugins.observation.RecomputeScheduler;
import org.quire.plugins.observation.SecureSyncFilter;
import org.quire.plugins.redaction.RedactionRenderer;
import org.quire.plugins.redaction.RenderedBlock;
import org.quire.plugins.reference.ExternalReferenceRegistry;
import org.quire.plugins.reference.TransclusionResolver;
import org.quire.security.authorization.BlockEditValidator;
import org.quire.security.integrity.BlockIntegrityVerifier;
import org.quire.security.token.CapabilityTokenBroker;
import org.quire.spi.audit.AuditAction;
import org.quire.spi.audit.AuditEvent;
import org.quire.spi.audit.AuditSink;
import org.quire.spi.audit.Severity;
import org.quire.spi.persistence.PersistenceLayer;
import org.quire.spi.reference.AuthorityProvider;
import org.quire.spi.reference.ResolveResult;
import org.quire.spi.security.AccessEvaluator;
import org.quire.spi.security.SigningAuthority;
import org.quire.spi.state.BlockEditor;
import org.quire.spi.state.ContentStore;
import org.quire.stats.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The secure view of one document for one subject. A session owns its
 * metadata store, reference registry, token broker, integrity verifier and
 * sync filter; nothing is shared between sessions except the content store
 * and the external collaborators handed in through {@link Quire}.
 * <p>
 * The subject can be switched at any time. Switching drops every cached
 * capability token and recomputes the view before returning.
 */
public class SecureDocumentSession implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(SecureDocumentSession.class);

    private final ContentStore store;
    private final AccessEvaluator evaluator;
    private final PersistenceLayer persistence;
    private final AuditSink audit;
    private final Clock clock;
    private final SessionConfiguration config;

    private final MetadataShadowStore metadata = new MetadataShadowStore();
    private final ExternalReferenceRegistry references;
    private final CapabilityTokenBroker broker;
    private final BlockIntegrityVerifier verifier;
    private final SecureSyncFilter filter;
    private final RecomputeScheduler scheduler;
    private final TransclusionResolver resolver;
    private final RedactionRenderer renderer;
    private final BlockEditValidator editValidator;

    private final Closer closer;

    private volatile boolean closed;

    SecureDocumentSession(ContentStore store, AccessEvaluator evaluator, SigningAuthority signingAuthority,
                          AuthorityProvider authorities, PersistenceLayer persistence, AuditSink audit,
                          Clock clock, SessionConfiguration config, ScheduledExecutorService scheduledExecutor,
                          Executor executor, Closer closer, @Nullable Subject subject) {
        this.store = store;
        this.evaluator = evaluator;
        this.persistence = persistence;
        this.audit = audit;
        this.clock = clock;
        this.config = config;
        this.closer = closer;

        String docId = store.getDocId();
        long timeout = config.getAuthorityTimeoutMillis();
        this.references = new ExternalReferenceRegistry(clock);
        this.broker = new CapabilityTokenBroker(authorities, metadata, executor, clock, config);
        this.verifier = new BlockIntegrityVerifier(docId, signingAuthority, metadata, executor, clock, audit, timeout);
        this.resolver = new TransclusionResolver(references, broker, authorities, executor, clock, audit, timeout);
        this.renderer = new RedactionRenderer(evaluator, metadata);
        this.editValidator = new BlockEditValidator(evaluator, metadata);

        this.filter = new SecureSyncFilter(store, metadata, evaluator, subject);
        if (config.getDebounceMillis() > 0) {
            this.scheduler = new RecomputeScheduler(() -> filter.recompute(), scheduledExecutor,
                    config.getDebounceMillis());
            filter.setScheduler(scheduler);
        } else {
            this.scheduler = null;
        }
        closer.register(store.addObserver(filter));
        closer.register(metadata.addListener(filter));
        filter.recompute();
        log.debug("Session for {} opened with {}", docId, config);
    }

    @Nonnull
    public String getDocId() {
        return store.getDocId();
    }

    @Nonnull
    public SessionConfiguration getConfiguration() {
        return config;
    }

    @CheckForNull
    public Subject getSubject() {
        return filter.getSubject();
    }

    /**
     * @return the blocks of the document the current subject may see
     */
    @Nonnull
    public FilteredView getView() {
        return filter.getView();
    }

    @Nonnull
    public MetadataShadowStore getMetadataStore() {
        return metadata;
    }

    @Nonnull
    public ExternalReferenceRegistry getReferences() {
        return references;
    }

    @Nonnull
    public CapabilityTokenBroker getTokenBroker() {
        return broker;
    }

    @Nonnull
    public BlockIntegrityVerifier getVerifier() {
        return verifier;
    }

    @Nonnull
    public SecureSyncFilter getFilter() {
        return filter;
    }

    /**
     * Replaces the subject. All cached tokens are invalidated and the view
     * is recomputed for the new subject before this method returns.
     */
    public void switchSubject(@Nullable Subject subject) {
        checkOpen();
        Subject previous = filter.getSubject();
        int dropped = broker.invalidateAll();
        String subjectId = previous == null ? "anonymous" : previous.getId();
        audit.emit(new AuditEvent(clock.getInstant(), subjectId, AuditAction.TOKENS_INVALIDATED,
                getDocId(), dropped + " tokens dropped on subject change", Severity.INFO));
        filter.setSubject(subject);
        log.info("Session for {} switched subject from {} to {}", getDocId(), subjectId,
                subject == null ? "anonymous" : subject.getId());
    }

    //---------------------------------------------------------< persistence >--

    /**
     * Loads the document from the persistence layer. Metadata goes into the
     * metadata store, the content into the content store, and every block is
     * verified.
     *
     * @return a future completing when all blocks were verified
     */
    @Nonnull
    public CompletableFuture<Void> load() throws QuireException {
        checkOpen();
        final List<Block> snapshot = persistence.loadSnapshot(getDocId());
        metadata.loadFromSnapshot(snapshot);
        final ImmutableList.Builder<Block> content = ImmutableList.builder();
        for (Block b : snapshot) {
            content.add(b.withMetadata(null));
        }
        List<Block> blocks = store.transact(new BlockEditor() {
            @Nonnull
            @Override
            public List<Block> edit(@Nonnull List<Block> current) {
                return content.build();
            }
        });
        filter.recompute();
        log.info("Loaded {} blocks of document {}", blocks.size(), getDocId());
        return verifier.verifyAll(blocks);
    }

    /**
     * Saves the current content together with the recorded metadata.
     */
    public void save() throws QuireException {
        checkOpen();
        persistence.saveSnapshot(getDocId(), metadata.exportSnapshot(store.getBlocks()));
    }

    //---------------------------------------------------------------< edit >--

    /**
     * Applies an edit of the current subject. The editor is handed the
     * subject's filtered view of the content; blocks hidden from the subject
     * keep their place relative to the visible blocks preceding them. The
     * edit is rejected as a whole if it touches a block the subject may not
     * edit or if it repeats a block id. Metadata carried by the edited
     * blocks is moved to the metadata store before the new content becomes
     * visible. Metadata of removed blocks is kept, so that an undo restores
     * the block with its attributes.
     *
     * @throws AccessViolationException if the edit was rejected
     * @throws QuireException if the content store rejected the edit
     */
    @Nonnull
    public List<Block> edit(@Nonnull final BlockEditor editor) throws QuireException {
        checkOpen();
        final Subject subject = filter.getSubject();
        return store.transact(new BlockEditor() {
            @Nonnull
            @Override
            public List<Block> edit(@Nonnull List<Block> current) throws QuireException {
                List<Block> visible = filter.filter(current, subject);
                List<Block> edited = mergeHidden(current, visible, editor.edit(visible));
                try {
                    editValidator.validate(subject, current, edited);
                } catch (AccessViolationException e) {
                    log.warn("Edit of {} rejected: {}", getDocId(), e.getMessage());
                    emitEditRejected(subject, e.getBlockId(), "edit rejected");
                    throw e;
                }
                Map<String, BlockMetadata> carried = Maps.newLinkedHashMap();
                Set<String> ids = Sets.newHashSet();
                ImmutableList.Builder<Block> stripped = ImmutableList.builder();
                for (Block b : edited) {
                    if (!ids.add(b.getId())) {
                        throw new QuireException(QuireException.STATE, 3,
                                "duplicate block id " + b.getId() + " in edit of " + getDocId());
                    }
                    if (b.getMetadata() != null) {
                        carried.put(b.getId(), b.getMetadata());
                    }
                    stripped.add(b.withMetadata(null));
                }
                metadata.setMany(carried);
                return stripped.build();
            }
        });
    }

    /**
     * Puts the blocks of {@code current} that are missing from
     * {@code visible} back into an edited list. Each hidden block follows
     * the nearest visible block before it that is still present, or goes to
     * the front if there is none.
     */
    static List<Block> mergeHidden(List<Block> current, List<Block> visible, List<Block> edited) {
        Set<String> visibleIds = Sets.newHashSet(Block.ids(visible));
        if (visibleIds.size() == current.size()) {
            return edited;
        }
        Set<String> editedIds = Sets.newHashSet(Block.ids(edited));
        ListMultimap<String, Block> anchored = ArrayListMultimap.create();
        List<Block> leading = Lists.newArrayList();
        List<String> before = Lists.newArrayList();
        for (Block b : current) {
            if (visibleIds.contains(b.getId())) {
                before.add(b.getId());
                continue;
            }
            String anchor = null;
            for (int i = before.size() - 1; i >= 0 && anchor == null; i--) {
                if (editedIds.contains(before.get(i))) {
                    anchor = before.get(i);
                }
            }
            if (anchor == null) {
                leading.add(b);
            } else {
                anchored.put(anchor, b);
            }
        }
        ImmutableList.Builder<Block> merged = ImmutableList.builder();
        merged.addAll(leading);
        for (Block b : edited) {
            merged.add(b);
            merged.addAll(anchored.removeAll(b.getId()));
        }
        return merged.build();
    }

    /**
     * Changes the metadata of a block. Requires edit rights under the
     * metadata currently recorded for it.
     *
     * @throws AccessViolationException if the subject may not edit the block
     */
    public void updateMetadata(@Nonnull String blockId, @Nonnull BlockMetadata md) throws AccessViolationException {
        checkOpen();
        checkNotNull(md);
        Subject subject = filter.getSubject();
        if (!evaluator.evaluateEdit(subject, metadata.get(blockId).orElse(null))) {
            emitEditRejected(subject, blockId, "metadata change rejected");
            throw new AccessViolationException(2, blockId, "metadata of block " + blockId + " may not be changed");
        }
        metadata.set(blockId, md);
    }

    //----------------------------------------------------------< integrity >--

    /**
     * Signs the current content of a block on behalf of the current subject.
     *
     * @throws IllegalArgumentException if the document has no such block
     */
    @Nonnull
    public CompletableFuture<Provenance> sign(@Nonnull String blockId) {
        checkOpen();
        Subject subject = filter.getSubject();
        checkState(subject != null, "no subject to sign for");
        return verifier.sign(getBlock(blockId), subject);
    }

    @Nonnull
    public CompletableFuture<VerificationStatus> verify(@Nonnull String blockId) {
        checkOpen();
        return verifier.verify(getBlock(blockId));
    }

    @Nonnull
    public VerificationStatus getVerificationStatus(@Nonnull String blockId) {
        return metadata.getVerificationStatus(blockId);
    }

    //---------------------------------------------------------< references >--

    public void addReference(@Nonnull ExternalReference reference) {
        checkOpen();
        references.register(reference);
    }

    /**
     * Resolves a reference for the current subject. Nothing of the returned
     * content is kept by the session.
     */
    @Nonnull
    public CompletableFuture<ResolveResult> resolveReference(@Nonnull String referenceId) {
        checkOpen();
        Subject subject = filter.getSubject();
        if (subject == null) {
            return CompletableFuture.completedFuture(ResolveResult.denied());
        }
        return resolver.resolve(subject, referenceId);
    }

    /**
     * Requests tokens for all registered references of the current subject.
     */
    @Nonnull
    public CompletableFuture<Void> prefetchTokens() {
        checkOpen();
        Subject subject = filter.getSubject();
        if (subject == null) {
            return CompletableFuture.completedFuture(null);
        }
        return broker.prefetch(subject, references.getAll());
    }

    //------------------------------------------------------------< render >--

    /**
     * Renders the authoritative content for the current subject, with
     * redaction markers in place of hidden blocks.
     */
    @Nonnull
    public List<RenderedBlock> render() {
        return renderer.render(store.getBlocks(), filter.getSubject());
    }

    /**
     * Stops the coalescing of recomputes, detaches from the content store
     * and shuts down executors created for this session.
     */
    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        if (scheduler != null) {
            scheduler.stop();
        }
        broker.invalidateAll();
        closer.close();
        log.debug("Session for {} closed", getDocId());
    }

    //------------------------------------------------------------< private >---

    private void emitEditRejected(@Nullable Subject subject, String blockId, String details) {
        audit.emit(new AuditEvent(clock.getInstant(), subject == null ? "anonymous" : subject.getId(),
                AuditAction.EDIT_REJECTED, getDocId() + '/' + blockId, details, Severity.WARN));
    }

    @CheckForNull
    private Block findBlock(String blockId) {
        for (Block b : store.getBlocks()) {
            if (b.getId().equals(blockId)) {
                return b;
            }
        }
        return null;
    }

    private Block getBlock(String blockId) {
        Block block = findBlock(blockId);
        if (block == null) {
            throw new IllegalArgumentException("No block " + blockId + " in document " + getDocId());
        }
        return block;
    }

    private void checkOpen() {
        checkState(!closed, "session for %s is closed", getDocId());
    }
}

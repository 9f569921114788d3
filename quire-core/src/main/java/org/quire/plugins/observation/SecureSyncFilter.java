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
package org.quire.plugins.observation;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.List;

import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import com.google.common.collect.ImmutableList;
import org.quire.api.Block;
import org.quire.api.BlockMetadata;
import org.quire.api.Subject;
import org.quire.plugins.metadata.MetadataListener;
import org.quire.plugins.metadata.MetadataShadowStore;
import org.quire.spi.observation.ContentObserver;
import org.quire.spi.security.AccessEvaluator;
import org.quire.spi.state.ContentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maintains the {@link FilteredView} of one document for one subject.
 * <p>
 * Each recompute takes a snapshot of the authoritative blocks, evaluates
 * every block against the metadata recorded in the
 * {@link MetadataShadowStore} and keeps the allowed blocks in document
 * order. The view is replaced as a whole when the result differs from the
 * current view; it is never patched. A block whose evaluation throws is
 * left out of the view.
 * <p>
 * Recomputes are serialized. A recompute requested from within a recompute
 * on the same thread, for example by a view listener, runs as another pass
 * once the current one has published its result.
 * Content changes are coalesced by a {@link RecomputeScheduler}; subject
 * and metadata changes recompute immediately, so a revoked permission never
 * waits for the coalescing window.
 */
public class SecureSyncFilter implements ContentObserver, MetadataListener {

    private static final Logger log = LoggerFactory.getLogger(SecureSyncFilter.class);

    private final ContentStore store;
    private final MetadataShadowStore metadata;
    private final AccessEvaluator evaluator;
    private final FilteredView view = new FilteredView();

    private volatile Subject subject;

    private volatile RecomputeScheduler scheduler;

    private boolean syncing;

    private boolean dirty;

    private long recomputeCount;

    public SecureSyncFilter(@Nonnull ContentStore store, @Nonnull MetadataShadowStore metadata,
                            @Nonnull AccessEvaluator evaluator, @Nullable Subject subject) {
        this.store = checkNotNull(store);
        this.metadata = checkNotNull(metadata);
        this.evaluator = checkNotNull(evaluator);
        this.subject = subject;
    }

    /**
     * Sets the scheduler used to coalesce content changes. Without one,
     * every content change recomputes immediately.
     */
    public void setScheduler(@Nullable RecomputeScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @Nonnull
    public FilteredView getView() {
        return view;
    }

    @CheckForNull
    public Subject getSubject() {
        return subject;
    }

    /**
     * Switches the subject and recomputes the view for it right away.
     */
    public void setSubject(@Nullable Subject subject) {
        this.subject = subject;
        recompute();
    }

    /**
     * @return the number of recomputes that ran to completion
     */
    public synchronized long getRecomputeCount() {
        return recomputeCount;
    }

    /**
     * Recomputes the view of the current subject.
     *
     * @return the view after the recompute
     */
    @Nonnull
    public synchronized List<Block> recompute() {
        if (syncing) {
            log.debug("Deferring recompute requested during recompute of {}", store.getDocId());
            dirty = true;
            return view.getBlocks();
        }
        syncing = true;
        try {
            do {
                dirty = false;
                List<Block> snapshot = store.getBlocks();
                List<Block> filtered = filter(snapshot, subject);
                List<Block> current = view.getBlocks();
                if (!filtered.equals(current)) {
                    if (!Block.ids(filtered).equals(Block.ids(current))) {
                        log.debug("View of {} for {} now has {} of {} blocks", store.getDocId(),
                                subjectId(subject), filtered.size(), snapshot.size());
                    }
                    view.replace(filtered);
                }
                recomputeCount++;
            } while (dirty);
            return view.getBlocks();
        } finally {
            syncing = false;
            dirty = false;
        }
    }

    /**
     * Evaluates a snapshot for a subject without touching the view.
     */
    @Nonnull
    public List<Block> filter(@Nonnull List<Block> snapshot, @Nullable Subject subject) {
        ImmutableList.Builder<Block> allowed = ImmutableList.builder();
        for (Block block : snapshot) {
            if (isAllowed(subject, block.getId(), metadata.get(block.getId()).orElse(null))) {
                allowed.add(block);
            }
        }
        return allowed.build();
    }

    //----------------------------------------------------< ContentObserver >--

    @Override
    public void contentChanged(@Nonnull List<Block> before, @Nonnull List<Block> after) {
        RecomputeScheduler s = scheduler;
        if (s == null) {
            recompute();
        } else {
            s.trigger();
        }
    }

    //---------------------------------------------------< MetadataListener >--

    @Override
    public void metadataChanged(@Nonnull String blockId, @Nullable BlockMetadata md) {
        recompute();
    }

    //------------------------------------------------------------< private >---

    private boolean isAllowed(Subject subject, String blockId, BlockMetadata md) {
        try {
            return evaluator.evaluate(subject, md);
        } catch (RuntimeException e) {
            log.error("Evaluation of block {} failed for {}, denying access", blockId, subjectId(subject), e);
            return false;
        }
    }

    private static String subjectId(Subject subject) {
        return subject == null ? "anonymous" : subject.getId();
    }

    @Override
    public String toString() {
        return "SecureSyncFilter[" + store.getDocId() + ", " + subjectId(subject) + ']';
    }
}

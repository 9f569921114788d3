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
package org.quire.plugins.memory;

import static com.google.common.base.Preconditions.checkNotNull;
import static java.lang.String.format;

import java.io.Closeable;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

import javax.annotation.Nonnull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;
import org.quire.api.Block;
import org.quire.api.QuireException;
import org.quire.spi.observation.ContentObserver;
import org.quire.spi.state.BlockEditor;
import org.quire.spi.state.ContentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Basic in-memory content store. Transactions are serialized; observers
 * are called synchronously after each committed change, so each observer
 * sees a linear sequence of snapshots.
 */
public class MemoryContentStore implements ContentStore {

    private static final Logger log = LoggerFactory.getLogger(MemoryContentStore.class);

    private final String docId;

    private final AtomicReference<List<Block>> blocks;

    private final List<ContentObserver> observers = new CopyOnWriteArrayList<ContentObserver>();

    public MemoryContentStore(@Nonnull String docId, @Nonnull List<Block> blocks) {
        this.docId = checkNotNull(docId);
        this.blocks = new AtomicReference<List<Block>>(ImmutableList.copyOf(blocks));
    }

    public MemoryContentStore(@Nonnull String docId) {
        this(docId, ImmutableList.<Block>of());
    }

    @Nonnull
    @Override
    public String getDocId() {
        return docId;
    }

    @Nonnull
    @Override
    public List<Block> getBlocks() {
        return blocks.get();
    }

    @Nonnull
    @Override
    public synchronized List<Block> transact(@Nonnull BlockEditor editor) throws QuireException {
        List<Block> before = blocks.get();
        List<Block> after = ImmutableList.copyOf(editor.edit(before));
        checkUniqueIds(after);
        if (after.equals(before)) {
            return before;
        }
        blocks.set(after);
        for (ContentObserver observer : observers) {
            try {
                observer.contentChanged(before, after);
            } catch (RuntimeException e) {
                log.error("Content observer {} failed on document {}", observer, docId, e);
            }
        }
        return after;
    }

    /**
     * Replaces the whole content, as when a merged remote state is applied.
     */
    @Nonnull
    public List<Block> replace(@Nonnull final List<Block> content) throws QuireException {
        return transact(new BlockEditor() {
            @Nonnull
            @Override
            public List<Block> edit(@Nonnull List<Block> current) {
                return content;
            }
        });
    }

    @Nonnull
    @Override
    public Closeable addObserver(@Nonnull final ContentObserver observer) {
        observers.add(checkNotNull(observer));
        return new Closeable() {
            @Override
            public void close() {
                observers.remove(observer);
            }
        };
    }

    @Override
    public String toString() {
        return "MemoryContentStore[" + docId + ']';
    }

    //------------------------------------------------------------< private >---

    private void checkUniqueIds(List<Block> content) throws QuireException {
        Set<String> seen = Sets.newHashSet();
        for (Block b : content) {
            if (!seen.add(b.getId())) {
                throw new QuireException(QuireException.STATE, 1,
                        format("duplicate block id %s in document %s", b.getId(), docId));
            }
        }
    }
}

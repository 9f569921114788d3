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
package org.quire.plugins.metadata;

import static com.google.common.base.Preconditions.checkNotNull;

import java.io.Closeable;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import org.quire.api.Block;
import org.quire.api.BlockMetadata;
import org.quire.api.CapabilityToken;
import org.quire.api.TokenScope;
import org.quire.api.VerificationStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Map from stable block id to security metadata, kept apart from the
 * document content so that the metadata survives structural edits and is
 * never part of exported markup. The store owns no storage: it is filled
 * from and exported to document snapshots.
 * <p>
 * Next to the metadata the store keeps two ephemeral maps that are never
 * persisted: the {@link VerificationStatus} of each block and the
 * {@link CapabilityToken}s held for external references.
 * <p>
 * All mutations are serialized by a single lock. Listeners are notified
 * after the lock was released.
 */
public class MetadataShadowStore {

    private static final Logger log = LoggerFactory.getLogger(MetadataShadowStore.class);

    private final Object lock = new Object();

    private final Map<String, BlockMetadata> metadata = Maps.newHashMap();

    private final Map<String, VerificationStatus> verification = Maps.newHashMap();

    private final Map<TokenScope, CapabilityToken> tokens = Maps.newHashMap();

    private final List<MetadataListener> listeners = new CopyOnWriteArrayList<MetadataListener>();

    //-----------------------------------------------------------< metadata >---

    /**
     * @return the metadata of the block, or an empty result if none was
     *         recorded. Absent metadata is not an error.
     */
    @Nonnull
    public Optional<BlockMetadata> get(@Nonnull String blockId) {
        synchronized (lock) {
            return Optional.ofNullable(metadata.get(checkNotNull(blockId)));
        }
    }

    /**
     * @return the metadata of the block, {@link BlockMetadata#DEFAULT} if
     *         none was recorded
     */
    @Nonnull
    public BlockMetadata getEffective(@Nonnull String blockId) {
        return get(blockId).orElse(BlockMetadata.DEFAULT);
    }

    public boolean contains(@Nonnull String blockId) {
        synchronized (lock) {
            return metadata.containsKey(blockId);
        }
    }

    public int size() {
        synchronized (lock) {
            return metadata.size();
        }
    }

    public void set(@Nonnull String blockId, @Nonnull BlockMetadata md) {
        checkNotNull(blockId);
        checkNotNull(md);
        boolean changed;
        synchronized (lock) {
            changed = !md.equals(metadata.put(blockId, md));
        }
        if (changed) {
            fire(ImmutableMap.of(blockId, Optional.of(md)));
        }
    }

    /**
     * Sets the metadata of several blocks in one step.
     */
    public void setMany(@Nonnull Map<String, BlockMetadata> entries) {
        Map<String, Optional<BlockMetadata>> changes = Maps.newLinkedHashMap();
        synchronized (lock) {
            for (Map.Entry<String, BlockMetadata> e : entries.entrySet()) {
                BlockMetadata md = checkNotNull(e.getValue());
                if (!md.equals(metadata.put(e.getKey(), md))) {
                    changes.put(e.getKey(), Optional.of(md));
                }
            }
        }
        fire(changes);
    }

    /**
     * @return {@code true} if metadata was recorded for the block
     */
    public boolean delete(@Nonnull String blockId) {
        boolean removed;
        synchronized (lock) {
            removed = metadata.remove(blockId) != null;
            verification.remove(blockId);
        }
        if (removed) {
            fire(ImmutableMap.of(blockId, Optional.<BlockMetadata>empty()));
        }
        return removed;
    }

    /**
     * Removes all metadata and verification status. Tokens are kept.
     */
    public void clear() {
        Map<String, Optional<BlockMetadata>> changes = Maps.newLinkedHashMap();
        synchronized (lock) {
            for (String id : metadata.keySet()) {
                changes.put(id, Optional.<BlockMetadata>empty());
            }
            metadata.clear();
            verification.clear();
        }
        fire(changes);
    }

    /**
     * Replaces the content of this store with the metadata embedded in the
     * given snapshot. Clearing and repopulating happen under one lock, so
     * no reader sees metadata left over from a previously loaded document.
     * Verification status is reset as well.
     */
    public void loadFromSnapshot(@Nonnull List<Block> blocks) {
        Map<String, Optional<BlockMetadata>> changes = Maps.newLinkedHashMap();
        synchronized (lock) {
            Map<String, BlockMetadata> previous = Maps.newHashMap(metadata);
            metadata.clear();
            verification.clear();
            for (Block b : blocks) {
                BlockMetadata md = b.getMetadata();
                if (md != null) {
                    metadata.put(b.getId(), md);
                    if (!md.equals(previous.remove(b.getId()))) {
                        changes.put(b.getId(), Optional.of(md));
                    }
                }
            }
            for (String id : previous.keySet()) {
                changes.put(id, Optional.<BlockMetadata>empty());
            }
        }
        log.info("Loaded metadata of {} blocks from snapshot", blocks.size());
        fire(changes);
    }

    /**
     * Attaches the recorded metadata to the given blocks for persisting.
     * Blocks without recorded metadata are exported without any; metadata
     * of blocks not in the list is not exported.
     */
    @Nonnull
    public List<Block> exportSnapshot(@Nonnull List<Block> blocks) {
        ImmutableList.Builder<Block> exported = ImmutableList.builder();
        synchronized (lock) {
            for (Block b : blocks) {
                exported.add(b.withMetadata(metadata.get(b.getId())));
            }
        }
        return exported.build();
    }

    /**
     * @return an immutable copy of all recorded metadata
     */
    @Nonnull
    public Map<String, BlockMetadata> getAll() {
        synchronized (lock) {
            return ImmutableMap.copyOf(metadata);
        }
    }

    //-------------------------------------------------------< verification >---

    @Nonnull
    public VerificationStatus getVerificationStatus(@Nonnull String blockId) {
        synchronized (lock) {
            VerificationStatus status = verification.get(blockId);
            return status == null ? VerificationStatus.UNKNOWN : status;
        }
    }

    public void setVerificationStatus(@Nonnull String blockId, @Nonnull VerificationStatus status) {
        synchronized (lock) {
            verification.put(checkNotNull(blockId), checkNotNull(status));
        }
    }

    @Nonnull
    public Map<String, VerificationStatus> getVerificationStatuses() {
        synchronized (lock) {
            return ImmutableMap.copyOf(verification);
        }
    }

    //-------------------------------------------------------------< tokens >---

    @CheckForNull
    public CapabilityToken getToken(@Nonnull TokenScope scope) {
        synchronized (lock) {
            return tokens.get(scope);
        }
    }

    public void putToken(@Nonnull CapabilityToken token) {
        synchronized (lock) {
            tokens.put(token.getScope(), token);
        }
    }

    /**
     * Removes the token for a scope, but only if it is still the given one.
     */
    public boolean removeToken(@Nonnull CapabilityToken token) {
        synchronized (lock) {
            return tokens.remove(token.getScope(), token);
        }
    }

    @CheckForNull
    public CapabilityToken removeToken(@Nonnull TokenScope scope) {
        synchronized (lock) {
            return tokens.remove(scope);
        }
    }

    /**
     * @return the number of tokens dropped
     */
    public int clearAllTokens() {
        synchronized (lock) {
            int n = tokens.size();
            tokens.clear();
            return n;
        }
    }

    public int getTokenCount() {
        synchronized (lock) {
            return tokens.size();
        }
    }

    //----------------------------------------------------------< listeners >---

    /**
     * @return a {@code Closeable} removing the listener again
     */
    @Nonnull
    public Closeable addListener(@Nonnull final MetadataListener listener) {
        listeners.add(checkNotNull(listener));
        return new Closeable() {
            @Override
            public void close() {
                listeners.remove(listener);
            }
        };
    }

    private void fire(Map<String, Optional<BlockMetadata>> changes) {
        for (Map.Entry<String, Optional<BlockMetadata>> change : changes.entrySet()) {
            for (MetadataListener l : listeners) {
                try {
                    l.metadataChanged(change.getKey(), change.getValue().orElse(null));
                } catch (RuntimeException e) {
                    log.error("Metadata listener {} failed for block {}", l, change.getKey(), e);
                }
            }
        }
    }
}

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
package org.quire.api;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.List;

import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

/**
 * A block of a document. The id is assigned once and never depends on the
 * position of the block, so that metadata, signatures and verification
 * state keyed by it survive reordering and structural edits.
 * <p>
 * The metadata carried here is the copy embedded in persisted snapshots;
 * at runtime the metadata shadow store is authoritative.
 */
public final class Block {

    private final String id;
    private final String type;
    private final String payload;
    private final BlockMetadata metadata;

    public Block(@Nonnull String id, @Nonnull String type, @Nonnull String payload,
                 @Nullable BlockMetadata metadata) {
        checkArgument(!Strings.isNullOrEmpty(id), "block id must not be empty");
        this.id = id;
        this.type = checkNotNull(type);
        this.payload = checkNotNull(payload);
        this.metadata = metadata;
    }

    public Block(@Nonnull String id, @Nonnull String type, @Nonnull String payload) {
        this(id, type, payload, null);
    }

    @Nonnull
    public String getId() {
        return id;
    }

    @Nonnull
    public String getType() {
        return type;
    }

    /**
     * @return the content of this block; its digest is what gets signed
     */
    @Nonnull
    public String getPayload() {
        return payload;
    }

    @CheckForNull
    public BlockMetadata getMetadata() {
        return metadata;
    }

    @Nonnull
    public Block withPayload(@Nonnull String payload) {
        return new Block(id, type, payload, metadata);
    }

    @Nonnull
    public Block withMetadata(@Nullable BlockMetadata metadata) {
        return new Block(id, type, payload, metadata);
    }

    /**
     * @return the ids of the given blocks, in order
     */
    @Nonnull
    public static List<String> ids(@Nonnull Iterable<Block> blocks) {
        ImmutableList.Builder<String> ids = ImmutableList.builder();
        for (Block b : blocks) {
            ids.add(b.getId());
        }
        return ids.build();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Block)) {
            return false;
        }
        Block that = (Block) other;
        return id.equals(that.id)
                && type.equals(that.type)
                && payload.equals(that.payload)
                && Objects.equal(metadata, that.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(id, type, payload, metadata);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", id)
                .add("type", type)
                .add("length", payload.length())
                .toString();
    }
}

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

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.List;

import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;

/**
 * Security attributes of a single block. Instances are immutable and are
 * kept apart from block content in the metadata shadow store, keyed by the
 * stable block id.
 * <p>
 * A record whose classification could not be understood (an unknown label
 * or an out-of-range level) is {@link #isMalformed() malformed} and is
 * treated as {@link Classification#RESTRICTED restricted}.
 */
public final class BlockMetadata {

    /**
     * The metadata implied for a block that has none: public, no ACL,
     * unlocked.
     */
    public static final BlockMetadata DEFAULT = builder().build();

    private final Classification classification;
    private final boolean malformed;
    private final ImmutableList<String> acl;
    private final boolean locked;
    private final Provenance provenance;

    private BlockMetadata(Builder b) {
        this.classification = b.classification;
        this.malformed = b.malformed;
        this.acl = ImmutableList.copyOf(b.acl);
        this.locked = b.locked;
        this.provenance = b.provenance;
    }

    @Nonnull
    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return the declared classification, {@code null} if none was declared
     *         or if the declared value was malformed
     */
    @CheckForNull
    public Classification getClassification() {
        return classification;
    }

    /**
     * The classification the access control gates use: restricted for
     * malformed records, public when nothing was declared.
     */
    @Nonnull
    public Classification getEffectiveClassification() {
        if (malformed) {
            return Classification.RESTRICTED;
        }
        return classification == null ? Classification.PUBLIC : classification;
    }

    public boolean isMalformed() {
        return malformed;
    }

    /**
     * Allow-list of subject ids and role names. Empty means public.
     */
    @Nonnull
    public List<String> getAcl() {
        return acl;
    }

    /**
     * Locked blocks may only be edited by administrators. Locking never
     * restricts read access.
     */
    public boolean isLocked() {
        return locked;
    }

    @CheckForNull
    public Provenance getProvenance() {
        return provenance;
    }

    @CheckForNull
    public String getOriginDocId() {
        return provenance == null ? null : provenance.getOriginDocId();
    }

    @Nonnull
    public BlockMetadata withProvenance(@Nullable Provenance provenance) {
        return toBuilder().provenance(provenance).build();
    }

    @Nonnull
    public Builder toBuilder() {
        Builder b = new Builder()
                .acl(acl)
                .locked(locked)
                .provenance(provenance);
        b.classification = classification;
        b.malformed = malformed;
        return b;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof BlockMetadata)) {
            return false;
        }
        BlockMetadata that = (BlockMetadata) other;
        return malformed == that.malformed
                && locked == that.locked
                && classification == that.classification
                && acl.equals(that.acl)
                && Objects.equal(provenance, that.provenance);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(classification, malformed, acl, locked, provenance);
    }

    /**
     * Only the size of the ACL is shown, never its entries.
     */
    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("classification", getEffectiveClassification())
                .add("malformed", malformed)
                .add("aclSize", acl.size())
                .add("locked", locked)
                .add("provenance", provenance)
                .omitNullValues()
                .toString();
    }

    public static final class Builder {

        private Classification classification;
        private boolean malformed;
        private List<String> acl = ImmutableList.of();
        private boolean locked;
        private Provenance provenance;

        private Builder() {
        }

        public Builder classification(@Nullable Classification classification) {
            this.classification = classification;
            this.malformed = false;
            return this;
        }

        /**
         * Sets the classification from a stored label. An unknown label
         * marks the record as malformed.
         */
        public Builder classification(@Nullable String label) {
            Classification c = Classification.fromLabel(label);
            this.classification = c;
            this.malformed = label != null && c == null;
            return this;
        }

        /**
         * Sets the classification from a stored level. An out-of-range
         * level marks the record as malformed.
         */
        public Builder classificationLevel(int level) {
            Classification c = Classification.fromLevel(level);
            this.classification = c;
            this.malformed = c == null;
            return this;
        }

        public Builder acl(@Nonnull List<String> acl) {
            this.acl = checkNotNull(acl);
            return this;
        }

        public Builder acl(String... acl) {
            this.acl = ImmutableList.copyOf(acl);
            return this;
        }

        public Builder locked(boolean locked) {
            this.locked = locked;
            return this;
        }

        public Builder provenance(@Nullable Provenance provenance) {
            this.provenance = provenance;
            return this;
        }

        public BlockMetadata build() {
            return new BlockMetadata(this);
        }
    }
}

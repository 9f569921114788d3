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
package org.quire.plugins.redaction;

import static com.google.common.base.Preconditions.checkNotNull;

import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

import com.google.common.base.MoreObjects;
import org.quire.api.Block;
import org.quire.api.Classification;

/**
 * A block as presented to a subject: either the block itself or a
 * redaction marker. A marker carries nothing but the classification a
 * subject would need, not the id, the content or the ACL of the block.
 */
public final class RenderedBlock {

    public enum Kind {
        VISIBLE, REDACTED
    }

    private final Kind kind;
    private final Block block;
    private final Classification requiredClassification;
    private final boolean tampered;

    private RenderedBlock(Kind kind, Block block, Classification requiredClassification, boolean tampered) {
        this.kind = kind;
        this.block = block;
        this.requiredClassification = requiredClassification;
        this.tampered = tampered;
    }

    @Nonnull
    static RenderedBlock visible(@Nonnull Block block, boolean tampered) {
        return new RenderedBlock(Kind.VISIBLE, checkNotNull(block), null, tampered);
    }

    @Nonnull
    static RenderedBlock redacted(@Nonnull Classification required) {
        return new RenderedBlock(Kind.REDACTED, null, checkNotNull(required), false);
    }

    @Nonnull
    public Kind getKind() {
        return kind;
    }

    public boolean isRedacted() {
        return kind == Kind.REDACTED;
    }

    /**
     * @return the block, {@code null} for a redaction marker
     */
    @CheckForNull
    public Block getBlock() {
        return block;
    }

    /**
     * @return the minimum classification of a redacted block, {@code null}
     *         for a visible block
     */
    @CheckForNull
    public Classification getRequiredClassification() {
        return requiredClassification;
    }

    /**
     * Tamper warnings cannot be dismissed and are shown in addition to the
     * content.
     */
    public boolean isTampered() {
        return tampered;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("kind", kind)
                .add("block", block)
                .add("required", requiredClassification)
                .add("tampered", tampered)
                .omitNullValues()
                .toString();
    }
}

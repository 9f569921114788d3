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
package org.quire.spi.reference;

import static com.google.common.base.Preconditions.checkNotNull;

import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

import com.google.common.base.MoreObjects;
import org.quire.api.Block;

/**
 * Answer of a {@link TargetDocumentAuthority} to a resolution request.
 * Denial is a regular result and carries no information about why access
 * was refused.
 */
public final class ResolveResult {

    public enum Status {
        GRANTED, DENIED, NOT_FOUND
    }

    private static final ResolveResult DENIED = new ResolveResult(Status.DENIED, null, false);

    private static final ResolveResult NOT_FOUND = new ResolveResult(Status.NOT_FOUND, null, false);

    private final Status status;
    private final Block block;
    private final boolean viaToken;

    private ResolveResult(Status status, Block block, boolean viaToken) {
        this.status = status;
        this.block = block;
        this.viaToken = viaToken;
    }

    /**
     * @param block the resolved block
     * @param viaToken whether a presented token let the authority skip full
     *                 evaluation
     */
    @Nonnull
    public static ResolveResult granted(@Nonnull Block block, boolean viaToken) {
        return new ResolveResult(Status.GRANTED, checkNotNull(block), viaToken);
    }

    @Nonnull
    public static ResolveResult denied() {
        return DENIED;
    }

    @Nonnull
    public static ResolveResult notFound() {
        return NOT_FOUND;
    }

    @Nonnull
    public Status getStatus() {
        return status;
    }

    public boolean isGranted() {
        return status == Status.GRANTED;
    }

    /**
     * @return the resolved block, {@code null} unless granted
     */
    @CheckForNull
    public Block getBlock() {
        return block;
    }

    public boolean isViaToken() {
        return viaToken;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("status", status)
                .add("block", block == null ? null : block.getId())
                .add("viaToken", viaToken)
                .omitNullValues()
                .toString();
    }
}

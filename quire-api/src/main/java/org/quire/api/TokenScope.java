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

import javax.annotation.Nonnull;

import com.google.common.base.Objects;

/**
 * The (subject, target) pair a capability token is issued for. A scope
 * always names a single block: tokens never cover a whole document.
 */
public final class TokenScope {

    private final String subjectId;
    private final String docId;
    private final String blockId;

    public TokenScope(@Nonnull String subjectId, @Nonnull String docId, @Nonnull String blockId) {
        this.subjectId = checkNotNull(subjectId);
        this.docId = checkNotNull(docId);
        this.blockId = checkNotNull(blockId);
    }

    @Nonnull
    public String getSubjectId() {
        return subjectId;
    }

    @Nonnull
    public String getDocId() {
        return docId;
    }

    @Nonnull
    public String getBlockId() {
        return blockId;
    }

    public boolean covers(@Nonnull String subjectId, @Nonnull String docId, @Nonnull String blockId) {
        return this.subjectId.equals(subjectId)
                && this.docId.equals(docId)
                && this.blockId.equals(blockId);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof TokenScope)) {
            return false;
        }
        TokenScope that = (TokenScope) other;
        return subjectId.equals(that.subjectId)
                && docId.equals(that.docId)
                && blockId.equals(that.blockId);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(subjectId, docId, blockId);
    }

    @Override
    public String toString() {
        return subjectId + "->" + docId + '/' + blockId;
    }
}

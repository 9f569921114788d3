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

import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import org.quire.api.AuthorityUnavailableException;
import org.quire.api.CapabilityToken;
import org.quire.api.Subject;

/**
 * The authority owning a document whose blocks are referenced from
 * elsewhere. Authorization is always decided here, never by the
 * referencing side.
 */
public interface TargetDocumentAuthority {

    /**
     * Resolves a block for a subject. A presented token may let the
     * authority skip full evaluation, but an expired, mismatching or
     * missing token always falls back to it.
     *
     * @param token a token previously issued for this scope, or {@code null}
     * @throws AuthorityUnavailableException if the authority cannot answer
     */
    @Nonnull
    ResolveResult resolve(@Nonnull Subject subject, @Nonnull String docId, @Nonnull String blockId,
                          @Nullable CapabilityToken token) throws AuthorityUnavailableException;

    /**
     * Runs the full authorization handshake and issues a short-lived token
     * for the given scope.
     *
     * @return the token, or {@code null} if the subject was denied
     * @throws AuthorityUnavailableException if the authority cannot answer
     */
    @CheckForNull
    CapabilityToken issueToken(@Nonnull Subject subject, @Nonnull String docId, @Nonnull String blockId)
            throws AuthorityUnavailableException;
}

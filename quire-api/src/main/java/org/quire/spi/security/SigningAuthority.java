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
package org.quire.spi.security;

import javax.annotation.Nonnull;

import org.quire.api.AuthorityUnavailableException;
import org.quire.api.QuireException;
import org.quire.api.SigningRejectedException;
import org.quire.api.Subject;

/**
 * Opaque signing service. The core only shapes requests, a block id plus
 * the digest of its content, and interprets the answers. The signature
 * scheme is up to the implementation.
 */
public interface SigningAuthority {

    /**
     * Signs the digest of a block's content on behalf of a subject.
     *
     * @throws SigningRejectedException if the subject may not sign
     * @throws AuthorityUnavailableException if the authority cannot answer
     */
    @Nonnull
    SignatureResult sign(@Nonnull String blockId, @Nonnull String contentHash, @Nonnull Subject subject)
            throws QuireException;

    /**
     * @return {@code true} iff {@code signature} is a valid signature of
     *         this authority over the given block id and digest
     * @throws AuthorityUnavailableException if the authority cannot answer
     */
    boolean verify(@Nonnull String blockId, @Nonnull String contentHash, @Nonnull String signature)
            throws AuthorityUnavailableException;
}

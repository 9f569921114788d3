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
package org.quire.security.authority;

import static com.google.common.base.Preconditions.checkNotNull;
import static java.lang.String.format;

import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.PublicKey;
import java.util.Set;

import javax.annotation.Nonnull;

import com.google.common.collect.ImmutableSet;
import org.quire.api.AuthorityUnavailableException;
import org.quire.api.QuireException;
import org.quire.api.SigningRejectedException;
import org.quire.api.Subject;
import org.quire.spi.security.SignatureResult;
import org.quire.spi.security.SigningAuthority;
import org.quire.stats.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Signing authority holding an Ed25519 key pair in process. Signatures are
 * computed over {@code blockId:contentHash}; the signer id is the first 16
 * hex characters of the raw public key. Viewers and auditors may not sign.
 */
public class LocalSigningAuthority implements SigningAuthority {

    private static final Logger log = LoggerFactory.getLogger(LocalSigningAuthority.class);

    private static final Set<String> NON_SIGNING_ROLES =
            ImmutableSet.of(Subject.ROLE_VIEWER, Subject.ROLE_AUDITOR);

    private final Ed25519Signer signer;

    private final Clock clock;

    public LocalSigningAuthority(@Nonnull KeyPair keyPair, @Nonnull Clock clock) {
        this.signer = new Ed25519Signer(keyPair);
        this.clock = checkNotNull(clock);
    }

    /**
     * Creates an authority with a freshly generated key pair.
     */
    public LocalSigningAuthority(@Nonnull Clock clock) {
        this(Ed25519Signer.generateKeyPair(), clock);
    }

    @Nonnull
    public String getSignerId() {
        return signer.getSignerId();
    }

    @Nonnull
    public PublicKey getPublicKey() {
        return signer.getPublicKey();
    }

    @Nonnull
    @Override
    public SignatureResult sign(@Nonnull String blockId, @Nonnull String contentHash, @Nonnull Subject subject)
            throws QuireException {
        if (NON_SIGNING_ROLES.contains(subject.getRole())) {
            throw new SigningRejectedException(1,
                    format("subject %s with role %s may not sign block %s", subject.getId(), subject.getRole(), blockId));
        }
        try {
            String signature = signer.sign(message(blockId, contentHash));
            log.debug("Signed block {} on behalf of {}", blockId, subject.getId());
            return new SignatureResult(signature, signer.getSignerId(), clock.getInstant(), Ed25519Signer.ALGORITHM);
        } catch (GeneralSecurityException e) {
            throw new AuthorityUnavailableException(1, "signing of block " + blockId + " failed", e);
        }
    }

    @Override
    public boolean verify(@Nonnull String blockId, @Nonnull String contentHash, @Nonnull String signature)
            throws AuthorityUnavailableException {
        try {
            return signer.verify(message(blockId, contentHash), signature);
        } catch (GeneralSecurityException e) {
            throw new AuthorityUnavailableException(2, "verification of block " + blockId + " failed", e);
        }
    }

    private static String message(String blockId, String contentHash) {
        return blockId + ':' + contentHash;
    }
}

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
import static java.nio.charset.StandardCharsets.UTF_8;

import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PublicKey;
import java.security.Signature;
import java.security.SignatureException;
import java.util.Arrays;

import javax.annotation.Nonnull;

import com.google.common.io.BaseEncoding;

/**
 * Ed25519 signatures over UTF-8 strings, encoded as Base64.
 */
class Ed25519Signer {

    static final String ALGORITHM = "Ed25519";

    /**
     * Length of the raw key at the end of an X.509 encoded Ed25519 key.
     */
    private static final int RAW_KEY_LENGTH = 32;

    private static final int SIGNER_ID_LENGTH = 16;

    private final KeyPair keyPair;

    private final String signerId;

    Ed25519Signer(@Nonnull KeyPair keyPair) {
        this.keyPair = checkNotNull(keyPair);
        this.signerId = publicKeyHex(keyPair.getPublic()).substring(0, SIGNER_ID_LENGTH);
    }

    static KeyPair generateKeyPair() {
        try {
            return KeyPairGenerator.getInstance(ALGORITHM).generateKeyPair();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Ed25519 is not available", e);
        }
    }

    String getSignerId() {
        return signerId;
    }

    PublicKey getPublicKey() {
        return keyPair.getPublic();
    }

    String sign(@Nonnull String message) throws GeneralSecurityException {
        Signature signature = Signature.getInstance(ALGORITHM);
        signature.initSign(keyPair.getPrivate());
        signature.update(message.getBytes(UTF_8));
        return BaseEncoding.base64().encode(signature.sign());
    }

    /**
     * @return {@code false} if the signature is malformed or does not match
     * @throws GeneralSecurityException if the algorithm cannot be used
     */
    boolean verify(@Nonnull String message, @Nonnull String encodedSignature) throws GeneralSecurityException {
        byte[] sig;
        try {
            sig = BaseEncoding.base64().decode(encodedSignature);
        } catch (IllegalArgumentException e) {
            return false;
        }
        Signature signature = Signature.getInstance(ALGORITHM);
        signature.initVerify(keyPair.getPublic());
        signature.update(message.getBytes(UTF_8));
        try {
            return signature.verify(sig);
        } catch (SignatureException e) {
            return false;
        }
    }

    static String publicKeyHex(PublicKey key) {
        byte[] encoded = key.getEncoded();
        byte[] raw = Arrays.copyOfRange(encoded, encoded.length - RAW_KEY_LENGTH, encoded.length);
        return BaseEncoding.base16().lowerCase().encode(raw);
    }
}

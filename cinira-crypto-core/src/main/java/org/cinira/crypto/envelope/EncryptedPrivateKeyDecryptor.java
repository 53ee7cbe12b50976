/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements. See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership. The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied. See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package org.cinira.crypto.envelope;

import java.io.IOException;
import java.security.GeneralSecurityException;
import java.security.InvalidParameterException;
import java.security.KeyFactory;
import java.security.PrivateKey;
import java.security.spec.InvalidKeySpecException;
import java.security.spec.PKCS8EncodedKeySpec;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import javax.crypto.SecretKey;

import org.cinira.crypto.common.util.GenericUtils;
import org.cinira.crypto.common.util.io.der.MalformedEncodingException;
import org.cinira.crypto.common.util.logging.AbstractLoggingBean;
import org.cinira.crypto.common.util.security.SecurityUtils;
import org.cinira.crypto.kdf.PBKDF2KeyDerivation;
import org.cinira.crypto.keybag.AlgorithmIdentifiers;
import org.cinira.crypto.keybag.EncryptedPrivateKeyInfo;
import org.cinira.crypto.keybag.PrivateKeyInfo;
import org.cinira.crypto.keybag.UnsupportedAlgorithmException;

/**
 * Decrypts an OpenSSL PBES2/PBKDF2/HMAC-SHA256/AES-256-CBC encrypted PKCS#8 document into an RSA
 * {@link PrivateKey}. The algorithms are validated before any key is derived, and every failure that may be caused by
 * a wrong passphrase is reported as the same {@link DecryptionFailedException}.
 *
 * @author Cinira Crypto Project
 */
public class EncryptedPrivateKeyDecryptor extends AbstractLoggingBean {
    /** The only supported algorithms - in the order they appear in the document */
    public static final List<AlgorithmIdentifiers> SUPPORTED_ALGORITHMS = GenericUtils.unmodifiableList(
            AlgorithmIdentifiers.PBES2, AlgorithmIdentifiers.PBKDF2,
            AlgorithmIdentifiers.HMAC_WITH_SHA256, AlgorithmIdentifiers.AES256_CBC);

    public static final String KEY_ALGORITHM = "RSA";

    /** AES-256 key length in bytes */
    public static final int AES256_KEY_LENGTH = 32;

    public static final EncryptedPrivateKeyDecryptor INSTANCE
            = new EncryptedPrivateKeyDecryptor(PBKDF2KeyDerivation.INSTANCE, AESEnvelopeCipher.INSTANCE);

    private final PBKDF2KeyDerivation keyDerivation;
    private final AESEnvelopeCipher aesCipher;

    public EncryptedPrivateKeyDecryptor(PBKDF2KeyDerivation keyDerivation, AESEnvelopeCipher aesCipher) {
        this.keyDerivation = Objects.requireNonNull(keyDerivation, "No key derivation");
        this.aesCipher = Objects.requireNonNull(aesCipher, "No AES cipher");
    }

    /**
     * @param  bag                           The DER encoded {@code EncryptedPrivateKeyInfo}
     * @param  passphrase                    The passphrase used to encrypt it
     * @return                               The decrypted RSA private key
     * @throws InvalidParameterException     If no passphrase provided
     * @throws IOException                   If the document is malformed
     * @throws UnsupportedAlgorithmException If the document uses other algorithms
     * @throws DecryptionFailedException     If the passphrase is wrong or the encrypted data corrupted
     * @throws GeneralSecurityException      If another primitive failure occurred
     */
    public PrivateKey decryptPrivateKey(byte[] bag, String passphrase) throws IOException, GeneralSecurityException {
        if (GenericUtils.isEmpty(passphrase)) {
            throw new InvalidParameterException("No passphrase provided");
        }
        Objects.requireNonNull(bag, "No encrypted key data");

        EncryptedPrivateKeyInfo info = EncryptedPrivateKeyInfo.decode(bag);
        validateAlgorithms(info);

        byte[] iv = info.getIV();
        if (iv.length != AESEnvelopeCipher.IV_LENGTH) {
            throw new MalformedEncodingException("Invalid AES-CBC IV length: " + iv.length);
        }

        if (log.isDebugEnabled()) {
            log.debug("decryptPrivateKey({} bytes) {}", bag.length, info);
        }

        SecretKey key = keyDerivation.deriveKey(passphrase, info.getSalt(), info.getIterationCount());
        byte[] encrypted = info.getEncryptedData();
        byte[] plain = aesCipher.decrypt(key, iv, encrypted, 0, encrypted.length);
        try {
            return importPrivateKey(plain);
        } finally {
            Arrays.fill(plain, (byte) 0);
        }
    }

    /**
     * @param  info                          The decoded document
     * @throws UnsupportedAlgorithmException If the algorithms are not exactly the supported ones
     */
    public void validateAlgorithms(EncryptedPrivateKeyInfo info) throws UnsupportedAlgorithmException {
        if (info.getPrf() == null) {
            throw new UnsupportedAlgorithmException("Unsupported PRF: default hmacWithSHA1");
        }

        List<byte[]> oids = info.getAlgorithmOIDs();
        if (oids.size() != SUPPORTED_ALGORITHMS.size()) {
            throw new UnsupportedAlgorithmException("Unexpected algorithms count: " + oids.size());
        }

        for (int index = 0; index < oids.size(); index++) {
            AlgorithmIdentifiers expected = SUPPORTED_ALGORITHMS.get(index);
            byte[] actual = oids.get(index);
            if (!expected.matches(actual)) {
                throw new UnsupportedAlgorithmException(
                        "Unsupported algorithm #" + index + ": expected=" + expected.getOID()
                                                        + ", actual=" + AlgorithmIdentifiers.describe(actual));
            }
        }

        int keyLength = info.getKeyLength();
        if ((keyLength >= 0) && (keyLength != AES256_KEY_LENGTH)) {
            throw new UnsupportedAlgorithmException("Unsupported derived key length: " + keyLength);
        }
    }

    protected PrivateKey importPrivateKey(byte[] plain) throws GeneralSecurityException {
        PrivateKeyInfo inner;
        try {
            inner = PrivateKeyInfo.decode(plain);
        } catch (IOException e) {
            // a wrong passphrase may still yield valid padding - the plaintext is garbage then
            debug("importPrivateKey({} bytes) undecodable plaintext: {}", plain.length, e.getClass().getSimpleName(), e);
            throw new DecryptionFailedException();
        }

        try {
            if (!inner.getAlgorithm().isAlgorithm(AlgorithmIdentifiers.RSA_ENCRYPTION)) {
                throw new UnsupportedAlgorithmException("Unsupported key algorithm: " + inner.getAlgorithm());
            }

            KeyFactory factory = SecurityUtils.getKeyFactory(KEY_ALGORITHM);
            try {
                return factory.generatePrivate(new PKCS8EncodedKeySpec(plain));
            } catch (InvalidKeySpecException e) {
                debug("importPrivateKey({} bytes) invalid key: {}", plain.length, e.getClass().getSimpleName(), e);
                throw new DecryptionFailedException();
            }
        } finally {
            inner.clear();
        }
    }
}

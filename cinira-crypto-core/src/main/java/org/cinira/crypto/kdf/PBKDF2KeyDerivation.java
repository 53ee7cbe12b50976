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

package org.cinira.crypto.kdf;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.InvalidParameterException;
import java.security.MessageDigest;
import java.util.Arrays;

import javax.crypto.SecretKey;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;

import org.cinira.crypto.common.util.GenericUtils;
import org.cinira.crypto.common.util.NumberUtils;
import org.cinira.crypto.common.util.logging.AbstractLoggingBean;
import org.cinira.crypto.common.util.security.SecurityUtils;

/**
 * Derives 256-bit AES keys from a passphrase using PBKDF2 with HMAC-SHA256. Two policies are offered and they must
 * not be mixed:
 * <UL>
 * <LI>{@link #generateAESKey(String, byte[])} - fixed {@link #DEFAULT_ITERATIONS} and a 16 bytes salt that defaults
 * to the start of the passphrase SHA-256 digest.</LI>
 * <LI>{@link #deriveKey(String, byte[], int)} - salt and iteration count taken as-is from an encrypted key document,
 * as OpenSSL wrote them.</LI>
 * </UL>
 *
 * @author Cinira Crypto Project
 */
public class PBKDF2KeyDerivation extends AbstractLoggingBean {
    public static final String KDF_ALGORITHM = "PBKDF2WithHmacSHA256";
    public static final String KEY_ALGORITHM = "AES";
    public static final String DIGEST_ALGORITHM = "SHA-256";

    public static final int DEFAULT_ITERATIONS = 65535;
    public static final int KEY_SIZE = 256;
    public static final int SALT_LENGTH = 16;
    public static final int IV_LENGTH = 16;

    public static final PBKDF2KeyDerivation INSTANCE = new PBKDF2KeyDerivation();

    public PBKDF2KeyDerivation() {
        super();
    }

    /**
     * @param  passphrase                The passphrase
     * @param  salt                      Exactly {@link #SALT_LENGTH} bytes - if {@code null} the start of the
     *                                   SHA-256 digest of the passphrase is used
     * @return                           An AES key usable for both encryption and decryption
     * @throws InvalidParameterException If the passphrase is missing or the salt has a bad length
     * @throws GeneralSecurityException  If the derivation failed
     */
    public SecretKey generateAESKey(String passphrase, byte[] salt) throws GeneralSecurityException {
        checkPassphrase(passphrase);
        byte[] effectiveSalt;
        if (salt == null) {
            effectiveSalt = defaultSalt(passphrase);
        } else {
            checkLength("salt", salt, SALT_LENGTH);
            effectiveSalt = salt;
        }

        return derive(passphrase, effectiveSalt, DEFAULT_ITERATIONS);
    }

    /**
     * Key derivation for encrypted key documents - salt and iterations come from the document. No default is ever
     * applied and the salt may have any non-zero length (OpenSSL writes 8 bytes).
     *
     * @param  passphrase                The passphrase
     * @param  salt                      The salt
     * @param  iterations                The iteration count - positive
     * @return                           An AES key
     * @throws InvalidParameterException If the passphrase or salt are missing or the iteration count is not positive
     * @throws GeneralSecurityException  If the derivation failed
     */
    public SecretKey deriveKey(String passphrase, byte[] salt, int iterations) throws GeneralSecurityException {
        checkPassphrase(passphrase);
        if (NumberUtils.isEmpty(salt)) {
            throw new InvalidParameterException("No salt provided");
        }
        if (iterations <= 0) {
            throw new InvalidParameterException("Invalid iterations count: " + iterations);
        }

        return derive(passphrase, salt, iterations);
    }

    /**
     * @param  password                  The password
     * @param  salt                      Exactly {@link #SALT_LENGTH} bytes - if {@code null} the first 16 bytes of
     *                                   the password SHA-256 digest are used
     * @param  iv                        Exactly {@link #IV_LENGTH} bytes - if {@code null} the last 16 bytes of the
     *                                   password SHA-256 digest are used
     * @return                           The effective salt and IV
     * @throws InvalidParameterException If the password is missing or salt/IV have a bad length
     * @throws GeneralSecurityException  If failed to digest the password
     */
    public SaltAndIv saltAndIv(String password, byte[] salt, byte[] iv) throws GeneralSecurityException {
        checkPassphrase(password);
        if (salt != null) {
            checkLength("salt", salt, SALT_LENGTH);
        }
        if (iv != null) {
            checkLength("IV", iv, IV_LENGTH);
        }

        if ((salt != null) && (iv != null)) {
            return new SaltAndIv(salt, iv);
        }

        byte[] digest = digest(password);
        try {
            byte[] effectiveSalt = (salt == null) ? Arrays.copyOfRange(digest, 0, SALT_LENGTH) : salt;
            byte[] effectiveIv = (iv == null) ? Arrays.copyOfRange(digest, SALT_LENGTH, SALT_LENGTH + IV_LENGTH) : iv;
            return new SaltAndIv(effectiveSalt, effectiveIv);
        } finally {
            Arrays.fill(digest, (byte) 0);
        }
    }

    /**
     * @param  passphrase               The passphrase
     * @return                          The first {@link #SALT_LENGTH} bytes of its SHA-256 digest
     * @throws GeneralSecurityException If failed to digest the passphrase
     */
    public byte[] defaultSalt(String passphrase) throws GeneralSecurityException {
        checkPassphrase(passphrase);
        byte[] digest = digest(passphrase);
        try {
            return Arrays.copyOfRange(digest, 0, SALT_LENGTH);
        } finally {
            Arrays.fill(digest, (byte) 0);
        }
    }

    protected byte[] digest(String passphrase) throws GeneralSecurityException {
        byte[] bytes = passphrase.getBytes(StandardCharsets.UTF_8);
        try {
            MessageDigest md = SecurityUtils.getMessageDigest(DIGEST_ALGORITHM);
            return md.digest(bytes);
        } finally {
            Arrays.fill(bytes, (byte) 0);
        }
    }

    protected SecretKey derive(String passphrase, byte[] salt, int iterations) throws GeneralSecurityException {
        char[] password = passphrase.toCharArray();
        PBEKeySpec spec = new PBEKeySpec(password, salt, iterations, KEY_SIZE);
        byte[] keyBytes = null;
        try {
            SecretKeyFactory factory = SecurityUtils.getSecretKeyFactory(KDF_ALGORITHM);
            keyBytes = factory.generateSecret(spec).getEncoded();
            if (log.isDebugEnabled()) {
                log.debug("derive({}) salt={} bytes, iterations={}, provider={}",
                        KDF_ALGORITHM, salt.length, iterations, factory.getProvider().getName());
            }
            return new SecretKeySpec(keyBytes, KEY_ALGORITHM);
        } finally {
            spec.clearPassword();
            Arrays.fill(password, '\0');
            if (keyBytes != null) {
                Arrays.fill(keyBytes, (byte) 0);
            }
        }
    }

    protected void checkPassphrase(String passphrase) {
        if (GenericUtils.isEmpty(passphrase)) {
            throw new InvalidParameterException("No passphrase provided");
        }
    }

    protected void checkLength(String what, byte[] value, int expected) {
        if (value.length != expected) {
            throw new InvalidParameterException(
                    "Invalid " + what + " length: expected=" + expected + ", actual=" + value.length);
        }
    }
}

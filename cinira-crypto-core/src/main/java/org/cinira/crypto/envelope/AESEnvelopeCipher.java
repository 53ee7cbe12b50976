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

import java.security.GeneralSecurityException;
import java.security.InvalidParameterException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Objects;

import javax.crypto.BadPaddingException;
import javax.crypto.Cipher;
import javax.crypto.IllegalBlockSizeException;
import javax.crypto.SecretKey;
import javax.crypto.spec.IvParameterSpec;

import org.cinira.crypto.common.util.NumberUtils;
import org.cinira.crypto.common.util.logging.AbstractLoggingBean;
import org.cinira.crypto.common.util.security.SecurityUtils;
import org.cinira.crypto.kdf.PBKDF2KeyDerivation;

/**
 * AES-CBC envelopes:
 * <UL>
 * <LI>Key envelope - {@code IV[16] || ciphertext}</LI>
 * <LI>Password envelope - {@code salt[16] || IV[16] || ciphertext}, the key derived via
 * {@link PBKDF2KeyDerivation#generateAESKey(String, byte[])} from the password and the salt</LI>
 * </UL>
 * Salt and IV are freshly generated from a {@link SecureRandom} for every encryption.
 *
 * @author Cinira Crypto Project
 */
public class AESEnvelopeCipher extends AbstractLoggingBean {
    public static final String CIPHER_TRANSFORMATION = "AES/CBC/PKCS5Padding";
    public static final int IV_LENGTH = PBKDF2KeyDerivation.IV_LENGTH;
    public static final int SALT_LENGTH = PBKDF2KeyDerivation.SALT_LENGTH;

    public static final AESEnvelopeCipher INSTANCE = new AESEnvelopeCipher(PBKDF2KeyDerivation.INSTANCE);

    private final PBKDF2KeyDerivation keyDerivation;

    public AESEnvelopeCipher(PBKDF2KeyDerivation keyDerivation) {
        this.keyDerivation = Objects.requireNonNull(keyDerivation, "No key derivation");
    }

    public PBKDF2KeyDerivation getKeyDerivation() {
        return keyDerivation;
    }

    /**
     * @param  key                      The AES key
     * @param  data                     The plaintext
     * @return                          {@code IV[16] || ciphertext}
     * @throws GeneralSecurityException If encryption failed
     */
    public byte[] aesEncrypt(SecretKey key, byte[] data) throws GeneralSecurityException {
        Objects.requireNonNull(key, "No key");
        Objects.requireNonNull(data, "No data");

        byte[] iv = new byte[IV_LENGTH];
        SecureRandom random = SecurityUtils.getSecureRandom();
        random.nextBytes(iv);

        byte[] encrypted = encrypt(key, iv, data);
        byte[] result = new byte[IV_LENGTH + encrypted.length];
        System.arraycopy(iv, 0, result, 0, IV_LENGTH);
        System.arraycopy(encrypted, 0, result, IV_LENGTH, encrypted.length);
        return result;
    }

    /**
     * @param  key                       The AES key
     * @param  ivAndEncrypted            {@code IV[16] || ciphertext}
     * @return                           The plaintext
     * @throws InvalidParameterException If the envelope has no ciphertext after the IV
     * @throws DecryptionFailedException If the key is wrong or the data corrupted
     * @throws GeneralSecurityException  If failed to initialize the cipher
     */
    public byte[] aesDecrypt(SecretKey key, byte[] ivAndEncrypted) throws GeneralSecurityException {
        Objects.requireNonNull(key, "No key");
        checkEnvelopeLength(ivAndEncrypted, IV_LENGTH);

        byte[] iv = Arrays.copyOfRange(ivAndEncrypted, 0, IV_LENGTH);
        return decrypt(key, iv, ivAndEncrypted, IV_LENGTH, ivAndEncrypted.length - IV_LENGTH);
    }

    /**
     * @param  password                 The password
     * @param  data                     The plaintext
     * @return                          {@code salt[16] || IV[16] || ciphertext}
     * @throws GeneralSecurityException If encryption failed
     */
    public byte[] aesPasswordEncrypt(String password, byte[] data) throws GeneralSecurityException {
        Objects.requireNonNull(data, "No data");

        SecureRandom random = SecurityUtils.getSecureRandom();
        byte[] salt = new byte[SALT_LENGTH];
        random.nextBytes(salt);
        byte[] iv = new byte[IV_LENGTH];
        random.nextBytes(iv);

        SecretKey key = keyDerivation.generateAESKey(password, salt);
        byte[] encrypted = encrypt(key, iv, data);
        byte[] result = new byte[SALT_LENGTH + IV_LENGTH + encrypted.length];
        System.arraycopy(salt, 0, result, 0, SALT_LENGTH);
        System.arraycopy(iv, 0, result, SALT_LENGTH, IV_LENGTH);
        System.arraycopy(encrypted, 0, result, SALT_LENGTH + IV_LENGTH, encrypted.length);
        return result;
    }

    /**
     * @param  password                  The password
     * @param  encrypted                 {@code salt[16] || IV[16] || ciphertext}
     * @return                           The plaintext
     * @throws InvalidParameterException If the password is missing or the envelope has no ciphertext
     * @throws DecryptionFailedException If the password is wrong or the data corrupted
     * @throws GeneralSecurityException  If failed to derive the key
     */
    public byte[] aesPasswordDecrypt(String password, byte[] encrypted) throws GeneralSecurityException {
        int headerLength = SALT_LENGTH + IV_LENGTH;
        checkEnvelopeLength(encrypted, headerLength);

        byte[] salt = Arrays.copyOfRange(encrypted, 0, SALT_LENGTH);
        byte[] iv = Arrays.copyOfRange(encrypted, SALT_LENGTH, headerLength);
        SecretKey key = keyDerivation.generateAESKey(password, salt);
        return decrypt(key, iv, encrypted, headerLength, encrypted.length - headerLength);
    }

    public byte[] encrypt(SecretKey key, byte[] iv, byte[] data) throws GeneralSecurityException {
        Cipher cipher = SecurityUtils.getCipher(CIPHER_TRANSFORMATION);
        cipher.init(Cipher.ENCRYPT_MODE, key, new IvParameterSpec(iv));
        return cipher.doFinal(data);
    }

    /**
     * @param  key                       The AES key
     * @param  iv                        The IV - must be 16 bytes
     * @param  data                      Buffer holding the ciphertext
     * @param  offset                    Ciphertext offset in the buffer
     * @param  len                       Ciphertext length
     * @return                           The plaintext
     * @throws DecryptionFailedException If the key is wrong or the data corrupted
     * @throws GeneralSecurityException  If failed to initialize the cipher
     */
    public byte[] decrypt(SecretKey key, byte[] iv, byte[] data, int offset, int len) throws GeneralSecurityException {
        if (NumberUtils.length(iv) != IV_LENGTH) {
            throw new InvalidParameterException("Invalid IV length: " + NumberUtils.length(iv));
        }

        Cipher cipher = SecurityUtils.getCipher(CIPHER_TRANSFORMATION);
        cipher.init(Cipher.DECRYPT_MODE, key, new IvParameterSpec(iv));
        try {
            return cipher.doFinal(data, offset, len);
        } catch (BadPaddingException | IllegalBlockSizeException e) {
            if (log.isDebugEnabled()) {
                log.debug("decrypt({} bytes) {}", len, e.getClass().getSimpleName());
            }
            throw new DecryptionFailedException();
        }
    }

    protected void checkEnvelopeLength(byte[] envelope, int headerLength) {
        int len = NumberUtils.length(envelope);
        if (len <= headerLength) {
            throw new InvalidParameterException(
                    "Envelope too short: length=" + len + ", header=" + headerLength + " bytes");
        }
    }
}

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

import java.math.BigInteger;
import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.interfaces.RSAKey;
import java.security.spec.MGF1ParameterSpec;
import java.util.Objects;

import javax.crypto.BadPaddingException;
import javax.crypto.Cipher;
import javax.crypto.IllegalBlockSizeException;
import javax.crypto.spec.OAEPParameterSpec;
import javax.crypto.spec.PSource;

import org.cinira.crypto.common.util.logging.AbstractLoggingBean;
import org.cinira.crypto.common.util.security.SecurityUtils;

/**
 * RSA-OAEP with SHA-256 as both the OAEP digest and the MGF1 digest - what WebCrypto calls
 * {@code RSA-OAEP} with {@code SHA-256}. A single block only - the data must fit the key OAEP limit.
 *
 * @author Cinira Crypto Project
 */
public class RSAOAEPCipher extends AbstractLoggingBean {
    public static final String CIPHER_TRANSFORMATION = "RSA/ECB/OAEPPadding";

    public static final OAEPParameterSpec OAEP_SHA256_PARAMS = new OAEPParameterSpec(
            "SHA-256", "MGF1", MGF1ParameterSpec.SHA256, PSource.PSpecified.DEFAULT);

    public static final RSAOAEPCipher INSTANCE = new RSAOAEPCipher();

    public RSAOAEPCipher() {
        super();
    }

    public byte[] rsaEncrypt(PublicKey publicKey, byte[] data) throws GeneralSecurityException {
        Objects.requireNonNull(publicKey, "No public key");
        Objects.requireNonNull(data, "No data");

        Cipher cipher = SecurityUtils.getCipher(CIPHER_TRANSFORMATION);
        cipher.init(Cipher.ENCRYPT_MODE, publicKey, OAEP_SHA256_PARAMS);
        return cipher.doFinal(data);
    }

    /**
     * @param  privateKey                The RSA private key
     * @param  data                      The ciphertext
     * @return                           The plaintext
     * @throws DecryptionFailedException If the key does not match or the data is corrupted
     * @throws GeneralSecurityException  If failed to initialize the cipher
     */
    public byte[] rsaDecrypt(PrivateKey privateKey, byte[] data) throws GeneralSecurityException {
        Objects.requireNonNull(privateKey, "No private key");
        Objects.requireNonNull(data, "No data");
        // some providers fail with an unchecked exception on such input
        if ((privateKey instanceof RSAKey)
                && (new BigInteger(1, data).compareTo(((RSAKey) privateKey).getModulus()) >= 0)) {
            if (log.isDebugEnabled()) {
                log.debug("rsaDecrypt({} bytes) value exceeds the modulus", data.length);
            }
            throw new DecryptionFailedException();
        }

        Cipher cipher = SecurityUtils.getCipher(CIPHER_TRANSFORMATION);
        cipher.init(Cipher.DECRYPT_MODE, privateKey, OAEP_SHA256_PARAMS);
        try {
            return cipher.doFinal(data);
        } catch (BadPaddingException | IllegalBlockSizeException e) {
            if (log.isDebugEnabled()) {
                log.debug("rsaDecrypt({} bytes) {}", data.length, e.getClass().getSimpleName());
            }
            throw new DecryptionFailedException();
        }
    }
}

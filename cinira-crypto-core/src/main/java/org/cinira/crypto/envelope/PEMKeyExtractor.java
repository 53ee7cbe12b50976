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
import java.security.PublicKey;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Arrays;
import java.util.Objects;

import org.cinira.crypto.common.config.keys.loader.pem.PEMSection;
import org.cinira.crypto.common.config.keys.loader.pem.PEMSectionExtractor;
import org.cinira.crypto.common.util.GenericUtils;
import org.cinira.crypto.common.util.io.der.MalformedEncodingException;
import org.cinira.crypto.common.util.logging.AbstractLoggingBean;
import org.cinira.crypto.common.util.security.SecurityUtils;
import org.cinira.crypto.keybag.AlgorithmIdentifiers;
import org.cinira.crypto.keybag.KeyBagDecoder;
import org.cinira.crypto.keybag.KeyBagShape;
import org.cinira.crypto.keybag.PrivateKeyInfo;
import org.cinira.crypto.keybag.SubjectPublicKeyInfo;
import org.cinira.crypto.keybag.UnsupportedAlgorithmException;

/**
 * Extracts RSA keys from PEM text - {@code PRIVATE KEY} (plain PKCS#8), {@code ENCRYPTED PRIVATE KEY} (PBES2
 * protected PKCS#8) and {@code PUBLIC KEY} (X.509 {@code SubjectPublicKeyInfo}) sections. The decoded body must
 * have the document shape its header announces.
 *
 * @author Cinira Crypto Project
 */
public class PEMKeyExtractor extends AbstractLoggingBean {
    public static final String PRIVATE_KEY_SECTION = "PRIVATE KEY";
    public static final String ENCRYPTED_PRIVATE_KEY_HEADER = "ENCRYPTED " + PRIVATE_KEY_SECTION;
    public static final String PUBLIC_KEY_SECTION = "PUBLIC KEY";

    public static final PEMKeyExtractor INSTANCE
            = new PEMKeyExtractor(PEMSectionExtractor.INSTANCE, EncryptedPrivateKeyDecryptor.INSTANCE);

    private final PEMSectionExtractor sectionExtractor;
    private final EncryptedPrivateKeyDecryptor decryptor;
    private final KeyBagDecoder shapeDecoder;

    public PEMKeyExtractor(PEMSectionExtractor sectionExtractor, EncryptedPrivateKeyDecryptor decryptor) {
        this(sectionExtractor, decryptor, KeyBagDecoder.INSTANCE);
    }

    public PEMKeyExtractor(PEMSectionExtractor sectionExtractor, EncryptedPrivateKeyDecryptor decryptor,
                           KeyBagDecoder shapeDecoder) {
        this.sectionExtractor = Objects.requireNonNull(sectionExtractor, "No section extractor");
        this.decryptor = Objects.requireNonNull(decryptor, "No decryptor");
        this.shapeDecoder = Objects.requireNonNull(shapeDecoder, "No shape decoder");
    }

    /**
     * @param  pem                             The PEM text
     * @param  passphrase                      The passphrase - required only if the key is encrypted
     * @return                                 The RSA private key
     * @throws InvalidParameterException       If the key is encrypted and no passphrase provided
     * @throws IOException                     If no private key section, it is malformed or its body does not
     *                                         match its header
     * @throws GeneralSecurityException        If failed to decrypt or import the key
     */
    public PrivateKey extractPrivateKey(String pem, String passphrase) throws IOException, GeneralSecurityException {
        PEMSection section = sectionExtractor.extractSection(pem, PRIVATE_KEY_SECTION);
        String header = section.getHeader();
        byte[] der = section.getDataBytes();
        try {
            KeyBagShape shape = shapeDecoder.detectShape(der);
            if (ENCRYPTED_PRIVATE_KEY_HEADER.equals(header)) {
                assertShape(header, shape, KeyBagShape.ENCRYPTED_PRIVATE_KEY_INFO);
                if (GenericUtils.isEmpty(passphrase)) {
                    throw new InvalidParameterException("No passphrase provided for " + header);
                }
                return decryptor.decryptPrivateKey(der, passphrase);
            }

            assertShape(header, shape, KeyBagShape.PRIVATE_KEY_INFO);
            return importPrivateKey(der);
        } finally {
            Arrays.fill(der, (byte) 0);
        }
    }

    /**
     * @param  pem                      The PEM text
     * @return                          The RSA public key
     * @throws IOException              If no public key section, it is malformed or its body is not a public key
     * @throws GeneralSecurityException If failed to import the key
     */
    public PublicKey extractPublicKey(String pem) throws IOException, GeneralSecurityException {
        PEMSection section = sectionExtractor.extractSection(pem, PUBLIC_KEY_SECTION);
        byte[] der = section.getDataBytes();
        assertShape(section.getHeader(), shapeDecoder.detectShape(der), KeyBagShape.SUBJECT_PUBLIC_KEY_INFO);
        SubjectPublicKeyInfo info = SubjectPublicKeyInfo.decode(der);
        if (!info.getAlgorithm().isAlgorithm(AlgorithmIdentifiers.RSA_ENCRYPTION)) {
            throw new UnsupportedAlgorithmException("Unsupported public key algorithm: " + info.getAlgorithm());
        }

        if (log.isDebugEnabled()) {
            log.debug("extractPublicKey({}) {}", section.getHeader(), info);
        }

        KeyFactory factory = SecurityUtils.getKeyFactory(EncryptedPrivateKeyDecryptor.KEY_ALGORITHM);
        return factory.generatePublic(new X509EncodedKeySpec(der));
    }

    protected void assertShape(String header, KeyBagShape actual, KeyBagShape expected)
            throws MalformedEncodingException {
        if (actual != expected) {
            throw new MalformedEncodingException("Section " + header + " holds a " + actual + " instead of " + expected);
        }
    }

    protected PrivateKey importPrivateKey(byte[] der) throws IOException, GeneralSecurityException {
        PrivateKeyInfo info = PrivateKeyInfo.decode(der);
        try {
            if (!info.getAlgorithm().isAlgorithm(AlgorithmIdentifiers.RSA_ENCRYPTION)) {
                throw new UnsupportedAlgorithmException("Unsupported private key algorithm: " + info.getAlgorithm());
            }

            if (log.isDebugEnabled()) {
                log.debug("importPrivateKey({} bytes) {}", der.length, info);
            }

            KeyFactory factory = SecurityUtils.getKeyFactory(EncryptedPrivateKeyDecryptor.KEY_ALGORITHM);
            return factory.generatePrivate(new PKCS8EncodedKeySpec(der));
        } finally {
            info.clear();
        }
    }
}

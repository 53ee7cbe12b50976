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
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.InvalidParameterException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.interfaces.RSAPrivateCrtKey;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.X509EncodedKeySpec;

import javax.crypto.SecretKey;

import org.bouncycastle.openssl.PKCS8Generator;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;
import org.bouncycastle.openssl.jcajce.JceOpenSSLPKCS8DecryptorProviderBuilder;
import org.bouncycastle.operator.InputDecryptorProvider;
import org.bouncycastle.pkcs.PKCS8EncryptedPrivateKeyInfo;
import org.cinira.crypto.common.util.io.der.DERWriter;
import org.cinira.crypto.common.util.io.der.MalformedEncodingException;
import org.cinira.crypto.common.util.security.SecurityUtils;
import org.cinira.crypto.kdf.PBKDF2KeyDerivation;
import org.cinira.crypto.keybag.AlgorithmIdentifiers;
import org.cinira.crypto.keybag.UnsupportedAlgorithmException;
import org.cinira.crypto.util.test.BaseTestSupport;
import org.junit.jupiter.api.MethodOrderer.MethodName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;
import org.mockito.Mockito;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;

/**
 * @author Cinira Crypto Project
 */
@TestMethodOrder(MethodName.class)
@Tag("NoIoTestCase")
public class EncryptedPrivateKeyDecryptorTest extends BaseTestSupport {
    private static final byte[] SALT = { 8, 7, 6, 5, 4, 3, 2, 1 };
    private static final int ITERATIONS = 1000;

    public EncryptedPrivateKeyDecryptorTest() {
        super();
    }

    @Test
    public void testDecryptOpenSSLKey() throws Exception {
        PBKDF2KeyDerivation kdf = Mockito.spy(new PBKDF2KeyDerivation());
        EncryptedPrivateKeyDecryptor decryptor = new EncryptedPrivateKeyDecryptor(kdf, AESEnvelopeCipher.INSTANCE);

        PrivateKey key = decryptor.decryptPrivateKey(loadFixtureDER(ENCRYPTED_KEY_FIXTURE), FIXTURE_PASSPHRASE);
        outputDebugMessage("%s: %s", getCurrentTestName(), key.getAlgorithm());

        RSAPrivateCrtKey rsaKey = assertInstanceOf(RSAPrivateCrtKey.class, key);
        RSAPublicKey pub = (RSAPublicKey) KeyFactory.getInstance("RSA").generatePublic(
                new X509EncodedKeySpec(loadFixtureDER(PUBLIC_KEY_FIXTURE)));
        assertEquals(pub.getModulus(), rsaKey.getModulus(), "Mismatched modulus");
        assertEquals(pub.getPublicExponent(), rsaKey.getPublicExponent(), "Mismatched public exponent");

        Mockito.verify(kdf).deriveKey(eq(FIXTURE_PASSPHRASE), any(byte[].class), eq(2048));
    }

    @Test
    public void testDecryptMatchesBouncyCastle() throws Exception {
        byte[] bag = loadFixtureDER(ENCRYPTED_KEY_FIXTURE);
        RSAPrivateCrtKey expected = (RSAPrivateCrtKey) decryptWithBouncyCastle(bag, FIXTURE_PASSPHRASE);
        RSAPrivateCrtKey actual
                = (RSAPrivateCrtKey) EncryptedPrivateKeyDecryptor.INSTANCE.decryptPrivateKey(bag, FIXTURE_PASSPHRASE);
        assertEquals(expected.getModulus(), actual.getModulus(), "Mismatched modulus");
        assertEquals(expected.getPrivateExponent(), actual.getPrivateExponent(), "Mismatched private exponent");
    }

    @Test
    public void testDecryptBouncyCastleKey() throws Exception {
        KeyPair kp = getRSAKeyPair();
        String passphrase = getCurrentTestName();
        byte[] bag = encryptWithBouncyCastle(kp.getPrivate(), passphrase, PKCS8Generator.AES_256_CBC, 4096);

        RSAPrivateCrtKey key
                = (RSAPrivateCrtKey) EncryptedPrivateKeyDecryptor.INSTANCE.decryptPrivateKey(bag, passphrase);
        RSAPrivateCrtKey expected = (RSAPrivateCrtKey) kp.getPrivate();
        assertEquals(expected.getModulus(), key.getModulus(), "Mismatched modulus");
        assertEquals(expected.getPrivateExponent(), key.getPrivateExponent(), "Mismatched private exponent");
    }

    @Test
    public void testWrongPassphraseFails() throws Exception {
        byte[] bag = loadFixtureDER(ENCRYPTED_KEY_FIXTURE);
        DecryptionFailedException e = assertThrows(DecryptionFailedException.class,
                () -> EncryptedPrivateKeyDecryptor.INSTANCE.decryptPrivateKey(bag, FIXTURE_PASSPHRASE + "x"));
        assertEquals(DecryptionFailedException.DEFAULT_MESSAGE, e.getMessage(), "Mismatched message");
        assertNull(e.getCause(), "Failure cause exposed");
    }

    @Test
    public void testMissingPassphraseRejected() throws Exception {
        byte[] bag = loadFixtureDER(ENCRYPTED_KEY_FIXTURE);
        for (String passphrase : new String[] { null, "" }) {
            assertThrows(InvalidParameterException.class,
                    () -> EncryptedPrivateKeyDecryptor.INSTANCE.decryptPrivateKey(bag, passphrase));
        }
    }

    @Test
    public void testAes128NotDerived() throws Exception {
        assertUnsupportedWithoutDerivation(loadFixtureDER(AES128_KEY_FIXTURE));
    }

    @Test
    public void testDefaultPrfNotDerived() throws Exception {
        assertUnsupportedWithoutDerivation(loadFixtureDER(SHA1_PRF_KEY_FIXTURE));
    }

    @Test
    public void testPatchedCipherNotDerived() throws Exception {
        byte[] bag = loadFixtureDER(ENCRYPTED_KEY_FIXTURE);
        byte[] oid = AlgorithmIdentifiers.AES256_CBC.getEncoded();
        int pos = indexOf(bag, oid);
        assertTrue(pos > 0, "Cipher OID not found");
        bag[pos + oid.length - 1] = 0x16; // aes192-CBC
        assertUnsupportedWithoutDerivation(bag);
    }

    @Test
    public void testBouncyCastleAes128Unsupported() throws Exception {
        byte[] bag = encryptWithBouncyCastle(
                getRSAKeyPair().getPrivate(), FIXTURE_PASSPHRASE, PKCS8Generator.AES_128_CBC, 2048);
        assertUnsupportedWithoutDerivation(bag);
    }

    @Test
    public void testUnsupportedKeyLength() throws Exception {
        byte[] bag = encodeBag(16, new byte[16], new byte[32]);
        assertUnsupportedWithoutDerivation(bag);
    }

    @Test
    public void testBadIVLengthIsMalformed() throws Exception {
        byte[] bag = encodeBag(-1, new byte[8], new byte[32]);
        assertThrows(MalformedEncodingException.class,
                () -> EncryptedPrivateKeyDecryptor.INSTANCE.decryptPrivateKey(bag, FIXTURE_PASSPHRASE));
    }

    @Test
    public void testTruncatedBagIsMalformed() throws Exception {
        byte[] der = loadFixtureDER(ENCRYPTED_KEY_FIXTURE);
        byte[] bag = new byte[der.length / 2];
        System.arraycopy(der, 0, bag, 0, bag.length);
        assertThrows(IOException.class,
                () -> EncryptedPrivateKeyDecryptor.INSTANCE.decryptPrivateKey(bag, FIXTURE_PASSPHRASE));
    }

    @Test
    public void testUndecodablePlaintextFails() throws Exception {
        byte[] iv = new byte[AESEnvelopeCipher.IV_LENGTH];
        SecurityUtils.getSecureRandom().nextBytes(iv);
        SecretKey key = PBKDF2KeyDerivation.INSTANCE.deriveKey(FIXTURE_PASSPHRASE, SALT, ITERATIONS);
        byte[] encrypted = AESEnvelopeCipher.INSTANCE.encrypt(
                key, iv, "not a key document".getBytes(StandardCharsets.US_ASCII));

        byte[] bag = encodeBag(-1, iv, encrypted);
        assertThrows(DecryptionFailedException.class,
                () -> EncryptedPrivateKeyDecryptor.INSTANCE.decryptPrivateKey(bag, FIXTURE_PASSPHRASE));
    }

    @Test
    public void testNonRSAKeyUnsupported() throws Exception {
        KeyPairGenerator generator = KeyPairGenerator.getInstance("EC");
        generator.initialize(256);
        PrivateKey ecKey = generator.generateKeyPair().getPrivate();
        byte[] bag = encryptWithBouncyCastle(ecKey, FIXTURE_PASSPHRASE, PKCS8Generator.AES_256_CBC, ITERATIONS);
        assertThrows(UnsupportedAlgorithmException.class,
                () -> EncryptedPrivateKeyDecryptor.INSTANCE.decryptPrivateKey(bag, FIXTURE_PASSPHRASE));
    }

    private static void assertUnsupportedWithoutDerivation(byte[] bag) throws Exception {
        PBKDF2KeyDerivation kdf = Mockito.spy(new PBKDF2KeyDerivation());
        EncryptedPrivateKeyDecryptor decryptor = new EncryptedPrivateKeyDecryptor(kdf, AESEnvelopeCipher.INSTANCE);
        assertThrows(UnsupportedAlgorithmException.class, () -> decryptor.decryptPrivateKey(bag, FIXTURE_PASSPHRASE));
        Mockito.verify(kdf, Mockito.never()).deriveKey(anyString(), any(byte[].class), anyInt());
        Mockito.verify(kdf, Mockito.never()).generateAESKey(anyString(), any(byte[].class));
    }

    private static PrivateKey decryptWithBouncyCastle(byte[] bag, String passphrase) throws Exception {
        InputDecryptorProvider provider = new JceOpenSSLPKCS8DecryptorProviderBuilder()
                .setProvider(SecurityUtils.BOUNCY_CASTLE)
                .build(passphrase.toCharArray());
        PKCS8EncryptedPrivateKeyInfo info = new PKCS8EncryptedPrivateKeyInfo(bag);
        return new JcaPEMKeyConverter()
                .setProvider(SecurityUtils.BOUNCY_CASTLE)
                .getPrivateKey(info.decryptPrivateKeyInfo(provider));
    }

    private static int indexOf(byte[] data, byte[] pattern) {
        for (int pos = 0; pos <= data.length - pattern.length; pos++) {
            boolean found = true;
            for (int index = 0; found && (index < pattern.length); index++) {
                found = data[pos + index] == pattern[index];
            }
            if (found) {
                return pos;
            }
        }
        return -1;
    }

    private static byte[] encodeBag(int keyLength, byte[] iv, byte[] encrypted) throws Exception {
        try (DERWriter w = new DERWriter()) {
            try (DERWriter info = w.startSequence()) {
                try (DERWriter scheme = info.startSequence()) {
                    scheme.writeOID(AlgorithmIdentifiers.PBES2.getEncoded());
                    try (DERWriter schemeParams = scheme.startSequence()) {
                        try (DERWriter kdf = schemeParams.startSequence()) {
                            kdf.writeOID(AlgorithmIdentifiers.PBKDF2.getEncoded());
                            try (DERWriter kdfParams = kdf.startSequence()) {
                                kdfParams.writeOctetString(SALT);
                                kdfParams.writeBigInteger(BigInteger.valueOf(ITERATIONS));
                                if (keyLength > 0) {
                                    kdfParams.writeBigInteger(BigInteger.valueOf(keyLength));
                                }
                                try (DERWriter prf = kdfParams.startSequence()) {
                                    prf.writeOID(AlgorithmIdentifiers.HMAC_WITH_SHA256.getEncoded());
                                    prf.writeNull();
                                }
                            }
                        }
                        try (DERWriter cipher = schemeParams.startSequence()) {
                            cipher.writeOID(AlgorithmIdentifiers.AES256_CBC.getEncoded());
                            cipher.writeOctetString(iv);
                        }
                    }
                }
                info.writeOctetString(encrypted);
            }
            return w.toByteArray();
        }
    }
}

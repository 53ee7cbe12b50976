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

import java.security.PrivateKey;
import java.security.PublicKey;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

import javax.crypto.SecretKey;

import org.cinira.crypto.common.util.logging.AbstractLoggingBean;
import org.cinira.crypto.kdf.PBKDF2KeyDerivation;
import org.cinira.crypto.kdf.SaltAndIv;

/**
 * Runs the key derivation and envelope operations on an {@link Executor}. Each call is independent - the input
 * buffers are copied when the call is made and a failure completes the returned future exceptionally with a
 * {@link CompletionException} whose cause is the exception the synchronous operation throws.
 *
 * @author Cinira Crypto Project
 */
public class AsyncEnvelopeOperations extends AbstractLoggingBean {
    /**
     * An operation that may throw checked exceptions
     *
     * @param <T> Type of result
     */
    @FunctionalInterface
    public interface CryptoOperation<T> {
        T invoke() throws Exception;
    }

    private final Executor executor;
    private final PBKDF2KeyDerivation keyDerivation;
    private final AESEnvelopeCipher aesCipher;
    private final RSAOAEPCipher rsaCipher;
    private final EncryptedPrivateKeyDecryptor decryptor;
    private final PEMKeyExtractor keyExtractor;

    public AsyncEnvelopeOperations() {
        this(ForkJoinPool.commonPool());
    }

    public AsyncEnvelopeOperations(Executor executor) {
        this(executor, PBKDF2KeyDerivation.INSTANCE, AESEnvelopeCipher.INSTANCE, RSAOAEPCipher.INSTANCE,
             EncryptedPrivateKeyDecryptor.INSTANCE, PEMKeyExtractor.INSTANCE);
    }

    public AsyncEnvelopeOperations(Executor executor,
                                   PBKDF2KeyDerivation keyDerivation,
                                   AESEnvelopeCipher aesCipher,
                                   RSAOAEPCipher rsaCipher,
                                   EncryptedPrivateKeyDecryptor decryptor,
                                   PEMKeyExtractor keyExtractor) {
        this.executor = Objects.requireNonNull(executor, "No executor");
        this.keyDerivation = Objects.requireNonNull(keyDerivation, "No key derivation");
        this.aesCipher = Objects.requireNonNull(aesCipher, "No AES cipher");
        this.rsaCipher = Objects.requireNonNull(rsaCipher, "No RSA cipher");
        this.decryptor = Objects.requireNonNull(decryptor, "No decryptor");
        this.keyExtractor = Objects.requireNonNull(keyExtractor, "No key extractor");
    }

    public Executor getExecutor() {
        return executor;
    }

    public CompletableFuture<SecretKey> generateAESKey(String passphrase, byte[] salt) {
        byte[] saltCopy = copyOf(salt);
        return submit("generateAESKey", () -> keyDerivation.generateAESKey(passphrase, saltCopy));
    }

    public CompletableFuture<SaltAndIv> saltAndIv(String password, byte[] salt, byte[] iv) {
        byte[] saltCopy = copyOf(salt);
        byte[] ivCopy = copyOf(iv);
        return submit("saltAndIv", () -> keyDerivation.saltAndIv(password, saltCopy, ivCopy));
    }

    public CompletableFuture<PrivateKey> decryptPrivateKey(byte[] bag, String passphrase) {
        byte[] bagCopy = copyOf(bag);
        return submit("decryptPrivateKey", () -> decryptor.decryptPrivateKey(bagCopy, passphrase));
    }

    public CompletableFuture<byte[]> aesEncrypt(SecretKey key, byte[] data) {
        byte[] dataCopy = copyOf(data);
        return submit("aesEncrypt", () -> aesCipher.aesEncrypt(key, dataCopy));
    }

    public CompletableFuture<byte[]> aesDecrypt(SecretKey key, byte[] ivAndEncrypted) {
        byte[] dataCopy = copyOf(ivAndEncrypted);
        return submit("aesDecrypt", () -> aesCipher.aesDecrypt(key, dataCopy));
    }

    public CompletableFuture<byte[]> aesPasswordEncrypt(String password, byte[] data) {
        byte[] dataCopy = copyOf(data);
        return submit("aesPasswordEncrypt", () -> aesCipher.aesPasswordEncrypt(password, dataCopy));
    }

    public CompletableFuture<byte[]> aesPasswordDecrypt(String password, byte[] encrypted) {
        byte[] dataCopy = copyOf(encrypted);
        return submit("aesPasswordDecrypt", () -> aesCipher.aesPasswordDecrypt(password, dataCopy));
    }

    public CompletableFuture<byte[]> rsaEncrypt(PublicKey publicKey, byte[] data) {
        byte[] dataCopy = copyOf(data);
        return submit("rsaEncrypt", () -> rsaCipher.rsaEncrypt(publicKey, dataCopy));
    }

    public CompletableFuture<byte[]> rsaDecrypt(PrivateKey privateKey, byte[] data) {
        byte[] dataCopy = copyOf(data);
        return submit("rsaDecrypt", () -> rsaCipher.rsaDecrypt(privateKey, dataCopy));
    }

    public CompletableFuture<PrivateKey> extractPrivateKey(String pem, String passphrase) {
        return submit("extractPrivateKey", () -> keyExtractor.extractPrivateKey(pem, passphrase));
    }

    public CompletableFuture<PublicKey> extractPublicKey(String pem) {
        return submit("extractPublicKey", () -> keyExtractor.extractPublicKey(pem));
    }

    protected <T> CompletableFuture<T> submit(String operation, CryptoOperation<T> task) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return task.invoke();
            } catch (RuntimeException e) {
                debug("{} failed ({}): {}", operation, e.getClass().getSimpleName(), e.getMessage(), e);
                throw e;
            } catch (Exception e) {
                debug("{} failed ({}): {}", operation, e.getClass().getSimpleName(), e.getMessage(), e);
                throw new CompletionException(e);
            }
        }, executor);
    }

    protected static byte[] copyOf(byte[] data) {
        return (data == null) ? null : data.clone();
    }
}

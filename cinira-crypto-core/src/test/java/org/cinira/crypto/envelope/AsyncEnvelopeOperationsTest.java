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

import java.nio.charset.StandardCharsets;
import java.security.InvalidParameterException;
import java.security.KeyPair;
import java.security.PrivateKey;
import java.security.interfaces.RSAPrivateKey;
import java.util.Arrays;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import javax.crypto.SecretKey;

import org.cinira.crypto.common.config.keys.loader.pem.SectionNotFoundException;
import org.cinira.crypto.kdf.PBKDF2KeyDerivation;
import org.cinira.crypto.kdf.SaltAndIv;
import org.cinira.crypto.keybag.UnsupportedAlgorithmException;
import org.cinira.crypto.util.test.BaseTestSupport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.MethodOrderer.MethodName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * @author Cinira Crypto Project
 */
@TestMethodOrder(MethodName.class)
public class AsyncEnvelopeOperationsTest extends BaseTestSupport {
    private ExecutorService executorService;
    private AtomicInteger submitted;
    private AsyncEnvelopeOperations operations;

    public AsyncEnvelopeOperationsTest() {
        super();
    }

    @BeforeEach
    public void setUp() {
        executorService = Executors.newFixedThreadPool(2);
        submitted = new AtomicInteger();
        Executor counting = command -> {
            submitted.incrementAndGet();
            executorService.execute(command);
        };
        operations = new AsyncEnvelopeOperations(counting);
    }

    @AfterEach
    public void tearDown() throws Exception {
        executorService.shutdownNow();
        assertTrue(executorService.awaitTermination(DEFAULT_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS),
                "Executor not terminated");
    }

    @Test
    public void testDefaultExecutor() {
        assertSame(ForkJoinPool.commonPool(), new AsyncEnvelopeOperations().getExecutor(), "Unexpected executor");
    }

    @Test
    public void testPasswordEnvelopeRoundTrip() throws Exception {
        byte[] data = getCurrentTestName().getBytes(StandardCharsets.UTF_8);
        byte[] envelope = await(operations.aesPasswordEncrypt("hunter2", data));
        assertArrayEquals(data, await(operations.aesPasswordDecrypt("hunter2", envelope)), "Mismatched plaintext");
        assertEquals(2, submitted.get(), "Mismatched submissions count");
    }

    @Test
    public void testKeyEnvelopeRoundTrip() throws Exception {
        SecretKey key = await(operations.generateAESKey("hunter2", null));
        assertArrayEquals(PBKDF2KeyDerivation.INSTANCE.generateAESKey("hunter2", null).getEncoded(), key.getEncoded(),
                "Mismatched key");

        byte[] data = getCurrentTestName().getBytes(StandardCharsets.UTF_8);
        byte[] envelope = await(operations.aesEncrypt(key, data));
        assertArrayEquals(data, await(operations.aesDecrypt(key, envelope)), "Mismatched plaintext");
    }

    @Test
    public void testSaltAndIvMatchesSync() throws Exception {
        SaltAndIv expected = PBKDF2KeyDerivation.INSTANCE.saltAndIv("hunter2", null, null);
        SaltAndIv actual = await(operations.saltAndIv("hunter2", null, null));
        assertArrayEquals(expected.getSalt(), actual.getSalt(), "Mismatched salt");
        assertArrayEquals(expected.getIv(), actual.getIv(), "Mismatched IV");
    }

    @Test
    public void testRsaRoundTrip() throws Exception {
        KeyPair kp = getRSAKeyPair();
        byte[] data = getCurrentTestName().getBytes(StandardCharsets.UTF_8);
        byte[] encrypted = await(operations.rsaEncrypt(kp.getPublic(), data));
        assertArrayEquals(data, await(operations.rsaDecrypt(kp.getPrivate(), encrypted)), "Mismatched plaintext");
    }

    @Test
    public void testDecryptPrivateKey() throws Exception {
        PrivateKey key = await(operations.decryptPrivateKey(loadFixtureDER(ENCRYPTED_KEY_FIXTURE), FIXTURE_PASSPHRASE));
        PrivateKey expected = await(operations.extractPrivateKey(loadFixture(PLAIN_KEY_FIXTURE), null));
        assertEquals(((RSAPrivateKey) expected).getPrivateExponent(),
                ((RSAPrivateKey) key).getPrivateExponent(), "Mismatched private exponent");
    }

    @Test
    public void testInputCopiedOnSubmission() throws Exception {
        byte[] data = getCurrentTestName().getBytes(StandardCharsets.UTF_8);
        byte[] expected = data.clone();
        CompletableFuture<byte[]> future = operations.aesPasswordEncrypt("hunter2", data);
        Arrays.fill(data, (byte) 0);

        byte[] envelope = await(future);
        assertArrayEquals(expected, await(operations.aesPasswordDecrypt("hunter2", envelope)),
                "Caller modification leaked into operation");
    }

    @Test
    public void testCheckedFailureWrapped() throws Exception {
        CompletableFuture<PrivateKey> future
                = operations.decryptPrivateKey(loadFixtureDER(ENCRYPTED_KEY_FIXTURE), "wrong");
        ExecutionException e = assertThrows(ExecutionException.class,
                () -> future.get(DEFAULT_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS));
        assertInstanceOf(DecryptionFailedException.class, e.getCause(), "Mismatched cause");

        CompletionException ce = assertThrows(CompletionException.class, future::join);
        assertInstanceOf(DecryptionFailedException.class, ce.getCause(), "Mismatched join cause");
    }

    @Test
    public void testUnsupportedAlgorithmFailure() throws Exception {
        CompletableFuture<PrivateKey> future
                = operations.decryptPrivateKey(loadFixtureDER(AES128_KEY_FIXTURE), FIXTURE_PASSPHRASE);
        ExecutionException e = assertThrows(ExecutionException.class,
                () -> future.get(DEFAULT_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS));
        assertInstanceOf(UnsupportedAlgorithmException.class, e.getCause(), "Mismatched cause");
    }

    @Test
    public void testUncheckedFailurePropagated() throws Exception {
        CompletableFuture<byte[]> future = operations.aesPasswordDecrypt("hunter2", new byte[16]);
        ExecutionException e = assertThrows(ExecutionException.class,
                () -> future.get(DEFAULT_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS));
        assertInstanceOf(InvalidParameterException.class, e.getCause(), "Mismatched cause");
    }

    @Test
    public void testMissingSectionFailure() throws Exception {
        CompletableFuture<?> future = operations.extractPublicKey(loadFixture(PLAIN_KEY_FIXTURE));
        ExecutionException e = assertThrows(ExecutionException.class,
                () -> future.get(DEFAULT_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS));
        assertInstanceOf(SectionNotFoundException.class, e.getCause(), "Mismatched cause");
    }

    private static <T> T await(CompletableFuture<T> future) throws Exception {
        return future.get(DEFAULT_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
    }
}

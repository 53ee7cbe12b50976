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

package org.cinira.crypto.common.util.security;

import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPairGenerator;
import java.security.MessageDigest;
import java.security.Provider;
import java.security.SecureRandom;
import java.security.Security;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import javax.crypto.Cipher;
import javax.crypto.SecretKeyFactory;

import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.cinira.crypto.common.util.GenericUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Specific security providers related code
 *
 * @author Cinira Crypto Project
 */
public final class SecurityUtils {
    /**
     * Bouncycastle JCE provider name
     */
    public static final String BOUNCY_CASTLE = "BC";

    /**
     * System property used to control whether to automatically register the {@code Bouncycastle} JCE provider
     */
    public static final String REGISTER_BOUNCY_CASTLE_PROP = "org.cinira.crypto.registerBouncyCastle";

    /**
     * System property used to select the provider name for all the primitives. If not set then {@code BC} is used if
     * registered, otherwise the JCE default lookup
     */
    public static final String PROP_DEFAULT_SECURITY_PROVIDER = "org.cinira.crypto.security.defaultProvider";

    /** Value of {@link #PROP_DEFAULT_SECURITY_PROVIDER} that selects the JCE default lookup */
    public static final String NONE_PROVIDER = "none";

    private static final AtomicBoolean REGISTRATION_STATE_HOLDER = new AtomicBoolean(false);
    private static final AtomicReference<String> DEFAULT_PROVIDER_HOLDER = new AtomicReference<>();

    private SecurityUtils() {
        throw new UnsupportedOperationException("No instance");
    }

    public static boolean isBouncyCastleRegistered() {
        register();
        return Security.getProvider(BOUNCY_CASTLE) != null;
    }

    public static boolean isRegistrationCompleted() {
        return REGISTRATION_STATE_HOLDER.get();
    }

    /**
     * @return The name of the provider used for all primitives - empty if the JCE default lookup is used
     */
    public static String getDefaultProviderChoice() {
        register();

        synchronized (DEFAULT_PROVIDER_HOLDER) {
            String choice = DEFAULT_PROVIDER_HOLDER.get();
            if (choice != null) {
                return choice;
            }

            String name = GenericUtils.trimToEmpty(System.getProperty(PROP_DEFAULT_SECURITY_PROVIDER));
            if (GenericUtils.isEmpty(name)) {
                choice = (Security.getProvider(BOUNCY_CASTLE) != null) ? BOUNCY_CASTLE : "";
            } else if (NONE_PROVIDER.equalsIgnoreCase(name)) {
                choice = "";
            } else {
                choice = name;
            }
            DEFAULT_PROVIDER_HOLDER.set(choice);
            return choice;
        }
    }

    /**
     * @param name The provider name to use from now on - {@code null} re-reads the configuration, empty selects the
     *             JCE default lookup
     */
    public static void setDefaultProviderChoice(String name) {
        synchronized (DEFAULT_PROVIDER_HOLDER) {
            DEFAULT_PROVIDER_HOLDER.set(name);
        }
    }

    private static void register() {
        synchronized (REGISTRATION_STATE_HOLDER) {
            if (REGISTRATION_STATE_HOLDER.get()) {
                return;
            }

            Logger logger = LoggerFactory.getLogger(SecurityUtils.class);
            String propValue = System.getProperty(REGISTER_BOUNCY_CASTLE_PROP);
            boolean enabled = GenericUtils.isEmpty(propValue) || Boolean.parseBoolean(propValue);
            if (!enabled) {
                logger.debug("register({}) disabled by {}", BOUNCY_CASTLE, REGISTER_BOUNCY_CASTLE_PROP);
            } else if (Security.getProvider(BOUNCY_CASTLE) == null) {
                Provider provider = new BouncyCastleProvider();
                int pos = Security.addProvider(provider);
                if (logger.isDebugEnabled()) {
                    logger.debug("register({}) version={} at position={}", BOUNCY_CASTLE, provider.getVersionStr(), pos);
                }
            }

            REGISTRATION_STATE_HOLDER.set(true);
        }
    }

    //////////////////////////// Security entities factories /////////////////////////////

    @FunctionalInterface
    private interface ProviderEntityFactory<T> {
        T getInstance(String algorithm, String provider) throws GeneralSecurityException;
    }

    @FunctionalInterface
    private interface DefaultEntityFactory<T> {
        T getInstance(String algorithm) throws GeneralSecurityException;
    }

    private static <T> T resolveSecurityEntity(
            String algorithm, ProviderEntityFactory<T> byProvider, DefaultEntityFactory<T> byDefault)
            throws GeneralSecurityException {
        String provider = getDefaultProviderChoice();
        if (GenericUtils.isEmpty(provider)) {
            return byDefault.getInstance(algorithm);
        } else {
            return byProvider.getInstance(algorithm, provider);
        }
    }

    public static KeyFactory getKeyFactory(String algorithm) throws GeneralSecurityException {
        return resolveSecurityEntity(algorithm, KeyFactory::getInstance, KeyFactory::getInstance);
    }

    public static Cipher getCipher(String transformation) throws GeneralSecurityException {
        return resolveSecurityEntity(transformation, Cipher::getInstance, Cipher::getInstance);
    }

    public static MessageDigest getMessageDigest(String algorithm) throws GeneralSecurityException {
        return resolveSecurityEntity(algorithm, MessageDigest::getInstance, MessageDigest::getInstance);
    }

    public static SecretKeyFactory getSecretKeyFactory(String algorithm) throws GeneralSecurityException {
        return resolveSecurityEntity(algorithm, SecretKeyFactory::getInstance, SecretKeyFactory::getInstance);
    }

    public static KeyPairGenerator getKeyPairGenerator(String algorithm) throws GeneralSecurityException {
        return resolveSecurityEntity(algorithm, KeyPairGenerator::getInstance, KeyPairGenerator::getInstance);
    }

    /**
     * @return A new {@link SecureRandom} - never shared between calls
     */
    public static SecureRandom getSecureRandom() {
        return new SecureRandom();
    }
}

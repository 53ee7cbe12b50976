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

package org.cinira.crypto.keybag;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

import org.cinira.crypto.common.util.NumberUtils;
import org.cinira.crypto.common.util.buffer.BufferUtils;

/**
 * The well-known object identifiers of the supported key documents. The encoded form is the raw value of the
 * OBJECT IDENTIFIER element (i.e., without tag and length) and is compared byte-for-byte.
 *
 * @author Cinira Crypto Project
 */
public enum AlgorithmIdentifiers {
    /** PKCS#5 v2 password based encryption scheme */
    PBES2("1.2.840.113549.1.5.13", 0x2a, 0x86, 0x48, 0x86, 0xf7, 0x0d, 0x01, 0x05, 0x0d),
    /** PKCS#5 v2 password based key derivation function */
    PBKDF2("1.2.840.113549.1.5.12", 0x2a, 0x86, 0x48, 0x86, 0xf7, 0x0d, 0x01, 0x05, 0x0c),
    HMAC_WITH_SHA256("1.2.840.113549.2.9", 0x2a, 0x86, 0x48, 0x86, 0xf7, 0x0d, 0x02, 0x09),
    AES256_CBC("2.16.840.1.101.3.4.1.42", 0x60, 0x86, 0x48, 0x01, 0x65, 0x03, 0x04, 0x01, 0x2a),
    RSA_ENCRYPTION("1.2.840.113549.1.1.1", 0x2a, 0x86, 0x48, 0x86, 0xf7, 0x0d, 0x01, 0x01, 0x01);

    public static final Set<AlgorithmIdentifiers> VALUES
            = Collections.unmodifiableSet(EnumSet.allOf(AlgorithmIdentifiers.class));

    private final String oid;
    private final byte[] encoded;

    AlgorithmIdentifiers(String oid, int... values) {
        this.oid = oid;
        this.encoded = new byte[values.length];
        for (int index = 0; index < values.length; index++) {
            this.encoded[index] = (byte) values[index];
        }
    }

    /**
     * @return The dotted OID string
     */
    public String getOID() {
        return oid;
    }

    /**
     * @return A <U>copy</U> of the raw OID value bytes
     */
    public byte[] getEncoded() {
        return encoded.clone();
    }

    public boolean matches(byte[] value) {
        return (NumberUtils.length(value) == encoded.length) && Arrays.equals(encoded, value);
    }

    /**
     * @param  value The raw OID value bytes
     * @return       The matching identifier - {@code null} if none
     */
    public static AlgorithmIdentifiers fromEncoded(byte[] value) {
        for (AlgorithmIdentifiers id : VALUES) {
            if (id.matches(value)) {
                return id;
            }
        }

        return null;
    }

    /**
     * @param  value The raw OID value bytes
     * @return       The known name or the hex bytes - for messages only
     */
    public static String describe(byte[] value) {
        AlgorithmIdentifiers id = fromEncoded(value);
        if (id != null) {
            return id.name() + "(" + id.getOID() + ")";
        }
        return "OID[" + BufferUtils.toHex(':', value) + "]";
    }
}

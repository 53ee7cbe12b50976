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

import java.io.IOException;
import java.util.Arrays;

import org.cinira.crypto.common.util.io.der.ASN1Class;
import org.cinira.crypto.common.util.io.der.ASN1Object;
import org.cinira.crypto.common.util.io.der.ASN1Type;
import org.cinira.crypto.common.util.io.der.DERParser;
import org.cinira.crypto.common.util.io.der.MalformedEncodingException;

/**
 * A plain PKCS#8 (RFC 5958) {@code PrivateKeyInfo}:
 *
 * <pre>
 * SEQUENCE {
 *      INTEGER version - 0 (v1) or 1 (v2)
 *      SEQUENCE {
 *          OBJECT IDENTIFIER algorithm
 *          ANY parameters OPTIONAL - usually NULL
 *      }
 *      OCTET STRING privateKey
 *      [0] attributes OPTIONAL
 *      [1] publicKey OPTIONAL - v2 only
 * }
 * </pre>
 *
 * @author Cinira Crypto Project
 */
public class PrivateKeyInfo {
    public static final int VERSION_1 = 0;
    public static final int VERSION_2 = 1;

    private final int version;
    private final AlgorithmIdentifierInfo algorithm;
    private final byte[] privateKey;
    private final byte[] encoded;

    public PrivateKeyInfo(int version, AlgorithmIdentifierInfo algorithm, byte[] privateKey, byte[] encoded) {
        this.version = version;
        this.algorithm = algorithm;
        this.privateKey = privateKey.clone();
        this.encoded = encoded.clone();
    }

    public int getVersion() {
        return version;
    }

    public AlgorithmIdentifierInfo getAlgorithm() {
        return algorithm;
    }

    public byte[] getPrivateKey() {
        return privateKey.clone();
    }

    /**
     * @return A <U>copy</U> of the full DER encoding
     */
    public byte[] getEncoded() {
        return encoded.clone();
    }

    /**
     * Wipes the key material held by this instance
     */
    public void clear() {
        Arrays.fill(privateKey, (byte) 0);
        Arrays.fill(encoded, (byte) 0);
    }

    public static PrivateKeyInfo decode(byte[] encBytes) throws IOException {
        DERParser parser = new DERParser(encBytes);
        ASN1Object info = parser.readObject(ASN1Type.SEQUENCE);
        parser.assertFullyConsumed();

        DERParser infoParser = info.createParser();
        int version = EncryptedPrivateKeyInfo.toInt(infoParser.readObject(ASN1Type.INTEGER), "version");
        if ((version != VERSION_1) && (version != VERSION_2)) {
            throw new MalformedEncodingException("Unsupported PKCS#8 version: " + version);
        }

        AlgorithmIdentifierInfo algorithm = AlgorithmIdentifierInfo.decode(infoParser.readObject(ASN1Type.SEQUENCE));
        byte[] privateKey = infoParser.readObject(ASN1Type.OCTET_STRING).getOctetStringBytes();

        ASN1Object next = infoParser.readObject();
        if (isContextTag(next, 0)) {
            next = infoParser.readObject();
        }
        if ((version == VERSION_2) && isContextTag(next, 1)) {
            next = infoParser.readObject();
        }
        if (next != null) {
            throw new MalformedEncodingException("Unexpected PKCS#8 element: " + next);
        }

        return new PrivateKeyInfo(version, algorithm, privateKey, info.getEncoded());
    }

    private static boolean isContextTag(ASN1Object obj, int tagNumber) {
        return (obj != null) && (obj.getObjClass() == ASN1Class.CONTEXT)
                && ((obj.getTag() & ASN1Type.HIGH_TAG_NUMBER) == tagNumber);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName()
               + "[version=" + getVersion()
               + ", algorithm=" + getAlgorithm()
               + "]";
    }
}

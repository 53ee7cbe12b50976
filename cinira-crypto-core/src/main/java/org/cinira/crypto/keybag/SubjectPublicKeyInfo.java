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

import org.cinira.crypto.common.util.io.der.ASN1Object;
import org.cinira.crypto.common.util.io.der.ASN1Type;
import org.cinira.crypto.common.util.io.der.DERParser;

/**
 * An X.509 {@code SubjectPublicKeyInfo} - SEQUENCE { AlgorithmIdentifier, BIT STRING }
 *
 * @author Cinira Crypto Project
 */
public class SubjectPublicKeyInfo {
    private final AlgorithmIdentifierInfo algorithm;
    private final byte[] publicKey;
    private final byte[] encoded;

    public SubjectPublicKeyInfo(AlgorithmIdentifierInfo algorithm, byte[] publicKey, byte[] encoded) {
        this.algorithm = algorithm;
        this.publicKey = publicKey.clone();
        this.encoded = encoded.clone();
    }

    public AlgorithmIdentifierInfo getAlgorithm() {
        return algorithm;
    }

    public byte[] getPublicKey() {
        return publicKey.clone();
    }

    public byte[] getEncoded() {
        return encoded.clone();
    }

    public static SubjectPublicKeyInfo decode(byte[] encBytes) throws IOException {
        DERParser parser = new DERParser(encBytes);
        ASN1Object info = parser.readObject(ASN1Type.SEQUENCE);
        parser.assertFullyConsumed();

        DERParser infoParser = info.createParser();
        AlgorithmIdentifierInfo algorithm = AlgorithmIdentifierInfo.decode(infoParser.readObject(ASN1Type.SEQUENCE));
        byte[] publicKey = infoParser.readObject(ASN1Type.BIT_STRING).getBitStringBytes();
        infoParser.assertFullyConsumed();

        return new SubjectPublicKeyInfo(algorithm, publicKey, info.getEncoded());
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[algorithm=" + getAlgorithm() + ", key=" + publicKey.length + " bytes]";
    }
}

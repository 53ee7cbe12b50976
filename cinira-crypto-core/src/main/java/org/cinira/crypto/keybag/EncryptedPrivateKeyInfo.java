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
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.cinira.crypto.common.util.io.der.ASN1Object;
import org.cinira.crypto.common.util.io.der.ASN1Type;
import org.cinira.crypto.common.util.io.der.DERParser;
import org.cinira.crypto.common.util.io.der.MalformedEncodingException;

/**
 * A PKCS#8 {@code EncryptedPrivateKeyInfo} protected with PBES2/PBKDF2 - the format OpenSSL writes for
 * {@code genpkey -aes-256-cbc} or {@code pkcs8 -topk8 -v2 aes-256-cbc}:
 *
 * <pre>
 * SEQUENCE {
 *      SEQUENCE {
 *          OBJECT IDENTIFIER pkcs5PBES2
 *          SEQUENCE {
 *              SEQUENCE {
 *                  OBJECT IDENTIFIER pkcs5PBKDF2
 *                  SEQUENCE {
 *                      OCTET STRING salt
 *                      INTEGER iterationCount
 *                      INTEGER keyLength OPTIONAL
 *                      SEQUENCE { OBJECT IDENTIFIER prf, NULL } OPTIONAL - default is hmacWithSHA1
 *                  }
 *              }
 *              SEQUENCE {
 *                  OBJECT IDENTIFIER encryptionScheme
 *                  OCTET STRING iv
 *              }
 *          }
 *      }
 *      OCTET STRING encryptedData
 * }
 * </pre>
 *
 * Only the structure is validated here - the PRF and cipher algorithms are checked by the decryptor. A scheme other
 * than PBES2/PBKDF2 is rejected right away since its parameters have another shape.
 *
 * @author Cinira Crypto Project
 */
public class EncryptedPrivateKeyInfo {
    private final byte[] salt;
    private final int iterationCount;
    private final int keyLength;
    private final AlgorithmIdentifierInfo prf;
    private final byte[] cipherOID;
    private final byte[] iv;
    private final byte[] encryptedData;

    public EncryptedPrivateKeyInfo(
            byte[] salt, int iterationCount, int keyLength, AlgorithmIdentifierInfo prf,
            byte[] cipherOID, byte[] iv, byte[] encryptedData) {
        this.salt = salt.clone();
        this.iterationCount = iterationCount;
        this.keyLength = keyLength;
        this.prf = prf;
        this.cipherOID = cipherOID.clone();
        this.iv = iv.clone();
        this.encryptedData = encryptedData.clone();
    }

    public byte[] getSalt() {
        return salt.clone();
    }

    public int getIterationCount() {
        return iterationCount;
    }

    /**
     * @return The explicit derived key length (bytes) - negative if not specified
     */
    public int getKeyLength() {
        return keyLength;
    }

    /**
     * @return The PRF - {@code null} if not specified (i.e., the default hmacWithSHA1)
     */
    public AlgorithmIdentifierInfo getPrf() {
        return prf;
    }

    public byte[] getCipherOID() {
        return cipherOID.clone();
    }

    public byte[] getIV() {
        return iv.clone();
    }

    public byte[] getEncryptedData() {
        return encryptedData.clone();
    }

    /**
     * @return The algorithm OIDs in document order - scheme, KDF, PRF (if present) and cipher
     */
    public List<byte[]> getAlgorithmOIDs() {
        List<byte[]> oids = new ArrayList<>(4);
        oids.add(AlgorithmIdentifiers.PBES2.getEncoded());
        oids.add(AlgorithmIdentifiers.PBKDF2.getEncoded());
        if (prf != null) {
            oids.add(prf.getOID());
        }
        oids.add(getCipherOID());
        return Collections.unmodifiableList(oids);
    }

    /**
     * @param  encBytes                      The DER encoded document
     * @return                               The decoded information
     * @throws IOException                   If the document is structurally invalid
     * @throws UnsupportedAlgorithmException If the scheme is not PBES2 or the key derivation not PBKDF2
     */
    public static EncryptedPrivateKeyInfo decode(byte[] encBytes) throws IOException, UnsupportedAlgorithmException {
        DERParser parser = new DERParser(encBytes);
        ASN1Object info = parser.readObject(ASN1Type.SEQUENCE);
        parser.assertFullyConsumed();

        DERParser infoParser = info.createParser();
        ASN1Object encryptionAlgorithm = infoParser.readObject(ASN1Type.SEQUENCE);
        byte[] encryptedData = infoParser.readObject(ASN1Type.OCTET_STRING).getOctetStringBytes();
        infoParser.assertFullyConsumed();

        AlgorithmIdentifierInfo scheme = AlgorithmIdentifierInfo.decode(encryptionAlgorithm);
        if (!scheme.isAlgorithm(AlgorithmIdentifiers.PBES2)) {
            throw new UnsupportedAlgorithmException("Unsupported encryption scheme: " + scheme);
        }

        DERParser pbes2Parser = requireParameters(scheme, ASN1Type.SEQUENCE).createParser();
        AlgorithmIdentifierInfo kdf = AlgorithmIdentifierInfo.decode(pbes2Parser.readObject(ASN1Type.SEQUENCE));
        AlgorithmIdentifierInfo cipher = AlgorithmIdentifierInfo.decode(pbes2Parser.readObject(ASN1Type.SEQUENCE));
        pbes2Parser.assertFullyConsumed();

        if (!kdf.isAlgorithm(AlgorithmIdentifiers.PBKDF2)) {
            throw new UnsupportedAlgorithmException("Unsupported key derivation function: " + kdf);
        }

        DERParser kdfParser = requireParameters(kdf, ASN1Type.SEQUENCE).createParser();
        // the salt may also be an AlgorithmIdentifier (otherSource) - we do not support it
        byte[] salt = kdfParser.readObject(ASN1Type.OCTET_STRING).getOctetStringBytes();
        int iterationCount = toInt(kdfParser.readObject(ASN1Type.INTEGER), "iteration count");
        if (iterationCount <= 0) {
            throw new MalformedEncodingException("Invalid PBKDF2 iteration count: " + iterationCount);
        }

        int keyLength = -1;
        ASN1Object next = kdfParser.readObject();
        if ((next != null) && next.isType(ASN1Type.INTEGER)) {
            keyLength = toInt(next, "key length");
            next = kdfParser.readObject();
        }

        AlgorithmIdentifierInfo prf = null;
        if (next != null) {
            prf = AlgorithmIdentifierInfo.decode(next);
        }
        kdfParser.assertFullyConsumed();

        ASN1Object ivObject = cipher.getParameters();
        if ((ivObject == null) || (!ivObject.isType(ASN1Type.OCTET_STRING))) {
            if (cipher.isAlgorithm(AlgorithmIdentifiers.AES256_CBC)) {
                throw new MalformedEncodingException("Missing IV for " + cipher);
            }
            throw new UnsupportedAlgorithmException("Unsupported encryption algorithm: " + cipher);
        }

        return new EncryptedPrivateKeyInfo(
                salt, iterationCount, keyLength, prf, cipher.getOID(), ivObject.getOctetStringBytes(), encryptedData);
    }

    private static ASN1Object requireParameters(AlgorithmIdentifierInfo info, ASN1Type expected)
            throws MalformedEncodingException {
        ASN1Object params = info.getParameters();
        if (params == null) {
            throw new MalformedEncodingException("Missing parameters for " + info);
        }
        params.assertType(expected);
        return params;
    }

    static int toInt(ASN1Object obj, String what) throws IOException {
        BigInteger value = obj.asInteger();
        if ((value.signum() < 0) || (value.bitLength() >= Integer.SIZE)) {
            throw new MalformedEncodingException("Invalid " + what + ": " + value);
        }
        return value.intValue();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName()
               + "[iterations=" + getIterationCount()
               + ", salt=" + salt.length + " bytes"
               + ", prf=" + getPrf()
               + ", cipher=" + AlgorithmIdentifiers.describe(cipherOID)
               + ", data=" + encryptedData.length + " bytes"
               + "]";
    }
}

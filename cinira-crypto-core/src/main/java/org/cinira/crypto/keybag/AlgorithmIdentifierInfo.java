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
 * An X.509 {@code AlgorithmIdentifier}:
 *
 * <pre>
 * AlgorithmIdentifier ::= SEQUENCE {
 *      algorithm       OBJECT IDENTIFIER,
 *      parameters      ANY DEFINED BY algorithm OPTIONAL
 * }
 * </pre>
 *
 * @author Cinira Crypto Project
 */
public class AlgorithmIdentifierInfo {
    private final byte[] oid;
    private final ASN1Object parameters;

    public AlgorithmIdentifierInfo(byte[] oid, ASN1Object parameters) {
        this.oid = oid.clone();
        this.parameters = parameters;
    }

    /**
     * @return A <U>copy</U> of the raw OID value bytes
     */
    public byte[] getOID() {
        return oid.clone();
    }

    public boolean isAlgorithm(AlgorithmIdentifiers id) {
        return id.matches(oid);
    }

    /**
     * @return The parameters element - {@code null} if absent or an explicit {@code NULL}
     */
    public ASN1Object getParameters() {
        return parameters;
    }

    /**
     * @param  algorithmIdentifier The {@code AlgorithmIdentifier} element
     * @return                     The decoded information
     * @throws IOException         If not a valid {@code AlgorithmIdentifier}
     */
    public static AlgorithmIdentifierInfo decode(ASN1Object algorithmIdentifier) throws IOException {
        algorithmIdentifier.assertType(ASN1Type.SEQUENCE);

        DERParser parser = algorithmIdentifier.createParser();
        byte[] oid = parser.readObject(ASN1Type.OBJECT_IDENTIFIER).getOIDBytes();
        // parameters are OPTIONAL - and often an explicit NULL
        ASN1Object params = parser.readObject();
        if ((params != null) && params.isType(ASN1Type.NULL)) {
            params = null;
        }
        parser.assertFullyConsumed();

        return new AlgorithmIdentifierInfo(oid, params);
    }

    @Override
    public String toString() {
        return AlgorithmIdentifiers.describe(oid);
    }
}

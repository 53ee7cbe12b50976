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
import java.util.List;

import org.cinira.crypto.common.util.ValidateUtils;
import org.cinira.crypto.common.util.io.der.ASN1Object;
import org.cinira.crypto.common.util.io.der.ASN1Type;
import org.cinira.crypto.common.util.io.der.DERParser;
import org.cinira.crypto.common.util.io.der.MalformedEncodingException;
import org.cinira.crypto.common.util.logging.AbstractLoggingBean;

/**
 * Walks a DER key document depth-first and projects it into {@link KeyBagContents}: OBJECT IDENTIFIER values go to
 * the OIDs, OCTET STRING and BIT STRING values (the latter without the unused bits octet) to the strings and
 * INTEGER values to the numbers. SEQUENCE and SET elements are recursed into, anything else is skipped. The whole
 * buffer must be exactly one element and every child must exactly consume its parent.
 *
 * @author Cinira Crypto Project
 */
public class KeyBagDecoder extends AbstractLoggingBean {
    /** Maximum nesting of constructed elements - key documents need no more than 6 */
    public static final int MAX_NESTING_DEPTH = 16;

    public static final KeyBagDecoder INSTANCE = new KeyBagDecoder();

    public KeyBagDecoder() {
        super();
    }

    /**
     * @param  encBytes    The DER encoded document
     * @return             The flat projection of the document
     * @throws IOException If the document is malformed or truncated
     */
    public KeyBagContents decode(byte[] encBytes) throws IOException {
        ValidateUtils.checkNotNull(encBytes, "No data to decode");

        DERParser parser = new DERParser(encBytes);
        ASN1Object top = parser.readObject();
        if (top == null) {
            throw new MalformedEncodingException("Invalid DER: empty document");
        }
        top.assertType(ASN1Type.SEQUENCE);
        parser.assertFullyConsumed();

        List<byte[]> oids = new ArrayList<>();
        List<byte[]> strings = new ArrayList<>();
        List<BigInteger> numbers = new ArrayList<>();
        collect(top, 1, oids, strings, numbers);

        KeyBagContents contents = new KeyBagContents(oids, strings, numbers);
        if (log.isDebugEnabled()) {
            log.debug("decode({} bytes) {}", encBytes.length, contents);
        }
        return contents;
    }

    protected void collect(
            ASN1Object obj, int depth, List<byte[]> oids, List<byte[]> strings, List<BigInteger> numbers)
            throws IOException {
        ASN1Type type = obj.getObjType();
        if (type == null) {
            return; // not a universal element - traversed over but not captured
        }

        switch (type) {
            case OBJECT_IDENTIFIER:
                oids.add(obj.getOIDBytes());
                break;
            case OCTET_STRING:
                strings.add(obj.getOctetStringBytes());
                break;
            case BIT_STRING:
                strings.add(obj.getBitStringBytes());
                break;
            case INTEGER: {
                BigInteger value = obj.asInteger();
                if (value.signum() < 0) {
                    throw new MalformedEncodingException("Negative INTEGER at offset " + obj.getHeaderOffset());
                }
                numbers.add(value);
                break;
            }
            case SEQUENCE:
            case SET: {
                if (depth > MAX_NESTING_DEPTH) {
                    throw new MalformedEncodingException("Nesting deeper than " + MAX_NESTING_DEPTH + " levels");
                }

                DERParser parser = obj.createParser();
                for (ASN1Object child = parser.readObject(); child != null; child = parser.readObject()) {
                    collect(child, depth + 1, oids, strings, numbers);
                }
                break;
            }
            default:
                break;
        }
    }

    /**
     * @param  encBytes    The DER encoded document
     * @return             The {@link KeyBagShape} of the document based on its outer structure
     * @throws IOException If the document matches none of the known shapes
     */
    public KeyBagShape detectShape(byte[] encBytes) throws IOException {
        DERParser parser = new DERParser(ValidateUtils.checkNotNull(encBytes, "No data to inspect"));
        ASN1Object top = parser.readObject(ASN1Type.SEQUENCE);
        parser.assertFullyConsumed();

        DERParser topParser = top.createParser();
        ASN1Object first = topParser.readObject();
        ASN1Object second = topParser.readObject();
        if ((first != null) && (second != null)) {
            if (first.isType(ASN1Type.INTEGER) && second.isType(ASN1Type.SEQUENCE)) {
                return KeyBagShape.PRIVATE_KEY_INFO;
            }

            if (first.isType(ASN1Type.SEQUENCE)) {
                if (second.isType(ASN1Type.OCTET_STRING)) {
                    return KeyBagShape.ENCRYPTED_PRIVATE_KEY_INFO;
                }
                if (second.isType(ASN1Type.BIT_STRING)) {
                    return KeyBagShape.SUBJECT_PUBLIC_KEY_INFO;
                }
            }
        }

        throw new MalformedEncodingException("Unknown key document shape: first=" + first + ", second=" + second);
    }
}

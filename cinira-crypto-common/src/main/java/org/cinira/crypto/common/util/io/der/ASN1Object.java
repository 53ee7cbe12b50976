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

package org.cinira.crypto.common.util.io.der;

import java.io.IOException;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.cinira.crypto.common.util.GenericUtils;
import org.cinira.crypto.common.util.NumberUtils;

/**
 * A single decoded tag/length/value element. The value is <U>not</U> copied - the object keeps a reference to the
 * source buffer together with the range the value occupies in it. Accessors that return bytes always return a copy.
 *
 * @author Cinira Crypto Project
 */
public class ASN1Object {
    // Constructed Flag
    public static final byte CONSTRUCTED = 0x20;

    private final byte[] source;
    private final byte tag;
    private final int headerOffset;
    private final int valueOffset;
    private final int length;

    /**
     * @param source       The buffer holding the encoded element
     * @param tag          The identifier octet
     * @param headerOffset Offset of the identifier octet in the buffer
     * @param valueOffset  Offset of the first value byte in the buffer
     * @param length       Number of value bytes
     */
    public ASN1Object(byte[] source, byte tag, int headerOffset, int valueOffset, int length) {
        this.source = source;
        this.tag = tag;
        this.headerOffset = headerOffset;
        this.valueOffset = valueOffset;
        this.length = length;
    }

    public byte getTag() {
        return tag;
    }

    public ASN1Class getObjClass() {
        return ASN1Class.fromDERValue(tag);
    }

    /**
     * @return The {@link ASN1Type} of a {@link ASN1Class#UNIVERSAL} element - {@code null} if unknown or not a
     *         universal element
     */
    public ASN1Type getObjType() {
        if (getObjClass() != ASN1Class.UNIVERSAL) {
            return null;
        }
        return ASN1Type.fromDERValue(tag);
    }

    public boolean isType(ASN1Type type) {
        return (type != null) && (type == getObjType());
    }

    public boolean isConstructed() {
        return (tag & CONSTRUCTED) == CONSTRUCTED;
    }

    public int getLength() {
        return length;
    }

    public int getHeaderOffset() {
        return headerOffset;
    }

    public int getValueOffset() {
        return valueOffset;
    }

    public int getValueEnd() {
        return valueOffset + length;
    }

    /**
     * @return Offset in the source buffer right after this element
     */
    public int getNextOffset() {
        return getValueEnd();
    }

    /**
     * @return A <U>copy</U> of the value bytes
     */
    public byte[] getValue() {
        if (length == 0) {
            return GenericUtils.EMPTY_BYTE_ARRAY;
        }
        return Arrays.copyOfRange(source, valueOffset, getValueEnd());
    }

    /**
     * @return A <U>copy</U> of the whole encoding - identifier, length and value
     */
    public byte[] getEncoded() {
        return Arrays.copyOfRange(source, headerOffset, getValueEnd());
    }

    /**
     * @return A parser over the value range - any child running past it is reported as a truncated document
     */
    public DERParser createParser() {
        return new DERParser(source, valueOffset, length);
    }

    /**
     * Get the value as {@link BigInteger}
     *
     * @return             BigInteger
     * @throws IOException if type not an {@link ASN1Type#INTEGER} or value is empty
     */
    public BigInteger asInteger() throws IOException {
        assertType(ASN1Type.INTEGER);
        if (length <= 0) {
            throw new MalformedEncodingException("Invalid DER: empty INTEGER value");
        }
        return new BigInteger(source, valueOffset, length);
    }

    /**
     * @return             The raw value bytes of an {@link ASN1Type#OBJECT_IDENTIFIER}
     * @throws IOException If not an OID or empty
     */
    public byte[] getOIDBytes() throws IOException {
        assertType(ASN1Type.OBJECT_IDENTIFIER);
        if (length <= 0) {
            throw new MalformedEncodingException("Invalid DER: empty OID value");
        }
        return getValue();
    }

    public byte[] getOctetStringBytes() throws IOException {
        assertType(ASN1Type.OCTET_STRING);
        return getValue();
    }

    /**
     * @return             The bits of an {@link ASN1Type#BIT_STRING} - without the leading &quot;unused bits&quot;
     *                     octet
     * @throws IOException If not a bit string or the unused bits count is invalid
     */
    public byte[] getBitStringBytes() throws IOException {
        assertType(ASN1Type.BIT_STRING);
        if (length <= 0) {
            throw new MalformedEncodingException("Invalid DER: BIT STRING without unused bits octet");
        }

        int unusedBits = source[valueOffset] & 0xFF;
        if ((unusedBits > 7) || ((length == 1) && (unusedBits != 0))) {
            throw new MalformedEncodingException("Invalid DER: bad BIT STRING unused bits count: " + unusedBits);
        }

        return Arrays.copyOfRange(source, valueOffset + 1, getValueEnd());
    }

    /**
     * @return             The OID arcs
     * @throws IOException If not an OID or badly encoded
     */
    public List<Integer> asOID() throws IOException {
        assertType(ASN1Type.OBJECT_IDENTIFIER);
        if (length <= 0) {
            throw new MalformedEncodingException("Invalid DER: empty OID value");
        }

        List<Integer> oid = new ArrayList<>(length + 1);
        int val1 = source[valueOffset] & 0xFF;
        if (val1 >= 80) {
            oid.add(Integer.valueOf(2));
            oid.add(Integer.valueOf(val1 - 80));
        } else {
            oid.add(Integer.valueOf(val1 / 40));
            oid.add(Integer.valueOf(val1 % 40));
        }

        int maxPos = getValueEnd();
        for (int curPos = valueOffset + 1; curPos < maxPos; curPos++) {
            int v = source[curPos] & 0xFF;
            if (v <= 0x7F) { // short form
                oid.add(Integer.valueOf(v));
                continue;
            }

            long curVal = v & 0x7F;
            for (int subLen = 1;; subLen++) {
                curPos++;
                if (curPos >= maxPos) {
                    throw new MalformedEncodingException("Invalid DER: incomplete OID value");
                }

                if (subLen >= 5) { // 32 bit values can span at most 5 octets
                    throw new MalformedEncodingException("Invalid DER: OID component encoding beyond 5 bytes");
                }

                v = source[curPos] & 0xFF;
                curVal = (curVal << 7) | (v & 0x7FL);
                if (curVal > Integer.MAX_VALUE) {
                    throw new MalformedEncodingException("Invalid DER: OID value exceeds 32 bits: " + curVal);
                }

                if (v <= 0x7F) { // found last octet ?
                    break;
                }
            }

            oid.add(Integer.valueOf((int) curVal));
        }

        return oid;
    }

    public String asOIDString() throws IOException {
        return GenericUtils.join(asOID(), '.');
    }

    /**
     * @param  expected                   The expected universal type
     * @throws MalformedEncodingException If this element is of another type
     */
    public void assertType(ASN1Type expected) throws MalformedEncodingException {
        if (!isType(expected)) {
            throw new MalformedEncodingException(
                    "Invalid DER: expected " + expected + " but found tag=0x" + Integer.toHexString(tag & 0xFF)
                                                 + " at offset " + headerOffset);
        }
    }

    @Override
    public int hashCode() {
        return 31 * Byte.hashCode(tag) + NumberUtils.hashCode(source, valueOffset, length);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == null) {
            return false;
        }
        if (this == obj) {
            return true;
        }
        if (getClass() != obj.getClass()) {
            return false;
        }

        ASN1Object other = (ASN1Object) obj;
        return (this.getTag() == other.getTag())
                && (this.getLength() == other.getLength())
                && (NumberUtils.diffOffset(this.source, this.valueOffset, other.source, other.valueOffset,
                        this.getLength()) < 0);
    }

    @Override
    public String toString() {
        ASN1Type type = getObjType();
        return getObjClass()
               + "/" + ((type == null) ? ("0x" + Integer.toHexString(tag & ASN1Type.HIGH_TAG_NUMBER)) : type)
               + "/" + isConstructed()
               + "[" + getLength() + "]@" + getHeaderOffset();
    }
}

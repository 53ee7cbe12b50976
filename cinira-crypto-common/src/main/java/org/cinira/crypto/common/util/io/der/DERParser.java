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

import org.cinira.crypto.common.util.NumberUtils;
import org.cinira.crypto.common.util.ValidateUtils;
import org.cinira.crypto.common.util.buffer.BufferUtils;

/**
 * A bare minimum DER parser - just enough to walk the fixed shapes of PKCS#8 and X.509 key documents. It is a cursor
 * over a range of a byte array and never copies the data. Reading past the range of an enclosing element is reported
 * as a {@link TruncatedDocumentException}, reading past the end of the whole buffer as a
 * {@link MalformedEncodingException}.
 *
 * @author Cinira Crypto Project
 */
public class DERParser {
    /**
     * Maximum size of data allowed by {@link #readLength()} - it is a bit arbitrary since one can encode 32-bit length
     * data, but it is far more than any key document needs
     */
    public static final int MAX_DER_VALUE_LENGTH = 1024 * 1024;

    /** Maximum number of octets of a long form length */
    public static final int MAX_LENGTH_OCTETS = Integer.BYTES;

    private final byte[] data;
    private final int limit;
    private int position;

    public DERParser(byte... bytes) {
        this(bytes, 0, NumberUtils.length(bytes));
    }

    /**
     * @param bytes  The data buffer
     * @param offset Offset of the first element
     * @param len    Number of bytes the parser may consume
     */
    public DERParser(byte[] bytes, int offset, int len) {
        data = ValidateUtils.checkNotNull(bytes, "No data buffer");
        ValidateUtils.checkTrue((offset >= 0) && (len >= 0) && (offset <= bytes.length),
                "Invalid range: offset=%d, len=%d", offset, len);
        position = offset;
        // the range itself may exceed the buffer - this is detected lazily as a malformed encoding
        limit = (int) Math.min((long) offset + len, Integer.MAX_VALUE);
    }

    /**
     * Reads a single element that starts at the given offset and may extend up to the end of the buffer
     *
     * @param  buffer                     The data buffer
     * @param  offset                     Offset of the identifier octet
     * @return                            The decoded {@link ASN1Object}
     * @throws MalformedEncodingException If offset is at or beyond the buffer end or the element is invalid
     */
    public static ASN1Object readElement(byte[] buffer, int offset) throws MalformedEncodingException {
        int len = NumberUtils.length(buffer);
        if ((offset < 0) || (offset >= len)) {
            throw new MalformedEncodingException("Invalid DER: offset " + offset + " beyond data length " + len);
        }

        try {
            return new DERParser(buffer, offset, len - offset).readObject();
        } catch (TruncatedDocumentException e) {
            // cannot happen since the range ends at the buffer end
            throw new MalformedEncodingException(e.getMessage());
        }
    }

    public int getPosition() {
        return position;
    }

    public int getLimit() {
        return limit;
    }

    public boolean hasMoreData() {
        return position < limit;
    }

    /**
     * Decode the length of the field. Can only support length encoding up to 4 octets. In DER encoding, length can be
     * encoded in 2 forms:
     * <ul>
     * <li>
     * <p>
     * Short form - One octet. Bit 8 has value "0" and bits 7-1 give the length.
     * </p>
     * </li>
     *
     * <li>
     * <p>
     * Long form - Two to 127 octets (only up to 4 are supported here). Bit 8 of first octet has value "1" and bits
     * 7-1 give the number of additional length octets. Second and following octets give the length, base 256, most
     * significant digit first. The indefinite form (0x80) is not allowed in DER.
     * </p>
     * </li>
     * </ul>
     *
     * @return                            The length as integer
     * @throws MalformedEncodingException If invalid format found
     * @throws TruncatedDocumentException If the length octets run past the enclosing element
     */
    public int readLength() throws MalformedEncodingException, TruncatedDocumentException {
        ensureAvailable(1, "length");
        int i = data[position] & 0xFF;
        position++;

        // A single byte short length
        if ((i & ~0x7F) == 0) {
            return i;
        }

        int num = i & 0x7F;
        if (num == 0) {
            throw new MalformedEncodingException("Invalid DER: indefinite length form not allowed");
        }
        if (num > MAX_LENGTH_OCTETS) {
            throw new MalformedEncodingException("Invalid DER: length field too big: " + num + " octets");
        }

        ensureAvailable(num, "length data");
        if (data[position] == 0) {
            throw new MalformedEncodingException("Invalid DER: length not in shortest form - leading zero octet");
        }

        long len = BufferUtils.getUInt(data, position, num);
        position += num;
        // according to standard: "the shortest possible length encoding must be used"
        if (len < 0x80L) {
            throw new MalformedEncodingException("Invalid DER: length not in shortest form: " + len);
        }

        if (len > MAX_DER_VALUE_LENGTH) {
            throw new MalformedEncodingException(
                    "Invalid DER: data length too big: " + len + " (max=" + MAX_DER_VALUE_LENGTH + ")");
        }

        // we know the cast is safe since it is less than MAX_DER_VALUE_LENGTH
        return (int) len;
    }

    /**
     * @return                            The next {@link ASN1Object} or {@code null} if the cursor is exactly at its
     *                                    limit
     * @throws MalformedEncodingException If the element is invalid, extends past the buffer end or a universal type
     *                                    has the wrong primitive/constructed form
     * @throws TruncatedDocumentException If the element extends past the limit of this parser
     */
    public ASN1Object readObject() throws MalformedEncodingException, TruncatedDocumentException {
        if (position == limit) {
            return null;
        }

        int headerOffset = position;
        ensureAvailable(1, "tag");
        byte tag = data[position];
        if ((tag & ASN1Type.HIGH_TAG_NUMBER) == ASN1Type.HIGH_TAG_NUMBER) {
            throw new MalformedEncodingException(
                    "Invalid DER: high tag number form not supported at offset " + headerOffset);
        }
        position++;

        int length = readLength();
        ensureAvailable(length, "value");

        int valueOffset = position;
        position += length;
        ASN1Object obj = new ASN1Object(data, tag, headerOffset, valueOffset, length);
        assertEncodingForm(obj);
        return obj;
    }

    /**
     * @param  obj                        A universal element
     * @throws MalformedEncodingException If its constructed bit does not match the form DER mandates for its type
     */
    protected void assertEncodingForm(ASN1Object obj) throws MalformedEncodingException {
        ASN1Type type = obj.getObjType();
        if (type == null) {
            return;
        }

        boolean constructed = obj.isConstructed();
        if ((type.isConstructedOnly() && (!constructed)) || (type.isPrimitiveOnly() && constructed)) {
            throw new MalformedEncodingException(
                    "Invalid DER: " + type + " at offset " + obj.getHeaderOffset() + " must be "
                                                 + (constructed ? "primitive" : "constructed"));
        }
    }

    /**
     * @param  expected                   The expected universal type of the next element
     * @return                            The read {@link ASN1Object}
     * @throws MalformedEncodingException If there is no next element or it is of another type
     * @throws TruncatedDocumentException If the element extends past the limit of this parser
     */
    public ASN1Object readObject(ASN1Type expected) throws MalformedEncodingException, TruncatedDocumentException {
        ASN1Object obj = readObject();
        if (obj == null) {
            throw new MalformedEncodingException("Invalid DER: missing " + expected + " at offset " + position);
        }

        obj.assertType(expected);
        return obj;
    }

    /**
     * @throws TruncatedDocumentException If the parser did not consume all its data
     */
    public void assertFullyConsumed() throws TruncatedDocumentException {
        if (position != limit) {
            throw new TruncatedDocumentException(
                    "Invalid DER: " + (limit - position) + " unexpected trailing bytes at offset " + position);
        }
    }

    protected void ensureAvailable(int count, String what) throws MalformedEncodingException, TruncatedDocumentException {
        long end = (long) position + count;
        if (end > data.length) {
            throw new MalformedEncodingException(
                    "Invalid DER: " + what + " at offset " + position + " extends past data end: required=" + count
                                                 + ", available=" + Math.max(0, data.length - position));
        }
        if (end > limit) {
            throw new TruncatedDocumentException(
                    "Invalid DER: " + what + " at offset " + position + " extends past enclosing element: required="
                                                 + count + ", available=" + Math.max(0, limit - position));
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[position=" + position + ", limit=" + limit + "]";
    }
}

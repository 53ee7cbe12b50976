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

import java.io.ByteArrayOutputStream;
import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.StreamCorruptedException;
import java.math.BigInteger;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

import org.cinira.crypto.common.util.NumberUtils;
import org.cinira.crypto.common.util.ValidateUtils;
import org.cinira.crypto.common.util.buffer.BufferUtils;

/**
 * A bare-minimum DER encoder - just enough to build key documents for the tests
 *
 * @author Cinira Crypto Project
 */
public class DERWriter extends FilterOutputStream {
    public static final int DEFAULT_SIZE = 256;

    private final byte[] lenBytes = new byte[Integer.BYTES];

    public DERWriter() {
        this(DEFAULT_SIZE);
    }

    public DERWriter(int initialSize) {
        this(new ByteArrayOutputStream(initialSize));
    }

    public DERWriter(OutputStream stream) {
        super(Objects.requireNonNull(stream, "No output stream"));
    }

    public DERWriter startSequence() {
        return startConstructed(ASN1Type.SEQUENCE.toUniversalTag());
    }

    public DERWriter startSet() {
        return startConstructed(ASN1Type.SET.toUniversalTag());
    }

    /**
     * @param  tag The identifier octet of the constructed element
     * @return     A writer for the element contents - the element is written to this writer when the returned one is
     *             closed
     */
    public DERWriter startConstructed(byte tag) {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        AtomicBoolean dataWritten = new AtomicBoolean(false);
        @SuppressWarnings("resource")
        DERWriter encloser = this;
        return new DERWriter(baos) {
            @Override
            public void close() throws IOException {
                baos.close();

                if (!dataWritten.getAndSet(true)) { // detect repeated calls and write this only once
                    byte[] contents = baos.toByteArray();
                    encloser.writeObject(tag, contents.length, contents);
                }
            }
        };
    }

    public void writeBigInteger(BigInteger value) throws IOException {
        writeBigInteger(Objects.requireNonNull(value, "No value").toByteArray());
    }

    /**
     * The integer is always considered to be positive, so if the first byte is &lt; 0, we pad with a zero to make it
     * positive
     *
     * @param  bytes       {@link BigInteger} bytes
     * @throws IOException If failed to write the bytes
     */
    public void writeBigInteger(byte... bytes) throws IOException {
        int off = 0;
        int len = NumberUtils.length(bytes);
        ValidateUtils.checkTrue(len > 0, "No integer bytes");

        // Strip leading zeroes
        while ((len > 1) && (bytes[off] == 0) && isPositive(bytes[off + 1])) {
            off++;
            len--;
        }

        write(ASN1Type.INTEGER.getTypeValue());
        // Pad with a zero if needed
        if (isPositive(bytes[off])) {
            writeLength(len);
        } else {
            writeLength(len + 1);
            write(0);
        }
        write(bytes, off, len);
    }

    private static boolean isPositive(byte b) {
        return (b & 0x80) == 0;
    }

    public void writeOID(byte... oidBytes) throws IOException {
        writeObject(ASN1Type.OBJECT_IDENTIFIER.getTypeValue(), NumberUtils.length(oidBytes), oidBytes);
    }

    public void writeOctetString(byte... value) throws IOException {
        writeObject(ASN1Type.OCTET_STRING.getTypeValue(), NumberUtils.length(value), value);
    }

    /**
     * Writes a BIT STRING whose last octet has no unused bits
     *
     * @param  value       The bits
     * @throws IOException If failed to write
     */
    public void writeBitString(byte... value) throws IOException {
        int len = NumberUtils.length(value);
        write(ASN1Type.BIT_STRING.getTypeValue());
        writeLength(len + 1);
        write(0);
        if (len > 0) {
            write(value, 0, len);
        }
    }

    public void writeNull() throws IOException {
        write(ASN1Type.NULL.getTypeValue());
        write(0);
    }

    public void writeObject(byte tag, int len, byte... data) throws IOException {
        write(tag & 0xFF);
        writeLength(len);
        if (len > 0) {
            write(data, 0, len);
        }
    }

    public void writeLength(int len) throws IOException {
        ValidateUtils.checkTrue(len >= 0, "Invalid length: %d", len);

        // short form - MSBit is zero
        if (len <= 127) {
            write(len);
            return;
        }

        BufferUtils.putUInt(len, lenBytes);

        int nonZeroPos = 0;
        for (; nonZeroPos < lenBytes.length; nonZeroPos++) {
            if (lenBytes[nonZeroPos] != 0) {
                break;
            }
        }

        if (nonZeroPos >= lenBytes.length) {
            throw new StreamCorruptedException("All zeroes length representation for len=" + len);
        }

        int bytesLen = lenBytes.length - nonZeroPos;
        write(0x80 | bytesLen); // indicate number of octets
        write(lenBytes, nonZeroPos, bytesLen);
    }

    public byte[] toByteArray() throws IOException {
        if (this.out instanceof ByteArrayOutputStream) {
            return ((ByteArrayOutputStream) this.out).toByteArray();
        } else {
            throw new IOException("The underlying stream is not a byte[] stream");
        }
    }
}

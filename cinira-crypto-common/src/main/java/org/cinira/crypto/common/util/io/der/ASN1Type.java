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

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * The universal tag numbers this package knows how to dispatch on. Only the low 5 bits of the identifier octet are
 * significant; the high-tag-number form (all 5 bits set) is never produced or accepted.
 *
 * @author Cinira Crypto Project
 */
public enum ASN1Type {
    ANY((byte) 0x00),
    BOOLEAN((byte) 0x01),
    INTEGER((byte) 0x02),
    BIT_STRING((byte) 0x03),
    OCTET_STRING((byte) 0x04),
    NULL((byte) 0x05),
    OBJECT_IDENTIFIER((byte) 0x06),
    UTF8_STRING((byte) 0x0C),
    SEQUENCE((byte) 0x10),
    SET((byte) 0x11),
    PRINTABLE_STRING((byte) 0x13),
    IA5_STRING((byte) 0x16),
    UTC_TIME((byte) 0x17),
    GENERALIZED_TIME((byte) 0x18),
    BMP_STRING((byte) 0x1E);

    public static final Set<ASN1Type> VALUES = Collections.unmodifiableSet(EnumSet.allOf(ASN1Type.class));

    /** Tag number value reserved for the (unsupported) high-tag-number form */
    public static final int HIGH_TAG_NUMBER = 0x1F;

    private final byte typeValue;

    ASN1Type(byte typeValue) {
        this.typeValue = typeValue;
    }

    public byte getTypeValue() {
        return typeValue;
    }

    /**
     * @return The identifier octet of a universal element of this type - constructed bit set for
     *         {@link #SEQUENCE} and {@link #SET}
     */
    public byte toUniversalTag() {
        if (isConstructedOnly()) {
            return (byte) (typeValue | ASN1Object.CONSTRUCTED);
        } else {
            return typeValue;
        }
    }

    /**
     * @return {@code true} if DER requires the constructed encoding for this type
     */
    public boolean isConstructedOnly() {
        return (this == SEQUENCE) || (this == SET);
    }

    /**
     * @return {@code true} if DER requires the primitive encoding for this type
     */
    public boolean isPrimitiveOnly() {
        switch (this) {
            case BOOLEAN:
            case INTEGER:
            case BIT_STRING:
            case OCTET_STRING:
            case NULL:
            case OBJECT_IDENTIFIER:
                return true;
            default:
                return false;
        }
    }

    /**
     * @param  tag The original DER identifier octet
     * @return     The {@link ASN1Type} value - {@code null} if no match found
     */
    public static ASN1Type fromDERValue(int tag) {
        return fromTypeValue(tag & HIGH_TAG_NUMBER);
    }

    public static ASN1Type fromTypeValue(int value) {
        for (ASN1Type t : VALUES) {
            if (t.getTypeValue() == value) {
                return t;
            }
        }

        return null;
    }
}

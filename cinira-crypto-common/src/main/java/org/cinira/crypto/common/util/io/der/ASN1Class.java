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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The tag class encoded in the 2 most significant bits of a DER identifier octet
 *
 * @author Cinira Crypto Project
 */
public enum ASN1Class {
    // NOTE: order matches the encoded value
    UNIVERSAL((byte) 0x00),
    APPLICATION((byte) 0x01),
    CONTEXT((byte) 0x02),
    PRIVATE((byte) 0x03);

    public static final List<ASN1Class> VALUES = Collections.unmodifiableList(Arrays.asList(values()));

    private final byte classValue;

    ASN1Class(byte classValue) {
        this.classValue = classValue;
    }

    public byte getClassValue() {
        return classValue;
    }

    /**
     * @param  tag The original DER identifier octet
     * @return     The matching {@link ASN1Class} - never {@code null} since all 4 values are defined
     */
    public static ASN1Class fromDERValue(int tag) {
        return VALUES.get((tag >> 6) & 0x03);
    }
}

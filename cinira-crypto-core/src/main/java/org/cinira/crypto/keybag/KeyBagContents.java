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

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

import org.cinira.crypto.common.util.io.der.MalformedEncodingException;

/**
 * Flat projection of a DER document - object identifiers, byte strings and integers, each list in depth-first
 * document order
 *
 * @author Cinira Crypto Project
 */
public class KeyBagContents {
    private final List<byte[]> oids;
    private final List<byte[]> strings;
    private final List<BigInteger> numbers;

    public KeyBagContents(Collection<byte[]> oids, Collection<byte[]> strings, Collection<BigInteger> numbers) {
        this.oids = copyOf(oids);
        this.strings = copyOf(strings);
        this.numbers = Collections.unmodifiableList(new ArrayList<>(numbers));
    }

    private static List<byte[]> copyOf(Collection<byte[]> values) {
        List<byte[]> result = new ArrayList<>(values.size());
        for (byte[] v : values) {
            result.add(v.clone());
        }
        return result;
    }

    public int getOIDsCount() {
        return oids.size();
    }

    public int getStringsCount() {
        return strings.size();
    }

    public int getNumbersCount() {
        return numbers.size();
    }

    /**
     * @return A <U>copy</U> of the OIDs
     */
    public List<byte[]> getOIDs() {
        return Collections.unmodifiableList(copyOf(oids));
    }

    /**
     * @return A <U>copy</U> of the byte strings
     */
    public List<byte[]> getStrings() {
        return Collections.unmodifiableList(copyOf(strings));
    }

    public List<BigInteger> getNumbers() {
        return numbers;
    }

    public byte[] getOID(int index) throws MalformedEncodingException {
        return checkIndex(oids, index, "OID").clone();
    }

    public byte[] getString(int index) throws MalformedEncodingException {
        return checkIndex(strings, index, "string").clone();
    }

    public BigInteger getNumber(int index) throws MalformedEncodingException {
        return checkIndex(numbers, index, "number");
    }

    /**
     * @param  index                      The number index
     * @return                            The number as a non-negative {@code int}
     * @throws MalformedEncodingException If no such number or it does not fit
     */
    public int getInt(int index) throws MalformedEncodingException {
        BigInteger value = getNumber(index);
        if ((value.signum() < 0) || (value.bitLength() >= Integer.SIZE)) {
            throw new MalformedEncodingException("Number #" + index + " does not fit a non-negative int: " + value);
        }
        return value.intValue();
    }

    private static <T> T checkIndex(List<T> values, int index, String kind) throws MalformedEncodingException {
        if ((index < 0) || (index >= values.size())) {
            throw new MalformedEncodingException(
                    "Missing " + kind + " #" + index + " - document has only " + values.size());
        }
        return values.get(index);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName()
               + "[oids=" + oids.size()
               + ", strings=" + strings.size()
               + ", numbers=" + numbers.size()
               + "]";
    }
}

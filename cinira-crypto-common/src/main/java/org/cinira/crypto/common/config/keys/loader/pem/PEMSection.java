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

package org.cinira.crypto.common.config.keys.loader.pem;

import java.util.Base64;
import java.util.Collection;
import java.util.List;

import org.cinira.crypto.common.util.GenericUtils;
import org.cinira.crypto.common.util.ValidateUtils;
import org.cinira.crypto.common.util.io.der.MalformedEncodingException;

/**
 * A section of a PEM document - the full header text found between {@code -----BEGIN } and {@code -----} (e.g.,
 * &quot;ENCRYPTED PRIVATE KEY&quot;) and the body lines up to the matching END marker
 *
 * @author Cinira Crypto Project
 */
public class PEMSection {
    public static final String BEGIN_MARKER_PREFIX = "-----BEGIN ";
    public static final String END_MARKER_PREFIX = "-----END ";
    public static final String MARKER_SUFFIX = "-----";

    private final String header;
    private final List<String> lines;

    public PEMSection(String header, Collection<String> lines) {
        this.header = ValidateUtils.checkNotNullAndNotEmpty(header, "No section header");
        this.lines = GenericUtils.unmodifiableList(lines);
    }

    public String getHeader() {
        return header;
    }

    /**
     * @return The body lines - exactly as found between the markers
     */
    public List<String> getLines() {
        return lines;
    }

    /**
     * @return                            The BASE64 decoded body
     * @throws MalformedEncodingException If the body is not valid BASE64
     */
    public byte[] getDataBytes() throws MalformedEncodingException {
        String data = joinDataLines(lines);
        try {
            return Base64.getDecoder().decode(data);
        } catch (IllegalArgumentException e) {
            throw new MalformedEncodingException("Invalid BASE64 data in " + header + " section: " + e.getMessage());
        }
    }

    public static String joinDataLines(Collection<String> lines) {
        String data = GenericUtils.join(lines, ' ');
        data = data.replaceAll("\\s", "");
        data = data.trim();
        return data;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + header + "]: " + lines.size() + " lines";
    }
}

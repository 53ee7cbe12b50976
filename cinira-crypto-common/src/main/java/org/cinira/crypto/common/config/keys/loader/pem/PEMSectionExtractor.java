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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

import org.cinira.crypto.common.util.ValidateUtils;
import org.cinira.crypto.common.util.logging.AbstractLoggingBean;

/**
 * Locates a named section in PEM text. A section matches a name if its BEGIN line ends with
 * {@code " <name>-----"}, so that looking for &quot;PRIVATE KEY&quot; also finds an
 * &quot;ENCRYPTED PRIVATE KEY&quot; section. The <U>first</U> such section is returned.
 *
 * @author Cinira Crypto Project
 */
public class PEMSectionExtractor extends AbstractLoggingBean {
    public static final PEMSectionExtractor INSTANCE = new PEMSectionExtractor();

    public static final Pattern LINE_SEPARATOR = Pattern.compile("\\r?\\n");

    public PEMSectionExtractor() {
        super();
    }

    /**
     * @param  text                     The PEM text - lines separated by {@code \n} or {@code \r\n}
     * @param  name                     The section name - e.g., &quot;PRIVATE KEY&quot;
     * @return                          The matching {@link PEMSection}
     * @throws SectionNotFoundException If no BEGIN line matches or it has no matching END line
     */
    public PEMSection extractSection(String text, String name) throws SectionNotFoundException {
        ValidateUtils.checkNotNull(text, "No PEM text");
        return extractSection(Arrays.asList(LINE_SEPARATOR.split(text, -1)), name);
    }

    public PEMSection extractSection(List<String> lines, String name) throws SectionNotFoundException {
        ValidateUtils.checkNotNull(lines, "No PEM lines");
        name = ValidateUtils.checkNotNullAndNotEmpty(name, "No section name");
        String suffix = " " + name + PEMSection.MARKER_SUFFIX;
        int minLength = PEMSection.BEGIN_MARKER_PREFIX.length() + name.length() + PEMSection.MARKER_SUFFIX.length();
        for (int index = 0, count = lines.size(); index < count; index++) {
            String line = lines.get(index);
            if ((line.length() < minLength) || (!line.startsWith(PEMSection.BEGIN_MARKER_PREFIX))
                    || (!line.endsWith(suffix))) {
                continue;
            }

            String header = line.substring(
                    PEMSection.BEGIN_MARKER_PREFIX.length(), line.length() - PEMSection.MARKER_SUFFIX.length());
            String endMarker = PEMSection.END_MARKER_PREFIX + header + PEMSection.MARKER_SUFFIX;
            List<String> body = new ArrayList<>();
            for (int bodyIndex = index + 1; bodyIndex < count; bodyIndex++) {
                String bodyLine = lines.get(bodyIndex);
                if (endMarker.equals(bodyLine)) {
                    if (log.isDebugEnabled()) {
                        log.debug("extractSection({}) found {} with {} lines at line={}",
                                name, header, body.size(), index + 1);
                    }
                    return new PEMSection(header, body);
                }
                body.add(bodyLine);
            }

            throw new SectionNotFoundException(name, "Missing " + endMarker + " for section at line " + (index + 1));
        }

        throw new SectionNotFoundException(name, "No " + name + " section found");
    }
}

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

import java.io.StreamCorruptedException;

/**
 * Thrown when a nested element's declared length does not exactly consume the bytes of its parent, or when data
 * follows the outermost element
 *
 * @author Cinira Crypto Project
 */
public class TruncatedDocumentException extends StreamCorruptedException {
    private static final long serialVersionUID = 6102975583812930154L;

    public TruncatedDocumentException(String message) {
        super(message);
    }
}

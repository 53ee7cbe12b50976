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

package org.cinira.crypto.envelope;

import java.security.GeneralSecurityException;

/**
 * Thrown when decryption fails at the primitive level - wrong key or passphrase, bad padding or undecodable
 * plaintext. The message is always the same so that callers cannot tell which of these happened.
 *
 * @author Cinira Crypto Project
 */
public class DecryptionFailedException extends GeneralSecurityException {
    public static final String DEFAULT_MESSAGE = "Decryption failed";

    private static final long serialVersionUID = -4160727353212961846L;

    public DecryptionFailedException() {
        super(DEFAULT_MESSAGE);
    }
}

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

package org.cinira.crypto.common.util.logging;

import org.cinira.crypto.common.util.GenericUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serves as a common base class for the classes that require some kind of logging
 *
 * @author Cinira Crypto Project
 */
public abstract class AbstractLoggingBean {
    protected final Logger log;

    /**
     * Default constructor - creates a logger using the full class name
     */
    protected AbstractLoggingBean() {
        this((Logger) null);
    }

    /**
     * Create a logger for instances of the same class for which we might want to have a &quot;discriminator&quot; for
     * them
     *
     * @param discriminator The discriminator value - ignored if {@code null} or empty
     */
    protected AbstractLoggingBean(String discriminator) {
        String name = getClass().getName();
        if (GenericUtils.isNotEmpty(discriminator)) {
            name += "[" + discriminator + "]";
        }
        log = LoggerFactory.getLogger(name);
    }

    /**
     * @param logger The {@link Logger} instance to use - if {@code null} then one is retrieved using the full class
     *               name
     */
    protected AbstractLoggingBean(Logger logger) {
        log = (logger == null) ? LoggerFactory.getLogger(getClass()) : logger;
    }

    /**
     * Logs a failure at DEBUG level - the stack trace is included only if TRACE is also enabled
     *
     * @param message The message format
     * @param o1      1st argument
     * @param o2      2nd argument
     * @param t       The failure
     */
    protected void debug(String message, Object o1, Object o2, Throwable t) {
        if (log.isTraceEnabled() && (t != null)) {
            log.debug(message, o1, o2, t);
        } else if (log.isDebugEnabled()) {
            log.debug(message, o1, o2);
        }
    }

    protected void debug(String message, Object o1, Object o2, Object o3, Throwable t) {
        if (log.isTraceEnabled() && (t != null)) {
            log.debug(message, o1, o2, o3, t);
        } else if (log.isDebugEnabled()) {
            log.debug(message, o1, o2, o3);
        }
    }
}

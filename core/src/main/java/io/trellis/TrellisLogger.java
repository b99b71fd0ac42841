/*
 * JBoss, Home of Professional Open Source.
 * Copyright 2024 Red Hat, Inc., and individual contributors
 * as indicated by the @author tags.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */

package io.trellis;

import org.jboss.logging.BasicLogger;
import org.jboss.logging.Logger;
import org.jboss.logging.annotations.Cause;
import org.jboss.logging.annotations.LogMessage;
import org.jboss.logging.annotations.Message;
import org.jboss.logging.annotations.MessageLogger;

import static org.jboss.logging.Logger.Level.DEBUG;
import static org.jboss.logging.Logger.Level.ERROR;

/**
 * log messages start at 5000
 */
@MessageLogger(projectCode = "TRL")
public interface TrellisLogger extends BasicLogger {

    /**
     * Route, catch-all and default handler registration.
     */
    TrellisLogger ROUTING_LOGGER = Logger.getMessageLogger(TrellisLogger.class, TrellisLogger.class.getPackage().getName() + ".routing");
    TrellisLogger REQUEST_LOGGER = Logger.getMessageLogger(TrellisLogger.class, TrellisLogger.class.getPackage().getName() + ".request");

    @LogMessage(level = ERROR)
    @Message(id = 5001, value = "An exception occurred processing the request")
    void exceptionProcessingRequest(@Cause Throwable cause);

    @LogMessage(level = DEBUG)
    @Message(id = 5002, value = "Registered %s for methods %s")
    void routeRegistered(String pattern, Object methods);

    @LogMessage(level = DEBUG)
    @Message(id = 5003, value = "Ignoring registration of an empty path pattern")
    void emptyPatternIgnored();

    @LogMessage(level = DEBUG)
    @Message(id = 5004, value = "Registered catch-all on %s for methods %s")
    void catchAllRegistered(String pattern, Object methods);

    @LogMessage(level = DEBUG)
    @Message(id = 5005, value = "Registered default handler for methods %s")
    void defaultHandlerRegistered(Object methods);
}

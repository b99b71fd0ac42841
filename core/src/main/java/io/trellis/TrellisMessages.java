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

import org.jboss.logging.Messages;
import org.jboss.logging.annotations.Message;
import org.jboss.logging.annotations.MessageBundle;

/**
 * Exception messages. Log messages live in {@link TrellisLogger}.
 */
@MessageBundle(projectCode = "TRL")
public interface TrellisMessages {

    TrellisMessages MESSAGES = Messages.getBundle(TrellisMessages.class);

    @Message(id = 1, value = "Argument %s cannot be null")
    IllegalArgumentException argumentCannotBeNull(final String argument);

    @Message(id = 2, value = "The response has already been started")
    IllegalStateException responseAlreadyStarted();

    @Message(id = 3, value = "Newline not supported in HttpString %s")
    IllegalArgumentException newlineNotSupportedInHttpString(String value);

    @Message(id = 4, value = "Invalid string contents %s")
    IllegalArgumentException invalidHttpStringContents(String value);

    @Message(id = 5, value = "Malformed path pattern %s: segment '%s' has unbalanced braces")
    IllegalArgumentException malformedPathPattern(String pattern, String segment);

    @Message(id = 6, value = "Malformed path pattern %s: parameter name cannot be empty")
    IllegalArgumentException emptyParameterName(String pattern);

    @Message(id = 7, value = "Path pattern %s declares parameter {%s} where {%s} is already registered")
    IllegalArgumentException conflictingPathParameter(String pattern, String name, String existing);

    @Message(id = 8, value = "Path pattern %s has not been registered, a catch-all can only be attached to a registered route")
    IllegalArgumentException patternNotRegistered(String pattern);

    @Message(id = 9, value = "Method set cannot be empty")
    IllegalArgumentException emptyMethodSet();
}

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

package io.trellis.server.routing;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import io.trellis.server.HttpHandler;

/**
 * The outcome of routing one request: exactly one handler, plus the parameters captured for it.
 */
public final class RouteResult {

    /**
     * How the handler was found.
     */
    public enum Outcome {
        /**
         * The request ended at a node with a handler for its method.
         */
        ENDPOINT,
        /**
         * A catch-all of the failure node or of one of its ancestors.
         */
        FALLBACK,
        /**
         * A default handler registered on the router.
         */
        DEFAULT,
        /**
         * The built-in not-found handler.
         */
        NOT_FOUND
    }

    private final HttpHandler handler;
    private final Map<String, String> parameters;
    private final Outcome outcome;
    private final String matchedPattern;

    RouteResult(
            final HttpHandler handler,
            final Map<String, String> parameters,
            final Outcome outcome,
            final String matchedPattern
    ) {
        this.handler = Objects.requireNonNull(handler);
        this.parameters = Collections.unmodifiableMap(parameters);
        this.outcome = Objects.requireNonNull(outcome);
        this.matchedPattern = matchedPattern;
    }

    public HttpHandler getHandler() {
        return handler;
    }

    /**
     * @return the captured parameters in capture order; empty for default and not-found outcomes
     */
    public Map<String, String> getParameters() {
        return parameters;
    }

    public Outcome getOutcome() {
        return outcome;
    }

    /**
     * @return the pattern of the node that served the request, empty for default and not-found outcomes
     */
    public Optional<String> getMatchedPattern() {
        return Optional.ofNullable(matchedPattern);
    }

    @Override
    public String toString() {
        return "RouteResult{" + "outcome=" + outcome + ", matchedPattern=" + matchedPattern + ", parameters=" + parameters + '}';
    }
}

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

import java.util.List;

import io.trellis.TrellisLogger;
import io.trellis.TrellisMessages;
import io.trellis.server.HttpHandler;
import io.trellis.util.MethodSet;

/**
 * The routing trie and its registration operations.
 * <p>
 * Registration builds or extends the chain of nodes named by a pattern (see {@link PathPatternParser} for the syntax)
 * and attaches handlers to the last node of the chain. Every node on the chain has its allowed methods widened by the
 * registered method set. Catch-all registration only annotates nodes that registration has already created.
 * <p>
 * This class is not thread-safe. All registration must happen before the trie is shared with a
 * {@link RouteDispatcher}, or be synchronized externally.
 */
public final class RouteTrie {

    private final RouteNode root = RouteNode.root();

    public RouteNode getRoot() {
        return root;
    }

    /**
     * Registers a handler for a pattern. Registering the same pattern and method again replaces the handler.
     *
     * @param pattern the pattern; the empty pattern is ignored
     * @param methods the methods the handler serves; the any member registers the any-method handler
     * @param handler the handler
     * @return the node the handler was attached to, or {@code null} if the pattern was empty
     * @throws IllegalArgumentException if the pattern is malformed, declares a parameter where a differently named one
     *                                  is registered, or if the method set is empty
     */
    public RouteNode add(final String pattern, final MethodSet methods, final HttpHandler handler) {
        checkArguments(pattern, methods);
        if (handler == null) {
            throw TrellisMessages.MESSAGES.argumentCannotBeNull("handler");
        }
        if (pattern.isEmpty()) {
            TrellisLogger.ROUTING_LOGGER.emptyPatternIgnored();
            return null;
        }

        final List<PathPatternParser.Segment> segments = PathPatternParser.parse(pattern);
        checkParameterNames(pattern, segments);

        RouteNode node = root;
        if (segments.isEmpty()) {
            root.widenAllowedMethods(methods);
        }
        for (PathPatternParser.Segment segment : segments) {
            if (segment.isParameter()) {
                node = node.getOrCreateParameterChild(segment.getValue(), methods);
            } else {
                node = node.getOrCreateLiteralChild(segment.getValue(), methods);
            }
        }
        node.setHandler(methods, handler);
        TrellisLogger.ROUTING_LOGGER.routeRegistered(node.getPattern(), methods);
        return node;
    }

    /**
     * Marks the node of a registered pattern as a catch-all that serves with its own endpoint handler.
     *
     * @param pattern the registered pattern; the empty pattern is ignored
     * @param methods the methods the catch-all applies to
     * @return the node, or {@code null} if the pattern was empty
     * @throws IllegalArgumentException if the pattern has not been registered
     */
    public RouteNode matchAny(final String pattern, final MethodSet methods) {
        return setFallback(pattern, methods, FallbackTarget.OWN_HANDLER);
    }

    /**
     * Attaches an explicit catch-all handler to the node of a registered pattern.
     *
     * @param pattern the registered pattern; the empty pattern is ignored
     * @param methods the methods the catch-all applies to
     * @param handler the catch-all handler
     * @return the node, or {@code null} if the pattern was empty
     * @throws IllegalArgumentException if the pattern has not been registered
     */
    public RouteNode handleAny(final String pattern, final MethodSet methods, final HttpHandler handler) {
        if (handler == null) {
            throw TrellisMessages.MESSAGES.argumentCannotBeNull("handler");
        }
        return setFallback(pattern, methods, FallbackTarget.of(handler));
    }

    /**
     * Looks up the node for a pattern without creating anything.
     *
     * @param pattern the pattern
     * @return the node, or {@code null} if no registration has created it
     */
    public RouteNode find(final String pattern) {
        if (pattern == null) {
            throw TrellisMessages.MESSAGES.argumentCannotBeNull("pattern");
        }
        if (pattern.isEmpty()) {
            return null;
        }
        RouteNode node = root;
        for (PathPatternParser.Segment segment : PathPatternParser.parse(pattern)) {
            if (segment.isParameter()) {
                node = node.getParameterChild();
                if (node != null && !node.getName().equals(segment.getValue())) {
                    return null;
                }
            } else {
                node = node.getLiteralChild(segment.getValue());
            }
            if (node == null) {
                return null;
            }
        }
        return node;
    }

    private RouteNode setFallback(final String pattern, final MethodSet methods, final FallbackTarget target) {
        checkArguments(pattern, methods);
        if (pattern.isEmpty()) {
            TrellisLogger.ROUTING_LOGGER.emptyPatternIgnored();
            return null;
        }
        final RouteNode node = find(pattern);
        if (node == null) {
            throw TrellisMessages.MESSAGES.patternNotRegistered(pattern);
        }
        node.setFallback(methods, target);
        TrellisLogger.ROUTING_LOGGER.catchAllRegistered(node.getPattern(), methods);
        return node;
    }

    private void checkParameterNames(final String pattern, final List<PathPatternParser.Segment> segments) {
        RouteNode node = root;
        for (PathPatternParser.Segment segment : segments) {
            if (segment.isParameter()) {
                final RouteNode existing = node.getParameterChild();
                if (existing != null && !existing.getName().equals(segment.getValue())) {
                    throw TrellisMessages.MESSAGES.conflictingPathParameter(pattern, segment.getValue(), existing.getName());
                }
                node = existing;
            } else {
                node = node.getLiteralChild(segment.getValue());
            }
            if (node == null) {
                return;
            }
        }
    }

    private static void checkArguments(final String pattern, final MethodSet methods) {
        if (pattern == null) {
            throw TrellisMessages.MESSAGES.argumentCannotBeNull("pattern");
        }
        if (methods == null) {
            throw TrellisMessages.MESSAGES.argumentCannotBeNull("methods");
        }
        if (methods.isEmpty()) {
            throw TrellisMessages.MESSAGES.emptyMethodSet();
        }
    }
}

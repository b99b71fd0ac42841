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
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

import io.trellis.TrellisLogger;
import io.trellis.TrellisMessages;
import io.trellis.server.HttpHandler;
import io.trellis.util.HttpString;
import io.trellis.util.MethodSet;

/**
 * Routes request paths through a {@link RouteTrie}.
 *
 * <p>
 * <b>Routing methodology</b>
 *
 * <ol>
 * <li>One leading {@code /} is stripped. An empty path is served by the root. Otherwise the path is split on every
 * {@code /}; a trailing slash gives a final empty segment, which only matches a slash node.</li>
 * <li>Each segment is first looked up among the literal children of the current node. A literal child that does not
 * allow the request method ends the walk with a failure <i>at</i> that child.</li>
 * <li>Otherwise the parameter child is taken if it allows the method, capturing the segment under its name. Empty
 * segments are never captured. If there is no usable parameter child the walk ends with a failure <i>beneath</i> the
 * current node.</li>
 * <li>When all segments are consumed, the handler of the final node for the method (or its any-method handler) serves
 * the request. A final node without one is a failure at that node.</li>
 * </ol>
 *
 * <p>
 * <b>Failure resolution</b>
 *
 * <p>
 * A failure is resolved by the first catch-all found while walking up from the failure node to the root, the failure
 * node included. For a failure at a node, that node's own catch-all is consulted first. Every node on the walk then
 * consults the catch-all of its <i>directory</i> before its own: the root and slash nodes are their own directory, any
 * other node's directory is its slash child. A request beneath {@code /a} is therefore caught by {@code /a/} before
 * {@code /a}. A request that only failed on its trailing slash skips the catch-all of the node it failed beneath, so
 * {@code /a/} is never served by the catch-all of {@code /a} when {@code /a/} is not registered. There is no
 * backtracking into sibling branches.
 * <p>
 * Without a catch-all the default handler for the method is used, then the any-method default, then the not-found
 * handler.
 *
 * <p>
 * Routing never mutates the trie and is safe for concurrent use once registration has finished. Default handlers may
 * be replaced at any time.
 */
public final class RouteDispatcher {

    private final RouteNode root;
    private final HttpHandler notFoundHandler;
    private final Map<HttpString, HttpHandler> defaultHandlers = new ConcurrentHashMap<>();
    private volatile HttpHandler anyMethodDefaultHandler;

    public RouteDispatcher(final RouteTrie trie, final HttpHandler notFoundHandler) {
        this.root = Objects.requireNonNull(trie).getRoot();
        this.notFoundHandler = Objects.requireNonNull(notFoundHandler);
    }

    /**
     * Registers the handler used when a request finds neither a route nor a catch-all.
     *
     * @param methods the methods; the any member sets the any-method default
     * @param handler the handler
     */
    public void setDefaultHandler(final MethodSet methods, final HttpHandler handler) {
        if (methods == null) {
            throw TrellisMessages.MESSAGES.argumentCannotBeNull("methods");
        }
        if (handler == null) {
            throw TrellisMessages.MESSAGES.argumentCannotBeNull("handler");
        }
        for (HttpString method : methods.getMethods()) {
            defaultHandlers.put(method, handler);
        }
        if (methods.isAny()) {
            anyMethodDefaultHandler = handler;
        }
        TrellisLogger.ROUTING_LOGGER.defaultHandlerRegistered(methods);
    }

    public HttpHandler getNotFoundHandler() {
        return notFoundHandler;
    }

    /**
     * Routes a request.
     *
     * @param method the request method
     * @param path   the request path
     * @return the result, never {@code null}
     */
    public RouteResult dispatch(final HttpString method, final String path) {
        if (method == null) {
            throw TrellisMessages.MESSAGES.argumentCannotBeNull("method");
        }
        if (path == null) {
            throw TrellisMessages.MESSAGES.argumentCannotBeNull("path");
        }
        final String relative = path.startsWith("/") ? path.substring(1) : path;
        final Map<String, String> parameters = new LinkedHashMap<>();

        RouteNode node = root;
        if (!relative.isEmpty()) {
            int start = 0;
            while (true) {
                final int end = relative.indexOf('/', start);
                final String segment = end == -1 ? relative.substring(start) : relative.substring(start, end);

                RouteNode next = node.getLiteralChild(segment);
                if (next != null) {
                    if (!next.allows(method)) {
                        return resolveFailure(next, true, false, method, parameters);
                    }
                } else {
                    next = node.getParameterChild();
                    if (next == null || segment.isEmpty() || !next.allows(method)) {
                        return resolveFailure(node, false, end == -1 && segment.isEmpty(), method, parameters);
                    }
                    parameters.put(next.getName(), segment);
                }
                node = next;

                if (end == -1) {
                    break;
                }
                start = end + 1;
            }
        }

        final HttpHandler handler = node.getHandler(method);
        if (handler != null) {
            return new RouteResult(handler, parameters, RouteResult.Outcome.ENDPOINT, node.getPattern());
        }
        return resolveFailure(node, true, false, method, parameters);
    }

    private RouteResult resolveFailure(
            final RouteNode failed,
            final boolean atNode,
            final boolean trailingSlash,
            final HttpString method,
            final Map<String, String> parameters
    ) {
        if (atNode) {
            final HttpHandler handler = failed.getFallbackHandler(method);
            if (handler != null) {
                return new RouteResult(handler, parameters, RouteResult.Outcome.FALLBACK, failed.getPattern());
            }
        }
        RouteNode lastDirectory = atNode ? failed : null;
        for (RouteNode node = failed; node != null; node = node.getParent()) {
            final RouteNode directory = node.getDirectory();
            if (directory != null && directory != lastDirectory) {
                final HttpHandler handler = directory.getFallbackHandler(method);
                if (handler != null) {
                    return new RouteResult(handler, parameters, RouteResult.Outcome.FALLBACK, directory.getPattern());
                }
                lastDirectory = directory;
            }
            if (node == directory || (node == failed && (atNode || trailingSlash))) {
                continue;
            }
            final HttpHandler handler = node.getFallbackHandler(method);
            if (handler != null) {
                return new RouteResult(handler, parameters, RouteResult.Outcome.FALLBACK, node.getPattern());
            }
        }
        return resolveDefault(method);
    }

    private RouteResult resolveDefault(final HttpString method) {
        HttpHandler handler = defaultHandlers.get(method);
        if (handler == null) {
            handler = anyMethodDefaultHandler;
        }
        if (handler != null) {
            return new RouteResult(handler, Collections.emptyMap(), RouteResult.Outcome.DEFAULT, null);
        }
        return new RouteResult(notFoundHandler, Collections.emptyMap(), RouteResult.Outcome.NOT_FOUND, null);
    }
}

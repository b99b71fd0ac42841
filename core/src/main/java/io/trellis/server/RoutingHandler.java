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

package io.trellis.server;

import java.util.Map;

import org.xnio.OptionMap;

import io.trellis.TrellisLogger;
import io.trellis.TrellisOptions;
import io.trellis.server.handlers.ResponseCodeHandler;
import io.trellis.server.routing.RouteDispatcher;
import io.trellis.server.routing.RouteNode;
import io.trellis.server.routing.RouteResult;
import io.trellis.server.routing.RouteTrie;
import io.trellis.util.HttpString;
import io.trellis.util.MethodSet;
import io.trellis.util.Methods;
import io.trellis.util.PathTemplateMatch;

/**
 * A handler that routes requests by path pattern and method through a trie of path segments.
 * <p>
 * Routes are registered with {@link #add(String, MethodSet, HttpHandler)} and its shortcuts. A route that cannot
 * serve a request may be covered by a catch-all ({@link #matchAny(String, MethodSet)} or
 * {@link #handleAny(String, MethodSet, HttpHandler)}), which serves failed requests beneath its directory. Requests
 * that find neither go to the default handler for their method, and finally to the not-found handler. See
 * {@link RouteDispatcher} for the exact rules.
 * <p>
 * Registration is synchronized but must complete before the handler starts serving requests.
 */
public class RoutingHandler implements HttpHandler {

    private final RouteTrie trie = new RouteTrie();
    private final RouteDispatcher dispatcher;

    public RoutingHandler(final OptionMap options) {
        final int notFoundStatus = options.get(TrellisOptions.NOT_FOUND_STATUS, TrellisOptions.DEFAULT_NOT_FOUND_STATUS);
        final HttpHandler notFoundHandler = notFoundStatus == TrellisOptions.DEFAULT_NOT_FOUND_STATUS
                ? ResponseCodeHandler.HANDLE_404
                : new ResponseCodeHandler(notFoundStatus);
        this.dispatcher = new RouteDispatcher(trie, notFoundHandler);
    }

    public RoutingHandler() {
        this(OptionMap.EMPTY);
    }

    @Override
    public void handleRequest(final HttpServerExchange exchange) throws Exception {
        final RouteResult result = dispatcher.dispatch(exchange.getRequestMethod(), exchange.getRelativePath());

        final Map<String, String> parameters = result.getParameters();
        exchange.getPathParameters().putAll(parameters);
        if (result.getMatchedPattern().isPresent()) {
            exchange.putAttachment(PathTemplateMatch.ATTACHMENT_KEY,
                    new PathTemplateMatch(result.getMatchedPattern().get(), parameters));
        }
        if (TrellisLogger.REQUEST_LOGGER.isDebugEnabled()) {
            TrellisLogger.REQUEST_LOGGER.debugf("Routed %s to %s", exchange, result);
        }
        result.getHandler().handleRequest(exchange);
    }

    /**
     * Routes a request without serving it.
     *
     * @param method the request method
     * @param path   the path to route
     * @return the routing result
     */
    public RouteResult route(final HttpString method, final String path) {
        return dispatcher.dispatch(method, path);
    }

    /**
     * @return the root of the routing trie
     */
    public RouteNode getRoot() {
        return trie.getRoot();
    }

    /**
     * Registers a handler for a path pattern.
     *
     * @param pattern the path pattern, the empty pattern is ignored
     * @param methods the methods served by the handler
     * @param handler the handler
     * @return this handler
     */
    public synchronized RoutingHandler add(final String pattern, final MethodSet methods, final HttpHandler handler) {
        trie.add(pattern, methods, handler);
        return this;
    }

    public synchronized RoutingHandler add(final HttpString method, final String pattern, final HttpHandler handler) {
        return add(pattern, MethodSet.of(method), handler);
    }

    public synchronized RoutingHandler add(final String method, final String pattern, final HttpHandler handler) {
        return add(pattern, MethodSet.of(method), handler);
    }

    public synchronized RoutingHandler get(final String pattern, final HttpHandler handler) {
        return add(Methods.GET, pattern, handler);
    }

    public synchronized RoutingHandler post(final String pattern, final HttpHandler handler) {
        return add(Methods.POST, pattern, handler);
    }

    public synchronized RoutingHandler put(final String pattern, final HttpHandler handler) {
        return add(Methods.PUT, pattern, handler);
    }

    public synchronized RoutingHandler delete(final String pattern, final HttpHandler handler) {
        return add(Methods.DELETE, pattern, handler);
    }

    /**
     * Registers a handler for every method, including methods not known in advance.
     */
    public synchronized RoutingHandler all(final String pattern, final HttpHandler handler) {
        return add(pattern, MethodSet.any(), handler);
    }

    /**
     * Makes a registered pattern a catch-all that serves failed requests with its own handler.
     *
     * @param pattern a pattern that has already been registered
     * @param methods the methods the catch-all applies to
     * @return this handler
     * @throws IllegalArgumentException if the pattern has not been registered
     */
    public synchronized RoutingHandler matchAny(final String pattern, final MethodSet methods) {
        trie.matchAny(pattern, methods);
        return this;
    }

    /**
     * Attaches a catch-all handler to a registered pattern.
     *
     * @param pattern a pattern that has already been registered
     * @param methods the methods the catch-all applies to
     * @param handler the catch-all handler
     * @return this handler
     * @throws IllegalArgumentException if the pattern has not been registered
     */
    public synchronized RoutingHandler handleAny(final String pattern, final MethodSet methods, final HttpHandler handler) {
        trie.handleAny(pattern, methods, handler);
        return this;
    }

    /**
     * Sets the handler for requests no route and no catch-all can serve.
     */
    public synchronized RoutingHandler setDefaultHandler(final MethodSet methods, final HttpHandler handler) {
        dispatcher.setDefaultHandler(methods, handler);
        return this;
    }
}

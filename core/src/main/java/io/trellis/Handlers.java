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

import java.io.IOException;
import java.net.InetSocketAddress;

import org.xnio.OptionMap;

import com.sun.net.httpserver.HttpServer;

import io.trellis.server.HttpHandler;
import io.trellis.server.RoutingHandler;
import io.trellis.server.handlers.HttpServerAdapter;
import io.trellis.server.handlers.ResponseCodeHandler;

/**
 * Utility class with convenience methods for dealing with handlers
 */
public class Handlers {

    /**
     *
     * @return a new routing handler
     */
    public static RoutingHandler routing() {
        return new RoutingHandler();
    }

    /**
     * @param options router options, see {@link TrellisOptions#NOT_FOUND_STATUS}
     * @return a new routing handler
     */
    public static RoutingHandler routing(final OptionMap options) {
        return new RoutingHandler(options);
    }

    /**
     * Returns a handler that sets the given response code.
     *
     * @param code the response code
     * @return the handler
     */
    public static ResponseCodeHandler responseCode(final int code) {
        switch (code) {
            case 200:
                return ResponseCodeHandler.HANDLE_200;
            case 403:
                return ResponseCodeHandler.HANDLE_403;
            case 404:
                return ResponseCodeHandler.HANDLE_404;
            case 405:
                return ResponseCodeHandler.HANDLE_405;
            case 500:
                return ResponseCodeHandler.HANDLE_500;
            default:
                return new ResponseCodeHandler(code);
        }
    }

    /**
     * Adapts a handler so it can be registered with a JDK {@link HttpServer}.
     *
     * @param next the handler that serves the requests
     * @return the adapter
     */
    public static HttpServerAdapter jdkServer(final HttpHandler next) {
        return new HttpServerAdapter(next);
    }

    public static HttpServerAdapter jdkServer(final HttpHandler next, final OptionMap options) {
        return new HttpServerAdapter(next, options);
    }

    /**
     * Creates a JDK {@link HttpServer} bound to the address that serves every request path with the handler. The
     * server is returned unstarted.
     *
     * @param address the address to bind, a port of {@code 0} picks a free port
     * @param next    the handler
     * @param options bridge options, see {@link TrellisOptions#DECODE_URL}
     * @return the server
     * @throws IOException if the address cannot be bound
     */
    public static HttpServer server(final InetSocketAddress address, final HttpHandler next, final OptionMap options) throws IOException {
        final HttpServer server = HttpServer.create(address, 0);
        server.createContext("/", jdkServer(next, options));
        return server;
    }

    private Handlers() {

    }
}

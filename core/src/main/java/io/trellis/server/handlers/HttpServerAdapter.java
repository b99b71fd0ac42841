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

package io.trellis.server.handlers;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

import org.xnio.OptionMap;

import com.sun.net.httpserver.HttpExchange;

import io.trellis.TrellisLogger;
import io.trellis.TrellisMessages;
import io.trellis.TrellisOptions;
import io.trellis.server.HttpHandler;
import io.trellis.server.HttpServerExchange;
import io.trellis.util.Methods;
import io.trellis.util.StatusCodes;

/**
 * Serves JDK {@code com.sun.net.httpserver} requests with a {@link HttpHandler}.
 * <p>
 * The response body is buffered until the handler returns, so the handler may set the status code at any point before
 * it writes. A handler that throws produces an empty {@code 500} response, unless it already wrote part of the body, in
 * which case the status it had set is kept.
 */
public class HttpServerAdapter implements com.sun.net.httpserver.HttpHandler {

    private final HttpHandler next;
    private final boolean decodeUrl;

    public HttpServerAdapter(final HttpHandler next, final OptionMap options) {
        if (next == null) {
            throw TrellisMessages.MESSAGES.argumentCannotBeNull("next");
        }
        this.next = next;
        this.decodeUrl = options.get(TrellisOptions.DECODE_URL, true);
    }

    public HttpServerAdapter(final HttpHandler next) {
        this(next, OptionMap.EMPTY);
    }

    @Override
    public void handle(final HttpExchange httpExchange) throws IOException {
        try {
            String path = decodeUrl ? httpExchange.getRequestURI().getPath() : httpExchange.getRequestURI().getRawPath();
            if (path == null || path.isEmpty()) {
                path = "/";
            }
            final ByteArrayOutputStream body = new ByteArrayOutputStream();
            final HttpServerExchange exchange = new HttpServerExchange(
                    Methods.fromString(httpExchange.getRequestMethod()), path, body);

            int status;
            try {
                next.handleRequest(exchange);
                status = exchange.getStatusCode();
            } catch (Exception e) {
                TrellisLogger.REQUEST_LOGGER.exceptionProcessingRequest(e);
                status = exchange.isResponseStarted() ? exchange.getStatusCode() : StatusCodes.INTERNAL_SERVER_ERROR;
            }

            final byte[] data = body.toByteArray();
            // an unread request body makes the server drop the connection after the response
            try (InputStream in = httpExchange.getRequestBody()) {
                in.transferTo(OutputStream.nullOutputStream());
            }
            httpExchange.sendResponseHeaders(status, data.length == 0 ? -1 : data.length);
            if (data.length > 0) {
                try (OutputStream out = httpExchange.getResponseBody()) {
                    out.write(data);
                }
            }
        } finally {
            httpExchange.close();
        }
    }

    @Override
    public String toString() {
        return "jdk-server( " + next + " )";
    }
}

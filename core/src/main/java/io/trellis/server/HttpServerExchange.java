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

import java.io.IOException;
import java.io.OutputStream;
import java.util.LinkedHashMap;
import java.util.Map;

import io.trellis.TrellisMessages;
import io.trellis.io.BlockingSenderImpl;
import io.trellis.io.Sender;
import io.trellis.util.AbstractAttachable;
import io.trellis.util.HttpString;
import io.trellis.util.StatusCodes;

/**
 * A request/response exchange as seen by routed handlers.
 * <p>
 * The exchange carries the request method and path, the parameters captured while routing, and the means to produce
 * a response: a status code and a body stream. The response is considered started once the first byte is written to
 * the body, after which the status code can no longer change.
 * <p>
 * Exchanges are confined to the thread handling the request and are not thread-safe.
 */
public final class HttpServerExchange extends AbstractAttachable {

    private final HttpString requestMethod;
    private final String requestPath;
    private String relativePath;

    /**
     * Path parameters in capture order.
     */
    private final Map<String, String> pathParameters = new LinkedHashMap<>();

    private final ResponseStream responseStream;
    private Sender sender;
    private int statusCode = StatusCodes.OK;

    public HttpServerExchange(final HttpString requestMethod, final String requestPath, final OutputStream responseBody) {
        if (requestMethod == null) {
            throw TrellisMessages.MESSAGES.argumentCannotBeNull("requestMethod");
        }
        if (requestPath == null) {
            throw TrellisMessages.MESSAGES.argumentCannotBeNull("requestPath");
        }
        if (responseBody == null) {
            throw TrellisMessages.MESSAGES.argumentCannotBeNull("responseBody");
        }
        this.requestMethod = requestMethod;
        this.requestPath = requestPath;
        this.relativePath = requestPath;
        this.responseStream = new ResponseStream(responseBody);
    }

    public HttpString getRequestMethod() {
        return requestMethod;
    }

    /**
     * @return the full request path, as received
     */
    public String getRequestPath() {
        return requestPath;
    }

    /**
     * Get the request path relative to the handler that is currently routing it. Routers match against this path.
     *
     * @return the relative path
     */
    public String getRelativePath() {
        return relativePath;
    }

    public HttpServerExchange setRelativePath(final String relativePath) {
        this.relativePath = relativePath;
        return this;
    }

    /**
     * Returns a mutable map of path parameters. The router fills it with the parameters captured on the way to the
     * handler that serves the request; it is empty (never {@code null}) when nothing was captured.
     *
     * @return The path parameters
     */
    public Map<String, String> getPathParameters() {
        return pathParameters;
    }

    /**
     * @return the parameter captured under the given name, or {@code null}
     */
    public String getPathParameter(final String name) {
        return pathParameters.get(name);
    }

    public int getStatusCode() {
        return statusCode;
    }

    /**
     * Change the status code for this response.  If not specified, the code will be a {@code 200}.
     *
     * @param statusCode the new code
     * @throws IllegalStateException if part of the response body was already written
     */
    public HttpServerExchange setStatusCode(final int statusCode) {
        if (responseStream.started) {
            throw TrellisMessages.MESSAGES.responseAlreadyStarted();
        }
        this.statusCode = statusCode;
        return this;
    }

    /**
     * @return {@code true} once any part of the response body has been written
     */
    public boolean isResponseStarted() {
        return responseStream.started;
    }

    /**
     * @return the response body stream
     */
    public OutputStream getOutputStream() {
        return responseStream;
    }

    /**
     * @return a sender that writes to the response body
     */
    public Sender getResponseSender() {
        if (sender == null) {
            sender = new BlockingSenderImpl(responseStream);
        }
        return sender;
    }

    @Override
    public String toString() {
        return "HttpServerExchange{ " + requestMethod + " " + requestPath + '}';
    }

    private static final class ResponseStream extends OutputStream {

        private final OutputStream delegate;
        private boolean started;

        private ResponseStream(final OutputStream delegate) {
            this.delegate = delegate;
        }

        @Override
        public void write(final int b) throws IOException {
            started = true;
            delegate.write(b);
        }

        @Override
        public void write(final byte[] b, final int off, final int len) throws IOException {
            if (len > 0) {
                started = true;
            }
            delegate.write(b, off, len);
        }

        @Override
        public void flush() throws IOException {
            delegate.flush();
        }

        @Override
        public void close() throws IOException {
            delegate.close();
        }
    }
}

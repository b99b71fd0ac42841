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

import io.trellis.server.HttpHandler;
import io.trellis.util.HttpString;

/**
 * A catch-all entry stored on a route node. An absent entry is represented by the absence of a
 * {@code FallbackTarget}; a present entry either points at the node's own endpoint handler or at an explicit handler.
 */
public final class FallbackTarget {

    /**
     * Serve the request with the endpoint handler the node has for the request method.
     */
    public static final FallbackTarget OWN_HANDLER = new FallbackTarget(null);

    private final HttpHandler handler;

    private FallbackTarget(final HttpHandler handler) {
        this.handler = handler;
    }

    public static FallbackTarget of(final HttpHandler handler) {
        if (handler == null) {
            return OWN_HANDLER;
        }
        return new FallbackTarget(handler);
    }

    public boolean isOwnHandler() {
        return this == OWN_HANDLER;
    }

    /**
     * @param node   the node this entry is stored on
     * @param method the request method
     * @return the handler this entry resolves to, or {@code null} if it points at an endpoint handler the node does not
     * have
     */
    HttpHandler resolve(final RouteNode node, final HttpString method) {
        if (isOwnHandler()) {
            return node.getHandler(method);
        }
        return handler;
    }

    @Override
    public String toString() {
        return isOwnHandler() ? "FallbackTarget{own-handler}" : "FallbackTarget{" + handler + '}';
    }
}

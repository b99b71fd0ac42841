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

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.Assert;
import org.junit.Test;
import org.junit.experimental.categories.Category;
import org.xnio.OptionMap;

import io.trellis.Handlers;
import io.trellis.TrellisOptions;
import io.trellis.testutils.category.UnitTest;
import io.trellis.util.MethodSet;
import io.trellis.util.Methods;
import io.trellis.util.PathTemplateMatch;
import io.trellis.util.StatusCodes;

@Category(UnitTest.class)
public class RoutingHandlerTestCase {

    @Test
    public void testConvenienceMethods() throws Exception {
        RoutingHandler handler = Handlers.routing()
                .get("/bar", send("GET bar"))
                .put("/bar", send("PUT bar"))
                .post("/bar", send("POST bar"))
                .delete("/bar", send("DELETE bar"))
                .add("PATCH", "/bar", send("PATCH bar"));

        Assert.assertEquals("GET bar", serve(handler, "GET", "/bar").body);
        Assert.assertEquals("PUT bar", serve(handler, "PUT", "/bar").body);
        Assert.assertEquals("POST bar", serve(handler, "POST", "/bar").body);
        Assert.assertEquals("DELETE bar", serve(handler, "DELETE", "/bar").body);
        Assert.assertEquals("PATCH bar", serve(handler, "PATCH", "/bar").body);

        Result result = serve(handler, "OPTIONS", "/bar");
        Assert.assertEquals(StatusCodes.NOT_FOUND, result.status);
        Assert.assertEquals("", result.body);
    }

    @Test
    public void testAllMatchesUnknownMethods() throws Exception {
        RoutingHandler handler = Handlers.routing().all("/any", send("any"));
        Assert.assertEquals("any", serve(handler, "PROPFIND", "/any").body);
    }

    @Test
    public void testParametersAndMatchAttachment() throws Exception {
        final AtomicReference<PathTemplateMatch> match = new AtomicReference<>();
        RoutingHandler handler = Handlers.routing()
                .get("/slug2/{slug2.1}/slug2.1.1", new HttpHandler() {
                    @Override
                    public void handleRequest(HttpServerExchange exchange) throws Exception {
                        match.set(exchange.getAttachment(PathTemplateMatch.ATTACHMENT_KEY));
                        exchange.getResponseSender().send("GET /slug2/" + exchange.getPathParameter("slug2.1") + "/slug2.1.1");
                    }
                });

        Assert.assertEquals("GET /slug2/SOMETHING/slug2.1.1", serve(handler, "GET", "/slug2/SOMETHING/slug2.1.1").body);
        Assert.assertEquals("/slug2/{slug2.1}/slug2.1.1", match.get().getMatchedTemplate());
        Assert.assertEquals(Collections.singletonMap("slug2.1", "SOMETHING"), match.get().getParameters());
    }

    @Test
    public void testNotFoundHasNoMatchAttachment() throws Exception {
        final AtomicReference<HttpServerExchange> seen = new AtomicReference<>();
        RoutingHandler handler = Handlers.routing()
                .get("/users/{id}/profile", send("profile"))
                .setDefaultHandler(MethodSet.any(), new HttpHandler() {
                    @Override
                    public void handleRequest(HttpServerExchange exchange) throws Exception {
                        seen.set(exchange);
                        exchange.setStatusCode(StatusCodes.METHOD_NOT_ALLOWED);
                    }
                });

        Assert.assertEquals(StatusCodes.METHOD_NOT_ALLOWED, serve(handler, "GET", "/users/3/other").status);
        Assert.assertNull(seen.get().getAttachment(PathTemplateMatch.ATTACHMENT_KEY));
        Assert.assertTrue(seen.get().getPathParameters().isEmpty());
    }

    @Test
    public void testCatchAllRegistration() throws Exception {
        RoutingHandler handler = Handlers.routing()
                .get("/docs/", send("docs index"))
                .matchAny("/docs/", MethodSet.get())
                .get("/api/", send("api"))
                .handleAny("/api/", MethodSet.any(), send("no such api"));

        Assert.assertEquals("docs index", serve(handler, "GET", "/docs/intro/setup").body);
        Assert.assertEquals(StatusCodes.NOT_FOUND, serve(handler, "POST", "/docs/intro").status);
        Assert.assertEquals("no such api", serve(handler, "DELETE", "/api/v9/thing").body);
    }

    @Test
    public void testRoutesOnRelativePath() throws Exception {
        RoutingHandler handler = Handlers.routing().get("/inner", send("inner"));
        HttpServerExchange exchange = new HttpServerExchange(Methods.GET, "/outer/inner", new ByteArrayOutputStream());
        exchange.setRelativePath("/inner");
        handler.handleRequest(exchange);
        Assert.assertEquals(StatusCodes.OK, exchange.getStatusCode());
        Assert.assertEquals("/outer/inner", exchange.getRequestPath());
    }

    @Test
    public void testNotFoundStatusOption() throws Exception {
        RoutingHandler handler = Handlers.routing(OptionMap.create(TrellisOptions.NOT_FOUND_STATUS, StatusCodes.FORBIDDEN))
                .get("/a", send("a"));
        Assert.assertEquals(StatusCodes.FORBIDDEN, serve(handler, "GET", "/b").status);
        Assert.assertEquals(StatusCodes.OK, serve(handler, "GET", "/a").status);
    }

    @Test
    public void testRouteWithoutServing() {
        RoutingHandler handler = Handlers.routing().get("/a/{b}", send("a"));
        Assert.assertEquals("x", handler.route(Methods.GET, "/a/x").getParameters().get("b"));
        Assert.assertTrue(handler.getRoot().getLiteralChildren().containsKey("a"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testCatchAllOnUnregisteredPattern() {
        Handlers.routing().matchAny("/nothing", MethodSet.any());
    }

    private static HttpHandler send(final String body) {
        return new HttpHandler() {
            @Override
            public void handleRequest(HttpServerExchange exchange) throws Exception {
                exchange.getResponseSender().send(body);
            }
        };
    }

    private static Result serve(final HttpHandler handler, final String method, final String path) throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        HttpServerExchange exchange = new HttpServerExchange(Methods.fromString(method), path, out);
        handler.handleRequest(exchange);
        return new Result(exchange.getStatusCode(), new String(out.toByteArray(), StandardCharsets.UTF_8));
    }

    private static final class Result {
        private final int status;
        private final String body;

        private Result(final int status, final String body) {
            this.status = status;
            this.body = body;
        }
    }
}

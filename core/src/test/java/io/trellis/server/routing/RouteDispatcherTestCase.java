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

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.junit.experimental.categories.Category;

import io.trellis.server.HttpHandler;
import io.trellis.server.HttpServerExchange;
import io.trellis.server.handlers.ResponseCodeHandler;
import io.trellis.testutils.category.UnitTest;
import io.trellis.util.HttpString;
import io.trellis.util.MethodSet;
import io.trellis.util.Methods;

@Category(UnitTest.class)
public class RouteDispatcherTestCase {

    private RouteTrie trie;
    private RouteDispatcher dispatcher;

    @Before
    public void setup() {
        trie = new RouteTrie();
        dispatcher = new RouteDispatcher(trie, ResponseCodeHandler.HANDLE_404);
    }

    @Test
    public void testRoot() {
        HttpHandler root = named("root");
        trie.add("/", MethodSet.get(), root);
        assertEndpoint(root, Methods.GET, "/");
        assertEndpoint(root, Methods.GET, "");
    }

    @Test
    public void testSlashSuffixedRoutesAreDistinct() {
        HttpHandler a = named("A");
        HttpHandler b = named("B");
        trie.add("/slug1", MethodSet.get(), a);
        trie.add("/slug1/", MethodSet.get(), b);
        assertEndpoint(a, Methods.GET, "/slug1");
        assertEndpoint(b, Methods.GET, "/slug1/");
    }

    @Test
    public void testParameterCapture() {
        HttpHandler handler = named("slug2");
        trie.add("/slug2/{id}", MethodSet.get(), handler);

        RouteResult result = assertEndpoint(handler, Methods.GET, "/slug2/abc");
        Assert.assertEquals(Collections.singletonMap("id", "abc"), result.getParameters());
        Assert.assertEquals("/slug2/{id}", result.getMatchedPattern().get());
    }

    @Test
    public void testCapturesAreInOrder() {
        HttpHandler handler = named("comment");
        trie.add("/posts/{post}/comments/{comment}", MethodSet.get(), handler);

        RouteResult result = assertEndpoint(handler, Methods.GET, "/posts/7/comments/42");
        Map<String, String> expected = new LinkedHashMap<>();
        expected.put("post", "7");
        expected.put("comment", "42");
        Assert.assertEquals(expected, result.getParameters());
        Assert.assertArrayEquals(new Object[] {"post", "comment"}, result.getParameters().keySet().toArray());
    }

    @Test
    public void testParameterNeverCapturesEmptySegment() {
        trie.add("/a/{id}", MethodSet.get(), named("id"));
        RouteResult result = dispatcher.dispatch(Methods.GET, "/a/");
        Assert.assertEquals(RouteResult.Outcome.NOT_FOUND, result.getOutcome());
    }

    @Test
    public void testWildcardCatchAllUnderSlashNode() {
        HttpHandler endpoint = named("fallback/");
        HttpHandler catchAll = named("catch-all");
        trie.add("/fallback/", MethodSet.get(), endpoint);
        trie.handleAny("/fallback/", MethodSet.any(), catchAll);

        RouteResult result = dispatcher.dispatch(Methods.GET, "/fallback/x/y");
        Assert.assertEquals(RouteResult.Outcome.FALLBACK, result.getOutcome());
        Assert.assertSame(catchAll, result.getHandler());
        Assert.assertEquals("/fallback/", result.getMatchedPattern().get());

        for (HttpString method : new HttpString[] {Methods.POST, Methods.DELETE, Methods.fromString("PROPFIND")}) {
            Assert.assertSame(method.toString(), catchAll, dispatcher.dispatch(method, "/fallback/x").getHandler());
        }
        assertEndpoint(endpoint, Methods.GET, "/fallback/");
    }

    @Test
    public void testMethodNotAllowedWithoutDefaultIsNotFound() {
        trie.add("/a", MethodSet.get(), named("a"));
        RouteResult result = dispatcher.dispatch(Methods.POST, "/a");
        Assert.assertEquals(RouteResult.Outcome.NOT_FOUND, result.getOutcome());
        Assert.assertSame(ResponseCodeHandler.HANDLE_404, result.getHandler());
        Assert.assertTrue(result.getParameters().isEmpty());
        Assert.assertFalse(result.getMatchedPattern().isPresent());
    }

    @Test
    public void testFailureBelowParameterWithoutCatchAll() {
        HttpHandler fixed = named("fixed");
        trie.add("/slug2/{id}/fixed", MethodSet.get(), fixed);

        RouteResult result = assertEndpoint(fixed, Methods.GET, "/slug2/v1/fixed");
        Assert.assertEquals("v1", result.getParameters().get("id"));

        Assert.assertEquals(RouteResult.Outcome.NOT_FOUND, dispatcher.dispatch(Methods.GET, "/slug2/v1/other").getOutcome());
        Assert.assertEquals(RouteResult.Outcome.NOT_FOUND, dispatcher.dispatch(Methods.GET, "/slug2/v1").getOutcome());
    }

    @Test
    public void testSlashNodeCatchesRequestsBeneathPlainNode() {
        HttpHandler plain = named("/fallback-slash");
        HttpHandler slash = named("/fallback-slash/");
        trie.add("/fallback-slash", MethodSet.get(), plain);
        trie.matchAny("/fallback-slash", MethodSet.get());
        trie.add("/fallback-slash/", MethodSet.get(), slash);
        trie.matchAny("/fallback-slash/", MethodSet.get());

        assertEndpoint(plain, Methods.GET, "/fallback-slash");
        assertEndpoint(slash, Methods.GET, "/fallback-slash/");
        assertFallback(slash, Methods.GET, "/fallback-slash/failing");
        assertFallback(slash, Methods.GET, "/fallback-slash/failing/deeper");
        assertFallback(slash, Methods.GET, "/fallback-slash//failing");
    }

    @Test
    public void testStructuralNodeUsesItsSlashChild() {
        HttpHandler slash = named("/fallback-slash2/");
        trie.add("/fallback-slash2/", MethodSet.get(), slash);
        trie.matchAny("/fallback-slash2/", MethodSet.get());

        assertEndpoint(slash, Methods.GET, "/fallback-slash2/");
        assertFallback(slash, Methods.GET, "/fallback-slash2");
    }

    @Test
    public void testPlainNodeCatchAllCoversRequestsBeneathButNotItsSlashPath() {
        HttpHandler rootCatchAll = named("root-catch-all");
        HttpHandler plain = named("/fallback-slash3");
        trie.add("/", MethodSet.get(), named("root"));
        trie.handleAny("/", MethodSet.get(), rootCatchAll);
        trie.add("/fallback-slash3", MethodSet.get(), plain);
        trie.matchAny("/fallback-slash3", MethodSet.get());

        assertEndpoint(plain, Methods.GET, "/fallback-slash3");
        assertFallback(rootCatchAll, Methods.GET, "/fallback-slash3/");
        assertFallback(plain, Methods.GET, "/fallback-slash3/x");
    }

    @Test
    public void testCatchAllOnPlainNode() {
        HttpHandler api = named("api");
        HttpHandler apiAny = named("api-any");
        trie.add("/api", MethodSet.get(), api);
        trie.handleAny("/api", MethodSet.any(), apiAny);

        assertEndpoint(api, Methods.GET, "/api");
        RouteResult result = assertFallback(apiAny, Methods.GET, "/api/x");
        Assert.assertEquals("/api", result.getMatchedPattern().get());
        result = assertFallback(apiAny, Methods.POST, "/api/x");
        Assert.assertEquals("/api", result.getMatchedPattern().get());
        // a trailing slash alone is not beneath /api
        Assert.assertEquals(RouteResult.Outcome.NOT_FOUND, dispatcher.dispatch(Methods.GET, "/api/").getOutcome());
    }

    @Test
    public void testCatchAllOnParameterNode() {
        HttpHandler slugAny = named("slug-any");
        trie.add("/slug2/{id}", MethodSet.get(), named("slug"));
        trie.handleAny("/slug2/{id}", MethodSet.any(), slugAny);

        RouteResult result = assertFallback(slugAny, Methods.GET, "/slug2/v1/other");
        Assert.assertEquals(Collections.singletonMap("id", "v1"), result.getParameters());
        Assert.assertEquals("/slug2/{id}", result.getMatchedPattern().get());
    }

    @Test
    public void testSlashChildCatchAllBeatsPlainNodeCatchAll() {
        HttpHandler plainAny = named("plain-any");
        HttpHandler slashAny = named("slash-any");
        trie.add("/docs", MethodSet.get(), named("docs"));
        trie.add("/docs/", MethodSet.get(), named("docs/"));
        trie.handleAny("/docs", MethodSet.any(), plainAny);
        trie.handleAny("/docs/", MethodSet.any(), slashAny);

        assertFallback(slashAny, Methods.GET, "/docs/missing");
        assertFallback(plainAny, Methods.POST, "/docs");
    }

    @Test
    public void testOwnCatchAllServesMethodRejectedAtNode() {
        HttpHandler any = named("any");
        trie.add("/a", MethodSet.of(Methods.GET, Methods.POST), named("a"));
        trie.add("/a/b", MethodSet.get(), named("b"));
        trie.handleAny("/a/b", MethodSet.any(), any);

        assertFallback(any, Methods.POST, "/a/b");
        // rejected before reaching /a/b
        Assert.assertEquals(RouteResult.Outcome.NOT_FOUND, dispatcher.dispatch(Methods.PUT, "/a/b").getOutcome());
    }

    @Test
    public void testCatchAllReceivesCapturesSoFar() {
        HttpHandler catchAll = named("catch-all");
        trie.add("/users/{id}/", MethodSet.get(), named("user/"));
        trie.handleAny("/users/{id}/", MethodSet.get(), catchAll);

        RouteResult result = assertFallback(catchAll, Methods.GET, "/users/42/unknown/path");
        Assert.assertEquals(Collections.singletonMap("id", "42"), result.getParameters());
        Assert.assertEquals("/users/{id}/", result.getMatchedPattern().get());
    }

    @Test
    public void testNearestCatchAllWins() {
        HttpHandler outer = named("outer");
        HttpHandler inner = named("inner");
        trie.add("/a/", MethodSet.get(), named("a/"));
        trie.add("/a/b/", MethodSet.get(), named("a/b/"));
        trie.handleAny("/a/", MethodSet.get(), outer);
        trie.handleAny("/a/b/", MethodSet.get(), inner);

        assertFallback(inner, Methods.GET, "/a/b/c");
        assertFallback(outer, Methods.GET, "/a/c");
    }

    @Test
    public void testMethodSpecificCatchAllBeatsAnyMethodEntry() {
        HttpHandler forGet = named("get");
        HttpHandler forAny = named("any");
        trie.add("/", MethodSet.get(), named("root"));
        trie.handleAny("/", MethodSet.any(), forAny);
        trie.handleAny("/", MethodSet.get(), forGet);

        assertFallback(forGet, Methods.GET, "/missing");
        assertFallback(forAny, Methods.POST, "/missing");
    }

    @Test
    public void testNoBacktrackingIntoParameterSibling() {
        HttpHandler byId = named("by-id");
        trie.add("/items/new", MethodSet.post(), named("new"));
        trie.add("/items/{id}", MethodSet.get(), byId);

        assertEndpoint(byId, Methods.GET, "/items/17");
        Assert.assertEquals(RouteResult.Outcome.NOT_FOUND, dispatcher.dispatch(Methods.GET, "/items/new").getOutcome());
    }

    @Test
    public void testParameterChildFilteredByMethod() {
        trie.add("/items/{id}", MethodSet.get(), named("by-id"));
        Assert.assertEquals(RouteResult.Outcome.NOT_FOUND, dispatcher.dispatch(Methods.DELETE, "/items/17").getOutcome());
    }

    @Test
    public void testAnyMethodEndpoint() {
        HttpHandler handler = named("all");
        trie.add("/all", MethodSet.any(), handler);
        assertEndpoint(handler, Methods.GET, "/all");
        assertEndpoint(handler, Methods.fromString("PROPFIND"), "/all");
    }

    @Test
    public void testMethodsAreCaseInsensitive() {
        HttpHandler handler = named("get");
        trie.add("/a", MethodSet.of("get"), handler);
        assertEndpoint(handler, new HttpString("GET"), "/a");
    }

    @Test
    public void testDefaultHandlers() {
        HttpHandler getDefault = named("get-default");
        HttpHandler anyDefault = named("any-default");
        trie.add("/a", MethodSet.get(), named("a"));
        dispatcher.setDefaultHandler(MethodSet.get(), getDefault);

        RouteResult result = dispatcher.dispatch(Methods.GET, "/missing");
        Assert.assertEquals(RouteResult.Outcome.DEFAULT, result.getOutcome());
        Assert.assertSame(getDefault, result.getHandler());
        Assert.assertEquals(RouteResult.Outcome.NOT_FOUND, dispatcher.dispatch(Methods.POST, "/a").getOutcome());

        dispatcher.setDefaultHandler(MethodSet.any(), anyDefault);
        Assert.assertSame(anyDefault, dispatcher.dispatch(Methods.POST, "/a").getHandler());
        Assert.assertSame(getDefault, dispatcher.dispatch(Methods.GET, "/missing").getHandler());
    }

    @Test
    public void testDefaultHandlerDoesNotReceiveCaptures() {
        HttpHandler fallback = named("default");
        trie.add("/users/{id}/profile", MethodSet.get(), named("profile"));
        dispatcher.setDefaultHandler(MethodSet.get(), fallback);

        RouteResult result = dispatcher.dispatch(Methods.GET, "/users/42/settings");
        Assert.assertSame(fallback, result.getHandler());
        Assert.assertTrue(result.getParameters().isEmpty());
    }

    @Test
    public void testEveryResultIsDistinctCaptureMap() {
        trie.add("/a/{id}", MethodSet.get(), named("a"));
        RouteResult first = dispatcher.dispatch(Methods.GET, "/a/1");
        RouteResult second = dispatcher.dispatch(Methods.GET, "/a/2");
        Assert.assertEquals("1", first.getParameters().get("id"));
        Assert.assertEquals("2", second.getParameters().get("id"));
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testCapturesAreReadOnly() {
        trie.add("/a/{id}", MethodSet.get(), named("a"));
        dispatcher.dispatch(Methods.GET, "/a/1").getParameters().put("id", "2");
    }

    private RouteResult assertEndpoint(final HttpHandler expected, final HttpString method, final String path) {
        RouteResult result = dispatcher.dispatch(method, path);
        Assert.assertEquals(path, RouteResult.Outcome.ENDPOINT, result.getOutcome());
        Assert.assertSame(path, expected, result.getHandler());
        return result;
    }

    private RouteResult assertFallback(final HttpHandler expected, final HttpString method, final String path) {
        RouteResult result = dispatcher.dispatch(method, path);
        Assert.assertEquals(path, RouteResult.Outcome.FALLBACK, result.getOutcome());
        Assert.assertSame(path, expected, result.getHandler());
        return result;
    }

    private static HttpHandler named(final String name) {
        return new HttpHandler() {
            @Override
            public void handleRequest(final HttpServerExchange exchange) throws Exception {
                exchange.getResponseSender().send(name);
            }

            @Override
            public String toString() {
                return name;
            }
        };
    }
}

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
import java.util.HashMap;
import java.util.Map;

import io.trellis.server.HttpHandler;
import io.trellis.util.HttpString;
import io.trellis.util.MethodSet;

/**
 * One node of the routing trie, standing for a fixed sequence of segments from the root.
 * <p>
 * Nodes are created by {@link RouteTrie} while patterns are registered and are never removed. Literal children are
 * keyed by their segment text; the slash child (created by an empty segment) is keyed by {@link #SLASH}, which no real
 * segment text can equal. The parameter child, if any, is held apart from the literal children so that it is only
 * tried once the literal lookup has failed.
 * <p>
 * The parent link is only followed by fallback resolution.
 */
public final class RouteNode {

    /**
     * Child key and name of slash nodes.
     */
    static final String SLASH = "";

    private final RouteNode parent;
    private final String name;
    private final boolean parameter;
    private final MethodSet allowedMethods;

    private final Map<HttpString, HttpHandler> handlers = new HashMap<>();
    private HttpHandler anyMethodHandler;

    private final Map<HttpString, FallbackTarget> fallbacks = new HashMap<>();
    private FallbackTarget anyMethodFallback;

    private final Map<String, RouteNode> children = new HashMap<>();
    private RouteNode parameterChild;

    private RouteNode(final RouteNode parent, final String name, final boolean parameter, final MethodSet allowedMethods) {
        this.parent = parent;
        this.name = name;
        this.parameter = parameter;
        this.allowedMethods = allowedMethods;
    }

    static RouteNode root() {
        return new RouteNode(null, SLASH, false, new MethodSet());
    }

    public RouteNode getParent() {
        return parent;
    }

    /**
     * @return the literal segment text, the parameter name, or the empty string for the root and slash nodes
     */
    public String getName() {
        return name;
    }

    public boolean isParameter() {
        return parameter;
    }

    public boolean isRoot() {
        return parent == null;
    }

    public boolean isSlash() {
        return parent != null && !parameter && SLASH.equals(name);
    }

    /**
     * @return a copy of the methods accepted by requests that pass through or end at this node
     */
    public MethodSet getAllowedMethods() {
        return allowedMethods.copy();
    }

    boolean allows(final HttpString method) {
        return allowedMethods.containsOrAny(method);
    }

    /**
     * @return {@code true} if any handler is attached directly to this node
     */
    public boolean isEndpoint() {
        return anyMethodHandler != null || !handlers.isEmpty();
    }

    /**
     * @param method the request method
     * @return the handler registered for the method, else the any-method handler, else {@code null}
     */
    public HttpHandler getHandler(final HttpString method) {
        final HttpHandler handler = handlers.get(method);
        if (handler != null) {
            return handler;
        }
        return anyMethodHandler;
    }

    /**
     * Resolves the catch-all of this node for the method. The entry for the method is preferred over the any-method
     * entry.
     *
     * @param method the request method
     * @return the resolved handler, or {@code null}
     */
    public HttpHandler getFallbackHandler(final HttpString method) {
        FallbackTarget target = fallbacks.get(method);
        if (target == null) {
            target = anyMethodFallback;
        }
        if (target == null) {
            return null;
        }
        return target.resolve(this, method);
    }

    RouteNode getLiteralChild(final String segment) {
        return children.get(segment);
    }

    RouteNode getParameterChild() {
        return parameterChild;
    }

    public Map<String, RouteNode> getLiteralChildren() {
        return Collections.unmodifiableMap(children);
    }

    /**
     * The node whose catch-all covers requests that fail beneath this node: the node itself for the root and for slash
     * nodes, otherwise its slash child.
     *
     * @return the directory node, or {@code null} if this node has no slash child
     */
    RouteNode getDirectory() {
        if (isRoot() || isSlash()) {
            return this;
        }
        return children.get(SLASH);
    }

    /**
     * @return the pattern this node was registered under, with parameters written as {@code {name}}
     */
    public String getPattern() {
        if (isRoot()) {
            return "/";
        }
        final String segment = parameter ? "{" + name + "}" : name;
        if (parent.isRoot()) {
            return "/" + segment;
        }
        return parent.getPattern() + "/" + segment;
    }

    RouteNode getOrCreateLiteralChild(final String segment, final MethodSet methods) {
        RouteNode child = children.get(segment);
        if (child == null) {
            child = new RouteNode(this, segment, false, methods.copy());
            children.put(segment, child);
        } else {
            child.allowedMethods.addAll(methods);
        }
        return child;
    }

    /**
     * Callers check the name against an existing parameter child first; a node has at most one.
     */
    RouteNode getOrCreateParameterChild(final String parameterName, final MethodSet methods) {
        if (parameterChild == null) {
            parameterChild = new RouteNode(this, parameterName, true, methods.copy());
        } else {
            parameterChild.allowedMethods.addAll(methods);
        }
        return parameterChild;
    }

    void widenAllowedMethods(final MethodSet methods) {
        allowedMethods.addAll(methods);
    }

    void setHandler(final MethodSet methods, final HttpHandler handler) {
        for (HttpString method : methods.getMethods()) {
            handlers.put(method, handler);
        }
        if (methods.isAny()) {
            anyMethodHandler = handler;
        }
    }

    void setFallback(final MethodSet methods, final FallbackTarget target) {
        for (HttpString method : methods.getMethods()) {
            fallbacks.put(method, target);
        }
        if (methods.isAny()) {
            anyMethodFallback = target;
        }
    }

    @Override
    public String toString() {
        return "RouteNode{" + getPattern() + " " + allowedMethods + '}';
    }
}

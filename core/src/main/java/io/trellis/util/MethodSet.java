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

package io.trellis.util;

import java.util.Collections;
import java.util.HashSet;
import java.util.Set;
import java.util.TreeSet;

import io.trellis.TrellisMessages;

/**
 * A set of request methods.
 * <p>
 * Besides named methods the set can hold the <i>any method</i> member. The any member is a flag rather than a
 * method name, so no request method can ever collide with it. When it is present {@link #containsOrAny(HttpString)}
 * returns {@code true} for every probe.
 * <p>
 * Instances are mutable and not thread-safe. Routes take a {@link #copy()} of the set they are registered with.
 */
public final class MethodSet {

    private final Set<HttpString> methods;
    private boolean any;

    public MethodSet() {
        this.methods = new HashSet<>();
    }

    private MethodSet(final Set<HttpString> methods, final boolean any) {
        this.methods = new HashSet<>(methods);
        this.any = any;
    }

    public static MethodSet of(final HttpString... methods) {
        final MethodSet result = new MethodSet();
        for (HttpString method : methods) {
            result.add(method);
        }
        return result;
    }

    public static MethodSet of(final String... methods) {
        final MethodSet result = new MethodSet();
        for (String method : methods) {
            result.add(method);
        }
        return result;
    }

    public static MethodSet get() {
        return of(Methods.GET);
    }

    public static MethodSet post() {
        return of(Methods.POST);
    }

    public static MethodSet put() {
        return of(Methods.PUT);
    }

    public static MethodSet delete() {
        return of(Methods.DELETE);
    }

    /**
     * @return a set holding only the any member
     */
    public static MethodSet any() {
        return new MethodSet().addAny();
    }

    public MethodSet add(final HttpString method) {
        if (method == null) {
            throw TrellisMessages.MESSAGES.argumentCannotBeNull("method");
        }
        methods.add(method);
        return this;
    }

    public MethodSet add(final String method) {
        if (method == null) {
            throw TrellisMessages.MESSAGES.argumentCannotBeNull("method");
        }
        return add(Methods.fromString(method));
    }

    public MethodSet addAny() {
        any = true;
        return this;
    }

    public MethodSet remove(final HttpString method) {
        methods.remove(method);
        return this;
    }

    public MethodSet remove(final String method) {
        final HttpString value = HttpString.tryFromString(method);
        if (value != null) {
            methods.remove(value);
        }
        return this;
    }

    public MethodSet removeAny() {
        any = false;
        return this;
    }

    /**
     * Union in place, the any member included.
     *
     * @param other the set to merge from
     * @return this set
     */
    public MethodSet addAll(final MethodSet other) {
        methods.addAll(other.methods);
        any |= other.any;
        return this;
    }

    /**
     * @return an independent copy of this set
     */
    public MethodSet copy() {
        return new MethodSet(methods, any);
    }

    /**
     * @param method the method
     * @return {@code true} if the method was added explicitly, regardless of the any member
     */
    public boolean contains(final HttpString method) {
        return methods.contains(method);
    }

    public boolean containsOrAny(final HttpString method) {
        return any || methods.contains(method);
    }

    public boolean isAny() {
        return any;
    }

    public boolean isEmpty() {
        return !any && methods.isEmpty();
    }

    /**
     * @return the named methods in this set, without the any member
     */
    public Set<HttpString> getMethods() {
        return Collections.unmodifiableSet(methods);
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof MethodSet)) {
            return false;
        }
        final MethodSet other = (MethodSet) obj;
        return any == other.any && methods.equals(other.methods);
    }

    @Override
    public int hashCode() {
        return 31 * methods.hashCode() + (any ? 1 : 0);
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder("[");
        boolean first = true;
        if (any) {
            sb.append("<any>");
            first = false;
        }
        for (HttpString method : new TreeSet<>(methods)) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(method);
            first = false;
        }
        return sb.append(']').toString();
    }
}

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import io.trellis.TrellisMessages;

/**
 * Parses path pattern strings into segments.
 *
 * <p>
 * <b>Path pattern strings</b>
 *
 * <ol>
 * <li>A single leading {@code /} is optional and ignored. The pattern {@code "/"} is the root and has no segments.</li>
 * <li>The rest of the pattern is split on every {@code /} character. The following segment types are recognised:
 * <ol>
 * <li>Literal segments. In {@code "/books/{bookId}/chapters"} the first and third segments are the literals
 * {@code "books"} and {@code "chapters"}.</li>
 * <li>Parameter segments, enclosed in {@code '{'} and {@code '}'}. In {@code "/books/{bookId}/chapters"} the second
 * segment captures any request segment under the name {@code "bookId"}.</li>
 * <li>Slash segments. Two adjacent slashes, or a trailing slash, produce an empty segment. {@code "/books/"} therefore
 * has the two segments {@code "books"} and a slash segment, and names a different route than {@code "/books"}.</li>
 * </ol>
 * </li>
 * <li>A parameter always spans an entire segment. A segment with an opening brace and no closing brace (or the
 * reverse), and the empty parameter {@code "{}"}, are malformed.</li>
 * </ol>
 *
 * Malformed patterns are rejected with an {@link IllegalArgumentException}; a pattern is parsed when it is registered,
 * never when a request is routed.
 */
public final class PathPatternParser {

    /**
     * One segment of a parsed pattern. Instances are immutable.
     */
    public static final class Segment {

        public enum Type {
            LITERAL,
            PARAMETER,
            SLASH
        }

        private final Type type;
        private final String value;

        private Segment(final Type type, final String value) {
            this.type = type;
            this.value = value;
        }

        public Type getType() {
            return type;
        }

        /**
         * @return the literal text, the parameter name without braces, or the empty string for a slash segment
         */
        public String getValue() {
            return value;
        }

        public boolean isParameter() {
            return type == Type.PARAMETER;
        }

        @Override
        public boolean equals(final Object obj) {
            if (this == obj) {
                return true;
            }
            if (obj == null || getClass() != obj.getClass()) {
                return false;
            }
            final Segment other = (Segment) obj;
            return type == other.type && value.equals(other.value);
        }

        @Override
        public int hashCode() {
            return Objects.hash(type, value);
        }

        @Override
        public String toString() {
            return "Segment{" + "type=" + type + ", value=" + value + '}';
        }
    }

    private PathPatternParser() {
    }

    /**
     * Parses a pattern into its segments.
     *
     * @param pattern the pattern; must not be empty
     * @return the segments, empty for the root pattern
     * @throws IllegalArgumentException if the pattern is malformed
     */
    public static List<Segment> parse(final String pattern) {
        if (pattern == null) {
            throw TrellisMessages.MESSAGES.argumentCannotBeNull("pattern");
        }
        final String path = pattern.startsWith("/") ? pattern.substring(1) : pattern;
        if (path.isEmpty()) {
            return Collections.emptyList();
        }

        final List<Segment> segments = new ArrayList<>();
        int start = 0;
        while (true) {
            final int end = path.indexOf('/', start);
            final String text = end == -1 ? path.substring(start) : path.substring(start, end);
            segments.add(createSegment(pattern, text));
            if (end == -1) {
                break;
            }
            start = end + 1;
        }
        return Collections.unmodifiableList(segments);
    }

    private static Segment createSegment(final String pattern, final String text) {
        if (text.isEmpty()) {
            return new Segment(Segment.Type.SLASH, RouteNode.SLASH);
        }
        final boolean open = text.charAt(0) == '{';
        final boolean close = text.charAt(text.length() - 1) == '}';
        if (open != close) {
            throw TrellisMessages.MESSAGES.malformedPathPattern(pattern, text);
        }
        if (open) {
            final String name = text.substring(1, text.length() - 1);
            if (name.isEmpty()) {
                throw TrellisMessages.MESSAGES.emptyParameterName(pattern);
            }
            return new Segment(Segment.Type.PARAMETER, name);
        }
        return new Segment(Segment.Type.LITERAL, text);
    }
}

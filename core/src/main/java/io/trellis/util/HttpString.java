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

import java.io.Serializable;

import static java.lang.Integer.signum;

import io.trellis.TrellisMessages;

/**
 * An HTTP case-insensitive Latin-1 string, used for method names.
 */
public final class HttpString implements Comparable<HttpString>, Serializable {
    private static final long serialVersionUID = 1L;

    private final String string;
    private final int hashCode;

    /**
     * Construct a new instance from a {@code String}.
     *
     * @param string the source string
     * @throws IllegalArgumentException if the string contains characters outside Latin-1, or a newline
     */
    public HttpString(final String string) {
        if (string == null) {
            throw TrellisMessages.MESSAGES.argumentCannotBeNull("string");
        }
        final int len = string.length();
        for (int i = 0; i < len; i++) {
            char c = string.charAt(i);
            if (c > 0xff) {
                throw TrellisMessages.MESSAGES.invalidHttpStringContents(string);
            }
            if (c == '\r' || c == '\n') {
                throw TrellisMessages.MESSAGES.newlineNotSupportedInHttpString(string);
            }
        }
        this.string = string;
        this.hashCode = calcHashCode(string);
    }

    /**
     * Attempt to convert a {@code String} to an {@code HttpString}.  If the string cannot be converted,
     * {@code null} is returned.
     *
     * @param string the string to try
     * @return the HTTP string, or {@code null} if the string is not in a compatible encoding
     */
    public static HttpString tryFromString(String string) {
        if (string == null) {
            return null;
        }
        final int len = string.length();
        for (int i = 0; i < len; i++) {
            char c = string.charAt(i);
            if (c > 0xff || c == '\r' || c == '\n') {
                return null;
            }
        }
        return new HttpString(string);
    }

    /**
     * Compare this string to another in a case-insensitive manner.
     *
     * @param other the other string
     * @return -1, 0, or 1
     */
    @Override
    public int compareTo(final HttpString other) {
        final int len = Math.min(string.length(), other.string.length());
        int res;
        for (int i = 0; i < len; i++) {
            res = signum(higher(string.charAt(i)) - higher(other.string.charAt(i)));
            if (res != 0) return res;
        }
        // shorter strings sort first
        return signum(string.length() - other.string.length());
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public boolean equals(final Object other) {
        if (other == this) {
            return true;
        }
        if (!(other instanceof HttpString)) {
            return false;
        }
        return equalToString(((HttpString) other).string);
    }

    /**
     * Case-insensitive comparison against a plain string.
     *
     * @param value the string
     * @return {@code true} if the strings are equal ignoring case
     */
    public boolean equalToString(String value) {
        if (value == null || value.length() != string.length()) {
            return false;
        }
        final int len = string.length();
        for (int i = 0; i < len; i++) {
            if (higher(string.charAt(i)) != higher(value.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static int calcHashCode(final String value) {
        int hc = 17;
        for (int i = 0; i < value.length(); i++) {
            hc = (hc << 4) + hc + higher(value.charAt(i));
        }
        return hc;
    }

    private static int higher(char c) {
        return c >= 'a' && c <= 'z' ? c & 0xDF : c;
    }

    @Override
    public String toString() {
        return string;
    }
}

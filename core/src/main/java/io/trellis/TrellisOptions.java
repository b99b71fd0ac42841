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

import org.xnio.Option;

/**
 * Configuration options for the router and the JDK server bridge.
 */
public class TrellisOptions {

    /**
     * The status code set by the built-in handler when a request matches no route, no catch-all and no
     * default handler.
     */
    public static final Option<Integer> NOT_FOUND_STATUS = Option.simple(TrellisOptions.class, "NOT_FOUND_STATUS", Integer.class);

    public static final int DEFAULT_NOT_FOUND_STATUS = 404;

    /**
     * If the JDK server bridge should route on the percent-decoded request path. If this is false the raw
     * path is routed and captured parameters are left encoded.
     * <p>
     * Defaults to true.
     */
    public static final Option<Boolean> DECODE_URL = Option.simple(TrellisOptions.class, "DECODE_URL", Boolean.class);

    private TrellisOptions() {

    }
}

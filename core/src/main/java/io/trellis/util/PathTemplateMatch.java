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
import java.util.Map;

/**
 * The pattern of the route that served a request, and the parameters captured on the way to it.
 * <p>
 * Routers attach this to the exchange under {@link #ATTACHMENT_KEY} whenever a registered route (as an endpoint or
 * as a catch-all) serves the request.
 */
public class PathTemplateMatch {

    public static final AttachmentKey<PathTemplateMatch> ATTACHMENT_KEY = AttachmentKey.create(PathTemplateMatch.class);

    private final String matchedTemplate;
    private final Map<String, String> parameters;

    public PathTemplateMatch(String matchedTemplate, Map<String, String> parameters) {
        this.matchedTemplate = matchedTemplate;
        this.parameters = Collections.unmodifiableMap(parameters);
    }

    public String getMatchedTemplate() {
        return matchedTemplate;
    }

    public Map<String, String> getParameters() {
        return parameters;
    }

    @Override
    public String toString() {
        return "PathTemplateMatch{" + "matchedTemplate=" + matchedTemplate + ", parameters=" + parameters + '}';
    }
}

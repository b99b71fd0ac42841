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

package io.trellis.io;

import java.io.IOException;
import java.nio.charset.Charset;

/**
 * Sender interface that allows for response data to be written to the exchange.
 */
public interface Sender {

    /**
     * Write the given String using the UTF-8 charset.
     *
     * @param data The data to send
     * @throws IOException if the underlying stream fails
     */
    void send(String data) throws IOException;

    /**
     * Write the given String using the given charset.
     *
     * @param data    The data to send
     * @param charset The charset to use
     * @throws IOException if the underlying stream fails
     */
    void send(String data, Charset charset) throws IOException;

    /**
     * Write the given bytes.
     *
     * @param data The data to send
     * @throws IOException if the underlying stream fails
     */
    void send(byte[] data) throws IOException;
}

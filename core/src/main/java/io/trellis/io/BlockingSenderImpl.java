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
import java.io.OutputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * A sender that uses an output stream.
 */
public class BlockingSenderImpl implements Sender {

    private final OutputStream outputStream;

    public BlockingSenderImpl(final OutputStream outputStream) {
        this.outputStream = outputStream;
    }

    @Override
    public void send(final String data) throws IOException {
        send(data, StandardCharsets.UTF_8);
    }

    @Override
    public void send(final String data, final Charset charset) throws IOException {
        outputStream.write(data.getBytes(charset));
    }

    @Override
    public void send(final byte[] data) throws IOException {
        outputStream.write(data);
    }
}

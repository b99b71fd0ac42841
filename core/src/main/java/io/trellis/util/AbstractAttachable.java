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

import java.util.IdentityHashMap;
import java.util.Map;

import io.trellis.TrellisMessages;

/**
 * Attachment storage backed by a lazily created identity map.
 */
public abstract class AbstractAttachable implements Attachable {

    private Map<AttachmentKey<?>, Object> attachments;

    @Override
    public <T> T getAttachment(final AttachmentKey<T> key) {
        if (key == null || attachments == null) {
            return null;
        }
        return key.cast(attachments.get(key));
    }

    @Override
    public <T> T putAttachment(final AttachmentKey<T> key, final T value) {
        if (key == null) {
            throw TrellisMessages.MESSAGES.argumentCannotBeNull("key");
        }
        if (value == null) {
            return removeAttachment(key);
        }
        if (attachments == null) {
            attachments = new IdentityHashMap<>(5);
        }
        return key.cast(attachments.put(key, key.cast(value)));
    }

    @Override
    public <T> T removeAttachment(final AttachmentKey<T> key) {
        if (key == null || attachments == null) {
            return null;
        }
        return key.cast(attachments.remove(key));
    }
}

/*
 * ====================================================================
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 * ====================================================================
 *
 * This software consists of voluntary contributions made by many
 * individuals on behalf of the Apache Software Foundation.  For more
 * information on the Apache Software Foundation, please see
 * <http://www.apache.org/>.
 *
 */
package org.apache.hc.client5.proxy.websocket.protocol;

import java.nio.charset.StandardCharsets;

import org.apache.hc.core5.util.Args;

/**
 * One fragment of a TEXT or BINARY message.
 *
 * @since 5.6
 */
public final class MessageEvent extends WebSocketEvent {

    private final String text;
    private final byte[] data;
    private final boolean messageFinished;

    private MessageEvent(final String text, final byte[] data, final boolean messageFinished) {
        this.text = text;
        this.data = data;
        this.messageFinished = messageFinished;
    }

    public static MessageEvent text(final String text, final boolean messageFinished) {
        Args.notNull(text, "Text");
        return new MessageEvent(text, text.getBytes(StandardCharsets.UTF_8), messageFinished);
    }

    public static MessageEvent binary(final byte[] data, final boolean messageFinished) {
        Args.notNull(data, "Data");
        return new MessageEvent(null, data, messageFinished);
    }

    public boolean isText() {
        return text != null;
    }

    /**
     * @return the text of a TEXT fragment, {@code null} for BINARY.
     */
    public String getText() {
        return text;
    }

    /**
     * @return the fragment payload; UTF-8 for TEXT fragments.
     */
    public byte[] getData() {
        return data;
    }

    public boolean isMessageFinished() {
        return messageFinished;
    }

    @Override
    public String toString() {
        return "MessageEvent{" + (isText() ? "text" : "binary")
                + ", length=" + data.length
                + ", finished=" + messageFinished + '}';
    }
}

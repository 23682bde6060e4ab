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
package org.apache.hc.client5.proxy.websocket.flow;

import java.nio.charset.StandardCharsets;

import org.apache.hc.core5.util.Args;

/**
 * A complete WebSocket message as seen by the proxy.
 * <p>
 * Message hooks may replace the content or kill the message; a killed message is
 * recorded in the flow but not forwarded.
 * </p>
 *
 * @since 5.6
 */
public final class WebSocketMessage {

    private final MessageType type;
    private final boolean fromClient;
    private final long timestamp;
    private byte[] content;
    private boolean killed;

    public WebSocketMessage(final MessageType type, final boolean fromClient, final byte[] content, final long timestamp) {
        this.type = Args.notNull(type, "Message type");
        this.fromClient = fromClient;
        this.content = Args.notNull(content, "Content");
        this.timestamp = timestamp;
    }

    public WebSocketMessage(final MessageType type, final boolean fromClient, final byte[] content) {
        this(type, fromClient, content, System.currentTimeMillis());
    }

    public MessageType getType() {
        return type;
    }

    public boolean isText() {
        return type == MessageType.TEXT;
    }

    public boolean isFromClient() {
        return fromClient;
    }

    /**
     * @return creation time in milliseconds since the epoch.
     */
    public long getTimestamp() {
        return timestamp;
    }

    public byte[] getContent() {
        return content;
    }

    public void setContent(final byte[] content) {
        this.content = Args.notNull(content, "Content");
    }

    /**
     * Content decoded as UTF-8; malformed sequences are replaced.
     */
    public String getText() {
        return new String(content, StandardCharsets.UTF_8);
    }

    public void setText(final String text) {
        Args.notNull(text, "Text");
        this.content = text.getBytes(StandardCharsets.UTF_8);
    }

    public boolean isKilled() {
        return killed;
    }

    /**
     * Prevents the message from being forwarded to the other peer.
     */
    public void kill() {
        this.killed = true;
    }

    @Override
    public String toString() {
        final String body = isText() ? getText() : content.length + " bytes";
        return (fromClient ? "client" : "server") + " -> " + type + ": " + body + (killed ? " (killed)" : "");
    }
}

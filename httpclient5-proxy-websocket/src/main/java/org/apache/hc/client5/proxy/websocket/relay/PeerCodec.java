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
package org.apache.hc.client5.proxy.websocket.relay;

import java.nio.ByteBuffer;
import java.util.List;

import org.apache.hc.client5.proxy.websocket.protocol.ConnectionState;
import org.apache.hc.client5.proxy.websocket.protocol.WebSocketConnection;
import org.apache.hc.client5.proxy.websocket.protocol.WebSocketEvent;
import org.apache.hc.core5.util.Args;

/**
 * One direction of the relay: a transport leg, the protocol state machine that
 * speaks to it and the buffer of its incomplete inbound message.
 */
final class PeerCodec {

    private final ProxyConnection connection;
    private final WebSocketConnection protocol;
    private final FrameBuffer frameBuffer = new FrameBuffer();

    PeerCodec(final ProxyConnection connection, final WebSocketConnection protocol) {
        this.connection = Args.notNull(connection, "Connection");
        this.protocol = Args.notNull(protocol, "Protocol");
    }

    ProxyConnection getConnection() {
        return connection;
    }

    FrameBuffer getFrameBuffer() {
        return frameBuffer;
    }

    ConnectionState getState() {
        return protocol.getState();
    }

    List<WebSocketEvent> feed(final ByteBuffer data) {
        protocol.receiveData(data);
        return protocol.events();
    }

    List<WebSocketEvent> feedEndOfStream() {
        protocol.receiveEndOfStream();
        return protocol.events();
    }

    ByteBuffer encode(final WebSocketEvent event) {
        return protocol.send(event);
    }

    /**
     * @return {@code true} if a close frame may still be sent on this leg.
     */
    boolean canSendClose() {
        final ConnectionState state = protocol.getState();
        return state == ConnectionState.OPEN || state == ConnectionState.REMOTE_CLOSING;
    }

    @Override
    public String toString() {
        return "PeerCodec{" + protocol.getRole() + ", " + protocol.getState() + ", " + connection.getId() + '}';
    }
}

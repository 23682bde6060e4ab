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

import java.nio.ByteBuffer;
import java.util.List;

/**
 * Sans-I/O WebSocket protocol state machine for one transport leg.
 * <p>
 * Inbound bytes are fed with {@link #receiveData(ByteBuffer)}; the resulting
 * events are collected with {@link #events()}. {@link #send(WebSocketEvent)} turns
 * an event into wire bytes without transmitting them.
 * </p>
 *
 * @since 5.6
 */
public interface WebSocketConnection {

    ConnectionRole getRole();

    ConnectionState getState();

    /**
     * Buffers bytes received from the peer.
     */
    void receiveData(ByteBuffer data);

    /**
     * Signals that the peer's transport closed.
     */
    void receiveEndOfStream();

    /**
     * Returns the events made available by the input received so far. Protocol
     * violations are reported as a {@link CloseEvent} carrying the matching close code.
     */
    List<WebSocketEvent> events();

    /**
     * Encodes an event for the wire.
     *
     * @throws IllegalStateException if the connection state does not permit the event.
     */
    ByteBuffer send(WebSocketEvent event);

}

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

import org.apache.hc.client5.proxy.websocket.flow.WebSocketFlow;

/**
 * Interception points of a relayed WebSocket session.
 * <p>
 * All callbacks run synchronously on the thread that delivered the triggering
 * event. Every flow receives exactly one of {@link #websocketEnd(WebSocketFlow)}
 * and {@link #websocketError(WebSocketFlow)}.
 * </p>
 *
 * @since 5.6
 */
public interface WebSocketHooks {

    /**
     * The relay has started.
     */
    default void websocketStart(final WebSocketFlow flow) {
    }

    /**
     * A complete message was received; it is the last entry of
     * {@link WebSocketFlow#getMessages()} and may be modified or killed.
     */
    default void websocketMessage(final WebSocketFlow flow) {
    }

    /**
     * The session ended with a normal close code.
     */
    default void websocketEnd(final WebSocketFlow flow) {
    }

    /**
     * The session ended abnormally; {@link WebSocketFlow#getError()} is set.
     */
    default void websocketError(final WebSocketFlow flow) {
    }

}

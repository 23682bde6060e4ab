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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.hc.core5.http.HttpRequest;
import org.apache.hc.core5.http.HttpResponse;
import org.apache.hc.core5.util.Args;

/**
 * The proxy's record of one intercepted WebSocket session: the upgrade exchange,
 * the messages relayed so far and how the session ended.
 *
 * @since 5.6
 */
public class WebSocketFlow {

    private final HttpRequest request;
    private final HttpResponse response;
    private final List<WebSocketMessage> messages = new ArrayList<>();

    private boolean closedByClient;
    private int closeCode;
    private String closeReason;
    private FlowError error;

    public WebSocketFlow(final HttpRequest request, final HttpResponse response) {
        this.request = request;
        this.response = Args.notNull(response, "Upgrade response");
    }

    public WebSocketFlow(final HttpResponse response) {
        this(null, response);
    }

    /**
     * @return the upgrade request, may be {@code null}.
     */
    public HttpRequest getRequest() {
        return request;
    }

    /**
     * @return the {@code 101 Switching Protocols} response.
     */
    public HttpResponse getResponse() {
        return response;
    }

    /**
     * @return the messages in the order they completed, read-only.
     */
    public List<WebSocketMessage> getMessages() {
        return Collections.unmodifiableList(messages);
    }

    /**
     * @return the most recent message, or {@code null} if none.
     */
    public WebSocketMessage getLastMessage() {
        return messages.isEmpty() ? null : messages.get(messages.size() - 1);
    }

    public void addMessage(final WebSocketMessage message) {
        messages.add(Args.notNull(message, "Message"));
    }

    public boolean isClosedByClient() {
        return closedByClient;
    }

    public void setClosedByClient(final boolean closedByClient) {
        this.closedByClient = closedByClient;
    }

    public int getCloseCode() {
        return closeCode;
    }

    public void setCloseCode(final int closeCode) {
        this.closeCode = closeCode;
    }

    public String getCloseReason() {
        return closeReason;
    }

    public void setCloseReason(final String closeReason) {
        this.closeReason = closeReason;
    }

    public FlowError getError() {
        return error;
    }

    public void setError(final FlowError error) {
        this.error = error;
    }

    @Override
    public String toString() {
        return "WebSocketFlow{messages=" + messages.size()
                + (closeReason != null ? ", closeCode=" + closeCode : "")
                + (error != null ? ", error=" + error : "") + '}';
    }
}

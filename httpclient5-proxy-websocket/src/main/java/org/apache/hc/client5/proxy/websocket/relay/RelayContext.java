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

import org.apache.hc.core5.util.Args;

/**
 * The two transport legs a relay sits between.
 *
 * @since 5.6
 */
public final class RelayContext {

    private final ProxyConnection client;
    private final ProxyConnection server;

    public RelayContext(final ProxyConnection client, final ProxyConnection server) {
        this.client = Args.notNull(client, "Client connection");
        this.server = Args.notNull(server, "Server connection");
    }

    public ProxyConnection getClient() {
        return client;
    }

    public ProxyConnection getServer() {
        return server;
    }

    @Override
    public String toString() {
        return "RelayContext{client=" + client.getId() + ", server=" + server.getId() + '}';
    }
}

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
package org.apache.hc.client5.proxy.websocket.core.extension;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of extension negotiation: one extension list per relay direction plus
 * the names of the extensions that were not recognised.
 *
 * @since 5.6
 */
public final class NegotiatedExtensions {

    private final List<Extension> clientExtensions;
    private final List<Extension> serverExtensions;
    private final List<String> ignored;

    public NegotiatedExtensions(
            final List<Extension> clientExtensions,
            final List<Extension> serverExtensions,
            final List<String> ignored) {
        this.clientExtensions = Collections.unmodifiableList(new ArrayList<>(clientExtensions));
        this.serverExtensions = Collections.unmodifiableList(new ArrayList<>(serverExtensions));
        this.ignored = Collections.unmodifiableList(new ArrayList<>(ignored));
    }

    /**
     * Extensions for the client-facing connection.
     */
    public List<Extension> getClientExtensions() {
        return clientExtensions;
    }

    /**
     * Extensions for the server-facing connection.
     */
    public List<Extension> getServerExtensions() {
        return serverExtensions;
    }

    public List<String> getIgnored() {
        return ignored;
    }

    @Override
    public String toString() {
        return "NegotiatedExtensions{client=" + clientExtensions
                + ", server=" + serverExtensions
                + ", ignored=" + ignored + '}';
    }
}

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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class WebSocketRelayConfigTest {

    @Test
    void testDefaults() {
        final WebSocketRelayConfig config = WebSocketRelayConfig.DEFAULT;
        Assertions.assertEquals(0, config.getMaxFrameSize());
        Assertions.assertEquals(0L, config.getMaxMessageSize());
        Assertions.assertEquals(4000, config.getFragmentSize());
    }

    @Test
    void testCustomAndCopy() {
        final WebSocketRelayConfig config = WebSocketRelayConfig.custom()
                .setMaxFrameSize(1024)
                .setMaxMessageSize(1L << 20)
                .setFragmentSize(512)
                .build();
        final WebSocketRelayConfig copy = WebSocketRelayConfig.copy(config).build();
        Assertions.assertEquals(1024, copy.getMaxFrameSize());
        Assertions.assertEquals(1L << 20, copy.getMaxMessageSize());
        Assertions.assertEquals(512, copy.getFragmentSize());
    }

    @Test
    void testValidation() {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> WebSocketRelayConfig.custom().setMaxFrameSize(-1).build());
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> WebSocketRelayConfig.custom().setMaxMessageSize(-1).build());
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> WebSocketRelayConfig.custom().setFragmentSize(0).build());
    }
}

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

import org.apache.hc.core5.annotation.Contract;
import org.apache.hc.core5.annotation.ThreadingBehavior;
import org.apache.hc.core5.util.Args;

/**
 * Immutable limits of a {@link WebSocketRelay}.
 *
 * @since 5.6
 */
@Contract(threading = ThreadingBehavior.IMMUTABLE)
public final class WebSocketRelayConfig {

    public static final int DEFAULT_FRAGMENT_SIZE = 4000;

    public static final WebSocketRelayConfig DEFAULT = custom().build();

    private final int maxFrameSize;
    private final long maxMessageSize;
    private final int fragmentSize;

    private WebSocketRelayConfig(final int maxFrameSize, final long maxMessageSize, final int fragmentSize) {
        this.maxFrameSize = maxFrameSize;
        this.maxMessageSize = maxMessageSize;
        this.fragmentSize = fragmentSize;
    }

    /**
     * Maximum inbound frame payload in bytes; {@code 0} means unlimited.
     */
    public int getMaxFrameSize() {
        return maxFrameSize;
    }

    /**
     * Maximum inbound message size in bytes after decompression; {@code 0} means unlimited.
     */
    public long getMaxMessageSize() {
        return maxMessageSize;
    }

    /**
     * Size of the parts a modified message is split into.
     */
    public int getFragmentSize() {
        return fragmentSize;
    }

    @Override
    public String toString() {
        return "WebSocketRelayConfig{maxFrameSize=" + maxFrameSize
                + ", maxMessageSize=" + maxMessageSize
                + ", fragmentSize=" + fragmentSize + '}';
    }

    public static Builder custom() {
        return new Builder();
    }

    public static Builder copy(final WebSocketRelayConfig config) {
        Args.notNull(config, "Config");
        return new Builder()
                .setMaxFrameSize(config.getMaxFrameSize())
                .setMaxMessageSize(config.getMaxMessageSize())
                .setFragmentSize(config.getFragmentSize());
    }

    public static final class Builder {
        private int maxFrameSize;
        private long maxMessageSize;
        private int fragmentSize = DEFAULT_FRAGMENT_SIZE;

        Builder() {
        }

        public Builder setMaxFrameSize(final int v) {
            this.maxFrameSize = v;
            return this;
        }

        public Builder setMaxMessageSize(final long v) {
            this.maxMessageSize = v;
            return this;
        }

        public Builder setFragmentSize(final int v) {
            this.fragmentSize = v;
            return this;
        }

        public WebSocketRelayConfig build() {
            Args.notNegative(maxFrameSize, "Max frame size");
            Args.notNegative(maxMessageSize, "Max message size");
            Args.positive(fragmentSize, "Fragment size");
            return new WebSocketRelayConfig(maxFrameSize, maxMessageSize, fragmentSize);
        }
    }
}

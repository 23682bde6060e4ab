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

/**
 * A negotiated WebSocket extension. One instance serves exactly one connection;
 * encoders and decoders created from it carry that connection's codec state.
 *
 * @since 5.6
 */
public interface Extension {

    /**
     * Extension token as it appears in {@code Sec-WebSocket-Extensions}.
     */
    String getName();

    /**
     * RSV bit(s) this extension uses to flag a transformed message.
     */
    int rsvMask();

    /**
     * Creates the outbound transform.
     *
     * @param clientSide {@code true} if the owning endpoint acts as the WebSocket client.
     */
    Encoder newEncoder(boolean clientSide);

    /**
     * Creates the inbound transform.
     *
     * @param clientSide {@code true} if the owning endpoint acts as the WebSocket client.
     */
    Decoder newDecoder(boolean clientSide);

    interface Encoder {

        /**
         * Transforms one outbound fragment of a message.
         */
        Encoded encode(byte[] data, boolean first, boolean fin);
    }

    interface Decoder {

        /**
         * Transforms one inbound fragment of a message flagged with this extension's RSV bit.
         */
        byte[] decode(byte[] data, boolean fin);
    }

    final class Encoded {

        public final byte[] payload;
        public final boolean setRsvOnFirst;

        public Encoded(final byte[] payload, final boolean setRsvOnFirst) {
            this.payload = payload;
            this.setRsvOnFirst = setRsvOnFirst;
        }
    }
}

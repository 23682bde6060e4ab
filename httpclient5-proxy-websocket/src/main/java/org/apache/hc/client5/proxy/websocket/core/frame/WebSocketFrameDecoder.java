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
package org.apache.hc.client5.proxy.websocket.core.frame;

import static org.apache.hc.client5.proxy.websocket.core.frame.FrameHeaderBits.FIN;
import static org.apache.hc.client5.proxy.websocket.core.frame.FrameHeaderBits.LENGTH;
import static org.apache.hc.client5.proxy.websocket.core.frame.FrameHeaderBits.MASK_BIT;
import static org.apache.hc.client5.proxy.websocket.core.frame.FrameHeaderBits.OPCODE;
import static org.apache.hc.client5.proxy.websocket.core.frame.FrameHeaderBits.RSV1;
import static org.apache.hc.client5.proxy.websocket.core.frame.FrameHeaderBits.RSV2;
import static org.apache.hc.client5.proxy.websocket.core.frame.FrameHeaderBits.RSV3;

import java.nio.ByteBuffer;

import org.apache.hc.client5.proxy.websocket.core.close.WebSocketProtocolException;
import org.apache.hc.client5.proxy.websocket.core.message.CloseCodec;

/**
 * Incremental RFC 6455 frame decoder.
 * <p>
 * {@link #decode(ByteBuffer)} consumes exactly one complete frame or nothing at all.
 * Frames from a client are expected to be masked, frames from a server must not be.
 * RSV bits are only accepted when enabled by a negotiated extension.
 * </p>
 *
 * @since 5.6
 */
public final class WebSocketFrameDecoder {

    private final int maxFrameSize;
    private final boolean expectMasked;
    private final int allowedRsv;

    private int opcode;
    private boolean fin;
    private boolean rsv1, rsv2, rsv3;
    private ByteBuffer payload = ByteBuffer.allocate(0);

    public WebSocketFrameDecoder(final int maxFrameSize, final boolean expectMasked) {
        this(maxFrameSize, expectMasked, 0);
    }

    /**
     * @param maxFrameSize maximum payload length of a single frame, {@code 0} for no limit.
     * @param expectMasked {@code true} when decoding frames sent by a client.
     * @param allowedRsv   RSV bits that negotiated extensions may set ({@link FrameHeaderBits#RSV1} for PMCE).
     */
    public WebSocketFrameDecoder(final int maxFrameSize, final boolean expectMasked, final int allowedRsv) {
        this.maxFrameSize = maxFrameSize;
        this.expectMasked = expectMasked;
        this.allowedRsv = allowedRsv & (RSV1 | RSV2 | RSV3);
    }

    /**
     * Attempts to decode one frame.
     *
     * @return {@code true} if a frame was decoded, {@code false} if more input is needed,
     * in which case the buffer position is left unchanged.
     * @throws WebSocketProtocolException if the frame violates the protocol.
     */
    public boolean decode(final ByteBuffer in) {
        in.mark();
        if (in.remaining() < 2) {
            in.reset();
            return false;
        }

        final int b0 = in.get() & 0xFF;
        final int b1 = in.get() & 0xFF;

        fin = (b0 & FIN) != 0;
        rsv1 = (b0 & RSV1) != 0;
        rsv2 = (b0 & RSV2) != 0;
        rsv3 = (b0 & RSV3) != 0;
        opcode = b0 & OPCODE;

        if ((b0 & (RSV1 | RSV2 | RSV3) & ~allowedRsv) != 0) {
            throw new WebSocketProtocolException(CloseCodec.PROTOCOL_ERROR, "RSV bits set without negotiated extension");
        }
        if (!Opcode.isKnown(opcode)) {
            throw new WebSocketProtocolException(CloseCodec.PROTOCOL_ERROR, "Reserved opcode: " + Opcode.name(opcode));
        }

        final boolean masked = (b1 & MASK_BIT) != 0;
        if (masked != expectMasked) {
            throw new WebSocketProtocolException(CloseCodec.PROTOCOL_ERROR,
                    expectMasked ? "Client frame is not masked" : "Server frame is masked");
        }

        long len = b1 & LENGTH;
        if (len == 126) {
            if (in.remaining() < 2) {
                in.reset();
                return false;
            }
            len = in.getShort() & 0xFFFF;
        } else if (len == 127) {
            if (in.remaining() < 8) {
                in.reset();
                return false;
            }
            final long l = in.getLong();
            if (l < 0) {
                throw new WebSocketProtocolException(CloseCodec.PROTOCOL_ERROR, "Negative length");
            }
            len = l;
        }

        if (Opcode.isControl(opcode)) {
            if (!fin) {
                throw new WebSocketProtocolException(CloseCodec.PROTOCOL_ERROR, "Fragmented control frame");
            }
            if (len > 125) {
                throw new WebSocketProtocolException(CloseCodec.PROTOCOL_ERROR, "Control frame too large: " + len);
            }
            if (rsv1 || rsv2 || rsv3) {
                throw new WebSocketProtocolException(CloseCodec.PROTOCOL_ERROR, "RSV bits set on control frame");
            }
        }

        if (len > Integer.MAX_VALUE || maxFrameSize > 0 && len > maxFrameSize) {
            throw new WebSocketProtocolException(CloseCodec.MESSAGE_TOO_BIG, "Frame too large: " + len);
        }

        final int maskLen = masked ? 4 : 0;
        if (in.remaining() < maskLen + len) {
            in.reset();
            return false;
        }

        final byte[] key = new byte[maskLen];
        in.get(key);

        final byte[] data = new byte[(int) len];
        in.get(data);
        if (masked) {
            for (int i = 0; i < data.length; i++) {
                data[i] ^= key[i & 3];
            }
        }
        payload = ByteBuffer.wrap(data).asReadOnlyBuffer();
        return true;
    }

    public int opcode() {
        return opcode;
    }

    public boolean fin() {
        return fin;
    }

    public boolean rsv1() {
        return rsv1;
    }

    public boolean rsv2() {
        return rsv2;
    }

    public boolean rsv3() {
        return rsv3;
    }

    public ByteBuffer payload() {
        return payload.asReadOnlyBuffer();
    }
}

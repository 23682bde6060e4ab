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
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import org.apache.hc.client5.proxy.websocket.core.close.WebSocketProtocolException;
import org.apache.hc.client5.proxy.websocket.core.extension.Extension;
import org.apache.hc.client5.proxy.websocket.core.extension.ExtensionChain;
import org.apache.hc.client5.proxy.websocket.core.frame.FrameHeaderBits;
import org.apache.hc.client5.proxy.websocket.core.frame.Opcode;
import org.apache.hc.client5.proxy.websocket.core.frame.WebSocketFrameDecoder;
import org.apache.hc.client5.proxy.websocket.core.frame.WebSocketFrameWriter;
import org.apache.hc.client5.proxy.websocket.core.message.CloseCodec;
import org.apache.hc.core5.annotation.Contract;
import org.apache.hc.core5.annotation.ThreadingBehavior;
import org.apache.hc.core5.util.Args;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * RFC 6455 / RFC 7692 implementation of {@link WebSocketConnection} for a connection
 * whose opening handshake has already completed.
 * <p>
 * Inbound data frames are reported one {@link MessageEvent} per frame. TEXT
 * fragments always hold whole characters: a UTF-8 sequence split across frames is
 * carried over to the next fragment.
 * </p>
 *
 * @since 5.6
 */
@Contract(threading = ThreadingBehavior.UNSAFE)
public final class DefaultWebSocketConnection implements WebSocketConnection {

    private static final Logger LOG = LoggerFactory.getLogger(DefaultWebSocketConnection.class);

    private static final int RSV_BITS = FrameHeaderBits.RSV1 | FrameHeaderBits.RSV2 | FrameHeaderBits.RSV3;

    private final ConnectionRole role;
    private final long maxMessageSize;
    private final ExtensionChain.EncodeChain encChain;
    private final ExtensionChain.DecodeChain decChain;
    private final WebSocketFrameDecoder decoder;
    private final WebSocketFrameWriter writer = new WebSocketFrameWriter();
    private final Deque<WebSocketEvent> pending = new ArrayDeque<>();

    private ConnectionState state = ConnectionState.OPEN;
    private ByteBuffer inbuf = ByteBuffer.allocate(4096);
    private boolean inputDone;

    // Inbound message assembly
    private int inOpcode = -1;
    private int inRsvBits;
    private long inSize;
    private final CharsetDecoder utf8 = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
    private byte[] utf8Carry = new byte[0];

    // Outbound fragmentation
    private int outOpcode = -1;

    public DefaultWebSocketConnection(final ConnectionRole role, final List<? extends Extension> extensions) {
        this(role, extensions, 0, 0L);
    }

    /**
     * @param maxFrameSize   maximum inbound frame payload, {@code 0} for no limit.
     * @param maxMessageSize maximum inbound message size after decompression, {@code 0} for no limit.
     */
    public DefaultWebSocketConnection(
            final ConnectionRole role,
            final List<? extends Extension> extensions,
            final int maxFrameSize,
            final long maxMessageSize) {
        this.role = Args.notNull(role, "Role");
        this.maxMessageSize = Args.notNegative(maxMessageSize, "Max message size");
        Args.notNegative(maxFrameSize, "Max frame size");
        final ExtensionChain chain = new ExtensionChain(extensions);
        final boolean clientSide = role == ConnectionRole.CLIENT;
        this.encChain = chain.newEncodeChain(clientSide);
        this.decChain = chain.newDecodeChain(clientSide);
        // frames from a client are masked
        this.decoder = new WebSocketFrameDecoder(maxFrameSize, !clientSide, chain.rsvMask());
    }

    @Override
    public ConnectionRole getRole() {
        return role;
    }

    @Override
    public ConnectionState getState() {
        return state;
    }

    @Override
    public void receiveData(final ByteBuffer data) {
        if (state == ConnectionState.CLOSED) {
            throw new IllegalStateException("Connection already closed");
        }
        if (inputDone) {
            if (LOG.isDebugEnabled()) {
                LOG.debug("{} connection: discarding {} bytes received after close", role, data != null ? data.remaining() : 0);
            }
            return;
        }
        if (data == null || !data.hasRemaining()) {
            return;
        }
        if (inbuf.remaining() < data.remaining()) {
            final int need = inbuf.position() + data.remaining();
            final int newCap = Math.max(inbuf.capacity() * 2, need);
            final ByteBuffer bigger = ByteBuffer.allocate(newCap);
            inbuf.flip();
            bigger.put(inbuf);
            inbuf = bigger;
        }
        inbuf.put(data);
    }

    @Override
    public void receiveEndOfStream() {
        if (state == ConnectionState.CLOSED) {
            return;
        }
        pending.add(new CloseEvent(CloseCodec.ABNORMAL_CLOSURE, ""));
        state = ConnectionState.CLOSED;
        inputDone = true;
    }

    @Override
    public List<WebSocketEvent> events() {
        final List<WebSocketEvent> events = new ArrayList<>(pending);
        pending.clear();
        if (inbuf.position() == 0) {
            return events;
        }
        inbuf.flip();
        try {
            while (!inputDone && decoder.decode(inbuf)) {
                events.add(onFrame());
            }
        } catch (final WebSocketProtocolException ex) {
            if (LOG.isDebugEnabled()) {
                LOG.debug("{} connection: protocol error {}: {}", role, ex.getCloseCode(), ex.getMessage());
            }
            inputDone = true;
            events.add(new CloseEvent(ex.getCloseCode(), ex.getMessage()));
        }
        if (inputDone) {
            inbuf.clear();
        } else {
            inbuf.compact();
        }
        return events;
    }

    private WebSocketEvent onFrame() {
        final int op = decoder.opcode();
        final boolean fin = decoder.fin();
        final ByteBuffer payload = decoder.payload();
        switch (op) {
            case Opcode.PING:
                return new PingEvent(toBytes(payload));
            case Opcode.PONG:
                return new PongEvent(toBytes(payload));
            case Opcode.CLOSE:
                return onClose(payload);
            case Opcode.CONT:
                if (inOpcode == -1) {
                    throw new WebSocketProtocolException(CloseCodec.PROTOCOL_ERROR, "Unexpected continuation frame");
                }
                if (decoder.rsv1() || decoder.rsv2() || decoder.rsv3()) {
                    throw new WebSocketProtocolException(CloseCodec.PROTOCOL_ERROR, "RSV bits set on continuation frame");
                }
                return onData(toBytes(payload), fin);
            case Opcode.TEXT:
            case Opcode.BINARY:
                if (inOpcode != -1) {
                    throw new WebSocketProtocolException(CloseCodec.PROTOCOL_ERROR,
                            "New data frame while fragmented message in progress");
                }
                inOpcode = op;
                inRsvBits = (decoder.rsv1() ? FrameHeaderBits.RSV1 : 0)
                        | (decoder.rsv2() ? FrameHeaderBits.RSV2 : 0)
                        | (decoder.rsv3() ? FrameHeaderBits.RSV3 : 0);
                inSize = 0L;
                utf8.reset();
                utf8Carry = new byte[0];
                return onData(toBytes(payload), fin);
            default:
                throw new WebSocketProtocolException(CloseCodec.PROTOCOL_ERROR, "Unsupported opcode: " + Opcode.name(op));
        }
    }

    private MessageEvent onData(final byte[] raw, final boolean fin) {
        final byte[] data = (inRsvBits & RSV_BITS) != 0 ? decChain.decode(raw, inRsvBits, fin) : raw;
        inSize += data.length;
        if (maxMessageSize > 0 && inSize > maxMessageSize) {
            throw new WebSocketProtocolException(CloseCodec.MESSAGE_TOO_BIG, "Message too big: " + inSize);
        }
        final boolean text = inOpcode == Opcode.TEXT;
        if (fin) {
            inOpcode = -1;
            inRsvBits = 0;
        }
        return text ? MessageEvent.text(decodeText(data, fin), fin) : MessageEvent.binary(data, fin);
    }

    private String decodeText(final byte[] data, final boolean fin) {
        final ByteBuffer in = ByteBuffer.allocate(utf8Carry.length + data.length);
        in.put(utf8Carry).put(data).flip();
        final CharBuffer out = CharBuffer.allocate(in.remaining() + 1);
        CoderResult result = utf8.decode(in, out, fin);
        if (!result.isError() && fin) {
            result = utf8.flush(out);
        }
        if (result.isError() || fin && in.hasRemaining()) {
            throw new WebSocketProtocolException(CloseCodec.INVALID_PAYLOAD, "Invalid UTF-8 in text message");
        }
        utf8Carry = toBytes(in);
        out.flip();
        return out.toString();
    }

    private CloseEvent onClose(final ByteBuffer payload) {
        final int len = payload.remaining();
        int code = CloseCodec.NO_STATUS_RCVD;
        String reason = "";
        if (len == 1) {
            throw new WebSocketProtocolException(CloseCodec.PROTOCOL_ERROR, "Close frame length of 1 is invalid");
        } else if (len >= 2) {
            code = CloseCodec.readCloseCode(payload);
            if (!CloseCodec.isValidToReceive(code)) {
                throw new WebSocketProtocolException(CloseCodec.PROTOCOL_ERROR, "Invalid close code: " + code);
            }
            reason = CloseCodec.readCloseReason(payload);
        }
        inputDone = true;
        if (state == ConnectionState.OPEN) {
            state = ConnectionState.REMOTE_CLOSING;
        } else if (state == ConnectionState.LOCAL_CLOSING) {
            state = ConnectionState.CLOSED;
        }
        return new CloseEvent(code, reason);
    }

    @Override
    public ByteBuffer send(final WebSocketEvent event) {
        Args.notNull(event, "Event");
        final boolean mask = role == ConnectionRole.CLIENT;
        if (event instanceof MessageEvent) {
            ensureCanSend(event);
            return sendMessage((MessageEvent) event, mask);
        } else if (event instanceof PingEvent) {
            ensureCanSend(event);
            return writer.frame(Opcode.PING, ByteBuffer.wrap(((PingEvent) event).getPayload()), true, mask);
        } else if (event instanceof PongEvent) {
            ensureCanSend(event);
            return writer.frame(Opcode.PONG, ByteBuffer.wrap(((PongEvent) event).getPayload()), true, mask);
        } else if (event instanceof CloseEvent) {
            final CloseEvent close = (CloseEvent) event;
            if (state == ConnectionState.OPEN) {
                state = ConnectionState.LOCAL_CLOSING;
            } else if (state == ConnectionState.REMOTE_CLOSING) {
                state = ConnectionState.CLOSED;
            } else {
                throw new IllegalStateException("Cannot send " + event + " in state " + state);
            }
            return writer.close(close.getCode(), close.getReason(), mask);
        }
        throw new IllegalArgumentException("Unsupported event: " + event);
    }

    private ByteBuffer sendMessage(final MessageEvent message, final boolean mask) {
        final int type = message.isText() ? Opcode.TEXT : Opcode.BINARY;
        final boolean first = outOpcode == -1;
        if (!first && outOpcode != type) {
            throw new IllegalStateException("Cannot interleave " + Opcode.name(type)
                    + " fragment with unfinished " + Opcode.name(outOpcode) + " message");
        }
        final boolean fin = message.isMessageFinished();
        final ExtensionChain.EncodeChain.Enc enc = encChain.encode(message.getData(), first, fin);
        outOpcode = fin ? -1 : type;
        return writer.frameWithRSV(first ? type : Opcode.CONT, ByteBuffer.wrap(enc.payload), fin, mask,
                first ? enc.rsvBits : 0);
    }

    private void ensureCanSend(final WebSocketEvent event) {
        if (state != ConnectionState.OPEN && state != ConnectionState.REMOTE_CLOSING) {
            throw new IllegalStateException("Cannot send " + event + " in state " + state);
        }
    }

    private static byte[] toBytes(final ByteBuffer buf) {
        final ByteBuffer b = buf.asReadOnlyBuffer();
        final byte[] out = new byte[b.remaining()];
        b.get(out);
        return out;
    }

    @Override
    public String toString() {
        return "DefaultWebSocketConnection{" + role + ", " + state + '}';
    }
}

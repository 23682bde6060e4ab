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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import org.apache.hc.client5.proxy.websocket.core.close.WebSocketProtocolException;
import org.apache.hc.client5.proxy.websocket.core.message.CloseCodec;
import org.junit.jupiter.api.Test;

class WebSocketFrameDecoderTest {

    private static ByteBuffer serverTextFrame(final String s) {
        final byte[] p = s.getBytes(StandardCharsets.UTF_8);
        final ByteBuffer buf = ByteBuffer.allocate(2 + p.length);
        buf.put((byte) 0x81);           // FIN|TEXT
        buf.put((byte) p.length);       // no MASK
        buf.put(p);
        buf.flip();
        return buf;
    }

    @Test
    void decode_small_text_unmasked() {
        final WebSocketFrameDecoder d = new WebSocketFrameDecoder(8192, false);
        assertTrue(d.decode(serverTextFrame("hello")));
        assertEquals(Opcode.TEXT, d.opcode());
        assertTrue(d.fin());
        assertFalse(d.rsv1());
        assertEquals("hello", StandardCharsets.UTF_8.decode(d.payload()).toString());
    }

    @Test
    void decode_masked_client_frame() {
        final ByteBuffer f = new WebSocketFrameWriter().frame(
                Opcode.BINARY, ByteBuffer.wrap(new byte[]{1, 2, 3, 4, 5}), true, true);
        final WebSocketFrameDecoder d = new WebSocketFrameDecoder(0, true);
        assertTrue(d.decode(f));
        assertEquals(Opcode.BINARY, d.opcode());
        final byte[] got = new byte[5];
        d.payload().get(got);
        assertArrayEquals(new byte[]{1, 2, 3, 4, 5}, got);
        assertFalse(f.hasRemaining());
    }

    @Test
    void decode_extended_126_and_127_lengths() {
        final byte[] p = new byte[300];
        for (int i = 0; i < p.length; i++) {
            p[i] = (byte) (i & 0xFF);
        }
        final ByteBuffer f126 = ByteBuffer.allocate(2 + 2 + p.length);
        f126.put((byte) 0x82).put((byte) 126).putShort((short) p.length).put(p).flip();

        final WebSocketFrameDecoder d = new WebSocketFrameDecoder(4096, false);
        assertTrue(d.decode(f126));
        final byte[] got = new byte[p.length];
        d.payload().get(got);
        assertArrayEquals(p, got);

        final int len = 66000;
        final byte[] big = new byte[len];
        Arrays.fill(big, (byte) 0xAB);
        final ByteBuffer f127 = ByteBuffer.allocate(2 + 8 + len);
        f127.put((byte) 0x82).put((byte) 127).putLong(len).put(big).flip();
        final WebSocketFrameDecoder d2 = new WebSocketFrameDecoder(0, false);
        assertTrue(d2.decode(f127));
        assertEquals(len, d2.payload().remaining());
    }

    @Test
    void partial_buffer_returns_false_and_consumes_nothing() {
        final ByteBuffer f = ByteBuffer.allocate(2);
        f.put((byte) 0x81).put((byte) 0x7E).flip(); // says 126, but no length bytes present

        final WebSocketFrameDecoder d = new WebSocketFrameDecoder(1024, false);
        assertFalse(d.decode(f));
        assertEquals(0, f.position());

        final ByteBuffer half = serverTextFrame("hello");
        half.limit(4);
        assertFalse(d.decode(half));
        assertEquals(0, half.position());
    }

    @Test
    void masked_server_frame_is_rejected() {
        final ByteBuffer f = ByteBuffer.allocate(6);
        f.put((byte) 0x81).put((byte) 0x80).putInt(0x11223344).flip();
        final WebSocketProtocolException ex = assertThrows(WebSocketProtocolException.class,
                () -> new WebSocketFrameDecoder(0, false).decode(f));
        assertEquals(CloseCodec.PROTOCOL_ERROR, ex.getCloseCode());
    }

    @Test
    void unmasked_client_frame_is_rejected() {
        assertThrows(WebSocketProtocolException.class,
                () -> new WebSocketFrameDecoder(0, true).decode(serverTextFrame("x")));
    }

    @Test
    void rsv_bits_need_an_extension() {
        final ByteBuffer f = ByteBuffer.allocate(2);
        f.put((byte) (0x80 | 0x40 | Opcode.TEXT)).put((byte) 0).flip();
        assertThrows(WebSocketProtocolException.class, () -> new WebSocketFrameDecoder(0, false).decode(f));

        f.rewind();
        final WebSocketFrameDecoder d = new WebSocketFrameDecoder(0, false, FrameHeaderBits.RSV1);
        assertTrue(d.decode(f));
        assertTrue(d.rsv1());
    }

    @Test
    void reserved_opcode_is_rejected() {
        final ByteBuffer f = ByteBuffer.allocate(2);
        f.put((byte) 0x83).put((byte) 0).flip();
        assertThrows(WebSocketProtocolException.class, () -> new WebSocketFrameDecoder(0, false).decode(f));
    }

    @Test
    void fragmented_or_oversized_control_frames_are_rejected() {
        final ByteBuffer fragmentedPing = ByteBuffer.allocate(2);
        fragmentedPing.put((byte) Opcode.PING).put((byte) 0).flip();
        assertThrows(WebSocketProtocolException.class,
                () -> new WebSocketFrameDecoder(0, false).decode(fragmentedPing));

        final ByteBuffer bigPing = ByteBuffer.allocate(4 + 126);
        bigPing.put((byte) (0x80 | Opcode.PING)).put((byte) 126).putShort((short) 126).put(new byte[126]).flip();
        assertThrows(WebSocketProtocolException.class,
                () -> new WebSocketFrameDecoder(0, false).decode(bigPing));
    }

    @Test
    void frame_above_limit_is_too_big() {
        final WebSocketProtocolException ex = assertThrows(WebSocketProtocolException.class,
                () -> new WebSocketFrameDecoder(3, false).decode(serverTextFrame("hello")));
        assertEquals(CloseCodec.MESSAGE_TOO_BIG, ex.getCloseCode());
    }

    @Test
    void decodes_back_to_back_frames() {
        final WebSocketFrameWriter w = new WebSocketFrameWriter();
        final ByteBuffer a = w.frame(Opcode.TEXT, StandardCharsets.UTF_8.encode("he"), false, false);
        final ByteBuffer b = w.frame(Opcode.CONT, StandardCharsets.UTF_8.encode("llo"), true, false);
        final ByteBuffer both = ByteBuffer.allocate(a.remaining() + b.remaining());
        both.put(a).put(b).flip();

        final WebSocketFrameDecoder d = new WebSocketFrameDecoder(0, false);
        assertTrue(d.decode(both));
        assertEquals(Opcode.TEXT, d.opcode());
        assertFalse(d.fin());
        assertTrue(d.decode(both));
        assertEquals(Opcode.CONT, d.opcode());
        assertTrue(d.fin());
        assertEquals("llo", StandardCharsets.UTF_8.decode(d.payload()).toString());
        assertFalse(d.decode(both));
    }
}

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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import org.apache.hc.client5.proxy.websocket.core.close.WebSocketProtocolException;
import org.apache.hc.client5.proxy.websocket.core.frame.FrameHeaderBits;
import org.junit.jupiter.api.Test;

class PerMessageDeflateTest {

    private static byte[] text(final String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void single_fragment_round_trip_strips_tail() {
        final PerMessageDeflate pmd = new PerMessageDeflate();
        final Extension.Encoder enc = pmd.newEncoder(true);
        final Extension.Decoder dec = pmd.newDecoder(false);

        final byte[] plain = text("hello hello hello hello");
        final Extension.Encoded encoded = enc.encode(plain, true, true);
        assertTrue(encoded.setRsvOnFirst);
        final byte[] p = encoded.payload;
        assertFalse(p.length >= 4 && p[p.length - 4] == 0 && p[p.length - 3] == 0
                && p[p.length - 2] == (byte) 0xFF && p[p.length - 1] == (byte) 0xFF);

        assertArrayEquals(plain, dec.decode(p, true));
    }

    @Test
    void fragmented_message_round_trip() {
        final PerMessageDeflate pmd = new PerMessageDeflate();
        final Extension.Encoder enc = pmd.newEncoder(false);
        final Extension.Decoder dec = pmd.newDecoder(true);

        final ByteArrayOutputStream out = new ByteArrayOutputStream();
        final byte[][] parts = {text("first part, "), text("second part, "), text("last part")};
        for (int i = 0; i < parts.length; i++) {
            final boolean fin = i == parts.length - 1;
            final byte[] c = enc.encode(parts[i], i == 0, fin).payload;
            final byte[] d = dec.decode(c, fin);
            out.write(d, 0, d.length);
        }
        assertEquals("first part, second part, last part", new String(out.toByteArray(), StandardCharsets.UTF_8));
    }

    @Test
    void context_takeover_across_messages() {
        final PerMessageDeflate pmd = new PerMessageDeflate();
        final Extension.Encoder enc = pmd.newEncoder(true);
        final Extension.Decoder dec = pmd.newDecoder(false);
        for (int i = 0; i < 3; i++) {
            final byte[] plain = text("repeated payload " + i);
            assertArrayEquals(plain, dec.decode(enc.encode(plain, true, true).payload, true));
        }
    }

    @Test
    void no_context_takeover_resets_between_messages() {
        final PerMessageDeflate pmd = new PerMessageDeflate(true, true, null, null);
        final Extension.Encoder enc = pmd.newEncoder(true);
        final byte[] plain = text("same payload every time");
        final byte[] first = enc.encode(plain, true, true).payload;
        final byte[] second = enc.encode(plain, true, true).payload;
        assertArrayEquals(first, second);
    }

    @Test
    void reduced_window_sends_uncompressed() {
        final PerMessageDeflate pmd = new PerMessageDeflate(false, false, 10, null);
        final byte[] plain = text("abc");
        final Extension.Encoded encoded = pmd.newEncoder(true).encode(plain, true, true);
        assertFalse(encoded.setRsvOnFirst);
        assertArrayEquals(plain, encoded.payload);
        // the server direction still uses the full window
        assertTrue(pmd.newEncoder(false).encode(plain, true, true).setRsvOnFirst);
    }

    @Test
    void corrupt_input_is_invalid_payload() {
        final Extension.Decoder dec = new PerMessageDeflate().newDecoder(false);
        final WebSocketProtocolException ex = assertThrows(WebSocketProtocolException.class,
                () -> dec.decode(new byte[]{(byte) 0xFF, (byte) 0xFF, (byte) 0xFF, 0x00}, true));
        assertEquals(1007, ex.getCloseCode());
    }

    @Test
    void instances_do_not_share_state() {
        final NegotiatedExtensions negotiated = ExtensionNegotiator.INSTANCE.negotiate("permessage-deflate");
        final Extension client = negotiated.getClientExtensions().get(0);
        final Extension server = negotiated.getServerExtensions().get(0);
        assertNotSame(client, server);

        // prime the client-side compressor with context, then use the server side fresh
        final Extension.Encoder clientEnc = client.newEncoder(false);
        final Extension.Decoder clientDec = client.newDecoder(true);
        final byte[] warm = text("context context context");
        clientDec.decode(clientEnc.encode(warm, true, true).payload, true);

        final Extension.Encoder serverEnc = server.newEncoder(true);
        final Extension.Decoder serverDec = server.newDecoder(false);
        final byte[] plain = text("context context context");
        assertArrayEquals(plain, serverDec.decode(serverEnc.encode(plain, true, true).payload, true));
    }

    @Test
    void rsv_mask_and_header_form() {
        final PerMessageDeflate pmd = new PerMessageDeflate(true, false, 12, null);
        assertEquals(FrameHeaderBits.RSV1, pmd.rsvMask());
        assertEquals("permessage-deflate; server_no_context_takeover; client_max_window_bits=12", pmd.toString());
    }

    @Test
    void large_message_round_trip() {
        final byte[] plain = new byte[100_000];
        Arrays.fill(plain, (byte) 'z');
        final PerMessageDeflate pmd = new PerMessageDeflate();
        final byte[] c = pmd.newEncoder(true).encode(plain, true, true).payload;
        assertTrue(c.length < plain.length);
        assertArrayEquals(plain, pmd.newDecoder(false).decode(c, true));
    }
}

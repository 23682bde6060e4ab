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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import org.apache.hc.client5.proxy.websocket.protocol.MessageEvent;
import org.junit.jupiter.api.Test;

class FragmentizerTest {

    private static int[] lengths(final List<MessageEvent> parts) {
        final int[] out = new int[parts.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = parts.get(i).getData().length;
        }
        return out;
    }

    private static void assertOnlyLastFinished(final List<MessageEvent> parts) {
        for (int i = 0; i < parts.size(); i++) {
            assertEquals(i == parts.size() - 1, parts.get(i).isMessageFinished());
        }
    }

    @Test
    void same_length_replays_profile() {
        final Fragmentizer f = new Fragmentizer(new int[]{2, 2, 1}, true);
        final List<MessageEvent> parts = f.fragment("HELLO".getBytes(StandardCharsets.UTF_8));
        assertArrayEquals(new int[]{2, 2, 1}, lengths(parts));
        assertEquals("HE", parts.get(0).getText());
        assertEquals("LL", parts.get(1).getText());
        assertEquals("O", parts.get(2).getText());
        assertOnlyLastFinished(parts);
    }

    @Test
    void single_large_fragment_is_not_split_when_unchanged() {
        final List<MessageEvent> parts = new Fragmentizer(new int[]{9000}, false).fragment(new byte[9000]);
        assertArrayEquals(new int[]{9000}, lengths(parts));
    }

    @Test
    void modified_content_is_split_into_4000_byte_parts() {
        final List<MessageEvent> parts = new Fragmentizer(new int[]{1000}, false).fragment(new byte[8500]);
        assertArrayEquals(new int[]{4000, 4000, 500}, lengths(parts));
        assertOnlyLastFinished(parts);
        assertFalse(parts.get(0).isText());
    }

    @Test
    void exact_multiple_keeps_full_tail() {
        assertArrayEquals(new int[]{4000, 4000},
                lengths(new Fragmentizer(new int[]{1}, false).fragment(new byte[8000])));
        assertArrayEquals(new int[]{4000},
                lengths(new Fragmentizer(new int[]{1}, false).fragment(new byte[4000])));
        assertArrayEquals(new int[]{4000, 1},
                lengths(new Fragmentizer(new int[]{1}, false).fragment(new byte[4001])));
    }

    @Test
    void shorter_content_is_a_single_part() {
        final List<MessageEvent> parts = new Fragmentizer(new int[]{10, 10}, true)
                .fragment("hi".getBytes(StandardCharsets.UTF_8));
        assertEquals(1, parts.size());
        assertEquals("hi", parts.get(0).getText());
        assertTrue(parts.get(0).isMessageFinished());
    }

    @Test
    void empty_content_yields_nothing() {
        assertTrue(new Fragmentizer(new int[]{3}, true).fragment(new byte[0]).isEmpty());
    }

    @Test
    void empty_profile_is_rejected() {
        assertThrows(IllegalArgumentException.class, () -> new Fragmentizer(new int[0], false));
    }

    @Test
    void parts_concatenate_to_content() {
        final byte[] content = new byte[12345];
        for (int i = 0; i < content.length; i++) {
            content[i] = (byte) i;
        }
        final List<MessageEvent> parts = new Fragmentizer(new int[]{7}, false).fragment(content);
        final byte[] joined = new byte[content.length];
        int off = 0;
        for (final MessageEvent part : parts) {
            System.arraycopy(part.getData(), 0, joined, off, part.getData().length);
            off += part.getData().length;
        }
        assertArrayEquals(content, joined);
        assertArrayEquals(new int[]{4000, 4000, 4000, 345}, lengths(parts));
    }

    @Test
    void text_parts_are_decoded_lossily() {
        final byte[] content = "é".getBytes(StandardCharsets.UTF_8);
        final List<MessageEvent> parts = new Fragmentizer(new int[]{1, 1}, true).fragment(content);
        assertEquals("\uFFFD", parts.get(0).getText());
        assertEquals("\uFFFD", parts.get(1).getText());
    }

    @Test
    void custom_fragment_size() {
        final byte[] content = new byte[25];
        Arrays.fill(content, (byte) 1);
        assertArrayEquals(new int[]{10, 10, 5},
                lengths(new Fragmentizer(new int[]{1}, false, 10).fragment(content)));
    }
}

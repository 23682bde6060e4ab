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

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.hc.client5.proxy.websocket.protocol.MessageEvent;
import org.apache.hc.core5.util.Args;

/**
 * Plans the outbound fragments of a relayed message.
 * <p>
 * RFC 6455 lets an intermediary coalesce or split frames, but some servers reject
 * large frames. Content of unchanged length keeps the fragment sizes it arrived
 * with; modified content is split into parts of at most {@code fragmentSize} bytes.
 * </p>
 *
 * @since 5.6
 */
public final class Fragmentizer {

    /**
     * A bit less than 4 KiB to leave room for frame headers.
     */
    public static final int FRAGMENT_SIZE = WebSocketRelayConfig.DEFAULT_FRAGMENT_SIZE;

    private final int[] fragmentLengths;
    private final long total;
    private final boolean text;
    private final int fragmentSize;

    public Fragmentizer(final int[] fragmentLengths, final boolean text, final int fragmentSize) {
        Args.notNull(fragmentLengths, "Fragment lengths");
        Args.check(fragmentLengths.length > 0, "Fragment lengths may not be empty");
        this.fragmentLengths = fragmentLengths.clone();
        this.total = Arrays.stream(fragmentLengths).asLongStream().sum();
        this.text = text;
        this.fragmentSize = Args.positive(fragmentSize, "Fragment size");
    }

    public Fragmentizer(final int[] fragmentLengths, final boolean text) {
        this(fragmentLengths, text, FRAGMENT_SIZE);
    }

    public List<MessageEvent> fragment(final byte[] content) {
        Args.notNull(content, "Content");
        if (content.length == 0) {
            return Collections.emptyList();
        }
        final List<MessageEvent> parts = new ArrayList<>();
        int offset = 0;
        if (content.length == total) {
            for (int i = 0; i < fragmentLengths.length - 1; i++) {
                parts.add(part(content, offset, fragmentLengths[i], false));
                offset += fragmentLengths[i];
            }
        } else {
            while (content.length - offset > fragmentSize) {
                parts.add(part(content, offset, fragmentSize, false));
                offset += fragmentSize;
            }
        }
        parts.add(part(content, offset, content.length - offset, true));
        return parts;
    }

    private MessageEvent part(final byte[] content, final int offset, final int len, final boolean fin) {
        if (text) {
            return MessageEvent.text(new String(content, offset, len, StandardCharsets.UTF_8), fin);
        }
        return MessageEvent.binary(Arrays.copyOfRange(content, offset, offset + len), fin);
    }
}

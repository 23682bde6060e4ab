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
package org.apache.hc.client5.proxy.websocket.core.message;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

import org.apache.hc.client5.proxy.websocket.core.close.WebSocketProtocolException;
import org.apache.hc.core5.annotation.Internal;

/**
 * Helpers for RFC6455 CLOSE parsing, validation and formatting.
 */
@Internal
public final class CloseCodec {

    public static final int NORMAL_CLOSURE = 1000;
    public static final int GOING_AWAY = 1001;
    public static final int PROTOCOL_ERROR = 1002;
    public static final int NO_STATUS_RCVD = 1005;
    public static final int ABNORMAL_CLOSURE = 1006;
    public static final int INVALID_PAYLOAD = 1007;
    public static final int MESSAGE_TOO_BIG = 1009;

    private CloseCodec() {
    }

    // ---- Wire helpers -------------------------------------------------------

    public static int readCloseCode(final ByteBuffer payloadRO) {
        if (payloadRO == null || payloadRO.remaining() < 2) {
            return NO_STATUS_RCVD;
        }
        final int b1 = payloadRO.get() & 0xFF;
        final int b2 = payloadRO.get() & 0xFF;
        return b1 << 8 | b2;
    }

    /**
     * Decodes the close reason, which must be valid UTF-8.
     *
     * @throws WebSocketProtocolException (1007) on malformed UTF-8.
     */
    public static String readCloseReason(final ByteBuffer payloadRO) {
        if (payloadRO == null || !payloadRO.hasRemaining()) {
            return "";
        }
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(payloadRO.slice())
                    .toString();
        } catch (final CharacterCodingException ex) {
            throw new WebSocketProtocolException(INVALID_PAYLOAD, "Invalid UTF-8 in close reason", ex);
        }
    }

    // ---- RFC validation -----------------------------------------------------

    /**
     * RFC 6455 §7.4.2: MUST NOT appear on the wire.
     */
    public static boolean isAllowedOnWire(final int code) {
        return code != NO_STATUS_RCVD && code != ABNORMAL_CLOSURE && code != 1015;
    }

    /**
     * Validate a code we PARSED FROM THE WIRE.
     */
    public static boolean isValidToReceive(final int code) {
        if (!isAllowedOnWire(code)) {
            return false;
        }
        if (code >= 3000 && code <= 4999) {
            return true;
        }
        return CloseReason.fromCode(code) != null;
    }

    /**
     * Codes that end a session without it being reported as an error.
     */
    public static boolean isNormalClosure(final int code) {
        return code == NORMAL_CLOSURE || code == GOING_AWAY || code == NO_STATUS_RCVD;
    }

    /**
     * Renders a close for diagnostics, e.g. {@code PROTOCOL_ERROR (reason: bad frame)}
     * or {@code UNKNOWN_ERROR=4000}.
     */
    public static String format(final int code, final String reason) {
        final CloseReason known = CloseReason.fromCode(code);
        final StringBuilder buf = new StringBuilder();
        if (known != null) {
            buf.append(known.name());
        } else {
            buf.append("UNKNOWN_ERROR=").append(code);
        }
        if (reason != null && !reason.isEmpty()) {
            buf.append(" (reason: ").append(reason).append(')');
        }
        return buf.toString();
    }

    // ---- Reason handling: max 123 bytes (2 bytes used by code) --------------

    /**
     * Returns a UTF-8 string truncated to ≤ 123 bytes, preserving code-points.
     */
    public static String truncateReasonUtf8(final String reason) {
        if (reason == null || reason.isEmpty()) {
            return "";
        }
        final byte[] bytes = reason.getBytes(StandardCharsets.UTF_8);
        if (bytes.length <= 123) {
            return reason;
        }
        int i = 0;
        int byteCount = 0;
        while (i < reason.length()) {
            final int cp = reason.codePointAt(i);
            final int extra = utf8Length(cp);
            if (byteCount + extra > 123) {
                break;
            }
            byteCount += extra;
            i += Character.charCount(cp);
        }
        return reason.substring(0, i);
    }

    private static int utf8Length(final int cp) {
        if (cp < 0x80) {
            return 1;
        } else if (cp < 0x800) {
            return 2;
        } else if (cp < 0x10000) {
            return 3;
        }
        return 4;
    }
}

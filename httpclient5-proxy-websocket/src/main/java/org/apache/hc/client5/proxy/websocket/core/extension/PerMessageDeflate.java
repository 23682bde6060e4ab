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

import java.io.ByteArrayOutputStream;
import java.util.zip.DataFormatException;
import java.util.zip.Deflater;
import java.util.zip.Inflater;

import org.apache.hc.client5.proxy.websocket.core.close.WebSocketProtocolException;
import org.apache.hc.client5.proxy.websocket.core.frame.FrameHeaderBits;
import org.apache.hc.client5.proxy.websocket.core.message.CloseCodec;

/**
 * permessage-deflate (RFC 7692) with parameters as accepted during the handshake.
 * <p>
 * Messages are inflated and deflated fragment by fragment so that fragment
 * boundaries survive the transform. {@link java.util.zip.Deflater} always uses a
 * 32K window; when the peer restricted our sending window below 15 bits messages
 * are sent uncompressed, which RFC 7692 permits.
 * </p>
 *
 * @since 5.6
 */
public final class PerMessageDeflate implements Extension {

    public static final String NAME = "permessage-deflate";

    static final int MAX_WINDOW_BITS = 15;

    private static final byte[] TAIL = new byte[]{0x00, 0x00, (byte) 0xFF, (byte) 0xFF};

    private final boolean serverNoContextTakeover;
    private final boolean clientNoContextTakeover;
    private final Integer clientMaxWindowBits; // negotiated or null
    private final Integer serverMaxWindowBits; // negotiated or null

    public PerMessageDeflate(final boolean serverNoContextTakeover,
                             final boolean clientNoContextTakeover,
                             final Integer clientMaxWindowBits,
                             final Integer serverMaxWindowBits) {
        this.serverNoContextTakeover = serverNoContextTakeover;
        this.clientNoContextTakeover = clientNoContextTakeover;
        this.clientMaxWindowBits = clientMaxWindowBits;
        this.serverMaxWindowBits = serverMaxWindowBits;
    }

    public PerMessageDeflate() {
        this(false, false, null, null);
    }

    // ---- Extension API ----

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int rsvMask() {
        // PMCE uses RSV1 per RFC 7692
        return FrameHeaderBits.RSV1;
    }

    @Override
    public Encoder newEncoder(final boolean clientSide) {
        final boolean noContextTakeover = clientSide ? clientNoContextTakeover : serverNoContextTakeover;
        final Integer windowBits = clientSide ? clientMaxWindowBits : serverMaxWindowBits;
        return new DeflateEncoder(noContextTakeover, windowBits == null || windowBits >= MAX_WINDOW_BITS);
    }

    @Override
    public Decoder newDecoder(final boolean clientSide) {
        // we inflate what the other side deflated
        return new InflateDecoder(clientSide ? serverNoContextTakeover : clientNoContextTakeover);
    }

    public boolean isServerNoContextTakeover() {
        return serverNoContextTakeover;
    }

    public boolean isClientNoContextTakeover() {
        return clientNoContextTakeover;
    }

    public Integer getClientMaxWindowBits() {
        return clientMaxWindowBits;
    }

    public Integer getServerMaxWindowBits() {
        return serverMaxWindowBits;
    }

    @Override
    public String toString() {
        final StringBuilder buf = new StringBuilder(NAME);
        if (serverNoContextTakeover) {
            buf.append("; server_no_context_takeover");
        }
        if (clientNoContextTakeover) {
            buf.append("; client_no_context_takeover");
        }
        if (serverMaxWindowBits != null) {
            buf.append("; server_max_window_bits=").append(serverMaxWindowBits);
        }
        if (clientMaxWindowBits != null) {
            buf.append("; client_max_window_bits=").append(clientMaxWindowBits);
        }
        return buf.toString();
    }

    // ---- codecs ----

    static final class DeflateEncoder implements Encoder {

        private final boolean noContextTakeover;
        private final boolean compress;
        private final Deflater deflater = new Deflater(Deflater.DEFAULT_COMPRESSION, true); // raw DEFLATE
        private boolean compressing;

        DeflateEncoder(final boolean noContextTakeover, final boolean compress) {
            this.noContextTakeover = noContextTakeover;
            this.compress = compress;
        }

        @Override
        public Encoded encode(final byte[] data, final boolean first, final boolean fin) {
            if (first) {
                compressing = compress;
            }
            if (!compressing) {
                return new Encoded(data, false);
            }
            deflater.setInput(data);
            final ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(128, data.length / 2));
            final byte[] buf = new byte[8192];
            int n;
            do {
                n = deflater.deflate(buf, 0, buf.length, Deflater.SYNC_FLUSH);
                out.write(buf, 0, n);
            } while (n == buf.length);

            byte[] all = out.toByteArray();
            if (fin) {
                all = stripTail(all);
                if (noContextTakeover) {
                    deflater.reset();
                }
            }
            // RSV1 goes on the FIRST frame of a compressed message only
            return new Encoded(all, true);
        }

        private static byte[] stripTail(final byte[] all) {
            final int n = all.length;
            if (n >= 4 && all[n - 4] == 0x00 && all[n - 3] == 0x00
                    && all[n - 2] == (byte) 0xFF && all[n - 1] == (byte) 0xFF) {
                final byte[] trimmed = new byte[n - 4];
                System.arraycopy(all, 0, trimmed, 0, trimmed.length);
                return trimmed;
            }
            return all;
        }
    }

    static final class InflateDecoder implements Decoder {

        private final boolean noContextTakeover;
        private final Inflater inflater = new Inflater(true);

        InflateDecoder(final boolean noContextTakeover) {
            this.noContextTakeover = noContextTakeover;
        }

        @Override
        public byte[] decode(final byte[] data, final boolean fin) {
            final ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(128, data.length * 2));
            inflate(data, out);
            if (fin) {
                inflate(TAIL, out);
                if (noContextTakeover || inflater.finished()) {
                    inflater.reset();
                }
            }
            return out.toByteArray();
        }

        private void inflate(final byte[] input, final ByteArrayOutputStream out) {
            if (input.length == 0 || inflater.finished()) {
                return;
            }
            inflater.setInput(input);
            final byte[] buf = new byte[8192];
            try {
                int n;
                do {
                    n = inflater.inflate(buf);
                    out.write(buf, 0, n);
                } while (n > 0 && !inflater.finished());
            } catch (final DataFormatException ex) {
                throw new WebSocketProtocolException(CloseCodec.INVALID_PAYLOAD, "permessage-deflate inflate failed", ex);
            }
        }
    }
}

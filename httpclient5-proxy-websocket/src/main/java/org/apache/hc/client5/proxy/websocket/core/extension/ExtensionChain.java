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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered set of the extensions negotiated for one connection. Outbound data passes
 * the extensions in order, inbound data in reverse order.
 */
public final class ExtensionChain {

    private final List<Extension> exts = new ArrayList<>();

    public ExtensionChain() {
    }

    public ExtensionChain(final List<? extends Extension> extensions) {
        if (extensions != null) {
            for (final Extension e : extensions) {
                add(e);
            }
        }
    }

    public void add(final Extension e) {
        if (e != null) {
            exts.add(e);
        }
    }

    public boolean isEmpty() {
        return exts.isEmpty();
    }

    public List<Extension> getExtensions() {
        return Collections.unmodifiableList(exts);
    }

    /**
     * RSV bits any extension of this chain may set.
     */
    public int rsvMask() {
        int mask = 0;
        for (final Extension e : exts) {
            mask |= e.rsvMask();
        }
        return mask;
    }

    public EncodeChain newEncodeChain(final boolean clientSide) {
        final List<Extension.Encoder> encs = new ArrayList<>(exts.size());
        for (final Extension e : exts) {
            encs.add(e.newEncoder(clientSide));
        }
        return new EncodeChain(exts, encs);
    }

    public DecodeChain newDecodeChain(final boolean clientSide) {
        final List<Extension.Decoder> decs = new ArrayList<>(exts.size());
        for (final Extension e : exts) {
            decs.add(e.newDecoder(clientSide));
        }
        return new DecodeChain(exts, decs);
    }

    // ----------------------

    public static final class EncodeChain {

        private final List<Extension> exts;
        private final List<Extension.Encoder> encs;

        EncodeChain(final List<Extension> exts, final List<Extension.Encoder> encs) {
            this.exts = exts;
            this.encs = encs;
        }

        /**
         * Encode one fragment through the chain, collecting the RSV bits of the first fragment.
         */
        public Enc encode(final byte[] data, final boolean first, final boolean fin) {
            byte[] out = data;
            int rsvBits = 0;
            for (int i = 0; i < encs.size(); i++) {
                final Extension.Encoded res = encs.get(i).encode(out, first, fin);
                out = res.payload;
                if (first && res.setRsvOnFirst) {
                    rsvBits |= exts.get(i).rsvMask();
                }
            }
            return new Enc(out, rsvBits);
        }

        public static final class Enc {

            public final byte[] payload;
            public final int rsvBits;

            public Enc(final byte[] payload, final int rsvBits) {
                this.payload = payload;
                this.rsvBits = rsvBits;
            }
        }
    }

    public static final class DecodeChain {

        private final List<Extension> exts;
        private final List<Extension.Decoder> decs;

        DecodeChain(final List<Extension> exts, final List<Extension.Decoder> decs) {
            this.exts = exts;
            this.decs = decs;
        }

        /**
         * Decode one fragment of a message whose first frame carried {@code messageRsvBits}.
         */
        public byte[] decode(final byte[] data, final int messageRsvBits, final boolean fin) {
            byte[] out = data;
            for (int i = decs.size() - 1; i >= 0; i--) {
                if ((messageRsvBits & exts.get(i).rsvMask()) != 0) {
                    out = decs.get(i).decode(out, fin);
                }
            }
            return out;
        }
    }
}

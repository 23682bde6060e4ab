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
import java.util.List;
import java.util.Locale;

import org.apache.hc.core5.annotation.Contract;
import org.apache.hc.core5.annotation.ThreadingBehavior;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.HeaderElement;
import org.apache.hc.core5.http.MessageHeaders;
import org.apache.hc.core5.http.NameValuePair;
import org.apache.hc.core5.http.message.BasicHeaderValueParser;
import org.apache.hc.core5.http.message.ParserCursor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the extension instances of both relay directions from the
 * {@code Sec-WebSocket-Extensions} value the server accepted during the handshake.
 * <p>
 * Only {@code permessage-deflate} is supported; other extensions are logged and
 * ignored. Negotiation never fails.
 * </p>
 *
 * @since 5.6
 */
@Contract(threading = ThreadingBehavior.STATELESS)
public final class ExtensionNegotiator {

    public static final String SEC_WEBSOCKET_EXTENSIONS = "Sec-WebSocket-Extensions";

    public static final ExtensionNegotiator INSTANCE = new ExtensionNegotiator();

    private static final Logger LOG = LoggerFactory.getLogger(ExtensionNegotiator.class);

    private static final int MIN_WINDOW_BITS = 8;

    /**
     * Negotiates from all {@code Sec-WebSocket-Extensions} headers of the upgrade response.
     */
    public NegotiatedExtensions negotiate(final MessageHeaders response) {
        if (response == null) {
            return negotiate((String) null);
        }
        final StringBuilder buf = new StringBuilder();
        for (final Header h : response.getHeaders(SEC_WEBSOCKET_EXTENSIONS)) {
            final String value = h.getValue();
            if (value == null || value.trim().isEmpty()) {
                continue;
            }
            if (buf.length() > 0) {
                buf.append(", ");
            }
            buf.append(value);
        }
        return negotiate(buf.toString());
    }

    /**
     * Negotiates from a raw header value; {@code null} or blank means no extensions.
     */
    public NegotiatedExtensions negotiate(final String header) {
        final List<Extension> client = new ArrayList<>();
        final List<Extension> server = new ArrayList<>();
        final List<String> ignored = new ArrayList<>();
        if (header != null && !header.trim().isEmpty()) {
            final HeaderElement[] elements = BasicHeaderValueParser.INSTANCE.parseElements(
                    header, new ParserCursor(0, header.length()));
            for (final HeaderElement element : elements) {
                final String name = element.getName().trim();
                if (PerMessageDeflate.NAME.equalsIgnoreCase(name)) {
                    // independent instances: compression state is per direction
                    client.add(createDeflate(element.getParameters()));
                    server.add(createDeflate(element.getParameters()));
                } else {
                    LOG.info("Ignoring unknown WebSocket extension '{}'.", name);
                    ignored.add(name);
                }
            }
        }
        final NegotiatedExtensions result = new NegotiatedExtensions(client, server, ignored);
        if (LOG.isDebugEnabled()) {
            LOG.debug("Negotiated {}", result);
        }
        return result;
    }

    static PerMessageDeflate createDeflate(final NameValuePair[] params) {
        boolean serverNoCtx = false;
        boolean clientNoCtx = false;
        Integer clientBits = null;
        Integer serverBits = null;
        for (final NameValuePair param : params) {
            final String name = param.getName().trim().toLowerCase(Locale.ROOT);
            switch (name) {
                case "server_no_context_takeover":
                    serverNoCtx = true;
                    break;
                case "client_no_context_takeover":
                    clientNoCtx = true;
                    break;
                case "server_max_window_bits":
                    serverBits = parseWindowBits(name, param.getValue());
                    break;
                case "client_max_window_bits":
                    clientBits = parseWindowBits(name, param.getValue());
                    break;
                default:
                    LOG.info("Ignoring unknown {} parameter '{}'.", PerMessageDeflate.NAME, name);
            }
        }
        return new PerMessageDeflate(serverNoCtx, clientNoCtx, clientBits, serverBits);
    }

    private static Integer parseWindowBits(final String name, final String value) {
        if (value == null || value.trim().isEmpty()) {
            return null;
        }
        final int bits;
        try {
            bits = Integer.parseInt(value.trim());
        } catch (final NumberFormatException ex) {
            LOG.info("Ignoring malformed {} value '{}'.", name, value);
            return null;
        }
        if (bits < MIN_WINDOW_BITS || bits > PerMessageDeflate.MAX_WINDOW_BITS) {
            LOG.info("Ignoring out of range {} value {}.", name, bits);
            return null;
        }
        return bits;
    }
}

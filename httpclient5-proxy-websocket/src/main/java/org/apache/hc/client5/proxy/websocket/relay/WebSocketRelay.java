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

import java.nio.ByteBuffer;
import java.util.List;

import org.apache.hc.client5.proxy.websocket.core.extension.ExtensionNegotiator;
import org.apache.hc.client5.proxy.websocket.core.extension.NegotiatedExtensions;
import org.apache.hc.client5.proxy.websocket.core.message.CloseCodec;
import org.apache.hc.client5.proxy.websocket.flow.FlowError;
import org.apache.hc.client5.proxy.websocket.flow.MessageType;
import org.apache.hc.client5.proxy.websocket.flow.WebSocketFlow;
import org.apache.hc.client5.proxy.websocket.flow.WebSocketMessage;
import org.apache.hc.client5.proxy.websocket.protocol.CloseEvent;
import org.apache.hc.client5.proxy.websocket.protocol.ConnectionRole;
import org.apache.hc.client5.proxy.websocket.protocol.DefaultWebSocketConnection;
import org.apache.hc.client5.proxy.websocket.protocol.MessageEvent;
import org.apache.hc.client5.proxy.websocket.protocol.PingEvent;
import org.apache.hc.client5.proxy.websocket.protocol.PongEvent;
import org.apache.hc.client5.proxy.websocket.protocol.WebSocketEvent;
import org.apache.hc.core5.annotation.Contract;
import org.apache.hc.core5.annotation.ThreadingBehavior;
import org.apache.hc.core5.util.Args;
import org.apache.hc.core5.util.Asserts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Relays one intercepted WebSocket session between the client-facing and the
 * server-facing connection of the proxy.
 * <p>
 * The relay decodes each direction independently, hands every complete message to
 * {@link WebSocketHooks#websocketMessage(WebSocketFlow)}, forwards the possibly
 * modified content, passes ping and pong frames through unchanged, and propagates a
 * close from either side to both legs. It is driven by the proxy's event loop, one
 * event at a time:
 * </p>
 * <pre>
 *   START --start()--&gt; RELAYING --close / fault--&gt; DONE
 * </pre>
 *
 * @since 5.6
 */
@Contract(threading = ThreadingBehavior.UNSAFE)
public final class WebSocketRelay {

    private static final Logger LOG = LoggerFactory.getLogger(WebSocketRelay.class);

    enum State {
        START,
        RELAYING,
        DONE
    }

    private final RelayContext context;
    private final WebSocketFlow flow;
    private final RelayTransport transport;
    private final WebSocketHooks hooks;
    private final WebSocketRelayConfig config;
    private final WebSocketConnectionFactory connectionFactory;

    private State state = State.START;
    private boolean terminated;
    private PeerCodec clientCodec;
    private PeerCodec serverCodec;

    public WebSocketRelay(
            final RelayContext context,
            final WebSocketFlow flow,
            final RelayTransport transport,
            final WebSocketHooks hooks,
            final WebSocketRelayConfig config,
            final WebSocketConnectionFactory connectionFactory) {
        this.context = Args.notNull(context, "Relay context");
        this.flow = Args.notNull(flow, "Flow");
        this.transport = Args.notNull(transport, "Transport");
        this.hooks = hooks != null ? hooks : new WebSocketHooks() { };
        this.config = config != null ? config : WebSocketRelayConfig.DEFAULT;
        this.connectionFactory = connectionFactory != null ? connectionFactory
                : (role, extensions) -> new DefaultWebSocketConnection(
                        role, extensions, this.config.getMaxFrameSize(), this.config.getMaxMessageSize());
        Asserts.check(context.getServer().isConnected(), "Server connection is not established");
    }

    public WebSocketRelay(
            final RelayContext context,
            final WebSocketFlow flow,
            final RelayTransport transport,
            final WebSocketHooks hooks,
            final WebSocketRelayConfig config) {
        this(context, flow, transport, hooks, config, null);
    }

    public WebSocketRelay(
            final RelayContext context,
            final WebSocketFlow flow,
            final RelayTransport transport,
            final WebSocketHooks hooks) {
        this(context, flow, transport, hooks, null, null);
    }

    public WebSocketFlow getFlow() {
        return flow;
    }

    State getState() {
        return state;
    }

    PeerCodec getClientCodec() {
        return clientCodec;
    }

    PeerCodec getServerCodec() {
        return serverCodec;
    }

    /**
     * Negotiates extensions from the upgrade response, sets up both directions and
     * fires {@link WebSocketHooks#websocketStart(WebSocketFlow)}.
     *
     * @throws IllegalStateException if the relay has already been started.
     */
    public void start() {
        Asserts.check(state == State.START, "WebSocket relay already started");
        final NegotiatedExtensions extensions = ExtensionNegotiator.INSTANCE.negotiate(flow.getResponse());
        // the proxy is the server towards the client and the client towards the server
        clientCodec = new PeerCodec(context.getClient(),
                connectionFactory.create(ConnectionRole.SERVER, extensions.getClientExtensions()));
        serverCodec = new PeerCodec(context.getServer(),
                connectionFactory.create(ConnectionRole.CLIENT, extensions.getServerExtensions()));
        hooks.websocketStart(flow);
        state = State.RELAYING;
        if (LOG.isDebugEnabled()) {
            LOG.debug("{}: {} -> {}", context, State.START, State.RELAYING);
        }
    }

    /**
     * Handles bytes received on one of the two legs.
     *
     * @throws IllegalStateException    if the relay has not been started.
     * @throws IllegalArgumentException if the connection belongs to neither leg.
     */
    public void dataReceived(final ProxyConnection connection, final ByteBuffer data) {
        Args.notNull(data, "Data");
        final boolean fromClient = isFromClient(connection);
        if (!acceptEvent(fromClient)) {
            return;
        }
        final PeerCodec source = fromClient ? clientCodec : serverCodec;
        try {
            relay(fromClient, source.feed(data));
        } catch (final RuntimeException ex) {
            fail(ex);
        }
    }

    /**
     * Handles the end of stream of one of the two legs.
     *
     * @throws IllegalStateException    if the relay has not been started.
     * @throws IllegalArgumentException if the connection belongs to neither leg.
     */
    public void connectionClosed(final ProxyConnection connection) {
        final boolean fromClient = isFromClient(connection);
        if (!acceptEvent(fromClient)) {
            return;
        }
        final PeerCodec source = fromClient ? clientCodec : serverCodec;
        try {
            relay(fromClient, source.feedEndOfStream());
        } catch (final RuntimeException ex) {
            fail(ex);
        }
    }

    private boolean isFromClient(final ProxyConnection connection) {
        Args.notNull(connection, "Connection");
        if (connection == context.getClient()) {
            return true;
        }
        if (connection == context.getServer()) {
            return false;
        }
        throw new IllegalArgumentException("Connection " + connection.getId() + " is not part of " + context);
    }

    private boolean acceptEvent(final boolean fromClient) {
        Asserts.check(state != State.START, "WebSocket relay not started");
        if (state == State.DONE) {
            if (LOG.isDebugEnabled()) {
                LOG.debug("{}: discarding event from {} after close", context, side(fromClient));
            }
            return false;
        }
        return true;
    }

    private void relay(final boolean fromClient, final List<WebSocketEvent> events) {
        final PeerCodec source = fromClient ? clientCodec : serverCodec;
        final PeerCodec destination = fromClient ? serverCodec : clientCodec;
        for (final WebSocketEvent event : events) {
            if (state == State.DONE) {
                if (LOG.isDebugEnabled()) {
                    LOG.debug("{}: discarding {} after close", context, event);
                }
                continue;
            }
            if (event instanceof MessageEvent) {
                onMessage(fromClient, (MessageEvent) event, source, destination);
            } else if (event instanceof PingEvent) {
                LOG.info("Received WebSocket ping from {} (payload: {})",
                        side(fromClient), formatPayload(((PingEvent) event).getPayload()));
                send(destination, event);
            } else if (event instanceof PongEvent) {
                LOG.info("Received WebSocket pong from {} (payload: {})",
                        side(fromClient), formatPayload(((PongEvent) event).getPayload()));
                send(destination, event);
            } else if (event instanceof CloseEvent) {
                onClose(fromClient, (CloseEvent) event);
            } else {
                throw new IllegalStateException("Unexpected WebSocket event: " + event);
            }
        }
    }

    private void onMessage(
            final boolean fromClient,
            final MessageEvent event,
            final PeerCodec source,
            final PeerCodec destination) {
        final FrameBuffer frameBuffer = source.getFrameBuffer();
        frameBuffer.append(event.getData());
        if (!event.isMessageFinished()) {
            return;
        }
        final FrameBuffer.BufferedMessage buffered = frameBuffer.takeAndClear();
        final Fragmentizer fragmentizer = new Fragmentizer(
                buffered.getFragmentLengths(), event.isText(), config.getFragmentSize());
        final WebSocketMessage message = new WebSocketMessage(
                event.isText() ? MessageType.TEXT : MessageType.BINARY, fromClient, buffered.getContent());
        flow.addMessage(message);
        hooks.websocketMessage(flow);
        if (message.isKilled()) {
            if (LOG.isDebugEnabled()) {
                LOG.debug("{}: message from {} killed", context, side(fromClient));
            }
            return;
        }
        for (final MessageEvent part : fragmentizer.fragment(message.getContent())) {
            send(destination, part);
        }
    }

    private void onClose(final boolean fromClient, final CloseEvent event) {
        flow.setClosedByClient(fromClient);
        flow.setCloseCode(event.getCode());
        flow.setCloseReason(event.getReason());
        if (LOG.isDebugEnabled()) {
            LOG.debug("{}: {} closed by {}", context, event, side(fromClient));
        }
        for (final PeerCodec codec : new PeerCodec[] {serverCodec, clientCodec}) {
            if (codec.canSendClose()) {
                send(codec, event);
            }
            transport.close(codec.getConnection());
        }
        terminated = true;
        state = State.DONE;
        if (LOG.isDebugEnabled()) {
            LOG.debug("{}: {} -> {}", context, State.RELAYING, State.DONE);
        }
        if (CloseCodec.isNormalClosure(event.getCode())) {
            hooks.websocketEnd(flow);
        } else {
            flow.setError(new FlowError("WebSocket Error: " + CloseCodec.format(event.getCode(), event.getReason())));
            hooks.websocketError(flow);
        }
    }

    private void fail(final RuntimeException ex) {
        if (terminated) {
            throw ex;
        }
        LOG.warn("{}: WebSocket relay failed: {}", context, ex.getMessage(), ex);
        terminated = true;
        state = State.DONE;
        transport.close(context.getServer());
        transport.close(context.getClient());
        flow.setError(new FlowError("WebSocket Error: " + ex.getMessage()));
        hooks.websocketError(flow);
    }

    private void send(final PeerCodec codec, final WebSocketEvent event) {
        transport.send(codec.getConnection(), codec.encode(event));
    }

    private static String side(final boolean fromClient) {
        return fromClient ? "client" : "server";
    }

    static String formatPayload(final byte[] payload) {
        final StringBuilder buf = new StringBuilder(payload.length + 3);
        buf.append("b'");
        for (final byte b : payload) {
            final int c = b & 0xFF;
            if (c == '\\' || c == '\'') {
                buf.append('\\').append((char) c);
            } else if (c >= 0x20 && c < 0x7F) {
                buf.append((char) c);
            } else {
                buf.append("\\x").append(Character.forDigit(c >> 4, 16)).append(Character.forDigit(c & 0xF, 16));
            }
        }
        return buf.append('\'').toString();
    }

}

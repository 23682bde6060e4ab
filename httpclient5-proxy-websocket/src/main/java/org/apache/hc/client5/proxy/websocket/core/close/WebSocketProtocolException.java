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
package org.apache.hc.client5.proxy.websocket.core.close;

/**
 * Signals a violation of RFC 6455 / RFC 7692 by a peer. Carries the close code
 * that should be reported for the violation.
 *
 * @since 5.6
 */
public class WebSocketProtocolException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int closeCode;

    public WebSocketProtocolException(final int closeCode, final String message) {
        super(message);
        this.closeCode = closeCode;
    }

    public WebSocketProtocolException(final int closeCode, final String message, final Throwable cause) {
        super(message, cause);
        this.closeCode = closeCode;
    }

    public int getCloseCode() {
        return closeCode;
    }
}

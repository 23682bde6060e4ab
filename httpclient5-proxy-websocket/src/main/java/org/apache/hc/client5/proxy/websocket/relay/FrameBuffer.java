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

import java.util.ArrayList;
import java.util.List;

import org.apache.hc.core5.util.Args;

/**
 * Accumulates the fragments of the message currently arriving on one side.
 */
final class FrameBuffer {

    private final List<byte[]> chunks = new ArrayList<>();

    void append(final byte[] chunk) {
        Args.notNull(chunk, "Chunk");
        chunks.add(chunk);
    }

    boolean isEmpty() {
        return chunks.isEmpty();
    }

    int size() {
        return chunks.size();
    }

    /**
     * Returns the buffered message and empties the buffer.
     */
    BufferedMessage takeAndClear() {
        int total = 0;
        final int[] lengths = new int[chunks.size()];
        for (int i = 0; i < lengths.length; i++) {
            lengths[i] = chunks.get(i).length;
            total += lengths[i];
        }
        final byte[] content = new byte[total];
        int off = 0;
        for (final byte[] chunk : chunks) {
            System.arraycopy(chunk, 0, content, off, chunk.length);
            off += chunk.length;
        }
        chunks.clear();
        return new BufferedMessage(content, lengths);
    }

    static final class BufferedMessage {

        private final byte[] content;
        private final int[] fragmentLengths;

        BufferedMessage(final byte[] content, final int[] fragmentLengths) {
            this.content = content;
            this.fragmentLengths = fragmentLengths;
        }

        byte[] getContent() {
            return content;
        }

        int[] getFragmentLengths() {
            return fragmentLengths;
        }
    }
}

package io.camdash.jetty.testserver;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.OutputStream;

/// Writes a response body in flushed slices with an optional pause between them.
final class PacedWriter {

    private PacedWriter() {
    }

    /// Writes the whole buffer.
    ///
    /// @param out the response stream
    /// @param data the bytes to write
    /// @param chunk the slice size, at least 1
    /// @param delayMs the pause after each slice except the last
    /// @throws IOException if the client went away or the pause was interrupted
    static void write(OutputStream out, byte[] data, int chunk, long delayMs) throws IOException {
        write(out, data, data.length, chunk, delayMs);
    }

    /// Writes the first `limit` bytes of the buffer.
    ///
    /// @param out the response stream
    /// @param data the bytes to write
    /// @param limit how many bytes of `data` to write
    /// @param chunk the slice size, at least 1
    /// @param delayMs the pause after each slice except the last
    /// @throws IOException if the client went away or the pause was interrupted
    static void write(OutputStream out, byte[] data, int limit, int chunk, long delayMs) throws IOException {
        int slice = Math.max(1, chunk);
        int position = 0;
        while (position < limit) {
            int length = Math.min(slice, limit - position);
            out.write(data, position, length);
            out.flush();
            position += length;
            if (delayMs > 0 && position < limit) {
                try {
                    Thread.sleep(delayMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new InterruptedIOException("Interrupted while pacing response");
                }
            }
        }
    }
}

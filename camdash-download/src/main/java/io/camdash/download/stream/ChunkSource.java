package io.camdash.download.stream;

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

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;

/// A readable response body.
///
/// Unlike an {@link InputStream} a source may return 0 from {@link #read(byte[])} without
/// being exhausted.
public interface ChunkSource extends Closeable {

    /// Reads up to `buffer.length` bytes.
    ///
    /// @param buffer the destination
    /// @return the number of bytes read, 0 if none are available yet, or -1 at end of stream
    /// @throws IOException on a read error
    int read(byte[] buffer) throws IOException;

    /// @param in the stream to adapt
    /// @return a source reading from the stream
    static ChunkSource of(InputStream in) {
        return new ChunkSource() {
            @Override
            public int read(byte[] buffer) throws IOException {
                return in.read(buffer, 0, buffer.length);
            }

            @Override
            public void close() throws IOException {
                in.close();
            }
        };
    }
}

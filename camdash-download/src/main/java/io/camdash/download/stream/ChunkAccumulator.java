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

import java.util.ArrayList;
import java.util.List;

/// An append-only, ordered list of received chunks for one transfer.
///
/// Once invalidated the accumulator drops what it holds and refuses further appends.
public class ChunkAccumulator {

    private final List<byte[]> chunks = new ArrayList<>();
    private long receivedBytes;
    private boolean invalidated;

    /// Appends a chunk. The array is retained, not copied.
    ///
    /// @param chunk the bytes received
    /// @return false if the accumulator was invalidated and the chunk was refused
    public synchronized boolean append(byte[] chunk) {
        if (invalidated) {
            return false;
        }
        chunks.add(chunk);
        receivedBytes += chunk.length;
        return true;
    }

    /// Drops every chunk and refuses further appends.
    public synchronized void invalidate() {
        invalidated = true;
        chunks.clear();
    }

    /// @return true once invalidated
    public synchronized boolean isInvalidated() {
        return invalidated;
    }

    /// @return the sum of all appended chunk lengths
    public synchronized long receivedBytes() {
        return receivedBytes;
    }

    /// @return the number of chunks held
    public synchronized int chunkCount() {
        return chunks.size();
    }

    /// @return the chunks in arrival order
    /// @throws IllegalStateException if the accumulator was invalidated
    public synchronized List<byte[]> drain() {
        if (invalidated) {
            throw new IllegalStateException("accumulator was invalidated");
        }
        return List.copyOf(chunks);
    }

    /// Concatenates chunks into one array sized to their total length.
    ///
    /// @param chunks the chunks in order
    /// @return the contiguous bytes
    /// @throws IllegalArgumentException if the total exceeds the largest array size
    public static byte[] assemble(List<byte[]> chunks) {
        long total = 0;
        for (byte[] chunk : chunks) {
            total += chunk.length;
        }
        if (total > Integer.MAX_VALUE - 8) {
            throw new IllegalArgumentException("archive too large to assemble in memory: " + total + " bytes");
        }
        byte[] assembled = new byte[(int) total];
        int offset = 0;
        for (byte[] chunk : chunks) {
            System.arraycopy(chunk, 0, assembled, offset, chunk.length);
            offset += chunk.length;
        }
        return assembled;
    }
}

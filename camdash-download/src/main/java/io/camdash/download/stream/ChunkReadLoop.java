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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.Arrays;
import java.util.function.LongConsumer;

/// Reads a {@link ChunkSource} to exhaustion, one chunk per read, into a {@link ChunkAccumulator}.
///
/// The token is checked before each read. On cancellation the source is closed and the
/// accumulator invalidated, and the loop returns {@link Outcome#CANCELLED}.
public class ChunkReadLoop {
    private static final Logger logger = LogManager.getLogger(ChunkReadLoop.class);

    /// How the loop ended
    public enum Outcome {
        COMPLETED,
        CANCELLED
    }

    private final ChunkSource source;
    private final CancellationToken token;
    private final int bufferSize;

    /// @param source the body to read
    /// @param token the transfer's cancellation token
    /// @param bufferSize the largest chunk to read at once
    public ChunkReadLoop(ChunkSource source, CancellationToken token, int bufferSize) {
        if (bufferSize <= 0) {
            throw new IllegalArgumentException("bufferSize must be positive: " + bufferSize);
        }
        this.source = source;
        this.token = token;
        this.bufferSize = bufferSize;
    }

    /// Runs the loop.
    ///
    /// @param accumulator receives each chunk in arrival order
    /// @param onProgress receives the running byte count after each non-empty chunk
    /// @return whether the body was read fully or the transfer was cancelled
    /// @throws IOException on a read error not caused by cancellation
    public Outcome run(ChunkAccumulator accumulator, LongConsumer onProgress) throws IOException {
        byte[] buffer = new byte[bufferSize];
        long received = 0;
        int emptyReads = 0;
        while (true) {
            if (token.isCancelled()) {
                return abandon(accumulator, received);
            }
            int n;
            try {
                n = source.read(buffer);
            } catch (IOException e) {
                if (token.isCancelled()) {
                    logger.debug("Read interrupted by cancellation after {} bytes: {}", received, e.getMessage());
                    return abandon(accumulator, received);
                }
                throw e;
            }
            if (n < 0) {
                if (emptyReads > 0) {
                    logger.trace("Stream ended after {} empty reads", emptyReads);
                }
                return Outcome.COMPLETED;
            }
            if (n == 0) {
                emptyReads++;
                continue;
            }
            if (!accumulator.append(Arrays.copyOf(buffer, n))) {
                return abandon(accumulator, received);
            }
            received += n;
            onProgress.accept(received);
        }
    }

    private Outcome abandon(ChunkAccumulator accumulator, long received) {
        accumulator.invalidate();
        try {
            source.close();
        } catch (IOException e) {
            logger.debug("Error closing cancelled body after {} bytes: {}", received, e.getMessage());
        }
        logger.debug("Read loop cancelled after {} bytes", received);
        return Outcome.CANCELLED;
    }
}

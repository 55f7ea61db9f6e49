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

import io.camdash.download.ScriptedChunkSource;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ChunkReadLoopTest {

    @Test
    public void testReadsToEnd() throws IOException {
        byte[] data = new byte[10_000];
        for (int i = 0; i < data.length; i++) {
            data[i] = (byte) i;
        }
        ChunkAccumulator accumulator = new ChunkAccumulator();
        List<Long> progress = new ArrayList<>();

        ChunkReadLoop.Outcome outcome = new ChunkReadLoop(
            ChunkSource.of(new ByteArrayInputStream(data)), new CancellationToken(), 4096)
            .run(accumulator, progress::add);

        assertEquals(ChunkReadLoop.Outcome.COMPLETED, outcome);
        assertArrayEquals(data, ChunkAccumulator.assemble(accumulator.drain()));
        assertThat(progress).containsExactly(4096L, 8192L, 10_000L);
    }

    @Test
    public void testEmptyReadsAreNotEndOfStream() throws IOException {
        ScriptedChunkSource source = new ScriptedChunkSource()
            .emptyRead()
            .chunk(new byte[]{1})
            .emptyRead()
            .emptyRead()
            .chunk(new byte[]{2, 3});
        ChunkAccumulator accumulator = new ChunkAccumulator();
        List<Long> progress = new ArrayList<>();

        ChunkReadLoop.Outcome outcome = new ChunkReadLoop(source, new CancellationToken(), 16)
            .run(accumulator, progress::add);

        assertEquals(ChunkReadLoop.Outcome.COMPLETED, outcome);
        assertEquals(6, source.reads());
        assertArrayEquals(new byte[]{1, 2, 3}, ChunkAccumulator.assemble(accumulator.drain()));
        assertThat(progress).containsExactly(1L, 3L);
    }

    @Test
    public void testCancellationClosesSourceAndDropsBuffer() throws IOException {
        CancellationToken token = new CancellationToken();
        ScriptedChunkSource source = ScriptedChunkSource.of(new byte[4], new byte[4], new byte[4], new byte[4]);
        ChunkAccumulator accumulator = new ChunkAccumulator();

        ChunkReadLoop.Outcome outcome = new ChunkReadLoop(source, token, 16).run(accumulator, received -> {
            if (received == 8) {
                token.cancel();
            }
        });

        assertEquals(ChunkReadLoop.Outcome.CANCELLED, outcome);
        assertEquals(2, source.reads());
        assertTrue(source.isClosed());
        assertTrue(accumulator.isInvalidated());
    }

    @Test
    public void testErrorAfterCancellationIsCancellation() throws IOException {
        CancellationToken token = new CancellationToken();
        ScriptedChunkSource source = new ScriptedChunkSource()
            .chunk(new byte[4])
            .fail(new IOException("Socket closed"))
            .onRead(2, token::cancel);

        ChunkReadLoop.Outcome outcome = new ChunkReadLoop(source, token, 16).run(new ChunkAccumulator(), received -> {
        });

        assertEquals(ChunkReadLoop.Outcome.CANCELLED, outcome);
    }

    @Test
    public void testReadErrorPropagates() {
        ScriptedChunkSource source = new ScriptedChunkSource()
            .chunk(new byte[4])
            .fail(new IOException("Connection reset"));

        assertThatThrownBy(() -> new ChunkReadLoop(source, new CancellationToken(), 16)
            .run(new ChunkAccumulator(), received -> {
            }))
            .isInstanceOf(IOException.class)
            .hasMessage("Connection reset");
    }
}

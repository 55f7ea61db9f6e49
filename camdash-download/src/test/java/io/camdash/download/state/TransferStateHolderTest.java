package io.camdash.download.state;

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

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TransferStateHolderTest {

    @Test
    public void testStartsIdle() {
        TransferStateHolder holder = new TransferStateHolder();
        assertEquals(TransferState.IDLE, holder.get());
        assertFalse(holder.get().active());
    }

    @Test
    public void testPercentNeverDecreases() {
        TransferStateHolder holder = new TransferStateHolder();
        long generation = holder.begin(1, "Compressing recording...");
        holder.update(generation, s -> s.withPercent(40));
        holder.update(generation, s -> s.withProgress(100, 20));

        assertEquals(40, holder.get().percent());
        assertEquals(100, holder.get().receivedBytes());
    }

    @Test
    public void testStaleWritesAreDiscarded() {
        TransferStateHolder holder = new TransferStateHolder();
        long first = holder.begin(1, "first");
        long second = holder.begin(2, "second");

        assertFalse(holder.update(first, s -> s.withPercent(70)));
        assertFalse(holder.reset(first));
        assertEquals("second", holder.get().statusText());
        assertEquals(0, holder.get().percent());

        assertTrue(holder.reset(second));
        assertFalse(holder.update(second, s -> s.withPercent(10)));
        assertEquals(TransferState.IDLE, holder.get());
    }

    @Test
    public void testListenersSeeChangesInOrder() {
        TransferStateHolder holder = new TransferStateHolder();
        List<String> seen = new ArrayList<>();
        holder.addListener((previous, current) -> seen.add(previous.percent() + "->" + current.percent()));
        holder.addListener((previous, current) -> {
            throw new IllegalStateException("listener failure");
        });

        long generation = holder.begin(1, "x");
        holder.update(generation, s -> s.withPercent(10));
        holder.update(generation, s -> s.withPercent(10));
        holder.update(generation, s -> s.finalizing("done", 5));
        holder.reset(generation);
        holder.forceIdle();

        assertThat(seen).containsExactly("0->0", "0->10", "10->100", "100->0");
    }

    @Test
    public void testIdleStateCarriesNoProgress() {
        assertThatThrownBy(() -> new TransferState(TransferPhase.IDLE, 10, "", 1, 0, -1))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TransferState(TransferPhase.IDLE, 0, "busy", 1, 0, -1))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TransferState.requesting(0, "x"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(TransferPhase.FINALIZING.isCancellable()).isFalse();
        assertThat(TransferPhase.STREAMING.isCancellable()).isTrue();
    }
}

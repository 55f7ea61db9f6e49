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

import java.util.Objects;

/// An immutable snapshot of the shared transfer state.
///
/// When the phase is {@link TransferPhase#IDLE} the percent is 0 and the status text is empty.
///
/// @param phase the current phase
/// @param percent progress within 0..100
/// @param statusText the human readable status line
/// @param itemCount how many recordings the transfer covers, at least 1
/// @param receivedBytes bytes read so far
/// @param totalBytes the declared body length, or -1 when unknown
public record TransferState(
    TransferPhase phase,
    int percent,
    String statusText,
    int itemCount,
    long receivedBytes,
    long totalBytes
) {
    /// The state before the first transfer and after every reset
    public static final TransferState IDLE = new TransferState(TransferPhase.IDLE, 0, "", 1, 0L, -1L);

    public TransferState {
        Objects.requireNonNull(phase, "phase");
        Objects.requireNonNull(statusText, "statusText");
        if (percent < 0 || percent > 100) {
            throw new IllegalArgumentException("percent must be within 0..100: " + percent);
        }
        if (itemCount < 1) {
            throw new IllegalArgumentException("itemCount must be at least 1: " + itemCount);
        }
        if (receivedBytes < 0) {
            throw new IllegalArgumentException("receivedBytes cannot be negative: " + receivedBytes);
        }
        if (phase == TransferPhase.IDLE && (percent != 0 || !statusText.isEmpty())) {
            throw new IllegalArgumentException("an idle state carries no progress: " + percent + " '" + statusText + "'");
        }
    }

    /// @param itemCount the number of recordings requested
    /// @param statusText the compressing label
    /// @return the state of a freshly issued request
    public static TransferState requesting(int itemCount, String statusText) {
        return new TransferState(TransferPhase.REQUESTING, 0, statusText, itemCount, 0L, -1L);
    }

    /// @return true unless idle
    public boolean active() {
        return phase.isActive();
    }

    /// @param statusText the downloading label
    /// @param totalBytes the declared length, or -1
    /// @return this state moved into streaming
    public TransferState streaming(String statusText, long totalBytes) {
        return new TransferState(TransferPhase.STREAMING, percent, statusText, itemCount, receivedBytes, totalBytes);
    }

    /// @param receivedBytes the bytes read so far
    /// @param percent the estimated percent
    /// @return this state with updated counters
    public TransferState withProgress(long receivedBytes, int percent) {
        return new TransferState(phase, percent, statusText, itemCount, receivedBytes, totalBytes);
    }

    /// @param percent the estimated percent
    /// @return this state with an updated percent
    public TransferState withPercent(int percent) {
        return new TransferState(phase, percent, statusText, itemCount, receivedBytes, totalBytes);
    }

    /// @param statusText the finalizing label
    /// @param receivedBytes the final body size
    /// @return this state moved into finalizing at 100 percent
    public TransferState finalizing(String statusText, long receivedBytes) {
        return new TransferState(TransferPhase.FINALIZING, 100, statusText, itemCount, receivedBytes, totalBytes);
    }
}

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

/// Lifecycle phases of a transfer, as seen through {@link TransferState}.
///
/// `IDLE → REQUESTING → STREAMING → FINALIZING → IDLE` on success; `REQUESTING` and
/// `STREAMING` fall back to `IDLE` on cancellation or failure.
public enum TransferPhase {
    /// No transfer is running
    IDLE,
    /// The request was issued and no body has been read yet
    REQUESTING,
    /// The body is being read
    STREAMING,
    /// The body is complete and the artifact is being saved; not cancellable
    FINALIZING;

    /// @return true for every phase except {@link #IDLE}
    public boolean isActive() {
        return this != IDLE;
    }

    /// @return true if a transfer in this phase may still be cancelled
    public boolean isCancellable() {
        return this == REQUESTING || this == STREAMING;
    }
}

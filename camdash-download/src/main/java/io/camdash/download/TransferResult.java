package io.camdash.download;

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

import java.nio.file.Path;
import java.util.Objects;

/// The resolved outcome of a transfer that did not fail.
///
/// @param status whether the artifact was saved or the transfer was cancelled
/// @param path the saved artifact, null when cancelled
/// @param bytes the number of bytes saved, 0 when cancelled
/// @param destinationFilename the requested destination filename
public record TransferResult(Status status, Path path, long bytes, String destinationFilename) {

    /// Terminal outcomes of a transfer that completed without error
    public enum Status {
        /// The full body was received and persisted
        SAVED,
        /// The transfer was cancelled or superseded before finalization
        CANCELLED
    }

    public TransferResult {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(destinationFilename, "destinationFilename");
        if (status == Status.SAVED && path == null) {
            throw new IllegalArgumentException("a saved result requires a path");
        }
    }

    /// @param request the completed request
    /// @param path where the artifact was written
    /// @param bytes the artifact size
    /// @return a saved result
    public static TransferResult saved(TransferRequest request, Path path, long bytes) {
        return new TransferResult(Status.SAVED, path, bytes, request.destinationFilename());
    }

    /// @param request the cancelled request
    /// @return a cancelled result
    public static TransferResult cancelled(TransferRequest request) {
        return new TransferResult(Status.CANCELLED, null, 0L, request.destinationFilename());
    }

    /// @return true if the artifact was saved
    public boolean isSaved() {
        return status == Status.SAVED;
    }
}

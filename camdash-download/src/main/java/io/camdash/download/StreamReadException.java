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

/// An I/O error interrupted the response body before it was fully received.
///
/// The partial buffer is discarded and never materialized.
public class StreamReadException extends TransferFailedException {

    private final long receivedBytes;

    /// @param request the failed request
    /// @param receivedBytes the bytes received before the error
    /// @param cause the I/O error
    public StreamReadException(TransferRequest request, long receivedBytes, Throwable cause) {
        super(request, "Stream read failed after " + receivedBytes + " bytes for "
            + request.destinationFilename() + ": " + cause.getMessage(), cause);
        this.receivedBytes = receivedBytes;
    }

    /// @return the bytes received before the error
    public long getReceivedBytes() {
        return receivedBytes;
    }
}

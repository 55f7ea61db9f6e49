package io.camdash.download.transport;

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

import io.camdash.download.stream.ChunkSource;

import java.io.Closeable;

/// A response to a transfer request, open until closed.
public interface TransferResponse extends Closeable {

    /// @return the HTTP status code
    int statusCode();

    /// @return true for a 2xx status
    default boolean isSuccessful() {
        return statusCode() >= 200 && statusCode() < 300;
    }

    /// @return the declared body length, or -1 when unknown
    long contentLength();

    /// Reads the error detail of a non-success response. Consumes the body.
    ///
    /// @return the `detail` field of a JSON error body, the raw body text, or the status message
    String errorDetail();

    /// @return the response body; closing it releases the response
    ChunkSource body();
}

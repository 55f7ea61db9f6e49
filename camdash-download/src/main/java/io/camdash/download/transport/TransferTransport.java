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

import io.camdash.download.TransferRequest;
import io.camdash.download.stream.CancellationToken;

import java.io.Closeable;
import java.io.IOException;

/// Issues a {@link TransferRequest} and hands back the response for reading.
///
/// Implementations bind the in-flight request to the token so that cancelling the token
/// aborts a pending call and unblocks any read on the body.
public interface TransferTransport extends Closeable {

    /// Issues the request and waits for the response headers.
    ///
    /// @param request the request to issue
    /// @param token the transfer's cancellation token
    /// @return the response, which the caller must close
    /// @throws IOException if no response could be obtained
    TransferResponse open(TransferRequest request, CancellationToken token) throws IOException;
}

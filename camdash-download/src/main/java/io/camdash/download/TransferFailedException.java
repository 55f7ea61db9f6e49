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

/// Base type for every way a transfer can fail.
///
/// A cancelled transfer is not a failure and never produces one of these; it resolves
/// with {@link TransferResult#cancelled(TransferRequest)} instead.
public class TransferFailedException extends Exception {

    private final TransferRequest request;

    /// @param request the request that failed
    /// @param message the failure description
    /// @param cause the underlying cause, may be null
    public TransferFailedException(TransferRequest request, String message, Throwable cause) {
        super(message, cause);
        this.request = request;
    }

    /// @return the request that failed
    public TransferRequest getRequest() {
        return request;
    }
}

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

/// The producer answered with a non-success status, or no response could be obtained.
///
/// No bytes of the body were read and nothing was persisted.
public class RequestFailedException extends TransferFailedException {

    /// Status code used when the request never produced a response
    public static final int NO_RESPONSE = 0;

    private final int statusCode;
    private final String detail;

    /// @param request the failed request
    /// @param statusCode the response status, or {@link #NO_RESPONSE}
    /// @param detail the producer's error detail, or the connection error message
    /// @param cause the underlying cause, may be null
    public RequestFailedException(TransferRequest request, int statusCode, String detail, Throwable cause) {
        super(request, describe(request, statusCode, detail), cause);
        this.statusCode = statusCode;
        this.detail = detail;
    }

    /// @return the response status, or {@link #NO_RESPONSE} when none was received
    public int getStatusCode() {
        return statusCode;
    }

    /// @return the error detail reported for the failure
    public String getDetail() {
        return detail;
    }

    private static String describe(TransferRequest request, int statusCode, String detail) {
        String target = request.method() + " " + request.uri();
        if (statusCode == NO_RESPONSE) {
            return "Request failed without a response: " + target + ": " + detail;
        }
        return "Request failed with status " + statusCode + ": " + target
            + (detail == null || detail.isEmpty() ? "" : ": " + detail);
    }
}

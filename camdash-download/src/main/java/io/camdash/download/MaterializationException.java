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

/// The fully received artifact could not be persisted.
///
/// The staging resource has already been released when this is raised.
public class MaterializationException extends TransferFailedException {

    /// @param request the request whose artifact failed to persist
    /// @param cause the persistence error
    public MaterializationException(TransferRequest request, Throwable cause) {
        super(request, "Failed to save " + request.destinationFilename() + ": " + cause.getMessage(), cause);
    }
}

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
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.io.InputStream;

/// {@link TransferResponse} over an OkHttp {@link Response}.
///
/// Owns the response: closing this object, or the source returned by {@link #body()},
/// closes the body and the response.
public class OkHttpTransferResponse implements TransferResponse {

    private final Response response;
    private final ResponseBody responseBody;
    private volatile boolean closed = false;

    /// @param response the response, ownership is transferred to this object
    public OkHttpTransferResponse(Response response) {
        this.response = response;
        this.responseBody = response.body();
    }

    @Override
    public int statusCode() {
        return response.code();
    }

    @Override
    public boolean isSuccessful() {
        return response.isSuccessful();
    }

    @Override
    public long contentLength() {
        if (responseBody != null) {
            long length = responseBody.contentLength();
            if (length >= 0) {
                return length;
            }
        }
        String header = response.header("Content-Length");
        if (header != null) {
            try {
                return Long.parseLong(header.trim());
            } catch (NumberFormatException e) {
                return -1;
            }
        }
        return -1;
    }

    @Override
    public String errorDetail() {
        String fallback = response.message() == null || response.message().isEmpty()
            ? "HTTP " + response.code()
            : response.message();
        if (responseBody == null) {
            return fallback;
        }
        try {
            return ErrorDetails.parse(responseBody.string(), fallback);
        } catch (IOException e) {
            return fallback + " (error body unreadable: " + e.getMessage() + ")";
        }
    }

    @Override
    public ChunkSource body() {
        if (closed) {
            throw new IllegalStateException("response has been closed");
        }
        if (responseBody == null) {
            throw new IllegalStateException("response has no body");
        }
        InputStream in = responseBody.byteStream();
        return new ChunkSource() {
            @Override
            public int read(byte[] buffer) throws IOException {
                return in.read(buffer, 0, buffer.length);
            }

            @Override
            public void close() {
                OkHttpTransferResponse.this.close();
            }
        };
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            try {
                if (responseBody != null) {
                    responseBody.close();
                }
            } finally {
                response.close();
            }
        }
    }
}

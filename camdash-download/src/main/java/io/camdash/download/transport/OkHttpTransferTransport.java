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
import io.camdash.download.TransferSettings;
import io.camdash.download.stream.CancellationToken;
import okhttp3.Call;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/// {@link TransferTransport} backed by OkHttp.
///
/// The client never retries on its own and follows redirects. The idle read timeout comes
/// from {@link TransferSettings#readTimeout()}, where zero means no timeout.
public class OkHttpTransferTransport implements TransferTransport {
    private static final Logger logger = LogManager.getLogger(OkHttpTransferTransport.class);
    private static final Set<String> BODY_REQUIRED = Set.of("POST", "PUT", "PATCH");

    private final OkHttpClient httpClient;
    private final boolean ownsClient;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /// @param settings the connect and read timeouts to apply
    public OkHttpTransferTransport(TransferSettings settings) {
        this(createHttpClient(settings), true);
    }

    /// Uses a caller-supplied client, which is left open on {@link #close()}.
    ///
    /// @param httpClient the client
    public OkHttpTransferTransport(OkHttpClient httpClient) {
        this(httpClient, false);
    }

    private OkHttpTransferTransport(OkHttpClient httpClient, boolean ownsClient) {
        this.httpClient = httpClient;
        this.ownsClient = ownsClient;
    }

    /// Creates the client used for archive transfers.
    ///
    /// @param settings the timeouts to apply
    /// @return a configured client
    public static OkHttpClient createHttpClient(TransferSettings settings) {
        return new OkHttpClient.Builder()
            .connectTimeout(settings.connectTimeout().toMillis(), TimeUnit.MILLISECONDS)
            .readTimeout(settings.readTimeout().toMillis(), TimeUnit.MILLISECONDS)
            .writeTimeout(settings.connectTimeout().toMillis(), TimeUnit.MILLISECONDS)
            .retryOnConnectionFailure(false)
            .followRedirects(true)
            .followSslRedirects(true)
            .build();
    }

    @Override
    public TransferResponse open(TransferRequest request, CancellationToken token) throws IOException {
        if (closed.get()) {
            throw new IllegalStateException("transport has been closed");
        }
        Call call = httpClient.newCall(toHttpRequest(request));
        token.onCancel(call::cancel);
        logger.debug("{} {}", request.method(), request.uri());
        Response response = call.execute();
        logger.debug("{} {} -> {}", request.method(), request.uri(), response.code());
        return new OkHttpTransferResponse(response);
    }

    /// Translates a transfer request into an OkHttp request.
    ///
    /// @param request the transfer request
    /// @return the OkHttp request
    static Request toHttpRequest(TransferRequest request) {
        HttpUrl url = HttpUrl.get(request.uri().toString());
        Request.Builder builder = new Request.Builder().url(url);
        String contentType = null;
        for (Map.Entry<String, String> header : request.headers().entrySet()) {
            if (header.getKey().equalsIgnoreCase("Content-Type")) {
                contentType = header.getValue();
            } else {
                builder.addHeader(header.getKey(), header.getValue());
            }
        }
        RequestBody body = null;
        MediaType mediaType = contentType == null ? null : MediaType.parse(contentType);
        if (request.hasBody()) {
            body = RequestBody.create(request.body(), mediaType);
        } else if (BODY_REQUIRED.contains(request.method())) {
            body = RequestBody.create(new byte[0], mediaType);
        }
        return builder.method(request.method(), body).build();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true) && ownsClient) {
            httpClient.dispatcher().executorService().shutdown();
            httpClient.connectionPool().evictAll();
        }
    }
}

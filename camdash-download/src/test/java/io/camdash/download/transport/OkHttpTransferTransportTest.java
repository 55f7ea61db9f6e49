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
import io.camdash.download.stream.ChunkSource;
import io.camdash.jetty.testserver.JettyArchiveServerExtension;
import io.camdash.jetty.testserver.RecordingFixtures;
import okhttp3.Request;
import okio.Buffer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;

@ExtendWith(JettyArchiveServerExtension.class)
public class OkHttpTransferTransportTest {

    private static URI base() throws Exception {
        return JettyArchiveServerExtension.getBaseUrl().toURI();
    }

    @Test
    public void testRequestTranslation() throws IOException {
        TransferRequest request = TransferRequest.builder(URI.create("http://h/api/x"), "x.zip")
            .method("POST")
            .header("Authorization", "Bearer t")
            .body("{}".getBytes(StandardCharsets.UTF_8), "application/json")
            .build();

        Request http = OkHttpTransferTransport.toHttpRequest(request);

        assertEquals("POST", http.method());
        assertEquals("Bearer t", http.header("Authorization"));
        assertNull(http.header("Content-Type"));
        assertEquals("application/json", http.body().contentType().toString());
        Buffer sink = new Buffer();
        http.body().writeTo(sink);
        assertEquals("{}", sink.readUtf8());
    }

    @Test
    public void testPostWithoutBodySendsEmptyBody() throws IOException {
        Request http = OkHttpTransferTransport.toHttpRequest(
            TransferRequest.builder(URI.create("http://h/api/x"), "x.zip").method("POST").build());
        assertEquals(0, http.body().contentLength());
    }

    @Test
    public void testStreamsBodyWithDeclaredLength() throws Exception {
        TransferSettings settings = TransferSettings.defaults().withReadTimeout(Duration.ofSeconds(10));
        try (OkHttpTransferTransport transport = new OkHttpTransferTransport(settings);
             TransferResponse response = transport.open(
                 TransferRequest.get(base().resolve("stream?size=3000&seed=5"), "s.bin"), new CancellationToken())) {
            assertEquals(200, response.statusCode());
            assertEquals(3000, response.contentLength());
            assertArrayEquals(RecordingFixtures.bytes(5, 3000), readAll(response.body()));
        }
    }

    @Test
    public void testErrorDetail() throws Exception {
        try (OkHttpTransferTransport transport = new OkHttpTransferTransport(TransferSettings.defaults());
             TransferResponse response = transport.open(
                 TransferRequest.get(base().resolve("stream?status=503"), "s.bin"), new CancellationToken())) {
            assertFalse(response.isSuccessful());
            assertEquals(503, response.statusCode());
            assertEquals("Scripted failure with status 503", response.errorDetail());
        }
    }

    @Test
    public void testCancelledTokenAbortsCall() throws Exception {
        CancellationToken token = new CancellationToken();
        token.cancel();
        try (OkHttpTransferTransport transport = new OkHttpTransferTransport(TransferSettings.defaults())) {
            assertThatThrownBy(() -> transport.open(TransferRequest.get(base().resolve("stream"), "s.bin"), token))
                .isInstanceOf(IOException.class);
        }
    }

    @Test
    public void testChunkedBodyHasUnknownLength() throws Exception {
        try (OkHttpTransferTransport transport = new OkHttpTransferTransport(TransferSettings.defaults());
             TransferResponse response = transport.open(
                 TransferRequest.get(base().resolve("stream?size=2000&length=chunked"), "s.bin"),
                 new CancellationToken())) {
            assertEquals(-1, response.contentLength());
            assertThat(readAll(response.body())).hasSize(2000);
        }
    }

    private static byte[] readAll(ChunkSource source) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] buffer = new byte[1024];
        int n;
        while ((n = source.read(buffer)) >= 0) {
            out.write(buffer, 0, n);
        }
        return out.toByteArray();
    }
}

package io.camdash.jetty.testserver;

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

import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;

/// Serves a deterministic byte stream whose shape is controlled by query parameters.
///
/// | parameter | meaning | default |
/// |---|---|---|
/// | `size` | total body bytes | 1000 |
/// | `seed` | content seed for {@link RecordingFixtures#bytes(long, int)} | 1 |
/// | `chunk` | bytes per flushed slice | 250 |
/// | `delayMs` | pause between slices | 0 |
/// | `length` | `declared` sends `Content-Length`, anything else streams chunked | `declared` |
/// | `status` | response status; non-2xx answers with a JSON detail body | 200 |
/// | `breakAfter` | abort the connection after this many bytes | none |
///
/// Both GET and POST are answered the same way.
public class ScriptedStreamServlet extends HttpServlet {
    private static final Logger logger = LogManager.getLogger(ScriptedStreamServlet.class);

    @Override
    protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        serve(req, resp);
    }

    @Override
    protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        serve(req, resp);
    }

    private void serve(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        int status = RecordingArchiveServlet.intParam(req, "status", 200);
        if (status < 200 || status >= 300) {
            RecordingArchiveServlet.sendDetail(resp, status, "Scripted failure with status " + status);
            return;
        }

        int size = RecordingArchiveServlet.intParam(req, "size", 1000);
        int seed = RecordingArchiveServlet.intParam(req, "seed", 1);
        int chunk = RecordingArchiveServlet.intParam(req, "chunk", 250);
        int delayMs = RecordingArchiveServlet.intParam(req, "delayMs", 0);
        int breakAfter = RecordingArchiveServlet.intParam(req, "breakAfter", -1);
        String length = req.getParameter("length");

        byte[] body = RecordingFixtures.bytes(seed, size);
        resp.setStatus(status);
        resp.setContentType("application/octet-stream");
        if (length == null || "declared".equals(length)) {
            resp.setContentLengthLong(size);
        }

        if (breakAfter >= 0 && breakAfter < size) {
            PacedWriter.write(resp.getOutputStream(), body, breakAfter, chunk, delayMs);
            logger.debug("Breaking scripted stream after {} of {} bytes", breakAfter, size);
            // the response is committed, so Jetty aborts the connection instead of sending an error page
            throw new IOException("Scripted stream break after " + breakAfter + " bytes");
        }
        PacedWriter.write(resp.getOutputStream(), body, chunk, delayMs);
    }
}

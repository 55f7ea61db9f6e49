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

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/// Emulates the recordings archive endpoints of the camdash backend.
///
/// - `GET  /api/recordings/download/{folder}/{filename}` zips one recording
/// - `POST /api/recordings/download-bulk` zips every recording named in
///   `{"recording_ids": ["folder::filename", ...]}`, skipping ids that are malformed or missing
///
/// Like the real backend, the archive is built in memory and streamed without a
/// `Content-Length` header. Requests carrying `?length=declared` get the header so the
/// exact progress path can be exercised, and `?chunk=N&delayMs=M` pace the body.
/// Errors are answered with a JSON body of the form `{"detail": "..."}`.
public class RecordingArchiveServlet extends HttpServlet {
    private static final Logger logger = LogManager.getLogger(RecordingArchiveServlet.class);
    private static final DateTimeFormatter ARCHIVE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final Gson GSON = new Gson();

    private final Path recordingsRoot;
    private final AtomicInteger archivesServed = new AtomicInteger();

    /// @param recordingsRoot the directory holding `folder/filename` recordings
    public RecordingArchiveServlet(Path recordingsRoot) {
        this.recordingsRoot = recordingsRoot;
    }

    /// @return the number of archives fully written since the server started
    public int getArchivesServed() {
        return archivesServed.get();
    }

    @Override
    protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        String pathInfo = req.getPathInfo() == null ? "" : req.getPathInfo();
        String[] parts = pathInfo.split("/");
        // "", "download", folder, filename
        if (parts.length != 4 || !"download".equals(parts[1])) {
            sendDetail(resp, HttpServletResponse.SC_NOT_FOUND, "Not Found");
            return;
        }
        String folder = parts[2];
        String filename = parts[3];
        Path recording = resolveRecording(folder, filename);
        if (recording == null) {
            sendDetail(resp, HttpServletResponse.SC_NOT_FOUND, "Recording not found");
            return;
        }

        ByteArrayOutputStream archive = new ByteArrayOutputStream();
        try (ZipOutputStream zip = new ZipOutputStream(archive)) {
            addEntry(zip, filename, recording);
        }
        writeArchive(req, resp, archive.toByteArray(), filename.replace(".mp4", ".zip"));
    }

    @Override
    protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        if (!"/download-bulk".equals(req.getPathInfo())) {
            sendDetail(resp, HttpServletResponse.SC_NOT_FOUND, "Not Found");
            return;
        }

        List<String> recordingIds;
        try (Reader reader = req.getReader()) {
            recordingIds = readRecordingIds(reader);
        } catch (JsonParseException | IllegalStateException e) {
            sendDetail(resp, 422, "Invalid request body: " + e.getMessage());
            return;
        }
        if (recordingIds.isEmpty()) {
            sendDetail(resp, HttpServletResponse.SC_BAD_REQUEST, "No recordings specified");
            return;
        }

        ByteArrayOutputStream archive = new ByteArrayOutputStream();
        try (ZipOutputStream zip = new ZipOutputStream(archive)) {
            for (String recordingId : recordingIds) {
                String[] idParts;
                try {
                    idParts = RecordingFixtures.splitId(recordingId);
                } catch (IllegalArgumentException e) {
                    logger.debug("Skipping invalid recording id {}", recordingId);
                    continue;
                }
                Path recording = resolveRecording(idParts[0], idParts[1]);
                if (recording != null) {
                    addEntry(zip, idParts[0] + "/" + idParts[1], recording);
                }
            }
        }
        String archiveName = "recordings_" + LocalDateTime.now().format(ARCHIVE_STAMP) + ".zip";
        writeArchive(req, resp, archive.toByteArray(), archiveName);
    }

    private List<String> readRecordingIds(Reader reader) {
        JsonObject body = GSON.fromJson(reader, JsonObject.class);
        List<String> ids = new ArrayList<>();
        if (body == null || !body.has("recording_ids")) {
            throw new IllegalStateException("recording_ids is required");
        }
        JsonArray array = body.getAsJsonArray("recording_ids");
        for (JsonElement element : array) {
            ids.add(element.getAsString());
        }
        return ids;
    }

    private Path resolveRecording(String folder, String filename) {
        Path candidate = recordingsRoot.resolve(folder).resolve(filename).normalize();
        if (!candidate.startsWith(recordingsRoot) || !Files.isRegularFile(candidate)) {
            return null;
        }
        return candidate;
    }

    private void addEntry(ZipOutputStream zip, String entryName, Path recording) throws IOException {
        zip.putNextEntry(new ZipEntry(entryName));
        Files.copy(recording, zip);
        zip.closeEntry();
    }

    private void writeArchive(HttpServletRequest req, HttpServletResponse resp, byte[] archive, String archiveName)
        throws IOException {
        int chunk = intParam(req, "chunk", 8192);
        long delayMs = intParam(req, "delayMs", 0);

        resp.setStatus(HttpServletResponse.SC_OK);
        resp.setContentType("application/zip");
        resp.setHeader("Content-Disposition", "attachment; filename=\"" + archiveName + "\"");
        if ("declared".equals(req.getParameter("length"))) {
            resp.setContentLengthLong(archive.length);
        }

        OutputStream out = resp.getOutputStream();
        PacedWriter.write(out, archive, chunk, delayMs);
        archivesServed.incrementAndGet();
        logger.debug("Served archive {} ({} bytes)", archiveName, archive.length);
    }

    static int intParam(HttpServletRequest req, String name, int defaultValue) {
        String value = req.getParameter(name);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return Integer.parseInt(value.trim());
    }

    static void sendDetail(HttpServletResponse resp, int status, String detail) throws IOException {
        JsonObject body = new JsonObject();
        body.addProperty("detail", detail);
        byte[] bytes = GSON.toJson(body).getBytes(StandardCharsets.UTF_8);
        resp.setStatus(status);
        resp.setContentType("application/json");
        resp.setContentLength(bytes.length);
        resp.getOutputStream().write(bytes);
    }
}

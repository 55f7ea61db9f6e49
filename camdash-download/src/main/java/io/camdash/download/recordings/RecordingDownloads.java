package io.camdash.download.recordings;

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
import com.google.gson.annotations.SerializedName;
import io.camdash.download.TransferRequest;
import okhttp3.HttpUrl;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Builds {@link TransferRequest}s for the recordings archive endpoints.
///
/// - single: `GET {base}/api/recordings/download/{folder}/{filename}`, saved as the recording
///   name with `.zip` in place of `.mp4`
/// - bulk: `POST {base}/api/recordings/download-bulk` with `{"recording_ids": [...]}`, saved as
///   `recordings_yyyyMMddTHHmmss.zip` in UTC
public class RecordingDownloads {

    /// Path of the single recording endpoint, relative to the base
    public static final String SINGLE_PATH = "api/recordings/download";
    /// Path of the bulk endpoint, relative to the base
    public static final String BULK_PATH = "api/recordings/download-bulk";

    private static final String ARCHIVE_SUFFIX = ".zip";
    private static final String RECORDING_SUFFIX = ".mp4";
    private static final DateTimeFormatter BULK_STAMP =
        DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss").withZone(ZoneOffset.UTC);
    private static final Gson GSON = new Gson();

    private final HttpUrl baseUrl;
    private final Clock clock;
    private final Map<String, String> headers;

    /// @param baseUrl the root of the recordings service
    public RecordingDownloads(URI baseUrl) {
        this(baseUrl, Clock.systemUTC(), Map.of());
    }

    /// @param baseUrl the root of the recordings service
    /// @param clock the clock used to stamp bulk archive names
    /// @param headers headers added to every request, such as `Authorization`
    public RecordingDownloads(URI baseUrl, Clock clock, Map<String, String> headers) {
        HttpUrl parsed = HttpUrl.parse(Objects.requireNonNull(baseUrl, "baseUrl").toString());
        if (parsed == null) {
            throw new IllegalArgumentException("base URL must be HTTP or HTTPS: " + baseUrl);
        }
        this.baseUrl = parsed;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.headers = new LinkedHashMap<>(headers);
    }

    /// @param folder the camera folder
    /// @param filename the recording file
    /// @return a request for the single recording archive
    public TransferRequest single(String folder, String filename) {
        return single(new RecordingId(folder, filename));
    }

    /// @param id the recording
    /// @return a request for the single recording archive
    public TransferRequest single(RecordingId id) {
        URI uri = baseUrl.newBuilder()
            .addPathSegments(SINGLE_PATH)
            .addPathSegment(id.folder())
            .addPathSegment(id.filename())
            .build()
            .uri();
        return TransferRequest.builder(uri, archiveNameFor(id.filename()))
            .headers(headers)
            .itemCount(1)
            .build();
    }

    /// @param ids recording ids of the form `folder::filename`
    /// @return a request for one archive holding every recording
    /// @throws IllegalArgumentException if the selection is empty or an id is malformed
    public TransferRequest bulk(Collection<String> ids) {
        List<RecordingId> parsed = new ArrayList<>(ids.size());
        for (String id : ids) {
            parsed.add(RecordingId.parse(id));
        }
        return bulkOf(parsed);
    }

    /// @param ids the recordings
    /// @return a request for one archive holding every recording
    /// @throws IllegalArgumentException if the selection is empty
    public TransferRequest bulkOf(List<RecordingId> ids) {
        if (ids.isEmpty()) {
            throw new IllegalArgumentException("no recordings selected");
        }
        List<String> wireIds = new ArrayList<>(ids.size());
        for (RecordingId id : ids) {
            wireIds.add(id.toString());
        }
        byte[] body = GSON.toJson(new BulkDownloadBody(wireIds)).getBytes(StandardCharsets.UTF_8);
        URI uri = baseUrl.newBuilder().addPathSegments(BULK_PATH).build().uri();
        return TransferRequest.builder(uri, bulkArchiveName())
            .method("POST")
            .headers(headers)
            .body(body, "application/json")
            .itemCount(ids.size())
            .build();
    }

    /// @return the bulk archive name for the current instant
    public String bulkArchiveName() {
        return "recordings_" + BULK_STAMP.format(clock.instant()) + ARCHIVE_SUFFIX;
    }

    /// @param recordingFilename a recording file name
    /// @return the archive name: `.mp4` replaced by `.zip`, or `.zip` appended
    public static String archiveNameFor(String recordingFilename) {
        if (recordingFilename.regionMatches(true, recordingFilename.length() - RECORDING_SUFFIX.length(),
            RECORDING_SUFFIX, 0, RECORDING_SUFFIX.length())) {
            return recordingFilename.substring(0, recordingFilename.length() - RECORDING_SUFFIX.length())
                + ARCHIVE_SUFFIX;
        }
        return recordingFilename + ARCHIVE_SUFFIX;
    }

    private record BulkDownloadBody(@SerializedName("recording_ids") List<String> recordingIds) {
    }
}

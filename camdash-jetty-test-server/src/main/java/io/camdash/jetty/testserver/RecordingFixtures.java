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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.SplittableRandom;

/// Deterministic recording content for the test archive server.
///
/// Every recording is identified by `folder/filename` and its bytes are derived from a
/// seed computed from that name, so tests can recompute the expected content of any
/// recording without reading it back from the server root.
public final class RecordingFixtures {

    /// The recordings seeded into every server root, keyed by `folder::filename`
    public static final Map<String, Integer> DEFAULT_RECORDINGS;

    static {
        Map<String, Integer> recordings = new LinkedHashMap<>();
        recordings.put("cam-lobby::2026-01-15_08-00-00.mp4", 64 * 1024);
        recordings.put("cam-lobby::2026-01-15_09-00-00.mp4", 200 * 1024 + 17);
        recordings.put("cam-parking::2026-01-15_08-30-00.mp4", 1024 * 1024);
        DEFAULT_RECORDINGS = Collections.unmodifiableMap(recordings);
    }

    private RecordingFixtures() {
    }

    /// Writes every default recording under the given root as `root/folder/filename`.
    ///
    /// @param root the directory to seed
    /// @throws IOException if a recording cannot be written
    public static void seed(Path root) throws IOException {
        for (Map.Entry<String, Integer> entry : DEFAULT_RECORDINGS.entrySet()) {
            String[] parts = splitId(entry.getKey());
            Path folder = root.resolve(parts[0]);
            Files.createDirectories(folder);
            Files.write(folder.resolve(parts[1]), recordingBytes(parts[0], parts[1], entry.getValue()));
        }
    }

    /// Computes the content of a recording.
    ///
    /// @param folder the recording folder
    /// @param filename the recording file name
    /// @param size the number of bytes
    /// @return the recording content
    public static byte[] recordingBytes(String folder, String filename, int size) {
        return bytes((folder + "/" + filename).hashCode(), size);
    }

    /// Computes the content of a default recording from its id.
    ///
    /// @param recordingId a `folder::filename` id present in {@link #DEFAULT_RECORDINGS}
    /// @return the recording content
    public static byte[] recordingBytes(String recordingId) {
        Integer size = DEFAULT_RECORDINGS.get(recordingId);
        if (size == null) {
            throw new IllegalArgumentException("Unknown fixture recording: " + recordingId);
        }
        String[] parts = splitId(recordingId);
        return recordingBytes(parts[0], parts[1], size);
    }

    /// Produces a deterministic pseudo-random byte sequence.
    ///
    /// @param seed the generator seed
    /// @param size the number of bytes
    /// @return the generated bytes
    public static byte[] bytes(long seed, int size) {
        byte[] data = new byte[size];
        SplittableRandom random = new SplittableRandom(seed);
        for (int i = 0; i < size; i++) {
            data[i] = (byte) random.nextInt(256);
        }
        return data;
    }

    /// Splits a `folder::filename` recording id.
    ///
    /// @param recordingId the id to split
    /// @return a two element array of folder and file name
    /// @throws IllegalArgumentException if the id has no `::` separator
    public static String[] splitId(String recordingId) {
        int separator = recordingId.indexOf("::");
        if (separator < 0) {
            throw new IllegalArgumentException(
                "Invalid recording ID format. Expected 'folder_name::filename': " + recordingId);
        }
        return new String[]{recordingId.substring(0, separator), recordingId.substring(separator + 2)};
    }
}

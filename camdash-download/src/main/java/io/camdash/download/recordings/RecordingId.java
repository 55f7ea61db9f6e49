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

import java.util.Objects;

/// Identifies one recording as `folder::filename`.
///
/// @param folder the camera folder
/// @param filename the recording file within the folder
public record RecordingId(String folder, String filename) {

    /// Separator between folder and file name
    public static final String SEPARATOR = "::";

    public RecordingId {
        requireSegment("folder", folder);
        requireSegment("filename", filename);
    }

    /// @param id an id of the form `folder::filename`
    /// @return the parsed id
    /// @throws IllegalArgumentException if the id is malformed
    public static RecordingId parse(String id) {
        Objects.requireNonNull(id, "id");
        int split = id.indexOf(SEPARATOR);
        if (split < 0) {
            throw new IllegalArgumentException("recording id must have the form folder::filename: " + id);
        }
        return new RecordingId(id.substring(0, split), id.substring(split + SEPARATOR.length()));
    }

    @Override
    public String toString() {
        return folder + SEPARATOR + filename;
    }

    private static void requireSegment(String name, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " cannot be blank");
        }
        if (value.contains(SEPARATOR) || value.indexOf('/') >= 0 || value.indexOf('\\') >= 0
            || value.equals(".") || value.equals("..")) {
            throw new IllegalArgumentException("invalid recording " + name + ": " + value);
        }
    }
}

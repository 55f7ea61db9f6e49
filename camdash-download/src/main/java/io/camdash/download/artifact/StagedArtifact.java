package io.camdash.download.artifact;

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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

/// A temporary file holding an assembled artifact until it is moved into place.
///
/// Closing deletes the file if it is still present.
public class StagedArtifact implements Closeable {
    private static final Logger logger = LogManager.getLogger(StagedArtifact.class);

    /// Prefix of staging file names
    public static final String PREFIX = ".camdash-";
    /// Suffix of staging file names
    public static final String SUFFIX = ".part";

    private final Path path;
    private final long size;

    private StagedArtifact(Path path, long size) {
        this.path = path;
        this.size = size;
    }

    /// Writes the bytes to a new staging file in the directory.
    ///
    /// @param directory where to stage, normally the download directory
    /// @param data the assembled artifact
    /// @return the staged artifact
    /// @throws IOException if the staging file could not be written; no file is left behind
    public static StagedArtifact stage(Path directory, byte[] data) throws IOException {
        // default attributes, not createTempFile's owner-only mode
        Path staging = Files.createFile(directory.resolve(PREFIX + UUID.randomUUID() + SUFFIX));
        try {
            Files.write(staging, data);
        } catch (IOException e) {
            Files.deleteIfExists(staging);
            throw e;
        }
        return new StagedArtifact(staging, data.length);
    }

    /// @return the staging file
    public Path path() {
        return path;
    }

    /// @return the staged byte count
    public long size() {
        return size;
    }

    @Override
    public void close() {
        try {
            if (Files.deleteIfExists(path)) {
                logger.debug("Released staging file {}", path);
            }
        } catch (IOException e) {
            logger.warn("Could not delete staging file {}: {}", path, e.getMessage());
        }
    }
}

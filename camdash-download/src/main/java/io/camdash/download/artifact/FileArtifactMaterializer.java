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

import io.camdash.download.stream.ChunkAccumulator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/// Saves artifacts into a download directory.
///
/// The assembled bytes are staged in a temporary file next to the destination and then
/// moved into place. Existing files are never overwritten: when `name.ext` is taken the
/// artifact is saved as `name (1).ext`, then `name (2).ext`, and so on.
public class FileArtifactMaterializer implements ArtifactMaterializer {
    private static final Logger logger = LogManager.getLogger(FileArtifactMaterializer.class);

    /// The highest suffix tried before giving up
    public static final int MAX_UNIQUE_SUFFIX = 10_000;

    private final Path directory;

    /// @param directory the download directory, created on first use
    public FileArtifactMaterializer(Path directory) {
        this.directory = directory.toAbsolutePath().normalize();
    }

    @Override
    public Path materialize(List<byte[]> chunks, String filename) throws IOException {
        Files.createDirectories(directory);
        byte[] assembled = ChunkAccumulator.assemble(chunks);
        try (StagedArtifact staged = StagedArtifact.stage(directory, assembled)) {
            Path saved = persist(staged, filename);
            logger.info("Saved {} ({} bytes)", saved, staged.size());
            return saved;
        }
    }

    /// Moves the staged artifact to the first free name derived from `filename`.
    ///
    /// @param staged the staged artifact
    /// @param filename the requested file name
    /// @return the saved path
    /// @throws IOException if the move fails for any reason other than a taken name
    protected Path persist(StagedArtifact staged, String filename) throws IOException {
        for (int attempt = 0; attempt <= MAX_UNIQUE_SUFFIX; attempt++) {
            Path target = directory.resolve(candidateName(filename, attempt));
            if (Files.exists(target)) {
                continue;
            }
            try {
                return Files.move(staged.path(), target);
            } catch (FileAlreadyExistsException e) {
                logger.debug("{} appeared while saving, trying the next name", target);
            }
        }
        throw new FileAlreadyExistsException(directory.resolve(filename).toString(), null,
            "no free name after " + MAX_UNIQUE_SUFFIX + " attempts");
    }

    /// Derives the name for a given attempt, inserting ` (n)` before the extension.
    ///
    /// @param filename the requested name
    /// @param attempt 0 for the name itself, n for the n-th alternative
    /// @return the candidate name
    public static String candidateName(String filename, int attempt) {
        if (attempt == 0) {
            return filename;
        }
        int dot = filename.lastIndexOf('.');
        if (dot <= 0) {
            return filename + " (" + attempt + ")";
        }
        return filename.substring(0, dot) + " (" + attempt + ")" + filename.substring(dot);
    }
}

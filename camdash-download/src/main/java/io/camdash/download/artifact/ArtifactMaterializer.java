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

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/// Turns the chunks of a fully received body into a saved artifact.
public interface ArtifactMaterializer {

    /// Assembles the chunks and saves them under the given name.
    ///
    /// Any staging resource is released before this method returns or throws.
    ///
    /// @param chunks the body chunks in arrival order
    /// @param filename the requested file name
    /// @return where the artifact was saved, which may differ from the requested name
    /// @throws IOException if the artifact could not be saved
    Path materialize(List<byte[]> chunks, String filename) throws IOException;
}

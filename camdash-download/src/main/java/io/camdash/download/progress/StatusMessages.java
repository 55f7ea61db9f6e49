package io.camdash.download.progress;

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

/// Status lines shown for each transfer phase.
public final class StatusMessages {

    private StatusMessages() {
    }

    /// @param itemCount the number of recordings in the archive
    /// @return the requesting label, e.g. `Compressing 3 recordings...`
    public static String compressing(int itemCount) {
        return itemCount > 1 ? "Compressing " + itemCount + " recordings..." : "Compressing recording...";
    }

    /// @param itemCount the number of recordings in the archive
    /// @return the streaming label, e.g. `Downloading 3 recordings...`
    public static String downloading(int itemCount) {
        return itemCount > 1 ? "Downloading " + itemCount + " recordings..." : "Downloading recording...";
    }

    /// @return the finalizing label
    public static String finalizing() {
        return "Finalizing file...";
    }

    /// @param itemCount the number of recordings
    /// @return `N recordings`, or `1 recording`
    public static String itemLabel(int itemCount) {
        return itemCount == 1 ? "1 recording" : itemCount + " recordings";
    }
}

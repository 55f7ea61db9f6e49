package io.camdash.command.recordings.subcommands;

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

import io.camdash.command.recordings.TransferCommand;
import io.camdash.download.TransferRequest;
import io.camdash.download.recordings.RecordingDownloads;
import picocli.CommandLine;

/// Download the archive of a single recording.
///
/// Usage:
/// ```
/// recordings download --base-url URL [--target dir] FOLDER FILENAME
/// ```
///
/// The archive is saved as FILENAME with `.mp4` replaced by `.zip`.
@CommandLine.Command(name = "download",
    header = "Download the archive of one recording",
    description = "Fetches FOLDER/FILENAME as a zip archive into the target directory.")
public class CMD_recordings_download extends TransferCommand {

  @CommandLine.Parameters(index = "0", description = "The camera folder")
  private String folder;

  @CommandLine.Parameters(index = "1", description = "The recording file name")
  private String filename;

  /// Run the download subcommand directly
  ///
  /// @param args command line arguments
  public static void main(String[] args) {
    int exitCode = new CommandLine(new CMD_recordings_download())
        .setCaseInsensitiveEnumValuesAllowed(true)
        .execute(args);
    System.exit(exitCode);
  }

  @Override
  protected TransferRequest createRequest(RecordingDownloads downloads) {
    return downloads.single(folder, filename);
  }
}

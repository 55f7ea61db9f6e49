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

import java.util.ArrayList;
import java.util.List;

/// Download several recordings as one archive.
///
/// Usage:
/// ```
/// recordings download-bulk --base-url URL [--target dir] folder::filename...
/// ```
@CommandLine.Command(name = "download-bulk",
    header = "Download several recordings as one archive",
    description = """
        Asks the server to compress the selected recordings into a single zip archive
        and saves it as recordings_<timestamp>.zip in the target directory.
        Recordings are named as folder::filename.
        """)
public class CMD_recordings_download_bulk extends TransferCommand {

  @CommandLine.Parameters(arity = "1..*", paramLabel = "ID", description = "Recording ids as folder::filename")
  private List<String> recordingIds = new ArrayList<>();

  /// Run the bulk download subcommand directly
  ///
  /// @param args command line arguments
  public static void main(String[] args) {
    int exitCode = new CommandLine(new CMD_recordings_download_bulk())
        .setCaseInsensitiveEnumValuesAllowed(true)
        .execute(args);
    System.exit(exitCode);
  }

  @Override
  protected TransferRequest createRequest(RecordingDownloads downloads) {
    return downloads.bulk(recordingIds);
  }
}

package io.camdash.command.recordings;

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

import io.camdash.command.recordings.subcommands.CMD_recordings_download;
import io.camdash.command.recordings.subcommands.CMD_recordings_download_bulk;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

/// Recording archive downloads
///
/// This command provides:
///
/// - `download`: fetch the archive of a single recording
/// - `download-bulk`: fetch one archive holding several recordings
///
/// Exit codes are 0 when the archive was saved, 1 when the transfer failed and 2 when it
/// was cancelled.
@CommandLine.Command(name = "recordings",
    header = "Download recording archives from a camdash server",
    subcommands = {CMD_recordings_download.class, CMD_recordings_download_bulk.class,
        CommandLine.HelpCommand.class})
public class CMD_recordings implements Runnable {
  private static final Logger logger = LogManager.getLogger(CMD_recordings.class);

  @CommandLine.Spec
  private CommandLine.Model.CommandSpec spec;

  /// Create the recordings command
  public CMD_recordings() {
  }

  /// Run the recordings command
  ///
  /// @param args command line arguments
  public static void main(String[] args) {
    logger.debug("Executing command line");
    int exitCode = new CommandLine(new CMD_recordings())
        .setCaseInsensitiveEnumValuesAllowed(true)
        .execute(args);
    logger.debug("Exiting main with code: {}", exitCode);
    System.exit(exitCode);
  }

  /// Without a subcommand, print usage
  @Override
  public void run() {
    spec.commandLine().usage(spec.commandLine().getOut());
  }
}

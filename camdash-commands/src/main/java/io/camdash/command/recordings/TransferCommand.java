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

import io.camdash.download.RequestFailedException;
import io.camdash.download.TransferController;
import io.camdash.download.TransferFailedException;
import io.camdash.download.TransferRequest;
import io.camdash.download.TransferResult;
import io.camdash.download.TransferSettings;
import io.camdash.download.recordings.RecordingDownloads;
import io.camdash.download.state.LoggerTransferStateListener;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.net.URI;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;

/// Options and execution shared by the recordings download subcommands.
///
/// Subcommands supply the request; this class runs it through a {@link TransferController}
/// and maps the outcome to an exit code.
public abstract class TransferCommand implements Callable<Integer> {
  private static final Logger logger = LogManager.getLogger(TransferCommand.class);

  /// Exit code when the archive was saved
  public static final int EXIT_SAVED = 0;
  /// Exit code when the transfer failed
  public static final int EXIT_FAILED = 1;
  /// Exit code when the transfer was cancelled
  public static final int EXIT_CANCELLED = 2;

  @CommandLine.Spec
  protected CommandLine.Model.CommandSpec spec;

  @CommandLine.Option(names = {"--base-url", "-u"}, required = true,
      description = "The root URL of the camdash server")
  private URI baseUrl;

  @CommandLine.Option(names = {"--target", "-t"},
      defaultValue = "~/Downloads",
      description = "The directory to save archives to (default: ${DEFAULT-VALUE})")
  private Path target;

  @CommandLine.Option(names = {"--header", "-H"},
      description = "A request header as name:value, may be repeated")
  private List<String> headers = new ArrayList<>();

  @CommandLine.Option(names = {"--read-timeout"},
      defaultValue = "300",
      description = "Idle read timeout in seconds, 0 disables it (default: ${DEFAULT-VALUE})")
  private long readTimeoutSeconds;

  @CommandLine.Option(names = {"--progress"},
      defaultValue = "console",
      description = "Progress reporting: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
  private ProgressMode progress = ProgressMode.console;

  /// Builds the request for this subcommand.
  ///
  /// @param downloads the request factory for the server
  /// @return the request to run
  protected abstract TransferRequest createRequest(RecordingDownloads downloads);

  @Override
  public Integer call() {
    Path directory = Path.of(target.toString().replaceAll("~", System.getProperty("user.home")));
    if (readTimeoutSeconds < 0) {
      spec.commandLine().getErr().println("--read-timeout cannot be negative: " + readTimeoutSeconds);
      return EXIT_FAILED;
    }

    Map<String, String> headerMap;
    TransferRequest request;
    try {
      headerMap = parseHeaders(headers);
      request = createRequest(new RecordingDownloads(baseUrl, Clock.systemUTC(), headerMap));
    } catch (IllegalArgumentException e) {
      spec.commandLine().getErr().println(e.getMessage());
      return EXIT_FAILED;
    }

    TransferSettings settings = TransferSettings.fromSystemProperties()
        .withDownloadDirectory(directory)
        .withReadTimeout(Duration.ofSeconds(readTimeoutSeconds));

    try (TransferController controller = new TransferController(settings)) {
      switch (progress) {
        case console:
          controller.addListener(new ConsoleProgressListener(spec.commandLine().getOut(), 80));
          break;
        case log:
          controller.addListener(new LoggerTransferStateListener(logger, Level.INFO));
          break;
        default:
          break;
      }
      Thread cancelHook = new Thread(controller::cancel, "camdash-cancel");
      Runtime.getRuntime().addShutdownHook(cancelHook);
      try {
        return report(request, controller.start(request).get());
      } catch (ExecutionException e) {
        return reportFailure(request, e.getCause());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        controller.cancel();
        spec.commandLine().getErr().println("Download interrupted: " + request.destinationFilename());
        return EXIT_CANCELLED;
      } finally {
        removeHook(cancelHook);
      }
    }
  }

  private int report(TransferRequest request, TransferResult result) {
    if (result.isSaved()) {
      spec.commandLine().getOut().println("Saved " + result.path() + " (" + result.bytes() + " bytes)");
      return EXIT_SAVED;
    }
    spec.commandLine().getErr().println("Download cancelled: " + request.destinationFilename());
    return EXIT_CANCELLED;
  }

  private int reportFailure(TransferRequest request, Throwable cause) {
    if (cause instanceof RequestFailedException) {
      RequestFailedException failed = (RequestFailedException) cause;
      spec.commandLine().getErr().println("Download failed"
          + (failed.getStatusCode() == RequestFailedException.NO_RESPONSE ? "" : " (HTTP " + failed.getStatusCode() + ")")
          + ": " + failed.getDetail());
    } else if (cause instanceof TransferFailedException) {
      spec.commandLine().getErr().println("Download failed: " + cause.getMessage());
    } else {
      logger.error("Unexpected error downloading {}", request.destinationFilename(), cause);
      spec.commandLine().getErr().println("Download failed: " + cause);
    }
    return EXIT_FAILED;
  }

  /// Parses `name:value` header options.
  ///
  /// @param headers the raw option values
  /// @return the headers in order
  /// @throws IllegalArgumentException if a value has no name or no colon
  static Map<String, String> parseHeaders(List<String> headers) {
    Map<String, String> parsed = new LinkedHashMap<>();
    for (String header : headers) {
      int colon = header.indexOf(':');
      if (colon <= 0) {
        throw new IllegalArgumentException("header must have the form name:value: " + header);
      }
      parsed.put(header.substring(0, colon).trim(), header.substring(colon + 1).trim());
    }
    return parsed;
  }

  private static void removeHook(Thread hook) {
    try {
      Runtime.getRuntime().removeShutdownHook(hook);
    } catch (IllegalStateException e) {
      logger.debug("JVM is shutting down, cancel hook stays registered");
    }
  }
}

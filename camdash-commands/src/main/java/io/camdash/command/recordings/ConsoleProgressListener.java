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

import io.camdash.download.progress.StatusMessages;
import io.camdash.download.state.TransferState;
import io.camdash.download.state.TransferStateListener;

import java.io.PrintWriter;

/// Draws transfer progress as a single console line, redrawn in place.
public class ConsoleProgressListener implements TransferStateListener {

  private final PrintWriter out;
  private final int width;
  private boolean drawn;

  /// @param out where to draw
  /// @param width the total line width in characters
  public ConsoleProgressListener(PrintWriter out, int width) {
    this.out = out;
    this.width = width;
  }

  @Override
  public synchronized void stateChanged(TransferState previous, TransferState current) {
    if (!current.active()) {
      if (drawn) {
        out.println();
        out.flush();
        drawn = false;
      }
      return;
    }
    out.print('\r');
    out.print(getProgressBar(current, width));
    out.flush();
    drawn = true;
  }

  /// Renders a state as `status [=====>    ]  42% (3 recordings)`.
  ///
  /// @param state the state to render
  /// @param width total width of the line in characters
  /// @return the rendered line
  public static String getProgressBar(TransferState state, int width) {
    String label = state.statusText();
    String suffix = String.format("] %3d%% (%s)", state.percent(), StatusMessages.itemLabel(state.itemCount()));
    int barWidth = Math.max(10, width - label.length() - suffix.length() - 2);
    int completedWidth = (int) ((long) barWidth * state.percent() / 100);

    StringBuilder bar = new StringBuilder();
    bar.append(label).append(" [");
    for (int i = 0; i < barWidth; i++) {
      if (i < completedWidth) {
        bar.append("=");
      } else if (i == completedWidth) {
        bar.append(">");
      } else {
        bar.append(" ");
      }
    }
    bar.append(suffix);
    return bar.toString();
  }
}

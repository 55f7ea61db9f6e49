package io.camdash.download.state;

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

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/// A {@link TransferStateListener} that writes state changes to Log4j 2.
///
/// Phase changes are logged at the configured level. Progress within a phase is logged
/// one level finer so that ordinary runs stay quiet.
public class LoggerTransferStateListener implements TransferStateListener {

    private final Logger logger;
    private final Level level;

    /// Creates a listener logging through this class's logger at INFO.
    public LoggerTransferStateListener() {
        this(LogManager.getLogger(LoggerTransferStateListener.class), Level.INFO);
    }

    /// @param logger the logger to write to
    /// @param level the level for phase changes
    public LoggerTransferStateListener(Logger logger, Level level) {
        this.logger = logger;
        this.level = level;
    }

    @Override
    public void stateChanged(TransferState previous, TransferState current) {
        if (previous.phase() != current.phase()) {
            if (current.active()) {
                logger.log(level, "[{}] {} ({}%)", current.phase(), current.statusText(), current.percent());
            } else {
                logger.log(level, "[{}] transfer ended after {}", current.phase(), previous.phase());
            }
        } else if (previous.percent() != current.percent()) {
            logger.log(finer(level), "[{}] {}% {} bytes", current.phase(), current.percent(), current.receivedBytes());
        }
    }

    private static Level finer(Level level) {
        if (level.isMoreSpecificThan(Level.WARN)) {
            return Level.INFO;
        }
        if (level.isMoreSpecificThan(Level.INFO)) {
            return Level.DEBUG;
        }
        return Level.TRACE;
    }
}

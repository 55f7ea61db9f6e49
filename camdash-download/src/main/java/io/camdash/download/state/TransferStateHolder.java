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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/// The observable holder for {@link TransferState}.
///
/// Every transfer writes under a generation number handed out by {@link #begin(int, String)}.
/// Writes carrying an older generation are discarded, so a superseded or cancelled transfer
/// can never touch the state of its successor. Within one generation the percent never
/// decreases until the state is reset.
public class TransferStateHolder {
    private static final Logger logger = LogManager.getLogger(TransferStateHolder.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final List<TransferStateListener> listeners = new CopyOnWriteArrayList<>();
    private volatile TransferState current = TransferState.IDLE;
    private long generation;

    /// @return the latest snapshot
    public TransferState get() {
        return current;
    }

    /// Registers a listener for subsequent changes.
    ///
    /// @param listener the listener
    public void addListener(TransferStateListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /// @param listener the listener to remove
    public void removeListener(TransferStateListener listener) {
        listeners.remove(listener);
    }

    /// Starts a new generation in the requesting phase.
    ///
    /// @param itemCount the number of recordings requested
    /// @param statusText the compressing label
    /// @return the generation the new transfer must write with
    public long begin(int itemCount, String statusText) {
        lock.lock();
        try {
            generation++;
            publish(TransferState.requesting(itemCount, statusText));
            return generation;
        } finally {
            lock.unlock();
        }
    }

    /// Applies an update if the generation is still current.
    ///
    /// A result whose percent is below the current percent keeps the current percent.
    ///
    /// @param writer the generation of the writing transfer
    /// @param update the change to apply
    /// @return true if the update was applied
    public boolean update(long writer, UnaryOperator<TransferState> update) {
        lock.lock();
        try {
            if (writer != generation || !current.active()) {
                return false;
            }
            TransferState next = update.apply(current);
            if (next.percent() < current.percent()) {
                next = next.withPercent(current.percent());
            }
            publish(next);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /// Returns to idle if the generation is still current, retiring it.
    ///
    /// @param writer the generation of the transfer being reset
    /// @return true if the state was reset
    public boolean reset(long writer) {
        lock.lock();
        try {
            if (writer != generation) {
                return false;
            }
            generation++;
            publish(TransferState.IDLE);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /// Returns to idle regardless of generation.
    public void forceIdle() {
        lock.lock();
        try {
            generation++;
            publish(TransferState.IDLE);
        } finally {
            lock.unlock();
        }
    }

    private void publish(TransferState next) {
        TransferState previous = current;
        if (previous.equals(next)) {
            return;
        }
        current = next;
        for (TransferStateListener listener : listeners) {
            try {
                listener.stateChanged(previous, next);
            } catch (RuntimeException e) {
                logger.warn("Transfer state listener {} failed: {}", listener, e.getMessage(), e);
            }
        }
    }
}

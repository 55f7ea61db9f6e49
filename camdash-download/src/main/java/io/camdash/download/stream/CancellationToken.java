package io.camdash.download.stream;

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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/// Cancellation signal for one transfer.
///
/// A token starts {@link State#ACTIVE} and moves exactly once, either to
/// {@link State#CANCELLED} or to {@link State#SEALED}. Sealing marks the start of
/// finalization, after which the transfer can no longer be cancelled. Hooks registered with
/// {@link #onCancel(Runnable)} release the resources bound to the transfer.
public class CancellationToken {
    private static final Logger logger = LogManager.getLogger(CancellationToken.class);

    /// Token states
    public enum State {
        ACTIVE,
        CANCELLED,
        SEALED
    }

    private final AtomicReference<State> state = new AtomicReference<>(State.ACTIVE);
    private final List<Runnable> hooks = new ArrayList<>();

    /// Cancels the token and runs every registered hook.
    ///
    /// @return true if this call moved the token from active to cancelled
    public boolean cancel() {
        if (!state.compareAndSet(State.ACTIVE, State.CANCELLED)) {
            return false;
        }
        List<Runnable> toRun;
        synchronized (hooks) {
            toRun = new ArrayList<>(hooks);
            hooks.clear();
        }
        toRun.forEach(CancellationToken::runHook);
        return true;
    }

    /// Seals the token so it can no longer be cancelled. Hooks are discarded.
    ///
    /// @return true if this call moved the token from active to sealed
    public boolean seal() {
        if (!state.compareAndSet(State.ACTIVE, State.SEALED)) {
            return false;
        }
        synchronized (hooks) {
            hooks.clear();
        }
        return true;
    }

    /// Registers a release hook. If the token is already cancelled the hook runs at once.
    ///
    /// @param hook the action to run on cancellation
    public void onCancel(Runnable hook) {
        Objects.requireNonNull(hook, "hook");
        synchronized (hooks) {
            State current = state.get();
            if (current == State.ACTIVE) {
                hooks.add(hook);
                return;
            }
            if (current == State.SEALED) {
                return;
            }
        }
        runHook(hook);
    }

    /// @return true once cancelled
    public boolean isCancelled() {
        return state.get() == State.CANCELLED;
    }

    /// @return true once sealed
    public boolean isSealed() {
        return state.get() == State.SEALED;
    }

    /// @return the current state
    public State state() {
        return state.get();
    }

    private static void runHook(Runnable hook) {
        try {
            hook.run();
        } catch (RuntimeException e) {
            logger.warn("Cancellation hook failed: {}", e.getMessage(), e);
        }
    }
}

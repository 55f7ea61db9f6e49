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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.IntConsumer;

/// Drives a {@link ProgressEstimator} on a fixed interval while the body length is unknown.
///
/// Once {@link #stop()} returns no further percent is published.
public class HeuristicProgressTicker {
    private static final Logger logger = LogManager.getLogger(HeuristicProgressTicker.class);

    private final ScheduledExecutorService scheduler;
    private final ProgressEstimator estimator;
    private final int step;
    private final int cap;
    private final Duration interval;
    private final IntConsumer publisher;

    private ScheduledFuture<?> future;
    private boolean stopped;

    /// @param scheduler the executor running the ticks
    /// @param estimator the estimator to advance
    /// @param step percent per tick
    /// @param cap the highest percent to report
    /// @param interval time between ticks
    /// @param publisher receives the percent after every tick
    public HeuristicProgressTicker(
        ScheduledExecutorService scheduler,
        ProgressEstimator estimator,
        int step,
        int cap,
        Duration interval,
        IntConsumer publisher
    ) {
        this.scheduler = scheduler;
        this.estimator = estimator;
        this.step = step;
        this.cap = cap;
        this.interval = interval;
        this.publisher = publisher;
    }

    /// Schedules the first tick one interval from now. Has no effect once started or stopped.
    public synchronized void start() {
        if (stopped || future != null) {
            return;
        }
        long millis = Math.max(1L, interval.toMillis());
        try {
            future = scheduler.scheduleAtFixedRate(this::tick, millis, millis, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            logger.debug("Progress ticker not scheduled, scheduler is shut down");
            stopped = true;
        }
    }

    /// Stops ticking. Safe to call more than once, and before {@link #start()}.
    public synchronized void stop() {
        stopped = true;
        if (future != null) {
            future.cancel(false);
        }
    }

    /// @return true once stopped
    public synchronized boolean isStopped() {
        return stopped;
    }

    private synchronized void tick() {
        if (stopped) {
            return;
        }
        int before = estimator.percent();
        int after = estimator.tick(step, cap);
        if (after != before) {
            publisher.accept(after);
        }
    }
}

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

/// Derives a transfer percentage from received bytes or from elapsed ticks.
///
/// With a declared total the percent is `floor(received * 100 / total)`, held at or below
/// {@link #MAX_STREAMING_PERCENT}. Without one, {@link #tick(int, int)} raises a simulated
/// percent in fixed steps up to a cap. Either way the reported percent never decreases.
/// 100 is reserved for the start of finalization.
public final class ProgressEstimator {

    /// The highest percent reported while the body is still being read
    public static final int MAX_STREAMING_PERCENT = 99;

    private final long totalBytes;
    private int percent;

    private ProgressEstimator(long totalBytes) {
        this.totalBytes = totalBytes;
    }

    /// @param totalBytes the declared body length, or any value of 0 or less when unknown
    /// @return an estimator starting at 0
    public static ProgressEstimator forTotal(long totalBytes) {
        return new ProgressEstimator(totalBytes > 0 ? totalBytes : -1L);
    }

    /// @return true if progress follows a declared length
    public boolean isExact() {
        return totalBytes > 0;
    }

    /// @return the declared length, or -1
    public long totalBytes() {
        return totalBytes;
    }

    /// Records the byte count after a chunk.
    ///
    /// @param receivedBytes bytes received so far
    /// @return the current percent, unchanged when the total is unknown
    public synchronized int onChunk(long receivedBytes) {
        if (isExact()) {
            advanceTo(percentOf(receivedBytes, totalBytes));
        }
        return percent;
    }

    /// Raises the simulated percent by one step.
    ///
    /// @param step percent to add
    /// @param cap the highest simulated percent
    /// @return the current percent
    public synchronized int tick(int step, int cap) {
        int limit = Math.min(cap, MAX_STREAMING_PERCENT);
        if (percent < limit) {
            advanceTo(Math.min(limit, percent + step));
        }
        return percent;
    }

    /// @return the current percent
    public synchronized int percent() {
        return percent;
    }

    /// Computes `floor(received * 100 / total)` clamped to 0..{@link #MAX_STREAMING_PERCENT}.
    ///
    /// @param receivedBytes bytes received so far
    /// @param totalBytes the declared length, must be positive
    /// @return the percent
    public static int percentOf(long receivedBytes, long totalBytes) {
        if (totalBytes <= 0) {
            throw new IllegalArgumentException("totalBytes must be positive: " + totalBytes);
        }
        if (receivedBytes <= 0) {
            return 0;
        }
        if (receivedBytes >= totalBytes) {
            return MAX_STREAMING_PERCENT;
        }
        long scaled = receivedBytes <= Long.MAX_VALUE / 100
            ? receivedBytes * 100 / totalBytes
            : (long) Math.floor((double) receivedBytes / totalBytes * 100);
        return (int) Math.min(MAX_STREAMING_PERCENT, scaled);
    }

    private void advanceTo(int candidate) {
        if (candidate > percent) {
            percent = candidate;
        }
    }
}

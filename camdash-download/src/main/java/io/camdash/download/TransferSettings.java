package io.camdash.download;

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

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

/// Tunables for a {@link TransferController}.
///
/// Defaults can be overridden through system properties under the `camdash.download.`
/// prefix, see {@link #fromProperties(Properties)}.
///
/// @param downloadDirectory where artifacts are saved
/// @param readBufferSize the size of each body read, in bytes
/// @param heuristicStep percent added per tick when the total size is unknown
/// @param heuristicInterval the tick interval when the total size is unknown
/// @param heuristicCap the highest percent the ticker may report
/// @param finalizeGrace how long the finalizing state is shown before returning to idle
/// @param connectTimeout the connection timeout, zero for none
/// @param readTimeout the idle read timeout, zero for none
public record TransferSettings(
    Path downloadDirectory,
    int readBufferSize,
    int heuristicStep,
    Duration heuristicInterval,
    int heuristicCap,
    Duration finalizeGrace,
    Duration connectTimeout,
    Duration readTimeout
) {
    /// Prefix for system property overrides
    public static final String PROPERTY_PREFIX = "camdash.download.";

    public static final int DEFAULT_READ_BUFFER_SIZE = 16 * 1024;
    public static final int DEFAULT_HEURISTIC_STEP = 5;
    public static final Duration DEFAULT_HEURISTIC_INTERVAL = Duration.ofMillis(200);
    public static final int DEFAULT_HEURISTIC_CAP = 90;
    public static final Duration DEFAULT_FINALIZE_GRACE = Duration.ofMillis(500);
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_READ_TIMEOUT = Duration.ofMinutes(5);

    public TransferSettings {
        Objects.requireNonNull(downloadDirectory, "downloadDirectory");
        if (readBufferSize <= 0) {
            throw new IllegalArgumentException("readBufferSize must be positive: " + readBufferSize);
        }
        if (heuristicStep <= 0) {
            throw new IllegalArgumentException("heuristicStep must be positive: " + heuristicStep);
        }
        if (heuristicCap < 0 || heuristicCap > 99) {
            throw new IllegalArgumentException("heuristicCap must be within 0..99: " + heuristicCap);
        }
        requirePositive("heuristicInterval", heuristicInterval);
        requireNotNegative("finalizeGrace", finalizeGrace);
        requireNotNegative("connectTimeout", connectTimeout);
        requireNotNegative("readTimeout", readTimeout);
    }

    /// @return settings with every default, saving to `~/Downloads`
    public static TransferSettings defaults() {
        return new TransferSettings(
            Path.of(System.getProperty("user.home"), "Downloads"),
            DEFAULT_READ_BUFFER_SIZE,
            DEFAULT_HEURISTIC_STEP,
            DEFAULT_HEURISTIC_INTERVAL,
            DEFAULT_HEURISTIC_CAP,
            DEFAULT_FINALIZE_GRACE,
            DEFAULT_CONNECT_TIMEOUT,
            DEFAULT_READ_TIMEOUT);
    }

    /// @return the defaults overridden by any `camdash.download.*` system properties
    public static TransferSettings fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    /// Reads overrides from a property set. Recognized keys, after the prefix, are
    /// `directory`, `bufferSize`, `heuristicStep`, `heuristicIntervalMs`, `heuristicCap`,
    /// `finalizeGraceMs`, `connectTimeoutMs` and `readTimeoutMs`.
    ///
    /// @param properties the property source
    /// @return the defaults with any overrides applied
    /// @throws IllegalArgumentException if a numeric property does not parse
    public static TransferSettings fromProperties(Properties properties) {
        TransferSettings settings = defaults();
        String directory = properties.getProperty(PROPERTY_PREFIX + "directory");
        if (directory != null && !directory.isBlank()) {
            settings = settings.withDownloadDirectory(Path.of(directory.trim()));
        }
        settings = settings
            .withReadBufferSize((int) longProperty(properties, "bufferSize", settings.readBufferSize))
            .withHeuristicStep((int) longProperty(properties, "heuristicStep", settings.heuristicStep))
            .withHeuristicInterval(Duration.ofMillis(
                longProperty(properties, "heuristicIntervalMs", settings.heuristicInterval.toMillis())))
            .withHeuristicCap((int) longProperty(properties, "heuristicCap", settings.heuristicCap))
            .withFinalizeGrace(Duration.ofMillis(
                longProperty(properties, "finalizeGraceMs", settings.finalizeGrace.toMillis())))
            .withConnectTimeout(Duration.ofMillis(
                longProperty(properties, "connectTimeoutMs", settings.connectTimeout.toMillis())))
            .withReadTimeout(Duration.ofMillis(
                longProperty(properties, "readTimeoutMs", settings.readTimeout.toMillis())));
        return settings;
    }

    public TransferSettings withDownloadDirectory(Path downloadDirectory) {
        return new TransferSettings(downloadDirectory, readBufferSize, heuristicStep, heuristicInterval,
            heuristicCap, finalizeGrace, connectTimeout, readTimeout);
    }

    public TransferSettings withReadBufferSize(int readBufferSize) {
        return new TransferSettings(downloadDirectory, readBufferSize, heuristicStep, heuristicInterval,
            heuristicCap, finalizeGrace, connectTimeout, readTimeout);
    }

    public TransferSettings withHeuristicStep(int heuristicStep) {
        return new TransferSettings(downloadDirectory, readBufferSize, heuristicStep, heuristicInterval,
            heuristicCap, finalizeGrace, connectTimeout, readTimeout);
    }

    public TransferSettings withHeuristicInterval(Duration heuristicInterval) {
        return new TransferSettings(downloadDirectory, readBufferSize, heuristicStep, heuristicInterval,
            heuristicCap, finalizeGrace, connectTimeout, readTimeout);
    }

    public TransferSettings withHeuristicCap(int heuristicCap) {
        return new TransferSettings(downloadDirectory, readBufferSize, heuristicStep, heuristicInterval,
            heuristicCap, finalizeGrace, connectTimeout, readTimeout);
    }

    public TransferSettings withFinalizeGrace(Duration finalizeGrace) {
        return new TransferSettings(downloadDirectory, readBufferSize, heuristicStep, heuristicInterval,
            heuristicCap, finalizeGrace, connectTimeout, readTimeout);
    }

    public TransferSettings withConnectTimeout(Duration connectTimeout) {
        return new TransferSettings(downloadDirectory, readBufferSize, heuristicStep, heuristicInterval,
            heuristicCap, finalizeGrace, connectTimeout, readTimeout);
    }

    public TransferSettings withReadTimeout(Duration readTimeout) {
        return new TransferSettings(downloadDirectory, readBufferSize, heuristicStep, heuristicInterval,
            heuristicCap, finalizeGrace, connectTimeout, readTimeout);
    }

    private static long longProperty(Properties properties, String key, long fallback) {
        String value = properties.getProperty(PROPERTY_PREFIX + key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + PROPERTY_PREFIX + key + ": " + value, e);
        }
    }

    private static void requirePositive(String name, Duration value) {
        Objects.requireNonNull(value, name);
        if (value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be positive: " + value);
        }
    }

    private static void requireNotNegative(String name, Duration value) {
        Objects.requireNonNull(value, name);
        if (value.isNegative()) {
            throw new IllegalArgumentException(name + " cannot be negative: " + value);
        }
    }
}

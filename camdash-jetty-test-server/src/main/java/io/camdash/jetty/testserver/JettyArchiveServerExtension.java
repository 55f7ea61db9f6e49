package io.camdash.jetty.testserver;

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
import org.junit.jupiter.api.extension.AfterAllCallback;
import org.junit.jupiter.api.extension.BeforeAllCallback;
import org.junit.jupiter.api.extension.ExtensionContext;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URL;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;

/// A JUnit Jupiter extension that shares one {@link JettyArchiveServerFixture} per JVM.
///
/// The server is started on first use with a freshly seeded recordings root (see
/// {@link RecordingFixtures#seed(Path)}) and stopped by a shutdown hook, so every test
/// class annotated with the extension talks to the same server.
///
/// The recordings root is a temporary directory unless the `camdash.test.recordings.root`
/// system property names one.
///
/// Example usage:
///
/// ```java
/// @ExtendWith(JettyArchiveServerExtension.class)
/// public class MyTest {
///     // Test methods
/// }
/// ```
public class JettyArchiveServerExtension implements BeforeAllCallback, AfterAllCallback {
    private static final Logger logger = LogManager.getLogger(JettyArchiveServerExtension.class);
    private static final String RECORDINGS_ROOT_PROPERTY = "camdash.test.recordings.root";

    private static JettyArchiveServerFixture server;
    private static URL baseUrl;

    private static final Object lock = new Object();

    /**
     * Initializes and starts the server if not already started.
     * This method is thread-safe and idempotent.
     */
    public static void initialize() {
        synchronized (lock) {
            if (server == null) {
                try {
                    Path root = recordingsRoot();
                    RecordingFixtures.seed(root);

                    logger.info("Starting Jetty archive server for the module");
                    server = new JettyArchiveServerFixture(root);
                    server.start();
                    baseUrl = server.getBaseUrl();
                    logger.info("Jetty archive server started at {}", baseUrl);

                    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                        if (server != null) {
                            logger.info("Stopping Jetty archive server for the module (shutdown hook)");
                            server.close();
                            if (System.getProperty(RECORDINGS_ROOT_PROPERTY) == null) {
                                deleteQuietly(root);
                            }
                            server = null;
                            baseUrl = null;
                        }
                    }));
                } catch (IOException e) {
                    logger.error("Failed to start Jetty archive server", e);
                    throw new UncheckedIOException("Failed to start Jetty archive server", e);
                }
            }
        }
    }

    /**
     * Gets the base URL of the test web server.
     * @return The base URL of the test web server
     */
    public static URL getBaseUrl() {
        initialize();
        return baseUrl;
    }

    /**
     * Gets the JettyArchiveServerFixture instance.
     * @return The JettyArchiveServerFixture instance
     */
    public static JettyArchiveServerFixture getServer() {
        initialize();
        return server;
    }

    @Override
    public void beforeAll(ExtensionContext context) {
        initialize();
        logger.debug("JettyArchiveServerExtension beforeAll called for {}", context.getDisplayName());
    }

    @Override
    public void afterAll(ExtensionContext context) {
        // stopped by the shutdown hook
        logger.debug("JettyArchiveServerExtension afterAll called for {}", context.getDisplayName());
    }

    private static Path recordingsRoot() throws IOException {
        String configured = System.getProperty(RECORDINGS_ROOT_PROPERTY);
        if (configured != null) {
            Path root = Path.of(configured).toAbsolutePath();
            Files.createDirectories(root);
            return root;
        }
        return Files.createTempDirectory("camdash-recordings");
    }

    private static void deleteQuietly(Path root) {
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                    Files.delete(file);
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                    Files.delete(dir);
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            logger.warn("Failed to delete recordings root {}: {}", root, e.getMessage());
        }
    }
}

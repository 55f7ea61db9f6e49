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
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.servlet.ServletContextHandler;
import org.eclipse.jetty.servlet.ServletHolder;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.ServerSocket;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * A test fixture that starts a Jetty web server standing in for the recordings backend.
 * <p>
 * The server listens on a random available port of 127.0.0.1 and exposes:
 * <ul>
 *   <li>{@code /api/recordings/*}: the archive endpoints, see {@link RecordingArchiveServlet}</li>
 *   <li>{@code /stream}: a scripted byte stream, see {@link ScriptedStreamServlet}</li>
 * </ul>
 * <p>
 * Example usage:
 * ```java
 * try (JettyArchiveServerFixture server = new JettyArchiveServerFixture(root)) {
 *     server.start();
 *     URL baseUrl = server.getBaseUrl();
 *     // Use baseUrl in your tests
 * }
 * ```
 */
public class JettyArchiveServerFixture implements AutoCloseable {

    private static Logger logger() {
        return LazyLoggerHolder.LOGGER;
    }

    private static class LazyLoggerHolder {
        private static final Logger LOGGER = LogManager.getLogger(JettyArchiveServerFixture.class);
    }

    private Server server;
    private int port;
    private final Path recordingsRoot;
    private RecordingArchiveServlet archiveServlet;

    /**
     * Creates a new fixture serving recordings from the specified directory.
     *
     * @param recordingsRoot The directory containing {@code folder/filename} recordings
     */
    public JettyArchiveServerFixture(Path recordingsRoot) {
        logger().debug("recordingsRoot: {}", recordingsRoot);
        this.recordingsRoot = recordingsRoot.toAbsolutePath().normalize();

        if (!Files.isDirectory(this.recordingsRoot)) {
            throw new UncheckedIOException(new IOException("Recordings directory does not exist: " + recordingsRoot));
        }
    }

    /**
     * Starts the web server on a random available port.
     *
     * @throws IOException If the server cannot be started
     */
    public void start() throws IOException {
        this.port = findAvailablePort();

        server = new Server();

        ServerConnector connector = new ServerConnector(server);
        connector.setHost("127.0.0.1");
        connector.setPort(port);
        server.addConnector(connector);

        ServletContextHandler context = new ServletContextHandler(ServletContextHandler.NO_SESSIONS);
        context.setContextPath("/");
        server.setHandler(context);

        archiveServlet = new RecordingArchiveServlet(recordingsRoot);
        context.addServlet(new ServletHolder("recordings", archiveServlet), "/api/recordings/*");
        context.addServlet(new ServletHolder("stream", new ScriptedStreamServlet()), "/stream");

        try {
            server.start();
            logger().info("Jetty archive server started on port {} serving recordings from {}", port, recordingsRoot);
        } catch (Exception e) {
            throw new IOException("Failed to start Jetty server", e);
        }
    }

    /**
     * Gets the base URL of the server.
     *
     * @return The base URL of the server, ending with a slash
     */
    public URL getBaseUrl() {
        try {
            return new URL("http://127.0.0.1:" + port + "/");
        } catch (Exception e) {
            throw new RuntimeException("Failed to create server URL", e);
        }
    }

    /**
     * Gets the number of archives the server has completely written.
     *
     * @return the served archive count
     */
    public int getArchivesServed() {
        return archiveServlet == null ? 0 : archiveServlet.getArchivesServed();
    }

    /**
     * Stops the server and releases resources.
     */
    @Override
    public void close() {
        if (server != null) {
            try {
                server.stop();
                logger().info("Jetty archive server stopped");
            } catch (Exception e) {
                logger().error("Error stopping Jetty server", e);
            }
        }
    }

    private int findAvailablePort() {
        try (ServerSocket socket = new ServerSocket(0)) {
            socket.setReuseAddress(true);
            return socket.getLocalPort();
        } catch (IOException e) {
            throw new RuntimeException("Failed to find available port", e);
        }
    }
}

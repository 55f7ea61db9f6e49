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

import java.net.URI;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/// Describes one archive transfer: where to fetch it and what to call the saved file.
///
/// Instances are immutable. The body array is copied on the way in and on the way out.
///
/// @param uri the http or https locator of the archive
/// @param method the HTTP method, upper case
/// @param headers request headers in insertion order
/// @param body the request body, or null for none
/// @param destinationFilename the plain file name to save the artifact under
/// @param itemCount how many recordings the archive holds, at least 1
public record TransferRequest(
    URI uri,
    String method,
    Map<String, String> headers,
    byte[] body,
    String destinationFilename,
    int itemCount
) {
    public TransferRequest {
        Objects.requireNonNull(uri, "uri");
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new IllegalArgumentException("URI must be HTTP or HTTPS: " + uri);
        }
        if (method == null || method.isBlank()) {
            throw new IllegalArgumentException("method cannot be null or blank");
        }
        method = method.trim().toUpperCase(Locale.ROOT);
        if (body != null && (method.equals("GET") || method.equals("HEAD"))) {
            throw new IllegalArgumentException(method + " requests cannot carry a body");
        }
        headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        body = body == null ? null : body.clone();
        destinationFilename = requirePlainFileName(destinationFilename);
        if (itemCount < 1) {
            throw new IllegalArgumentException("itemCount must be at least 1: " + itemCount);
        }
    }

    /// Creates a GET request for a single-item archive.
    ///
    /// @param uri the archive locator
    /// @param destinationFilename the file name to save under
    /// @return the request
    public static TransferRequest get(URI uri, String destinationFilename) {
        return builder(uri, destinationFilename).build();
    }

    /// Starts a request builder.
    ///
    /// @param uri the archive locator
    /// @param destinationFilename the file name to save under
    /// @return a builder defaulting to GET, no headers, no body and one item
    public static Builder builder(URI uri, String destinationFilename) {
        return new Builder(uri, destinationFilename);
    }

    @Override
    public byte[] body() {
        return body == null ? null : body.clone();
    }

    /// @return true when the request carries a body
    public boolean hasBody() {
        return body != null;
    }

    /// Looks up a header by case-insensitive name.
    ///
    /// @param name the header name
    /// @return the header value, or null
    public String header(String name) {
        for (Map.Entry<String, String> entry : headers.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(name)) {
                return entry.getValue();
            }
        }
        return null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TransferRequest)) {
            return false;
        }
        TransferRequest that = (TransferRequest) o;
        return itemCount == that.itemCount
            && uri.equals(that.uri)
            && method.equals(that.method)
            && headers.equals(that.headers)
            && Arrays.equals(body, that.body)
            && destinationFilename.equals(that.destinationFilename);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(uri, method, headers, destinationFilename, itemCount);
        return 31 * result + Arrays.hashCode(body);
    }

    @Override
    public String toString() {
        return "TransferRequest{" + method + " " + uri
            + ", destination=" + destinationFilename
            + ", items=" + itemCount
            + (body == null ? "" : ", body=" + body.length + " bytes")
            + "}";
    }

    /// Validates that a name can be used as a file directly inside the download directory.
    ///
    /// @param filename the candidate name
    /// @return the name, trimmed
    /// @throws IllegalArgumentException if the name is blank, a dot entry, or contains a separator
    public static String requirePlainFileName(String filename) {
        if (filename == null || filename.isBlank()) {
            throw new IllegalArgumentException("destination filename cannot be null or blank");
        }
        String trimmed = filename.trim();
        if (trimmed.equals(".") || trimmed.equals("..")
            || trimmed.indexOf('/') >= 0 || trimmed.indexOf('\\') >= 0 || trimmed.indexOf('\0') >= 0) {
            throw new IllegalArgumentException("destination filename must be a plain file name: " + filename);
        }
        return trimmed;
    }

    /// Builder for {@link TransferRequest}.
    public static final class Builder {
        private final URI uri;
        private final String destinationFilename;
        private String method = "GET";
        private final Map<String, String> headers = new LinkedHashMap<>();
        private byte[] body;
        private int itemCount = 1;

        private Builder(URI uri, String destinationFilename) {
            this.uri = uri;
            this.destinationFilename = destinationFilename;
        }

        /// @param method the HTTP method
        /// @return this builder
        public Builder method(String method) {
            this.method = method;
            return this;
        }

        /// Adds or replaces a header.
        ///
        /// @param name the header name
        /// @param value the header value
        /// @return this builder
        public Builder header(String name, String value) {
            this.headers.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
            return this;
        }

        /// Adds every header in the map.
        ///
        /// @param headers the headers to add
        /// @return this builder
        public Builder headers(Map<String, String> headers) {
            headers.forEach(this::header);
            return this;
        }

        /// Sets the body along with its content type.
        ///
        /// @param body the body bytes
        /// @param contentType the media type of the body
        /// @return this builder
        public Builder body(byte[] body, String contentType) {
            this.body = body;
            return header("Content-Type", contentType);
        }

        /// @param itemCount how many recordings the archive holds
        /// @return this builder
        public Builder itemCount(int itemCount) {
            this.itemCount = itemCount;
            return this;
        }

        /// @return the validated request
        public TransferRequest build() {
            return new TransferRequest(uri, method, headers, body, destinationFilename, itemCount);
        }
    }
}

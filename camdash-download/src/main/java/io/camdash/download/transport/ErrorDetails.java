package io.camdash.download.transport;

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

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

/// Extracts a readable message from an error response body.
public final class ErrorDetails {

    /// Error bodies longer than this are truncated in messages
    public static final int MAX_DETAIL_LENGTH = 512;

    private ErrorDetails() {
    }

    /// Parses `{"detail": ...}` bodies, falling back to the trimmed body text.
    ///
    /// @param body the error body, may be null
    /// @param fallback the text to use when the body is empty
    /// @return the detail message
    public static String parse(String body, String fallback) {
        if (body == null || body.isBlank()) {
            return fallback;
        }
        String trimmed = body.trim();
        if (trimmed.startsWith("{")) {
            try {
                JsonElement element = JsonParser.parseString(trimmed);
                if (element.isJsonObject()) {
                    JsonObject object = element.getAsJsonObject();
                    JsonElement detail = object.get("detail");
                    if (detail != null && !detail.isJsonNull()) {
                        return detail.isJsonPrimitive() ? detail.getAsString() : detail.toString();
                    }
                }
            } catch (JsonParseException e) {
                return truncate(trimmed);
            }
        }
        return truncate(trimmed);
    }

    private static String truncate(String trimmed) {
        return trimmed.length() > MAX_DETAIL_LENGTH ? trimmed.substring(0, MAX_DETAIL_LENGTH) + "..." : trimmed;
    }
}

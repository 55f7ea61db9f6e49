/// Embedded Jetty server for testing recording archive downloads.
///
/// This package provides an embedded Jetty server that emulates the archive endpoints of
/// the camdash recordings backend, plus a scripted byte stream with controllable size,
/// pacing, declared length and failure modes for exercising transfer edge cases.
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

/// Bulk download of server-generated recording archives.
///
/// {@link io.camdash.download.TransferController} runs one transfer at a time: it issues a
/// {@link io.camdash.download.TransferRequest}, reads the body chunk by chunk while
/// publishing {@link io.camdash.download.state.TransferState}, and saves the artifact only
/// once the body has been received in full.
///
/// ## Key Components
///
/// - {@link io.camdash.download.TransferController}: start and cancel transfers
/// - {@link io.camdash.download.recordings.RecordingDownloads}: requests for the recordings endpoints
/// - {@link io.camdash.download.state.TransferStateHolder}: the observable state
/// - {@link io.camdash.download.progress.ProgressEstimator}: exact and heuristic progress
/// - {@link io.camdash.download.artifact.FileArtifactMaterializer}: saving without overwriting
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

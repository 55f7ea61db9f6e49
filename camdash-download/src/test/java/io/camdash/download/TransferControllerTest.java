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

import io.camdash.download.artifact.ArtifactMaterializer;
import io.camdash.download.artifact.FileArtifactMaterializer;
import io.camdash.download.state.TransferPhase;
import io.camdash.download.state.TransferState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TransferControllerTest {

    @TempDir
    Path downloads;

    private ScriptedTransport transport;
    private RecordingStateListener listener;
    private TransferController controller;

    @BeforeEach
    public void setUp() {
        transport = new ScriptedTransport();
        listener = new RecordingStateListener();
        controller = newController(new FileArtifactMaterializer(downloads));
    }

    @AfterEach
    public void tearDown() {
        controller.close();
    }

    private TransferController newController(ArtifactMaterializer materializer) {
        TransferSettings settings = TransferSettings.defaults()
            .withDownloadDirectory(downloads)
            .withHeuristicInterval(Duration.ofMillis(10))
            .withFinalizeGrace(Duration.ofMillis(50));
        TransferController created = new TransferController(settings, transport, materializer);
        created.addListener(listener);
        return created;
    }

    private static TransferRequest request(String filename) {
        return TransferRequest.get(URI.create("http://127.0.0.1/archive"), filename);
    }

    private static byte[] filled(int size, int value) {
        byte[] data = new byte[size];
        Arrays.fill(data, (byte) value);
        return data;
    }

    private List<Path> savedFiles() throws IOException {
        try (Stream<Path> files = Files.list(downloads)) {
            return files.toList();
        }
    }

    @Test
    public void testDeclaredLengthProgress() throws Exception {
        transport.ok(1000, ScriptedChunkSource.of(filled(250, 1), filled(250, 2), filled(250, 3), filled(250, 4)));

        TransferResult result = controller.start(request("a.zip")).get(5, TimeUnit.SECONDS);
        listener.await(s -> !s.active(), 2000);

        assertTrue(result.isSaved());
        assertEquals(1000, result.bytes());
        assertEquals(downloads.resolve("a.zip"), result.path());
        assertThat(listener.activePercents()).containsExactly(0, 25, 50, 75, 99, 100);
        assertEquals(TransferState.IDLE, controller.state());

        byte[] saved = Files.readAllBytes(result.path());
        assertEquals(1000, saved.length);
        assertEquals(1, saved[0]);
        assertEquals(4, saved[999]);
    }

    @Test
    public void testStatusTextFollowsPhases() throws Exception {
        transport.ok(-1, ScriptedChunkSource.of(filled(10, 1)));

        controller.start(TransferRequest.builder(URI.create("http://127.0.0.1/bulk"), "b.zip")
            .method("POST")
            .itemCount(3)
            .build()).get(5, TimeUnit.SECONDS);
        listener.await(s -> !s.active(), 2000);

        List<TransferState> states = listener.states();
        assertThat(states).extracting(TransferState::phase).containsSubsequence(
            TransferPhase.REQUESTING, TransferPhase.STREAMING, TransferPhase.FINALIZING, TransferPhase.IDLE);
        assertThat(states).extracting(TransferState::statusText).contains(
            "Compressing 3 recordings...", "Downloading 3 recordings...", "Finalizing file...");
        assertThat(states).filteredOn(TransferState::active).allMatch(s -> s.itemCount() == 3);
    }

    @Test
    public void testCancelDuringStreaming() throws Exception {
        AtomicReference<TransferState> afterCancel = new AtomicReference<>();
        ScriptedChunkSource source = ScriptedChunkSource.of(filled(250, 1), filled(250, 2), filled(250, 3), filled(250, 4))
            .onRead(3, () -> {
                controller.cancel();
                afterCancel.set(controller.state());
            });
        transport.ok(1000, source);

        TransferResult result = controller.start(request("cancelled.zip")).get(5, TimeUnit.SECONDS);

        assertEquals(TransferResult.Status.CANCELLED, result.status());
        assertFalse(afterCancel.get().active());
        assertEquals(0, afterCancel.get().percent());
        assertEquals("", afterCancel.get().statusText());
        assertTrue(source.isClosed());
        assertEquals(3, source.reads());
        assertThat(listener.activePercents()).containsExactly(0, 25, 50);
        assertThat(savedFiles()).isEmpty();
    }

    @Test
    public void testCancelWhileWaitingForData() throws Exception {
        CountDownLatch never = new CountDownLatch(1);
        ScriptedChunkSource source = new ScriptedChunkSource().pauseUntil(never).chunk(filled(10, 1));
        transport.ok(10, source);

        CompletableFuture<TransferResult> future = controller.start(request("early.zip"));
        listener.await(s -> s.phase() == TransferPhase.STREAMING, 2000);
        controller.cancel();

        assertEquals(TransferResult.Status.CANCELLED, future.get(5, TimeUnit.SECONDS).status());
        assertFalse(controller.state().active());
        assertThat(savedFiles()).isEmpty();
    }

    @Test
    public void testServerErrorFailsWithoutReading() throws Exception {
        ScriptedChunkSource source = ScriptedChunkSource.of(filled(10, 1));
        transport.status(500, "{\"detail\": \"Error creating archive: disk full\"}", source);

        CompletableFuture<TransferResult> future = controller.start(request("error.zip"));

        assertThatThrownBy(() -> future.get(5, TimeUnit.SECONDS))
            .isInstanceOf(ExecutionException.class)
            .cause()
            .isInstanceOf(RequestFailedException.class)
            .hasMessageContaining("500")
            .hasMessageContaining("disk full");
        RequestFailedException failure = (RequestFailedException) catchCause(future);
        assertEquals(500, failure.getStatusCode());
        assertEquals("Error creating archive: disk full", failure.getDetail());
        assertFalse(controller.state().active());
        assertEquals(0, source.reads());
        assertThat(listener.states()).extracting(TransferState::phase).doesNotContain(TransferPhase.STREAMING);
    }

    @Test
    public void testConnectionFailure() {
        transport.failOpen(new IOException("Connection refused"));

        CompletableFuture<TransferResult> future = controller.start(request("refused.zip"));

        RequestFailedException failure = (RequestFailedException) catchCause(future);
        assertEquals(RequestFailedException.NO_RESPONSE, failure.getStatusCode());
        assertThat(failure.getDetail()).contains("Connection refused");
        assertFalse(controller.state().active());
    }

    @Test
    public void testSecondStartSupersedesFirst() throws Exception {
        CountDownLatch never = new CountDownLatch(1);
        ScriptedChunkSource first = new ScriptedChunkSource().chunk(filled(100, 1)).pauseUntil(never).chunk(filled(100, 1));
        transport.ok(200, first);
        transport.ok(200, ScriptedChunkSource.of(filled(100, 2), filled(100, 2)));

        CompletableFuture<TransferResult> a = controller.start(request("first.zip"));
        listener.await(s -> s.percent() == 50, 2000);
        CompletableFuture<TransferResult> b = controller.start(request("second.zip"));

        TransferResult resultA = a.get(5, TimeUnit.SECONDS);
        TransferResult resultB = b.get(5, TimeUnit.SECONDS);

        assertEquals(TransferResult.Status.CANCELLED, resultA.status());
        assertTrue(resultB.isSaved());
        assertTrue(first.isClosed());
        assertThat(savedFiles()).containsExactly(downloads.resolve("second.zip"));
        assertArrayEquals(filled(200, 2), Files.readAllBytes(resultB.path()));
    }

    @Test
    public void testUnknownLengthStaysBelowCap() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        ScriptedChunkSource source = new ScriptedChunkSource()
            .chunk(filled(64, 1))
            .pauseUntil(release)
            .chunk(filled(64, 2));
        transport.ok(-1, source);

        CompletableFuture<TransferResult> future = controller.start(request("unknown.zip"));
        listener.await(s -> s.percent() == 90, 5000);
        Thread.sleep(100);
        assertEquals(90, controller.state().percent());
        release.countDown();

        TransferResult result = future.get(5, TimeUnit.SECONDS);
        assertEquals(128, result.bytes());
        List<Integer> percents = listener.activePercents();
        assertThat(percents.subList(0, percents.size() - 1)).allMatch(p -> p <= 90);
        assertThat(percents).isSorted().endsWith(90, 100);
    }

    @Test
    public void testZeroLengthReadsKeepAllData() throws Exception {
        ScriptedChunkSource source = new ScriptedChunkSource()
            .chunk(filled(10, 1))
            .emptyRead()
            .emptyRead()
            .chunk(filled(5, 2));
        transport.ok(15, source);

        TransferResult result = controller.start(request("sparse.zip")).get(5, TimeUnit.SECONDS);

        byte[] expected = new byte[15];
        Arrays.fill(expected, 0, 10, (byte) 1);
        Arrays.fill(expected, 10, 15, (byte) 2);
        assertArrayEquals(expected, Files.readAllBytes(result.path()));
    }

    @Test
    public void testReadErrorDiscardsBuffer() throws Exception {
        transport.ok(1000, new ScriptedChunkSource()
            .chunk(filled(250, 1))
            .fail(new IOException("unexpected end of stream")));

        CompletableFuture<TransferResult> future = controller.start(request("broken.zip"));

        StreamReadException failure = (StreamReadException) catchCause(future);
        assertEquals(250, failure.getReceivedBytes());
        assertFalse(controller.state().active());
        assertThat(savedFiles()).isEmpty();
    }

    @Test
    public void testMaterializationFailureResetsState() throws Exception {
        controller.close();
        controller = newController((chunks, filename) -> {
            throw new IOException("No space left on device");
        });
        transport.ok(10, ScriptedChunkSource.of(filled(10, 1)));

        CompletableFuture<TransferResult> future = controller.start(request("full.zip"));

        MaterializationException failure = (MaterializationException) catchCause(future);
        assertThat(failure).hasMessageContaining("No space left on device");
        assertFalse(controller.state().active());
    }

    @Test
    public void testUncheckedSaveFailureIsMaterializationException() throws Exception {
        controller.close();
        controller = newController((chunks, filename) -> {
            throw new UncheckedIOException(new IOException("Read-only file system"));
        });
        transport.ok(10, ScriptedChunkSource.of(filled(10, 1)));

        CompletableFuture<TransferResult> future = controller.start(request("readonly.zip"));

        Throwable failure = catchCause(future);
        assertThat(failure).isInstanceOf(MaterializationException.class)
            .hasCauseInstanceOf(UncheckedIOException.class)
            .hasMessageContaining("Read-only file system");
        assertFalse(controller.state().active());
    }

    @Test
    public void testErrorDuringSaveStillReleasesTransfer() throws Exception {
        controller.close();
        FileArtifactMaterializer files = new FileArtifactMaterializer(downloads);
        AtomicBoolean failNext = new AtomicBoolean(true);
        controller = newController((chunks, filename) -> {
            if (failNext.getAndSet(false)) {
                throw new OutOfMemoryError("Java heap space");
            }
            return files.materialize(chunks, filename);
        });
        transport.ok(10, ScriptedChunkSource.of(filled(10, 1)));

        CompletableFuture<TransferResult> future = controller.start(request("huge.zip"));

        assertThat(catchCause(future)).isInstanceOf(OutOfMemoryError.class);
        assertEquals(TransferState.IDLE, controller.state());

        transport.ok(10, ScriptedChunkSource.of(filled(10, 2)));
        TransferResult retry = controller.start(request("huge.zip")).get(5, TimeUnit.SECONDS);
        assertTrue(retry.isSaved());
    }

    @Test
    public void testCancelIsIdempotent() throws Exception {
        controller.cancel();
        assertThat(listener.states()).isEmpty();
        assertEquals(TransferState.IDLE, controller.state());

        CountDownLatch never = new CountDownLatch(1);
        transport.ok(10, new ScriptedChunkSource().pauseUntil(never));
        CompletableFuture<TransferResult> future = controller.start(request("twice.zip"));
        listener.await(s -> s.phase() == TransferPhase.STREAMING, 2000);

        controller.cancel();
        controller.cancel();

        assertEquals(TransferResult.Status.CANCELLED, future.get(5, TimeUnit.SECONDS).status());
        long idleTransitions = listener.states().stream().filter(s -> !s.active()).count();
        assertEquals(1, idleTransitions);
    }

    @Test
    public void testCancelWhileFinalizingIsIgnored() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch proceed = new CountDownLatch(1);
        FileArtifactMaterializer files = new FileArtifactMaterializer(downloads);
        controller.close();
        controller = newController((chunks, filename) -> {
            entered.countDown();
            try {
                proceed.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return files.materialize(chunks, filename);
        });
        transport.ok(10, ScriptedChunkSource.of(filled(10, 1)));

        CompletableFuture<TransferResult> future = controller.start(request("final.zip"));
        assertTrue(entered.await(5, TimeUnit.SECONDS));
        controller.cancel();
        assertEquals(TransferPhase.FINALIZING, controller.state().phase());
        assertEquals(100, controller.state().percent());
        proceed.countDown();

        assertTrue(future.get(5, TimeUnit.SECONDS).isSaved());
        assertTrue(Files.exists(downloads.resolve("final.zip")));
    }

    @Test
    public void testStartAfterCloseIsRejected() {
        controller.close();
        assertTrue(transport.isClosed());
        assertThatThrownBy(() -> controller.start(request("late.zip")))
            .isInstanceOf(IllegalStateException.class);
    }

    private static Throwable catchCause(CompletableFuture<?> future) {
        try {
            future.get(5, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            return e.getCause();
        } catch (Exception e) {
            throw new AssertionError("transfer did not fail", e);
        }
        throw new AssertionError("transfer did not fail");
    }
}

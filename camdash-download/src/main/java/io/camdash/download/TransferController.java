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
import io.camdash.download.progress.HeuristicProgressTicker;
import io.camdash.download.progress.ProgressEstimator;
import io.camdash.download.progress.StatusMessages;
import io.camdash.download.state.TransferState;
import io.camdash.download.state.TransferStateHolder;
import io.camdash.download.state.TransferStateListener;
import io.camdash.download.stream.CancellationToken;
import io.camdash.download.stream.ChunkAccumulator;
import io.camdash.download.stream.ChunkReadLoop;
import io.camdash.download.transport.OkHttpTransferTransport;
import io.camdash.download.transport.TransferResponse;
import io.camdash.download.transport.TransferTransport;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/// Runs archive transfers one at a time and publishes their progress.
///
/// Starting a transfer supersedes the one in flight, which resolves as
/// {@link TransferResult.Status#CANCELLED}. A transfer can be cancelled until its body has been
/// fully read; from then on it is finalizing and runs to completion.
///
/// The returned future resolves with {@link TransferResult} for saved and cancelled
/// transfers, and completes exceptionally with a {@link TransferFailedException} when the
/// request, the read or the save fails. Any other throwable completes the future with that
/// throwable. The shared {@link TransferState} is back to idle before a failed future completes.
///
/// ```java
/// try (TransferController controller = new TransferController(TransferSettings.defaults())) {
///     controller.addListener((before, after) -> System.out.println(after.percent()));
///     TransferResult result = controller.start(request).get();
/// }
/// ```
public class TransferController implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(TransferController.class);
    private static final AtomicInteger controllerCounter = new AtomicInteger();

    private final TransferSettings settings;
    private final TransferTransport transport;
    private final ArtifactMaterializer materializer;
    private final TransferStateHolder state = new TransferStateHolder();
    private final ExecutorService workers;
    private final ScheduledExecutorService scheduler;
    private final Object materializeLock = new Object();

    private ActiveTransfer active;
    private boolean closed;

    /// Creates a controller using OkHttp and saving into the settings' download directory.
    ///
    /// @param settings the transfer settings
    public TransferController(TransferSettings settings) {
        this(settings, new OkHttpTransferTransport(settings), new FileArtifactMaterializer(settings.downloadDirectory()));
    }

    /// @param settings the transfer settings
    /// @param transport issues requests; closed with this controller
    /// @param materializer saves completed bodies
    public TransferController(TransferSettings settings, TransferTransport transport, ArtifactMaterializer materializer) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.materializer = Objects.requireNonNull(materializer, "materializer");
        int id = controllerCounter.incrementAndGet();
        AtomicInteger workerCounter = new AtomicInteger();
        this.workers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "camdash-transfer-" + id + "-" + workerCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "camdash-progress-" + id);
            t.setDaemon(true);
            return t;
        });
    }

    /// Starts a transfer, cancelling any transfer still in flight.
    ///
    /// @param request the transfer to run
    /// @return the outcome of the transfer
    /// @throws IllegalStateException if the controller is closed
    public synchronized CompletableFuture<TransferResult> start(TransferRequest request) {
        Objects.requireNonNull(request, "request");
        if (closed) {
            throw new IllegalStateException("transfer controller is closed");
        }
        if (active != null && active.token.cancel()) {
            logger.info("Superseding transfer of {}", active.request.destinationFilename());
        }
        active = null;

        CancellationToken token = new CancellationToken();
        long generation = state.begin(request.itemCount(), StatusMessages.compressing(request.itemCount()));
        ActiveTransfer transfer = new ActiveTransfer(request, token, generation);
        active = transfer;
        logger.info("Starting transfer of {} ({})", request.destinationFilename(),
            StatusMessages.itemLabel(request.itemCount()));
        try {
            workers.execute(() -> run(transfer));
        } catch (RejectedExecutionException e) {
            active = null;
            state.reset(generation);
            throw new IllegalStateException("transfer controller is shutting down", e);
        }
        return transfer.future;
    }

    /// Cancels the transfer in flight, if any, and returns the state to idle at once.
    ///
    /// Has no effect when idle, when the transfer is finalizing, or when called again.
    public synchronized void cancel() {
        ActiveTransfer transfer = active;
        if (transfer == null) {
            return;
        }
        if (transfer.token.cancel()) {
            active = null;
            state.reset(transfer.generation);
            logger.info("Cancelled transfer of {}", transfer.request.destinationFilename());
        } else if (transfer.token.isSealed()) {
            logger.debug("Transfer of {} is finalizing and can no longer be cancelled",
                transfer.request.destinationFilename());
        }
    }

    /// @return the latest state snapshot
    public TransferState state() {
        return state.get();
    }

    /// @param listener receives every subsequent state change
    public void addListener(TransferStateListener listener) {
        state.addListener(listener);
    }

    /// @param listener the listener to remove
    public void removeListener(TransferStateListener listener) {
        state.removeListener(listener);
    }

    /// Cancels any transfer in flight, waits briefly for finalizing work, and releases the
    /// executors and the transport.
    @Override
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            if (active != null) {
                active.token.cancel();
                active = null;
            }
        }
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn("Transfer workers did not stop in time");
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        scheduler.shutdownNow();
        state.forceIdle();
        try {
            transport.close();
        } catch (IOException e) {
            logger.warn("Error closing transport: {}", e.getMessage(), e);
        }
    }

    private void run(ActiveTransfer transfer) {
        TransferResult result;
        try {
            result = execute(transfer);
        } catch (TransferFailedException e) {
            logger.error("Transfer of {} failed: {}", transfer.request.destinationFilename(), e.getMessage());
            state.reset(transfer.generation);
            release(transfer);
            transfer.future.completeExceptionally(e);
            return;
        } catch (Throwable t) {
            logger.error("Transfer of {} failed unexpectedly", transfer.request.destinationFilename(), t);
            state.reset(transfer.generation);
            release(transfer);
            transfer.future.completeExceptionally(t);
            if (t instanceof Error) {
                throw (Error) t;
            }
            return;
        }
        if (!result.isSaved()) {
            state.reset(transfer.generation);
        }
        release(transfer);
        transfer.future.complete(result);
    }

    private TransferResult execute(ActiveTransfer transfer) throws TransferFailedException {
        TransferRequest request = transfer.request;
        CancellationToken token = transfer.token;
        long generation = transfer.generation;
        if (token.isCancelled()) {
            return TransferResult.cancelled(request);
        }

        TransferResponse response;
        try {
            response = transport.open(request, token);
        } catch (IOException e) {
            if (token.isCancelled()) {
                return TransferResult.cancelled(request);
            }
            throw new RequestFailedException(request, RequestFailedException.NO_RESPONSE, e.getMessage(), e);
        }

        try {
            if (token.isCancelled()) {
                return TransferResult.cancelled(request);
            }
            if (!response.isSuccessful()) {
                throw new RequestFailedException(request, response.statusCode(), response.errorDetail(), null);
            }
            List<byte[]> chunks = readBody(transfer, response);
            if (chunks == null || !token.seal()) {
                return TransferResult.cancelled(request);
            }
            return finish(request, generation, chunks);
        } finally {
            closeQuietly(response);
        }
    }

    private List<byte[]> readBody(ActiveTransfer transfer, TransferResponse response) throws StreamReadException {
        TransferRequest request = transfer.request;
        CancellationToken token = transfer.token;
        long generation = transfer.generation;

        ProgressEstimator estimator = ProgressEstimator.forTotal(response.contentLength());
        ChunkAccumulator accumulator = new ChunkAccumulator();
        token.onCancel(accumulator::invalidate);
        state.update(generation,
            s -> s.streaming(StatusMessages.downloading(request.itemCount()), estimator.totalBytes()));

        HeuristicProgressTicker ticker = null;
        if (!estimator.isExact()) {
            ticker = new HeuristicProgressTicker(scheduler, estimator,
                settings.heuristicStep(), settings.heuristicCap(), settings.heuristicInterval(),
                percent -> state.update(generation, s -> s.withPercent(percent)));
            token.onCancel(ticker::stop);
            ticker.start();
        }

        try {
            ChunkReadLoop loop = new ChunkReadLoop(response.body(), token, settings.readBufferSize());
            ChunkReadLoop.Outcome outcome = loop.run(accumulator, received -> {
                int percent = estimator.onChunk(received);
                state.update(generation, s -> s.withProgress(received, percent));
            });
            if (outcome == ChunkReadLoop.Outcome.CANCELLED) {
                return null;
            }
            logger.debug("Read {} bytes in {} chunks for {}", accumulator.receivedBytes(),
                accumulator.chunkCount(), request.destinationFilename());
            return accumulator.drain();
        } catch (IOException e) {
            long received = accumulator.receivedBytes();
            accumulator.invalidate();
            if (token.isCancelled()) {
                return null;
            }
            throw new StreamReadException(request, received, e);
        } catch (IllegalStateException e) {
            // drained after a cancellation invalidated the buffer
            if (token.isCancelled()) {
                return null;
            }
            throw e;
        } finally {
            if (ticker != null) {
                ticker.stop();
            }
        }
    }

    private TransferResult finish(TransferRequest request, long generation, List<byte[]> chunks)
        throws MaterializationException {
        long size = 0;
        for (byte[] chunk : chunks) {
            size += chunk.length;
        }
        long total = size;
        state.update(generation, s -> s.finalizing(StatusMessages.finalizing(), total));

        Path saved;
        synchronized (materializeLock) {
            try {
                saved = materializer.materialize(chunks, request.destinationFilename());
            } catch (IOException | RuntimeException e) {
                throw new MaterializationException(request, e);
            }
        }
        scheduleReset(generation);
        return TransferResult.saved(request, saved, total);
    }

    private void scheduleReset(long generation) {
        long grace = settings.finalizeGrace().toMillis();
        if (grace <= 0) {
            state.reset(generation);
            return;
        }
        try {
            scheduler.schedule(() -> state.reset(generation), grace, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            state.reset(generation);
        }
    }

    private synchronized void release(ActiveTransfer transfer) {
        if (active == transfer) {
            active = null;
        }
    }

    private static void closeQuietly(TransferResponse response) {
        try {
            response.close();
        } catch (IOException e) {
            logger.debug("Error closing response: {}", e.getMessage());
        }
    }

    private static final class ActiveTransfer {
        private final TransferRequest request;
        private final CancellationToken token;
        private final long generation;
        private final CompletableFuture<TransferResult> future = new CompletableFuture<>();

        private ActiveTransfer(TransferRequest request, CancellationToken token, long generation) {
            this.request = request;
            this.token = token;
            this.generation = generation;
        }
    }
}

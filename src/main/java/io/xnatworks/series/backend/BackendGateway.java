/*
 * XNAT DICOM Series Organizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.series.backend;

import io.xnatworks.series.config.EngineConfig;
import io.xnatworks.series.model.DicomFile;
import io.xnatworks.series.model.DicomImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the connection to the decoding backend.
 * <p>
 * The backend is started lazily by the first {@link #initialize()} call. Callers that arrive while
 * that attempt is running wait for it and see its outcome; nobody starts a second one. A failed
 * attempt stays failed until {@link #reset()} is called.
 */
public class BackendGateway implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(BackendGateway.class);

    /**
     * Pipeline that hosts every DICOM action.
     */
    public static final String DICOM_PIPELINE = "dicom";

    private final DecodingBackend backend;
    private final EngineConfig config;

    // null: not started; incomplete: in progress; complete: done (handle or failure)
    private final AtomicReference<CompletableFuture<BackendHandle>> initialization = new AtomicReference<>();

    private volatile BackendHandle handle;
    private volatile boolean closed;

    public BackendGateway(DecodingBackend backend, EngineConfig config) {
        this.backend = backend;
        this.config = config;
    }

    /**
     * Start the backend, or wait for the attempt already under way. Safe to call from any thread,
     * any number of times.
     *
     * @throws InitException if the backend could not be started
     */
    public void initialize() throws InitException {
        if (closed) {
            throw new InitException("Backend gateway is closed");
        }
        while (true) {
            CompletableFuture<BackendHandle> attempt = initialization.get();
            if (attempt == null) {
                CompletableFuture<BackendHandle> mine = new CompletableFuture<>();
                if (!initialization.compareAndSet(null, mine)) {
                    continue;
                }
                bootstrap(mine);
                attempt = mine;
            }
            await(attempt);
            return;
        }
    }

    private void bootstrap(CompletableFuture<BackendHandle> attempt) {
        log.info("Starting '{}' decoding backend (pipelines: {}, worker: {})",
                backend.getName(), config.getPipelinesUrl(), config.getPipelineWorkerUrl());

        BackendHandle opened = null;
        try {
            opened = backend.open(config);

            TaskResult probe = opened.runPipeline(DICOM_PIPELINE,
                    Collections.emptyList(), Collections.emptyList(), Collections.emptyList());
            if (!probe.isSuccess()) {
                throw new InitException("Could not initialize backend: " + describeFailure(probe));
            }

            if (config.isWarmUp()) {
                warmUp(opened);
            }

            handle = opened;
            attempt.complete(opened);
            log.info("Decoding backend '{}' is ready", backend.getName());

        } catch (InitException e) {
            log.error("Failed to start decoding backend '{}': {}", backend.getName(), e.getMessage());
            fail(attempt, opened, e);
        } catch (TaskExecutionException | RuntimeException e) {
            log.error("Failed to start decoding backend '{}': {}", backend.getName(), e.getMessage(), e);
            fail(attempt, opened, new InitException("Could not initialize backend: " + e.getMessage(), e));
        } catch (Error e) {
            log.error("Failed to start decoding backend '{}': {}", backend.getName(), e, e);
            fail(attempt, opened, new InitException("Could not initialize backend: " + e, e));
            throw e;
        }
    }

    /**
     * Complete a failed attempt. An attempt cut short by an interrupt is withdrawn first, so only the
     * callers already waiting on it see the failure and the next caller starts a fresh one.
     */
    private void fail(CompletableFuture<BackendHandle> attempt, BackendHandle opened, InitException failure) {
        closeQuietly(opened);
        if (Thread.currentThread().isInterrupted() || causedByInterrupt(failure)) {
            initialization.compareAndSet(attempt, null);
            log.warn("Start of decoding backend '{}' was interrupted, the next caller will retry", backend.getName());
        }
        attempt.completeExceptionally(failure);
    }

    private static boolean causedByInterrupt(Throwable failure) {
        for (Throwable t = failure; t != null; t = t.getCause()) {
            if (t instanceof InterruptedException) {
                return true;
            }
        }
        return false;
    }

    /**
     * Pre-load the tag reader. Failures here never fail initialization.
     */
    private void warmUp(BackendHandle opened) {
        try {
            opened.readDicomTags(DicomFile.empty(""), Collections.emptyList());
        } catch (Exception e) {
            log.warn("Tag reader warm-up failed (ignored): {}", e.getMessage());
        }
    }

    private void await(CompletableFuture<BackendHandle> attempt) throws InitException {
        try {
            attempt.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InitException("Interrupted while waiting for backend initialization", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            throw new InitException(cause.getMessage(), cause);
        }
    }

    /**
     * Forget a failed initialization so the next {@link #initialize()} tries again.
     *
     * @return true if a failed attempt was discarded
     */
    public boolean reset() {
        CompletableFuture<BackendHandle> attempt = initialization.get();
        if (attempt != null && attempt.isCompletedExceptionally()) {
            return initialization.compareAndSet(attempt, null);
        }
        return false;
    }

    public boolean isInitialized() {
        return handle != null && !closed;
    }

    /**
     * Run a pipeline on the backend.
     *
     * @throws BackendUnavailableException if no backend has been established
     * @throws TaskExecutionException      if the backend reports failure
     */
    public TaskResult runTask(String pipeline, List<String> args,
                              List<PipelineInput> inputs, List<PipelineOutput> outputs)
            throws BackendUnavailableException, TaskExecutionException {
        BackendHandle h = requireHandle();
        log.debug("Running pipeline '{}' with args {} and {} inputs", pipeline, args, inputs.size());

        TaskResult result = h.runPipeline(pipeline, args, inputs, outputs);
        if (!result.isSuccess()) {
            throw new TaskExecutionException("Pipeline '" + pipeline + "' failed: " + describeFailure(result));
        }
        return result;
    }

    /**
     * Read tag codes from one file through the backend's tag reader.
     */
    public Map<String, String> readDicomTags(DicomFile file, List<String> tags)
            throws BackendUnavailableException, TaskExecutionException {
        return requireHandle().readDicomTags(file, tags);
    }

    /**
     * Reconstruct a volume through the backend's series reader.
     */
    public DicomImage readImageDicomFileSeries(List<DicomFile> files, boolean singleSortedSeries)
            throws BackendUnavailableException, TaskExecutionException {
        return requireHandle().readImageDicomFileSeries(files, singleSortedSeries);
    }

    private BackendHandle requireHandle() throws BackendUnavailableException {
        BackendHandle h = handle;
        if (h == null || closed) {
            throw new BackendUnavailableException("Decoding backend is not available");
        }
        return h;
    }

    private static String describeFailure(TaskResult result) {
        String detail = !result.getStderr().isBlank() ? result.getStderr().trim() : result.getStdout().trim();
        return "return code " + result.getReturnCode() + (detail.isEmpty() ? "" : ": " + detail);
    }

    private static void closeQuietly(BackendHandle h) {
        if (h == null) {
            return;
        }
        try {
            h.close();
        } catch (RuntimeException e) {
            log.warn("Error closing backend handle: {}", e.getMessage());
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;

        CompletableFuture<BackendHandle> attempt = initialization.get();
        if (attempt != null && !attempt.isDone()) {
            attempt.thenAccept(BackendGateway::closeQuietly);
        }
        BackendHandle h = handle;
        handle = null;
        if (h != null) {
            closeQuietly(h);
            log.info("Decoding backend '{}' closed", backend.getName());
        }
    }
}

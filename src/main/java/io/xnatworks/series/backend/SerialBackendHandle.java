/*
 * XNAT DICOM Series Organizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.series.backend;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Base for handles whose backend accepts one task at a time.
 * Tasks run on a single daemon worker thread; callers block until their task completes.
 */
public abstract class SerialBackendHandle implements BackendHandle {
    private static final Logger log = LoggerFactory.getLogger(SerialBackendHandle.class);

    private final ExecutorService worker;

    protected SerialBackendHandle(String workerName) {
        this.worker = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, workerName);
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Run a task on the worker and wait for it. Abandoning the wait does not cancel the task.
     */
    protected <T> T submit(String what, Callable<T> task) throws TaskExecutionException {
        Future<T> future;
        try {
            future = worker.submit(task);
        } catch (RejectedExecutionException e) {
            throw new TaskExecutionException("Backend is closed", e);
        }

        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TaskExecutionException("Interrupted while waiting for " + what, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof TaskExecutionException) {
                throw (TaskExecutionException) cause;
            }
            throw new TaskExecutionException(what + " failed: " + cause.getMessage(), cause);
        }
    }

    @Override
    public void close() {
        worker.shutdown();
        try {
            if (!worker.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Backend worker did not finish within 10 seconds, interrupting");
                worker.shutdownNow();
            }
        } catch (InterruptedException e) {
            worker.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}

/*
 * XNAT DICOM Series Organizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.series.backend;

import io.xnatworks.series.SeriesEngineException;

/**
 * A task was attempted without an established backend handle.
 */
public class BackendUnavailableException extends SeriesEngineException {

    public BackendUnavailableException(String message) {
        super(message);
    }

    public BackendUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

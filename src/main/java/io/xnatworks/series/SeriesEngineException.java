/*
 * XNAT DICOM Series Organizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.series;

/**
 * Base type for failures reported by the series engine and its backend.
 */
public class SeriesEngineException extends Exception {

    public SeriesEngineException(String message) {
        super(message);
    }

    public SeriesEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}

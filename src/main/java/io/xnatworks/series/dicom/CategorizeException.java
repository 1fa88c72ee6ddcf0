/*
 * XNAT DICOM Series Organizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.series.dicom;

import io.xnatworks.series.SeriesEngineException;

/**
 * Grouping files into volumes failed, or the backend returned a grouping that is not a partition of the input.
 */
public class CategorizeException extends SeriesEngineException {

    public CategorizeException(String message) {
        super(message);
    }

    public CategorizeException(String message, Throwable cause) {
        super(message, cause);
    }
}

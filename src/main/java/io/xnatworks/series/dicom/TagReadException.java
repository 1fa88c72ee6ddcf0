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
 * Reading tags from one file failed at the backend or in transit.
 */
public class TagReadException extends SeriesEngineException {

    public TagReadException(String message) {
        super(message);
    }

    public TagReadException(String message, Throwable cause) {
        super(message, cause);
    }
}

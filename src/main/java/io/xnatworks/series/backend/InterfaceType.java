/*
 * XNAT DICOM Series Organizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.series.backend;

/**
 * Kinds of payload exchanged with a backend pipeline.
 */
public enum InterfaceType {
    BINARY_FILE,
    TEXT_STREAM,
    IMAGE
}

/*
 * XNAT DICOM Series Organizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.series.dicom;

import io.xnatworks.series.model.DicomFile;

/**
 * Makes file names safe to use as backend path identifiers.
 * Path separators in a name would otherwise be read as directories by the backend's file system.
 */
public final class FileNames {

    private FileNames() {
    }

    public static String sanitize(String name) {
        return name.replace('/', '_').replace('\\', '_');
    }

    /**
     * Copy of the file under its sanitized name; the file itself when nothing changes.
     */
    public static DicomFile sanitize(DicomFile file) {
        return file.withName(sanitize(file.getName()));
    }
}

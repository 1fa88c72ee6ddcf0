/*
 * XNAT DICOM Series Organizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.series.backend.local;

import org.dcm4che3.data.Attributes;
import org.dcm4che3.io.DicomInputStream;

import java.io.ByteArrayInputStream;
import java.io.IOException;

/**
 * Parses in-memory DICOM content with dcm4che.
 */
final class DicomDatasets {

    private DicomDatasets() {
    }

    /**
     * Read the dataset of a DICOM file, pixel data included.
     *
     * @param source name used in error messages
     * @throws IOException if the bytes are not a DICOM dataset
     */
    static Attributes read(String source, byte[] content) throws IOException {
        if (content.length == 0) {
            throw new IOException("Empty file: " + source);
        }
        try (DicomInputStream dis = new DicomInputStream(new ByteArrayInputStream(content))) {
            return dis.readDataset();
        } catch (IOException e) {
            throw new IOException("Not a readable DICOM file: " + source + " (" + e.getMessage() + ")", e);
        } catch (RuntimeException e) {
            // dcm4che reports some malformed streams as runtime exceptions
            throw new IOException("Not a readable DICOM file: " + source + " (" + e.getMessage() + ")", e);
        }
    }
}

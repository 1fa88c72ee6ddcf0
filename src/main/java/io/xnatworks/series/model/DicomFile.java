/*
 * XNAT DICOM Series Organizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.series.model;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * A named DICOM file captured in memory.
 * Content is copied on the way in and on the way out, so instances are immutable.
 */
public final class DicomFile {

    private final String name;
    private final byte[] content;

    public DicomFile(String name, byte[] content) {
        this.name = Objects.requireNonNull(name, "name");
        this.content = content != null ? content.clone() : new byte[0];
    }

    /**
     * Capture a file from disk, named by its file name.
     */
    public static DicomFile read(Path path) throws IOException {
        return new DicomFile(path.getFileName().toString(), Files.readAllBytes(path));
    }

    public static DicomFile empty(String name) {
        return new DicomFile(name, new byte[0]);
    }

    public String getName() {
        return name;
    }

    public byte[] getContent() {
        return content.clone();
    }

    public int size() {
        return content.length;
    }

    /**
     * Copy of this file under another name.
     */
    public DicomFile withName(String newName) {
        if (name.equals(newName)) {
            return this;
        }
        return new DicomFile(newName, content);
    }

    @Override
    public String toString() {
        return "DicomFile{" + name + ", " + content.length + " bytes}";
    }
}

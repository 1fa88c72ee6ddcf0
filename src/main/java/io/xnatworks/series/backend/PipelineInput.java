/*
 * XNAT DICOM Series Organizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.series.backend;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * One payload handed to a pipeline: a binary file keyed by a path-like identifier, or free text.
 */
public final class PipelineInput {

    private final InterfaceType type;
    private final String path;
    private final byte[] data;

    private PipelineInput(InterfaceType type, String path, byte[] data) {
        this.type = type;
        this.path = path;
        this.data = data;
    }

    public static PipelineInput binaryFile(String path, byte[] data) {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(data, "data");
        return new PipelineInput(InterfaceType.BINARY_FILE, path, data);
    }

    public static PipelineInput textStream(String text) {
        Objects.requireNonNull(text, "text");
        return new PipelineInput(InterfaceType.TEXT_STREAM, null, text.getBytes(StandardCharsets.UTF_8));
    }

    public InterfaceType getType() {
        return type;
    }

    public String getPath() {
        return path;
    }

    /**
     * Raw payload. Not copied; pipelines must treat it as read-only.
     */
    public byte[] getData() {
        return data;
    }

    public String getText() {
        return new String(data, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return type == InterfaceType.BINARY_FILE
                ? "BinaryFile{" + path + ", " + data.length + " bytes}"
                : "TextStream{" + data.length + " bytes}";
    }
}

/*
 * XNAT DICOM Series Organizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.series.backend;

import java.util.Objects;

/**
 * Describes one output a pipeline is expected to produce.
 */
public final class PipelineOutput {

    private final InterfaceType type;
    private final String path;

    private PipelineOutput(InterfaceType type, String path) {
        this.type = Objects.requireNonNull(type, "type");
        this.path = path;
    }

    public static PipelineOutput textStream() {
        return new PipelineOutput(InterfaceType.TEXT_STREAM, null);
    }

    public static PipelineOutput image() {
        return new PipelineOutput(InterfaceType.IMAGE, null);
    }

    public static PipelineOutput binaryFile(String path) {
        return new PipelineOutput(InterfaceType.BINARY_FILE, path);
    }

    public InterfaceType getType() {
        return type;
    }

    /**
     * Target path for binary file outputs, null otherwise.
     */
    public String getPath() {
        return path;
    }
}

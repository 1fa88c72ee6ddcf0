/*
 * XNAT DICOM Series Organizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.series.backend;

import io.xnatworks.series.model.DicomImage;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * One output produced by a pipeline run.
 */
public final class OutputData {

    private final InterfaceType type;
    private final Object data;

    private OutputData(InterfaceType type, Object data) {
        this.type = type;
        this.data = Objects.requireNonNull(data, "data");
    }

    public static OutputData text(String text) {
        return new OutputData(InterfaceType.TEXT_STREAM, text);
    }

    public static OutputData image(DicomImage image) {
        return new OutputData(InterfaceType.IMAGE, image);
    }

    public static OutputData binary(byte[] bytes) {
        return new OutputData(InterfaceType.BINARY_FILE, bytes);
    }

    public InterfaceType getType() {
        return type;
    }

    public String asText() {
        if (type == InterfaceType.TEXT_STREAM) {
            return (String) data;
        }
        if (type == InterfaceType.BINARY_FILE) {
            return new String((byte[]) data, StandardCharsets.UTF_8);
        }
        throw new IllegalStateException("Output is " + type + ", not text");
    }

    public DicomImage asImage() {
        if (type != InterfaceType.IMAGE) {
            throw new IllegalStateException("Output is " + type + ", not an image");
        }
        return (DicomImage) data;
    }

    public byte[] asBytes() {
        if (type != InterfaceType.BINARY_FILE) {
            throw new IllegalStateException("Output is " + type + ", not a binary file");
        }
        return ((byte[]) data).clone();
    }
}

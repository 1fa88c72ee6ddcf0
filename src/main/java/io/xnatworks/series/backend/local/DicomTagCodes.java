/*
 * XNAT DICOM Series Organizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.series.backend.local;

/**
 * Parses tag codes in {@code gggg|eeee} form into dcm4che integer tags.
 */
final class DicomTagCodes {

    private DicomTagCodes() {
    }

    /**
     * Parse a code such as {@code 0020|0013}. A comma separator and surrounding parentheses are accepted too.
     *
     * @throws IllegalArgumentException if the code is malformed
     */
    static int parse(String code) {
        if (code == null) {
            throw new IllegalArgumentException("Tag code is null");
        }
        String trimmed = code.trim();
        if (trimmed.startsWith("(") && trimmed.endsWith(")")) {
            trimmed = trimmed.substring(1, trimmed.length() - 1);
        }
        String[] parts = trimmed.split("[|,]");
        if (parts.length != 2 || parts[0].trim().length() != 4 || parts[1].trim().length() != 4) {
            throw new IllegalArgumentException("Malformed tag code: " + code);
        }
        try {
            int group = Integer.parseInt(parts[0].trim(), 16);
            int element = Integer.parseInt(parts[1].trim(), 16);
            return (group << 16) | element;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed tag code: " + code, e);
        }
    }
}

/*
 * XNAT DICOM Series Organizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.series.dicom;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How {@link InstanceOrderer} treats files that share an instance number.
 */
public enum DuplicateInstancePolicy {

    /**
     * The later file in scan order replaces the earlier one. The ordered volume can be shorter than its input.
     */
    LAST_WINS,

    /**
     * Every file is kept. Files sharing a number stay in scan order.
     */
    KEEP_ALL;

    @JsonValue
    public String toConfigValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static DuplicateInstancePolicy fromConfigValue(String value) {
        if (value == null) {
            return null;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown duplicate instance policy: " + value, e);
        }
    }
}

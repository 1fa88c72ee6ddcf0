/*
 * XNAT DICOM Series Organizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.series.backend.local;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parsed {@code --option value...} arguments of a pipeline run.
 * An option takes every following argument up to the next option.
 */
final class PipelineArguments {

    private final Map<String, List<String>> options;

    private PipelineArguments(Map<String, List<String>> options) {
        this.options = options;
    }

    static PipelineArguments parse(List<String> args) {
        Map<String, List<String>> options = new LinkedHashMap<>();
        List<String> current = null;
        for (String arg : args) {
            if (arg.startsWith("--") && arg.length() > 2) {
                current = new ArrayList<>();
                options.put(arg.substring(2), current);
            } else if (current != null) {
                current.add(arg);
            } else {
                throw new IllegalArgumentException("Unexpected argument before any option: " + arg);
            }
        }
        return new PipelineArguments(options);
    }

    boolean isEmpty() {
        return options.isEmpty();
    }

    /**
     * Single value of an option.
     *
     * @throws IllegalArgumentException if the option is missing or has no value
     */
    String require(String option) {
        List<String> values = options.get(option);
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException("Missing value for --" + option);
        }
        return values.get(0);
    }

    String get(String option, String defaultValue) {
        List<String> values = options.get(option);
        return values == null || values.isEmpty() ? defaultValue : values.get(0);
    }

    List<String> getAll(String option) {
        List<String> values = options.get(option);
        return values == null ? Collections.emptyList() : Collections.unmodifiableList(values);
    }
}

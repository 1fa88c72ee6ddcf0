/*
 * XNAT DICOM Series Organizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.series.dicom;

import io.xnatworks.series.model.DicomFile;
import io.xnatworks.series.model.TagSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Orders the files of one volume by Instance Number (0020,0013).
 * <p>
 * Lookups run one file at a time in input order. An instance number is read from its leading integer,
 * so {@code "3\4"} sorts as 3 and {@code "12abc"} as 12. A file whose value is missing or does not
 * start with an integer sorts as 0. With {@link DuplicateInstancePolicy#LAST_WINS} a repeated number keeps only the
 * later file, so the result can be shorter than the input.
 */
public class InstanceOrderer {
    private static final Logger log = LoggerFactory.getLogger(InstanceOrderer.class);

    static final int MISSING_INSTANCE_NUMBER = 0;

    private final TagReader tagReader;
    private final DuplicateInstancePolicy duplicatePolicy;

    public InstanceOrderer(TagReader tagReader, DuplicateInstancePolicy duplicatePolicy) {
        this.tagReader = tagReader;
        this.duplicatePolicy = duplicatePolicy;
    }

    /**
     * @throws OrderException if an instance number could not be read because the backend failed
     */
    public List<DicomFile> orderByInstance(List<DicomFile> files) throws OrderException {
        TreeMap<Integer, List<DicomFile>> byInstance = new TreeMap<>();

        for (DicomFile file : files) {
            String value;
            try {
                value = tagReader.readTag(file, TagSpec.INSTANCE_NUMBER);
            } catch (TagReadException e) {
                throw new OrderException("Failed to read instance number of " + file.getName() + ": " + e.getMessage(), e);
            }
            int instance = parseInstanceNumber(value);

            List<DicomFile> atKey = byInstance.computeIfAbsent(instance, k -> new ArrayList<>(1));
            if (!atKey.isEmpty()) {
                log.warn("Instance number {} repeated: {} and {} ({})",
                        instance, atKey.get(atKey.size() - 1).getName(), file.getName(), duplicatePolicy);
                if (duplicatePolicy == DuplicateInstancePolicy.LAST_WINS) {
                    atKey.clear();
                }
            }
            atKey.add(file);
        }

        List<DicomFile> ordered = new ArrayList<>(files.size());
        for (Map.Entry<Integer, List<DicomFile>> entry : byInstance.entrySet()) {
            ordered.addAll(entry.getValue());
        }
        if (ordered.size() < files.size()) {
            log.info("Dropped {} files with repeated instance numbers", files.size() - ordered.size());
        }
        return ordered;
    }

    /**
     * Leading integer of an instance number, {@value #MISSING_INSTANCE_NUMBER} when absent, when it does
     * not start with an optionally signed run of digits, or when that run overflows an int.
     */
    static int parseInstanceNumber(String value) {
        if (value == null) {
            return MISSING_INSTANCE_NUMBER;
        }
        String trimmed = value.trim();
        int end = 0;
        if (end < trimmed.length() && (trimmed.charAt(end) == '-' || trimmed.charAt(end) == '+')) {
            end++;
        }
        int digitsStart = end;
        while (end < trimmed.length() && trimmed.charAt(end) >= '0' && trimmed.charAt(end) <= '9') {
            end++;
        }
        if (end == digitsStart) {
            log.debug("Instance number '{}' is not an integer, using {}", value, MISSING_INSTANCE_NUMBER);
            return MISSING_INSTANCE_NUMBER;
        }
        try {
            return Integer.parseInt(trimmed.substring(0, end));
        } catch (NumberFormatException e) {
            log.debug("Instance number '{}' is out of range, using {}", value, MISSING_INSTANCE_NUMBER);
            return MISSING_INSTANCE_NUMBER;
        }
    }
}

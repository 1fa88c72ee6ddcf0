/*
 * XNAT DICOM Series Organizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.series.dicom;

import io.xnatworks.series.backend.BackendGateway;
import io.xnatworks.series.backend.BackendUnavailableException;
import io.xnatworks.series.backend.InitException;
import io.xnatworks.series.backend.TaskExecutionException;
import io.xnatworks.series.model.DicomFile;
import io.xnatworks.series.model.TagSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads named tags from a single file.
 * Tags missing from the file are left out of the result rather than reported as errors.
 */
public class TagReader {
    private static final Logger log = LoggerFactory.getLogger(TagReader.class);

    private final BackendGateway gateway;

    public TagReader(BackendGateway gateway) {
        this.gateway = gateway;
    }

    /**
     * @param file the file to read
     * @param tags tags to read
     * @return tag name to value, in request order, for the tags present in the file
     * @throws TagReadException if the backend cannot be reached or fails
     */
    public Map<String, String> readTags(DicomFile file, List<TagSpec> tags) throws TagReadException {
        List<String> codes = new ArrayList<>(tags.size());
        for (TagSpec spec : tags) {
            codes.add(spec.getTag());
        }

        Map<String, String> tagValues;
        try {
            gateway.initialize();
            tagValues = gateway.readDicomTags(FileNames.sanitize(file), codes);
        } catch (InitException | BackendUnavailableException | TaskExecutionException e) {
            throw new TagReadException("Failed to read tags from " + file.getName() + ": " + e.getMessage(), e);
        }

        // backends may differ in the case of hex digits
        Map<String, String> byCode = new HashMap<>();
        for (Map.Entry<String, String> entry : tagValues.entrySet()) {
            if (entry.getKey() == null) {
                log.debug("Ignoring tag value without a code from {}", file.getName());
                continue;
            }
            byCode.put(entry.getKey().toLowerCase(Locale.ROOT), entry.getValue());
        }

        Map<String, String> result = new LinkedHashMap<>();
        for (TagSpec spec : tags) {
            String value = byCode.get(spec.getTag().toLowerCase(Locale.ROOT));
            if (value != null) {
                result.put(spec.getName(), value);
            }
        }

        log.debug("Read {}/{} tags from {}", result.size(), tags.size(), file.getName());
        return result;
    }

    /**
     * Single tag value, or null when the file does not carry it.
     */
    public String readTag(DicomFile file, TagSpec tag) throws TagReadException {
        return readTags(file, List.of(tag)).get(tag.getName());
    }
}

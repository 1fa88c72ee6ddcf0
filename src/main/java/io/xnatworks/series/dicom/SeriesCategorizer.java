/*
 * XNAT DICOM Series Organizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.series.dicom;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.xnatworks.series.backend.BackendGateway;
import io.xnatworks.series.backend.BackendUnavailableException;
import io.xnatworks.series.backend.InitException;
import io.xnatworks.series.backend.InterfaceType;
import io.xnatworks.series.backend.PipelineInput;
import io.xnatworks.series.backend.PipelineOutput;
import io.xnatworks.series.backend.TaskExecutionException;
import io.xnatworks.series.backend.TaskResult;
import io.xnatworks.series.model.DicomFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Splits a set of files into volumes using the backend's grouping.
 * <p>
 * Files are submitted under their position in the input list rather than their names, so two files
 * with the same name cannot collide. The backend answers in terms of those positions, which are then
 * mapped back to the caller's files. The answer must be a partition of what was submitted.
 */
public class SeriesCategorizer {
    private static final Logger log = LoggerFactory.getLogger(SeriesCategorizer.class);

    private static final TypeReference<LinkedHashMap<String, List<String>>> VOLUME_MAP =
            new TypeReference<LinkedHashMap<String, List<String>>>() {};

    private final BackendGateway gateway;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public SeriesCategorizer(BackendGateway gateway) {
        this.gateway = gateway;
    }

    /**
     * @return volume ID to files, in backend order; every input file appears in exactly one volume
     * @throws CategorizeException if the backend fails or returns a grouping that is not a partition
     */
    public Map<String, List<DicomFile>> categorize(List<DicomFile> files) throws CategorizeException {
        if (files.isEmpty()) {
            return new LinkedHashMap<>();
        }

        List<PipelineInput> inputs = new ArrayList<>(files.size());
        List<String> args = new ArrayList<>(List.of("--action", "categorize", "--memory-io", "0", "--files"));
        for (int i = 0; i < files.size(); i++) {
            String id = FileNames.sanitize(Integer.toString(i));
            inputs.add(PipelineInput.binaryFile(id, files.get(i).getContent()));
            args.add(id);
        }

        String json;
        try {
            gateway.initialize();
            TaskResult result = gateway.runTask(BackendGateway.DICOM_PIPELINE, args, inputs,
                    List.of(PipelineOutput.textStream()));
            json = result.getOutput(0, InterfaceType.TEXT_STREAM).asText();
        } catch (InitException | BackendUnavailableException | TaskExecutionException e) {
            throw new CategorizeException("Failed to categorize " + files.size() + " files: " + e.getMessage(), e);
        }

        Map<String, List<String>> volumeToIds;
        try {
            volumeToIds = objectMapper.readValue(json, VOLUME_MAP);
        } catch (JsonProcessingException e) {
            throw new CategorizeException("Backend returned malformed categorization: " + e.getOriginalMessage(), e);
        }
        if (volumeToIds == null) {
            throw new CategorizeException("Backend returned an empty categorization");
        }

        Map<String, List<DicomFile>> volumes = rehydrate(volumeToIds, files);
        log.info("Categorized {} files into {} volumes", files.size(), volumes.size());
        return volumes;
    }

    /**
     * Map identifiers back to files, checking that every submitted file is placed exactly once.
     */
    private static Map<String, List<DicomFile>> rehydrate(Map<String, List<String>> volumeToIds,
                                                          List<DicomFile> files) throws CategorizeException {
        boolean[] seen = new boolean[files.size()];
        Map<String, List<DicomFile>> volumes = new LinkedHashMap<>();

        for (Map.Entry<String, List<String>> entry : volumeToIds.entrySet()) {
            List<String> ids = entry.getValue() != null ? entry.getValue() : Collections.emptyList();
            List<DicomFile> volume = new ArrayList<>(ids.size());
            for (String id : ids) {
                int index = parseIndex(id, files.size());
                if (seen[index]) {
                    throw new CategorizeException("File identifier '" + id + "' appears more than once in categorization");
                }
                seen[index] = true;
                volume.add(files.get(index));
            }
            volumes.put(entry.getKey(), volume);
        }

        List<Integer> missing = new ArrayList<>();
        for (int i = 0; i < seen.length; i++) {
            if (!seen[i]) {
                missing.add(i);
            }
        }
        if (!missing.isEmpty()) {
            throw new CategorizeException("Categorization left out " + missing.size() + " files: " + missing);
        }
        return volumes;
    }

    private static int parseIndex(String id, int count) throws CategorizeException {
        int index;
        try {
            index = Integer.parseInt(id == null ? "" : id);
        } catch (NumberFormatException e) {
            throw new CategorizeException("Unknown file identifier in categorization: '" + id + "'", e);
        }
        // "01" or "+1" parse, but were never submitted
        if (!Integer.toString(index).equals(id)) {
            throw new CategorizeException("Unknown file identifier in categorization: '" + id + "'");
        }
        if (index < 0 || index >= count) {
            throw new CategorizeException("File identifier out of range in categorization: " + id);
        }
        return index;
    }
}

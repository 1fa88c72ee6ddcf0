/*
 * XNAT DICOM Series Organizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.series.backend.local;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.xnatworks.series.backend.InterfaceType;
import io.xnatworks.series.backend.OutputData;
import io.xnatworks.series.backend.PipelineInput;
import io.xnatworks.series.backend.PipelineOutput;
import io.xnatworks.series.backend.SerialBackendHandle;
import io.xnatworks.series.backend.TaskExecutionException;
import io.xnatworks.series.backend.TaskResult;
import io.xnatworks.series.model.DicomFile;
import io.xnatworks.series.model.DicomImage;
import io.xnatworks.series.model.ImageType;
import io.xnatworks.series.model.SpatialParameters;
import org.dcm4che3.data.Attributes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-process backend handle running the {@code dicom} pipeline actions, tag reads and series reads.
 */
class LocalBackendHandle extends SerialBackendHandle {
    private static final Logger log = LoggerFactory.getLogger(LocalBackendHandle.class);

    static final String ACTION_CATEGORIZE = "categorize";
    static final String ACTION_GET_SLICE_IMAGE = "getSliceImage";

    private final ObjectMapper objectMapper = new ObjectMapper();

    LocalBackendHandle() {
        super("dicom-backend-worker");
    }

    @Override
    public TaskResult runPipeline(String pipeline, List<String> args,
                                  List<PipelineInput> inputs, List<PipelineOutput> outputs) throws TaskExecutionException {
        return submit("pipeline '" + pipeline + "'", () -> {
            try {
                return execute(pipeline, args, inputs);
            } catch (IOException | IllegalArgumentException e) {
                log.debug("Pipeline '{}' failed: {}", pipeline, e.getMessage());
                return new TaskResult(1, "", e.getMessage(), Collections.emptyList());
            }
        });
    }

    private TaskResult execute(String pipeline, List<String> args, List<PipelineInput> inputs) throws IOException {
        if (!"dicom".equals(pipeline)) {
            throw new IllegalArgumentException("Unknown pipeline: " + pipeline);
        }
        PipelineArguments parsed = PipelineArguments.parse(args);
        if (parsed.isEmpty()) {
            // bootstrap probe
            return TaskResult.success(Collections.emptyList());
        }

        String action = parsed.require("action");
        switch (action) {
            case ACTION_CATEGORIZE:
                return TaskResult.success(List.of(categorize(parsed.getAll("files"), inputs)));
            case ACTION_GET_SLICE_IMAGE:
                boolean thumbnail = Boolean.parseBoolean(parsed.get("thumbnail", "false"));
                return TaskResult.success(List.of(sliceImage(parsed.require("file"), thumbnail, inputs)));
            default:
                throw new IllegalArgumentException("Unknown action: " + action);
        }
    }

    private OutputData categorize(List<String> ids, List<PipelineInput> inputs) throws IOException {
        Map<String, PipelineInput> byPath = indexByPath(inputs);
        SeriesGrouper grouper = new SeriesGrouper();
        for (String id : ids) {
            PipelineInput input = byPath.get(id);
            if (input == null) {
                throw new IllegalArgumentException("No input file named '" + id + "'");
            }
            grouper.add(id, DicomDatasets.read(id, input.getData()));
        }

        Map<String, List<String>> volumes = grouper.volumes();
        log.debug("Categorized {} files into {} volumes", ids.size(), volumes.size());
        try {
            return OutputData.text(objectMapper.writeValueAsString(volumes));
        } catch (JsonProcessingException e) {
            throw new IOException("Could not encode categorization: " + e.getMessage(), e);
        }
    }

    private OutputData sliceImage(String id, boolean thumbnail, List<PipelineInput> inputs) throws IOException {
        PipelineInput input = indexByPath(inputs).get(id);
        if (input == null) {
            throw new IllegalArgumentException("No input file named '" + id + "'");
        }
        DecodedSlice slice = PixelDataDecoder.decode(id, DicomDatasets.read(id, input.getData()));

        byte[] frame = slice.frames.get(0);
        ImageType type = slice.pixelType;
        if (thumbnail) {
            frame = PixelDataDecoder.rescaleToUint8(frame, type);
            type = new ImageType(2, ImageType.UINT8, type.getPixelType(), type.getComponents());
        }

        double[] origin = slice.hasPosition()
                ? new double[]{slice.position[0], slice.position[1]}
                : new double[2];
        SpatialParameters geometry = new SpatialParameters(
                new int[]{slice.columns, slice.rows}, slice.inPlaneSpacing(), origin, new double[]{1, 0, 0, 1});
        return OutputData.image(new DicomImage(id, type, geometry, frame));
    }

    private static Map<String, PipelineInput> indexByPath(List<PipelineInput> inputs) {
        Map<String, PipelineInput> byPath = new LinkedHashMap<>();
        for (PipelineInput input : inputs) {
            if (input.getType() == InterfaceType.BINARY_FILE) {
                byPath.put(input.getPath(), input);
            }
        }
        return byPath;
    }

    @Override
    public Map<String, String> readDicomTags(DicomFile file, List<String> tags) throws TaskExecutionException {
        return submit("tag read of " + file.getName(), () -> {
            if (file.size() == 0) {
                return Collections.<String, String>emptyMap();
            }
            Attributes attrs = DicomDatasets.read(file.getName(), file.getContent());
            Map<String, String> values = new LinkedHashMap<>();
            for (String code : tags) {
                int tag = DicomTagCodes.parse(code);
                if (!attrs.contains(tag)) {
                    continue;
                }
                String[] strings = attrs.getStrings(tag);
                values.put(code, strings == null ? "" : String.join("\\", strings));
            }
            return values;
        });
    }

    @Override
    public DicomImage readImageDicomFileSeries(List<DicomFile> files, boolean singleSortedSeries)
            throws TaskExecutionException {
        return submit("series read", () -> {
            List<DecodedSlice> slices = new ArrayList<>(files.size());
            for (DicomFile file : files) {
                slices.add(PixelDataDecoder.decode(file.getName(), DicomDatasets.read(file.getName(), file.getContent())));
            }
            String name = files.isEmpty() ? "volume" : files.get(0).getName();
            return SeriesVolumeAssembler.assemble(name, slices, singleSortedSeries);
        });
    }
}

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
import io.xnatworks.series.backend.InterfaceType;
import io.xnatworks.series.backend.PipelineInput;
import io.xnatworks.series.backend.PipelineOutput;
import io.xnatworks.series.backend.TaskExecutionException;
import io.xnatworks.series.backend.TaskResult;
import io.xnatworks.series.model.DicomFile;
import io.xnatworks.series.model.DicomImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Requests reconstructed slice and volume images from the backend.
 */
public class ImageBuilder {
    private static final Logger log = LoggerFactory.getLogger(ImageBuilder.class);

    private final BackendGateway gateway;
    private final boolean presorted;

    /**
     * @param presorted volumes are handed over already in slice order, so the backend must not re-sort them
     */
    public ImageBuilder(BackendGateway gateway, boolean presorted) {
        this.gateway = gateway;
        this.presorted = presorted;
    }

    /**
     * Extract the image of a single slice.
     *
     * @param asThumbnail reduce the image to 8 bits for previews
     */
    public DicomImage getSlice(DicomFile file, boolean asThumbnail) throws BuildException {
        String id = FileNames.sanitize(file.getName());
        List<String> args = List.of(
                "--action", "getSliceImage",
                "--thumbnail", Boolean.toString(asThumbnail),
                "--file", id,
                "--memory-io", "0");

        DicomImage image;
        try {
            gateway.initialize();
            TaskResult result = gateway.runTask(BackendGateway.DICOM_PIPELINE, args,
                    List.of(PipelineInput.binaryFile(id, file.getContent())),
                    List.of(PipelineOutput.image()));
            image = result.getOutput(0, InterfaceType.IMAGE).asImage();
        } catch (InitException | BackendUnavailableException | TaskExecutionException e) {
            throw new BuildException("Failed to get slice " + file.getName() + ": " + e.getMessage(), e);
        }

        if (image.getDimension() != 2) {
            throw new BuildException("Backend returned a " + image.getDimension() + "D image for slice " + file.getName());
        }
        return image;
    }

    /**
     * Reconstruct a volume from files in slice order.
     */
    public DicomImage buildVolume(List<DicomFile> orderedFiles) throws BuildException {
        if (orderedFiles.isEmpty()) {
            throw new BuildException("Cannot build a volume from no files");
        }

        List<DicomFile> sanitized = new ArrayList<>(orderedFiles.size());
        for (DicomFile file : orderedFiles) {
            sanitized.add(FileNames.sanitize(file));
        }

        DicomImage image;
        try {
            gateway.initialize();
            image = gateway.readImageDicomFileSeries(sanitized, presorted);
        } catch (InitException | BackendUnavailableException | TaskExecutionException e) {
            throw new BuildException("Failed to build volume from " + orderedFiles.size() + " files: " + e.getMessage(), e);
        }

        if (image == null) {
            throw new BuildException("Backend returned no volume");
        }
        log.debug("Built volume from {} files: {}", orderedFiles.size(), image.getSpatialParameters());
        return image;
    }
}

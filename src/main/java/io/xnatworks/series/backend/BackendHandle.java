/*
 * XNAT DICOM Series Organizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.series.backend;

import io.xnatworks.series.model.DicomFile;
import io.xnatworks.series.model.DicomImage;

import java.util.List;
import java.util.Map;

/**
 * A live connection to a decoding backend.
 * <p>
 * The backend runs one task at a time to completion. Calls block until the task finishes
 * and cannot be interrupted once submitted.
 */
public interface BackendHandle extends AutoCloseable {

    /**
     * Run a named pipeline.
     *
     * @param pipeline pipeline name, e.g. "dicom"
     * @param args     positional string arguments
     * @param inputs   payloads the pipeline reads
     * @param outputs  outputs the pipeline is expected to produce, in order
     * @return the pipeline result, whatever its return code
     * @throws TaskExecutionException if the task could not be run or delivered
     */
    TaskResult runPipeline(String pipeline, List<String> args,
                           List<PipelineInput> inputs, List<PipelineOutput> outputs) throws TaskExecutionException;

    /**
     * Read tag values from one file.
     *
     * @param tags tag codes in {@code gggg|eeee} form
     * @return tag code to value, for the tags present in the file only
     */
    Map<String, String> readDicomTags(DicomFile file, List<String> tags) throws TaskExecutionException;

    /**
     * Reconstruct one volume from a series of files.
     *
     * @param singleSortedSeries the files are one series already in slice order; skip sorting
     */
    DicomImage readImageDicomFileSeries(List<DicomFile> files, boolean singleSortedSeries) throws TaskExecutionException;

    @Override
    void close();
}

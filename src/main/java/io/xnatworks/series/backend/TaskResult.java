/*
 * XNAT DICOM Series Organizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.series.backend;

import java.util.Collections;
import java.util.List;

/**
 * Structured result of one pipeline run.
 */
public class TaskResult {

    private final int returnCode;
    private final String stdout;
    private final String stderr;
    private final List<OutputData> outputs;

    public TaskResult(int returnCode, String stdout, String stderr, List<OutputData> outputs) {
        this.returnCode = returnCode;
        this.stdout = stdout != null ? stdout : "";
        this.stderr = stderr != null ? stderr : "";
        this.outputs = outputs != null ? List.copyOf(outputs) : Collections.emptyList();
    }

    public static TaskResult success(List<OutputData> outputs) {
        return new TaskResult(0, "", "", outputs);
    }

    public int getReturnCode() {
        return returnCode;
    }

    public boolean isSuccess() {
        return returnCode == 0;
    }

    public String getStdout() {
        return stdout;
    }

    public String getStderr() {
        return stderr;
    }

    public List<OutputData> getOutputs() {
        return outputs;
    }

    /**
     * Output at the given position, checked against the expected type.
     */
    public OutputData getOutput(int index, InterfaceType expected) throws TaskExecutionException {
        if (index >= outputs.size()) {
            throw new TaskExecutionException("Pipeline produced " + outputs.size()
                    + " outputs, output " + index + " is missing");
        }
        OutputData output = outputs.get(index);
        if (output.getType() != expected) {
            throw new TaskExecutionException("Output " + index + " is " + output.getType()
                    + ", expected " + expected);
        }
        return output;
    }
}

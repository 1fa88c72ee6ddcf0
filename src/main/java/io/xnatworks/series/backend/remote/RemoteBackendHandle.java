/*
 * XNAT DICOM Series Organizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.series.backend.remote;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
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
import okhttp3.MediaType;
import okhttp3.MultipartBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Handle to a pipeline worker service reached over HTTP.
 */
class RemoteBackendHandle extends SerialBackendHandle {
    private static final Logger log = LoggerFactory.getLogger(RemoteBackendHandle.class);

    private static final MediaType JSON = MediaType.parse("application/json; charset=utf-8");
    private static final MediaType DICOM = MediaType.parse("application/dicom");

    private final String baseUrl;
    private final String workerUrl;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    RemoteBackendHandle(String baseUrl, String workerUrl, OkHttpClient httpClient) {
        super("dicom-backend-remote");
        this.baseUrl = baseUrl;
        this.workerUrl = workerUrl;
        this.httpClient = httpClient;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public TaskResult runPipeline(String pipeline, List<String> args,
                                  List<PipelineInput> inputs, List<PipelineOutput> outputs) throws TaskExecutionException {
        return submit("pipeline '" + pipeline + "'", () -> {
            Map<String, Object> request = new LinkedHashMap<>();
            request.put("args", args);
            List<String> outputTypes = new ArrayList<>();
            for (PipelineOutput output : outputs) {
                outputTypes.add(output.getType().name());
            }
            request.put("outputs", outputTypes);
            List<String> textInputs = new ArrayList<>();
            for (PipelineInput input : inputs) {
                if (input.getType() == InterfaceType.TEXT_STREAM) {
                    textInputs.add(input.getText());
                }
            }
            request.put("textInputs", textInputs);
            if (workerUrl != null) {
                request.put("workerUrl", workerUrl);
            }

            MultipartBody.Builder body = new MultipartBody.Builder()
                    .setType(MultipartBody.FORM)
                    .addFormDataPart("request", null,
                            RequestBody.create(objectMapper.writeValueAsBytes(request), JSON));
            for (PipelineInput input : inputs) {
                if (input.getType() == InterfaceType.BINARY_FILE) {
                    body.addFormDataPart("files", input.getPath(), RequestBody.create(input.getData(), DICOM));
                }
            }

            PipelineResponse response = post("/pipelines/" + pipeline, body.build(), PipelineResponse.class);
            List<OutputData> outputData = new ArrayList<>();
            if (response.outputs != null) {
                for (OutputPayload payload : response.outputs) {
                    outputData.add(toOutputData(payload));
                }
            }
            return new TaskResult(response.returnCode, response.stdout, response.stderr, outputData);
        });
    }

    @Override
    public Map<String, String> readDicomTags(DicomFile file, List<String> tags) throws TaskExecutionException {
        return submit("tag read of " + file.getName(), () -> {
            MultipartBody body = new MultipartBody.Builder()
                    .setType(MultipartBody.FORM)
                    .addFormDataPart("tags", null, RequestBody.create(objectMapper.writeValueAsBytes(tags), JSON))
                    .addFormDataPart("file", file.getName(), RequestBody.create(file.getContent(), DICOM))
                    .build();

            TagsResponse response = post("/tags", body, TagsResponse.class);
            Map<String, String> values = new LinkedHashMap<>();
            if (response.tags != null) {
                for (List<String> pair : response.tags) {
                    if (pair != null && pair.size() == 2 && pair.get(0) != null) {
                        values.put(pair.get(0), pair.get(1));
                    }
                }
            }
            return values;
        });
    }

    @Override
    public DicomImage readImageDicomFileSeries(List<DicomFile> files, boolean singleSortedSeries)
            throws TaskExecutionException {
        return submit("series read", () -> {
            MultipartBody.Builder body = new MultipartBody.Builder()
                    .setType(MultipartBody.FORM)
                    .addFormDataPart("singleSortedSeries", String.valueOf(singleSortedSeries));
            for (DicomFile file : files) {
                body.addFormDataPart("files", file.getName(), RequestBody.create(file.getContent(), DICOM));
            }

            SeriesResponse response = post("/series", body.build(), SeriesResponse.class);
            if (response.outputImage == null) {
                throw new TaskExecutionException("Series read returned no image");
            }
            return response.outputImage.toImage();
        });
    }

    private <T> T post(String path, RequestBody body, Class<T> responseType) throws IOException, TaskExecutionException {
        Request request = new Request.Builder()
                .url(baseUrl + path)
                .post(body)
                .build();

        log.debug("POST {}{}", baseUrl, path);
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody responseBody = response.body();
            if (!response.isSuccessful()) {
                String detail = responseBody != null ? responseBody.string() : "";
                throw new TaskExecutionException("Backend request " + path + " failed: HTTP "
                        + response.code() + (detail.isBlank() ? "" : " " + detail.trim()));
            }
            if (responseBody == null) {
                throw new TaskExecutionException("Backend request " + path + " returned no body");
            }
            return objectMapper.readValue(responseBody.bytes(), responseType);
        }
    }

    private OutputData toOutputData(OutputPayload payload) throws IOException, TaskExecutionException {
        InterfaceType type;
        try {
            type = InterfaceType.valueOf(payload.type);
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new TaskExecutionException("Unknown output type from backend: " + payload.type);
        }
        if (payload.data == null || payload.data.isNull()) {
            throw new TaskExecutionException("Backend output of type " + type + " has no data");
        }
        switch (type) {
            case TEXT_STREAM:
                return OutputData.text(payload.data.asText());
            case BINARY_FILE:
                return OutputData.binary(payload.data.binaryValue());
            case IMAGE:
                return OutputData.image(objectMapper.treeToValue(payload.data, ImagePayload.class).toImage());
            default:
                throw new TaskExecutionException("Unsupported output type: " + type);
        }
    }

    @Override
    public void close() {
        super.close();
        httpClient.dispatcher().executorService().shutdown();
        httpClient.connectionPool().evictAll();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class PipelineResponse {
        @JsonProperty("returnCode")
        int returnCode;
        @JsonProperty("stdout")
        String stdout;
        @JsonProperty("stderr")
        String stderr;
        @JsonProperty("outputs")
        List<OutputPayload> outputs;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class OutputPayload {
        @JsonProperty("type")
        String type;
        @JsonProperty("data")
        JsonNode data;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class TagsResponse {
        @JsonProperty("tags")
        List<List<String>> tags;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class SeriesResponse {
        @JsonProperty("outputImage")
        ImagePayload outputImage;
    }

    /**
     * Image as sent by the service; pixel data is base64.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ImagePayload {
        @JsonProperty("imageType")
        ImageType imageType;
        @JsonProperty("name")
        String name;
        @JsonProperty("size")
        int[] size;
        @JsonProperty("spacing")
        double[] spacing;
        @JsonProperty("origin")
        double[] origin;
        @JsonProperty("direction")
        double[] direction;
        @JsonProperty("data")
        byte[] data;

        DicomImage toImage() throws TaskExecutionException {
            try {
                return new DicomImage(name, imageType, new SpatialParameters(size, spacing, origin, direction),
                        data != null ? data : new byte[0]);
            } catch (IllegalArgumentException | NullPointerException e) {
                throw new TaskExecutionException("Malformed image from backend: " + e.getMessage(), e);
            }
        }
    }
}

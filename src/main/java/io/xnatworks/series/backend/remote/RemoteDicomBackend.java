/*
 * XNAT DICOM Series Organizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.series.backend.remote;

import io.xnatworks.series.backend.BackendHandle;
import io.xnatworks.series.backend.DecodingBackend;
import io.xnatworks.series.backend.InitException;
import io.xnatworks.series.config.EngineConfig;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * Decoding backend served by a pipeline worker over HTTP.
 * <p>
 * Endpoints, relative to {@code pipelines_url}:
 * <ul>
 *   <li>{@code GET /health} - reachability probe</li>
 *   <li>{@code POST /pipelines/{name}} - run a pipeline</li>
 *   <li>{@code POST /tags} - read tags from one file</li>
 *   <li>{@code POST /series} - reconstruct a volume</li>
 * </ul>
 */
public class RemoteDicomBackend implements DecodingBackend {
    private static final Logger log = LoggerFactory.getLogger(RemoteDicomBackend.class);

    @Override
    public String getName() {
        return EngineConfig.BACKEND_REMOTE;
    }

    @Override
    public BackendHandle open(EngineConfig config) throws InitException {
        String baseUrl = config.getPipelinesUrl().replaceAll("/$", "");

        OkHttpClient httpClient = new OkHttpClient.Builder()
                .connectTimeout(config.getConnectTimeoutSeconds(), TimeUnit.SECONDS)
                .readTimeout(config.getReadTimeoutSeconds(), TimeUnit.SECONDS)
                .writeTimeout(config.getReadTimeoutSeconds(), TimeUnit.SECONDS)
                .build();

        Request request = new Request.Builder()
                .url(baseUrl + "/health")
                .get()
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new InitException("Pipeline service at " + baseUrl + " is not healthy: HTTP " + response.code());
            }
        } catch (IOException e) {
            throw new InitException("Pipeline service at " + baseUrl + " is not reachable: " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new InitException("Invalid pipelines_url: " + config.getPipelinesUrl(), e);
        }

        log.debug("Connected to pipeline service at {}", baseUrl);
        return new RemoteBackendHandle(baseUrl, config.getPipelineWorkerUrl(), httpClient);
    }
}

/*
 * XNAT DICOM Series Organizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.series.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.xnatworks.series.dicom.DuplicateInstancePolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;

/**
 * Configuration for one series engine instance.
 * Backend discovery endpoints live here rather than in global state, so two engines
 * can talk to two different backends.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class EngineConfig {
    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    public static final String BACKEND_LOCAL = "local";
    public static final String BACKEND_REMOTE = "remote";

    /**
     * Which decoding backend to start: "local" (in-process dcm4che) or "remote" (pipeline worker over HTTP).
     */
    private String backend = BACKEND_LOCAL;

    /**
     * Base URL the pipelines are served from.
     */
    @JsonProperty("pipelines_url")
    private String pipelinesUrl = "http://localhost:8090";

    /**
     * Worker the remote service should run pipelines on. Optional.
     */
    @JsonProperty("pipeline_worker_url")
    private String pipelineWorkerUrl;

    /**
     * Order each categorized volume by instance number.
     */
    @JsonProperty("sort_by_instance_number")
    private boolean sortByInstanceNumber = true;

    /**
     * What to do when two files in a volume carry the same instance number.
     */
    @JsonProperty("duplicate_instance_policy")
    private DuplicateInstancePolicy duplicateInstancePolicy = DuplicateInstancePolicy.LAST_WINS;

    /**
     * Pre-load the tag reading pipeline while initializing.
     */
    @JsonProperty("warm_up")
    private boolean warmUp = true;

    @JsonProperty("connect_timeout_seconds")
    private int connectTimeoutSeconds = 30;

    @JsonProperty("read_timeout_seconds")
    private int readTimeoutSeconds = 120;

    public static EngineConfig load(File configFile) throws IOException {
        log.info("Loading engine configuration from: {}", configFile.getAbsolutePath());
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        EngineConfig config = mapper.readValue(configFile, EngineConfig.class);
        config.validate();
        return config;
    }

    public static EngineConfig load(String configPath) throws IOException {
        return load(new File(configPath));
    }

    /**
     * Load from a classpath resource, e.g. the bundled defaults.
     */
    public static EngineConfig loadResource(String resource) throws IOException {
        try (InputStream in = EngineConfig.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IOException("Configuration resource not found: " + resource);
            }
            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            EngineConfig config = mapper.readValue(in, EngineConfig.class);
            config.validate();
            return config;
        }
    }

    /**
     * Save the configuration to a YAML file.
     */
    public void save(File file) throws IOException {
        log.info("Saving engine configuration to: {}", file.getAbsolutePath());
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        mapper.writerWithDefaultPrettyPrinter().writeValue(file, this);
    }

    /**
     * Check that the settings describe a backend that can be started.
     *
     * @throws IllegalArgumentException if they do not
     */
    public void validate() {
        if (!BACKEND_LOCAL.equals(backend) && !BACKEND_REMOTE.equals(backend)) {
            throw new IllegalArgumentException("Unknown backend '" + backend
                    + "', expected '" + BACKEND_LOCAL + "' or '" + BACKEND_REMOTE + "'");
        }
        if (BACKEND_REMOTE.equals(backend) && (pipelinesUrl == null || pipelinesUrl.isBlank())) {
            throw new IllegalArgumentException("Remote backend requires pipelines_url");
        }
        if (duplicateInstancePolicy == null) {
            throw new IllegalArgumentException("duplicate_instance_policy must not be empty");
        }
        if (connectTimeoutSeconds < 0 || readTimeoutSeconds < 0) {
            throw new IllegalArgumentException("Timeouts must not be negative");
        }
    }

    public String getBackend() { return backend; }
    public void setBackend(String backend) { this.backend = backend; }

    public String getPipelinesUrl() { return pipelinesUrl; }
    public void setPipelinesUrl(String pipelinesUrl) { this.pipelinesUrl = pipelinesUrl; }

    public String getPipelineWorkerUrl() { return pipelineWorkerUrl; }
    public void setPipelineWorkerUrl(String pipelineWorkerUrl) { this.pipelineWorkerUrl = pipelineWorkerUrl; }

    public boolean isSortByInstanceNumber() { return sortByInstanceNumber; }
    public void setSortByInstanceNumber(boolean sortByInstanceNumber) { this.sortByInstanceNumber = sortByInstanceNumber; }

    public DuplicateInstancePolicy getDuplicateInstancePolicy() { return duplicateInstancePolicy; }
    public void setDuplicateInstancePolicy(DuplicateInstancePolicy duplicateInstancePolicy) {
        this.duplicateInstancePolicy = duplicateInstancePolicy;
    }

    public boolean isWarmUp() { return warmUp; }
    public void setWarmUp(boolean warmUp) { this.warmUp = warmUp; }

    public int getConnectTimeoutSeconds() { return connectTimeoutSeconds; }
    public void setConnectTimeoutSeconds(int connectTimeoutSeconds) { this.connectTimeoutSeconds = connectTimeoutSeconds; }

    public int getReadTimeoutSeconds() { return readTimeoutSeconds; }
    public void setReadTimeoutSeconds(int readTimeoutSeconds) { this.readTimeoutSeconds = readTimeoutSeconds; }
}

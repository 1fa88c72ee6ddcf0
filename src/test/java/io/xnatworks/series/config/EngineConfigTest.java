/*
 * XNAT DICOM Series Organizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 */
package io.xnatworks.series.config;

import io.xnatworks.series.dicom.DuplicateInstancePolicy;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for EngineConfig.
 */
@DisplayName("EngineConfig Tests")
class EngineConfigTest {

    @TempDir
    Path tempDir;

    private File write(String yaml) throws IOException {
        File configFile = tempDir.resolve("engine.yaml").toFile();
        Files.writeString(configFile.toPath(), yaml);
        return configFile;
    }

    @Nested
    @DisplayName("Default Values Tests")
    class DefaultValuesTests {

        @Test
        @DisplayName("Should default to the local backend")
        void shouldDefaultToLocalBackend() {
            EngineConfig config = new EngineConfig();

            assertEquals(EngineConfig.BACKEND_LOCAL, config.getBackend());
            assertEquals("http://localhost:8090", config.getPipelinesUrl());
            assertNull(config.getPipelineWorkerUrl());
        }

        @Test
        @DisplayName("Should sort by instance number with last-wins duplicates")
        void shouldHaveOrderingDefaults() {
            EngineConfig config = new EngineConfig();

            assertTrue(config.isSortByInstanceNumber());
            assertEquals(DuplicateInstancePolicy.LAST_WINS, config.getDuplicateInstancePolicy());
            assertTrue(config.isWarmUp());
            assertEquals(30, config.getConnectTimeoutSeconds());
            assertEquals(120, config.getReadTimeoutSeconds());
        }

        @Test
        @DisplayName("Should match the bundled defaults")
        void shouldMatchBundledDefaults() throws IOException {
            EngineConfig bundled = EngineConfig.loadResource("/series-engine.yml");
            EngineConfig defaults = new EngineConfig();

            assertEquals(defaults.getBackend(), bundled.getBackend());
            assertEquals(defaults.getPipelinesUrl(), bundled.getPipelinesUrl());
            assertEquals(defaults.getDuplicateInstancePolicy(), bundled.getDuplicateInstancePolicy());
            assertEquals(defaults.isSortByInstanceNumber(), bundled.isSortByInstanceNumber());
        }

        @Test
        @DisplayName("Should report a missing resource")
        void shouldReportMissingResource() {
            assertThrows(IOException.class, () -> EngineConfig.loadResource("/no-such-config.yml"));
        }
    }

    @Nested
    @DisplayName("YAML Loading Tests")
    class YamlLoadingTests {

        @Test
        @DisplayName("Should load config from YAML file")
        void shouldLoadConfigFromYaml() throws IOException {
            File configFile = write("""
                backend: remote
                pipelines_url: http://pipelines.example.org
                pipeline_worker_url: http://worker.example.org/worker.js
                sort_by_instance_number: false
                duplicate_instance_policy: keep_all
                warm_up: false
                connect_timeout_seconds: 5
                read_timeout_seconds: 60
                """);

            EngineConfig config = EngineConfig.load(configFile);

            assertEquals(EngineConfig.BACKEND_REMOTE, config.getBackend());
            assertEquals("http://pipelines.example.org", config.getPipelinesUrl());
            assertEquals("http://worker.example.org/worker.js", config.getPipelineWorkerUrl());
            assertFalse(config.isSortByInstanceNumber());
            assertEquals(DuplicateInstancePolicy.KEEP_ALL, config.getDuplicateInstancePolicy());
            assertFalse(config.isWarmUp());
            assertEquals(5, config.getConnectTimeoutSeconds());
            assertEquals(60, config.getReadTimeoutSeconds());
        }

        @Test
        @DisplayName("Should keep defaults for omitted settings and ignore unknown ones")
        void shouldKeepDefaultsForOmittedSettings() throws IOException {
            File configFile = write("""
                read_timeout_seconds: 10
                some_future_setting: true
                """);

            EngineConfig config = EngineConfig.load(configFile.getAbsolutePath());

            assertEquals(10, config.getReadTimeoutSeconds());
            assertEquals(EngineConfig.BACKEND_LOCAL, config.getBackend());
            assertEquals(DuplicateInstancePolicy.LAST_WINS, config.getDuplicateInstancePolicy());
        }

        @Test
        @DisplayName("Should accept policy names in any case")
        void shouldAcceptPolicyNamesInAnyCase() throws IOException {
            assertEquals(DuplicateInstancePolicy.KEEP_ALL,
                    EngineConfig.load(write("duplicate_instance_policy: KEEP-ALL\n")).getDuplicateInstancePolicy());
            assertEquals(DuplicateInstancePolicy.LAST_WINS,
                    EngineConfig.load(write("duplicate_instance_policy: Last_Wins\n")).getDuplicateInstancePolicy());
        }

        @Test
        @DisplayName("Should reject an unknown policy")
        void shouldRejectUnknownPolicy() throws IOException {
            File configFile = write("duplicate_instance_policy: first_wins\n");

            assertThrows(IOException.class, () -> EngineConfig.load(configFile));
        }

        @Test
        @DisplayName("Should save and reload the same settings")
        void shouldSaveAndReload() throws IOException {
            EngineConfig config = new EngineConfig();
            config.setBackend(EngineConfig.BACKEND_REMOTE);
            config.setPipelinesUrl("http://10.0.0.5:8090");
            config.setDuplicateInstancePolicy(DuplicateInstancePolicy.KEEP_ALL);
            config.setWarmUp(false);

            File configFile = tempDir.resolve("saved.yaml").toFile();
            config.save(configFile);
            String yaml = Files.readString(configFile.toPath());
            EngineConfig loaded = EngineConfig.load(configFile);

            assertTrue(yaml.contains("duplicate_instance_policy: \"keep_all\"")
                    || yaml.contains("duplicate_instance_policy: keep_all"), yaml);
            assertEquals(EngineConfig.BACKEND_REMOTE, loaded.getBackend());
            assertEquals("http://10.0.0.5:8090", loaded.getPipelinesUrl());
            assertEquals(DuplicateInstancePolicy.KEEP_ALL, loaded.getDuplicateInstancePolicy());
            assertFalse(loaded.isWarmUp());
        }
    }

    @Nested
    @DisplayName("Validation Tests")
    class ValidationTests {

        @Test
        @DisplayName("Should reject an unknown backend")
        void shouldRejectUnknownBackend() {
            EngineConfig config = new EngineConfig();
            config.setBackend("gpu");

            IllegalArgumentException e = assertThrows(IllegalArgumentException.class, config::validate);
            assertTrue(e.getMessage().contains("gpu"));
        }

        @Test
        @DisplayName("Should require a URL for the remote backend")
        void shouldRequireUrlForRemoteBackend() {
            EngineConfig config = new EngineConfig();
            config.setBackend(EngineConfig.BACKEND_REMOTE);
            config.setPipelinesUrl(" ");

            assertThrows(IllegalArgumentException.class, config::validate);
        }

        @Test
        @DisplayName("Should reject negative timeouts")
        void shouldRejectNegativeTimeouts() {
            EngineConfig config = new EngineConfig();
            config.setReadTimeoutSeconds(-1);

            assertThrows(IllegalArgumentException.class, config::validate);
        }

        @Test
        @DisplayName("Should reject invalid settings while loading")
        void shouldValidateOnLoad() throws IOException {
            File configFile = write("backend: cloud\n");

            assertThrows(IllegalArgumentException.class, () -> EngineConfig.load(configFile));
        }

        @Test
        @DisplayName("Should accept the defaults")
        void shouldAcceptDefaults() {
            assertDoesNotThrow(() -> new EngineConfig().validate());
        }
    }
}

/*
 * XNAT DICOM Series Organizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 */
package io.xnatworks.series.backend;

import io.xnatworks.series.config.EngineConfig;
import io.xnatworks.series.model.DicomFile;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for BackendGateway lifecycle and task dispatch.
 */
@DisplayName("Backend Gateway Tests")
class BackendGatewayTest {

    private ScriptedBackend backend;
    private EngineConfig config;
    private BackendGateway gateway;

    @BeforeEach
    void setUp() {
        backend = new ScriptedBackend();
        config = new EngineConfig();
        gateway = new BackendGateway(backend, config);
    }

    @AfterEach
    void tearDown() {
        gateway.close();
    }

    @Nested
    @DisplayName("Initialization")
    class InitializationTests {

        @Test
        @DisplayName("Should open the backend once across repeated calls")
        void shouldOpenOnce() throws Exception {
            gateway.initialize();
            gateway.initialize();
            gateway.initialize();

            assertEquals(1, backend.opens.get());
            assertTrue(gateway.isInitialized());
        }

        @Test
        @DisplayName("Should share one bootstrap between concurrent callers")
        void shouldShareBootstrapBetweenConcurrentCallers() throws Exception {
            backend.openGate = new CountDownLatch(1);
            int callers = 8;
            ExecutorService pool = Executors.newFixedThreadPool(callers);
            try {
                CountDownLatch ready = new CountDownLatch(callers);
                List<Future<?>> results = new ArrayList<>();
                for (int i = 0; i < callers; i++) {
                    results.add(pool.submit(() -> {
                        ready.countDown();
                        gateway.initialize();
                        return null;
                    }));
                }
                assertTrue(ready.await(5, TimeUnit.SECONDS));
                Thread.sleep(100);
                backend.openGate.countDown();

                for (Future<?> result : results) {
                    result.get(5, TimeUnit.SECONDS);
                }
            } finally {
                pool.shutdownNow();
            }

            assertEquals(1, backend.opens.get(), "Only one bootstrap should run");
            assertTrue(gateway.isInitialized());
        }

        @Test
        @DisplayName("Should report the same failure to every concurrent caller")
        void shouldReportSameFailureToAllCallers() throws Exception {
            backend.openGate = new CountDownLatch(1);
            backend.openFailure = new InitException("worker script missing");
            int callers = 6;
            ExecutorService pool = Executors.newFixedThreadPool(callers);
            Set<String> messages = Collections.synchronizedSet(new HashSet<>());
            try {
                List<Future<?>> results = new ArrayList<>();
                for (int i = 0; i < callers; i++) {
                    results.add(pool.submit(() -> {
                        InitException e = assertThrows(InitException.class, gateway::initialize);
                        messages.add(e.getMessage());
                        return null;
                    }));
                }
                Thread.sleep(100);
                backend.openGate.countDown();
                for (Future<?> result : results) {
                    result.get(5, TimeUnit.SECONDS);
                }
            } finally {
                pool.shutdownNow();
            }

            assertEquals(1, backend.opens.get());
            assertEquals(Set.of("worker script missing"), messages);
        }

        @Test
        @DisplayName("Should keep a failed initialization until reset")
        void shouldKeepFailureUntilReset() {
            backend.openFailure = new InitException("no worker");

            assertThrows(InitException.class, gateway::initialize);
            assertThrows(InitException.class, gateway::initialize);
            assertEquals(1, backend.opens.get(), "Failure should not be retried automatically");

            backend.openFailure = null;
            assertTrue(gateway.reset());
            assertDoesNotThrow(gateway::initialize);
            assertEquals(2, backend.opens.get());
        }

        @Test
        @DisplayName("Should settle the attempt when opening the backend throws an Error")
        void shouldSettleAttemptOnError() {
            backend.openError = new ExceptionInInitializerError("native library missing");

            assertThrows(ExceptionInInitializerError.class, gateway::initialize);
            InitException later = assertTimeoutPreemptively(Duration.ofSeconds(5),
                    () -> assertThrows(InitException.class, gateway::initialize));
            assertTrue(later.getMessage().contains("native library missing"), later.getMessage());
            assertEquals(1, backend.opens.get());

            backend.openError = null;
            assertTrue(gateway.reset());
            assertDoesNotThrow(gateway::initialize);
            assertEquals(2, backend.opens.get());
        }

        @Test
        @DisplayName("Should retry on the next call after an interrupted start")
        void shouldRetryAfterInterruptedStart() {
            backend.openFailure = new InitException("Interrupted while waiting for the worker",
                    new InterruptedException());

            assertThrows(InitException.class, gateway::initialize);
            assertFalse(gateway.reset(), "An interrupted start should not be kept as a failure");

            backend.openFailure = null;
            assertDoesNotThrow(gateway::initialize);
            assertEquals(2, backend.opens.get());
        }

        @Test
        @DisplayName("Should not reset a successful initialization")
        void shouldNotResetSuccess() throws Exception {
            gateway.initialize();

            assertFalse(gateway.reset());
            gateway.initialize();
            assertEquals(1, backend.opens.get());
        }

        @Test
        @DisplayName("Should ignore a failing warm-up")
        void shouldIgnoreWarmUpFailure() throws Exception {
            backend.failWarmUp = true;

            gateway.initialize();

            assertEquals(1, backend.warmUps.get());
            assertTrue(gateway.isInitialized());
        }

        @Test
        @DisplayName("Should skip warm-up when disabled")
        void shouldSkipWarmUpWhenDisabled() throws Exception {
            config.setWarmUp(false);

            gateway.initialize();

            assertEquals(0, backend.warmUps.get());
        }

        @Test
        @DisplayName("Should fail and close the handle when the bootstrap probe fails")
        void shouldFailWhenProbeFails() {
            backend.probeReturnCode = 2;

            InitException e = assertThrows(InitException.class, gateway::initialize);

            assertTrue(e.getMessage().contains("probe failed"), e.getMessage());
            assertEquals(1, backend.closes.get());
            assertFalse(gateway.isInitialized());
        }

        @Test
        @DisplayName("Should refuse to initialize after close")
        void shouldRefuseAfterClose() {
            gateway.close();

            assertThrows(InitException.class, gateway::initialize);
            assertEquals(0, backend.opens.get());
        }
    }

    @Nested
    @DisplayName("Task Dispatch")
    class TaskDispatchTests {

        @Test
        @DisplayName("Should refuse tasks before initialization")
        void shouldRefuseTasksBeforeInitialization() {
            assertThrows(BackendUnavailableException.class, () ->
                    gateway.runTask("dicom", List.of("--action", "categorize"),
                            Collections.emptyList(), Collections.emptyList()));
            assertThrows(BackendUnavailableException.class, () ->
                    gateway.readDicomTags(DicomFile.empty("a.dcm"), List.of("0020|0013")));
        }

        @Test
        @DisplayName("Should pass the task through and return its result")
        void shouldPassTaskThrough() throws Exception {
            backend.pipelineScript = (args, inputs) -> TaskResult.success(List.of(OutputData.text("{}")));
            gateway.initialize();

            TaskResult result = gateway.runTask("dicom", List.of("--action", "categorize"),
                    List.of(PipelineInput.binaryFile("0", new byte[]{1})), List.of(PipelineOutput.textStream()));

            assertEquals("{}", result.getOutput(0, InterfaceType.TEXT_STREAM).asText());
            ScriptedBackend.PipelineCall call = backend.taskCalls().get(0);
            assertEquals("dicom", call.pipeline);
            assertEquals(List.of("--action", "categorize"), call.args);
            assertEquals("0", call.inputs.get(0).getPath());
        }

        @Test
        @DisplayName("Should raise TaskExecutionException on a non-zero return code")
        void shouldRaiseOnFailedTask() throws Exception {
            backend.pipelineScript = (args, inputs) -> new TaskResult(1, "", "bad input", List.of());
            gateway.initialize();

            TaskExecutionException e = assertThrows(TaskExecutionException.class, () ->
                    gateway.runTask("dicom", List.of("--action", "x"), List.of(), List.of()));
            assertTrue(e.getMessage().contains("bad input"));
        }

        @Test
        @DisplayName("Should keep working after a failed task")
        void shouldKeepWorkingAfterFailedTask() throws Exception {
            gateway.initialize();
            backend.pipelineScript = (args, inputs) -> new TaskResult(1, "", "boom", List.of());
            assertThrows(TaskExecutionException.class, () ->
                    gateway.runTask("dicom", List.of("--action", "x"), List.of(), List.of()));

            backend.pipelineScript = (args, inputs) -> TaskResult.success(List.of());
            assertTrue(gateway.runTask("dicom", List.of("--action", "x"), List.of(), List.of()).isSuccess());
        }

        @Test
        @DisplayName("Should close the handle and refuse tasks after close")
        void shouldCloseHandle() throws Exception {
            gateway.initialize();
            gateway.close();

            assertEquals(1, backend.closes.get());
            assertThrows(BackendUnavailableException.class, () ->
                    gateway.runTask("dicom", List.of("--action", "x"), List.of(), List.of()));
        }
    }
}

/*
 * XNAT DICOM Series Organizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 */
package io.xnatworks.series.dicom;

import io.xnatworks.series.backend.BackendGateway;
import io.xnatworks.series.backend.ScriptedBackend;
import io.xnatworks.series.backend.TaskExecutionException;
import io.xnatworks.series.config.EngineConfig;
import io.xnatworks.series.model.DicomFile;
import org.junit.jupiter.api.*;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Instance Orderer Tests")
class InstanceOrdererTest {

    private ScriptedBackend backend;
    private BackendGateway gateway;

    @BeforeEach
    void setUp() {
        backend = new ScriptedBackend();
        gateway = new BackendGateway(backend, new EngineConfig());
    }

    @AfterEach
    void tearDown() {
        gateway.close();
    }

    private InstanceOrderer orderer(DuplicateInstancePolicy policy) {
        return new InstanceOrderer(new TagReader(gateway), policy);
    }

    private DicomFile file(String name, String instanceNumber) {
        if (instanceNumber != null) {
            backend.withInstanceNumber(name, instanceNumber);
        }
        return new DicomFile(name, new byte[]{1});
    }

    private static List<String> names(List<DicomFile> files) {
        List<String> names = new ArrayList<>();
        for (DicomFile f : files) {
            names.add(f.getName());
        }
        return names;
    }

    @Nested
    @DisplayName("Ordering")
    class OrderingTests {

        @Test
        @DisplayName("Should sort by instance number ascending")
        void shouldSortAscending() throws Exception {
            List<DicomFile> files = List.of(file("c", "3"), file("a", "1"), file("b", "2"));

            List<DicomFile> ordered = orderer(DuplicateInstancePolicy.LAST_WINS).orderByInstance(files);

            assertEquals(List.of("a", "b", "c"), names(ordered));
        }

        @Test
        @DisplayName("Should sort numerically, not lexically")
        void shouldSortNumerically() throws Exception {
            List<DicomFile> files = List.of(file("ten", "10"), file("nine", "9"), file("hundred", "100"));

            List<DicomFile> ordered = orderer(DuplicateInstancePolicy.LAST_WINS).orderByInstance(files);

            assertEquals(List.of("nine", "ten", "hundred"), names(ordered));
        }

        @Test
        @DisplayName("Should place negative numbers before zero")
        void shouldPlaceNegativesFirst() throws Exception {
            List<DicomFile> files = List.of(file("zero", "0"), file("neg", "-2"), file("pos", "1"));

            List<DicomFile> ordered = orderer(DuplicateInstancePolicy.LAST_WINS).orderByInstance(files);

            assertEquals(List.of("neg", "zero", "pos"), names(ordered));
        }

        @Test
        @DisplayName("Should look up instance numbers one file at a time in input order")
        void shouldLookUpInInputOrder() throws Exception {
            List<DicomFile> files = List.of(file("x/3.dcm", "3"), file("1.dcm", "1"), file("2.dcm", "2"));

            orderer(DuplicateInstancePolicy.LAST_WINS).orderByInstance(files);

            assertEquals(List.of("x_3.dcm", "1.dcm", "2.dcm"), backend.tagReads);
        }

        @Test
        @DisplayName("Should return the caller's file objects")
        void shouldReturnCallerFiles() throws Exception {
            DicomFile second = file("dir/2.dcm", "2");
            backend.withInstanceNumber("dir_2.dcm", "2");
            DicomFile first = file("1.dcm", "1");

            List<DicomFile> ordered = orderer(DuplicateInstancePolicy.LAST_WINS).orderByInstance(List.of(second, first));

            assertSame(first, ordered.get(0));
            assertSame(second, ordered.get(1));
            assertEquals("dir/2.dcm", ordered.get(1).getName());
        }
    }

    @Nested
    @DisplayName("Missing And Malformed Instance Numbers")
    class FallbackTests {

        @Test
        @DisplayName("Should sort a file without instance number as 0")
        void shouldTreatMissingAsZero() throws Exception {
            List<DicomFile> files = List.of(file("two", "2"), file("none", null), file("one", "1"));

            List<DicomFile> ordered = orderer(DuplicateInstancePolicy.LAST_WINS).orderByInstance(files);

            assertEquals(List.of("none", "one", "two"), names(ordered));
        }

        @Test
        @DisplayName("Should sort a non-numeric instance number as 0")
        void shouldTreatGarbageAsZero() throws Exception {
            List<DicomFile> files = List.of(file("two", "2"), file("bad", "abc"), file("decimal", "1.5"));

            List<DicomFile> ordered = orderer(DuplicateInstancePolicy.KEEP_ALL).orderByInstance(files);

            assertEquals(List.of("bad", "decimal", "two"), names(ordered));
        }

        @Test
        @DisplayName("Should order by the leading integer of a value")
        void shouldUseLeadingInteger() throws Exception {
            List<DicomFile> files = List.of(file("twelve", "12abc"), file("multi", "3\\4"), file("decimal", "7.9"));

            List<DicomFile> ordered = orderer(DuplicateInstancePolicy.KEEP_ALL).orderByInstance(files);

            assertEquals(List.of("multi", "decimal", "twelve"), names(ordered));
        }

        @Test
        @DisplayName("Should read signs and reject values without leading digits")
        void shouldParseLeadingIntegerEdges() {
            assertEquals(3, InstanceOrderer.parseInstanceNumber("3\\4"));
            assertEquals(12, InstanceOrderer.parseInstanceNumber("12abc"));
            assertEquals(1, InstanceOrderer.parseInstanceNumber("1.5"));
            assertEquals(7, InstanceOrderer.parseInstanceNumber("+7"));
            assertEquals(-4, InstanceOrderer.parseInstanceNumber(" -4x"));
            assertEquals(0, InstanceOrderer.parseInstanceNumber("-"));
            assertEquals(0, InstanceOrderer.parseInstanceNumber("x12"));
            assertEquals(0, InstanceOrderer.parseInstanceNumber("99999999999"));
        }

        @Test
        @DisplayName("Should accept padded instance numbers")
        void shouldTrimPadding() {
            assertEquals(12, InstanceOrderer.parseInstanceNumber(" 12 "));
            assertEquals(0, InstanceOrderer.parseInstanceNumber(""));
            assertEquals(0, InstanceOrderer.parseInstanceNumber(null));
        }
    }

    @Nested
    @DisplayName("Repeated Instance Numbers")
    class DuplicateTests {

        @Test
        @DisplayName("LAST_WINS keeps only the later of two files with the same number")
        void lastWinsKeepsLaterFile() throws Exception {
            DicomFile earlier = file("earlier", "5");
            DicomFile later = file("later", "5");

            List<DicomFile> ordered = orderer(DuplicateInstancePolicy.LAST_WINS).orderByInstance(List.of(earlier, later));

            assertEquals(1, ordered.size(), "Repeated numbers collapse to one file");
            assertSame(later, ordered.get(0));
        }

        @Test
        @DisplayName("LAST_WINS drops files that a missing number collides with")
        void lastWinsCollapsesMissingNumbers() throws Exception {
            List<DicomFile> files = List.of(file("none1", null), file("one", "1"), file("none2", "junk"));

            List<DicomFile> ordered = orderer(DuplicateInstancePolicy.LAST_WINS).orderByInstance(files);

            assertEquals(List.of("none2", "one"), names(ordered));
        }

        @Test
        @DisplayName("KEEP_ALL keeps every file, repeated numbers in input order")
        void keepAllKeepsEveryFile() throws Exception {
            List<DicomFile> files = List.of(file("b", "5"), file("first", "1"), file("a", "5"));

            List<DicomFile> ordered = orderer(DuplicateInstancePolicy.KEEP_ALL).orderByInstance(files);

            assertEquals(List.of("first", "b", "a"), names(ordered));
        }
    }

    @Test
    @DisplayName("Should fail the volume when the backend cannot be reached")
    void shouldFailWhenBackendFails() {
        backend.tagFailure = new TaskExecutionException("worker gone");
        List<DicomFile> files = List.of(file("a", "1"), file("b", "2"));

        OrderException e = assertThrows(OrderException.class,
                () -> orderer(DuplicateInstancePolicy.LAST_WINS).orderByInstance(files));
        assertInstanceOf(TagReadException.class, e.getCause());
    }

    @Test
    @DisplayName("Should return an empty list for an empty volume")
    void shouldHandleEmptyVolume() throws Exception {
        assertTrue(orderer(DuplicateInstancePolicy.LAST_WINS).orderByInstance(List.of()).isEmpty());
    }
}

/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.errsim.demo;

import dev.mars.errsim.Errsim;
import dev.mars.errsim.ErrsimGuard;
import dev.mars.errsim.demo.FileOffloader.OffloadResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link FileOffloader}, with and without injected faults.
 */
class FileOffloaderTest {

    @TempDir
    Path tempDir;

    private FileOffloader offloader;
    private Map<String, byte[]> batch;

    @BeforeEach
    void setUp() {
        offloader = new FileOffloader(tempDir);
        batch = new LinkedHashMap<>();
        for (int i = 1; i <= 3; i++) {
            batch.put("key" + i, ("value" + i).getBytes(StandardCharsets.UTF_8));
        }
    }

    @AfterEach
    void tearDown() {
        Errsim.resetAll();
        offloader.close();
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private OffloadResult offload() throws Exception {
        return offloader.offload(batch).get(5, TimeUnit.SECONDS);
    }

    private OffloadException failure(ExecutionException e) {
        assertInstanceOf(OffloadException.class, e.getCause());
        return (OffloadException) e.getCause();
    }

    // ========================================================================
    // Without faults
    // ========================================================================

    @Nested
    @DisplayName("Without faults")
    class WithoutFaults {

        @Test
        @DisplayName("All entries are written and can be loaded")
        void writesAndLoads() throws Exception {
            OffloadResult result = offload();

            assertEquals(List.of("key1", "key2", "key3"), result.written());
            assertTrue(result.skipped().isEmpty());
            for (int i = 1; i <= 3; i++) {
                Optional<byte[]> value = offloader.load("key" + i).get(5, TimeUnit.SECONDS);
                assertTrue(value.isPresent());
                assertArrayEquals(bytes("value" + i), value.get());
            }
        }

        @Test
        @DisplayName("Loading a missing key returns empty")
        void missingKey() throws Exception {
            assertTrue(offloader.load("nope").get(5, TimeUnit.SECONDS).isEmpty());
        }

        @Test
        @DisplayName("Invalid keys are rejected before any write")
        void invalidKey() {
            batch.put("../escape", bytes("x"));

            ExecutionException e = assertThrows(ExecutionException.class, this::offloadBatch);
            assertEquals(ErrorCode.INVALID_KEY, failure(e).errorCode());
            assertFalse(Files.exists(tempDir.resolve("key1.kv")));
        }

        private void offloadBatch() throws Exception {
            offload();
        }

        @Test
        @DisplayName("Corrupted files fail the CRC check")
        void corruptedFile() throws Exception {
            offload();
            Path file = tempDir.resolve("key1.kv");
            byte[] raw = Files.readAllBytes(file);
            raw[0] ^= 0x7F;
            Files.write(file, raw);

            ExecutionException e = assertThrows(ExecutionException.class,
                    () -> offloader.load("key1").get(5, TimeUnit.SECONDS));
            assertEquals(ErrorCode.CORRUPT_DATA, failure(e).errorCode());
        }

        @Test
        @DisplayName("Offload after close fails")
        void offloadAfterClose() {
            offloader.close();

            ExecutionException e = assertThrows(ExecutionException.class, this::offloadBatch);
            assertEquals(ErrorCode.INTERNAL_ERROR, failure(e).errorCode());
        }
    }

    // ========================================================================
    // Injected write faults
    // ========================================================================

    @Nested
    @DisplayName("Injected write faults")
    class WriteFaults {

        @Test
        @DisplayName("Keyed fault skips only the matching entry")
        void keyedFaultSkipsEntry() throws Exception {
            try (ErrsimGuard g = new ErrsimGuard(FileOffloader.EP_OFFLOAD_WRITE,
                    ErrorCode.FILE_WRITE_FAIL.toInt(), "key2")) {
                OffloadResult result = offload();

                assertEquals(List.of("key1", "key3"), result.written());
                assertEquals(List.of("key2"), result.skipped());
            }
            assertFalse(Files.exists(tempDir.resolve("key2.kv")));
            assertTrue(Files.exists(tempDir.resolve("key1.kv")));
        }

        @Test
        @DisplayName("Unkeyed fault with a budget skips the first entries only")
        void budgetedFault() throws Exception {
            Errsim.activate("EP_OFFLOAD_WRITE", ErrorCode.FILE_WRITE_FAIL.toInt(), "", 2);

            OffloadResult result = offload();

            assertEquals(List.of("key3"), result.written());
            assertEquals(List.of("key1", "key2"), result.skipped());

            result = offload();
            assertEquals(List.of("key1", "key2", "key3"), result.written());
        }

        @Test
        @DisplayName("After the guard closes the next batch is written in full")
        void guardScope() throws Exception {
            try (ErrsimGuard g = new ErrsimGuard(FileOffloader.EP_OFFLOAD_WRITE, ErrorCode.FILE_WRITE_FAIL.toInt())) {
                assertEquals(3, offload().skipped().size());
            }
            assertEquals(3, offload().written().size());
        }
    }

    // ========================================================================
    // Injected sync and load faults
    // ========================================================================

    @Nested
    @DisplayName("Injected sync and load faults")
    class SyncAndLoadFaults {

        @Test
        @DisplayName("Sync fault surfaces the injected code")
        void syncFault() {
            try (ErrsimGuard g = new ErrsimGuard(FileOffloader.EP_OFFLOAD_SYNC, ErrorCode.SYNC_FAIL.toInt())) {
                ExecutionException e = assertThrows(ExecutionException.class,
                        () -> offloader.offload(batch).get(5, TimeUnit.SECONDS));
                OffloadException failure = failure(e);
                assertEquals(ErrorCode.SYNC_FAIL, failure.errorCode());
                assertEquals(-7, failure.code());
            }
        }

        @Test
        @DisplayName("Codes outside ErrorCode reach the caller unchanged")
        void unknownCodeIsKept() {
            try (ErrsimGuard g = new ErrsimGuard(FileOffloader.EP_OFFLOAD_SYNC, 42)) {
                ExecutionException e = assertThrows(ExecutionException.class,
                        () -> offloader.offload(batch).get(5, TimeUnit.SECONDS));
                OffloadException failure = failure(e);
                assertEquals(42, failure.code());
                assertEquals(ErrorCode.INTERNAL_ERROR, failure.errorCode());
            }
        }

        @Test
        @DisplayName("Keyed load fault keeps its raw code")
        void loadFaultKeepsRawCode() throws Exception {
            offload();
            try (ErrsimGuard g = new ErrsimGuard(FileOffloader.EP_OFFLOAD_LOAD, 9, "key3")) {
                ExecutionException e = assertThrows(ExecutionException.class,
                        () -> offloader.load("key3").get(5, TimeUnit.SECONDS));
                assertEquals(9, failure(e).code());
            }
        }

        @Test
        @DisplayName("Load fault hits only the matching key, once")
        void loadFault() throws Exception {
            offload();
            Errsim.activate("EP_OFFLOAD_LOAD", ErrorCode.FILE_READ_FAIL.toInt(), "key1", 1);

            assertTrue(offloader.load("key2").get(5, TimeUnit.SECONDS).isPresent());
            ExecutionException e = assertThrows(ExecutionException.class,
                    () -> offloader.load("key1").get(5, TimeUnit.SECONDS));
            assertEquals(ErrorCode.FILE_READ_FAIL, failure(e).errorCode());
            assertTrue(offloader.load("key1").get(5, TimeUnit.SECONDS).isPresent());
        }
    }

    @Test
    @DisplayName("Offloader points are registered")
    void pointsRegistered() {
        assertTrue(Errsim.registeredNames().containsAll(
                List.of("EP_OFFLOAD_WRITE", "EP_OFFLOAD_SYNC", "EP_OFFLOAD_LOAD")));
    }

    @Test
    @DisplayName("Error codes round-trip through their integer form")
    void errorCodes() {
        for (ErrorCode code : ErrorCode.values()) {
            assertEquals(code, ErrorCode.fromInt(code.toInt()));
        }
        assertEquals(ErrorCode.INTERNAL_ERROR, ErrorCode.fromInt(999));
    }
}

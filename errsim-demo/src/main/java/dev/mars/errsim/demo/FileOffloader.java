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

import dev.mars.errsim.ErrsimPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.regex.Pattern;
import java.util.zip.CRC32C;

/**
 * Offloads key/value batches to a directory, one file per key.
 * <p>
 * <b>File format:</b>
 * <pre>
 * &lt;dir&gt;/&lt;key&gt;.kv   // PAYLOAD(var) + CRC32C(4)
 * </pre>
 * <p>
 * <b>Thread Safety:</b>
 * All file operations are serialized through a single-threaded executor.
 * <p>
 * <b>Injection points:</b>
 * <ul>
 *   <li>{@code EP_OFFLOAD_WRITE} (keyed): the entry is skipped and reported in
 *       {@link OffloadResult#skipped()}</li>
 *   <li>{@code EP_OFFLOAD_SYNC}: the batch fails with an {@link OffloadException}
 *       carrying the injected code</li>
 *   <li>{@code EP_OFFLOAD_LOAD} (keyed): the read fails with an {@link OffloadException}</li>
 * </ul>
 */
public final class FileOffloader implements Closeable {

    // ========================================================================
    // Logger
    // ========================================================================

    private static final Logger LOG = LoggerFactory.getLogger(FileOffloader.class);

    // ========================================================================
    // Injection points
    // ========================================================================

    static final ErrsimPoint EP_OFFLOAD_WRITE = ErrsimPoint.define("EP_OFFLOAD_WRITE");
    static final ErrsimPoint EP_OFFLOAD_SYNC = ErrsimPoint.define("EP_OFFLOAD_SYNC");
    static final ErrsimPoint EP_OFFLOAD_LOAD = ErrsimPoint.define("EP_OFFLOAD_LOAD");

    // ========================================================================
    // Constants
    // ========================================================================

    private static final String FILE_SUFFIX = ".kv";

    private static final int CRC_SIZE = 4;

    private static final Pattern VALID_KEY = Pattern.compile("[A-Za-z0-9._-]{1,200}");

    // ========================================================================
    // State
    // ========================================================================

    private final ExecutorService ioExecutor;
    private final Path dir;
    private volatile boolean closed = false;

    /**
     * Creates an offloader writing into {@code dir}, creating it if needed.
     *
     * @throws OffloadException if the directory cannot be created
     */
    public FileOffloader(Path dir) {
        this.dir = dir;
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new OffloadException(ErrorCode.FILE_WRITE_FAIL, "Cannot create offload directory " + dir, e);
        }
        this.ioExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "offload-io");
            t.setDaemon(true);
            return t;
        });
        LOG.info("FileOffloader initialized at {}", dir);
    }

    /** Directory the offloader writes into. */
    public Path dir() {
        return dir;
    }

    // ========================================================================
    // Operations
    // ========================================================================

    /**
     * Writes every entry of {@code batch}, in iteration order, then syncs the directory.
     * <p>
     * Entries rejected by {@code EP_OFFLOAD_WRITE} are skipped; the rest are still written.
     *
     * @return a future with the keys written and skipped; fails with
     *         {@link OffloadException} on invalid keys, I/O errors or an injected sync fault
     */
    public CompletableFuture<OffloadResult> offload(Map<String, byte[]> batch) {
        if (closed) {
            return CompletableFuture.failedFuture(
                    new OffloadException(ErrorCode.INTERNAL_ERROR, "Offloader is closed"));
        }
        for (String key : batch.keySet()) {
            if (!isValidKey(key)) {
                return CompletableFuture.failedFuture(
                        new OffloadException(ErrorCode.INVALID_KEY, "Invalid key '" + key + "'"));
            }
        }

        return CompletableFuture.supplyAsync(() -> {
            List<String> written = new ArrayList<>();
            List<String> skipped = new ArrayList<>();
            for (Map.Entry<String, byte[]> entry : batch.entrySet()) {
                String key = entry.getKey();
                if (EP_OFFLOAD_WRITE.fires(key)) {
                    LOG.warn("Skipping offload of key {}", key);
                    skipped.add(key);
                    continue;
                }
                writeEntry(key, entry.getValue() != null ? entry.getValue() : new byte[0]);
                written.add(key);
            }

            EP_OFFLOAD_SYNC.throwIfFired("", code ->
                    OffloadException.ofCode(code, "Failed to sync offload directory " + dir));
            syncDirectory();

            LOG.info("Offloaded {} entries ({} skipped) to {}", written.size(), skipped.size(), dir);
            return new OffloadResult(List.copyOf(written), List.copyOf(skipped));
        }, ioExecutor);
    }

    /**
     * Reads back the value stored for {@code key}.
     *
     * @return a future with the value, or empty if the key was never offloaded;
     *         fails with {@link OffloadException} on CRC mismatch, I/O errors or an injected fault
     */
    public CompletableFuture<Optional<byte[]>> load(String key) {
        if (!isValidKey(key)) {
            return CompletableFuture.failedFuture(
                    new OffloadException(ErrorCode.INVALID_KEY, "Invalid key '" + key + "'"));
        }
        return CompletableFuture.supplyAsync(() -> {
            Optional<OffloadException> injected = EP_OFFLOAD_LOAD.failWith(key, code ->
                    OffloadException.ofCode(code, "Failed to load key " + key));
            if (injected.isPresent()) {
                throw injected.get();
            }

            Path file = dir.resolve(key + FILE_SUFFIX);
            if (!Files.exists(file)) {
                LOG.debug("No offloaded value for key {}", key);
                return Optional.<byte[]>empty();
            }
            try {
                byte[] all = Files.readAllBytes(file);
                if (all.length < CRC_SIZE) {
                    throw new OffloadException(ErrorCode.CORRUPT_DATA, "Truncated file for key " + key);
                }
                int payloadLen = all.length - CRC_SIZE;
                int storedCrc = ByteBuffer.wrap(all, payloadLen, CRC_SIZE).getInt();
                CRC32C crc = new CRC32C();
                crc.update(all, 0, payloadLen);
                if ((int) crc.getValue() != storedCrc) {
                    LOG.error("CRC mismatch for key {}: stored={}, computed={}", key, storedCrc, (int) crc.getValue());
                    throw new OffloadException(ErrorCode.CORRUPT_DATA, "CRC mismatch for key " + key);
                }
                byte[] payload = new byte[payloadLen];
                System.arraycopy(all, 0, payload, 0, payloadLen);
                return Optional.of(payload);
            } catch (IOException e) {
                LOG.error("Failed to load key {}: {}", key, e.getMessage(), e);
                throw new OffloadException(ErrorCode.FILE_READ_FAIL, "Failed to load key " + key, e);
            }
        }, ioExecutor);
    }

    @Override
    public void close() {
        if (closed) {
            LOG.debug("Offloader already closed, ignoring duplicate close()");
            return;
        }
        closed = true;
        ioExecutor.shutdown();
        LOG.info("FileOffloader at {} closed", dir);
    }

    // ========================================================================
    // Internal Helpers
    // ========================================================================

    static boolean isValidKey(String key) {
        return key != null && VALID_KEY.matcher(key).matches();
    }

    /**
     * Writes one value with its CRC trailer. Must be called from the ioExecutor thread.
     */
    private void writeEntry(String key, byte[] payload) {
        ByteBuffer buf = ByteBuffer.allocate(payload.length + CRC_SIZE);
        buf.put(payload);
        CRC32C crc = new CRC32C();
        crc.update(payload, 0, payload.length);
        buf.putInt((int) crc.getValue());
        buf.flip();

        Path file = dir.resolve(key + FILE_SUFFIX);
        try (FileChannel ch = FileChannel.open(file,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.WRITE)) {
            while (buf.hasRemaining()) {
                ch.write(buf);
            }
            ch.force(true);
            LOG.trace("Wrote {} bytes for key {}", payload.length, key);
        } catch (IOException e) {
            LOG.error("Failed to write key {}: {}", key, e.getMessage(), e);
            throw new OffloadException(ErrorCode.FILE_WRITE_FAIL, "Failed to write key " + key, e);
        }
    }

    /**
     * Fsyncs the directory so new files survive a crash. Skipped on Windows.
     */
    private void syncDirectory() {
        if (System.getProperty("os.name").toLowerCase().contains("win")) {
            LOG.trace("Skipping directory sync on Windows");
            return;
        }
        try (FileChannel fc = FileChannel.open(dir, StandardOpenOption.READ)) {
            fc.force(true);
        } catch (IOException e) {
            LOG.warn("Could not fsync directory {}: {}", dir, e.getMessage());
        }
    }

    /**
     * Outcome of one {@link #offload(Map)} call.
     *
     * @param written keys written and synced, in batch order
     * @param skipped keys left out by an injected write fault, in batch order
     */
    public record OffloadResult(List<String> written, List<String> skipped) {
    }
}

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

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.stream.Stream;

/**
 * Walks through the injection scenarios against a {@link FileOffloader}.
 * <p>
 * Injection is off by default outside of {@code -ea} runs, so this demo turns it
 * on unless {@code errsim.enabled} is set explicitly.
 *
 * <h2>Usage</h2>
 * <pre>
 * # Build the demo JAR
 * mvn package -pl errsim-demo -am
 *
 * # Run (injection on)
 * java -cp "errsim-demo/target/*:..." dev.mars.errsim.demo.ErrsimDemo
 *
 * # Run with injection compiled down to no-ops
 * java -Derrsim.enabled=false -cp ... dev.mars.errsim.demo.ErrsimDemo
 * </pre>
 */
public class ErrsimDemo {

    public static void main(String[] args) throws Exception {
        if (System.getProperty("errsim.enabled") == null) {
            System.setProperty("errsim.enabled", "true");
        }

        System.out.println("+---------------------------------------+");
        System.out.println("|        Error Injection Demo           |");
        System.out.println("+---------------------------------------+");
        System.out.println();

        Path dir = Files.createTempDirectory("errsim-demo-");
        Map<String, byte[]> batch = new LinkedHashMap<>();
        for (int i = 1; i <= 3; i++) {
            batch.put("key" + i, ("value" + i).getBytes(StandardCharsets.UTF_8));
        }

        try (FileOffloader offloader = new FileOffloader(dir)) {
            System.out.println("Injection enabled: " + Errsim.isEnabled());
            System.out.println("Registered points: " + Errsim.registeredNames());
            System.out.println();

            OffloadResult result = offloader.offload(batch).join();
            System.out.println("[OK] No faults:             written=" + result.written() + ", skipped=" + result.skipped());

            try (ErrsimGuard g = new ErrsimGuard(FileOffloader.EP_OFFLOAD_WRITE,
                    ErrorCode.FILE_WRITE_FAIL.toInt(), "key2")) {
                result = offloader.offload(batch).join();
                System.out.println("[OK] Write fault on key2:   written=" + result.written() + ", skipped=" + result.skipped());
            }

            Errsim.activate("EP_OFFLOAD_WRITE", ErrorCode.FILE_WRITE_FAIL.toInt(), "", 2);
            result = offloader.offload(batch).join();
            System.out.println("[OK] Two write faults:      written=" + result.written() + ", skipped=" + result.skipped());
            Errsim.reset("EP_OFFLOAD_WRITE");

            try (ErrsimGuard g = new ErrsimGuard(FileOffloader.EP_OFFLOAD_SYNC, ErrorCode.SYNC_FAIL.toInt())) {
                offloader.offload(batch).join();
                System.out.println("[??] Sync fault did not fire");
            } catch (CompletionException e) {
                System.out.println("[OK] Sync fault:            " + e.getCause().getMessage());
            }

            Errsim.activate("EP_NO_SUCH_POINT", ErrorCode.INTERNAL_ERROR.toInt());
            System.out.println("[OK] Unknown point ignored: present=" + Errsim.get("EP_NO_SUCH_POINT").isPresent());

            System.out.println("[OK] Fire counts:           write=" + FileOffloader.EP_OFFLOAD_WRITE.fireCount()
                    + ", sync=" + FileOffloader.EP_OFFLOAD_SYNC.fireCount());
        } finally {
            deleteRecursively(dir);
        }

        System.out.println();
        System.out.println("+---------------------------------------+");
        System.out.println("|  Error injection demo complete!       |");
        System.out.println("+---------------------------------------+");
    }

    private static void deleteRecursively(Path dir) throws IOException {
        try (Stream<Path> paths = Files.walk(dir)) {
            for (Path p : (Iterable<Path>) paths.sorted(Comparator.reverseOrder())::iterator) {
                Files.deleteIfExists(p);
            }
        }
    }
}

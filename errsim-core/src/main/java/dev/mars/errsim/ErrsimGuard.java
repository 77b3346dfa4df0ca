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
package dev.mars.errsim;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Activates an injection point for the lifetime of a try-with-resources block.
 * <pre>
 * try (ErrsimGuard g = new ErrsimGuard(EP_OFFLOAD_WRITE, FILE_WRITE_FAIL, "key2")) {
 *     offloader.offload(batch);
 * }
 * // point is inactive again here, however the block was left
 * </pre>
 * {@link #close()} resets the point exactly once; further calls do nothing.
 * The guard captures the point's name and acts through the registry, so a
 * guard on a point that was re-registered under the same name resets the
 * current registration.
 */
public final class ErrsimGuard implements AutoCloseable {

    private final ErrsimRegistry registry;
    private final String pointName;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /** Fails every call to {@code point} until closed. */
    public ErrsimGuard(ErrsimPoint point, int faultCode) {
        this(point, faultCode, "", Errsim.UNLIMITED);
    }

    /** Fails calls to {@code point} whose key equals {@code matchKey} (empty for all) until closed. */
    public ErrsimGuard(ErrsimPoint point, int faultCode, String matchKey) {
        this(point, faultCode, matchKey, Errsim.UNLIMITED);
    }

    /** Fails at most {@code times} matching calls (-1 for unbounded) until closed. */
    public ErrsimGuard(ErrsimPoint point, int faultCode, String matchKey, int times) {
        this(Errsim.registry(), point, faultCode, matchKey, times);
    }

    ErrsimGuard(ErrsimRegistry registry, ErrsimPoint point, int faultCode, String matchKey, int times) {
        this.registry = registry;
        this.pointName = point.name();
        registry.activate(pointName, faultCode, matchKey, times);
    }

    /** Name of the guarded point. */
    public String pointName() {
        return pointName;
    }

    /** Whether the guard has already deactivated its point. */
    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            registry.reset(pointName);
        }
    }
}

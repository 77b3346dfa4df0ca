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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.SortedSet;

/**
 * Process-wide entry point for error injection.
 * <p>
 * The registry behind these methods is created on first use from
 * {@link ErrsimConfig#load()} and lives until the JVM exits. Whether it is the
 * live or the no-op implementation is decided at that moment and never changes.
 *
 * <h2>Usage in tests</h2>
 * <pre>
 * // Fail every call to the point
 * Errsim.activate("EP_OFFLOAD_SYNC", ErrorCode.INTERNAL_ERROR.toInt());
 *
 * // Fail only for key "key2", twice
 * Errsim.activate("EP_OFFLOAD_WRITE", ErrorCode.FILE_WRITE_FAIL.toInt(), "key2", 2);
 *
 * Errsim.reset("EP_OFFLOAD_WRITE");
 * </pre>
 * Points are registered when the class declaring them is initialised. A test
 * that activates by name before that class has been touched should call
 * {@link #load(Class[])} first, or use an {@link ErrsimGuard} on the point itself.
 */
public final class Errsim {

    private static final Logger LOG = LoggerFactory.getLogger(Errsim.class);

    /** Fault code meaning "no fault". */
    public static final int NO_FAULT = 0;

    /** {@code times} value for an unbounded activation. */
    public static final int UNLIMITED = -1;

    private Errsim() {
    }

    private static final class Holder {
        static final ErrsimRegistry REGISTRY = create(ErrsimConfig.load());

        private static ErrsimRegistry create(ErrsimConfig config) {
            if (config.enabled()) {
                LOG.info("[ERRSIM] Error injection enabled: {}", config);
                return new LiveRegistry(config);
            }
            LOG.debug("[ERRSIM] Error injection disabled, points are no-ops");
            return DisabledRegistry.INSTANCE;
        }
    }

    /** The process-wide registry. */
    public static ErrsimRegistry registry() {
        return Holder.REGISTRY;
    }

    /** Whether points in this process are live. */
    public static boolean isEnabled() {
        return registry().isEnabled();
    }

    /** Activates {@code name} for every key, without limit. */
    public static void activate(String name, int faultCode) {
        registry().activate(name, faultCode, "", UNLIMITED);
    }

    /** Activates {@code name} for {@code matchKey} only (empty for every key), without limit. */
    public static void activate(String name, int faultCode, String matchKey) {
        registry().activate(name, faultCode, matchKey, UNLIMITED);
    }

    /**
     * Activates {@code name}.
     *
     * @see ErrsimRegistry#activate(String, int, String, int)
     */
    public static void activate(String name, int faultCode, String matchKey, int times) {
        registry().activate(name, faultCode, matchKey, times);
    }

    /** Deactivates {@code name}; a no-op for unknown names. */
    public static void reset(String name) {
        registry().reset(name);
    }

    /** Deactivates every registered point. Intended for test teardown. */
    public static void resetAll() {
        registry().resetAll();
    }

    /** Looks up a registered point. */
    public static Optional<ErrsimPoint> get(String name) {
        return registry().get(name);
    }

    /** Sorted snapshot of the registered point names. */
    public static SortedSet<String> registeredNames() {
        return registry().names();
    }

    /**
     * Initialises the given classes so the points they declare are registered,
     * in the order given.
     *
     * @throws IllegalStateException if a class cannot be initialised
     */
    public static void load(Class<?>... holders) {
        for (Class<?> holder : holders) {
            try {
                Class.forName(holder.getName(), true, holder.getClassLoader());
                LOG.debug("[ERRSIM] Loaded points from {}", holder.getName());
            } catch (ClassNotFoundException | ExceptionInInitializerError | NoClassDefFoundError e) {
                throw new IllegalStateException("Cannot initialise " + holder.getName(), e);
            }
        }
    }
}

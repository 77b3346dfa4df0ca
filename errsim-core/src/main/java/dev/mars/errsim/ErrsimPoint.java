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

import java.util.Optional;
import java.util.function.IntFunction;

/**
 * A named location in production code where a test can force a fault.
 * <p>
 * Declare one point per site, as a static field, and consult it where the
 * failure should be simulated:
 * <pre>
 * private static final ErrsimPoint EP_OFFLOAD_WRITE = ErrsimPoint.define("EP_OFFLOAD_WRITE");
 *
 * for (Entry e : batch) {
 *     if (EP_OFFLOAD_WRITE.fires(e.key())) {
 *         continue;
 *     }
 *     write(e);
 * }
 * </pre>
 * Tests activate the point by name through {@link Errsim} or with an
 * {@link ErrsimGuard}. Production code never looks points up by name; it holds
 * the reference returned by {@link #define(String)}.
 * <p>
 * <b>Thread Safety:</b> {@link #check(String)} may be called from any number of
 * threads while a test thread activates or resets the point.
 */
public interface ErrsimPoint {

    /** Activation state as observed by {@link #state()}. */
    enum State {
        INACTIVE,
        ACTIVE_INFINITE,
        ACTIVE_FINITE
    }

    /**
     * Creates the point named {@code name} and registers it with the
     * process-wide registry. A later definition under the same name replaces
     * this one in the registry.
     *
     * @param name process-unique name, conventionally {@code EP_UPPER_CASE}
     * @return the point; a no-op point when injection is disabled
     * @throws IllegalArgumentException if the name is null or blank
     */
    static ErrsimPoint define(String name) {
        return Errsim.registry().define(name);
    }

    /** The name this point is registered under. */
    String name();

    /**
     * Returns the active fault code if this call should fail, 0 otherwise.
     * <p>
     * A call fires when the point is active, its match key is empty or equal
     * to {@code key}, and its budget is not exhausted. Non-matching calls never
     * consume budget. Never throws.
     *
     * @param key discriminator for this call (e.g. a storage key); null is the empty key
     * @return the fault code, or 0 for no fault
     */
    int check(String key);

    /** Unkeyed {@link #check(String)}. */
    default int check() {
        return check("");
    }

    /** Current activation state. */
    State state();

    /** Remaining firings: -1 for unbounded, 0 when inactive. */
    int remaining();

    /** Number of times this point has fired since it was defined. */
    long fireCount();

    /**
     * Whether this call fires. Use for actions like skipping the current iteration.
     */
    default boolean fires(String key) {
        return check(key) != 0;
    }

    /**
     * Throws the exception built by {@code onFault} when this call fires.
     *
     * @param key     discriminator for this call
     * @param onFault maps the fault code to the caller's own exception type
     * @throws X when the point fires
     */
    default <X extends Exception> void throwIfFired(String key, IntFunction<X> onFault) throws X {
        int code = check(key);
        if (code != 0) {
            throw onFault.apply(code);
        }
    }

    /**
     * Maps a firing into the caller's result representation.
     *
     * @return the mapped failure when the point fires, empty otherwise
     */
    default <T> Optional<T> failWith(String key, IntFunction<T> onFault) {
        int code = check(key);
        return code != 0 ? Optional.of(onFault.apply(code)) : Optional.empty();
    }
}

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
import java.util.SortedSet;

/**
 * Name-indexed directory of injection points and the test-side operations on them.
 * <p>
 * Two implementations exist with identical shapes: {@link LiveRegistry} when
 * injection is enabled and {@link DisabledRegistry} when it is not. The
 * process-wide instance is obtained through {@link Errsim}.
 *
 * @see Errsim
 */
public interface ErrsimRegistry {

    /**
     * Creates a point and registers it under its name, replacing any earlier
     * point with the same name.
     *
     * @throws IllegalArgumentException if the name is null or blank, or breaks
     *         the naming convention while strict names are configured
     */
    ErrsimPoint define(String name);

    /**
     * Activates the named point. An unknown name is logged and ignored.
     *
     * @param name      registered point name
     * @param faultCode code returned by firing checks; 0 leaves the point inactive
     * @param matchKey  empty or null fires for every key, otherwise only for this key
     * @param times     -1 (or any negative) for unbounded, otherwise the number of firings
     */
    void activate(String name, int faultCode, String matchKey, int times);

    /** Deactivates the named point. Unknown names are ignored. */
    void reset(String name);

    /** Deactivates every registered point. */
    void resetAll();

    /** Looks up a point by name. */
    Optional<ErrsimPoint> get(String name);

    /** Sorted snapshot of the registered names. */
    SortedSet<String> names();

    /** Whether this registry hands out live points. */
    boolean isEnabled();
}

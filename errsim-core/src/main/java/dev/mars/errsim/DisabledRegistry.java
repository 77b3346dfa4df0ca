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

import java.util.Collections;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Registry used when error injection is disabled. Keeps no state: points are
 * not recorded, activation does nothing and lookups find nothing.
 */
final class DisabledRegistry implements ErrsimRegistry {

    static final DisabledRegistry INSTANCE = new DisabledRegistry();

    private static final SortedSet<String> NO_NAMES = Collections.unmodifiableSortedSet(new TreeSet<>());

    private DisabledRegistry() {
    }

    @Override
    public ErrsimPoint define(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Injection point name must not be blank");
        }
        return new DisabledPoint(name);
    }

    @Override
    public void activate(String name, int faultCode, String matchKey, int times) {
    }

    @Override
    public void reset(String name) {
    }

    @Override
    public void resetAll() {
    }

    @Override
    public Optional<ErrsimPoint> get(String name) {
        return Optional.empty();
    }

    @Override
    public SortedSet<String> names() {
        return NO_NAMES;
    }

    @Override
    public boolean isEnabled() {
        return false;
    }
}

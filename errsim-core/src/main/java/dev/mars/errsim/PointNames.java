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

import java.util.regex.Pattern;

/**
 * Validation of injection point names.
 */
final class PointNames {

    private static final Logger LOG = LoggerFactory.getLogger(PointNames.class);

    /** Uppercase identifier prefixed with {@code EP_}. */
    static final Pattern CONVENTION = Pattern.compile("EP_[A-Z0-9_]+");

    private PointNames() {
    }

    /**
     * Returns {@code name} if it can be registered.
     *
     * @param strict reject names that break the convention instead of logging them
     * @throws IllegalArgumentException for null or blank names, or unconventional ones when strict
     */
    static String validate(String name, boolean strict) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Injection point name must not be blank");
        }
        if (!CONVENTION.matcher(name).matches()) {
            if (strict) {
                throw new IllegalArgumentException(
                        "Injection point name '" + name + "' does not match " + CONVENTION.pattern());
            }
            LOG.warn("[ERRSIM] Point name '{}' does not follow the {} convention", name, CONVENTION.pattern());
        }
        return name;
    }
}

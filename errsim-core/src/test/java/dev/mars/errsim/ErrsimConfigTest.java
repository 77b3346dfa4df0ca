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

import org.junit.jupiter.api.*;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link ErrsimConfig} resolution.
 */
class ErrsimConfigTest {

    @AfterEach
    void clearSystemProperties() {
        System.clearProperty("errsim.enabled");
        System.clearProperty("errsim.logFires");
        System.clearProperty("errsim.strictNames");
    }

    // ========================================================================
    // Defaults
    // ========================================================================

    @Nested
    @DisplayName("Default Values")
    class DefaultTests {

        @Test
        @DisplayName("enabled follows the JVM assertion status")
        void enabledFollowsAssertions() {
            ErrsimConfig config = ErrsimConfig.load();
            assertEquals(ErrsimConfig.assertionsEnabled(), config.enabled());
        }

        @Test
        @DisplayName("Tests run with assertions, so injection defaults to on")
        void assertionsOnUnderTest() {
            assertTrue(ErrsimConfig.assertionsEnabled());
        }

        @Test
        @DisplayName("logFires defaults to true, strictNames to false")
        void diagnosticsDefaults() {
            ErrsimConfig config = ErrsimConfig.load();
            assertTrue(config.logFires());
            assertFalse(config.strictNames());
        }
    }

    // ========================================================================
    // System properties
    // ========================================================================

    @Nested
    @DisplayName("System Property Resolution")
    class SystemPropertyTests {

        @Test
        @DisplayName("errsim.enabled=false is respected")
        void enabledFalse() {
            System.setProperty("errsim.enabled", "false");
            assertFalse(ErrsimConfig.load().enabled());
        }

        @Test
        @DisplayName("errsim.enabled=true is respected")
        void enabledTrue() {
            System.setProperty("errsim.enabled", "true");
            assertTrue(ErrsimConfig.load().enabled());
        }

        @Test
        @DisplayName("errsim.logFires=false is respected")
        void logFiresFalse() {
            System.setProperty("errsim.logFires", "false");
            assertFalse(ErrsimConfig.load().logFires());
        }

        @Test
        @DisplayName("errsim.strictNames=true is respected")
        void strictNamesTrue() {
            System.setProperty("errsim.strictNames", "true");
            assertTrue(ErrsimConfig.load().strictNames());
        }

        @Test
        @DisplayName("Whitespace and case around booleans are tolerated")
        void lenientBooleans() {
            System.setProperty("errsim.strictNames", "  TRUE ");
            assertTrue(ErrsimConfig.load().strictNames());
        }

        @Test
        @DisplayName("Unparseable boolean falls back to default")
        void unparseableBoolean() {
            System.setProperty("errsim.logFires", "yes please");
            assertTrue(ErrsimConfig.load().logFires());
        }

        @Test
        @DisplayName("Blank system property falls back to default")
        void blankProperty() {
            System.setProperty("errsim.strictNames", "   ");
            assertFalse(ErrsimConfig.load().strictNames());
        }
    }

    // ========================================================================
    // Programmatic override
    // ========================================================================

    @Nested
    @DisplayName("Programmatic Override")
    class ProgrammaticTests {

        @Test
        @DisplayName("Builder values override system properties")
        void builderOverridesSystemProperty() {
            System.setProperty("errsim.enabled", "true");
            System.setProperty("errsim.logFires", "true");
            System.setProperty("errsim.strictNames", "false");

            ErrsimConfig config = ErrsimConfig.builder()
                    .enabled(false)
                    .logFires(false)
                    .strictNames(true)
                    .build();

            assertFalse(config.enabled());
            assertFalse(config.logFires());
            assertTrue(config.strictNames());
        }

        @Test
        @DisplayName("toString lists every setting")
        void toStringListsSettings() {
            String s = ErrsimConfig.builder().enabled(true).logFires(false).strictNames(true).build().toString();
            assertEquals("ErrsimConfig{enabled=true, logFires=false, strictNames=true}", s);
        }
    }
}

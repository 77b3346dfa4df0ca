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

/**
 * Injection point used when error injection is disabled. Carries only its
 * name and never fires.
 */
final class DisabledPoint implements ErrsimPoint {

    private final String name;

    DisabledPoint(String name) {
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public int check(String key) {
        return 0;
    }

    @Override
    public State state() {
        return State.INACTIVE;
    }

    @Override
    public int remaining() {
        return 0;
    }

    @Override
    public long fireCount() {
        return 0;
    }

    @Override
    public String toString() {
        return "DisabledPoint{name=" + name + '}';
    }
}

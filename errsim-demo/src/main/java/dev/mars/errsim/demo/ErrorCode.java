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

/**
 * Error codes returned by the offload storage layer.
 * <p>
 * Injection points fire with one of these codes (as {@link #toInt()}), so an
 * injected failure is indistinguishable from a real one to the caller.
 */
public enum ErrorCode {
    OK(0),
    INTERNAL_ERROR(-1),
    INVALID_KEY(-2),
    FILE_NOT_FOUND(-3),
    FILE_WRITE_FAIL(-4),
    FILE_READ_FAIL(-5),
    CORRUPT_DATA(-6),
    SYNC_FAIL(-7);

    private final int value;

    ErrorCode(int value) {
        this.value = value;
    }

    public int toInt() {
        return value;
    }

    /** Maps a raw code back to its enum constant; unknown codes are {@link #INTERNAL_ERROR}. */
    public static ErrorCode fromInt(int value) {
        for (ErrorCode code : values()) {
            if (code.value == value) {
                return code;
            }
        }
        return INTERNAL_ERROR;
    }
}

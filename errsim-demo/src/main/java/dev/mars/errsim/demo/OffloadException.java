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
 * Exception thrown when an offload operation fails, carrying the storage error code.
 */
public class OffloadException extends RuntimeException {

    private final ErrorCode errorCode;
    private final int code;

    public OffloadException(ErrorCode errorCode, String message) {
        this(errorCode, errorCode.toInt(), message, null);
    }

    public OffloadException(ErrorCode errorCode, String message, Throwable cause) {
        this(errorCode, errorCode.toInt(), message, cause);
    }

    private OffloadException(ErrorCode errorCode, int code, String message, Throwable cause) {
        super(message + " (" + errorCode + ", code=" + code + ")", cause);
        this.errorCode = errorCode;
        this.code = code;
    }

    /**
     * Builds the exception for a raw code, as returned by an injection point.
     * The raw code is kept as-is; {@link #errorCode()} is its closest enum constant.
     */
    public static OffloadException ofCode(int code, String message) {
        return new OffloadException(ErrorCode.fromInt(code), code, message, null);
    }

    /** Enum view of {@link #code()}; codes outside {@link ErrorCode} map to {@link ErrorCode#INTERNAL_ERROR}. */
    public ErrorCode errorCode() {
        return errorCode;
    }

    /** The code this failure was raised with, unchanged. */
    public int code() {
        return code;
    }
}

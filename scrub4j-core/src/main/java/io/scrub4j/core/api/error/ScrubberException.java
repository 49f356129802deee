/*
 * Copyright (c) 2025 Scrub4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrub4j.core.api.error;

/** Base type for every failure raised by scrub4j. */
public class ScrubberException extends RuntimeException {

    public ScrubberException(String message) {
        super(message);
    }

    public ScrubberException(String message, Throwable cause) {
        super(message, cause);
    }
}

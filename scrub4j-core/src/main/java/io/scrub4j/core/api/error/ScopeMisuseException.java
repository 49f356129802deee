/*
 * Copyright (c) 2025 Scrub4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrub4j.core.api.error;

/** A scope request that contradicts itself, or a scope closed when none is open. */
public class ScopeMisuseException extends ScrubberException {

    public ScopeMisuseException(String message) {
        super(message);
    }
}

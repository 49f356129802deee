/*
 * Copyright (c) 2025 Scrub4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrub4j.core.api.error;

/** Raised when a hook, callable or source cannot be found. */
public class MissingTargetException extends ScrubberException {

    private final String target;

    public MissingTargetException(String target) {
        super("No interceptable target named '" + target + "'");
        this.target = target;
    }

    public String getTarget() {
        return target;
    }
}

/*
 * Copyright (c) 2025 Scrub4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrub4j.core.api.error;

/** Thrown by the default DIE handler; the message is the (already redacted) diagnostic text. */
public class FatalDiagnosticException extends ScrubberException {

    public FatalDiagnosticException(String message) {
        super(message);
    }
}

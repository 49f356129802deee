/*
 * Copyright (c) 2025 Scrub4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrub4j.core.api;

/** Handler installed on a diagnostic hook or a named callable slot. */
@FunctionalInterface
public interface EmissionHandler {
    void handle(Object... args);
}

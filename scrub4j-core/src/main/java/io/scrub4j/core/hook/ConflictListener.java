/*
 * Copyright (c) 2025 Scrub4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrub4j.core.hook;

import io.scrub4j.core.api.model.ConflictReport;

/**
 * Receives hooks we could not unwrap because another party replaced our handler.
 * Implementations must not emit through a scrubbed hook.
 */
@FunctionalInterface
public interface ConflictListener {
    void onConflict(ConflictReport report);
}

/*
 * Copyright (c) 2025 Scrub4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrub4j.core.report;

import io.scrub4j.core.api.model.Redaction;
import java.util.List;

public final class NoopReporter implements Reporter {
    public static final NoopReporter INSTANCE = new NoopReporter();

    @Override
    public void report(List<Redaction> redactions) {
        /* no-op */
    }
}

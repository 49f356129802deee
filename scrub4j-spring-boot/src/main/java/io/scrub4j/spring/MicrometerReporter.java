/*
 * Copyright (c) 2025 Scrub4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrub4j.spring;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.MeterRegistry;
import io.scrub4j.core.api.model.Redaction;
import io.scrub4j.core.report.Reporter;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Counts redactions per pattern index and keeps the most recent ones. Neither pattern text nor
 * matched text reaches the registry.
 */
public final class MicrometerReporter implements Reporter {
    private final MeterRegistry registry;
    private final Deque<Redaction> ring = new ArrayDeque<>();
    private final int capacity;

    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP2",
            justification = "MeterRegistry is a framework-managed, thread-safe component; "
                    + "keeping a reference is required for metrics reporting and it is not exposed via accessors.")
    public MicrometerReporter(MeterRegistry registry, int capacity) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.capacity = Math.max(10, capacity);
    }

    @Override
    public synchronized void report(List<Redaction> redactions) {
        if (redactions == null || redactions.isEmpty()) return;
        for (Redaction r : redactions) {
            registry.counter("scrub4j_redactions_total", "pattern_index", String.valueOf(r.patternIndex())).increment(r.count());
            if (ring.size() >= capacity) ring.removeFirst();
            ring.addLast(r);
        }
    }

    /** Returns an unmodifiable snapshot of the recent redactions ring buffer. */
    public synchronized List<Redaction> recentRedactions() {
        return List.copyOf(ring);
    }
}

/*
 * Copyright (c) 2025 Scrub4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrub4j.spring;

import io.scrub4j.core.state.ScrubberContext;
import io.scrub4j.core.state.ScrubberState;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.actuate.endpoint.annotation.Endpoint;
import org.springframework.boot.actuate.endpoint.annotation.ReadOperation;

/**
 * Exposes the live configuration. Patterns are reduced to their count and recent redactions
 * name a pattern by index only.
 */
@Endpoint(id = "scrub4j")
public class ScrubberEndpoint {

    private final ScrubberContext context;
    private final MicrometerReporter reporter; // may be null

    public ScrubberEndpoint(ScrubberContext context, MicrometerReporter reporter) {
        this.context = context;
        this.reporter = reporter;
    }

    @ReadOperation
    public Map<String, Object> info() {
        ScrubberState state = context.current();
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("status", "OK");
        m.put("enabled", state.isEnabled());
        m.put("patterns", state.patterns().size());
        m.put("hooks", state.hooks().ids());
        m.put("methods", state.methods().ids());
        m.put("scopeDepth", context.depth());
        m.put("recentRedactions", reporter == null ? List.of() : reporter.recentRedactions());
        return m;
    }
}

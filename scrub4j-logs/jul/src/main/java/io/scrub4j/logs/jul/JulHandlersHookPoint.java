/*
 * Copyright (c) 2025 Scrub4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrub4j.logs.jul;

import io.scrub4j.core.api.HookPoint;
import io.scrub4j.core.redact.Redactor;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Handler;
import java.util.logging.Logger;

/**
 * The handler chain of one JUL logger, as a hook point. Wrapping replaces every handler
 * with a {@link ScrubbingJulHandler} around it; handlers that already are one are kept.
 * A logger without handlers gets none: its records still travel to the parent's handlers.
 */
final class JulHandlersHookPoint implements HookPoint<List<Handler>> {

    private final String id;
    private final Logger logger;

    JulHandlersHookPoint(String id, Logger logger) {
        this.id = id;
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public List<Handler> current() {
        return List.of(logger.getHandlers());
    }

    @Override
    public void install(List<Handler> handlers) {
        for (Handler h : logger.getHandlers()) logger.removeHandler(h);
        if (handlers != null) for (Handler h : handlers) logger.addHandler(h);
    }

    @Override
    public List<Handler> wrap(List<Handler> original, Redactor redactor) {
        List<Handler> out = new ArrayList<>();
        if (original != null) {
            for (Handler h : original) {
                out.add(h instanceof ScrubbingJulHandler ? h : new ScrubbingJulHandler(h, redactor));
            }
        }
        return out;
    }
}

/*
 * Copyright (c) 2025 Scrub4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrub4j.logs.jul;

import io.scrub4j.core.state.ScrubberContext;
import java.util.*;
import lombok.extern.slf4j.Slf4j;

/**
 * Makes JUL loggers interceptable through a {@link ScrubberContext} and wraps them.
 * Safe to call multiple times: already wrapped loggers are skipped by the registry.
 */
@Slf4j
public final class ScrubberJulInstaller {

    private final ScrubberContext context;

    public ScrubberJulInstaller(ScrubberContext context) {
        this.context = Objects.requireNonNull(context, "context");
    }

    /** Registers the {@code jul:} resolver and the {@value JulSource#NAME} source. */
    public ScrubberJulInstaller register() {
        context.registerHookResolver(new JulHookResolver());
        context.registerSource(new JulSource());
        return this;
    }

    /**
     * Wraps the handler chains of {@code onlyLoggers}, or of every logger with handlers
     * when the list is empty.
     */
    public void install(List<String> onlyLoggers) {
        register();
        if (onlyLoggers == null || onlyLoggers.isEmpty()) {
            context.current().addSources(List.of(JulSource.NAME));
        } else {
            List<String> ids = new ArrayList<>();
            for (String name : onlyLoggers) ids.add(JulHookResolver.idFor(name));
            context.current().addHooks(ids);
        }
        log.debug("scrub4j: JUL hooks tracked: {}", context.current().hooks().ids());
    }
}

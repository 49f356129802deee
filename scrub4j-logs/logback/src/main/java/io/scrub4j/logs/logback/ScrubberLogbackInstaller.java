/*
 * Copyright (c) 2025 Scrub4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrub4j.logs.logback;

import ch.qos.logback.classic.LoggerContext;
import io.scrub4j.core.state.ScrubberContext;
import java.util.List;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Makes Logback loggers interceptable through a {@link ScrubberContext}, wraps them, and
 * keeps them wrapped across context resets. Safe to call multiple times.
 */
@Slf4j
public final class ScrubberLogbackInstaller {

    private final ScrubberContext scrubber;
    private final LoggerContext loggerContext;

    public ScrubberLogbackInstaller(ScrubberContext scrubber, LoggerContext loggerContext) {
        this.scrubber = Objects.requireNonNull(scrubber, "scrubber");
        this.loggerContext = Objects.requireNonNull(loggerContext, "loggerContext");
    }

    public void install(List<String> onlyLoggers, List<String> ignoreLoggers) {
        scrubber.registerHookResolver(new LogbackHookResolver(loggerContext));
        scrubber.registerSource(new LogbackSource(loggerContext, onlyLoggers, ignoreLoggers));
        scrubber.current().addSources(List.of(LogbackSource.NAME));

        boolean already = loggerContext.getCopyOfListenerList().stream()
                .anyMatch(l -> l instanceof ScrubLoggerContextListener);
        if (!already) loggerContext.addListener(new ScrubLoggerContextListener(scrubber));
        log.debug("scrub4j: Logback hooks tracked: {}", scrubber.current().hooks().ids());
    }
}

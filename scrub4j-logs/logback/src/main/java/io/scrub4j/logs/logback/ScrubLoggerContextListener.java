/*
 * Copyright (c) 2025 Scrub4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrub4j.logs.logback;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.LoggerContextListener;
import io.scrub4j.core.state.ScrubberContext;
import io.scrub4j.core.state.ScrubberState;
import java.util.List;
import java.util.Objects;

/**
 * Re-wraps appenders after {@link LoggerContext#reset()}: the reset replaces every
 * appender we wrapped, so the live state is started again to wrap the new ones. New
 * loggers of the {@value LogbackSource#NAME} source are picked up as well.
 */
public final class ScrubLoggerContextListener implements LoggerContextListener {

    private final ScrubberContext scrubber;

    public ScrubLoggerContextListener(ScrubberContext scrubber) {
        this.scrubber = Objects.requireNonNull(scrubber, "scrubber");
    }

    @Override
    public boolean isResetResistant() {
        return true;
    }

    @Override
    public void onStart(LoggerContext context) {
        rewrap();
    }

    @Override
    public void onReset(LoggerContext context) {
        rewrap();
    }

    @Override
    public void onStop(LoggerContext context) {
        /* no-op */
    }

    @Override
    public void onLevelChange(Logger logger, Level level) {
        /* no-op */
    }

    private void rewrap() {
        ScrubberState state = scrubber.current();
        if (!state.isEnabled()) return;
        state.start();
        if (scrubber.sources().names().contains(LogbackSource.NAME)) {
            state.addSources(List.of(LogbackSource.NAME));
        }
    }
}

/*
 * Copyright (c) 2025 Scrub4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrub4j.logs.logback;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import io.scrub4j.core.api.HookPoint;
import io.scrub4j.core.redact.Redactor;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The appenders attached to one Logback logger, as a hook point. Wrapping puts a started
 * {@link ScrubbingAppender} around every appender, including async ones, so redaction
 * happens on the calling thread before anything is queued.
 */
final class LogbackAppendersHookPoint implements HookPoint<List<Appender<ILoggingEvent>>> {

    private final String id;
    private final Logger logger;

    LogbackAppendersHookPoint(String id, Logger logger) {
        this.id = id;
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public List<Appender<ILoggingEvent>> current() {
        List<Appender<ILoggingEvent>> out = new ArrayList<>();
        for (var it = logger.iteratorForAppenders(); it.hasNext(); ) out.add(it.next());
        return out;
    }

    /** Detaches without stopping, so the application's appenders survive unwrapping. */
    @Override
    public void install(List<Appender<ILoggingEvent>> appenders) {
        for (Appender<ILoggingEvent> app : current()) logger.detachAppender(app);
        if (appenders != null) for (Appender<ILoggingEvent> app : appenders) logger.addAppender(app);
    }

    @Override
    public List<Appender<ILoggingEvent>> wrap(List<Appender<ILoggingEvent>> original, Redactor redactor) {
        List<Appender<ILoggingEvent>> out = new ArrayList<>();
        if (original == null) return out;
        for (Appender<ILoggingEvent> app : original) {
            if (ScrubbingAppender.isScrubbing(app)) {
                out.add(app);
                continue;
            }
            var wrapper = new ScrubbingAppender(app, redactor);
            wrapper.setContext(logger.getLoggerContext());
            wrapper.start();
            out.add(wrapper);
        }
        return out;
    }
}

/*
 * Copyright (c) 2025 Scrub4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrub4j.logs.logback;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import io.scrub4j.core.api.HookPoint;
import io.scrub4j.core.api.HookResolver;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves {@code logback:<loggerName>} to the appenders of that logger
 * ({@code logback:ROOT} for the root logger). Only loggers that already exist resolve.
 */
public final class LogbackHookResolver implements HookResolver {

    public static final String PREFIX = "logback:";

    private final LoggerContext loggerContext;

    public LogbackHookResolver(LoggerContext loggerContext) {
        this.loggerContext = Objects.requireNonNull(loggerContext, "loggerContext");
    }

    public static String idFor(String loggerName) {
        return PREFIX + loggerName;
    }

    @Override
    public Optional<HookPoint<?>> find(String id) {
        if (id == null || !id.startsWith(PREFIX)) return Optional.empty();
        Logger logger = loggerContext.exists(id.substring(PREFIX.length()));
        if (logger == null) return Optional.empty();
        return Optional.of(new LogbackAppendersHookPoint(id, logger));
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof LogbackHookResolver other && other.loggerContext == loggerContext;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(loggerContext);
    }
}

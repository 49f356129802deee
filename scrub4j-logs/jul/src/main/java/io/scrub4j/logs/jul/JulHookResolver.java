/*
 * Copyright (c) 2025 Scrub4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrub4j.logs.jul;

import io.scrub4j.core.api.HookPoint;
import io.scrub4j.core.api.HookResolver;
import java.util.Optional;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Resolves {@code jul:<loggerName>} to the handler chain of that logger; {@code jul:} alone
 * is the root logger. Only loggers that already exist resolve.
 */
public final class JulHookResolver implements HookResolver {

    public static final String PREFIX = "jul:";

    public static String idFor(String loggerName) {
        return PREFIX + (loggerName == null ? "" : loggerName);
    }

    @Override
    public Optional<HookPoint<?>> find(String id) {
        if (id == null || !id.startsWith(PREFIX)) return Optional.empty();
        String name = id.substring(PREFIX.length());
        Logger logger = LogManager.getLogManager().getLogger(name);
        if (logger == null) return Optional.empty();
        return Optional.of(new JulHandlersHookPoint(id, logger));
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof JulHookResolver;
    }

    @Override
    public int hashCode() {
        return JulHookResolver.class.hashCode();
    }
}

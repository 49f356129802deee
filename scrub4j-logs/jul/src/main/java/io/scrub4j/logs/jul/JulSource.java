/*
 * Copyright (c) 2025 Scrub4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrub4j.logs.jul;

import io.scrub4j.core.api.HookSource;
import java.util.*;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Source {@value #NAME}: every JUL logger that currently has handlers (root included).
 * Loggers created later are not picked up until the source is added again.
 */
public final class JulSource implements HookSource {

    public static final String NAME = "jul";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Set<String> ids() {
        LogManager lm = LogManager.getLogManager();
        Set<String> out = new TreeSet<>();
        // root logger in JUL has empty name ""
        Enumeration<String> names = lm.getLoggerNames();
        while (names.hasMoreElements()) {
            String n = names.nextElement();
            Logger l = lm.getLogger(n);
            if (l != null && l.getHandlers().length > 0) out.add(JulHookResolver.idFor(n));
        }
        return out;
    }

    @Override
    public boolean namedCallables() {
        return false;
    }
}

/*
 * Copyright (c) 2025 Scrub4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrub4j.logs.logback;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import io.scrub4j.core.api.HookSource;
import java.util.*;

/** Source {@value #NAME}: every Logback logger that currently has appenders attached. */
public final class LogbackSource implements HookSource {

    public static final String NAME = "logback";

    private final LoggerContext loggerContext;
    private final List<String> only; // lowercase names; empty => all
    private final List<String> ignore; // lowercase names

    public LogbackSource(LoggerContext loggerContext) {
        this(loggerContext, List.of(), List.of());
    }

    public LogbackSource(LoggerContext loggerContext, List<String> onlyLoggers, List<String> ignoreLoggers) {
        this.loggerContext = Objects.requireNonNull(loggerContext, "loggerContext");
        this.only = toLower(onlyLoggers);
        this.ignore = toLower(ignoreLoggers);
    }

    private static List<String> toLower(List<String> in) {
        var out = new ArrayList<String>();
        if (in != null) for (String s : in) if (s != null) out.add(s.toLowerCase(Locale.ROOT));
        return out;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Set<String> ids() {
        List<Logger> loggers = new ArrayList<>(loggerContext.getLoggerList());
        Logger root = loggerContext.getLogger(Logger.ROOT_LOGGER_NAME);
        if (!loggers.contains(root)) loggers.add(root);

        Set<String> out = new TreeSet<>();
        for (Logger logger : loggers) {
            String lname = (logger.getName() == null ? "" : logger.getName().toLowerCase(Locale.ROOT));
            if (!only.isEmpty() && !only.contains(lname)) continue;
            if (!ignore.isEmpty() && ignore.contains(lname)) continue;
            if (logger.iteratorForAppenders().hasNext()) out.add(LogbackHookResolver.idFor(logger.getName()));
        }
        return out;
    }

    @Override
    public boolean namedCallables() {
        return false;
    }
}

/*
 * Copyright (c) 2025 Scrub4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrub4j.core.platform;

import java.util.Arrays;
import java.util.IllegalFormatException;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

/**
 * {@code syslog(priority, format, args...)} routed to the SLF4J logger {@value #LOGGER_NAME}.
 * Dispatches through {@link CallableTable#global()} as {@value #SYSLOG}.
 *
 * <p>Priorities follow syslog names ({@code emerg} .. {@code debug}); unknown names log at INFO.
 */
public final class Syslog {

    public static final String SOURCE = "Syslog";
    public static final String SYSLOG = SOURCE + "::syslog";
    public static final String LOGGER_NAME = "syslog";

    private static final Logger LOG = LoggerFactory.getLogger(LOGGER_NAME);

    private Syslog() {}

    public static void syslog(String priority, String format, Object... args) {
        Object[] all = new Object[(args == null ? 0 : args.length) + 2];
        all[0] = priority;
        all[1] = format;
        if (args != null) System.arraycopy(args, 0, all, 2, args.length);
        CallableTable.global().invoke(SYSLOG, all);
    }

    static void defineIn(CallableTable table) {
        table.define(SYSLOG, Syslog::emit);
    }

    static void emit(Object... all) {
        if (all == null || all.length == 0) return;
        Level level = level(String.valueOf(all[0]));
        String message = all.length > 1 ? format(all[1], Arrays.copyOfRange(all, 2, all.length)) : "";
        LOG.atLevel(level).log(message);
    }

    static Level level(String priority) {
        return switch (priority.toLowerCase(Locale.ROOT).replace("log_", "")) {
            case "emerg", "alert", "crit", "err", "error" -> Level.ERROR;
            case "warning", "warn" -> Level.WARN;
            case "debug" -> Level.DEBUG;
            default -> Level.INFO; // notice, info
        };
    }

    private static String format(Object format, Object[] args) {
        String f = String.valueOf(format);
        if (args.length == 0) return f;
        try {
            return String.format(Locale.ROOT, f, args);
        } catch (IllegalFormatException e) {
            return f + " " + Arrays.toString(args);
        }
    }
}

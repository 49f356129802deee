/*
 * Copyright (c) 2025 Scrub4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrub4j.core.platform;

import io.scrub4j.core.api.EmissionHandler;
import io.scrub4j.core.api.error.FatalDiagnosticException;
import java.io.PrintStream;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide warning and fatal-error channels, each with a replaceable handler slot.
 *
 * <ul>
 *   <li>{@link #warn}: calls the {@link #WARN} handler, or prints the joined arguments to
 *       {@code System.err}.</li>
 *   <li>{@link #warnIf}: if the condition holds, calls the {@link #WARNIF} handler, or
 *       falls back to {@link #warn}.</li>
 *   <li>{@link #die}: calls the {@link #DIE} handler and then throws
 *       {@link FatalDiagnosticException}. Without a handler, the exception carries the
 *       joined arguments. A handler that returns normally gets a bare "Died" exception;
 *       handlers that want to control the message should throw themselves.</li>
 * </ul>
 */
public final class Diagnostics {

    public static final String WARN = "WARN";
    public static final String DIE = "DIE";
    public static final String WARNIF = "WARNIF";

    private static final Map<String, EmissionHandler> SLOTS = new ConcurrentHashMap<>();

    private Diagnostics() {}

    public static void warn(Object... args) {
        EmissionHandler h = SLOTS.get(WARN);
        if (h != null) h.handle(args);
        else emitWarning(args);
    }

    public static void warnIf(boolean condition, Object... args) {
        if (!condition) return;
        EmissionHandler h = SLOTS.get(WARNIF);
        if (h != null) h.handle(args);
        else warn(args);
    }

    public static void die(Object... args) {
        EmissionHandler h = SLOTS.get(DIE);
        if (h == null) throw new FatalDiagnosticException(render(args));
        h.handle(args);
        throw new FatalDiagnosticException("Died");
    }

    public static EmissionHandler handler(String slot) {
        return SLOTS.get(requireSlot(slot));
    }

    /** Installs {@code handler} on {@code slot}; {@code null} unsets it. */
    public static void setHandler(String slot, EmissionHandler handler) {
        requireSlot(slot);
        if (handler == null) SLOTS.remove(slot);
        else SLOTS.put(slot, handler);
    }

    public static boolean isSlot(String name) {
        return WARN.equals(name) || DIE.equals(name) || WARNIF.equals(name);
    }

    /** Default warning sink: the joined text, newline-terminated, on {@code System.err}. */
    public static void emitWarning(Object... args) {
        String text = render(args);
        PrintStream err = System.err;
        if (text.endsWith("\n")) err.print(text);
        else err.println(text);
        err.flush();
    }

    /** Concatenates the arguments' text forms, like a print of the argument list. */
    public static String render(Object... args) {
        if (args == null || args.length == 0) return "";
        StringBuilder sb = new StringBuilder();
        for (Object a : args) sb.append(a);
        return sb.toString();
    }

    private static String requireSlot(String slot) {
        Objects.requireNonNull(slot, "slot");
        if (!isSlot(slot)) throw new IllegalArgumentException("Unknown diagnostic slot: " + slot);
        return slot;
    }
}

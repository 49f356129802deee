/*
 * Copyright (c) 2025 Scrub4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrub4j.core.platform;

/**
 * Caller-facing warn/die helpers. Every call dispatches through {@link CallableTable#global()},
 * under the source {@value #SOURCE}, so the entries can be intercepted by name.
 *
 * <p>{@code carp}/{@code croak} warn/die with the message; {@code cluck}/{@code confess}
 * additionally append the current stack.
 */
public final class Carp {

    public static final String SOURCE = "Carp";
    public static final String CARP = SOURCE + "::carp";
    public static final String CLUCK = SOURCE + "::cluck";
    public static final String CROAK = SOURCE + "::croak";
    public static final String CONFESS = SOURCE + "::confess";

    private Carp() {}

    public static void carp(Object... args) {
        CallableTable.global().invoke(CARP, args);
    }

    public static void cluck(Object... args) {
        CallableTable.global().invoke(CLUCK, args);
    }

    public static void croak(Object... args) {
        CallableTable.global().invoke(CROAK, args);
    }

    public static void confess(Object... args) {
        CallableTable.global().invoke(CONFESS, args);
    }

    static void defineIn(CallableTable table) {
        table.define(CARP, Diagnostics::warn);
        table.define(CLUCK, args -> Diagnostics.warn(withStack(args)));
        table.define(CROAK, Diagnostics::die);
        table.define(CONFESS, args -> Diagnostics.die(withStack(args)));
    }

    static Object[] withStack(Object[] args) {
        Object[] out = new Object[(args == null ? 0 : args.length) + 1];
        if (args != null) System.arraycopy(args, 0, out, 0, args.length);
        StringBuilder sb = new StringBuilder();
        for (StackTraceElement e : new Throwable().getStackTrace()) sb.append("\n\tat ").append(e);
        out[out.length - 1] = sb.toString();
        return out;
    }
}

/*
 * Copyright (c) 2025 Scrub4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrub4j.core;

import io.scrub4j.core.api.Replacement;
import io.scrub4j.core.pattern.PatternSet;
import io.scrub4j.core.state.ScopeRequest;
import io.scrub4j.core.state.ScrubberContext;
import io.scrub4j.core.state.ScrubberScope;
import io.scrub4j.core.state.ScrubberState;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Entry points for application code.
 *
 * <pre>{@code
 * Scrubber.init(Map.of("4007000000027", "DELETED"));
 * Diagnostics.warn("The card number is 4007000000027.");   // The card number is DELETED.
 * }</pre>
 *
 * All calls go to one process-wide {@link ScrubberContext}; {@link #useContext} swaps it
 * (mainly for tests).
 */
public final class Scrubber {

    private static volatile ScrubberContext context = ScrubberContext.createDefault();

    private Scrubber() {}

    public static ScrubberContext context() {
        return context;
    }

    /** Replaces the process-wide context and returns the previous one. Nothing is unwrapped. */
    public static ScrubberContext useContext(ScrubberContext replacement) {
        ScrubberContext previous = context;
        context = Objects.requireNonNull(replacement, "replacement");
        return previous;
    }

    /** Replaces all patterns with literal replacements and (re)wraps every tracked hook. */
    public static Map<String, Replacement> init(Map<String, String> literals) {
        return context.init(PatternSet.ofLiterals(literals));
    }

    public static Map<String, Replacement> init(PatternSet patterns) {
        return context.init(patterns);
    }

    /** Re-wraps every tracked hook with the current patterns. */
    public static Map<String, Replacement> init() {
        return context.init(null);
    }

    public static List<Object> redact(Object... values) {
        return context.redactor().redact(values);
    }

    public static String redactText(String text) {
        return context.redactor().redactText(text);
    }

    public static boolean isEnabled() {
        return state().isEnabled();
    }

    public static void enable() {
        context.toggle(true);
    }

    public static void disable() {
        context.toggle(false);
    }

    public static void addPattern(Map<String, String> literals) {
        state().patterns().putAll(PatternSet.ofLiterals(literals));
    }

    public static void addPattern(String pattern, Replacement replacement) {
        state().patterns().put(pattern, replacement);
    }

    /** Removes the given patterns; the map values are ignored. */
    public static void removePattern(Map<String, ?> patterns) {
        if (patterns != null) state().patterns().removeAll(patterns.keySet());
    }

    public static void removePattern(String... patterns) {
        state().patterns().removeAll(Arrays.asList(patterns));
    }

    public static void addHook(String... ids) {
        state().addHooks(Arrays.asList(ids));
    }

    public static void removeHook(String... ids) {
        state().removeHooks(Arrays.asList(ids));
    }

    public static void addMethod(String... ids) {
        state().addMethods(Arrays.asList(ids));
    }

    public static void removeMethod(String... ids) {
        state().removeMethods(Arrays.asList(ids));
    }

    public static void addSource(String... names) {
        state().addSources(Arrays.asList(names));
    }

    public static void removeSource(String... names) {
        state().removeSources(Arrays.asList(names));
    }

    public static ScrubberScope scope(ScopeRequest request) {
        return context.enter(request);
    }

    public static <T> T withScope(ScopeRequest request, Supplier<T> body) {
        return context.withScope(request, body);
    }

    public static void withScope(ScopeRequest request, Runnable body) {
        context.withScope(request, body);
    }

    private static ScrubberState state() {
        return context.current();
    }
}

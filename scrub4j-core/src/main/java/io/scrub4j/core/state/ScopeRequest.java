/*
 * Copyright (c) 2025 Scrub4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrub4j.core.state;

import io.scrub4j.core.api.Replacement;
import io.scrub4j.core.api.error.ScopeMisuseException;
import io.scrub4j.core.pattern.PatternSet;
import java.util.*;

/**
 * Changes to apply on top of a snapshot of the live configuration. Build it fluently,
 * then hand it to {@link ScrubberContext#enter} or {@link ScrubberContext#withScope}.
 *
 * <p>Order of application: patterns (replace, then add, then remove), hooks, methods,
 * sources, and finally the enable/disable switch.
 */
public final class ScopeRequest {

    private boolean enable;
    private boolean disable;
    private PatternSet replacePatterns;
    private final PatternSet addPatterns = new PatternSet();
    private final Set<String> removePatterns = new LinkedHashSet<>();
    private final Set<String> addHooks = new LinkedHashSet<>();
    private final Set<String> removeHooks = new LinkedHashSet<>();
    private final Set<String> addMethods = new LinkedHashSet<>();
    private final Set<String> removeMethods = new LinkedHashSet<>();
    private final Set<String> addSources = new LinkedHashSet<>();
    private final Set<String> removeSources = new LinkedHashSet<>();

    public static ScopeRequest create() {
        return new ScopeRequest();
    }

    public ScopeRequest enable() {
        this.enable = true;
        return this;
    }

    public ScopeRequest disable() {
        this.disable = true;
        return this;
    }

    /** Replaces the inherited patterns instead of adding to them. */
    public ScopeRequest patterns(PatternSet patterns) {
        this.replacePatterns = Objects.requireNonNull(patterns, "patterns").copy();
        return this;
    }

    public ScopeRequest addPattern(String pattern, String literal) {
        addPatterns.put(pattern, literal);
        return this;
    }

    public ScopeRequest addPattern(String pattern, Replacement replacement) {
        addPatterns.put(pattern, replacement);
        return this;
    }

    public ScopeRequest addPatterns(Map<String, ? extends Replacement> patterns) {
        addPatterns.putAll(patterns);
        return this;
    }

    public ScopeRequest removePatterns(String... patterns) {
        removePatterns.addAll(Arrays.asList(patterns));
        return this;
    }

    public ScopeRequest addHooks(String... ids) {
        addHooks.addAll(Arrays.asList(ids));
        return this;
    }

    public ScopeRequest removeHooks(String... ids) {
        removeHooks.addAll(Arrays.asList(ids));
        return this;
    }

    public ScopeRequest addMethods(String... ids) {
        addMethods.addAll(Arrays.asList(ids));
        return this;
    }

    public ScopeRequest removeMethods(String... ids) {
        removeMethods.addAll(Arrays.asList(ids));
        return this;
    }

    public ScopeRequest addSources(String... names) {
        addSources.addAll(Arrays.asList(names));
        return this;
    }

    public ScopeRequest removeSources(String... names) {
        removeSources.addAll(Arrays.asList(names));
        return this;
    }

    /** Rejects contradictory requests before anything is touched. */
    void validate() {
        if (enable && disable) {
            throw new ScopeMisuseException("A scope cannot both enable and disable scrubbing");
        }
    }

    void applyTo(ScrubberState state) {
        if (replacePatterns != null) state.replacePatterns(replacePatterns);
        if (!addPatterns.isEmpty()) state.patterns().putAll(addPatterns);
        if (!removePatterns.isEmpty()) state.patterns().removeAll(removePatterns);
        state.addHooks(addHooks);
        state.removeHooks(removeHooks);
        state.addMethods(addMethods);
        state.removeMethods(removeMethods);
        state.addSources(addSources);
        state.removeSources(removeSources);
        if (enable) state.start();
        if (disable) state.stop();
    }
}

/*
 * Copyright (c) 2025 Scrub4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrub4j.core.state;

import io.scrub4j.core.api.HookResolver;
import io.scrub4j.core.api.HookSource;
import io.scrub4j.core.api.Replacement;
import io.scrub4j.core.api.error.ScrubberException;
import io.scrub4j.core.hook.ConflictListener;
import io.scrub4j.core.hook.HookRegistry;
import io.scrub4j.core.pattern.PatternSet;
import io.scrub4j.core.platform.SourceCatalog;
import io.scrub4j.core.redact.Redactor;
import java.util.*;
import java.util.function.Consumer;

/**
 * One configuration: the global switch, the patterns, and the tracked hooks and methods.
 *
 * <p>{@link #snapshot()} copies everything by value into a child whose {@link #parent()}
 * is this state; {@link #copy()} does the same but keeps this state's parent. Records are
 * copied with their installed wrappers, so a child can unwrap what its parent wrapped.
 */
public final class ScrubberState {

    private final SourceCatalog sources;
    private final ScrubberState parent;
    private final HookRegistry hooks;
    private final HookRegistry methods;
    private boolean enabled;
    private PatternSet patterns;

    ScrubberState(
            HookResolver hookResolver,
            HookResolver methodResolver,
            SourceCatalog sources,
            Redactor redactor,
            ConflictListener conflicts) {
        this.sources = Objects.requireNonNull(sources, "sources");
        this.parent = null;
        this.enabled = true;
        this.patterns = new PatternSet();
        this.hooks = new HookRegistry("hook", hookResolver, redactor, conflicts, this::isEnabled);
        this.methods = new HookRegistry("method", methodResolver, redactor, conflicts, this::isEnabled);
    }

    private ScrubberState(ScrubberState src, ScrubberState parent) {
        this.sources = src.sources;
        this.parent = parent;
        this.enabled = src.enabled;
        this.patterns = src.patterns.copy();
        this.hooks = src.hooks.copy(this::isEnabled);
        this.methods = src.methods.copy(this::isEnabled);
    }

    public boolean isEnabled() {
        return enabled;
    }

    /** The live pattern set. Changes take effect on the next redaction. */
    public PatternSet patterns() {
        return patterns;
    }

    public HookRegistry hooks() {
        return hooks;
    }

    public HookRegistry methods() {
        return methods;
    }

    public Optional<ScrubberState> parent() {
        return Optional.ofNullable(parent);
    }

    public void start() {
        enabled = true;
        runBoth(hooks::enableAll, methods::enableAll);
    }

    public void stop() {
        try {
            runBoth(hooks::disableAll, methods::disableAll);
        } finally {
            enabled = false;
        }
    }

    /**
     * Stops, swaps in a copy of {@code newPatterns} when given, and starts again. Calling it
     * without patterns re-wraps any hook another party has taken over since.
     *
     * @return read-only view of the patterns now in effect
     */
    public Map<String, Replacement> init(PatternSet newPatterns) {
        stop();
        if (newPatterns != null) patterns = newPatterns.copy();
        start();
        return patterns.asMap();
    }

    public void replacePatterns(PatternSet newPatterns) {
        patterns = newPatterns == null ? new PatternSet() : newPatterns.copy();
    }

    public void addHooks(Collection<String> ids) {
        hooks.addAll(ids);
    }

    public void removeHooks(Collection<String> ids) {
        hooks.removeAll(ids);
    }

    public void addMethods(Collection<String> ids) {
        methods.addAll(ids);
    }

    public void removeMethods(Collection<String> ids) {
        methods.removeAll(ids);
    }

    /** Registers every id the named sources currently enumerate. Unknown names fail individually. */
    public void addSources(Collection<String> names) {
        forEachSource(names, s -> registryFor(s).addAll(s.ids()));
    }

    public void removeSources(Collection<String> names) {
        forEachSource(names, s -> registryFor(s).removeAll(s.ids()));
    }

    public ScrubberState snapshot() {
        return new ScrubberState(this, this);
    }

    public ScrubberState copy() {
        return new ScrubberState(this, parent);
    }

    private HookRegistry registryFor(HookSource source) {
        return source.namedCallables() ? methods : hooks;
    }

    private void forEachSource(Collection<String> names, Consumer<HookSource> op) {
        if (names == null) return;
        ScrubberException first = null;
        for (String name : names) {
            try {
                op.accept(sources.resolve(name));
            } catch (ScrubberException e) {
                if (first == null) first = e;
                else first.addSuppressed(e);
            }
        }
        if (first != null) throw first;
    }

    private static void runBoth(Runnable a, Runnable b) {
        try {
            a.run();
        } finally {
            b.run();
        }
    }

    @Override
    public String toString() {
        return "ScrubberState[enabled=" + enabled + ", patterns=" + patterns.size() + ", hooks=" + hooks.ids()
                + ", methods=" + methods.ids() + ", nested=" + (parent != null) + "]";
    }
}

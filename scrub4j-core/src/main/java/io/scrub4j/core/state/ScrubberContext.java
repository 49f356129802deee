/*
 * Copyright (c) 2025 Scrub4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrub4j.core.state;

import io.scrub4j.core.api.HookResolver;
import io.scrub4j.core.api.HookSource;
import io.scrub4j.core.api.Replacement;
import io.scrub4j.core.api.error.ScopeMisuseException;
import io.scrub4j.core.hook.CompositeHookResolver;
import io.scrub4j.core.hook.ConflictListener;
import io.scrub4j.core.hook.Slf4jConflictListener;
import io.scrub4j.core.pattern.PatternSet;
import io.scrub4j.core.platform.CallableTable;
import io.scrub4j.core.platform.DiagnosticHookResolver;
import io.scrub4j.core.platform.SourceCatalog;
import io.scrub4j.core.redact.Redactor;
import io.scrub4j.core.report.NoopReporter;
import io.scrub4j.core.report.Reporter;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Owns the live {@link ScrubberState} and the chain of states saved by open scopes.
 *
 * <p>Every wrapper built through this context shares one {@link Redactor} that reads the
 * patterns of whichever state is live at call time, so entering or leaving a scope takes
 * effect on installed hooks without re-wrapping them.
 *
 * <p>Configuration changes are not synchronized. Make them from one thread, or guard
 * them externally.
 */
@Slf4j
public final class ScrubberContext {

    private final CompositeHookResolver hookResolver;
    private final CallableTable callables;
    private final SourceCatalog sources;
    private final Redactor redactor;
    private volatile Reporter reporter = NoopReporter.INSTANCE;
    private volatile ScrubberState live;
    private boolean defaultsApplied;

    public ScrubberContext(CallableTable callables, ConflictListener conflicts) {
        this.callables = Objects.requireNonNull(callables, "callables");
        this.hookResolver = new CompositeHookResolver(new DiagnosticHookResolver());
        this.sources = new SourceCatalog(callables);
        this.redactor = new Redactor(() -> live.patterns(), () -> reporter);
        this.live = new ScrubberState(hookResolver, callables, sources, redactor, conflicts);
    }

    public static ScrubberContext createDefault() {
        return new ScrubberContext(CallableTable.global(), new Slf4jConflictListener());
    }

    public ScrubberState current() {
        return live;
    }

    public Redactor redactor() {
        return redactor;
    }

    public CallableTable callables() {
        return callables;
    }

    public SourceCatalog sources() {
        return sources;
    }

    public void registerHookResolver(HookResolver resolver) {
        hookResolver.register(resolver);
    }

    public void registerSource(HookSource source) {
        sources.register(source);
    }

    public Reporter getReporter() {
        return reporter;
    }

    public void setReporter(Reporter reporter) {
        this.reporter = reporter == null ? NoopReporter.INSTANCE : reporter;
    }

    /**
     * Restarts the live state with {@code patterns}, or with the current ones when
     * {@code null}. The first call also wraps the default diagnostic hooks.
     */
    public Map<String, Replacement> init(PatternSet patterns) {
        return init(patterns, DiagnosticHookResolver.DEFAULT_HOOKS);
    }

    /** Like {@link #init(PatternSet)}, with the hooks to wrap on the first call given explicitly. */
    public Map<String, Replacement> init(PatternSet patterns, Collection<String> firstTimeHooks) {
        Map<String, Replacement> view = live.init(patterns);
        if (!defaultsApplied) {
            defaultsApplied = true;
            live.addHooks(firstTimeHooks);
        }
        return view;
    }

    /** Unwraps everything the live state installed and switches it off. */
    public void shutdown() {
        live.stop();
        log.debug("scrub4j: shut down, {} hook(s) and {} method(s) unwrapped",
                live.hooks().size(), live.methods().size());
    }

    /** Switches the live state on or off without touching its patterns. */
    public void toggle(boolean on) {
        if (on) live.start();
        else live.stop();
    }

    /**
     * Saves the live configuration and makes a modified copy of it live. If applying the
     * request fails, the saved configuration is put back before the exception propagates.
     */
    public ScrubberScope enter(ScopeRequest request) {
        Objects.requireNonNull(request, "request");
        request.validate();
        live = live.snapshot();
        try {
            request.applyTo(live);
        } catch (RuntimeException e) {
            restore();
            throw e;
        }
        return new ScrubberScope(this, depth());
    }

    public <T> T withScope(ScopeRequest request, Supplier<T> body) {
        try (ScrubberScope ignored = enter(request)) {
            return body.get();
        }
    }

    public void withScope(ScopeRequest request, Runnable body) {
        try (ScrubberScope ignored = enter(request)) {
            body.run();
        }
    }

    /**
     * Leaves the innermost scope: unwraps what it installed and makes a fresh copy of the
     * enclosing configuration live, wrapping its hooks again if it was enabled.
     */
    public void restore() {
        ScrubberState child = live;
        ScrubberState parent =
                child.parent().orElseThrow(() -> new ScopeMisuseException("No scope to restore"));
        try {
            child.stop();
        } finally {
            ScrubberState restored = parent.copy();
            live = restored;
            if (restored.isEnabled()) restored.start();
        }
    }

    /** Number of open scopes. */
    public int depth() {
        int d = 0;
        for (var s = live.parent(); s.isPresent(); s = s.get().parent()) d++;
        return d;
    }

    void restoreTo(int targetDepth) {
        int d = depth();
        if (d <= targetDepth) {
            log.warn("scrub4j: scope at depth {} closed after an outer scope; nothing to restore", targetDepth + 1);
            return;
        }
        while (d-- > targetDepth) restore();
    }
}

/*
 * Copyright (c) 2025 Scrub4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrub4j.core.hook;

import io.scrub4j.core.api.EmissionHandler;
import io.scrub4j.core.api.HookPoint;
import io.scrub4j.core.redact.Redactor;

/**
 * Base for points whose handler is an {@link EmissionHandler}. The wrapper redacts the
 * arguments first, then calls the original handler or, if there was none, {@link #fallback}.
 */
public abstract class EmissionHookPoint implements HookPoint<EmissionHandler> {

    private final String id;

    protected EmissionHookPoint(String id) {
        this.id = id;
    }

    @Override
    public final String id() {
        return id;
    }

    /** Platform default used when nothing was installed before us. */
    protected abstract void fallback(Object... args);

    @Override
    public EmissionHandler wrap(EmissionHandler original, Redactor redactor) {
        return new RedactingHandler(original, redactor, this);
    }

    /** Strips every redacting layer off {@code handler}; {@code null} when none was underneath. */
    public static EmissionHandler unwrap(EmissionHandler handler) {
        EmissionHandler h = handler;
        while (h instanceof RedactingHandler r) h = r.original;
        return h;
    }

    /** The wrapper this point installs. */
    static final class RedactingHandler implements EmissionHandler {
        private final EmissionHandler original;
        private final Redactor redactor;
        private final EmissionHookPoint point;

        RedactingHandler(EmissionHandler original, Redactor redactor, EmissionHookPoint point) {
            this.original = original;
            this.redactor = redactor;
            this.point = point;
        }

        @Override
        public void handle(Object... args) {
            Object[] clean = redactor.redactArgs(args);
            if (original != null) original.handle(clean);
            else point.fallback(clean);
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + id + "]";
    }
}

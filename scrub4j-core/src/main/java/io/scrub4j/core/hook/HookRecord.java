/*
 * Copyright (c) 2025 Scrub4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrub4j.core.hook;

import io.scrub4j.core.api.HookPoint;
import io.scrub4j.core.api.model.ConflictReport;
import io.scrub4j.core.redact.Redactor;
import java.util.Objects;

/**
 * One tracked hook: the handler that was live before we wrapped it ({@code old}) and the
 * wrapper we installed. Both are {@code null} while the hook is not wrapped.
 */
public final class HookRecord<H> {

    public enum Outcome {
        INSTALLED,
        ALREADY_INSTALLED,
        RESTORED,
        NOT_INSTALLED,
        CONFLICT
    }

    private final HookPoint<H> point;
    private H old;
    private H wrapper;

    public HookRecord(HookPoint<H> point) {
        this.point = Objects.requireNonNull(point, "point");
    }

    private HookRecord(HookRecord<H> src) {
        this.point = src.point;
        this.old = src.old;
        this.wrapper = src.wrapper;
    }

    public String id() {
        return point.id();
    }

    public HookPoint<H> point() {
        return point;
    }

    public H old() {
        return old;
    }

    public H wrapper() {
        return wrapper;
    }

    public boolean isInstalled() {
        return wrapper != null && Objects.equals(point.current(), wrapper);
    }

    /** Wraps whatever is live now, unless it already is our wrapper. */
    Outcome enable(Redactor redactor) {
        H live = point.current();
        if (wrapper != null && Objects.equals(live, wrapper)) return Outcome.ALREADY_INSTALLED;
        H built = point.wrap(live, redactor);
        point.install(built);
        old = live;
        wrapper = built;
        return Outcome.INSTALLED;
    }

    /** Puts {@code old} back, but only if our wrapper is still the live handler. */
    Outcome disable(ConflictListener conflicts) {
        if (wrapper == null) return Outcome.NOT_INSTALLED;
        H live = point.current();
        if (!Objects.equals(live, wrapper)) {
            conflicts.onConflict(new ConflictReport(id(), wrapper, live));
            return Outcome.CONFLICT;
        }
        point.install(old);
        old = null;
        wrapper = null;
        return Outcome.RESTORED;
    }

    HookRecord<H> copy() {
        return new HookRecord<>(this);
    }

    @Override
    public String toString() {
        return "HookRecord[" + id() + (wrapper != null ? ", wrapped" : "") + "]";
    }
}

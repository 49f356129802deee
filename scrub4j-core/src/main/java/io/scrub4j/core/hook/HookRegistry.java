/*
 * Copyright (c) 2025 Scrub4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrub4j.core.hook;

import io.scrub4j.core.api.HookPoint;
import io.scrub4j.core.api.HookResolver;
import io.scrub4j.core.api.error.ScrubberException;
import io.scrub4j.core.redact.Redactor;
import java.util.*;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;

/**
 * Tracks the hooks we wrap, keyed by identifier.
 *
 * <ul>
 *   <li>{@link #add}: start tracking and enable. No-op if already tracked.</li>
 *   <li>{@link #enable}: install the wrapper. No-op while the owner is disabled, or when
 *       our wrapper is already live.</li>
 *   <li>{@link #disable}: restore the previous handler if our wrapper is still live;
 *       otherwise report a conflict and leave the foreign handler alone.</li>
 *   <li>{@link #remove}: disable, then stop tracking.</li>
 * </ul>
 *
 * <p>Bulk variants visit every identifier even if some fail. Entries that succeeded stay
 * applied; the first failure is rethrown at the end with the others attached as
 * suppressed exceptions.
 *
 * <p>Not thread-safe.
 */
@Slf4j
public final class HookRegistry {

    private final String kind;
    private final HookResolver resolver;
    private final Redactor redactor;
    private final ConflictListener conflicts;
    private final BooleanSupplier enabled;
    private final Map<String, HookRecord<?>> records = new LinkedHashMap<>();

    /**
     * @param kind      "hook" or "method", used in log lines only
     * @param resolver  turns identifiers into hook points
     * @param redactor  handed to every wrapper we build
     * @param conflicts where takeover conflicts are reported
     * @param enabled   global switch of the owning state
     */
    public HookRegistry(
            String kind,
            HookResolver resolver,
            Redactor redactor,
            ConflictListener conflicts,
            BooleanSupplier enabled) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.redactor = Objects.requireNonNull(redactor, "redactor");
        this.conflicts = Objects.requireNonNull(conflicts, "conflicts");
        this.enabled = Objects.requireNonNull(enabled, "enabled");
    }

    public void add(String id) {
        if (records.containsKey(id)) return;
        HookPoint<?> point = resolver.resolve(id); // MissingTargetException leaves us untouched
        records.put(id, newRecord(point));
        try {
            enable(id);
        } catch (ScrubberException e) {
            records.remove(id);
            throw e;
        }
    }

    /** A failure while building or installing the wrapper surfaces as {@link ScrubberException}. */
    public HookRecord.Outcome enable(String id) {
        HookRecord<?> r = records.get(id);
        if (r == null || !enabled.getAsBoolean()) return HookRecord.Outcome.NOT_INSTALLED;
        HookRecord.Outcome outcome;
        try {
            outcome = r.enable(redactor);
        } catch (ScrubberException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ScrubberException("scrub4j: cannot wrap " + kind + " '" + id + "'", e);
        }
        if (outcome == HookRecord.Outcome.INSTALLED) log.debug("scrub4j: wrapped {} '{}'", kind, id);
        return outcome;
    }

    public HookRecord.Outcome disable(String id) {
        HookRecord<?> r = records.get(id);
        if (r == null) return HookRecord.Outcome.NOT_INSTALLED;
        HookRecord.Outcome outcome = r.disable(conflicts);
        if (outcome == HookRecord.Outcome.RESTORED) log.debug("scrub4j: restored {} '{}'", kind, id);
        return outcome;
    }

    public void remove(String id) {
        if (!records.containsKey(id)) return;
        disable(id);
        records.remove(id);
    }

    public void addAll(Collection<String> ids) {
        forEachCollecting(ids, this::add);
    }

    public void removeAll(Collection<String> ids) {
        forEachCollecting(ids, this::remove);
    }

    public void enableAll() {
        forEachCollecting(ids(), this::enable);
    }

    public void disableAll() {
        forEachCollecting(ids(), this::disable);
    }

    public boolean isTracked(String id) {
        return records.containsKey(id);
    }

    /** Tracked identifiers in registration order. */
    public List<String> ids() {
        return List.copyOf(records.keySet());
    }

    public Optional<HookRecord<?>> record(String id) {
        return Optional.ofNullable(records.get(id));
    }

    public int size() {
        return records.size();
    }

    /** Copies every record by value into a registry bound to another owner's switch. */
    public HookRegistry copy(BooleanSupplier enabledOfCopy) {
        HookRegistry copy = new HookRegistry(kind, resolver, redactor, conflicts, enabledOfCopy);
        records.forEach((id, r) -> copy.records.put(id, r.copy()));
        return copy;
    }

    private static <H> HookRecord<H> newRecord(HookPoint<H> point) {
        return new HookRecord<>(point);
    }

    private static void forEachCollecting(Collection<String> ids, Consumer<String> op) {
        if (ids == null || ids.isEmpty()) return;
        ScrubberException first = null;
        for (String id : List.copyOf(ids)) {
            try {
                op.accept(id);
            } catch (ScrubberException e) {
                if (first == null) first = e;
                else first.addSuppressed(e);
            }
        }
        if (first != null) throw first;
    }
}

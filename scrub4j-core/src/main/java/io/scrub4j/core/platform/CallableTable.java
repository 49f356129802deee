/*
 * Copyright (c) 2025 Scrub4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrub4j.core.platform;

import io.scrub4j.core.api.EmissionHandler;
import io.scrub4j.core.api.HookPoint;
import io.scrub4j.core.api.HookResolver;
import io.scrub4j.core.api.error.MissingTargetException;
import io.scrub4j.core.redact.Redactor;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Named, replaceable callables, keyed {@code Source::name}. Library entry points such as
 * {@link Carp#croak} dispatch through this table, so replacing an entry intercepts every
 * caller without touching call sites.
 */
public final class CallableTable implements HookResolver {

    public static final String SEPARATOR = "::";

    private static final CallableTable GLOBAL = createWithBuiltIns();

    private final Map<String, EmissionHandler> slots = new ConcurrentHashMap<>();

    public static CallableTable global() {
        return GLOBAL;
    }

    /** A table holding the built-in {@link Carp} and {@link Syslog} callables. */
    public static CallableTable createWithBuiltIns() {
        CallableTable t = new CallableTable();
        Carp.defineIn(t);
        Syslog.defineIn(t);
        return t;
    }

    /** Defines (or redefines) a callable. */
    public void define(String id, EmissionHandler impl) {
        requireQualified(id);
        slots.put(id, Objects.requireNonNull(impl, "impl"));
    }

    public boolean isDefined(String id) {
        return id != null && slots.containsKey(id);
    }

    public EmissionHandler lookup(String id) {
        return id == null ? null : slots.get(id);
    }

    /** Replaces a defined callable; unknown names are rejected. */
    public void replace(String id, EmissionHandler impl) {
        Objects.requireNonNull(impl, "impl");
        if (slots.replace(id, impl) == null) throw new MissingTargetException(id);
    }

    public void invoke(String id, Object... args) {
        EmissionHandler h = lookup(id);
        if (h == null) throw new MissingTargetException(id);
        h.handle(args);
    }

    /** Every defined id, sorted. */
    public SortedSet<String> ids() {
        return new TreeSet<>(slots.keySet());
    }

    /** Ids defined under {@code source}, i.e. starting with {@code source + "::"}. */
    public SortedSet<String> idsIn(String source) {
        String prefix = source + SEPARATOR;
        SortedSet<String> out = new TreeSet<>();
        for (String id : slots.keySet()) if (id.startsWith(prefix)) out.add(id);
        return out;
    }

    /** Distinct source names present in the table. */
    public SortedSet<String> sources() {
        SortedSet<String> out = new TreeSet<>();
        for (String id : slots.keySet()) out.add(id.substring(0, id.lastIndexOf(SEPARATOR)));
        return out;
    }

    @Override
    public Optional<HookPoint<?>> find(String id) {
        if (!isDefined(id)) return Optional.empty();
        return Optional.of(new CallableHookPoint(id));
    }

    private static void requireQualified(String id) {
        Objects.requireNonNull(id, "id");
        int sep = id.lastIndexOf(SEPARATOR);
        if (sep <= 0 || sep + SEPARATOR.length() >= id.length()) {
            throw new IllegalArgumentException("Callable id must look like Source::name, got: " + id);
        }
    }

    private final class CallableHookPoint implements HookPoint<EmissionHandler> {
        private final String id;

        CallableHookPoint(String id) {
            this.id = id;
        }

        @Override
        public String id() {
            return id;
        }

        @Override
        public EmissionHandler current() {
            return lookup(id);
        }

        @Override
        public void install(EmissionHandler handler) {
            if (handler == null) throw new IllegalStateException("Callable '" + id + "' cannot be unset");
            replace(id, handler);
        }

        @Override
        public EmissionHandler wrap(EmissionHandler original, Redactor redactor) {
            if (original == null) throw new MissingTargetException(id);
            return args -> original.handle(redactor.redactArgs(args));
        }
    }
}

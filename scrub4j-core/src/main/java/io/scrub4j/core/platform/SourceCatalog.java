/*
 * Copyright (c) 2025 Scrub4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrub4j.core.platform;

import io.scrub4j.core.api.HookSource;
import io.scrub4j.core.api.error.MissingTargetException;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Looks up sources by name. Explicitly registered sources win; otherwise any prefix of the
 * {@link CallableTable} (e.g. {@code Carp}) is a source made of its callables.
 */
public final class SourceCatalog {

    private final CallableTable callables;
    private final Map<String, HookSource> registered = new ConcurrentHashMap<>();

    public SourceCatalog(CallableTable callables) {
        this.callables = Objects.requireNonNull(callables, "callables");
    }

    public void register(HookSource source) {
        Objects.requireNonNull(source, "source");
        registered.put(source.name(), source);
    }

    public HookSource resolve(String name) {
        HookSource s = registered.get(name);
        if (s != null) return s;
        if (name != null && !callables.idsIn(name).isEmpty()) return new CallableSource(name);
        throw new MissingTargetException(name);
    }

    public SortedSet<String> names() {
        SortedSet<String> out = new TreeSet<>(callables.sources());
        out.addAll(registered.keySet());
        return out;
    }

    /** Enumerates the table lazily, so callables defined later are picked up. */
    private final class CallableSource implements HookSource {
        private final String name;

        CallableSource(String name) {
            this.name = name;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public Set<String> ids() {
            return callables.idsIn(name);
        }
    }
}

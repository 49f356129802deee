/*
 * Copyright (c) 2025 Scrub4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrub4j.core.hook;

import io.scrub4j.core.api.HookPoint;
import io.scrub4j.core.api.HookResolver;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/** Asks each delegate in registration order; the first match wins. */
public final class CompositeHookResolver implements HookResolver {

    private final CopyOnWriteArrayList<HookResolver> delegates = new CopyOnWriteArrayList<>();

    public CompositeHookResolver(HookResolver... initial) {
        for (HookResolver r : initial) register(r);
    }

    /** Idempotent per instance. */
    public void register(HookResolver resolver) {
        if (resolver != null) delegates.addIfAbsent(resolver);
    }

    @Override
    public Optional<HookPoint<?>> find(String id) {
        if (id == null) return Optional.empty();
        for (HookResolver r : delegates) {
            Optional<HookPoint<?>> p = r.find(id);
            if (p.isPresent()) return p;
        }
        return Optional.empty();
    }
}

/*
 * Copyright (c) 2025 Scrub4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrub4j.core.api;

import java.util.Set;

/** A named group of interceptable points that can be registered in one go. */
public interface HookSource {

    String name();

    /** Identifiers currently belonging to this source. */
    Set<String> ids();

    /**
     * Whether {@link #ids()} are named callables (tracked as methods) rather than
     * signal-style hooks.
     */
    default boolean namedCallables() {
        return true;
    }
}

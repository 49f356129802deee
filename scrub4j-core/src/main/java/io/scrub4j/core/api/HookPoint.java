/*
 * Copyright (c) 2025 Scrub4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrub4j.core.api;

import io.scrub4j.core.redact.Redactor;

/**
 * A single interceptable emission point, as exposed by a platform adapter.
 *
 * <p>The registry only ever reads the live handler, installs a handler, and asks the
 * point to build a redacting wrapper around whatever was live before. Two handlers are
 * considered the same when {@link Object#equals} says so.
 *
 * @param <H> the handler type of this point (a callable, a handler chain, ...)
 */
public interface HookPoint<H> {

    String id();

    /** The live handler, or {@code null} when unset. */
    H current();

    /** Make {@code handler} live; {@code null} unsets the point. */
    void install(H handler);

    /**
     * Build a handler that redacts its input with {@code redactor} and then delegates to
     * {@code original}, or to the platform default when {@code original} is {@code null}.
     * Every call must return a new instance.
     */
    H wrap(H original, Redactor redactor);
}

/*
 * Copyright (c) 2025 Scrub4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrub4j.core.api;

import io.scrub4j.core.api.error.MissingTargetException;
import java.util.Optional;

/** Turns a hook identifier into the capability object that controls it. */
public interface HookResolver {

    Optional<HookPoint<?>> find(String id);

    default HookPoint<?> resolve(String id) {
        return find(id).orElseThrow(() -> new MissingTargetException(id));
    }
}

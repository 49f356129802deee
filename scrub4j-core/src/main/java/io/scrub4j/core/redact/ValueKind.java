/*
 * Copyright (c) 2025 Scrub4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrub4j.core.redact;

import java.util.List;
import java.util.Map;

/** How the redactor treats a value. */
public enum ValueKind {
    SCALAR,
    SEQUENCE,
    MAPPING,
    OPAQUE;

    public static ValueKind of(Object value) {
        if (value instanceof CharSequence
                || value instanceof Number
                || value instanceof Boolean
                || value instanceof Character
                || value instanceof Enum<?>) return SCALAR;
        if (value instanceof List<?> || value instanceof Object[]) return SEQUENCE;
        if (value instanceof Map<?, ?>) return MAPPING;
        return OPAQUE; // includes null and primitive arrays
    }
}

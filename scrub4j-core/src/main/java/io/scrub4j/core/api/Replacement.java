/*
 * Copyright (c) 2025 Scrub4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrub4j.core.api;

import java.util.Objects;

/**
 * Replacement for a matched pattern. A transform receives the pattern text and the
 * text it is being applied to, and returns the new text.
 */
@FunctionalInterface
public interface Replacement {

    String replace(String pattern, String value);

    static Replacement literal(String text) {
        return new Literal(text);
    }

    /** Fixed replacement text, inserted verbatim for every match (no group references). */
    record Literal(String text) implements Replacement {
        public Literal {
            Objects.requireNonNull(text, "text");
        }

        @Override
        public String replace(String pattern, String value) {
            return text;
        }
    }
}

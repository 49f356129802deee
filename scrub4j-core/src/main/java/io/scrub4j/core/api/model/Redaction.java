/*
 * Copyright (c) 2025 Scrub4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrub4j.core.api.model;

/**
 * One pattern that fired during a redact call and how many matches it rewrote.
 *
 * <p>The pattern is named by its position in the set it came from, never by its text: a
 * pattern is often the secret itself.
 */
public record Redaction(int patternIndex, int count) {}

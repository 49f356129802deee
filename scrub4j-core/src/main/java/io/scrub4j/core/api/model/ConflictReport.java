/*
 * Copyright (c) 2025 Scrub4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrub4j.core.api.model;

/** A hook whose live handler was replaced by someone else while we had it wrapped. */
public record ConflictReport(String id, Object expected, Object found) {}

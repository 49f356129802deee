/*
 * Copyright (c) 2025 Scrub4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrub4j.core.pattern;

import io.scrub4j.core.api.Replacement;
import io.scrub4j.core.api.error.InvalidPatternException;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Mapping of regular expression to {@link Replacement}.
 *
 * <p>Patterns are compiled on insertion and applied in insertion order. Patterns are
 * expected not to overlap; when they do, which one wins is unspecified.
 *
 * <p>Not thread-safe. Mutate it only while holding whatever lock guards the live
 * configuration.
 */
public final class PatternSet {

    private final Map<String, Entry> entries = new LinkedHashMap<>();

    public PatternSet() {}

    public static PatternSet empty() {
        return new PatternSet();
    }

    /** Literal replacements keyed by pattern. */
    public static PatternSet ofLiterals(Map<String, String> literals) {
        PatternSet set = new PatternSet();
        if (literals != null) literals.forEach((p, r) -> set.put(p, Replacement.literal(r)));
        return set;
    }

    public static PatternSet of(Map<String, ? extends Replacement> patterns) {
        PatternSet set = new PatternSet();
        set.putAll(patterns);
        return set;
    }

    public PatternSet put(String pattern, String literal) {
        return put(pattern, Replacement.literal(literal));
    }

    public PatternSet put(String pattern, Replacement replacement) {
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(replacement, "replacement");
        entries.put(pattern, new Entry(pattern, compile(pattern), replacement));
        return this;
    }

    /** All-or-nothing: if any pattern fails to compile, nothing is added. */
    public PatternSet putAll(Map<String, ? extends Replacement> patterns) {
        if (patterns == null || patterns.isEmpty()) return this;
        Map<String, Entry> staged = new LinkedHashMap<>();
        for (var e : patterns.entrySet()) {
            String p = Objects.requireNonNull(e.getKey(), "pattern");
            Replacement r = Objects.requireNonNull(e.getValue(), "replacement for " + p);
            staged.put(p, new Entry(p, compile(p), r));
        }
        entries.putAll(staged);
        return this;
    }

    public PatternSet putAll(PatternSet other) {
        if (other != null) entries.putAll(other.entries);
        return this;
    }

    public boolean remove(String pattern) {
        return entries.remove(pattern) != null;
    }

    public int removeAll(Collection<String> patterns) {
        int removed = 0;
        if (patterns != null) for (String p : patterns) if (remove(p)) removed++;
        return removed;
    }

    public boolean contains(String pattern) {
        return entries.containsKey(pattern);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public PatternSet copy() {
        PatternSet copy = new PatternSet();
        copy.entries.putAll(entries);
        return copy;
    }

    /** Read-only view, pattern to replacement, in application order. */
    public Map<String, Replacement> asMap() {
        Map<String, Replacement> out = new LinkedHashMap<>();
        entries.forEach((p, e) -> out.put(p, e.replacement()));
        return Collections.unmodifiableMap(out);
    }

    /** Compiled entries in application order. */
    public List<Entry> entries() {
        return List.copyOf(entries.values());
    }

    private static Pattern compile(String pattern) {
        try {
            return Pattern.compile(pattern);
        } catch (PatternSyntaxException e) {
            throw new InvalidPatternException(pattern, e);
        }
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof PatternSet other && entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "PatternSet" + entries.keySet();
    }

    /**
     * A compiled pattern and its replacement.
     *
     * <p>Literal replacements substitute every non-overlapping match. Transform
     * replacements are called once with the pattern and the whole current text, and only
     * when the pattern matches somewhere in it; their result becomes the new text.
     */
    public record Entry(String pattern, Pattern compiled, Replacement replacement) {

        /** @return the rewritten text, or {@code null} when the pattern does not match */
        public Applied apply(String text) {
            Matcher m = compiled.matcher(text);
            if (!m.find()) return null;
            if (!(replacement instanceof Replacement.Literal literal)) {
                String out = replacement.replace(pattern, text);
                return new Applied(out == null ? "" : out, 1);
            }
            String quoted = Matcher.quoteReplacement(literal.text());
            StringBuilder sb = new StringBuilder(text.length() + 16);
            int count = 0;
            do {
                m.appendReplacement(sb, quoted);
                count++;
            } while (m.find());
            m.appendTail(sb);
            return new Applied(sb.toString(), count);
        }

        // Pattern has identity equals; compare on the source text instead.
        @Override
        public boolean equals(Object o) {
            return o instanceof Entry e && pattern.equals(e.pattern) && replacement.equals(e.replacement);
        }

        @Override
        public int hashCode() {
            return Objects.hash(pattern, replacement);
        }
    }

    public record Applied(String text, int matches) {}
}

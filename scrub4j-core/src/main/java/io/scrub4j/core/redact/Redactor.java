/*
 * Copyright (c) 2025 Scrub4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrub4j.core.redact;

import io.scrub4j.core.api.model.Redaction;
import io.scrub4j.core.pattern.PatternSet;
import io.scrub4j.core.report.NoopReporter;
import io.scrub4j.core.report.Reporter;
import java.util.*;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Rewrites every match of the live {@link PatternSet} inside arbitrary values.
 *
 * <p>Scalars ({@link ValueKind#SCALAR}) are matched on their text form and come back as
 * {@code String} when anything matched; an unmatched scalar is returned as the same
 * object. Lists, object arrays and maps are rewritten in place, recursively. Map keys go
 * through the same pipeline, and an entry whose key changes is moved to the new key
 * (a collision with an existing key overwrites it). Lists and maps that refuse in-place
 * mutation are replaced by a mutable copy. Anything else is passed through untouched.
 *
 * <p>A composite reached twice within one call (shared or cyclic) is only rewritten the
 * first time and returned as-is afterwards.
 *
 * <p>The pattern set is looked up on every call, so a redactor handed to an installed
 * wrapper always sees the current configuration.
 *
 * <p>After each call that matched anything, the reporter receives one {@link Redaction} per
 * pattern that fired, identified by its index in {@link PatternSet#entries()}.
 */
@Slf4j
public final class Redactor {

    private final Supplier<PatternSet> patterns;
    private final Supplier<? extends Reporter> reporter;

    public Redactor(PatternSet patterns) {
        this(() -> patterns, () -> NoopReporter.INSTANCE);
    }

    public Redactor(Supplier<PatternSet> patterns, Supplier<? extends Reporter> reporter) {
        this.patterns = Objects.requireNonNull(patterns, "patterns");
        this.reporter = Objects.requireNonNull(reporter, "reporter");
    }

    /** Redacts each argument; the result has the same length and order. */
    public List<Object> redact(Object... values) {
        if (values == null || values.length == 0) return new ArrayList<>();
        PatternSet set = patterns.get();
        if (set == null || set.isEmpty()) return new ArrayList<>(Arrays.asList(values));

        Pass pass = new Pass(set.entries());
        List<Object> out = new ArrayList<>(values.length);
        for (Object v : values) out.add(pass.visit(v));
        pass.report();
        return out;
    }

    /** Same as {@link #redact(Object...)} but returns an array, for passing on as varargs. */
    public Object[] redactArgs(Object... values) {
        return redact(values).toArray();
    }

    public Object redactValue(Object value) {
        return redact(value).get(0);
    }

    public String redactText(String text) {
        if (text == null || text.isEmpty()) return text;
        return String.valueOf(redactValue(text));
    }

    private void publish(Map<Integer, Integer> counts) {
        if (counts.isEmpty()) return;
        List<Redaction> list = new ArrayList<>(counts.size());
        counts.forEach((index, n) -> list.add(new Redaction(index, n)));
        try {
            reporter.get().report(List.copyOf(list));
        } catch (RuntimeException e) {
            // a broken reporter must never stop the diagnostic from going out
            log.debug("scrub4j reporter failed", e);
        }
    }

    /** State of one top-level redact call. */
    private final class Pass {
        private final List<PatternSet.Entry> entries;
        private final Set<Object> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        private final Map<Integer, Integer> counts = new TreeMap<>();

        Pass(List<PatternSet.Entry> entries) {
            this.entries = entries;
        }

        Object visit(Object v) {
            return switch (ValueKind.of(v)) {
                case SCALAR -> scalar(v);
                case SEQUENCE -> visited.add(v) ? sequence(v) : v;
                case MAPPING -> visited.add(v) ? mapping((Map<?, ?>) v) : v;
                case OPAQUE -> v;
            };
        }

        Object scalar(Object v) {
            String text = String.valueOf(v);
            boolean changed = false;
            for (int i = 0; i < entries.size(); i++) {
                PatternSet.Applied r = entries.get(i).apply(text);
                if (r == null) continue;
                counts.merge(i, r.matches(), Integer::sum);
                changed |= !r.text().equals(text);
                text = r.text();
            }
            return changed ? text : v;
        }

        Object sequence(Object v) {
            if (v instanceof Object[] arr) {
                for (int i = 0; i < arr.length; i++) arr[i] = visit(arr[i]);
                return arr;
            }
            @SuppressWarnings("unchecked")
            List<Object> list = (List<Object>) v;
            Object[] redacted = new Object[list.size()];
            boolean changed = false;
            int i = 0;
            for (Object element : list) {
                redacted[i] = visit(element);
                changed |= redacted[i] != element;
                i++;
            }
            if (!changed) return list;
            try {
                for (int j = 0; j < redacted.length; j++) {
                    if (list.get(j) != redacted[j]) list.set(j, redacted[j]);
                }
                return list;
            } catch (UnsupportedOperationException immutable) {
                return new ArrayList<>(Arrays.asList(redacted));
            }
        }

        Object mapping(Map<?, ?> v) {
            @SuppressWarnings("unchecked")
            Map<Object, Object> map = (Map<Object, Object>) v;
            List<Object[]> rewrites = new ArrayList<>();
            for (var e : new ArrayList<>(map.entrySet())) {
                Object key = e.getKey();
                Object value = e.getValue();
                Object newKey = ValueKind.of(key) == ValueKind.SCALAR ? scalar(key) : key;
                Object newValue = visit(value);
                if (newKey != key || newValue != value) rewrites.add(new Object[] {key, newKey, newValue});
            }
            if (rewrites.isEmpty()) return map;
            try {
                applyTo(map, rewrites);
                return map;
            } catch (UnsupportedOperationException immutable) {
                Map<Object, Object> copy = new LinkedHashMap<>(map);
                applyTo(copy, rewrites);
                return copy;
            }
        }

        /** Old keys go first, so a key moved onto another rewritten key survives. */
        private void applyTo(Map<Object, Object> map, List<Object[]> rewrites) {
            for (Object[] r : rewrites) {
                if (r[0] != r[1]) map.remove(r[0]);
            }
            for (Object[] r : rewrites) map.put(r[1], r[2]);
        }

        void report() {
            publish(counts);
        }
    }
}

/*
 * Copyright (c) 2025 Scrub4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrub4j.logs.logback;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.classic.spi.ThrowableProxyUtil;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.AppenderBase;
import io.scrub4j.core.redact.Redactor;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.event.KeyValuePair;

/**
 * # ScrubbingAppender (Logback)
 *
 * Wraps a real Logback {@link Appender} and redacts, before forwarding:
 * - the formatted message,
 * - MDC values and keys (an MDC entry whose key matches moves to the redacted key),
 * - key/value pairs attached through the SLF4J fluent API,
 * - the throwable: if its rendering contains a match, the redacted rendering is appended
 *   to the message and the raw throwable is dropped, so Logback cannot print it unmasked.
 *
 * If nothing matched, the original event is forwarded as-is.
 *
 * ## Recursion safety
 * Events from the {@code scrub4j.} logger namespace are not processed and go straight to
 * the delegate, so conflict reports can never loop back through a wrapper.
 *
 * The wrapper never starts or stops the delegate: it belongs to the application's config.
 */
public final class ScrubbingAppender extends AppenderBase<ILoggingEvent> {

    /** Name prefix of wrapper appenders. */
    public static final String NAME_PREFIX = "SCRUB4J_WRAPPER_";

    private final Appender<ILoggingEvent> delegate;
    private final Redactor redactor;

    public ScrubbingAppender(Appender<ILoggingEvent> delegate, Redactor redactor) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.redactor = Objects.requireNonNull(redactor, "redactor");
        setName(NAME_PREFIX + delegate.getName());
    }

    public Appender<ILoggingEvent> getDelegate() {
        return delegate;
    }

    @Override
    public void start() {
        // Mirror delegate context so both live in the same Logback context.
        if (getContext() == null && delegate.getContext() != null) {
            setContext(delegate.getContext());
        }
        super.start();
    }

    @Override
    protected void append(ILoggingEvent event) {
        if (isInternalLogger(event.getLoggerName())) {
            delegate.doAppend(event);
            return;
        }

        final String originalMsg = event.getFormattedMessage();
        String outMsg = redactor.redactText(originalMsg);

        final Map<String, String> originalMdc = event.getMDCPropertyMap();
        final Map<String, String> maskedMdc = redactMdc(originalMdc);

        final List<KeyValuePair> originalKvs = event.getKeyValuePairs();
        final List<KeyValuePair> maskedKvs = redactKeyValuePairs(originalKvs);

        IThrowableProxy toForwardThrowable = event.getThrowableProxy();
        if (toForwardThrowable != null) {
            String raw = ThrowableProxyUtil.asString(toForwardThrowable).stripTrailing();
            String clean = redactor.redactText(raw);
            if (!clean.equals(raw)) {
                outMsg = (outMsg == null || outMsg.isEmpty()) ? clean : (outMsg + "\n" + clean);
                toForwardThrowable = null; // prevent raw, unmasked stack printing by Logback
            }
        }

        final boolean anyChange = !Objects.equals(originalMsg, outMsg)
                || maskedMdc != originalMdc
                || maskedKvs != originalKvs
                || toForwardThrowable != event.getThrowableProxy();

        // Zero-overhead path
        if (!anyChange) {
            delegate.doAppend(event);
            return;
        }

        delegate.doAppend(new ScrubbedLoggingEvent(event, outMsg, maskedMdc, maskedKvs, toForwardThrowable));
    }

    /** @return {@code mdc} itself when nothing matched, else a redacted copy */
    private Map<String, String> redactMdc(Map<String, String> mdc) {
        if (mdc == null || mdc.isEmpty()) return mdc;
        Map<Object, Object> copy = new LinkedHashMap<>(mdc);
        redactor.redactValue(copy);
        if (copy.equals(mdc)) return mdc;
        Map<String, String> out = new LinkedHashMap<>(copy.size());
        copy.forEach((k, v) -> out.put(String.valueOf(k), v == null ? null : String.valueOf(v)));
        return out;
    }

    /** @return {@code kvs} itself when nothing matched, else a redacted copy */
    private List<KeyValuePair> redactKeyValuePairs(List<KeyValuePair> kvs) {
        if (kvs == null || kvs.isEmpty()) return kvs;
        List<KeyValuePair> out = new ArrayList<>(kvs.size());
        boolean changed = false;
        for (KeyValuePair kv : kvs) {
            Object key = redactor.redactValue(kv.key);
            Object value = redactor.redactValue(kv.value);
            changed |= key != kv.key || value != kv.value;
            out.add(new KeyValuePair(String.valueOf(key), value));
        }
        return changed ? out : kvs;
    }

    static boolean isInternalLogger(String name) {
        return name != null && name.startsWith("scrub4j.");
    }

    /** Public helper: tells whether an appender is already a scrub4j wrapper. */
    public static boolean isScrubbing(Appender<?> app) {
        return app instanceof ScrubbingAppender;
    }
}

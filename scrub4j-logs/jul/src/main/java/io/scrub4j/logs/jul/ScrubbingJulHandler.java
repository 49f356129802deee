/*
 * Copyright (c) 2025 Scrub4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrub4j.logs.jul;

import io.scrub4j.core.redact.Redactor;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Objects;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.LogRecord;
import java.util.logging.SimpleFormatter;

/**
 * JUL handler that wraps a real Handler and redacts:
 *  - the formatted message (parameters are applied first, then dropped),
 *  - the Throwable: if its rendering contains a match, the redacted rendering is appended
 *    to the message and the raw throwable is dropped.
 *
 * Records from the {@code scrub4j.} logger namespace are forwarded untouched.
 * When nothing matched, the original record is forwarded as-is.
 */
public final class ScrubbingJulHandler extends Handler {

    private static final Formatter MESSAGE_FORMATTER = new SimpleFormatter();

    private final Handler delegate;
    private final Redactor redactor;

    public ScrubbingJulHandler(Handler delegate, Redactor redactor) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.redactor = Objects.requireNonNull(redactor, "redactor");

        // mirror delegate's config; setFormatter and setLevel reject null
        if (delegate.getFormatter() != null) setFormatter(delegate.getFormatter());
        if (delegate.getFilter() != null) setFilter(delegate.getFilter());
        if (delegate.getLevel() != null) setLevel(delegate.getLevel());
    }

    public Handler getDelegate() {
        return delegate;
    }

    @Override
    public void publish(LogRecord record) {
        if (record == null || !isLoggable(record)) return;

        if (isInternalLogger(record.getLoggerName())) {
            delegate.publish(record);
            return;
        }

        final String originalMsg = MESSAGE_FORMATTER.formatMessage(record);
        String outMsg = redactor.redactText(originalMsg);

        String renderedExc = null;
        if (record.getThrown() != null) {
            String raw = render(record.getThrown());
            String clean = redactor.redactText(raw);
            if (!clean.equals(raw)) renderedExc = clean;
        }

        // fast-path
        if (Objects.equals(originalMsg, outMsg) && renderedExc == null) {
            delegate.publish(record);
            return;
        }

        if (renderedExc != null) {
            outMsg = (outMsg == null || outMsg.isEmpty()) ? renderedExc : outMsg + "\n" + renderedExc;
            delegate.publish(copy(record, outMsg, /*drop*/ null));
        } else {
            delegate.publish(copy(record, outMsg, record.getThrown()));
        }
    }

    @Override
    public void flush() {
        delegate.flush();
    }

    /** The wrapped handler belongs to the application; unwrapping must not close it. */
    @Override
    public void close() {
        flush();
    }

    /** Builds a redacted copy: replaces the message, clears parameters, sets the Throwable. */
    private static LogRecord copy(LogRecord src, String newMsg, Throwable newThrown) {
        LogRecord r = new LogRecord(src.getLevel(), newMsg);
        r.setLoggerName(src.getLoggerName());
        r.setInstant(src.getInstant());
        r.setSequenceNumber(src.getSequenceNumber());
        r.setSourceClassName(src.getSourceClassName());
        r.setSourceMethodName(src.getSourceMethodName());
        r.setLongThreadID(src.getLongThreadID());
        r.setParameters(null); // message is already formatted
        r.setThrown(newThrown);
        return r;
    }

    private static String render(Throwable t) {
        StringWriter sw = new StringWriter();
        t.printStackTrace(new PrintWriter(sw));
        return sw.toString().stripTrailing();
    }

    static boolean isInternalLogger(String name) {
        return name != null && name.startsWith("scrub4j.");
    }

    @Override
    public String toString() {
        return "ScrubbingJulHandler[" + delegate + "]";
    }
}

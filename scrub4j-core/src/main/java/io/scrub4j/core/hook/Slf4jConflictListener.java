/*
 * Copyright (c) 2025 Scrub4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrub4j.core.hook;

import io.scrub4j.core.api.model.ConflictReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Reports conflicts as WARN on {@value #LOGGER_NAME}; log wrappers pass that namespace through untouched. */
public final class Slf4jConflictListener implements ConflictListener {

    public static final String LOGGER_NAME = "scrub4j.conflict";

    private static final Logger LOG = LoggerFactory.getLogger(LOGGER_NAME);

    @Override
    public void onConflict(ConflictReport report) {
        LOG.warn(
                "scrub4j: hook '{}' was taken over by another handler; leaving it in place ({} installed, {} found)",
                report.id(),
                describe(report.expected()),
                describe(report.found()));
    }

    private static String describe(Object handler) {
        return handler == null ? "none" : handler.getClass().getName();
    }
}

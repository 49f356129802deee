/*
 * Copyright (c) 2025 Scrub4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrub4j.logs.logback;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.LoggerContextListener;
import ch.qos.logback.core.read.ListAppender;
import io.scrub4j.core.pattern.PatternSet;
import io.scrub4j.core.platform.CallableTable;
import io.scrub4j.core.state.ScrubberContext;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class ScrubberLogbackInstallerTest {

    private static final String NAME = "test.scrub4j.logback.installer";

    private final LoggerContext loggerContext = (LoggerContext) LoggerFactory.getILoggerFactory();
    private final Logger logger = loggerContext.getLogger(NAME);
    private final ListAppender<ILoggingEvent> sink = new ListAppender<>();
    private ScrubberContext context;

    @BeforeEach
    void setUp() {
        sink.setContext(loggerContext);
        sink.start();
        logger.setAdditive(false);
        logger.addAppender(sink);
        context = new ScrubberContext(CallableTable.createWithBuiltIns(), report -> {});
        context.init(PatternSet.ofLiterals(Map.of("4007000000027", "DELETED")), List.of());
    }

    @AfterEach
    void tearDown() {
        context.shutdown();
        logger.detachAndStopAllAppenders();
        loggerContext.getCopyOfListenerList().stream()
                .filter(l -> l instanceof ScrubLoggerContextListener)
                .forEach(loggerContext::removeListener);
    }

    @Test
    void installWrapsSelectedLoggersOnce() {
        ScrubberLogbackInstaller installer = new ScrubberLogbackInstaller(context, loggerContext);

        installer.install(List.of(NAME), List.of());
        installer.install(List.of(NAME), List.of());
        logger.info("card {}", "4007000000027");

        assertThat(context.current().hooks().ids()).containsExactly(LogbackHookResolver.idFor(NAME));
        assertThat(listeners()).hasSize(1);
        assertThat(sink.list).singleElement()
                .satisfies(e -> assertThat(e.getFormattedMessage()).isEqualTo("card DELETED"));
    }

    @Test
    void listenerRewrapsAppendersReplacedByAReset() {
        new ScrubberLogbackInstaller(context, loggerContext).install(List.of(NAME), List.of());
        ListAppender<ILoggingEvent> fresh = new ListAppender<>();
        fresh.setContext(loggerContext);
        fresh.start();
        logger.detachAndStopAllAppenders();
        logger.addAppender(fresh);

        listeners().get(0).onReset(loggerContext);
        logger.info("card {}", "4007000000027");

        assertThat(fresh.list).singleElement()
                .satisfies(e -> assertThat(e.getFormattedMessage()).isEqualTo("card DELETED"));
    }

    @Test
    void listenerLeavesADisabledStateAlone() {
        new ScrubberLogbackInstaller(context, loggerContext).install(List.of(NAME), List.of());
        context.toggle(false);

        listeners().get(0).onReset(loggerContext);
        logger.info("card {}", "4007000000027");

        assertThat(sink.list).singleElement()
                .satisfies(e -> assertThat(e.getFormattedMessage()).isEqualTo("card 4007000000027"));
    }

    private List<LoggerContextListener> listeners() {
        return loggerContext.getCopyOfListenerList().stream()
                .filter(l -> l instanceof ScrubLoggerContextListener)
                .toList();
    }
}

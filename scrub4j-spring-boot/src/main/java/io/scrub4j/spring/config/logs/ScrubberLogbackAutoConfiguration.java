/*
 * Copyright (c) 2025 Scrub4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrub4j.spring.config.logs;

import ch.qos.logback.classic.LoggerContext;
import io.scrub4j.core.state.ScrubberContext;
import io.scrub4j.logs.logback.ScrubberLogbackInstaller;
import io.scrub4j.spring.ScrubberProperties;
import io.scrub4j.spring.config.ScrubberAutoConfiguration;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

@AutoConfiguration(after = ScrubberAutoConfiguration.class)
@ConditionalOnProperty(prefix = "scrub4j.logs", name = "enabled", havingValue = "true")
@ConditionalOnClass(
        name = {"ch.qos.logback.classic.LoggerContext", "io.scrub4j.logs.logback.ScrubberLogbackInstaller"})
public class ScrubberLogbackAutoConfiguration {

    @Bean
    @ConditionalOnBean(ScrubberContext.class)
    public Object scrub4jLogbackInit(ScrubberProperties props, ScrubberContext context) {
        var lf = LoggerFactory.getILoggerFactory();
        if (!(lf instanceof LoggerContext ctx)) return new Object();

        new ScrubberLogbackInstaller(context, ctx)
                .install(props.getLogs().getOnlyLoggers(), props.getLogs().getIgnoreLoggers());
        return new Object();
    }
}

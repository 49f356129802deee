/*
 * Copyright (c) 2025 Scrub4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrub4j.spring.config.logs;

import io.scrub4j.core.state.ScrubberContext;
import io.scrub4j.logs.jul.ScrubberJulInstaller;
import io.scrub4j.spring.ScrubberProperties;
import io.scrub4j.spring.config.ScrubberAutoConfiguration;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

@AutoConfiguration(after = ScrubberAutoConfiguration.class)
@ConditionalOnProperty(prefix = "scrub4j.logs", name = "enabled", havingValue = "true")
@ConditionalOnClass(name = "io.scrub4j.logs.jul.ScrubberJulInstaller")
@ConditionalOnMissingClass({
    "ch.qos.logback.classic.LoggerContext", // exclude Logback
    "org.apache.logging.log4j.core.LoggerContext" // exclude Log4j2 Core
})
public class ScrubberJulAutoConfiguration {

    @Bean
    @ConditionalOnBean(ScrubberContext.class)
    public Object scrub4jJulInit(ScrubberProperties props, ScrubberContext context) {
        new ScrubberJulInstaller(context).install(props.getLogs().getOnlyLoggers());
        return new Object();
    }
}

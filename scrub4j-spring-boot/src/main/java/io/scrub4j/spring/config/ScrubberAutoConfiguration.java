/*
 * Copyright (c) 2025 Scrub4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrub4j.spring.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.scrub4j.core.Scrubber;
import io.scrub4j.core.pattern.PatternSet;
import io.scrub4j.core.report.Reporter;
import io.scrub4j.core.state.ScrubberContext;
import io.scrub4j.spring.MicrometerReporter;
import io.scrub4j.spring.ScrubberEndpoint;
import io.scrub4j.spring.ScrubberProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.autoconfigure.endpoint.condition.ConditionalOnAvailableEndpoint;
import org.springframework.boot.actuate.endpoint.annotation.Endpoint;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.*;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@AutoConfiguration(
        afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@EnableConfigurationProperties(ScrubberProperties.class)
@ConditionalOnProperty(prefix = "scrub4j", name = "enabled", havingValue = "true")
public class ScrubberAutoConfiguration {

    /**
     * The process-wide context, configured from properties. Unwrapped again when the
     * application context closes.
     */
    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    public ScrubberContext scrubberContext(ScrubberProperties props, ObjectProvider<Reporter> reporter) {
        ScrubberContext ctx = Scrubber.context();
        reporter.ifAvailable(ctx::setReporter);
        ctx.init(PatternSet.ofLiterals(props.getPatterns()), props.getHooks());
        ctx.current().addHooks(props.getHooks());
        ctx.current().addMethods(props.getMethods());
        ctx.current().addSources(props.getSources());
        log.info(
                "scrub4j enabled: {} pattern(s), hooks={}, methods={}",
                ctx.current().patterns().size(),
                ctx.current().hooks().ids(),
                ctx.current().methods().ids());
        return ctx;
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(MeterRegistry.class)
    static class MetricsConfiguration {

        @Bean
        @ConditionalOnBean(MeterRegistry.class)
        @ConditionalOnMissingBean(MicrometerReporter.class)
        public MicrometerReporter micrometerReporter(MeterRegistry registry) {
            return new MicrometerReporter(registry, 200);
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(Endpoint.class)
    static class EndpointConfiguration {

        @Bean
        @ConditionalOnAvailableEndpoint(endpoint = ScrubberEndpoint.class)
        public ScrubberEndpoint scrubberEndpoint(ScrubberContext context, ObjectProvider<MicrometerReporter> reporter) {
            return new ScrubberEndpoint(context, reporter.getIfAvailable());
        }
    }
}

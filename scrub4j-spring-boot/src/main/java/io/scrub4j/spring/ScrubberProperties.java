/*
 * Copyright (c) 2025 Scrub4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrub4j.spring;

import io.scrub4j.core.platform.DiagnosticHookResolver;
import java.util.*;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@ConfigurationProperties(prefix = "scrub4j")
public class ScrubberProperties {

    @Setter
    private boolean enabled = false;

    /** Regular expression to literal replacement. */
    private Map<String, String> patterns = new LinkedHashMap<>();

    /** Signal-style hooks to wrap (WARN, DIE, WARNIF, jul:..., logback:...). */
    private List<String> hooks = new ArrayList<>(DiagnosticHookResolver.DEFAULT_HOOKS);

    /** Named callables to wrap, e.g. Carp::croak. */
    private List<String> methods = new ArrayList<>();

    /** Sources whose callables are all wrapped, e.g. Carp, Syslog. */
    private List<String> sources = new ArrayList<>();

    private Logs logs = new Logs();

    public Map<String, String> getPatterns() {
        return Collections.unmodifiableMap(patterns);
    }

    public void setPatterns(Map<String, String> patterns) {
        this.patterns = new LinkedHashMap<>(Objects.requireNonNullElse(patterns, Map.of()));
    }

    public List<String> getHooks() {
        return Collections.unmodifiableList(hooks);
    }

    public void setHooks(List<String> v) {
        this.hooks = new ArrayList<>(Objects.requireNonNullElse(v, List.of()));
    }

    public List<String> getMethods() {
        return Collections.unmodifiableList(methods);
    }

    public void setMethods(List<String> v) {
        this.methods = new ArrayList<>(Objects.requireNonNullElse(v, List.of()));
    }

    public List<String> getSources() {
        return Collections.unmodifiableList(sources);
    }

    public void setSources(List<String> v) {
        this.sources = new ArrayList<>(Objects.requireNonNullElse(v, List.of()));
    }

    public void setLogs(Logs logs) {
        this.logs = (logs == null) ? new Logs() : logs;
    }

    // ---- nested: logs ----
    public static final class Logs {
        @Setter
        @Getter
        private boolean enabled = false;

        private List<String> onlyLoggers = new ArrayList<>();
        private List<String> ignoreLoggers = new ArrayList<>();

        public List<String> getOnlyLoggers() {
            return Collections.unmodifiableList(onlyLoggers);
        }

        public void setOnlyLoggers(List<String> v) {
            this.onlyLoggers = new ArrayList<>(Objects.requireNonNullElse(v, List.of()));
        }

        public List<String> getIgnoreLoggers() {
            return Collections.unmodifiableList(ignoreLoggers);
        }

        public void setIgnoreLoggers(List<String> v) {
            this.ignoreLoggers = new ArrayList<>(Objects.requireNonNullElse(v, List.of()));
        }
    }
}

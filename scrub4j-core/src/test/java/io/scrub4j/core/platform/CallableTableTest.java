/*
 * Copyright (c) 2025 Scrub4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrub4j.core.platform;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.scrub4j.core.api.HookSource;
import io.scrub4j.core.api.error.MissingTargetException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class CallableTableTest {

    private final CallableTable table = CallableTable.createWithBuiltIns();

    @Test
    void builtInsAreGroupedBySource() {
        assertThat(table.sources()).containsExactly("Carp", "Syslog");
        assertThat(table.idsIn("Carp")).containsExactly(Carp.CARP, Carp.CLUCK, Carp.CONFESS, Carp.CROAK);
    }

    @Test
    void defineRequiresQualifiedName() {
        assertThatThrownBy(() -> table.define("carp", args -> {})).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> table.define("Carp::", args -> {})).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void replaceAndInvokeRejectUnknownNames() {
        assertThatThrownBy(() -> table.replace("App::audit", args -> {})).isInstanceOf(MissingTargetException.class);
        assertThatThrownBy(() -> table.invoke("App::audit")).isInstanceOf(MissingTargetException.class);
    }

    @Test
    void invokeDispatchesToCurrentImplementation() {
        List<Object> seen = new ArrayList<>();
        table.define("App::audit", args -> seen.addAll(List.of(args)));

        table.invoke("App::audit", "a", 1);

        assertThat(seen).containsExactly("a", 1);
        assertThat(table.find("App::audit")).isPresent();
        assertThat(table.find("App::missing")).isEmpty();
    }

    @Test
    void catalogPrefersRegisteredSources() {
        SourceCatalog catalog = new SourceCatalog(table);
        catalog.register(new HookSource() {
            @Override
            public String name() {
                return "Carp";
            }

            @Override
            public Set<String> ids() {
                return Set.of(Carp.CARP);
            }
        });

        assertThat(catalog.resolve("Carp").ids()).containsExactly(Carp.CARP);
        assertThat(catalog.resolve("Syslog").ids()).containsExactly(Syslog.SYSLOG);
        assertThat(catalog.names()).contains("Carp", "Syslog");
        assertThatThrownBy(() -> catalog.resolve("Nope")).isInstanceOf(MissingTargetException.class);
    }

    @Test
    void catalogSeesCallablesDefinedLater() {
        SourceCatalog catalog = new SourceCatalog(table);
        HookSource carp = catalog.resolve("Carp");

        table.define("Carp::shout", args -> {});

        assertThat(carp.ids()).contains("Carp::shout");
    }
}

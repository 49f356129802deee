/*
 * Copyright (c) 2025 Scrub4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrub4j.core.platform;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.scrub4j.core.api.EmissionHandler;
import io.scrub4j.core.api.error.FatalDiagnosticException;
import io.scrub4j.core.api.error.MissingTargetException;
import io.scrub4j.core.pattern.PatternSet;
import io.scrub4j.core.state.ScrubberContext;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CarpTest {

    private static final String CARD = "4007000000027";

    private final List<String> warnings = new ArrayList<>();
    private final Map<String, EmissionHandler> builtIns = new HashMap<>();
    private ScrubberContext context;

    @BeforeEach
    void setUp() {
        for (String id : CallableTable.global().idsIn(Carp.SOURCE)) builtIns.put(id, CallableTable.global().lookup(id));
        Diagnostics.setHandler(Diagnostics.WARN, args -> warnings.add(Diagnostics.render(args)));
        context = new ScrubberContext(CallableTable.global(), report -> {});
        context.init(PatternSet.ofLiterals(Map.of(CARD, "DELETED")), List.of());
    }

    @AfterEach
    void tearDown() {
        context.shutdown();
        for (String slot : DiagnosticHookResolver.DEFAULT_HOOKS) Diagnostics.setHandler(slot, null);
    }

    @Test
    void sourceWrapsEveryCallable() {
        context.current().addSources(List.of(Carp.SOURCE));

        assertThat(context.current().methods().ids())
                .containsExactlyInAnyOrder(Carp.CARP, Carp.CLUCK, Carp.CROAK, Carp.CONFESS);
        assertThat(context.current().hooks().ids()).isEmpty();
    }

    @Test
    void carpIsRedactedWithoutTheWarnHook() {
        context.current().addMethods(List.of(Carp.CARP));

        Carp.carp("card ", CARD);

        assertThat(warnings).containsExactly("card DELETED");
    }

    @Test
    void croakIsRedacted() {
        context.current().addMethods(List.of(Carp.CROAK));

        assertThatThrownBy(() -> Carp.croak("card ", CARD))
                .isInstanceOf(FatalDiagnosticException.class)
                .hasMessage("card DELETED");
    }

    @Test
    void cluckAppendsTheStack() {
        context.current().addSources(List.of(Carp.SOURCE));

        Carp.cluck(CARD);

        assertThat(warnings).singleElement().satisfies(w -> {
            assertThat(w).startsWith("DELETED\n\tat ");
            assertThat(w).doesNotContain(CARD);
        });
    }

    @Test
    void unwrappingRestoresTheBuiltIns() {
        context.current().addSources(List.of(Carp.SOURCE));

        context.current().removeSources(List.of(Carp.SOURCE));
        Carp.carp(CARD);

        builtIns.forEach((id, impl) -> assertThat(CallableTable.global().lookup(id)).isSameAs(impl));
        assertThat(warnings).containsExactly(CARD);
    }

    @Test
    void unknownSourceIsRejected() {
        assertThatThrownBy(() -> context.current().addSources(List.of("Nope")))
                .isInstanceOf(MissingTargetException.class);
        assertThatThrownBy(() -> context.current().addMethods(List.of("Carp::shout")))
                .isInstanceOf(MissingTargetException.class);
    }
}

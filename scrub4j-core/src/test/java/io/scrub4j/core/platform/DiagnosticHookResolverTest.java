/*
 * Copyright (c) 2025 Scrub4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrub4j.core.platform;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.scrub4j.core.api.EmissionHandler;
import io.scrub4j.core.api.error.FatalDiagnosticException;
import io.scrub4j.core.api.model.ConflictReport;
import io.scrub4j.core.pattern.PatternSet;
import io.scrub4j.core.state.ScrubberContext;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DiagnosticHookResolverTest {

    private static final String CARD = "4007000000027";

    private final List<ConflictReport> conflicts = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();
    private final EmissionHandler userWarn = args -> warnings.add(Diagnostics.render(args));
    private ScrubberContext context;

    @BeforeEach
    void setUp() {
        clearSlots();
        context = new ScrubberContext(CallableTable.createWithBuiltIns(), conflicts::add);
    }

    @AfterEach
    void tearDown() {
        context.shutdown();
        clearSlots();
    }

    @Test
    void warnIsRedactedThroughTheUserHandler() {
        Diagnostics.setHandler(Diagnostics.WARN, userWarn);
        context.init(PatternSet.ofLiterals(Map.of(CARD, "DELETED")));

        Diagnostics.warn("The card number is ", CARD, ".");

        assertThat(warnings).containsExactly("The card number is DELETED.");
    }

    @Test
    void removingTheHookRestoresTheUserHandler() {
        Diagnostics.setHandler(Diagnostics.WARN, userWarn);
        context.init(PatternSet.ofLiterals(Map.of(CARD, "DELETED")));

        context.current().removeHooks(List.of(Diagnostics.WARN));
        Diagnostics.warn(CARD);

        assertThat(Diagnostics.handler(Diagnostics.WARN)).isSameAs(userWarn);
        assertThat(warnings).containsExactly(CARD);
    }

    @Test
    void warnWithoutHandlerGoesToStandardErrorRedacted() {
        PrintStream saved = System.err;
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        System.setErr(new PrintStream(buffer, true, StandardCharsets.UTF_8));
        try {
            context.init(PatternSet.ofLiterals(Map.of(CARD, "DELETED")));
            Diagnostics.warn("card ", CARD);
        } finally {
            System.setErr(saved);
        }

        assertThat(buffer.toString(StandardCharsets.UTF_8)).isEqualTo("card DELETED" + System.lineSeparator());
    }

    @Test
    void dieWithoutHandlerCarriesRedactedMessage() {
        context.init(PatternSet.ofLiterals(Map.of(CARD, "DELETED")));

        assertThatThrownBy(() -> Diagnostics.die("card ", CARD, " declined"))
                .isInstanceOf(FatalDiagnosticException.class)
                .hasMessage("card DELETED declined");
    }

    @Test
    void dieHandlerReceivesRedactedArguments() {
        List<String> seen = new ArrayList<>();
        Diagnostics.setHandler(Diagnostics.DIE, args -> seen.add(Diagnostics.render(args)));
        context.init(PatternSet.ofLiterals(Map.of(CARD, "DELETED")));

        assertThatThrownBy(() -> Diagnostics.die(CARD))
                .isInstanceOf(FatalDiagnosticException.class)
                .hasMessage("Died");
        assertThat(seen).containsExactly("DELETED");
    }

    @Test
    void warnIfFallsBackToTheWarnChannel() {
        Diagnostics.setHandler(Diagnostics.WARN, userWarn);
        context.init(PatternSet.ofLiterals(Map.of(CARD, "DELETED")));

        Diagnostics.warnIf(false, CARD);
        Diagnostics.warnIf(true, "card ", CARD);

        assertThat(warnings).containsExactly("card DELETED");
    }

    @Test
    void warnIfIsRedactedOnceLikeWarn() {
        List<Integer> counts = new ArrayList<>();
        context.setReporter(rs -> rs.forEach(r -> counts.add(r.count())));
        Diagnostics.setHandler(Diagnostics.WARN, userWarn);
        context.init(PatternSet.ofLiterals(Map.of("a", "aa")));

        Diagnostics.warn("a");
        Diagnostics.warnIf(true, "a");

        assertThat(warnings).containsExactly("aa", "aa");
        assertThat(counts).containsExactly(1, 1);
    }

    @Test
    void wrappedWarnIfWithoutWarnHandlerWritesStandardErrorOnce() {
        PrintStream saved = System.err;
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        System.setErr(new PrintStream(buffer, true, StandardCharsets.UTF_8));
        try {
            context.init(PatternSet.ofLiterals(Map.of("a", "aa")));
            Diagnostics.warnIf(true, "a");
        } finally {
            System.setErr(saved);
        }

        assertThat(buffer.toString(StandardCharsets.UTF_8)).isEqualTo("aa" + System.lineSeparator());
    }

    @Test
    void firstInitWrapsAllDefaultHooks() {
        context.init(new PatternSet());

        assertThat(context.current().hooks().ids()).containsExactlyElementsOf(DiagnosticHookResolver.DEFAULT_HOOKS);
        assertThat(Diagnostics.handler(Diagnostics.WARN)).isNotNull();
        assertThat(Diagnostics.handler(Diagnostics.DIE)).isNotNull();
    }

    @Test
    void shutdownUnsetsSlotsThatWereEmpty() {
        context.init(new PatternSet());

        context.shutdown();

        assertThat(Diagnostics.handler(Diagnostics.WARN)).isNull();
        assertThat(Diagnostics.handler(Diagnostics.DIE)).isNull();
        assertThat(Diagnostics.handler(Diagnostics.WARNIF)).isNull();
        assertThat(conflicts).isEmpty();
    }

    @Test
    void unknownSlotIsRejected() {
        assertThatThrownBy(() -> Diagnostics.setHandler("INFO", args -> {}))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(new DiagnosticHookResolver().find("INFO")).isEmpty();
    }

    private static void clearSlots() {
        for (String slot : DiagnosticHookResolver.DEFAULT_HOOKS) Diagnostics.setHandler(slot, null);
    }
}

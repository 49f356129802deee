/*
 * Copyright (c) 2025 Scrub4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrub4j.core.hook;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.scrub4j.core.api.EmissionHandler;
import io.scrub4j.core.api.HookPoint;
import io.scrub4j.core.api.error.MissingTargetException;
import io.scrub4j.core.api.error.ScrubberException;
import io.scrub4j.core.api.model.ConflictReport;
import io.scrub4j.core.pattern.PatternSet;
import io.scrub4j.core.platform.Diagnostics;
import io.scrub4j.core.redact.Redactor;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HookRegistryTest {

    private final Map<String, FakeSlot> slots = new HashMap<>();
    private final List<ConflictReport> conflicts = new ArrayList<>();
    private final List<String> received = new ArrayList<>();
    private final EmissionHandler original = args -> received.add(Diagnostics.render(args));
    private boolean enabled = true;
    private HookRegistry registry;

    @BeforeEach
    void setUp() {
        slots.put("alpha", new FakeSlot("alpha"));
        slots.put("beta", new FakeSlot("beta"));
        slots.get("alpha").live = original;
        registry = new HookRegistry(
                "hook",
                id -> Optional.<HookPoint<?>>ofNullable(slots.get(id)),
                new Redactor(PatternSet.ofLiterals(Map.of("1234", "XXXX"))),
                conflicts::add,
                () -> enabled);
    }

    @Test
    void addWrapsAndRedactsBeforeCallingOriginal() {
        registry.add("alpha");

        FakeSlot alpha = slots.get("alpha");
        assertThat(alpha.live).isNotSameAs(original);
        alpha.live.handle("pin ", "1234");

        assertThat(received).containsExactly("pin XXXX");
        assertThat(registry.isTracked("alpha")).isTrue();
        assertThat(registry.record("alpha")).hasValueSatisfying(r -> assertThat(r.isInstalled()).isTrue());
    }

    @Test
    void wrapperFallsBackWhenNothingWasInstalled() {
        registry.add("beta");

        slots.get("beta").live.handle("1234");

        assertThat(slots.get("beta").fallbackOutput).containsExactly("XXXX");
    }

    @Test
    void enableIsIdempotent() {
        registry.add("alpha");
        EmissionHandler wrapper = slots.get("alpha").live;

        assertThat(registry.enable("alpha")).isEqualTo(HookRecord.Outcome.ALREADY_INSTALLED);
        registry.add("alpha");

        assertThat(slots.get("alpha").live).isSameAs(wrapper);
        slots.get("alpha").live.handle("1234");
        assertThat(received).containsExactly("XXXX");
    }

    @Test
    void disableRestoresExactOriginal() {
        registry.add("alpha");

        assertThat(registry.disable("alpha")).isEqualTo(HookRecord.Outcome.RESTORED);
        assertThat(slots.get("alpha").live).isSameAs(original);
        assertThat(registry.isTracked("alpha")).isTrue();
        assertThat(registry.disable("alpha")).isEqualTo(HookRecord.Outcome.NOT_INSTALLED);
    }

    @Test
    void foreignTakeoverIsReportedAndLeftAlone() {
        registry.add("alpha");
        EmissionHandler wrapper = slots.get("alpha").live;
        EmissionHandler foreign = args -> {};
        slots.get("alpha").live = foreign;

        assertThat(registry.disable("alpha")).isEqualTo(HookRecord.Outcome.CONFLICT);

        assertThat(slots.get("alpha").live).isSameAs(foreign);
        assertThat(conflicts).singleElement().satisfies(c -> {
            assertThat(c.id()).isEqualTo("alpha");
            assertThat(c.expected()).isSameAs(wrapper);
            assertThat(c.found()).isSameAs(foreign);
        });
    }

    @Test
    void enableAfterTakeoverWrapsTheNewHandler() {
        registry.add("alpha");
        List<String> foreignOut = new ArrayList<>();
        slots.get("alpha").live = args -> foreignOut.add(Diagnostics.render(args));

        assertThat(registry.enable("alpha")).isEqualTo(HookRecord.Outcome.INSTALLED);
        slots.get("alpha").live.handle("1234");

        assertThat(foreignOut).containsExactly("XXXX");
    }

    @Test
    void disabledOwnerTracksWithoutInstalling() {
        enabled = false;

        registry.add("alpha");

        assertThat(registry.isTracked("alpha")).isTrue();
        assertThat(slots.get("alpha").live).isSameAs(original);

        enabled = true;
        registry.enableAll();
        assertThat(slots.get("alpha").live).isNotSameAs(original);
    }

    @Test
    void unknownIdIsRejectedWithoutTracking() {
        assertThatThrownBy(() -> registry.add("nope"))
                .isInstanceOf(MissingTargetException.class)
                .satisfies(e -> assertThat(((MissingTargetException) e).getTarget()).isEqualTo("nope"));

        assertThat(registry.size()).isZero();
    }

    @Test
    void bulkAddKeepsPartialProgress() {
        assertThatThrownBy(() -> registry.addAll(List.of("alpha", "nope", "beta", "nada")))
                .isInstanceOf(MissingTargetException.class)
                .hasMessageContaining("nope")
                .satisfies(e -> assertThat(e.getSuppressed()).hasSize(1));

        assertThat(registry.ids()).containsExactly("alpha", "beta");
    }

    @Test
    void removeRestoresAndForgets() {
        registry.add("alpha");

        registry.remove("alpha");
        registry.remove("alpha");

        assertThat(slots.get("alpha").live).isSameAs(original);
        assertThat(registry.isTracked("alpha")).isFalse();
    }

    @Test
    void copyCanUnwrapWhatTheSourceWrapped() {
        registry.add("alpha");
        HookRegistry copy = registry.copy(() -> true);

        copy.disableAll();

        assertThat(slots.get("alpha").live).isSameAs(original);
        assertThat(registry.record("alpha").orElseThrow().wrapper()).isNotNull();
        assertThat(copy.record("alpha").orElseThrow().wrapper()).isNull();
    }

    @Test
    void failedInstallLeavesNothingTracked() {
        FakeSlot alpha = slots.get("alpha");
        alpha.rejectInstall = true;

        assertThatThrownBy(() -> registry.add("alpha"))
                .isInstanceOf(ScrubberException.class)
                .hasMessageContaining("alpha")
                .hasCauseInstanceOf(IllegalStateException.class);

        assertThat(registry.isTracked("alpha")).isFalse();
        assertThat(alpha.live).isSameAs(original);

        alpha.rejectInstall = false;
        registry.add("alpha");
        assertThat(registry.record("alpha")).hasValueSatisfying(r -> assertThat(r.isInstalled()).isTrue());
    }

    static final class FakeSlot extends EmissionHookPoint {
        EmissionHandler live;
        boolean rejectInstall;
        final List<String> fallbackOutput = new ArrayList<>();

        FakeSlot(String id) {
            super(id);
        }

        @Override
        public EmissionHandler current() {
            return live;
        }

        @Override
        public void install(EmissionHandler handler) {
            if (rejectInstall) throw new IllegalStateException("slot is read-only");
            live = handler;
        }

        @Override
        protected void fallback(Object... args) {
            fallbackOutput.add(Diagnostics.render(args));
        }
    }
}

/*
 * Copyright (c) 2025 Scrub4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrub4j.core.platform;

import io.scrub4j.core.api.EmissionHandler;
import io.scrub4j.core.api.HookPoint;
import io.scrub4j.core.api.HookResolver;
import io.scrub4j.core.api.error.FatalDiagnosticException;
import io.scrub4j.core.hook.EmissionHookPoint;
import java.util.List;
import java.util.Optional;

/** Resolves {@code WARN}, {@code DIE} and {@code WARNIF} to the {@link Diagnostics} slots. */
public final class DiagnosticHookResolver implements HookResolver {

    /** Hooks that are wrapped by default on first initialisation. */
    public static final List<String> DEFAULT_HOOKS = List.of(Diagnostics.WARN, Diagnostics.DIE, Diagnostics.WARNIF);

    @Override
    public Optional<HookPoint<?>> find(String id) {
        if (!Diagnostics.isSlot(id)) return Optional.empty();
        return Optional.of(new SlotHookPoint(id));
    }

    static final class SlotHookPoint extends EmissionHookPoint {

        SlotHookPoint(String slot) {
            super(slot);
        }

        @Override
        public EmissionHandler current() {
            return Diagnostics.handler(id());
        }

        @Override
        public void install(EmissionHandler handler) {
            Diagnostics.setHandler(id(), handler);
        }

        @Override
        protected void fallback(Object... args) {
            switch (id()) {
                case Diagnostics.DIE -> throw new FatalDiagnosticException(Diagnostics.render(args));
                case Diagnostics.WARNIF -> warnUnwrapped(args);
                default -> Diagnostics.emitWarning(args);
            }
        }

        // args are already redacted; WARN's own wrapper must not see them again
        private static void warnUnwrapped(Object... args) {
            EmissionHandler warn = unwrap(Diagnostics.handler(Diagnostics.WARN));
            if (warn != null) warn.handle(args);
            else Diagnostics.emitWarning(args);
        }
    }
}

/*
 * Copyright (c) 2025 Scrub4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrub4j.core.state;

/**
 * A temporary configuration. Closing it puts back the configuration that was live when it
 * was entered. Close scopes in reverse order of entering them; closing twice is a no-op.
 */
public final class ScrubberScope implements AutoCloseable {

    private final ScrubberContext context;
    private final int depth;
    private boolean closed;

    ScrubberScope(ScrubberContext context, int depth) {
        this.context = context;
        this.depth = depth;
    }

    public int depth() {
        return depth;
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        context.restoreTo(depth - 1);
    }
}

package com.telemetry.activity.context;

import com.telemetry.activity.tracing.Span;

import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * A span captured on one thread, to be made current on another.
 *
 * <pre>
 * ContextSnapshot snapshot = contextStack.capture();
 * executor.submit(snapshot.wrap(() -&gt; {
 *     // contextStack.current() is the captured span here
 * }));
 * </pre>
 */
public final class ContextSnapshot {

    private final ContextStack stack;
    private final Span span;

    ContextSnapshot(ContextStack stack, Span span) {
        this.stack = stack;
        this.span = span;
    }

    public Optional<Span> span() {
        return Optional.ofNullable(span);
    }

    public ContextScope attach() {
        return stack.attach(span);
    }

    public Runnable wrap(Runnable task) {
        return () -> {
            try (ContextScope ignored = attach()) {
                task.run();
            }
        };
    }

    public <T> Callable<T> wrap(Callable<T> task) {
        return () -> {
            try (ContextScope ignored = attach()) {
                return task.call();
            }
        };
    }
}

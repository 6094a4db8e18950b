package com.telemetry.activity.context;

import com.telemetry.activity.tracing.Span;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * Holds the current span for each logical call chain.
 *
 * <p>Every thread sees its own LIFO stack of open spans; the top is the current span.
 * Nothing crosses threads implicitly: work handed to another thread must carry its
 * context with {@link #capture()} and {@link ContextSnapshot#wrap(Runnable)}.</p>
 *
 * <p>Rules:</p>
 * <ul>
 *   <li>{@link #push} makes a span current.</li>
 *   <li>{@link #pop} removes a span only if it is current; otherwise nothing changes.
 *       Spans underneath that were already stopped out of order are discarded as well,
 *       so the nearest open ancestor becomes current.</li>
 *   <li>A span stopped from another thread can't be popped here; it is discarded the next
 *       time this thread reads or pushes, so a stopped span is never current or a parent.</li>
 * </ul>
 *
 * <p>Each instance owns its own storage, so replacing a runtime also replaces its stacks.</p>
 */
public class ContextStack {

    private final ThreadLocal<Deque<Span>> stacks = new ThreadLocal<>();

    public void push(Span span) {
        if (span == null) {
            return;
        }
        Deque<Span> stack = prune();
        if (stack == null) {
            stack = new ArrayDeque<>();
            stacks.set(stack);
        }
        stack.push(span);
    }

    /**
     * Removes {@code span} if it is the current span of the calling thread.
     *
     * @return true if the span was current and has been removed
     */
    public boolean pop(Span span) {
        Deque<Span> stack = stacks.get();
        if (stack == null || span == null || stack.peek() != span) {
            return false;
        }
        stack.pop();
        prune();
        return true;
    }

    public Optional<Span> current() {
        Deque<Span> stack = prune();
        return stack == null ? Optional.empty() : Optional.ofNullable(stack.peek());
    }

    /**
     * Number of spans stacked on the calling thread.
     */
    public int depth() {
        Deque<Span> stack = stacks.get();
        return stack == null ? 0 : stack.size();
    }

    /**
     * Captures the current span of the calling thread so it can be re-attached elsewhere.
     */
    public ContextSnapshot capture() {
        return new ContextSnapshot(this, current().orElse(null));
    }

    /**
     * Makes {@code span} current on the calling thread until the returned scope is closed.
     * Closing removes exactly this attachment, even if other spans were pushed above it.
     */
    public ContextScope attach(Span span) {
        if (span == null) {
            return ContextScope.NOOP;
        }
        push(span);
        return () -> detach(span);
    }

    /**
     * Drops every span stacked on the calling thread.
     */
    public void clear() {
        stacks.remove();
    }

    // drops stopped spans from the top; returns null once the stack is empty
    private Deque<Span> prune() {
        Deque<Span> stack = stacks.get();
        if (stack == null) {
            return null;
        }
        while (!stack.isEmpty() && stack.peek().isStopped()) {
            stack.pop();
        }
        if (stack.isEmpty()) {
            stacks.remove();
            return null;
        }
        return stack;
    }

    private void detach(Span span) {
        Deque<Span> stack = stacks.get();
        if (stack == null) {
            return;
        }
        stack.removeFirstOccurrence(span);
        if (stack.isEmpty()) {
            stacks.remove();
        }
    }
}

package com.telemetry.activity.context;

import com.telemetry.activity.tracing.Span;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("ContextStack Tests")
class ContextStackTest {

    private ContextStack stack;

    @BeforeEach
    void setUp() {
        stack = new ContextStack();
    }

    @AfterEach
    void tearDown() {
        stack.clear();
    }

    private static Span openSpan(String name) {
        Span span = mock(Span.class);
        when(span.name()).thenReturn(name);
        when(span.isStopped()).thenReturn(false);
        return span;
    }

    @Nested
    @DisplayName("Push and pop")
    class PushPopTests {

        @Test
        @DisplayName("Empty stack should have no current span")
        void emptyStack() {
            assertTrue(stack.current().isEmpty());
            assertEquals(0, stack.depth());
        }

        @Test
        @DisplayName("Pushed span should become current")
        void pushMakesCurrent() {
            Span a = openSpan("A");
            Span b = openSpan("B");
            stack.push(a);
            stack.push(b);

            assertSame(b, stack.current().orElseThrow());
            assertEquals(2, stack.depth());
        }

        @Test
        @DisplayName("Popping the current span should restore its parent")
        void popRestoresParent() {
            Span a = openSpan("A");
            Span b = openSpan("B");
            stack.push(a);
            stack.push(b);

            assertTrue(stack.pop(b));
            assertSame(a, stack.current().orElseThrow());
            assertTrue(stack.pop(a));
            assertTrue(stack.current().isEmpty());
        }

        @Test
        @DisplayName("Popping a span that is not current should change nothing")
        void popNonCurrentIsNoOp() {
            Span a = openSpan("A");
            Span b = openSpan("B");
            stack.push(a);
            stack.push(b);

            assertFalse(stack.pop(a));
            assertSame(b, stack.current().orElseThrow());
            assertEquals(2, stack.depth());
        }

        @Test
        @DisplayName("Spans stopped out of order should be discarded once exposed")
        void stoppedSpansBeneathAreDiscarded() {
            Span root = openSpan("root");
            Span middle = openSpan("middle");
            Span leaf = openSpan("leaf");
            stack.push(root);
            stack.push(middle);
            stack.push(leaf);

            // middle stopped while leaf is still current
            when(middle.isStopped()).thenReturn(true);
            assertFalse(stack.pop(middle));

            assertTrue(stack.pop(leaf));
            assertSame(root, stack.current().orElseThrow());
            assertEquals(1, stack.depth());
        }

        @Test
        @DisplayName("A current span stopped elsewhere should be discarded before reads and pushes")
        void stoppedTopIsDiscarded() {
            Span root = openSpan("root");
            Span leaf = openSpan("leaf");
            stack.push(root);
            stack.push(leaf);

            when(leaf.isStopped()).thenReturn(true);
            assertSame(root, stack.current().orElseThrow());
            assertEquals(1, stack.depth());

            when(root.isStopped()).thenReturn(true);
            Span next = openSpan("next");
            stack.push(next);
            assertSame(next, stack.current().orElseThrow());
            assertEquals(1, stack.depth());
        }

        @Test
        @DisplayName("Null spans should be ignored")
        void nullIgnored() {
            stack.push(null);
            assertEquals(0, stack.depth());
            assertFalse(stack.pop(null));
        }
    }

    @Nested
    @DisplayName("Thread isolation")
    class ThreadTests {

        @Test
        @DisplayName("Other threads should not see the current span")
        void notSharedImplicitly() throws Exception {
            stack.push(openSpan("A"));
            ExecutorService executor = Executors.newSingleThreadExecutor();
            try {
                Future<Optional<Span>> seen = executor.submit(() -> stack.current());
                assertTrue(seen.get(5, TimeUnit.SECONDS).isEmpty());
            } finally {
                executor.shutdownNow();
            }
        }

        @Test
        @DisplayName("Separate instances should not share storage")
        void separateInstances() {
            ContextStack other = new ContextStack();
            stack.push(openSpan("A"));
            assertTrue(other.current().isEmpty());
        }

        @Test
        @DisplayName("Wrapped task should run with the captured span")
        void wrapCarriesContext() throws Exception {
            Span a = openSpan("A");
            stack.push(a);
            ContextSnapshot snapshot = stack.capture();
            assertSame(a, snapshot.span().orElseThrow());

            ExecutorService executor = Executors.newSingleThreadExecutor();
            try {
                Future<Optional<Span>> seen = executor.submit(snapshot.wrap(() -> stack.current()));
                assertSame(a, seen.get(5, TimeUnit.SECONDS).orElseThrow());

                Future<Optional<Span>> after = executor.submit(() -> stack.current());
                assertTrue(after.get(5, TimeUnit.SECONDS).isEmpty());
            } finally {
                executor.shutdownNow();
            }
        }

        @Test
        @DisplayName("Closing an attachment should remove exactly that span")
        void attachScope() {
            Span a = openSpan("A");
            Span b = openSpan("B");
            ContextScope scope = stack.attach(a);
            stack.push(b);

            scope.close();

            assertSame(b, stack.current().orElseThrow());
            assertEquals(1, stack.depth());
        }

        @Test
        @DisplayName("Capturing an empty context should attach nothing")
        void emptySnapshot() {
            ContextSnapshot snapshot = stack.capture();
            assertTrue(snapshot.span().isEmpty());
            try (ContextScope ignored = snapshot.attach()) {
                assertTrue(stack.current().isEmpty());
            }
        }
    }
}

package dev.promptbench.run;

import static org.junit.jupiter.api.Assertions.*;

import dev.promptbench.TestHarness;
import io.opentelemetry.api.trace.Span;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

class TaskGroupTest {
    @Test
    void completesWhenEveryTaskSettles() {
        var committed = new AtomicInteger();
        try (var group = new TaskGroup("complete", 2)) {
            for (int i = 0; i < 5; i++) {
                group.spawn(() -> group.commit(committed::incrementAndGet));
            }
            assertEquals(TaskGroup.Outcome.COMPLETED, group.join(Duration.ofSeconds(5)));
        }
        assertEquals(5, committed.get());
    }

    @Test
    void timeoutRejectsLateCommits() {
        try (var group = new TaskGroup("timeout", 1)) {
            group.spawn(() -> Thread.sleep(10_000));
            assertEquals(TaskGroup.Outcome.TIMED_OUT, group.join(Duration.ofMillis(100)));
            assertFalse(group.commit(() -> fail("late write must be discarded")));
        }
    }

    @Test
    void cancelInterruptsRunningTasks() throws Exception {
        var started = new CountDownLatch(1);
        var interrupted = new CountDownLatch(1);
        try (var group = new TaskGroup("cancel", 1)) {
            group.spawn(
                    () -> {
                        started.countDown();
                        try {
                            Thread.sleep(10_000);
                        } finally {
                            interrupted.countDown();
                        }
                    });
            assertTrue(started.await(5, TimeUnit.SECONDS));
            var outcome = new AtomicReference<TaskGroup.Outcome>();
            var joiner = new Thread(() -> outcome.set(group.join(Duration.ofSeconds(10))));
            joiner.start();
            group.cancel();
            joiner.join(5_000);

            assertTrue(interrupted.await(5, TimeUnit.SECONDS));
            assertEquals(TaskGroup.Outcome.CANCELLED, outcome.get());
            assertTrue(group.isCancelled());
            assertFalse(group.commit(() -> fail("write after cancel must be discarded")));
        }
    }

    @Test
    void spawnAfterCancelIsDropped() {
        try (var group = new TaskGroup("cancelled", 1)) {
            group.cancel();
            assertFalse(group.spawn(() -> fail("cancelled group must not run tasks")));
            assertEquals(TaskGroup.Outcome.CANCELLED, group.join(Duration.ofSeconds(1)));
        }
    }

    @Test
    void tasksInheritTheCallersSpan() {
        var harness = new TestHarness();
        var span = harness.tracer().spanBuilder("parent").startSpan();
        var seen = new AtomicReference<String>();
        try (var ignored = span.makeCurrent();
                var group = new TaskGroup("context", 1)) {
            group.spawn(() -> seen.set(Span.current().getSpanContext().getSpanId()));
            group.join(Duration.ofSeconds(5));
        } finally {
            span.end();
        }
        assertEquals(span.getSpanContext().getSpanId(), seen.get());
    }

    @Test
    void rejectsNonPositiveConcurrency() {
        assertThrows(IllegalArgumentException.class, () -> new TaskGroup("bad", 0));
    }
}

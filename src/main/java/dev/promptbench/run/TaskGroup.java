package dev.promptbench.run;

import io.opentelemetry.context.Context;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;
import lombok.extern.slf4j.Slf4j;

/**
 * A group of tasks that run on a bounded pool and settle together.
 *
 * <p>Tasks publish their results through {@link #commit(Runnable)}. Once the group is closed by a
 * timeout or a cancellation, further commits are rejected, so results that arrive late are
 * discarded rather than written.
 */
@Slf4j
@ThreadSafe
public final class TaskGroup implements AutoCloseable {
    public enum Outcome {
        COMPLETED,
        TIMED_OUT,
        CANCELLED
    }

    /** Body of one task. Interruption means the group is being cancelled. */
    @FunctionalInterface
    public interface GroupTask {
        void run() throws InterruptedException;
    }

    private final String name;
    private final ExecutorService executor;
    private final Object gate = new Object();

    @GuardedBy("gate")
    private boolean open = true;

    private volatile boolean cancelled = false;

    public TaskGroup(String name, int concurrency) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be positive: " + concurrency);
        }
        this.name = name;
        this.executor = Executors.newFixedThreadPool(concurrency, threadFactory(name));
    }

    /**
     * Submit a task. The OpenTelemetry context of the caller is carried into the task.
     *
     * @return false if the group was already cancelled or closed and the task was dropped
     */
    public boolean spawn(GroupTask task) {
        var context = Context.current();
        synchronized (gate) {
            if (!open) {
                log.debug("group {} is closed, task not dispatched", name);
                return false;
            }
            executor.execute(
                    () -> {
                        try (var ignored = context.makeCurrent()) {
                            task.run();
                        } catch (InterruptedException e) {
                            log.debug("task in group {} interrupted", name);
                            Thread.currentThread().interrupt();
                        } catch (RuntimeException e) {
                            log.error("task in group {} failed", name, e);
                        }
                    });
            return true;
        }
    }

    /**
     * Apply a write if the group is still open.
     *
     * @return false if the write was discarded because the group has been closed
     */
    public boolean commit(Runnable write) {
        synchronized (gate) {
            if (!open) {
                return false;
            }
            write.run();
            return true;
        }
    }

    /**
     * Wait for every spawned task to settle, at most {@code timeout}. No tasks may be spawned
     * afterwards. On timeout the remaining tasks are interrupted and their results discarded.
     */
    public Outcome join(Duration timeout) {
        executor.shutdown();
        boolean settled;
        try {
            settled = executor.awaitTermination(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel();
            return Outcome.CANCELLED;
        }
        if (cancelled) {
            return Outcome.CANCELLED;
        }
        if (!settled) {
            log.debug("group {} timed out after {}", name, timeout);
            closeGate();
            executor.shutdownNow();
            return Outcome.TIMED_OUT;
        }
        closeGate();
        return Outcome.COMPLETED;
    }

    /** Discard further results and interrupt running tasks. */
    public void cancel() {
        cancelled = true;
        closeGate();
        executor.shutdownNow();
    }

    public boolean isCancelled() {
        return cancelled;
    }

    private void closeGate() {
        synchronized (gate) {
            open = false;
        }
    }

    @Override
    public void close() {
        closeGate();
        executor.shutdownNow();
    }

    private static ThreadFactory threadFactory(String name) {
        var counter = new AtomicInteger();
        return runnable -> {
            var thread = new Thread(runnable, "promptbench-" + name + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}

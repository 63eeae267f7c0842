package dev.promptbench.run;

import dev.promptbench.store.Pair;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;

/**
 * Tracks the active runs of every pair. At most one run of each {@link RunKind} may be active for
 * a pair at a time.
 */
@ThreadSafe
public final class RunRegistry {
    public enum RunKind {
        GENERATION("generation"),
        EVALUATION("evaluation");

        private final String label;

        RunKind(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    private record RunKey(Pair pair, RunKind kind) {}

    private final Map<RunKey, ActiveRun> active = new ConcurrentHashMap<>();

    /**
     * Claim the pair for a run of the given kind. Close the returned handle when the run ends.
     *
     * @throws AlreadyInProgressException if the pair already has an active run of that kind
     */
    public ActiveRun register(Pair pair, RunKind kind) {
        var key = new RunKey(pair, kind);
        var run = new ActiveRun(key);
        if (active.putIfAbsent(key, run) != null) {
            throw new AlreadyInProgressException(pair, kind);
        }
        return run;
    }

    public boolean isActive(Pair pair, RunKind kind) {
        return active.containsKey(new RunKey(pair, kind));
    }

    /**
     * Cancel every active run of the pair.
     *
     * @return the number of runs cancelled
     */
    public int cancel(Pair pair) {
        int cancelled = 0;
        for (var kind : RunKind.values()) {
            var run = active.get(new RunKey(pair, kind));
            if (run != null) {
                run.cancel();
                cancelled++;
            }
        }
        return cancelled;
    }

    /** Handle on a registered run. */
    @ThreadSafe
    public final class ActiveRun implements AutoCloseable {
        private final RunKey key;
        private @Nullable TaskGroup taskGroup;
        private boolean cancelRequested;

        private ActiveRun(RunKey key) {
            this.key = key;
        }

        /** Bind the run's task group. A cancel that arrived earlier is applied immediately. */
        public synchronized void attach(TaskGroup group) {
            this.taskGroup = group;
            if (cancelRequested) {
                group.cancel();
            }
        }

        public synchronized void cancel() {
            cancelRequested = true;
            if (taskGroup != null) {
                taskGroup.cancel();
            }
        }

        public synchronized boolean isCancelRequested() {
            return cancelRequested;
        }

        @Override
        public void close() {
            active.remove(key, this);
        }
    }
}

package dev.promptbench.store;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import javax.annotation.Nonnull;
import javax.annotation.concurrent.ThreadSafe;

/**
 * Persistence for generated responses and judge verdicts, keyed by (prompt set, model, prompt
 * index).
 *
 * <p>Implementations must accept concurrent writers on different pairs without contention. Writes
 * to a single pair are atomic with respect to each other.
 */
public interface ResponseStore {
    /** Consistent read of every response and verdict stored for the pair. */
    PairSnapshot snapshot(@Nonnull Pair pair);

    default Optional<PromptResponse> response(@Nonnull Pair pair, int promptIndex) {
        return Optional.ofNullable(snapshot(pair).responses().get(promptIndex));
    }

    default List<PromptResponse> responses(@Nonnull Pair pair) {
        return List.copyOf(snapshot(pair).responses().values());
    }

    default List<EvaluationResult> evaluations(@Nonnull Pair pair) {
        return List.copyOf(snapshot(pair).evaluations().values());
    }

    /**
     * Record a response unless the index already has one.
     *
     * @return true if the response was written
     */
    boolean putResponseIfAbsent(@Nonnull PromptResponse response);

    /**
     * Record a response, superseding any existing one for the index. A verdict on the superseded
     * response is dropped in the same step.
     */
    void replaceResponse(@Nonnull PromptResponse response);

    /**
     * Record a verdict for a response.
     *
     * <p>The write only happens if {@code judged} is still the stored, successful response for that
     * index and no verdict exists yet.
     *
     * @return true if the verdict was written
     */
    boolean putEvaluationIfCurrent(
            @Nonnull EvaluationResult evaluation, @Nonnull PromptResponse judged);

    static ResponseStore inMemory() {
        return new InMemoryImpl();
    }

    /** Holds all rows in memory. Each pair is guarded by its own monitor. */
    @ThreadSafe
    class InMemoryImpl implements ResponseStore {
        private final Map<Pair, PairRows> rows = new ConcurrentHashMap<>();

        private PairRows rowsFor(Pair pair) {
            return rows.computeIfAbsent(pair, unused -> new PairRows());
        }

        @Override
        public PairSnapshot snapshot(@Nonnull Pair pair) {
            var pairRows = rows.get(pair);
            if (pairRows == null) {
                return PairSnapshot.empty(pair);
            }
            synchronized (pairRows) {
                return PairSnapshot.of(pair, pairRows.responses, pairRows.evaluations);
            }
        }

        @Override
        public boolean putResponseIfAbsent(@Nonnull PromptResponse response) {
            var pairRows = rowsFor(response.pair());
            synchronized (pairRows) {
                return pairRows.responses.putIfAbsent(response.promptIndex(), response) == null;
            }
        }

        @Override
        public void replaceResponse(@Nonnull PromptResponse response) {
            var pairRows = rowsFor(response.pair());
            synchronized (pairRows) {
                pairRows.responses.put(response.promptIndex(), response);
                pairRows.evaluations.remove(response.promptIndex());
            }
        }

        @Override
        public boolean putEvaluationIfCurrent(
                @Nonnull EvaluationResult evaluation, @Nonnull PromptResponse judged) {
            if (!evaluation.pair().equals(judged.pair())
                    || evaluation.promptIndex() != judged.promptIndex()) {
                throw new IllegalArgumentException(
                        "verdict %s/%d does not belong to response %s/%d"
                                .formatted(
                                        evaluation.pair(),
                                        evaluation.promptIndex(),
                                        judged.pair(),
                                        judged.promptIndex()));
            }
            var pairRows = rowsFor(evaluation.pair());
            synchronized (pairRows) {
                var current = pairRows.responses.get(evaluation.promptIndex());
                if (!judged.equals(current) || current.isError()) {
                    return false;
                }
                return pairRows.evaluations.putIfAbsent(evaluation.promptIndex(), evaluation)
                        == null;
            }
        }

        private static final class PairRows {
            private final Map<Integer, PromptResponse> responses = new HashMap<>();
            private final Map<Integer, EvaluationResult> evaluations = new HashMap<>();
        }
    }
}

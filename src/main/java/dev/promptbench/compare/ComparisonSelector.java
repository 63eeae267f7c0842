package dev.promptbench.compare;

import dev.promptbench.catalog.PairResolver;
import dev.promptbench.catalog.PromptSet;
import dev.promptbench.store.Pair;
import dev.promptbench.store.PairSnapshot;
import dev.promptbench.store.PairState;
import dev.promptbench.store.ResponseStore;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nonnull;
import javax.annotation.concurrent.ThreadSafe;

/**
 * Selection of at most two pairs for side-by-side comparison, scoped to one comparison session.
 *
 * <p>Selecting a third pair evicts the one selected earliest.
 */
@ThreadSafe
public final class ComparisonSelector {
    public static final int CAPACITY = 2;

    private final @Nonnull PairResolver pairResolver;
    private final @Nonnull ResponseStore store;
    private final Deque<Pair> selection = new ArrayDeque<>(CAPACITY + 1);

    public ComparisonSelector(@Nonnull PairResolver pairResolver, @Nonnull ResponseStore store) {
        this.pairResolver = Objects.requireNonNull(pairResolver);
        this.store = Objects.requireNonNull(store);
    }

    /**
     * Select or deselect a pair. Selecting an already selected pair, or deselecting one that is
     * not selected, changes nothing.
     */
    public synchronized ToggleResult toggle(@Nonnull Pair pair, boolean selected) {
        Objects.requireNonNull(pair, "pair");
        if (!selected) {
            selection.remove(pair);
            return ToggleResult.NONE;
        }
        if (selection.contains(pair)) {
            return ToggleResult.NONE;
        }
        selection.addLast(pair);
        if (selection.size() > CAPACITY) {
            return new ToggleResult(Optional.of(selection.removeFirst()));
        }
        return ToggleResult.NONE;
    }

    /** Selected pairs, oldest first. */
    public synchronized List<Pair> selection() {
        return List.copyOf(selection);
    }

    /**
     * Build the side-by-side view of the two selected pairs.
     *
     * @throws IncompleteSelectionException unless exactly two pairs are selected and both have a
     *     response for every prompt
     */
    public ComparisonView compare() {
        var pairs = selection();
        if (pairs.size() != CAPACITY) {
            throw new IncompleteSelectionException(
                    "comparison needs %d selected pairs, found %d".formatted(CAPACITY, pairs.size()));
        }
        var left = load(pairs.get(0));
        var right = load(pairs.get(1));

        int rowCount = Math.max(left.promptSet.promptCount(), right.promptSet.promptCount());
        var rows = new ArrayList<ComparisonView.Row>(rowCount);
        for (int index = 0; index < rowCount; index++) {
            rows.add(new ComparisonView.Row(index, left.side(index), right.side(index)));
        }
        return new ComparisonView(left.snapshot.pair(), right.snapshot.pair(), rows);
    }

    private Loaded load(Pair pair) {
        var promptSet = pairResolver.resolve(pair);
        var snapshot = store.snapshot(pair);
        var state = PairState.derive(promptSet.promptCount(), snapshot);
        if (!state.isAtLeast(PairState.GENERATED)) {
            throw new IncompleteSelectionException(
                    "%s is %s and cannot be compared".formatted(pair, state));
        }
        return new Loaded(promptSet, snapshot);
    }

    private final class Loaded {
        private final PromptSet promptSet;
        private final PairSnapshot snapshot;

        private Loaded(PromptSet promptSet, PairSnapshot snapshot) {
            this.promptSet = promptSet;
            this.snapshot = snapshot;
        }

        private ComparisonView.Side side(int index) {
            if (!promptSet.containsIndex(index)) {
                return ComparisonView.Side.ABSENT;
            }
            return new ComparisonView.Side(
                    true,
                    Optional.of(pairResolver.promptText(promptSet, index)),
                    Optional.ofNullable(snapshot.responses().get(index)),
                    Optional.ofNullable(snapshot.evaluations().get(index)));
        }
    }
}

package dev.promptbench.store;

/**
 * Derived lifecycle stage of a pair. Never stored: always computed from the stored rows against
 * the prompt set's prompt count.
 */
public enum PairState {
    /** at least one prompt index has no response yet */
    NOT_GENERATED,
    /** every index has a response (success or error) */
    GENERATED,
    /** every index has a response and every successful one has a verdict */
    EVALUATED;

    public static PairState derive(int promptCount, PairSnapshot snapshot) {
        if (snapshot.responses().size() < promptCount) {
            return NOT_GENERATED;
        }
        return snapshot.unevaluatedCount() == 0 ? EVALUATED : GENERATED;
    }

    public boolean isAtLeast(PairState other) {
        return compareTo(other) >= 0;
    }
}

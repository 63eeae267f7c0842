package dev.promptbench.stats;

import static dev.promptbench.TestHarness.*;
import static org.junit.jupiter.api.Assertions.*;

import dev.promptbench.TestHarness;
import dev.promptbench.catalog.InvalidPairException;
import dev.promptbench.store.EvaluationResult;
import dev.promptbench.store.Pair;
import dev.promptbench.store.PairState;
import dev.promptbench.store.PromptResponse;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class StatsAggregatorTest {
    private static final Pair PAIR = Pair.of("arith", MODEL_A);

    private TestHarness harness;
    private StatsAggregator aggregator;

    @BeforeEach
    void beforeEach() {
        harness = new TestHarness();
        harness.promptSets().add("arith", List.of("2+2?", "3+3?", "4+4?"));
        aggregator = new StatsAggregator(harness.pairResolver(), harness.store());
    }

    @Test
    void latencyIgnoresErrorMarkers() {
        var store = harness.store();
        store.putResponseIfAbsent(PromptResponse.success(PAIR, 0, "4", 0.5));
        store.putResponseIfAbsent(PromptResponse.failure(PAIR, 1, "TIMEOUT: slow"));
        store.putResponseIfAbsent(PromptResponse.success(PAIR, 2, "8", 1.5));

        var latency = aggregator.computeLatency(PAIR).orElseThrow();

        assertEquals(0.5, latency.min(), 1e-9);
        assertEquals(1.0, latency.avg(), 1e-9);
        assertEquals(1.5, latency.max(), 1e-9);
        assertEquals(2, latency.count());
    }

    @Test
    void latencyIsEmptyWithoutSuccessfulResponses() {
        assertTrue(aggregator.computeLatency(PAIR).isEmpty());
        harness.store().putResponseIfAbsent(PromptResponse.failure(PAIR, 0, "TIMEOUT: slow"));
        assertTrue(aggregator.computeLatency(PAIR).isEmpty());
    }

    @Test
    void evalCountsTallyEachCriterionSeparately() {
        var store = harness.store();
        var first = PromptResponse.success(PAIR, 0, "4", 0.5);
        var second = PromptResponse.success(PAIR, 1, "7", 0.5);
        var third = PromptResponse.success(PAIR, 2, "8", 0.5);
        store.putResponseIfAbsent(first);
        store.putResponseIfAbsent(second);
        store.putResponseIfAbsent(third);
        store.putEvaluationIfCurrent(EvaluationResult.of(PAIR, 0, JUDGE, true, false), first);
        store.putEvaluationIfCurrent(EvaluationResult.of(PAIR, 1, JUDGE, false, true), second);
        store.putEvaluationIfCurrent(EvaluationResult.of(PAIR, 2, JUDGE, true, true), third);

        var counts = aggregator.computeEvalCounts(PAIR);

        assertEquals(new EvalCounts(2, 1, 2, 1), counts);
        assertEquals(3, counts.evaluatedCount());
        assertEquals(2.0 / 3, counts.okRatio().orElseThrow(), 1e-9);
    }

    @Test
    void ratiosAreEmptyWhenNothingWasEvaluated() {
        var counts = aggregator.computeEvalCounts(PAIR);
        assertEquals(EvalCounts.NONE, counts);
        assertTrue(counts.okRatio().isEmpty());
        assertTrue(counts.otherRatio().isEmpty());
    }

    @Test
    void statsCombineStateAndCounts() {
        var store = harness.store();
        store.putResponseIfAbsent(PromptResponse.success(PAIR, 0, "4", 0.5));
        store.putResponseIfAbsent(PromptResponse.failure(PAIR, 1, "TIMEOUT: slow"));

        var stats = aggregator.computeStats(PAIR);

        assertEquals(PairState.NOT_GENERATED, stats.state());
        assertEquals(3, stats.promptCount());
        assertEquals(1, stats.responseCount());
        assertEquals(1, stats.errorCount());
        assertTrue(stats.latency().isPresent());
        assertEquals(0, stats.evalCounts().evaluatedCount());
        assertEquals(PairState.NOT_GENERATED, aggregator.computeState(PAIR));
    }

    @Test
    void unknownPairIsRejected() {
        assertThrows(
                InvalidPairException.class, () -> aggregator.computeStats(Pair.of("x", MODEL_A)));
    }
}

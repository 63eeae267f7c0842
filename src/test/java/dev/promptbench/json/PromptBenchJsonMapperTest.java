package dev.promptbench.json;

import static org.junit.jupiter.api.Assertions.*;

import dev.promptbench.run.GenerationSummary;
import dev.promptbench.store.Pair;
import dev.promptbench.store.PromptResponse;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class PromptBenchJsonMapperTest {
    @Test
    void serializesWithSnakeCase() {
        var summary = new GenerationSummary(2, 1, 0, Duration.ZERO);
        var json = PromptBenchJsonMapper.toJson(summary);
        assertTrue(json.contains("\"generated_count\":2"), json);
        assertTrue(json.contains("\"failed_count\":1"), json);
    }

    @Test
    void omitsAbsentOptionals() {
        var failure = PromptResponse.failure(Pair.of("set", "model"), 0, "TIMEOUT: slow");
        var node = PromptBenchJsonMapper.get().valueToTree(failure);
        assertEquals("TIMEOUT: slow", node.get("error_marker").asText());
        assertFalse(node.has("text"));
        assertFalse(node.has("latency_seconds"));
        assertTrue(node.get("created_at").isTextual());
    }

    @Test
    void ignoresUnknownPropertiesWhenReading() {
        var pair =
                PromptBenchJsonMapper.fromJson(
                        "{\"prompt_set_id\":\"s\",\"model_id\":\"m\",\"extra\":1}", Pair.class);
        assertEquals(Pair.of("s", "m"), pair);
    }
}

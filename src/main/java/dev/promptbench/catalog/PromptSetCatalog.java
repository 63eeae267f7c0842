package dev.promptbench.catalog;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.annotation.Nonnull;
import javax.annotation.concurrent.ThreadSafe;

/**
 * Read-only source of prompt sets and their prompt text.
 *
 * <p>How prompts are authored is outside promptbench; implementations only need to enumerate the
 * sets and render the text of a given index.
 */
public interface PromptSetCatalog {
    /** All available prompt sets, in catalog order. */
    List<PromptSet> list();

    /**
     * Render the text of one prompt.
     *
     * @throws IndexOutOfBoundsException if {@code promptIndex} is outside the set's index range
     */
    String promptText(@Nonnull PromptSet promptSet, int promptIndex);

    default Optional<PromptSet> get(String promptSetId) {
        return list().stream().filter(set -> set.id().equals(promptSetId)).findFirst();
    }

    /** Implementation for holding prompts in memory */
    @ThreadSafe
    class InMemoryImpl implements PromptSetCatalog {
        private final Map<String, PromptSet> promptSets = new LinkedHashMap<>();
        private final Map<String, List<String>> prompts = new LinkedHashMap<>();

        /** Register a prompt set whose source file and generation function are not tracked. */
        public InMemoryImpl add(String promptSetId, List<String> promptTexts) {
            return add(
                    new PromptSet(
                            promptSetId, Instant.now(), "memory", "literal", promptTexts.size()),
                    promptTexts);
        }

        public synchronized InMemoryImpl add(PromptSet promptSet, List<String> promptTexts) {
            if (promptSet.promptCount() != promptTexts.size()) {
                throw new IllegalArgumentException(
                        "prompt set %s declares %d prompts but %d were given"
                                .formatted(
                                        promptSet.id(),
                                        promptSet.promptCount(),
                                        promptTexts.size()));
            }
            promptSets.put(promptSet.id(), promptSet);
            prompts.put(promptSet.id(), List.copyOf(promptTexts));
            return this;
        }

        @Override
        public synchronized List<PromptSet> list() {
            return new ArrayList<>(promptSets.values());
        }

        @Override
        public synchronized String promptText(@Nonnull PromptSet promptSet, int promptIndex) {
            var texts = prompts.get(promptSet.id());
            if (texts == null) {
                throw new IllegalArgumentException("unknown prompt set: " + promptSet.id());
            }
            return texts.get(promptIndex);
        }
    }
}

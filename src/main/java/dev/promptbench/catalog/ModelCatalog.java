package dev.promptbench.catalog;

import java.util.List;

/** Enumerates the model ids that may be paired with a prompt set. */
public interface ModelCatalog {
    List<String> list();

    default boolean contains(String modelId) {
        return list().contains(modelId);
    }

    static ModelCatalog of(List<String> modelIds) {
        var copy = List.copyOf(modelIds);
        return () -> copy;
    }

    static ModelCatalog of(String... modelIds) {
        return of(List.of(modelIds));
    }
}

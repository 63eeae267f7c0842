package dev.promptbench.run;

import io.opentelemetry.api.common.AttributeKey;

/** Span attribute keys recorded by generate and evaluate runs. */
final class RunAttributes {
    static final AttributeKey<String> PROMPT_SET_ID =
            AttributeKey.stringKey("promptbench.prompt_set_id");
    static final AttributeKey<String> MODEL_ID = AttributeKey.stringKey("promptbench.model_id");
    static final AttributeKey<String> JUDGE_MODEL_ID =
            AttributeKey.stringKey("promptbench.judge_model_id");
    static final AttributeKey<Long> PROMPT_INDEX =
            AttributeKey.longKey("promptbench.prompt_index");
    static final AttributeKey<String> FAILURE_KIND =
            AttributeKey.stringKey("promptbench.failure_kind");
    static final AttributeKey<String> OUTCOME = AttributeKey.stringKey("promptbench.outcome");
    static final AttributeKey<Long> DISPATCHED = AttributeKey.longKey("promptbench.dispatched");
    static final AttributeKey<Long> PENDING = AttributeKey.longKey("promptbench.pending");

    static final String PROVIDER_FAILURE_EVENT = "provider_failure";

    private RunAttributes() {}
}

package dev.promptbench.provider;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import lombok.Getter;

/**
 * A failed call to an external model provider.
 *
 * <p>Provider failures never escape a generate or evaluate run. They are retried when {@link
 * Kind#isRetryable()} and otherwise recorded against the prompt index that triggered them.
 */
public class ProviderException extends Exception {
    public enum Kind {
        TIMEOUT(true),
        RATE_LIMITED(true),
        QUOTA_EXCEEDED(false),
        AUTHENTICATION(false),
        CONTEXT_LENGTH_EXCEEDED(false),
        BAD_REQUEST(false),
        MALFORMED_RESPONSE(false),
        API_ERROR(false),
        /** the retry budget was spent on retryable failures */
        UNAVAILABLE(false);

        private final boolean retryable;

        Kind(boolean retryable) {
            this.retryable = retryable;
        }

        public boolean isRetryable() {
            return retryable;
        }
    }

    @Getter private final @Nonnull Kind kind;

    public ProviderException(@Nonnull Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ProviderException(@Nonnull Kind kind, String message, @Nullable Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    /** Text stored in place of a response when generation for an index fails. */
    public String toErrorMarker() {
        return "%s: %s".formatted(kind, getMessage());
    }
}

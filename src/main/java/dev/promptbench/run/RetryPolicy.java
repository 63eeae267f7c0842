package dev.promptbench.run;

import dev.promptbench.config.PromptBenchConfig;
import dev.promptbench.provider.ProviderException;
import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import javax.annotation.Nonnull;
import lombok.Getter;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;

/**
 * Bounded retries with exponential backoff and jitter for provider calls.
 *
 * <p>Only failures whose {@link ProviderException.Kind} is retryable are retried. Once the attempt
 * budget is spent the last failure is escalated to {@link ProviderException.Kind#UNAVAILABLE}.
 */
@Slf4j
@Getter
@Accessors(fluent = true)
public final class RetryPolicy {
    private final int maxAttempts;
    private final @Nonnull Duration initialBackoff;
    private final double multiplier;
    private final @Nonnull Duration maxBackoff;
    private final double jitter;

    public RetryPolicy(
            int maxAttempts,
            @Nonnull Duration initialBackoff,
            double multiplier,
            @Nonnull Duration maxBackoff,
            double jitter) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("max attempts must be positive: " + maxAttempts);
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("backoff multiplier must be >= 1: " + multiplier);
        }
        if (jitter < 0.0 || jitter > 1.0) {
            throw new IllegalArgumentException("jitter must be within [0, 1]: " + jitter);
        }
        this.maxAttempts = maxAttempts;
        this.initialBackoff = initialBackoff;
        this.multiplier = multiplier;
        this.maxBackoff = maxBackoff;
        this.jitter = jitter;
    }

    public static RetryPolicy of(PromptBenchConfig config) {
        return new RetryPolicy(
                config.maxAttempts(),
                config.initialBackoff(),
                config.backoffMultiplier(),
                config.maxBackoff(),
                config.backoffJitter());
    }

    /** A single provider call attempt. */
    @FunctionalInterface
    public interface Attempt<T> {
        T call() throws ProviderException, InterruptedException;
    }

    /**
     * Run {@code attempt} until it succeeds, fails with a non-retryable error, or the attempt
     * budget is spent.
     *
     * @throws ProviderException the non-retryable failure, or an {@code UNAVAILABLE} failure
     *     wrapping the last retryable one
     * @throws InterruptedException if the run is cancelled during an attempt or a backoff
     */
    public <T> T call(String description, Attempt<T> attempt)
            throws ProviderException, InterruptedException {
        for (int attemptNumber = 1; ; attemptNumber++) {
            try {
                return attempt.call();
            } catch (ProviderException e) {
                if (!e.getKind().isRetryable()) {
                    throw e;
                }
                if (attemptNumber >= maxAttempts) {
                    throw new ProviderException(
                            ProviderException.Kind.UNAVAILABLE,
                            "gave up after %d attempts, last failure %s: %s"
                                    .formatted(attemptNumber, e.getKind(), e.getMessage()),
                            e);
                }
                var delay = backoffDelay(attemptNumber);
                log.debug(
                        "{} failed with {} (attempt {}/{}), retrying in {} ms",
                        description,
                        e.getKind(),
                        attemptNumber,
                        maxAttempts,
                        delay.toMillis());
                Thread.sleep(delay.toMillis());
            }
        }
    }

    /** Delay to wait after the given failed attempt (1-based). */
    Duration backoffDelay(int attemptNumber) {
        double base = initialBackoff.toMillis() * Math.pow(multiplier, attemptNumber - 1);
        double capped = Math.min(base, maxBackoff.toMillis());
        double spread = capped * jitter;
        double jittered = capped - spread + ThreadLocalRandom.current().nextDouble() * 2 * spread;
        return Duration.ofMillis(Math.round(Math.min(jittered, maxBackoff.toMillis())));
    }
}

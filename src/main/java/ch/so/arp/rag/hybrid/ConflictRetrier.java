package ch.so.arp.rag.hybrid;

import java.time.Duration;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;

/**
 * Re-runs optimistic read-modify-write cycles that lost a compare-and-swap race.
 * Only {@link ConcurrencyConflictException} is retried; once the attempts are
 * exhausted the conflict propagates to the caller instead of being dropped.
 */
public class ConflictRetrier {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConflictRetrier.class);

    private final Retry retry;

    public ConflictRetrier(String name, int maxAttempts, Duration initialBackoff) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(initialBackoff, 1.5d))
                .retryExceptions(ConcurrencyConflictException.class)
                .build();
        this.retry = Retry.of(name, config);
        this.retry.getEventPublisher()
                .onRetry(event -> LOGGER.debug("Retrying {} after conflict (attempt {}): {}", name,
                        event.getNumberOfRetryAttempts(), event.getLastThrowable().getMessage()));
    }

    public <T> T execute(Supplier<T> cycle) {
        return retry.executeSupplier(cycle);
    }
}

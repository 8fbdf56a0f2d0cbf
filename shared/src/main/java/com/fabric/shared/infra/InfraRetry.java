package com.fabric.shared.infra;

import com.fabric.shared.error.TransientInfraException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.transaction.CannotCreateTransactionException;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Bounded exponential-backoff retry at the storage boundary.
 *
 * Transient data-access failures are translated to {@link TransientInfraException} and
 * retried; once the attempts are used up the last {@code TransientInfraException} escapes
 * to the caller. Every other exception passes through untouched on the first attempt.
 */
@Slf4j
public class InfraRetry {

    private final Retry retry;

    public InfraRetry(String name, int maxAttempts, Duration initialBackoff, double multiplier) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(initialBackoff, multiplier))
                .retryExceptions(TransientInfraException.class)
                .build();
        this.retry = Retry.of(name, config);
        this.retry.getEventPublisher()
                .onRetry(event -> log.warn("Transient infra failure, retrying: retry={}, attempt={}, wait={}",
                        name, event.getNumberOfRetryAttempts(), event.getWaitInterval()))
                .onError(event -> log.error("Transient infra failure, giving up: retry={}, attempts={}",
                        name, event.getNumberOfRetryAttempts(), event.getLastThrowable()));
    }

    public static InfraRetry noRetry(String name) {
        return new InfraRetry(name, 1, Duration.ofMillis(1), 2.0);
    }

    public <T> T call(String operation, Supplier<T> action) {
        return Retry.decorateSupplier(retry, () -> translate(operation, action)).get();
    }

    public void run(String operation, Runnable action) {
        call(operation, () -> {
            action.run();
            return null;
        });
    }

    private static <T> T translate(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (TransientDataAccessException | DataAccessResourceFailureException
                 | CannotCreateTransactionException e) {
            throw new TransientInfraException(operation + " failed: " + e.getMessage(), e);
        }
    }
}

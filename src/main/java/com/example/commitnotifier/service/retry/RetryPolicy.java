package com.example.commitnotifier.service.retry;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.core.functions.CheckedRunnable;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Bounded retry with capped exponential backoff around an arbitrary action.
 * <p>
 * The wait before attempt n+1 is {@code min(baseDelay * 2^(n-1), maxDelay)}.
 * Every failure is retried; no state is carried between attempts. After the
 * last attempt the last failure is rethrown unchanged.
 */
@Slf4j
@Getter
public class RetryPolicy {

    private static final double BACKOFF_MULTIPLIER = 2.0;

    private final int maxAttempts;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final IntervalFunction intervalFunction;

    public RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.maxAttempts = maxAttempts;
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay.compareTo(baseDelay) < 0 ? baseDelay : maxDelay;
        this.intervalFunction = IntervalFunction.ofExponentialBackoff(
                this.baseDelay.toMillis(), BACKOFF_MULTIPLIER, this.maxDelay.toMillis());
    }

    /**
     * Wait applied after the given failed attempt (1-based)
     */
    public Duration delayAfterAttempt(int failedAttempt) {
        return Duration.ofMillis(intervalFunction.apply(failedAttempt));
    }

    /**
     * Run the action until it succeeds or the attempts are used up
     *
     * @param context label used in log lines, e.g. the repository name
     * @param action  the unit of work; must be safe to run again from scratch
     * @throws Exception the failure of the last attempt
     */
    public void execute(String context, CheckedRunnable action) throws Exception {
        var retry = Retry.of(context, RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(intervalFunction)
                .build());

        retry.getEventPublisher()
                .onRetry(event -> log.warn("Attempt {}/{} failed for {}: {}. Retrying in {}ms",
                        event.getNumberOfRetryAttempts(), maxAttempts, context,
                        messageOf(event.getLastThrowable()), event.getWaitInterval().toMillis()))
                .onError(event -> log.error("Attempt {}/{} failed for {}: {}. Giving up",
                        event.getNumberOfRetryAttempts(), maxAttempts, context,
                        messageOf(event.getLastThrowable())));

        try {
            Retry.decorateCheckedRunnable(retry, action).run();
        } catch (Exception | Error e) {
            throw e;
        } catch (Throwable t) {
            throw new IllegalStateException(t);
        }
    }

    private static String messageOf(Throwable t) {
        return t != null ? t.getMessage() : "unknown error";
    }
}

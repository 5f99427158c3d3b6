package com.ragingest.embed;

import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class RetryExecutor {
    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final RetryPolicy policy;
    private final Sleeper sleeper;

    public RetryExecutor(RetryPolicy policy) {
        this(policy, Sleeper.SYSTEM);
    }

    public RetryExecutor(RetryPolicy policy, Sleeper sleeper) {
        this.policy = policy;
        this.sleeper = sleeper;
    }

    public <T> RetryResult<T> execute(String operation, Attempt<T> attempt) {
        int attempts = 0;
        while (true) {
            attempts++;
            AttemptOutcome<T> outcome = attempt.run(attempts);
            if (outcome.succeeded()) {
                if (attempts > 1) {
                    log.info("Operation {} succeeded on attempt={}", operation, attempts);
                }
                return new RetryResult<>(outcome, attempts, false);
            }
            if (!outcome.failureKind().retryable() || attempts >= policy.maxAttempts()) {
                log.warn("Operation {} gave up attempt={} kind={} cause={}",
                        operation, attempts, outcome.failureKind(), messageOf(outcome));
                return new RetryResult<>(outcome, attempts, false);
            }

            Duration backoff = policy.backoffBeforeRetry(attempts - 1);
            log.warn("Operation {} failed attempt={}/{} kind={} retryInMs={} cause={}",
                    operation, attempts, policy.maxAttempts(), outcome.failureKind(), backoff.toMillis(), messageOf(outcome));
            try {
                sleeper.sleep(backoff);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return new RetryResult<>(outcome, attempts, true);
            }
        }
    }

    public RetryPolicy policy() {
        return policy;
    }

    private static String messageOf(AttemptOutcome<?> outcome) {
        return outcome.failure() == null ? "none" : outcome.failure().getMessage();
    }

    @FunctionalInterface
    public interface Attempt<T> {
        AttemptOutcome<T> run(int attemptNumber);
    }
}

package com.github.dimitryivaniuta.gateway.esim.service;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Retry delays shared by the job queue and the outbox dispatcher.
 */
final class Backoff {

    private static final int MAX_ERROR_LENGTH = 2000;

    private Backoff() {
    }

    /**
     * Exponential backoff {@code base * 2^(attempt-1)} capped at {@code max}, with jitter in [0.5, 1.5).
     * The result never drops below {@code base} nor exceeds {@code max}.
     *
     * @param base first delay
     * @param max upper bound
     * @param attempt 1-based attempt number
     * @return delay
     */
    static Duration compute(Duration base, Duration max, int attempt) {
        double exp = Math.pow(2.0, Math.max(0, attempt - 1));
        long candidateMs = (long) (base.toMillis() * exp);
        long capped = Math.min(candidateMs, max.toMillis());

        double jitter = 0.5 + ThreadLocalRandom.current().nextDouble();
        long withJitter = (long) (capped * jitter);

        return Duration.ofMillis(Math.max(base.toMillis(), Math.min(withJitter, max.toMillis())));
    }

    /**
     * Error text suitable for a {@code last_error} column.
     *
     * @param ex failure
     * @return message, or the exception type when there is none, truncated
     */
    static String errorText(Throwable ex) {
        String msg = ex.getMessage();
        if (msg == null) {
            msg = ex.getClass().getSimpleName();
        }
        if (msg.length() > MAX_ERROR_LENGTH) {
            msg = msg.substring(0, MAX_ERROR_LENGTH);
        }
        return msg;
    }
}

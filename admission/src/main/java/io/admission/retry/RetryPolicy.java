package io.admission.retry;

/**
 * Decides whether a failed job attempt is tried again, and how long to pause first. Budget admission is never
 * retried through this; a refused reservation fails the job outright.
 */
public interface RetryPolicy {
    /** @param attempt 1-based number of the attempt that just failed */
    boolean shouldRetry(int attempt, Exception e);

    /** Pause before the attempt that follows {@code attempt}. */
    long backoffMillis(int attempt);
}

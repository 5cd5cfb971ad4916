package io.admission.retry;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeoutException;

/**
 * Doubling backoff with a cap and random jitter. Only transient failures are retried: I/O and timeout
 * exceptions, or anything whose message or class name mentions a known transient condition.
 */
public class ExponentialBackoffRetryPolicy implements RetryPolicy {
    static final List<String> TRANSIENT_MARKERS = List.of(
            "network", "timeout", "timed out", "connection", "socket", "econnreset", "etimedout",
            "service unavailable", "bad gateway", "gateway timeout", "temporary failure", "rate limit");

    private final int maxAttempts;
    private final long baseMillis;
    private final long maxMillis;
    private final long jitterMillis;

    public ExponentialBackoffRetryPolicy(int maxAttempts, long baseMillis, long maxMillis, long jitterMillis) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseMillis = Math.max(0, baseMillis);
        this.maxMillis = Math.max(this.baseMillis, maxMillis);
        this.jitterMillis = Math.max(0, jitterMillis);
    }

    public ExponentialBackoffRetryPolicy(int maxAttempts, long baseMillis, long maxMillis) {
        this(maxAttempts, baseMillis, maxMillis, 0);
    }

    @Override
    public boolean shouldRetry(int attempt, Exception e) {
        return attempt < maxAttempts && isTransient(e);
    }

    @Override
    public long backoffMillis(int attempt) {
        long delay = Math.min(baseMillis * (1L << Math.min(20, Math.max(0, attempt - 1))), maxMillis);
        long jitter = jitterMillis == 0 ? 0 : ThreadLocalRandom.current().nextLong(jitterMillis);
        return delay + jitter;
    }

    static boolean isTransient(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof IOException || t instanceof TimeoutException) return true;
            String text = (t.getClass().getSimpleName() + " " + (t.getMessage() == null ? "" : t.getMessage()))
                    .toLowerCase(Locale.ROOT);
            for (String marker : TRANSIENT_MARKERS) {
                if (text.contains(marker)) return true;
            }
            if (t.getCause() == t) break;
        }
        return false;
    }
}

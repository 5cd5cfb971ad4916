package io.admission.runner;

/**
 * Outcome of one job. {@code value} is null and {@code error} set when the job did not succeed.
 */
public record JobResult<T>(
        int batchId,
        String name,
        boolean success,
        T value,
        String error,
        int attempts,
        long elapsedMillis
) {
    public static <T> JobResult<T> success(int batchId, String name, T value, int attempts, long elapsedMillis) {
        return new JobResult<>(batchId, name, true, value, null, attempts, elapsedMillis);
    }

    public static <T> JobResult<T> failure(int batchId, String name, String error, int attempts, long elapsedMillis) {
        return new JobResult<>(batchId, name, false, null, error, attempts, elapsedMillis);
    }
}

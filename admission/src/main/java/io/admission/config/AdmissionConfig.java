package io.admission.config;

/**
 * Settings for one admission-controlled run. Each key is read from a system property first, then from the
 * environment, then falls back to a default.
 *
 * @param totalBudget 0 means "derive from the provider's token limit"
 */
public record AdmissionConfig(
        int maxConcurrent,
        long totalBudget,
        String provider,
        double safetyMargin,
        int retryMaxAttempts,
        long retryBaseMillis,
        long retryMaxMillis,
        long retryJitterMillis
) {
    public static AdmissionConfig defaults() {
        return new AdmissionConfig(3, 0, "auto", 0.8, 3, 1000, 10_000, 100);
    }

    public static AdmissionConfig fromEnv() {
        int maxConcurrent = Integer.parseInt(read("admission.maxConcurrent", "ADMISSION_MAX_CONCURRENT", "3"));
        long budget = Long.parseLong(read("admission.totalBudget", "ADMISSION_TOTAL_BUDGET", "0"));
        String provider = read("admission.provider", "ADMISSION_PROVIDER", "auto");
        double margin = Double.parseDouble(read("admission.safetyMargin", "ADMISSION_SAFETY_MARGIN", "0.8"));
        int attempts = Integer.parseInt(read("admission.retry.maxAttempts", "ADMISSION_RETRY_MAX_ATTEMPTS", "3"));
        long base = Long.parseLong(read("admission.retry.baseMillis", "ADMISSION_RETRY_BASE_MILLIS", "1000"));
        long max = Long.parseLong(read("admission.retry.maxMillis", "ADMISSION_RETRY_MAX_MILLIS", "10000"));
        long jitter = Long.parseLong(read("admission.retry.jitterMillis", "ADMISSION_RETRY_JITTER_MILLIS", "100"));
        return new AdmissionConfig(maxConcurrent, budget, provider, margin, attempts, base, max, jitter).validate();
    }

    public AdmissionConfig withMaxConcurrent(int n) {
        return new AdmissionConfig(n, totalBudget, provider, safetyMargin, retryMaxAttempts, retryBaseMillis, retryMaxMillis, retryJitterMillis);
    }

    public AdmissionConfig withTotalBudget(long budget) {
        return new AdmissionConfig(maxConcurrent, budget, provider, safetyMargin, retryMaxAttempts, retryBaseMillis, retryMaxMillis, retryJitterMillis);
    }

    public AdmissionConfig withProvider(String p) {
        return new AdmissionConfig(maxConcurrent, totalBudget, p, safetyMargin, retryMaxAttempts, retryBaseMillis, retryMaxMillis, retryJitterMillis);
    }

    public AdmissionConfig withRetry(int attempts, long baseMillis, long maxMillis, long jitterMillis) {
        return new AdmissionConfig(maxConcurrent, totalBudget, provider, safetyMargin, attempts, baseMillis, maxMillis, jitterMillis);
    }

    public AdmissionConfig validate() {
        if (maxConcurrent <= 0) throw new IllegalArgumentException("maxConcurrent must be > 0: " + maxConcurrent);
        if (totalBudget < 0) throw new IllegalArgumentException("totalBudget must be >= 0: " + totalBudget);
        if (!(safetyMargin > 0 && safetyMargin <= 1)) throw new IllegalArgumentException("safetyMargin must be in (0, 1]: " + safetyMargin);
        if (retryMaxAttempts <= 0) throw new IllegalArgumentException("retry.maxAttempts must be > 0: " + retryMaxAttempts);
        if (retryBaseMillis < 0 || retryMaxMillis < 0 || retryJitterMillis < 0) throw new IllegalArgumentException("retry delays must be >= 0");
        return this;
    }

    private static String read(String property, String env, String def) {
        return System.getProperty(property, System.getenv().getOrDefault(env, def));
    }
}

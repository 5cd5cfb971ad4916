package io.admission.runner;

import com.codahale.metrics.MetricRegistry;
import io.admission.config.AdmissionConfig;
import io.admission.metrics.AdmissionMetrics;
import io.admission.retry.ExponentialBackoffRetryPolicy;
import io.admission.retry.RetryPolicy;

import java.util.Objects;

public class BatchRunnerBuilder {
    private AdmissionConfig config;
    private RetryPolicy retryPolicy;
    private MetricRegistry metricRegistry = new MetricRegistry();
    private Sleeper sleeper = Sleeper.SYSTEM;

    public BatchRunnerBuilder config(AdmissionConfig c) { this.config = c; return this; }
    public BatchRunnerBuilder retry(RetryPolicy r) { this.retryPolicy = r; return this; }
    public BatchRunnerBuilder metrics(MetricRegistry r) { this.metricRegistry = r; return this; }
    public BatchRunnerBuilder sleeper(Sleeper s) { this.sleeper = s; return this; }

    public BatchRunner build() {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(metricRegistry, "metrics");
        RetryPolicy retry = retryPolicy != null ? retryPolicy : new ExponentialBackoffRetryPolicy(
                config.retryMaxAttempts(), config.retryBaseMillis(), config.retryMaxMillis(), config.retryJitterMillis());
        return new BatchRunner(config, retry, new AdmissionMetrics(metricRegistry), sleeper);
    }
}

package io.admission.runner;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.admission.config.AdmissionConfig;
import io.admission.retry.ExponentialBackoffRetryPolicy;
import io.admission.retry.RetryPolicy;

public class AdmissionModule extends AbstractModule {
    private final AdmissionConfig config;

    public AdmissionModule(AdmissionConfig config) { this.config = config.validate(); }

    @Override
    protected void configure() {
        bind(AdmissionConfig.class).toInstance(config);
        bind(Sleeper.class).toInstance(Sleeper.SYSTEM);
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton RetryPolicy retryPolicy() {
        return new ExponentialBackoffRetryPolicy(config.retryMaxAttempts(), config.retryBaseMillis(), config.retryMaxMillis(), config.retryJitterMillis());
    }

    @Provides @Singleton BatchRunner batchRunner(MetricRegistry registry, RetryPolicy retry, Sleeper sleeper) {
        return new BatchRunnerBuilder()
                .config(config)
                .retry(retry)
                .metrics(registry)
                .sleeper(sleeper)
                .build();
    }
}

package io.admission.metrics;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Gauge;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;
import io.admission.budget.TokenBudget;
import io.admission.gate.Gate;

/**
 * Dropwizard registry wrapper for admission-controlled runs. {@link #watch} publishes gate and ledger state as
 * gauges so backpressure can be read from the registry while a run is in flight.
 */
public class AdmissionMetrics {
    public static final String GATE_AVAILABLE = "admission.gate.available";
    public static final String GATE_WAITING = "admission.gate.waiting";
    public static final String BUDGET_USED = "admission.budget.used";
    public static final String BUDGET_RESERVED = "admission.budget.reserved";
    public static final String BUDGET_AVAILABLE = "admission.budget.available";
    public static final String BUDGET_UTILIZATION = "admission.budget.utilization";

    private final MetricRegistry registry;

    public AdmissionMetrics(MetricRegistry registry) {
        this.registry = registry;
    }

    public MetricRegistry registry() { return registry; }

    public Counter counter(String name) { return registry.counter(name); }
    public Meter meter(String name) { return registry.meter(name); }
    public Timer timer(String name) { return registry.timer(name); }

    /** Point the admission gauges at this gate and budget, replacing whatever an earlier run registered. */
    public void watch(Gate gate, TokenBudget budget) {
        gauge(GATE_AVAILABLE, gate::getAvailablePermits);
        gauge(GATE_WAITING, gate::getWaitingCount);
        gauge(BUDGET_USED, budget::getUsedTokens);
        gauge(BUDGET_RESERVED, budget::getReservedTokens);
        gauge(BUDGET_AVAILABLE, budget::getAvailableBudget);
        gauge(BUDGET_UTILIZATION, () -> budget.getBudgetStatus().utilizationPercent());
    }

    public Object gaugeValue(String name) {
        Gauge<?> gauge = registry.getGauges().get(name);
        return gauge == null ? null : gauge.getValue();
    }

    private <T> void gauge(String name, Gauge<T> gauge) {
        registry.remove(name);
        registry.register(name, gauge);
    }
}

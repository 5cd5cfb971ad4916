package io.admission.runner;

import java.io.IOException;
import java.util.Random;

/**
 * Stand-in for a backend call: sleeps for a simulated latency and fails with a transient error at a fixed rate.
 */
final class SimulatedJob implements Job<String> {
    private final String name;
    private final long estimatedCost;
    private final long latencyMillis;
    private final double failureRate;
    private final Random random;

    SimulatedJob(String name, long estimatedCost, long latencyMillis, double failureRate, long seed) {
        this.name = name;
        this.estimatedCost = estimatedCost;
        this.latencyMillis = latencyMillis;
        this.failureRate = failureRate;
        this.random = new Random(seed);
    }

    @Override public String name() { return name; }
    @Override public long estimatedCost() { return estimatedCost; }

    @Override
    public String execute() throws Exception {
        Thread.sleep(latencyMillis);
        synchronized (random) {
            if (random.nextDouble() < failureRate) {
                throw new IOException("simulated backend timeout for " + name);
            }
        }
        return name + " used ~" + estimatedCost + " tokens";
    }
}

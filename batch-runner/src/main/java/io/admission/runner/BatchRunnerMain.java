package io.admission.runner;

import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;
import com.google.inject.Guice;
import com.google.inject.Injector;
import io.admission.config.AdmissionConfig;
import io.admission.metrics.AdmissionMetrics;
import picocli.CommandLine;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.Callable;

/**
 * CLI that pushes a batch of simulated backend jobs through the admission gate and token budget.
 */
@CommandLine.Command(name = "batch-run", mixinStandardHelpOptions = true, description = "Run simulated jobs under concurrency and token-budget admission")
public final class BatchRunnerMain implements Callable<Integer> {
    @CommandLine.Option(names = {"-n", "--jobs"}, description = "Number of jobs", defaultValue = "12")
    int jobs;

    @CommandLine.Option(names = {"-c", "--max-concurrent"}, description = "Concurrency ceiling; default from admission.maxConcurrent")
    Integer maxConcurrent;

    @CommandLine.Option(names = {"-b", "--budget"}, description = "Total token budget; 0 derives it from the provider")
    Long budget;

    @CommandLine.Option(names = {"-p", "--provider"}, description = "Provider whose token limits size the budget")
    String provider;

    @CommandLine.Option(names = {"-a", "--avg-cost"}, description = "Average estimated tokens per job", defaultValue = "5000")
    long avgCost;

    @CommandLine.Option(names = {"-l", "--latency-ms"}, description = "Simulated backend latency", defaultValue = "200")
    long latencyMillis;

    @CommandLine.Option(names = {"-f", "--failure-rate"}, description = "Chance a backend call fails transiently", defaultValue = "0.1")
    double failureRate;

    @CommandLine.Option(names = {"-s", "--seed"}, description = "Random seed", defaultValue = "42")
    long seed;

    public static void main(String[] args) {
        int code = new CommandLine(new BatchRunnerMain()).execute(args);
        System.exit(code);
    }

    @Override
    public Integer call() {
        AdmissionConfig config;
        try {
            config = AdmissionConfig.fromEnv();
            if (maxConcurrent != null) config = config.withMaxConcurrent(maxConcurrent);
            if (budget != null) config = config.withTotalBudget(budget);
            if (provider != null) config = config.withProvider(provider);
            config.validate();
        } catch (IllegalArgumentException e) {
            System.err.println("Invalid configuration: " + e.getMessage());
            return 2;
        }
        if (jobs <= 0 || avgCost <= 0 || failureRate < 0 || failureRate > 1) {
            System.err.println("jobs and avg-cost must be positive, failure-rate within [0, 1]");
            return 2;
        }

        Injector injector = Guice.createInjector(new AdmissionModule(config));
        BatchRunner runner = injector.getInstance(BatchRunner.class);
        MetricRegistry registry = injector.getInstance(MetricRegistry.class);

        RunReport<String> report = runner.run(buildJobs());

        System.out.println("Per-job summary:");
        for (JobResult<String> r : report.results()) {
            System.out.println("  #" + r.batchId() + " " + r.name() + ": " + (r.success() ? "ok" : "FAILED (" + r.error() + ")")
                    + " attempts=" + r.attempts() + " elapsedMs=" + r.elapsedMillis());
        }
        printOnce(registry, report);
        return report.allSucceeded() ? 0 : 1;
    }

    private List<SimulatedJob> buildJobs() {
        Random random = new Random(seed);
        List<SimulatedJob> list = new ArrayList<>(jobs);
        for (int i = 0; i < jobs; i++) {
            // spread estimates +/-50% around the average
            long cost = Math.max(1, Math.round(avgCost * (0.5 + random.nextDouble())));
            list.add(new SimulatedJob("job-" + i, cost, latencyMillis, failureRate, random.nextLong()));
        }
        return list;
    }

    private static void printOnce(MetricRegistry r, RunReport<?> report) {
        Meter admitted = r.meter(BatchRunner.JOBS_ADMITTED);
        Meter rejected = r.meter(BatchRunner.JOBS_REJECTED);
        Meter failed = r.meter(BatchRunner.JOBS_FAILED);
        Timer jobTime = r.timer(BatchRunner.JOB_TIME);
        long retries = r.counter(BatchRunner.JOB_RETRIES).getCount();
        Object utilization = new AdmissionMetrics(r).gaugeValue(AdmissionMetrics.BUDGET_UTILIZATION);

        String now = Instant.now().toString();
        System.out.println("[" + now + "] metrics:" +
                " concurrency=" + report.concurrency() + " budget=" + report.totalBudget() +
                " | admitted=" + admitted.getCount() + " rejected=" + rejected.getCount() +
                " failed=" + failed.getCount() + " retries=" + retries +
                " | used=" + report.budget().used() + " utilization%=" + utilization +
                " | t.p50(ms)=" + nsToMs(jobTime.getSnapshot().getMedian()) +
                " | elapsedMs=" + report.elapsedMillis()
        );
    }

    private static String nsToMs(double nanos) { return String.format("%.3f", nanos / 1_000_000.0); }
}

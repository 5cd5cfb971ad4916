package io.admission.runner;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Meter;
import com.codahale.metrics.Timer;
import io.admission.budget.TokenBudget;
import io.admission.budget.TokenBudgetLedger;
import io.admission.config.AdmissionConfig;
import io.admission.gate.FifoGate;
import io.admission.gate.Gate;
import io.admission.metrics.AdmissionMetrics;
import io.admission.retry.RetryPolicy;
import io.admission.sizing.ConcurrencySizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a list of jobs under a concurrency gate and a token budget.
 * <p>
 * Each run sizes its own gate and ledger, then dispatches jobs in submission order: wait for a permit, reserve
 * the job's estimate, hand it to a worker. A job that cannot get its reservation fails without running. A
 * failing job never stops the run; every job ends up with a {@link JobResult}.
 */
public class BatchRunner {
    private static final Logger log = LoggerFactory.getLogger(BatchRunner.class);

    public static final String JOBS_ADMITTED = "runner.jobs.admitted";
    public static final String JOBS_REJECTED = "runner.jobs.rejected";
    public static final String JOBS_SUCCEEDED = "runner.jobs.succeeded";
    public static final String JOBS_FAILED = "runner.jobs.failed";
    public static final String JOB_TIME = "runner.job.time";
    public static final String JOB_RETRIES = "runner.job.retries";

    private final AdmissionConfig config;
    private final RetryPolicy retryPolicy;
    private final AdmissionMetrics metrics;
    private final Sleeper sleeper;

    private final Meter admittedMeter;
    private final Meter rejectedMeter;
    private final Meter succeededMeter;
    private final Meter failedMeter;
    private final Timer jobTimer;
    private final Counter retryCounter;

    public BatchRunner(AdmissionConfig config, RetryPolicy retryPolicy, AdmissionMetrics metrics, Sleeper sleeper) {
        this.config = Objects.requireNonNull(config).validate();
        this.retryPolicy = Objects.requireNonNull(retryPolicy);
        this.metrics = Objects.requireNonNull(metrics);
        this.sleeper = Objects.requireNonNull(sleeper);
        this.admittedMeter = metrics.meter(JOBS_ADMITTED);
        this.rejectedMeter = metrics.meter(JOBS_REJECTED);
        this.succeededMeter = metrics.meter(JOBS_SUCCEEDED);
        this.failedMeter = metrics.meter(JOBS_FAILED);
        this.jobTimer = metrics.timer(JOB_TIME);
        this.retryCounter = metrics.counter(JOB_RETRIES);
    }

    public AdmissionConfig config() { return config; }

    public <T> RunReport<T> run(List<? extends Job<T>> jobs) {
        if (jobs.isEmpty()) {
            throw new IllegalArgumentException("No jobs to run");
        }
        long start = System.nanoTime();

        List<Long> estimates = jobs.stream().map(Job::estimatedCost).toList();
        long avgCost = ConcurrencySizer.averageCost(estimates);
        long totalBudget = config.totalBudget() > 0
                ? config.totalBudget()
                : ProviderLimits.totalBudgetFor(config.provider(), jobs.size(), config.safetyMargin());
        int concurrency = ConcurrencySizer.calculateOptimalConcurrency(jobs.size(), config.maxConcurrent(), avgCost, totalBudget);

        Gate gate = new FifoGate(concurrency);
        TokenBudget ledger = new TokenBudgetLedger(totalBudget);
        metrics.watch(gate, ledger);
        log.info("Running {} jobs: {} concurrent, {} total token budget (avg estimate {})",
                jobs.size(), concurrency, totalBudget, avgCost);

        ExecutorService workers = Executors.newFixedThreadPool(concurrency, namedThreads());
        List<CompletableFuture<JobResult<T>>> pending = new ArrayList<>(jobs.size());
        try {
            dispatch(jobs, gate, ledger, workers, pending);
            List<JobResult<T>> results = collect(jobs, pending);
            long elapsed = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            RunReport<T> report = new RunReport<>(results, concurrency, totalBudget, gate.getStatus(), ledger.getBudgetStatus(), elapsed);
            log.info("Run finished in {}ms: {} succeeded, {} failed, {} tokens used",
                    elapsed, report.succeeded().size(), report.failed().size(), report.budget().used());
            return report;
        } finally {
            workers.shutdown();
        }
    }

    private <T> void dispatch(List<? extends Job<T>> jobs, Gate gate, TokenBudget ledger, ExecutorService workers,
                              List<CompletableFuture<JobResult<T>>> pending) {
        for (int i = 0; i < jobs.size(); i++) {
            Job<T> job = jobs.get(i);
            int batchId = i;
            Optional<AdmissionTicket> ticket;
            try {
                ticket = AdmissionTicket.admit(batchId, job.estimatedCost(), gate, ledger);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                log.warn("Dispatch interrupted, {} jobs not started", jobs.size() - i);
                for (int j = i; j < jobs.size(); j++) {
                    pending.add(CompletableFuture.completedFuture(JobResult.<T>failure(j, jobs.get(j).name(), "interrupted", 0, 0)));
                }
                return;
            }
            if (ticket.isEmpty()) {
                rejectedMeter.mark();
                log.warn("Insufficient token budget for job {} (needs {}, {} available)",
                        job.name(), job.estimatedCost(), ledger.getAvailableBudget());
                pending.add(CompletableFuture.completedFuture(
                        JobResult.<T>failure(batchId, job.name(), "Insufficient token budget for job " + job.name(), 0, 0)));
                continue;
            }
            admittedMeter.mark();
            AdmissionTicket admitted = ticket.get();
            log.debug("Dispatching job {}/{}: {}", batchId + 1, jobs.size(), job.name());
            try {
                pending.add(CompletableFuture.supplyAsync(() -> execute(batchId, job, admitted), workers));
            } catch (RejectedExecutionException e) {
                admitted.close();
                failedMeter.mark();
                pending.add(CompletableFuture.completedFuture(JobResult.<T>failure(batchId, job.name(), e.toString(), 0, 0)));
            }
        }
    }

    private <T> JobResult<T> execute(int batchId, Job<T> job, AdmissionTicket ticket) {
        long t0 = System.nanoTime();
        int attempt = 0;
        try (ticket; Timer.Context ignored = jobTimer.time()) {
            while (true) {
                attempt++;
                try {
                    T value = job.execute();
                    succeededMeter.mark();
                    log.debug("Job {} completed in {}ms", job.name(), millisSince(t0));
                    return JobResult.success(batchId, job.name(), value, attempt, millisSince(t0));
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    failedMeter.mark();
                    return JobResult.failure(batchId, job.name(), "interrupted", attempt, millisSince(t0));
                } catch (Exception e) {
                    if (!retryPolicy.shouldRetry(attempt, e)) {
                        failedMeter.mark();
                        log.warn("Job {} failed after {} attempt(s): {}", job.name(), attempt, e.toString());
                        return JobResult.failure(batchId, job.name(), describe(e), attempt, millisSince(t0));
                    }
                    retryCounter.inc();
                    long backoff = retryPolicy.backoffMillis(attempt);
                    log.warn("Job {} failed (attempt {}), retrying in {}ms: {}", job.name(), attempt, backoff, e.toString());
                    try {
                        sleeper.sleep(backoff);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        failedMeter.mark();
                        return JobResult.failure(batchId, job.name(), "interrupted", attempt, millisSince(t0));
                    }
                }
            }
        }
    }

    private <T> List<JobResult<T>> collect(List<? extends Job<T>> jobs, List<CompletableFuture<JobResult<T>>> pending) {
        List<JobResult<T>> results = new ArrayList<>(pending.size());
        for (int i = 0; i < pending.size(); i++) {
            try {
                results.add(pending.get(i).join());
            } catch (CompletionException e) {
                // only errors escape execute(); the ticket was already closed on the way out
                failedMeter.mark();
                log.error("Job {} aborted", jobs.get(i).name(), e.getCause());
                results.add(JobResult.failure(i, jobs.get(i).name(), describe(e.getCause()), 0, 0));
            }
        }
        return results;
    }

    private static String describe(Throwable e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }

    private static long millisSince(long t0) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0);
    }

    private static ThreadFactory namedThreads() {
        AtomicInteger n = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "batch-worker-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}

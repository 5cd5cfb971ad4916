package io.admission.sizing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;

/**
 * Picks how many jobs to run side by side from three ceilings: the job count, the configured maximum, and how
 * many average-cost jobs the token budget can hold. Evaluated once per run.
 */
public final class ConcurrencySizer {
    private static final Logger log = LoggerFactory.getLogger(ConcurrencySizer.class);

    private ConcurrencySizer() {
    }

    /**
     * @param totalJobs      units of work in this run
     * @param maxConcurrent  configured hard ceiling
     * @param avgCostPerJob  estimated tokens per job; zero adds no budget ceiling
     * @param totalBudget    tokens available to the run
     * @return concurrency degree, never below 1
     */
    public static int calculateOptimalConcurrency(int totalJobs, int maxConcurrent, long avgCostPerJob, long totalBudget) {
        int optimal = Math.min(maxConcurrent, totalJobs);

        long budgetLimit = avgCostPerJob == 0 ? Long.MAX_VALUE : Math.floorDiv(totalBudget, avgCostPerJob);
        if (budgetLimit < optimal) {
            optimal = (int) Math.max(0, budgetLimit);
        }

        // a tight budget degrades to one job at a time instead of refusing the run
        optimal = Math.max(1, optimal);

        log.debug("Calculated optimal concurrency: {} (max: {}, jobs: {}, budget-limited: {})",
                optimal, maxConcurrent, totalJobs, budgetLimit == Long.MAX_VALUE ? "none" : budgetLimit);
        return optimal;
    }

    /** Mean of the estimates, rounded up. Returns 0 for an empty collection. */
    public static long averageCost(Collection<Long> estimates) {
        if (estimates.isEmpty()) return 0;
        int n = estimates.size();
        // sum kept as quotient and remainder to stay within long range
        long quotient = 0;
        long remainder = 0;
        for (long e : estimates) {
            long cost = Math.max(0, e);
            quotient += cost / n;
            remainder += cost % n;
            if (remainder >= n) {
                quotient += remainder / n;
                remainder %= n;
            }
        }
        return remainder > 0 ? quotient + 1 : quotient;
    }
}

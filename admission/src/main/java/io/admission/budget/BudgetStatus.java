package io.admission.budget;

/** Snapshot of a {@link TokenBudget} for monitoring. */
public record BudgetStatus(
        long total,
        long used,
        long reserved,
        long available,
        int activeBatches,
        double utilizationPercent
) {
}

package io.admission.budget;

/**
 * TokenBudget governs a shared, finite token quota split across concurrently running batches.
 * <p>
 * Work reserves its estimated cost before it starts and commits that same estimate on release.
 */
public interface TokenBudget {
    /** Reserve tokens for a batch. Return false, leaving state untouched, if the reservation is refused. */
    boolean allocateForBatch(int batchId, long estimatedTokens);

    /** Commit a batch's reservation to used tokens. Unknown ids are ignored. */
    void releaseBatch(int batchId);

    long getAvailableBudget();
    long getTotalBudget();
    long getUsedTokens();
    long getReservedTokens();
    int getActiveBatches();

    boolean isAllocated(int batchId);

    /** Reserved amount for a live batch, or 0 when none. */
    long getAllocation(int batchId);

    BudgetStatus getBudgetStatus();

    /** Resize the ceiling. Existing reservations are kept even if they no longer fit. */
    void updateBudget(long newBudget);

    /** Forget all usage and reservations; the ceiling is kept. */
    void reset();
}

package io.admission.budget;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Two-phase token accounting: {@link #allocateForBatch} reserves an estimate, {@link #releaseBatch} moves that
 * estimate from reserved to used. Every method runs under the ledger's monitor, so the admission check and the
 * reservation it guards happen as one step.
 * <p>
 * Holds {@code used + reserved <= total} after every admission. Only {@link #updateBudget} may break it, by
 * shrinking the ceiling below what is already committed.
 */
public class TokenBudgetLedger implements TokenBudget {
    private static final Logger log = LoggerFactory.getLogger(TokenBudgetLedger.class);

    private final Map<Integer, Long> allocations = new HashMap<>();
    private long totalBudget;
    private long usedTokens;
    private long reservedTokens;

    public TokenBudgetLedger(long totalBudget) {
        requirePositive(totalBudget);
        this.totalBudget = totalBudget;
        log.debug("Token ledger created with budget of {} tokens", totalBudget);
    }

    @Override
    public synchronized boolean allocateForBatch(int batchId, long estimatedTokens) {
        if (estimatedTokens <= 0) {
            log.warn("Invalid token estimate for batch {}: {}", batchId, estimatedTokens);
            return false;
        }
        if (allocations.containsKey(batchId)) {
            log.warn("Batch {} already has token allocation", batchId);
            return false;
        }
        if (estimatedTokens > totalBudget - usedTokens - reservedTokens) {
            log.debug("Insufficient token budget for batch {}: need {}, available {}",
                    batchId, estimatedTokens, getAvailableBudget());
            return false;
        }

        reservedTokens += estimatedTokens;
        allocations.put(batchId, estimatedTokens);
        log.debug("Allocated {} tokens for batch {} ({} remaining)", estimatedTokens, batchId, getAvailableBudget());
        return true;
    }

    @Override
    public synchronized void releaseBatch(int batchId) {
        Long allocated = allocations.remove(batchId);
        if (allocated == null) {
            log.warn("No token allocation found for batch {}", batchId);
            return;
        }
        // the estimate is what gets committed; actual usage is never reconciled
        reservedTokens -= allocated;
        usedTokens += allocated;
        log.debug("Released {} tokens from batch {} ({} now available)", allocated, batchId, getAvailableBudget());
    }

    @Override
    public synchronized long getAvailableBudget() {
        return totalBudget - usedTokens - reservedTokens;
    }

    @Override
    public synchronized long getTotalBudget() {
        return totalBudget;
    }

    @Override
    public synchronized long getUsedTokens() {
        return usedTokens;
    }

    @Override
    public synchronized long getReservedTokens() {
        return reservedTokens;
    }

    @Override
    public synchronized int getActiveBatches() {
        return allocations.size();
    }

    @Override
    public synchronized boolean isAllocated(int batchId) {
        return allocations.containsKey(batchId);
    }

    @Override
    public synchronized long getAllocation(int batchId) {
        return allocations.getOrDefault(batchId, 0L);
    }

    @Override
    public synchronized BudgetStatus getBudgetStatus() {
        double utilization = ((double) (usedTokens + reservedTokens) / totalBudget) * 100.0;
        return new BudgetStatus(
                totalBudget,
                usedTokens,
                reservedTokens,
                getAvailableBudget(),
                allocations.size(),
                Math.round(utilization * 100.0) / 100.0);
    }

    @Override
    public synchronized void updateBudget(long newBudget) {
        requirePositive(newBudget);
        long oldBudget = totalBudget;
        totalBudget = newBudget;
        log.debug("Token budget updated from {} to {}", oldBudget, newBudget);

        long committed = usedTokens + reservedTokens;
        if (newBudget < committed) {
            log.warn("New budget ({}) is less than current usage ({})", newBudget, committed);
        }
    }

    @Override
    public synchronized void reset() {
        usedTokens = 0;
        reservedTokens = 0;
        allocations.clear();
        log.debug("Token ledger reset");
    }

    private static void requirePositive(long budget) {
        if (budget <= 0) {
            throw new IllegalArgumentException("Token budget must be greater than 0");
        }
    }
}

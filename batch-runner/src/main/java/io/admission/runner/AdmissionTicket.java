package io.admission.runner;

import io.admission.budget.TokenBudget;
import io.admission.gate.Gate;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A gate permit plus a budget reservation held by one batch. Closing it gives both back exactly once, so a
 * try-with-resources around the job covers success, failure and interruption alike.
 */
public final class AdmissionTicket implements AutoCloseable {
    private final int batchId;
    private final long reservedTokens;
    private final Gate gate;
    private final TokenBudget budget;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private AdmissionTicket(int batchId, long reservedTokens, Gate gate, TokenBudget budget) {
        this.batchId = batchId;
        this.reservedTokens = reservedTokens;
        this.gate = gate;
        this.budget = budget;
    }

    /**
     * Wait for a permit, then reserve the estimate. When the reservation is refused the permit is returned
     * immediately and the result is empty.
     */
    public static Optional<AdmissionTicket> admit(int batchId, long estimatedTokens, Gate gate, TokenBudget budget)
            throws InterruptedException {
        gate.acquire();
        boolean reserved = false;
        try {
            reserved = budget.allocateForBatch(batchId, estimatedTokens);
        } finally {
            if (!reserved) gate.release();
        }
        return reserved ? Optional.of(new AdmissionTicket(batchId, estimatedTokens, gate, budget)) : Optional.empty();
    }

    public int batchId() { return batchId; }
    public long reservedTokens() { return reservedTokens; }
    public boolean isClosed() { return closed.get(); }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        try {
            budget.releaseBatch(batchId);
        } finally {
            gate.release();
        }
    }
}

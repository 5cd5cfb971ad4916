package io.admission.gate;

import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;

/**
 * Gate bounds how many callers may hold a slot at once. Waiters are served in arrival order.
 */
public interface Gate {
    /** Block until a permit is granted. */
    void acquire() throws InterruptedException;

    /** Completes when a permit is granted; queues in the same order as {@link #acquire()}. */
    CompletionStage<Void> acquireAsync();

    /** Take a permit only if one is free and nobody is queued. */
    boolean tryAcquire();

    /**
     * Wait at most the given time. A grant that races the deadline still counts: when this returns true the
     * caller holds a permit and must release it.
     */
    boolean tryAcquire(long timeout, TimeUnit unit) throws InterruptedException;

    /** Return one permit, handing it straight to the longest waiter if there is one. */
    void release();

    int getCapacity();
    int getAvailablePermits();
    int getWaitingCount();

    default GateStatus getStatus() {
        return new GateStatus(getAvailablePermits(), getWaitingCount());
    }
}

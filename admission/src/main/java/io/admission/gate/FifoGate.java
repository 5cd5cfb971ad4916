package io.admission.gate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Counting semaphore with strict FIFO hand-off.
 * <p>
 * Each waiter is a future parked in an unbounded queue. {@link #release()} pops the head and reassigns the
 * freed permit to it while holding the lock, so no caller can observe a free permit while somebody is queued.
 * The future is completed after the lock is dropped.
 * <p>
 * Releasing more often than acquiring is not rejected: the permit count simply grows past the capacity.
 */
public class FifoGate implements Gate {
    private static final Logger log = LoggerFactory.getLogger(FifoGate.class);

    private final int capacity;
    private final ReentrantLock lock = new ReentrantLock();
    private final ArrayDeque<CompletableFuture<Void>> waiting = new ArrayDeque<>();
    private int permits;

    public FifoGate(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Semaphore permits must be greater than 0");
        }
        this.capacity = capacity;
        this.permits = capacity;
        log.debug("Gate created with {} permits", capacity);
    }

    @Override
    public void acquire() throws InterruptedException {
        CompletableFuture<Void> ticket = enqueue();
        try {
            ticket.get();
        } catch (InterruptedException ie) {
            if (!withdraw(ticket)) {
                // granted while we were being interrupted; pass it on rather than leak it
                release();
            }
            throw ie;
        } catch (ExecutionException e) {
            throw new IllegalStateException("gate waiter completed exceptionally", e.getCause());
        }
    }

    @Override
    public CompletionStage<Void> acquireAsync() {
        CompletableFuture<Void> ticket = enqueue();
        if (!ticket.isDone()) {
            ticket.whenComplete((ok, err) -> {
                if (ticket.isCancelled() && withdraw(ticket)) {
                    log.debug("Cancelled gate waiter removed from queue");
                }
            });
        }
        return ticket;
    }

    @Override
    public boolean tryAcquire() {
        lock.lock();
        try {
            if (permits > 0 && waiting.isEmpty()) {
                permits--;
                log.debug("Gate permit acquired, {} remaining", permits);
                return true;
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean tryAcquire(long timeout, TimeUnit unit) throws InterruptedException {
        CompletableFuture<Void> ticket = enqueue();
        try {
            ticket.get(timeout, unit);
            return true;
        } catch (TimeoutException te) {
            if (withdraw(ticket)) {
                log.debug("Gate wait timed out after {} {}", timeout, unit);
                return false;
            }
            // the grant beat the revoke: the caller owns the permit now
            return true;
        } catch (InterruptedException ie) {
            if (!withdraw(ticket)) {
                release();
            }
            throw ie;
        } catch (ExecutionException e) {
            throw new IllegalStateException("gate waiter completed exceptionally", e.getCause());
        }
    }

    @Override
    public void release() {
        CompletableFuture<Void> next;
        lock.lock();
        try {
            permits++;
            next = waiting.poll();
            if (next != null) {
                permits--;
                log.debug("Gate permit handed to waiting caller, {} still waiting", waiting.size());
            } else {
                log.debug("Gate permit released, {} available", permits);
                if (permits > capacity) {
                    log.warn("Gate released more often than acquired: {} permits available, capacity {}", permits, capacity);
                }
            }
        } finally {
            lock.unlock();
        }
        if (next != null && !next.complete(null)) {
            // waiter was cancelled before we could wake it
            release();
        }
    }

    @Override
    public int getCapacity() {
        return capacity;
    }

    @Override
    public int getAvailablePermits() {
        lock.lock();
        try {
            return permits;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int getWaitingCount() {
        lock.lock();
        try {
            return waiting.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public GateStatus getStatus() {
        lock.lock();
        try {
            return new GateStatus(permits, waiting.size());
        } finally {
            lock.unlock();
        }
    }

    private CompletableFuture<Void> enqueue() {
        lock.lock();
        try {
            if (permits > 0) {
                permits--;
                log.debug("Gate permit acquired, {} remaining", permits);
                return CompletableFuture.completedFuture(null);
            }
            CompletableFuture<Void> ticket = new CompletableFuture<>();
            log.debug("Gate permit requested, waiting in queue ({} waiting)", waiting.size());
            waiting.add(ticket);
            return ticket;
        } finally {
            lock.unlock();
        }
    }

    /** Remove a still-queued waiter. False means it was already granted a permit. */
    private boolean withdraw(CompletableFuture<Void> ticket) {
        lock.lock();
        try {
            return waiting.remove(ticket);
        } finally {
            lock.unlock();
        }
    }
}

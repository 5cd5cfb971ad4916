package io.admission.runner;

/** Backoff pause between retries; swapped out in tests. */
@FunctionalInterface
public interface Sleeper {
    Sleeper SYSTEM = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}

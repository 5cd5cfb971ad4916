package io.admission.runner;

import java.util.concurrent.Callable;

final class TestJobs {
    private TestJobs() {
    }

    static <T> Job<T> job(String name, long cost, Callable<T> body) {
        return new Job<>() {
            @Override public String name() { return name; }
            @Override public long estimatedCost() { return cost; }
            @Override public T execute() throws Exception { return body.call(); }
        };
    }
}

package io.admission.runner;

/**
 * One unit of work submitted to a rate- and cost-constrained backend.
 */
public interface Job<T> {
    String name();

    /** Tokens this job is expected to consume; reserved before it starts and committed when it ends. */
    long estimatedCost();

    T execute() throws Exception;
}

package io.admission.runner;

import io.admission.budget.BudgetStatus;
import io.admission.gate.GateStatus;

import java.util.List;

/**
 * Results of a run in submission order, with the admission settings it ran under and the final gate and
 * budget state.
 */
public record RunReport<T>(
        List<JobResult<T>> results,
        int concurrency,
        long totalBudget,
        GateStatus gate,
        BudgetStatus budget,
        long elapsedMillis
) {
    public List<JobResult<T>> succeeded() {
        return results.stream().filter(JobResult::success).toList();
    }

    public List<JobResult<T>> failed() {
        return results.stream().filter(r -> !r.success()).toList();
    }

    public boolean allSucceeded() {
        return results.stream().allMatch(JobResult::success);
    }
}

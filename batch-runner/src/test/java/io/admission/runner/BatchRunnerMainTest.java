package io.admission.runner;

import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import static org.junit.jupiter.api.Assertions.*;

public class BatchRunnerMainTest {

    @Test
    void successful_run_exits_zero() {
        int code = new CommandLine(new BatchRunnerMain())
                .execute("--jobs", "4", "--max-concurrent", "2", "--budget", "100000", "--latency-ms", "1", "--failure-rate", "0");
        assertEquals(0, code);
    }

    @Test
    void exhausted_budget_exits_one() {
        int code = new CommandLine(new BatchRunnerMain())
                .execute("--jobs", "4", "--budget", "100", "--avg-cost", "1000", "--latency-ms", "1", "--failure-rate", "0");
        assertEquals(1, code);
    }

    @Test
    void bad_arguments_exit_two() {
        assertEquals(2, new CommandLine(new BatchRunnerMain()).execute("--jobs", "0"));
        assertEquals(2, new CommandLine(new BatchRunnerMain()).execute("--max-concurrent", "0"));
    }
}

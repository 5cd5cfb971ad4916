package io.admission.sizing;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ConcurrencySizerTest {

    @Test
    void budget_is_the_binding_ceiling() {
        assertEquals(3, ConcurrencySizer.calculateOptimalConcurrency(10, 5, 100, 300));
    }

    @Test
    void never_drops_below_one() {
        assertEquals(1, ConcurrencySizer.calculateOptimalConcurrency(5, 5, 1000, 10));
        assertEquals(1, ConcurrencySizer.calculateOptimalConcurrency(0, 5, 100, 1000));
    }

    @Test
    void configured_maximum_caps_parallelism() {
        assertEquals(2, ConcurrencySizer.calculateOptimalConcurrency(10, 2, 10, 1_000_000));
    }

    @Test
    void job_count_caps_parallelism() {
        assertEquals(3, ConcurrencySizer.calculateOptimalConcurrency(3, 8, 10, 1_000_000));
    }

    @Test
    void unknown_average_cost_applies_no_budget_ceiling() {
        assertEquals(4, ConcurrencySizer.calculateOptimalConcurrency(4, 6, 0, 10));
    }

    @Test
    void negative_average_cost_degrades_to_one() {
        assertEquals(1, ConcurrencySizer.calculateOptimalConcurrency(10, 5, -100, 300));
        assertEquals(1, ConcurrencySizer.calculateOptimalConcurrency(3, 3, -1, 0));
    }

    @Test
    void average_cost_of_huge_estimates_does_not_overflow() {
        long big = Long.MAX_VALUE - 1;
        assertEquals(big, ConcurrencySizer.averageCost(List.of(big, big, big)));
        assertEquals(Long.MAX_VALUE / 2 + 1, ConcurrencySizer.averageCost(List.of(Long.MAX_VALUE, 1L)));
    }

    @Test
    void average_cost_rounds_up() {
        assertEquals(0, ConcurrencySizer.averageCost(List.of()));
        assertEquals(2, ConcurrencySizer.averageCost(List.of(1L, 2L)));
        assertEquals(100, ConcurrencySizer.averageCost(List.of(100L, 100L, 100L)));
    }
}

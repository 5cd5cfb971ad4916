package io.admission.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class AdmissionConfigTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty("admission.maxConcurrent");
        System.clearProperty("admission.totalBudget");
        System.clearProperty("admission.provider");
        System.clearProperty("admission.safetyMargin");
    }

    @Test
    void system_properties_override_defaults() {
        System.setProperty("admission.maxConcurrent", "7");
        System.setProperty("admission.totalBudget", "50000");
        System.setProperty("admission.provider", "anthropic");
        AdmissionConfig cfg = AdmissionConfig.fromEnv();
        assertEquals(7, cfg.maxConcurrent());
        assertEquals(50_000, cfg.totalBudget());
        assertEquals("anthropic", cfg.provider());
    }

    @Test
    void invalid_values_are_rejected() {
        System.setProperty("admission.safetyMargin", "1.5");
        assertThrows(IllegalArgumentException.class, AdmissionConfig::fromEnv);
        assertThrows(IllegalArgumentException.class, () -> AdmissionConfig.defaults().withMaxConcurrent(0).validate());
        assertThrows(IllegalArgumentException.class, () -> AdmissionConfig.defaults().withTotalBudget(-1).validate());
    }

    @Test
    void withers_keep_other_fields() {
        AdmissionConfig cfg = AdmissionConfig.defaults().withMaxConcurrent(5).withRetry(2, 1, 5, 0);
        assertEquals(5, cfg.maxConcurrent());
        assertEquals(2, cfg.retryMaxAttempts());
        assertEquals("auto", cfg.provider());
        assertEquals(0.8, cfg.safetyMargin());
    }
}

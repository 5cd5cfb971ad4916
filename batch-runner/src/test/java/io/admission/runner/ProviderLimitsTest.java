package io.admission.runner;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ProviderLimitsTest {

    @Test
    void exact_and_partial_matches() {
        assertEquals(200_000, ProviderLimits.tokenLimit("anthropic", false));
        assertEquals(190_000, ProviderLimits.tokenLimit("Claude", true));
        assertEquals(128_000, ProviderLimits.tokenLimit("gpt-4-turbo", false));
        assertEquals(95_000, ProviderLimits.tokenLimit("aws-bedrock", true));
    }

    @Test
    void unknown_or_missing_provider_falls_back_to_auto() {
        assertEquals(60_000, ProviderLimits.tokenLimit("mystery", false));
        assertEquals(60_000, ProviderLimits.tokenLimit(null, true));
        assertEquals(60_000, ProviderLimits.tokenLimit("", false));
        assertFalse(ProviderLimits.isSupported("mystery"));
        assertFalse(ProviderLimits.isSupported(null));
        assertTrue(ProviderLimits.isSupported("VERTEX"));
    }

    @Test
    void validate_clamps_to_the_provider_limit() {
        assertEquals(65_536, ProviderLimits.validate("vertex", 100_000, false));
        assertEquals(40_000, ProviderLimits.validate("vertex", 40_000, false));
        assertEquals(120_000, ProviderLimits.validate("openai", 0, true));
    }

    @Test
    void run_budget_applies_the_safety_margin() {
        assertEquals(288_000, ProviderLimits.totalBudgetFor("openai", 3, 0.8));
        assertEquals(48_000, ProviderLimits.totalBudgetFor("auto", 1, 0.8));
        assertTrue(ProviderLimits.supportedProviders().contains("gemini"));
    }
}

package io.admission.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Per-provider token ceilings for a single backend call, and the run budget derived from them.
 * <p>
 * Lookup is case-insensitive: exact name first, then the first table entry that contains, or is contained
 * in, the given name. Anything else falls back to {@code auto}.
 */
public final class ProviderLimits {
    private static final Logger log = LoggerFactory.getLogger(ProviderLimits.class);

    public static final String AUTO = "auto";

    private static final Map<String, Long> STANDARD = table(
            65_536, 65_536, 65_536, 128_000, 128_000, 200_000, 200_000, 128_000, 100_000, 60_000);
    // kept below the hard limits to leave headroom for prompt overhead
    private static final Map<String, Long> CONSERVATIVE = table(
            65_536, 65_536, 65_536, 120_000, 120_000, 190_000, 190_000, 120_000, 95_000, 60_000);

    private ProviderLimits() {
    }

    public static long tokenLimit(String provider, boolean conservative) {
        Map<String, Long> limits = conservative ? CONSERVATIVE : STANDARD;
        String key = resolve(provider);
        return limits.get(key == null ? AUTO : key);
    }

    /** The configured limit if it fits the provider, the provider limit when unset or too large. */
    public static long validate(String provider, long configured, boolean conservative) {
        long providerLimit = tokenLimit(provider, conservative);
        if (configured <= 0) {
            log.debug("No configured tokens for {}, using provider default: {}", provider, providerLimit);
            return providerLimit;
        }
        if (configured > providerLimit) {
            log.warn("Configured max tokens ({}) exceeds {} limit ({}). Adjusting to {}.",
                    configured, provider, providerLimit, providerLimit);
            return providerLimit;
        }
        return configured;
    }

    public static boolean isSupported(String provider) {
        return resolve(provider) != null;
    }

    public static Set<String> supportedProviders() {
        return Collections.unmodifiableSet(STANDARD.keySet());
    }

    /**
     * Budget for a run of {@code instances} jobs against one provider: each job may use up to the conservative
     * limit, scaled down by {@code safetyMargin}.
     */
    public static long totalBudgetFor(String provider, int instances, double safetyMargin) {
        long limit = tokenLimit(provider, true);
        long total = (long) Math.floor(instances * (double) limit * safetyMargin);
        log.debug("Calculated total token budget: {} ({} instances x {} x {}, floored)", total, instances, limit, safetyMargin);
        return total;
    }

    private static String resolve(String provider) {
        if (provider == null || provider.isBlank()) return null;
        String normalized = provider.toLowerCase(Locale.ROOT).trim();
        if (STANDARD.containsKey(normalized)) return normalized;
        for (String key : STANDARD.keySet()) {
            if (normalized.contains(key) || key.contains(normalized)) return key;
        }
        return null;
    }

    private static Map<String, Long> table(long vertex, long googleAi, long gemini, long openai, long gpt4,
                                           long anthropic, long claude, long azure, long bedrock, long auto) {
        Map<String, Long> m = new LinkedHashMap<>();
        m.put("vertex", vertex);
        m.put("google-ai", googleAi);
        m.put("gemini", gemini);
        m.put("openai", openai);
        m.put("gpt-4", gpt4);
        m.put("anthropic", anthropic);
        m.put("claude", claude);
        m.put("azure", azure);
        m.put("bedrock", bedrock);
        m.put(AUTO, auto);
        return Collections.unmodifiableMap(m);
    }
}

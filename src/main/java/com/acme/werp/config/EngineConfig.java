package com.acme.werp.config;

import com.acme.werp.inspect.Placeholders;
import com.acme.werp.severity.SeverityThresholds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.*;

/** Immutable engine settings. Built once per invocation and passed down. */
public record EngineConfig(
        SeverityThresholds thresholds,
        Set<String> placeholders,
        boolean dryRunDefault,
        int pageSize,
        int maxOpsPerBatch,
        Duration timeBudget,
        int regenerationFanout,
        int maxRegenerationCallsPerRun,
        Duration configTtl
) {
    private static final Logger logger = LoggerFactory.getLogger(EngineConfig.class);

    public static final int MAX_PAGE_SIZE = 450;
    public static final int MAX_OPS_PER_BATCH = 450;

    public static final String SEVERITY_HIGH = "severity.high";
    public static final String SEVERITY_MEDIUM = "severity.medium";
    public static final String PLACEHOLDERS = "placeholders";
    public static final String DRY_RUN_DEFAULT = "batch.dryRunDefault";
    public static final String PAGE_SIZE = "batch.pageSize";
    public static final String MAX_OPS = "batch.maxOpsPerBatch";
    public static final String TIME_BUDGET = "batch.timeBudgetSeconds";
    public static final String FANOUT = "regeneration.fanout";
    public static final String MAX_CALLS = "regeneration.maxCallsPerRun";
    public static final String TTL = "config.ttlSeconds";

    public EngineConfig {
        placeholders = Set.copyOf(placeholders);
        pageSize = clamp(pageSize, 1, MAX_PAGE_SIZE);
        maxOpsPerBatch = clamp(maxOpsPerBatch, 1, MAX_OPS_PER_BATCH);
        regenerationFanout = Math.max(1, regenerationFanout);
        maxRegenerationCallsPerRun = Math.max(0, maxRegenerationCallsPerRun);
    }

    public static EngineConfig defaults() {
        return new EngineConfig(SeverityThresholds.DEFAULTS, Placeholders.DEFAULTS, true, 150, MAX_OPS_PER_BATCH,
                Duration.ofSeconds(45), 4, 200, Duration.ofSeconds(60));
    }

    /** Reads known keys; anything missing or unreadable keeps its default. */
    public static EngineConfig from(Map<String, String> values) {
        EngineConfig d = defaults();
        double high = dbl(values, SEVERITY_HIGH, d.thresholds().high());
        double medium = dbl(values, SEVERITY_MEDIUM, d.thresholds().medium());
        SeverityThresholds thresholds;
        try { thresholds = new SeverityThresholds(high, medium); }
        catch (IllegalArgumentException e) {
            logger.warn("{}; using defaults", e.getMessage());
            thresholds = d.thresholds();
        }
        return new EngineConfig(
                thresholds,
                placeholders(values.get(PLACEHOLDERS), d.placeholders()),
                bool(values, DRY_RUN_DEFAULT, d.dryRunDefault()),
                integer(values, PAGE_SIZE, d.pageSize()),
                integer(values, MAX_OPS, d.maxOpsPerBatch()),
                Duration.ofSeconds(integer(values, TIME_BUDGET, (int) d.timeBudget().toSeconds())),
                integer(values, FANOUT, d.regenerationFanout()),
                integer(values, MAX_CALLS, d.maxRegenerationCallsPerRun()),
                Duration.ofSeconds(integer(values, TTL, (int) d.configTtl().toSeconds()))
        );
    }

    public Placeholders placeholderSet() { return new Placeholders(placeholders); }

    /** Pipe-separated so that the empty string can be listed. */
    static Set<String> placeholders(String raw, Set<String> fallback) {
        if (raw == null) return fallback;
        Set<String> out = new LinkedHashSet<>();
        for (String s : raw.split("\\|", -1)) out.add(s.trim().toLowerCase(Locale.ROOT));
        return out;
    }

    private static double dbl(Map<String, String> m, String key, double fallback) {
        String v = m.get(key);
        if (v == null || v.isBlank()) return fallback;
        double d;
        try { d = Double.parseDouble(v.trim()); }
        catch (NumberFormatException e) { d = Double.NaN; }
        if (Double.isFinite(d)) return d;
        logger.warn("Ignoring invalid value '{}' for {}", v, key);
        return fallback;
    }

    private static int integer(Map<String, String> m, String key, int fallback) {
        String v = m.get(key);
        if (v == null || v.isBlank()) return fallback;
        try { return Integer.parseInt(v.trim()); }
        catch (NumberFormatException e) {
            logger.warn("Ignoring invalid value '{}' for {}", v, key);
            return fallback;
        }
    }

    private static boolean bool(Map<String, String> m, String key, boolean fallback) {
        String v = m.get(key);
        if (v == null || v.isBlank()) return fallback;
        String s = v.trim().toLowerCase(Locale.ROOT);
        if (s.equals("true") || s.equals("false")) return Boolean.parseBoolean(s);
        logger.warn("Ignoring invalid value '{}' for {}", v, key);
        return fallback;
    }

    private static int clamp(int v, int min, int max) { return Math.min(max, Math.max(min, v)); }
}

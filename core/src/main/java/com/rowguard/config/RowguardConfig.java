package com.rowguard.config;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Immutable snapshot of the settings read by the fallback engine.
 *
 * <p>Values are parsed eagerly when the snapshot is built, so a malformed value fails
 * fast with {@link IllegalArgumentException} instead of surfacing mid-pipeline.
 * Keys outside the known set are kept and readable through {@link #get(String)}.
 */
public final class RowguardConfig {

    private final Map<String, String> settings;
    private final boolean ansiEnabled;
    private final boolean scanOnly;
    private final boolean joinOptimizeEnabled;
    private final int joinOptimizationLevel;
    private final boolean forceShuffledHashJoin;
    private final int expressionDepthThreshold;
    private final boolean oneRowRelationEnabled;
    private final boolean arrowUdfEnabled;
    private final boolean recordTagOrigin;
    private final Map<OperatorSwitch, Boolean> switches;

    private RowguardConfig(Map<String, String> settings) {
        this.settings = Collections.unmodifiableMap(settings);
        this.ansiEnabled = parseBoolean(RowguardDefaults.ANSI_ENABLED);
        this.scanOnly = parseBoolean(RowguardDefaults.SCAN_ONLY);
        this.joinOptimizeEnabled = parseBoolean(RowguardDefaults.JOIN_OPTIMIZE_ENABLED);
        this.joinOptimizationLevel = parsePositiveInt(RowguardDefaults.JOIN_OPTIMIZATION_LEVEL);
        this.forceShuffledHashJoin = parseBoolean(RowguardDefaults.FORCE_SHUFFLED_HASH_JOIN);
        this.expressionDepthThreshold = parsePositiveInt(RowguardDefaults.EXPRESSION_DEPTH_THRESHOLD);
        this.oneRowRelationEnabled = parseBoolean(RowguardDefaults.ONE_ROW_RELATION);
        this.arrowUdfEnabled = parseBoolean(RowguardDefaults.ARROW_UDF);
        this.recordTagOrigin = parseBoolean(RowguardDefaults.RECORD_TAG_ORIGIN);
        this.switches = new EnumMap<>(OperatorSwitch.class);
        for (OperatorSwitch op : OperatorSwitch.values()) {
            switches.put(op, parseBoolean(op.key()));
        }
    }

    /**
     * Returns a snapshot holding only the defaults.
     *
     * @return the default configuration
     */
    public static RowguardConfig defaults() {
        return of(Collections.emptyMap());
    }

    /**
     * Builds a snapshot from user settings layered over the defaults.
     *
     * @param overrides user settings; keys not present fall back to defaults
     * @return the configuration
     * @throws IllegalArgumentException if a known key holds a malformed value
     */
    public static RowguardConfig of(Map<String, String> overrides) {
        Objects.requireNonNull(overrides, "overrides must not be null");
        Map<String, String> merged = new HashMap<>(RowguardDefaults.getDefaults());
        merged.putAll(overrides);
        return new RowguardConfig(merged);
    }

    /**
     * Returns a copy of this snapshot with one setting changed.
     *
     * @param key the key
     * @param value the new value
     * @return the new configuration
     */
    public RowguardConfig with(String key, String value) {
        Map<String, String> merged = new HashMap<>(settings);
        merged.put(key, value);
        return new RowguardConfig(merged);
    }

    /**
     * Returns the raw value of a setting.
     *
     * @param key the key
     * @return the value, or null when unset and without default
     */
    public String get(String key) {
        return settings.get(key);
    }

    public boolean ansiEnabled() {
        return ansiEnabled;
    }

    public boolean scanOnly() {
        return scanOnly;
    }

    /**
     * Returns whether the fused-chain fallback heuristic runs.
     *
     * @return the value of {@code physicalJoinOptimizeEnable}
     */
    public boolean joinOptimizeEnabled() {
        return joinOptimizeEnabled;
    }

    /**
     * Returns the minimum length of a fused chain that triggers fallback.
     *
     * @return the value of {@code physicalJoinOptimizationLevel}
     */
    public int joinOptimizationLevel() {
        return joinOptimizationLevel;
    }

    public boolean forceShuffledHashJoin() {
        return forceShuffledHashJoin;
    }

    public int expressionDepthThreshold() {
        return expressionDepthThreshold;
    }

    public boolean oneRowRelationEnabled() {
        return oneRowRelationEnabled;
    }

    public boolean arrowUdfEnabled() {
        return arrowUdfEnabled;
    }

    public boolean recordTagOrigin() {
        return recordTagOrigin;
    }

    /**
     * Returns whether an operator family may be offloaded.
     *
     * @param op the switch
     * @return true when enabled
     */
    public boolean isEnabled(OperatorSwitch op) {
        return switches.get(op);
    }

    private boolean parseBoolean(String key) {
        String value = settings.get(key);
        if (value == null) {
            throw new IllegalArgumentException("Missing value for '%s'".formatted(key));
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "true" -> true;
            case "false" -> false;
            default -> throw new IllegalArgumentException(
                "Invalid boolean for '%s': '%s'. Valid values: true, false".formatted(key, value));
        };
    }

    private int parsePositiveInt(String key) {
        String value = settings.get(key);
        int parsed;
        try {
            parsed = Integer.parseInt(value == null ? "" : value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                "Invalid integer for '%s': '%s'".formatted(key, value), e);
        }
        if (parsed < 1) {
            throw new IllegalArgumentException(
                "Value of '%s' must be positive: %d".formatted(key, parsed));
        }
        return parsed;
    }

    @Override
    public String toString() {
        return "RowguardConfig" + new TreeMap<>(settings);
    }
}

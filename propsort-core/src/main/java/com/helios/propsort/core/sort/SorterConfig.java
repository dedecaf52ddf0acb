/*
 * Copyright (c) 2025 Helios Prop Sorter
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.propsort.core.sort;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.helios.propsort.api.model.SortMode;
import com.helios.propsort.core.ranking.BradleyTerryEstimator;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Settings for a {@link PreferenceSorter} and its comparator cache.
 *
 * <p><b>Environment Variable Override:</b> {@link #builder()} starts from the defaults and
 * then applies any of the following environment variables, falling back to a system
 * property of the same name:
 * <pre>
 * PROPSORT_MODE=stabilized             direct|off|stabilized (aliases yes|no|stable)
 * PROPSORT_CUSTOM_ORDER=key,id,onClick  comma-separated raw names
 * PROPSORT_CACHE_MAX_SIZE=10000
 * PROPSORT_CACHE_RECORD_STATS=false
 * PROPSORT_RANK_MAX_ITERATIONS=10
 * </pre>
 * Unparsable or non-positive values are logged and ignored. Values set through the
 * builder or read by {@link #fromJson(InputStream)} are validated instead, and an
 * out-of-range one fails {@link Builder#build()} with {@link IllegalArgumentException}.
 *
 * <p>{@link #fromJson(InputStream)} reads the same settings from a JSON document:
 * <pre>{@code
 * {
 *   "sortPropsUseAI": "stabilized",
 *   "sortPropsCustomOrder": ["key", "id", "on*"],
 *   "cacheMaxSize": 5000,
 *   "rankMaxIterations": 20
 * }
 * }</pre>
 */
public final class SorterConfig {
    private static final Logger logger = Logger.getLogger(SorterConfig.class.getName());

    static final String ENV_MODE = "PROPSORT_MODE";
    static final String ENV_CUSTOM_ORDER = "PROPSORT_CUSTOM_ORDER";
    static final String ENV_CACHE_MAX_SIZE = "PROPSORT_CACHE_MAX_SIZE";
    static final String ENV_CACHE_RECORD_STATS = "PROPSORT_CACHE_RECORD_STATS";
    static final String ENV_RANK_MAX_ITERATIONS = "PROPSORT_RANK_MAX_ITERATIONS";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final SortMode mode;
    private final List<String> customOrder;
    private final long cacheMaxSize;
    private final boolean cacheRecordStats;
    private final int rankMaxIterations;

    private SorterConfig(Builder builder) {
        this.mode = builder.mode;
        this.customOrder = List.copyOf(builder.customOrder);
        this.cacheMaxSize = builder.cacheMaxSize;
        this.cacheRecordStats = builder.cacheRecordStats;
        this.rankMaxIterations = builder.rankMaxIterations;

        validate();
    }

    /**
     * Defaults plus environment overrides.
     */
    public static SorterConfig fromEnvironment() {
        return builder().build();
    }

    /**
     * Defaults overridden by a JSON document; environment variables are not consulted.
     * The caller owns the stream.
     *
     * @throws IllegalArgumentException if the document is malformed or names an unknown mode
     */
    public static SorterConfig fromJson(InputStream in) {
        JsonNode root;
        try {
            root = MAPPER.readTree(in);
        } catch (IOException e) {
            throw new IllegalArgumentException("Malformed sorter configuration", e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Sorter configuration must be a JSON object");
        }

        Builder builder = new Builder(true);
        JsonNode mode = root.get("sortPropsUseAI");
        if (mode != null && !mode.isNull()) {
            builder.mode(SortMode.fromString(mode.asText()));
        }
        JsonNode order = root.get("sortPropsCustomOrder");
        if (order != null && order.isArray()) {
            List<String> names = new ArrayList<>();
            order.forEach(entry -> names.add(entry.asText()));
            builder.customOrder(names);
        }
        JsonNode maxSize = root.get("cacheMaxSize");
        if (maxSize != null && maxSize.canConvertToLong()) {
            builder.cacheMaxSize(maxSize.asLong());
        }
        JsonNode recordStats = root.get("cacheRecordStats");
        if (recordStats != null && recordStats.isBoolean()) {
            builder.cacheRecordStats(recordStats.asBoolean());
        }
        JsonNode iterations = root.get("rankMaxIterations");
        if (iterations != null && iterations.canConvertToInt()) {
            builder.rankMaxIterations(iterations.asInt());
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder(false);
    }

    /**
     * A builder holding only the defaults, ignoring the environment.
     */
    public static Builder defaults() {
        return new Builder(true);
    }

    public SortMode mode() {
        return mode;
    }

    /**
     * Raw custom order names; {@link PreferenceSorter} normalizes them.
     */
    public List<String> customOrder() {
        return customOrder;
    }

    public long cacheMaxSize() {
        return cacheMaxSize;
    }

    public boolean cacheRecordStats() {
        return cacheRecordStats;
    }

    public int rankMaxIterations() {
        return rankMaxIterations;
    }

    private void validate() {
        if (cacheMaxSize <= 0) {
            throw new IllegalArgumentException("cacheMaxSize must be positive: " + cacheMaxSize);
        }
        if (rankMaxIterations <= 0) {
            throw new IllegalArgumentException("rankMaxIterations must be positive: " + rankMaxIterations);
        }
    }

    @Override
    public String toString() {
        return "SorterConfig{mode=" + mode.value()
                + ", customOrder=" + customOrder
                + ", cacheMaxSize=" + cacheMaxSize
                + ", cacheRecordStats=" + cacheRecordStats
                + ", rankMaxIterations=" + rankMaxIterations + '}';
    }

    public static final class Builder {
        private SortMode mode = SortMode.OFF;
        private List<String> customOrder = List.of();
        private long cacheMaxSize = 10_000;
        private boolean cacheRecordStats = false;
        private int rankMaxIterations = BradleyTerryEstimator.DEFAULT_MAX_ITERATIONS;

        private Builder(boolean skipEnvironmentLoading) {
            if (!skipEnvironmentLoading) {
                applyEnvironmentVariables();
            }
        }

        private void applyEnvironmentVariables() {
            getEnv(ENV_MODE).ifPresent(val -> {
                try {
                    this.mode = SortMode.fromString(val);
                } catch (IllegalArgumentException e) {
                    logger.warning("Invalid " + ENV_MODE + ": " + val + ", using " + mode.value());
                }
            });
            getEnv(ENV_CUSTOM_ORDER).ifPresent(val -> this.customOrder = splitList(val));
            getEnvLong(ENV_CACHE_MAX_SIZE)
                    .filter(val -> isPositive(ENV_CACHE_MAX_SIZE, val, cacheMaxSize))
                    .ifPresent(val -> this.cacheMaxSize = val);
            getEnv(ENV_CACHE_RECORD_STATS).ifPresent(val -> this.cacheRecordStats = parseBoolean(val));
            getEnvInt(ENV_RANK_MAX_ITERATIONS)
                    .filter(val -> isPositive(ENV_RANK_MAX_ITERATIONS, val, rankMaxIterations))
                    .ifPresent(val -> this.rankMaxIterations = val);
        }

        public Builder mode(SortMode mode) {
            this.mode = Objects.requireNonNull(mode, "mode");
            return this;
        }

        public Builder mode(String mode) {
            return mode(SortMode.fromString(mode));
        }

        public Builder customOrder(List<String> customOrder) {
            this.customOrder = List.copyOf(customOrder);
            return this;
        }

        public Builder cacheMaxSize(long cacheMaxSize) {
            this.cacheMaxSize = cacheMaxSize;
            return this;
        }

        public Builder cacheRecordStats(boolean cacheRecordStats) {
            this.cacheRecordStats = cacheRecordStats;
            return this;
        }

        public Builder rankMaxIterations(int rankMaxIterations) {
            this.rankMaxIterations = rankMaxIterations;
            return this;
        }

        public SorterConfig build() {
            return new SorterConfig(this);
        }

        private static List<String> splitList(String value) {
            List<String> names = new ArrayList<>();
            for (String part : value.split(",")) {
                String trimmed = part.trim();
                if (!trimmed.isEmpty()) {
                    names.add(trimmed);
                }
            }
            return names;
        }

        private static boolean isPositive(String key, long value, long fallback) {
            if (value > 0) {
                return true;
            }
            logger.warning("Out of range " + key + ": " + value + ", using " + fallback);
            return false;
        }

        private static boolean parseBoolean(String value) {
            String normalized = value.toLowerCase();
            return "true".equals(normalized) || "1".equals(normalized) || "yes".equals(normalized);
        }

        private static Optional<String> getEnv(String key) {
            String value = System.getenv(key);
            if (value == null || value.trim().isEmpty()) {
                value = System.getProperty(key);
            }
            if (value != null && !value.trim().isEmpty()) {
                logger.fine("Loaded override: " + key + "=" + value);
                return Optional.of(value.trim());
            }
            return Optional.empty();
        }

        private static Optional<Long> getEnvLong(String key) {
            return getEnv(key).map(val -> {
                try {
                    return Long.parseLong(val);
                } catch (NumberFormatException e) {
                    logger.warning("Invalid long value for " + key + ": " + val);
                    return null;
                }
            });
        }

        private static Optional<Integer> getEnvInt(String key) {
            return getEnv(key).map(val -> {
                try {
                    return Integer.parseInt(val);
                } catch (NumberFormatException e) {
                    logger.warning("Invalid int value for " + key + ": " + val);
                    return null;
                }
            });
        }
    }
}

/*
 * Copyright (c) 2025 Helios Prop Sorter
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.propsort.api.model;

import java.util.Locale;

/**
 * Selects how items left unordered by the hints are finally ordered.
 */
public enum SortMode {
    /**
     * Break ties with the pairwise comparator directly. Output may vary between runs
     * if the comparator does.
     */
    DIRECT("direct", "yes"),

    /**
     * No comparator. Untouched items keep their original relative order.
     */
    OFF("off", "no"),

    /**
     * Collect every pairwise outcome, rank the items with a Bradley-Terry estimate and
     * use that ranking as one more hint before a deterministic sort.
     */
    STABILIZED("stabilized", "stable");

    private final String value;
    private final String alias;

    SortMode(String value, String alias) {
        this.value = value;
        this.alias = alias;
    }

    public String value() {
        return value;
    }

    /**
     * Whether this mode consults the pairwise comparator.
     */
    public boolean requiresComparator() {
        return this != OFF;
    }

    /**
     * Parses a mode selector. Accepts the canonical names ({@code direct}, {@code off},
     * {@code stabilized}) and the plugin option values ({@code yes}, {@code no},
     * {@code stable}), case-insensitively.
     *
     * @param mode the selector
     * @return the matching mode
     * @throws IllegalArgumentException if the selector is null or unknown
     */
    public static SortMode fromString(String mode) {
        if (mode == null) {
            throw new IllegalArgumentException("Sort mode must not be null");
        }
        String normalized = mode.trim().toLowerCase(Locale.ROOT);
        for (SortMode candidate : values()) {
            if (candidate.value.equals(normalized) || candidate.alias.equals(normalized)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown sort mode: '" + mode
                + "' (expected one of direct, off, stabilized)");
    }
}

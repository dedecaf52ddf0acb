/*
 * Copyright (c) 2025 Helios Prop Sorter
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.propsort.core.graph;

/**
 * Trailing-wildcard patterns: {@code "data *"} matches every token starting with
 * {@code "data "}.
 */
public final class WildcardTokenMatcher implements TokenMatcher {

    public static final String WILDCARD = "*";

    public static final WildcardTokenMatcher INSTANCE = new WildcardTokenMatcher();

    private WildcardTokenMatcher() {
    }

    @Override
    public boolean isPattern(String entry) {
        return entry.endsWith(WILDCARD);
    }

    @Override
    public boolean matches(String entry, String token) {
        return token.startsWith(prefixOf(entry));
    }

    /**
     * The non-wildcard part of a pattern.
     */
    public static String prefixOf(String pattern) {
        return pattern.substring(0, pattern.length() - WILDCARD.length());
    }

    /**
     * The pattern matching every token that starts with {@code prefix}.
     */
    public static String patternFor(String prefix) {
        return prefix + WILDCARD;
    }
}

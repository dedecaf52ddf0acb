/*
 * Copyright (c) 2025 Helios Prop Sorter
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.propsort.core.graph;

/**
 * Decides which graph nodes a hint entry refers to.
 */
public interface TokenMatcher {

    /**
     * Whether {@code entry} is a pattern that may match several tokens.
     */
    boolean isPattern(String entry);

    /**
     * Whether the pattern {@code entry} matches {@code token}. Only called for patterns.
     */
    boolean matches(String entry, String token);
}

/*
 * Copyright (c) 2025 Helios Prop Sorter
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.propsort.api.model;

/**
 * Two independent preference scores for an ordered pair {@code (a, b)}.
 *
 * @param forward strength of the preference for placing {@code a} before {@code b}
 * @param reverse strength of the preference for placing {@code b} before {@code a}
 */
public record RawScores(double forward, double reverse) {

    /**
     * The same scores seen from the pair {@code (b, a)}.
     */
    public RawScores swap() {
        return new RawScores(reverse, forward);
    }

    /**
     * Signed comparison derived from the scores: negative when {@code a} should come first.
     */
    public double signedComparison() {
        return reverse - forward;
    }
}

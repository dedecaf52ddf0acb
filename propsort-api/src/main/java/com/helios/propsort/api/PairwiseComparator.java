/*
 * Copyright (c) 2025 Helios Prop Sorter
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.propsort.api;

import com.helios.propsort.api.model.RawScores;

import java.util.concurrent.CompletableFuture;

/**
 * A learned pairwise preference between two normalized tokens.
 *
 * <p>Both operations are asynchronous and must be pure functions of their arguments, so
 * callers are free to cache results. A failed future aborts whatever sort requested it.
 */
public interface PairwiseComparator {

    /**
     * Scores the ordered pair {@code (a, b)}.
     *
     * @return the preference for {@code a} before {@code b} and for {@code b} before {@code a}
     */
    CompletableFuture<RawScores> rawCompare(String a, String b);

    /**
     * Signed comparison of two tokens: negative if {@code a} should sort before {@code b},
     * positive for the reverse, zero for no preference.
     */
    default CompletableFuture<Double> compare(String a, String b) {
        return rawCompare(a, b).thenApply(RawScores::signedComparison);
    }
}

/*
 * Copyright (c) 2025 Helios Prop Sorter
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.propsort.core.comparator;

import java.util.Objects;

/**
 * Unordered pair of tokens. {@code first} is never lexicographically greater than
 * {@code second}, so {@code of(a, b)} and {@code of(b, a)} are equal.
 */
public record PairKey(String first, String second) {

    public PairKey {
        Objects.requireNonNull(first, "first");
        Objects.requireNonNull(second, "second");
        if (first.compareTo(second) > 0) {
            throw new IllegalArgumentException("PairKey tokens out of order: " + first + ", " + second);
        }
    }

    public static PairKey of(String a, String b) {
        return isReversed(a, b) ? new PairKey(b, a) : new PairKey(a, b);
    }

    /**
     * Whether the ordered pair {@code (a, b)} is stored the other way round.
     */
    public static boolean isReversed(String a, String b) {
        return a.compareTo(b) > 0;
    }
}

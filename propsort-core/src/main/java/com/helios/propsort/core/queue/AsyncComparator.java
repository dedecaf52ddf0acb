/*
 * Copyright (c) 2025 Helios Prop Sorter
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.propsort.core.queue;

import java.util.Comparator;
import java.util.concurrent.CompletableFuture;

/**
 * A three-way comparison that may complete later.
 *
 * <p>Same contract as {@link Comparator}: negative if {@code a} must sort before {@code b},
 * positive for the reverse, zero if either order is acceptable.
 */
@FunctionalInterface
public interface AsyncComparator<T> {

    CompletableFuture<Integer> compare(T a, T b);

    /**
     * Adapts a synchronous comparator. Comparisons complete immediately.
     */
    static <T> AsyncComparator<T> of(Comparator<? super T> comparator) {
        return (a, b) -> CompletableFuture.completedFuture(comparator.compare(a, b));
    }
}

/*
 * Copyright (c) 2025 Helios Prop Sorter
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.propsort.core.comparator;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.helios.propsort.api.PairwiseComparator;
import com.helios.propsort.api.model.RawScores;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Logger;

/**
 * Caches the results of a {@link PairwiseComparator} under an unordered {@link PairKey}.
 *
 * <p>Results are stored oriented to the key, so a lookup for {@code (b, a)} after
 * {@code (a, b)} was computed is answered without calling the delegate: {@code compare}
 * is negated and {@code rawCompare} swapped. Only successful results are stored.
 *
 * <p>The owner decides the lifetime: one instance per sort session, or one shared by
 * several sorters.
 */
public class CachingPairwiseComparator implements PairwiseComparator {
    private static final Logger logger = Logger.getLogger(CachingPairwiseComparator.class.getName());

    private final PairwiseComparator delegate;
    private final Cache<PairKey, Double> compareCache;
    private final Cache<PairKey, RawScores> rawCache;
    private final boolean statsEnabled;

    private CachingPairwiseComparator(Builder builder) {
        this.delegate = builder.delegate;
        this.statsEnabled = builder.recordStats;
        this.compareCache = newCache(builder);
        this.rawCache = newCache(builder);

        logger.info(String.format("CachingPairwiseComparator initialized: maxSize=%d, stats=%b",
                builder.maxSize, builder.recordStats));
    }

    private static <V> Cache<PairKey, V> newCache(Builder builder) {
        Caffeine<Object, Object> cacheBuilder = Caffeine.newBuilder();
        if (builder.maxSize > 0) {
            cacheBuilder.maximumSize(builder.maxSize);
        }
        if (builder.recordStats) {
            cacheBuilder.recordStats();
        }
        return cacheBuilder.build();
    }

    @Override
    public CompletableFuture<Double> compare(String a, String b) {
        PairKey key = PairKey.of(a, b);
        boolean reversed = PairKey.isReversed(a, b);

        Double cached = compareCache.getIfPresent(key);
        if (cached != null) {
            return CompletableFuture.completedFuture(reversed ? -cached : cached);
        }
        return delegate.compare(a, b).thenApply(result -> {
            if (result == null) {
                throw new IllegalStateException("Comparator returned no result for (" + a + ", " + b + ")");
            }
            compareCache.put(key, reversed ? -result : result);
            return result;
        });
    }

    @Override
    public CompletableFuture<RawScores> rawCompare(String a, String b) {
        PairKey key = PairKey.of(a, b);
        boolean reversed = PairKey.isReversed(a, b);

        RawScores cached = rawCache.getIfPresent(key);
        if (cached != null) {
            return CompletableFuture.completedFuture(reversed ? cached.swap() : cached);
        }
        return delegate.rawCompare(a, b).thenApply(scores -> {
            if (scores == null) {
                throw new IllegalStateException("Comparator returned no scores for (" + a + ", " + b + ")");
            }
            rawCache.put(key, reversed ? scores.swap() : scores);
            return scores;
        });
    }

    public void invalidateAll() {
        compareCache.invalidateAll();
        rawCache.invalidateAll();
    }

    /**
     * Combined statistics of both caches; empty unless stats recording was enabled.
     */
    public CacheStats stats() {
        if (!statsEnabled) {
            return CacheStats.empty();
        }
        return compareCache.stats().plus(rawCache.stats());
    }

    public long estimatedSize() {
        return compareCache.estimatedSize() + rawCache.estimatedSize();
    }

    public static Builder builder(PairwiseComparator delegate) {
        return new Builder(delegate);
    }

    public static class Builder {
        private final PairwiseComparator delegate;
        private long maxSize = 10_000;
        private boolean recordStats = false;

        private Builder(PairwiseComparator delegate) {
            this.delegate = Objects.requireNonNull(delegate, "delegate");
        }

        public Builder maxSize(long maxSize) {
            this.maxSize = maxSize;
            return this;
        }

        public Builder recordStats(boolean recordStats) {
            this.recordStats = recordStats;
            return this;
        }

        public CachingPairwiseComparator build() {
            return new CachingPairwiseComparator(this);
        }
    }
}

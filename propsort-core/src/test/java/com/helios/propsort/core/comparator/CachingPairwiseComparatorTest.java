/*
 * Copyright (c) 2025 Helios Prop Sorter
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.propsort.core.comparator;

import com.helios.propsort.api.PairwiseComparator;
import com.helios.propsort.api.model.RawScores;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CachingPairwiseComparatorTest {

    @Mock
    private PairwiseComparator delegate;

    private CachingPairwiseComparator comparator;

    @BeforeEach
    void setUp() {
        comparator = CachingPairwiseComparator.builder(delegate)
                .maxSize(100)
                .recordStats(true)
                .build();
    }

    @Test
    @DisplayName("Should call the delegate once for a repeated pair")
    void testRepeatedPair() {
        when(delegate.compare("cached a", "cached b")).thenReturn(CompletableFuture.completedFuture(-0.5));

        assertThat(comparator.compare("cached a", "cached b").join()).isEqualTo(-0.5);
        assertThat(comparator.compare("cached a", "cached b").join()).isEqualTo(-0.5);

        verify(delegate, times(1)).compare("cached a", "cached b");
        assertThat(comparator.stats().hitCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should negate a cached comparison for the reversed pair")
    void testReversedCompare() {
        when(delegate.compare("swapped t", "swapped s")).thenReturn(CompletableFuture.completedFuture(0.8));

        assertThat(comparator.compare("swapped t", "swapped s").join()).isEqualTo(0.8);
        assertThat(comparator.compare("swapped s", "swapped t").join()).isEqualTo(-0.8);

        verify(delegate).compare("swapped t", "swapped s");
        verifyNoMoreInteractions(delegate);
    }

    @Test
    @DisplayName("Should swap cached raw scores for the reversed pair")
    void testReversedRawCompare() {
        when(delegate.rawCompare("a", "b")).thenReturn(CompletableFuture.completedFuture(new RawScores(0.9, 0.05)));

        assertThat(comparator.rawCompare("a", "b").join()).isEqualTo(new RawScores(0.9, 0.05));
        assertThat(comparator.rawCompare("b", "a").join()).isEqualTo(new RawScores(0.05, 0.9));

        verify(delegate).rawCompare("a", "b");
        verifyNoMoreInteractions(delegate);
    }

    @Test
    @DisplayName("Should keep compare and rawCompare results apart")
    void testSeparateCaches() {
        when(delegate.compare("a", "b")).thenReturn(CompletableFuture.completedFuture(-1.0));
        when(delegate.rawCompare("a", "b")).thenReturn(CompletableFuture.completedFuture(new RawScores(0.7, 0.2)));

        comparator.compare("a", "b").join();

        assertThat(comparator.rawCompare("a", "b").join()).isEqualTo(new RawScores(0.7, 0.2));
        assertThat(comparator.estimatedSize()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should not cache failures")
    void testFailuresNotCached() {
        when(delegate.compare("x", "y"))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("model unavailable")))
                .thenReturn(CompletableFuture.completedFuture(0.25));

        assertThatThrownBy(() -> comparator.compare("x", "y").join())
                .isInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
        assertThat(comparator.compare("x", "y").join()).isEqualTo(0.25);

        verify(delegate, times(2)).compare("x", "y");
    }

    @Test
    @DisplayName("Should reject a delegate that completes without a result")
    void testNullResultRejected() {
        when(delegate.compare("p", "q")).thenReturn(CompletableFuture.<Double>completedFuture(null));
        when(delegate.rawCompare("p", "q")).thenReturn(CompletableFuture.<RawScores>completedFuture(null));

        assertThatThrownBy(() -> comparator.compare("p", "q").join())
                .isInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(IllegalStateException.class)
                .hasMessageContaining("(p, q)");
        assertThatThrownBy(() -> comparator.rawCompare("p", "q").join())
                .isInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
        assertThat(comparator.estimatedSize()).isZero();
    }

    @Test
    @DisplayName("invalidateAll should force fresh comparisons")
    void testInvalidateAll() {
        when(delegate.compare("a", "b")).thenReturn(CompletableFuture.completedFuture(-1.0));
        comparator.compare("a", "b").join();

        comparator.invalidateAll();
        comparator.compare("a", "b").join();

        verify(delegate, times(2)).compare("a", "b");
    }

    @Test
    @DisplayName("Pair keys should not depend on argument order")
    void testPairKey() {
        assertThat(PairKey.of("b", "a")).isEqualTo(PairKey.of("a", "b"));
        assertThat(PairKey.isReversed("b", "a")).isTrue();
        assertThat(PairKey.isReversed("a", "a")).isFalse();
        assertThatThrownBy(() -> new PairKey("b", "a")).isInstanceOf(IllegalArgumentException.class);
    }
}

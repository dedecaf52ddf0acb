/*
 * Copyright (c) 2025 Helios Prop Sorter
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.propsort.api.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ValueTypesTest {

    @Test
    @DisplayName("Signed comparison is negative when the first item is preferred")
    void testSignedComparison() {
        RawScores scores = new RawScores(0.9, 0.05);

        assertThat(scores.signedComparison()).isCloseTo(-0.85, within(1e-9));
        assertThat(scores.swap()).isEqualTo(new RawScores(0.05, 0.9));
        assertThat(scores.swap().signedComparison()).isCloseTo(0.85, within(1e-9));
    }

    @Test
    @DisplayName("Weighted edges reject non-positive, infinite or NaN weights")
    void testWeightedEdgeValidation() {
        assertThat(new WeightedEdge("a", "b", 0.5).weight()).isEqualTo(0.5);

        assertThatThrownBy(() -> new WeightedEdge("a", "b", 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("positive");
        assertThatThrownBy(() -> new WeightedEdge("a", "b", -1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new WeightedEdge("a", "b", Double.POSITIVE_INFINITY))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new WeightedEdge("a", "b", Double.NaN))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new WeightedEdge(null, "b", 1))
                .isInstanceOf(NullPointerException.class);
    }
}

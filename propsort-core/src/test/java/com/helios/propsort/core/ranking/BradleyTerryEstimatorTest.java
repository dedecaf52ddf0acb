/*
 * Copyright (c) 2025 Helios Prop Sorter
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.propsort.core.ranking;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class BradleyTerryEstimatorTest {

    @Test
    @DisplayName("A symmetric matrix should give equal strengths")
    void testSymmetricMatrix() {
        double[][] wins = {
                {0, 1, 1},
                {1, 0, 1},
                {1, 1, 0}
        };

        double[] strengths = new BradleyTerryEstimator().estimate(wins);

        assertThat(strengths).containsExactly(new double[]{1, 1, 1}, within(1e-9));
    }

    @Test
    @DisplayName("Should converge to the win ratio for two items")
    void testTwoItemsConverge() {
        double[][] wins = {
                {0, 100},
                {1, 0}
        };

        double[] strengths = new BradleyTerryEstimator().estimate(wins);

        assertThat(strengths).containsExactly(new double[]{10, 0.1}, within(1e-6));
    }

    @Test
    @DisplayName("A single pass should already reach the win ratio for two items")
    void testSinglePass() {
        double[][] wins = {
                {0, 100},
                {1, 0}
        };

        BradleyTerryEstimator estimator = new BradleyTerryEstimator(1);
        double[] strengths = estimator.estimate(wins);

        assertThat(estimator.maxIterations()).isEqualTo(1);
        assertThat(strengths).containsExactly(new double[]{10, 0.1}, within(1e-9));
    }

    @Test
    @DisplayName("One-sided wins with nothing else observed should be undefined")
    void testOneSidedWinsGiveNaN() {
        double[][] wins = {
                {0, 10},
                {0, 0}
        };

        double[] strengths = new BradleyTerryEstimator().estimate(wins);

        assertThat(Double.isNaN(strengths[0])).isTrue();
        assertThat(Double.isNaN(strengths[1])).isTrue();
    }

    @Test
    @DisplayName("A stronger item should rank higher")
    void testRanking() {
        double[][] wins = {
                {0, 3, 4},
                {1, 0, 3},
                {1, 2, 0}
        };

        double[] p = new BradleyTerryEstimator(50).estimate(wins);

        assertThat(p[0]).isGreaterThan(p[1]);
        assertThat(p[1]).isGreaterThan(p[2]);
    }

    @Test
    @DisplayName("Should handle an empty matrix")
    void testEmpty() {
        assertThat(new BradleyTerryEstimator().estimate(new double[0][0])).isEmpty();
    }

    @Test
    @DisplayName("Should reject ragged matrices and non-positive caps")
    void testValidation() {
        BradleyTerryEstimator estimator = new BradleyTerryEstimator();

        assertThatThrownBy(() -> estimator.estimate(new double[][]{{0, 1}, {1}}))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BradleyTerryEstimator(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

/*
 * Copyright (c) 2025 Helios Prop Sorter
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.propsort.core.ranking;

/**
 * Turns pairwise comparison outcomes into one strength per item.
 */
public interface RankEstimator {

    /**
     * @param wins square matrix; {@code wins[i][j]} is the observed preference for item
     *             {@code i} over item {@code j}. The diagonal is ignored.
     * @return one strength per item, higher meaning earlier. May contain {@code NaN} for
     *         items the observations say nothing about.
     */
    double[] estimate(double[][] wins);
}

/*
 * Copyright (c) 2025 Helios Prop Sorter
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.propsort.core.ranking;

import java.util.Arrays;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Bradley-Terry strengths by the minorization-maximization iteration.
 *
 * <p>Strengths start at 1 and are updated in place in index order, so later items in a
 * pass already see the updated values of earlier ones. After every pass the strengths are
 * divided by their geometric mean. Iteration stops when that mean changes by less than
 * the tolerance, or after {@code maxIterations} passes.
 *
 * <p>An item with neither wins nor losses against its peers gets {@code 0/0 = NaN}, and
 * the NaN spreads through the normalisation. Such results are returned as they are.
 */
public class BradleyTerryEstimator implements RankEstimator {
    private static final Logger logger = Logger.getLogger(BradleyTerryEstimator.class.getName());

    public static final int DEFAULT_MAX_ITERATIONS = 10;
    public static final double DEFAULT_TOLERANCE = 1e-3;

    private final int maxIterations;
    private final double tolerance;

    public BradleyTerryEstimator() {
        this(DEFAULT_MAX_ITERATIONS);
    }

    public BradleyTerryEstimator(int maxIterations) {
        this(maxIterations, DEFAULT_TOLERANCE);
    }

    public BradleyTerryEstimator(int maxIterations, double tolerance) {
        if (maxIterations <= 0) {
            throw new IllegalArgumentException("maxIterations must be positive, got: " + maxIterations);
        }
        this.maxIterations = maxIterations;
        this.tolerance = tolerance;
    }

    public int maxIterations() {
        return maxIterations;
    }

    @Override
    public double[] estimate(double[][] wins) {
        int n = wins.length;
        for (double[] row : wins) {
            if (row.length != n) {
                throw new IllegalArgumentException("Win matrix must be square, got a row of "
                        + row.length + " in a " + n + "x" + n + " matrix");
            }
        }

        double[] p = new double[n];
        Arrays.fill(p, 1.0);
        double lastNorm = 0;

        int iteration = 0;
        while (iteration < maxIterations) {
            iteration++;
            double logSum = 0;
            for (int i = 0; i < n; i++) {
                double numerator = 0;
                double denominator = 0;
                for (int j = 0; j < n; j++) {
                    if (i == j) continue;
                    double sum = p[i] + p[j];
                    numerator += wins[i][j] * p[j] / sum;
                    denominator += wins[j][i] / sum;
                }
                p[i] = numerator / denominator;
                logSum += Math.log(p[i]);
            }

            double norm = Math.exp(logSum / n);
            for (int i = 0; i < n; i++) {
                p[i] /= norm;
            }
            if (Math.abs(lastNorm - norm) < tolerance) {
                break;
            }
            lastNorm = norm;
        }

        if (logger.isLoggable(Level.FINE)) {
            logger.fine(String.format("Bradley-Terry over %d items stopped after %d iterations: %s",
                    n, iteration, Arrays.toString(p)));
        }
        return p;
    }
}

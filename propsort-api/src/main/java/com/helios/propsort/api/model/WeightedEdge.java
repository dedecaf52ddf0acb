/*
 * Copyright (c) 2025 Helios Prop Sorter
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.propsort.api.model;

import java.util.Objects;

/**
 * A weighted precedence observation: {@code source} was seen before {@code target}
 * with total strength {@code weight}. Weights are strictly positive; an absent
 * observation is no edge at all.
 */
public record WeightedEdge(String source, String target, double weight) {

    public WeightedEdge {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        if (!(weight > 0) || Double.isInfinite(weight)) {
            throw new IllegalArgumentException(
                    "Edge weight must be a positive finite number, got: " + weight);
        }
    }
}

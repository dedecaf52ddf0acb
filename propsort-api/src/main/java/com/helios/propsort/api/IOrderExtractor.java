/*
 * Copyright (c) 2025 Helios Prop Sorter
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.propsort.api;

import com.helios.propsort.api.model.WeightedEdge;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Learns a suggested precedence list from groups observed in existing code.
 */
public interface IOrderExtractor {

    /**
     * Records one group of normalized tokens in their observed order.
     */
    void observe(List<String> group);

    /**
     * The accumulated precedence observations.
     */
    List<WeightedEdge> edges();

    /**
     * Computes one linear order that contradicts as little observed weight as possible.
     */
    CompletableFuture<List<String>> extractOrder();
}

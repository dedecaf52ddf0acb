/*
 * Copyright (c) 2025 Helios Prop Sorter
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.propsort.api;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Contract for ordering one group of items by combining precedence hints with a
 * tie-breaking strategy.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * IPreferenceSorter sorter = PreferenceSorter.builder()
 *     .mode(SortMode.OFF)
 *     .customOrder(List.of("key", "className"))
 *     .build();
 *
 * List<String> sorted = sorter.sortNames(List.of("onClick", "className", "key")).join();
 * // [key, className, onClick]
 * }</pre>
 *
 * <p>Implementations keep no mutable state between calls apart from an optional
 * comparator cache; each call owns its own graph and queues.
 */
public interface IPreferenceSorter {

    /**
     * Orders normalized tokens.
     *
     * @param tokens the group, in source order
     * @return a permutation of {@code tokens}
     */
    CompletableFuture<List<String>> sort(List<String> tokens);

    /**
     * Normalizes raw names, orders them, and maps the result back to the raw names.
     *
     * @param names the group's raw names, in source order
     * @return a permutation of {@code names}
     */
    CompletableFuture<List<String>> sortNames(List<String> names);
}

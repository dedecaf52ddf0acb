/*
 * Copyright (c) 2025 Helios Prop Sorter
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.propsort.core.queue;

import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import it.unimi.dsi.fastutil.longs.LongSet;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One logical set of items exposed through several independent priority orderings.
 *
 * <p>Each view is a {@link PriorityQueue} keyed by a constant of {@code V}. Every pushed
 * item is inserted into all views; deletion only clears its id from the live set. Stale
 * entries are discarded lazily, per view, when they surface at the top of that view.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * enum View { BY_COST, BY_AGE }
 *
 * MultiViewQueue<Job, View> queue = new MultiViewQueue<>(View.class, Map.of(
 *     View.BY_COST, AsyncComparator.of(Comparator.comparingInt(Job::cost)),
 *     View.BY_AGE, AsyncComparator.of(Comparator.comparingLong(Job::createdAt))));
 *
 * QueuedItem<Job> item = queue.push(job).join();
 * queue.delete(item.id());
 * }</pre>
 *
 * <p>Like {@link PriorityQueue}, operations on one instance must not overlap.
 *
 * @param <T> payload type
 * @param <V> view identifiers
 */
public class MultiViewQueue<T, V extends Enum<V>> {

    private final Map<V, PriorityQueue<QueuedItem<T>>> views;
    private final LongSet live = new LongOpenHashSet();
    private long nextId = 0;

    /**
     * @param viewType the view enum
     * @param comparators one comparator per view; every constant of {@code viewType} needs one
     * @throws IllegalArgumentException if a view has no comparator
     */
    public MultiViewQueue(Class<V> viewType, Map<V, AsyncComparator<T>> comparators) {
        this.views = new EnumMap<>(viewType);
        for (V view : viewType.getEnumConstants()) {
            AsyncComparator<T> cmp = comparators.get(view);
            if (cmp == null) {
                throw new IllegalArgumentException("No comparator for view " + view);
            }
            views.put(view, new PriorityQueue<>((a, b) -> cmp.compare(a.payload(), b.payload())));
        }
    }

    /**
     * Number of live items.
     */
    public int size() {
        return live.size();
    }

    public boolean isEmpty() {
        return live.isEmpty();
    }

    /**
     * Wraps the payload under a fresh id and inserts it into every view.
     */
    public CompletableFuture<QueuedItem<T>> push(T payload) {
        Objects.requireNonNull(payload, "payload");
        QueuedItem<T> item = new QueuedItem<>(nextId++, payload);
        live.add(item.id());
        return AsyncLoop.forEach(views.values(), queue -> queue.push(item))
                .thenApply(v -> item);
    }

    /**
     * Removes and returns the first live item of {@code view}. The item is gone from all
     * views afterwards.
     */
    public CompletableFuture<Optional<T>> pop(V view) {
        PriorityQueue<QueuedItem<T>> queue = views.get(view);
        AtomicReference<T> found = new AtomicReference<>();

        return AsyncLoop.repeatWhile(() -> {
            Optional<QueuedItem<T>> top = queue.peek();
            if (top.isEmpty()) {
                return CompletableFuture.completedFuture(false);
            }
            QueuedItem<T> item = top.get();
            return queue.pop().thenApply(ignored -> {
                if (live.remove(item.id())) {
                    found.set(item.payload());
                    return false;
                }
                return true;
            });
        }).thenApply(v -> Optional.ofNullable(found.get()));
    }

    /**
     * Returns the first live item of {@code view} without consuming it. Dead entries above
     * it are physically removed from that view.
     */
    public CompletableFuture<Optional<T>> peek(V view) {
        PriorityQueue<QueuedItem<T>> queue = views.get(view);
        AtomicReference<T> found = new AtomicReference<>();

        return AsyncLoop.repeatWhile(() -> {
            Optional<QueuedItem<T>> top = queue.peek();
            if (top.isEmpty()) {
                return CompletableFuture.completedFuture(false);
            }
            if (live.contains(top.get().id())) {
                found.set(top.get().payload());
                return CompletableFuture.completedFuture(false);
            }
            return queue.pop().thenApply(ignored -> true);
        }).thenApply(v -> Optional.ofNullable(found.get()));
    }

    /**
     * Marks the item dead. No view is touched.
     */
    public void delete(long id) {
        live.remove(id);
    }

    /**
     * Whether {@code id} was pushed and has been neither popped nor deleted.
     */
    public boolean isLive(long id) {
        return live.contains(id);
    }
}

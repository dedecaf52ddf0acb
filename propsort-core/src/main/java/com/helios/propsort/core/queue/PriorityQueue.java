/*
 * Copyright (c) 2025 Helios Prop Sorter
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.propsort.core.queue;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Binary min-heap ordered by an {@link AsyncComparator}.
 *
 * <p>Each sift step awaits one comparison per level. The queue does no locking: a caller
 * must wait for a {@link #push} or {@link #pop} to complete before issuing the next
 * operation on the same instance. Elements that compare equal leave the heap in no
 * particular relative order.
 */
public class PriorityQueue<T> {
    private static final CompletableFuture<Void> DONE = CompletableFuture.completedFuture(null);

    private final List<T> heap = new ArrayList<>();
    private final AsyncComparator<T> comparator;

    public PriorityQueue(AsyncComparator<T> comparator) {
        this.comparator = comparator;
    }

    public int size() {
        return heap.size();
    }

    public boolean isEmpty() {
        return heap.isEmpty();
    }

    /**
     * Appends the element and sifts it up.
     */
    public CompletableFuture<Void> push(T item) {
        heap.add(item);
        return siftUp(heap.size() - 1);
    }

    /**
     * Removes the minimum element.
     *
     * @return the former root, or empty if the queue was empty
     */
    public CompletableFuture<Optional<T>> pop() {
        if (heap.isEmpty()) {
            return CompletableFuture.completedFuture(Optional.empty());
        }

        T top = heap.get(0);
        T last = heap.remove(heap.size() - 1);
        if (heap.isEmpty()) {
            return CompletableFuture.completedFuture(Optional.of(top));
        }
        heap.set(0, last);
        return siftDown(0).thenApply(v -> Optional.of(top));
    }

    /**
     * Reads the minimum element without removing it.
     */
    public Optional<T> peek() {
        return heap.isEmpty() ? Optional.empty() : Optional.of(heap.get(0));
    }

    private CompletableFuture<Void> siftUp(int idx) {
        if (idx == 0) {
            return DONE;
        }
        int parent = (idx - 1) / 2;
        return comparator.compare(heap.get(idx), heap.get(parent)).thenCompose(cmp -> {
            if (cmp >= 0) {
                return DONE;
            }
            swap(idx, parent);
            return siftUp(parent);
        });
    }

    private CompletableFuture<Void> siftDown(int idx) {
        int size = heap.size();
        int left = 2 * idx + 1;
        int right = left + 1;
        if (left >= size) {
            return DONE;
        }

        return comparator.compare(heap.get(left), heap.get(idx))
                .thenCompose(cmpLeft -> {
                    int min = cmpLeft < 0 ? left : idx;
                    if (right >= size) {
                        return CompletableFuture.completedFuture(min);
                    }
                    return comparator.compare(heap.get(right), heap.get(min))
                            .thenApply(cmpRight -> cmpRight < 0 ? right : min);
                })
                .thenCompose(min -> {
                    if (min == idx) {
                        return DONE;
                    }
                    swap(idx, min);
                    return siftDown(min);
                });
    }

    private void swap(int i, int j) {
        T tmp = heap.get(i);
        heap.set(i, heap.get(j));
        heap.set(j, tmp);
    }
}

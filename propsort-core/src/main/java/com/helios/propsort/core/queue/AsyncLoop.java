/*
 * Copyright (c) 2025 Helios Prop Sorter
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.propsort.core.queue;

import java.util.Iterator;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Loop drivers for step functions that may suspend on a comparator.
 *
 * <p>Steps that complete synchronously run in a plain loop on the calling thread, so long
 * loops over synchronous comparators never deepen the stack. Only a step that is still
 * pending when it returns is resumed from its completion callback.
 */
public final class AsyncLoop {

    private AsyncLoop() {
    }

    /**
     * Runs {@code step} until it yields {@code false} or fails.
     *
     * @param step one iteration; its result tells whether to continue
     * @return completes after the last iteration, or exceptionally with the first failure
     */
    public static CompletableFuture<Void> repeatWhile(Supplier<CompletableFuture<Boolean>> step) {
        CompletableFuture<Void> done = new CompletableFuture<>();
        drive(step, done);
        return done;
    }

    /**
     * Applies {@code action} to each element in iteration order, waiting for each one
     * before starting the next.
     */
    public static <T> CompletableFuture<Void> forEach(Iterable<? extends T> items,
                                                      Function<? super T, ? extends CompletableFuture<?>> action) {
        Iterator<? extends T> it = items.iterator();
        return repeatWhile(() -> {
            if (!it.hasNext()) {
                return CompletableFuture.completedFuture(false);
            }
            return action.apply(it.next()).thenApply(ignored -> true);
        });
    }

    private static void drive(Supplier<CompletableFuture<Boolean>> step, CompletableFuture<Void> done) {
        while (true) {
            CompletableFuture<Boolean> next;
            try {
                next = Objects.requireNonNull(step.get(), "step result");
            } catch (RuntimeException e) {
                done.completeExceptionally(e);
                return;
            }

            if (!next.isDone() || next.isCompletedExceptionally()) {
                next.whenComplete((more, error) -> {
                    if (error != null) {
                        done.completeExceptionally(unwrap(error));
                    } else if (Boolean.TRUE.equals(more)) {
                        drive(step, done);
                    } else {
                        done.complete(null);
                    }
                });
                return;
            }

            if (!Boolean.TRUE.equals(next.join())) {
                done.complete(null);
                return;
            }
        }
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }
}

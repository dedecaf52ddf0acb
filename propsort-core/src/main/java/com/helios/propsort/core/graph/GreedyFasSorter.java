/*
 * Copyright (c) 2025 Helios Prop Sorter
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.propsort.core.graph;

import com.helios.propsort.api.model.WeightedEdge;
import com.helios.propsort.core.queue.AsyncComparator;
import com.helios.propsort.core.queue.AsyncLoop;
import com.helios.propsort.core.queue.MultiViewQueue;
import com.helios.propsort.core.queue.QueuedItem;
import it.unimi.dsi.fastutil.doubles.DoubleIterator;
import it.unimi.dsi.fastutil.objects.Object2DoubleLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2DoubleMap;

import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.BiFunction;
import java.util.function.ToDoubleFunction;
import java.util.function.UnaryOperator;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Linear ordering of a weighted directed graph that may contain cycles.
 *
 * <p>Greedy Feedback Arc Set heuristic (Eades, Lin and Smyth): sinks are placed from the
 * right end, sources from the left end, and when neither exists the node with the largest
 * {@code outWeight - inWeight} is placed on the left as if it were a source. Backward
 * edges in the result are the approximated feedback arc set.
 *
 * <p>The three selections are views of one {@link MultiViewQueue}. When a node is
 * removed, each remaining neighbour's entry is replaced by a snapshot with updated
 * weights.
 */
public class GreedyFasSorter {
    private static final Logger logger = Logger.getLogger(GreedyFasSorter.class.getName());

    private enum View { OUT_WEIGHT, IN_WEIGHT, SCORE }

    /**
     * Weight snapshot of a node. {@code seq} is the node's first appearance in the edge
     * list and breaks every remaining tie.
     */
    private record NodeWeights(String token, int seq, double outWeight, double inWeight) {
        NodeWeights withOutWeight(double weight) {
            return new NodeWeights(token, seq, weight, inWeight);
        }

        NodeWeights withInWeight(double weight) {
            return new NodeWeights(token, seq, outWeight, weight);
        }

        double delta() {
            return inWeight - outWeight;
        }

        double total() {
            return inWeight + outWeight;
        }
    }

    // Sinks fill the result from the right, so among equal sinks the later node is taken first.
    private static final Comparator<NodeWeights> BY_OUT_WEIGHT = Comparator
            .comparingDouble(NodeWeights::outWeight)
            .thenComparing(Comparator.comparingInt(NodeWeights::seq).reversed());

    private static final Comparator<NodeWeights> BY_IN_WEIGHT = Comparator
            .comparingDouble(NodeWeights::inWeight)
            .thenComparingInt(NodeWeights::seq);

    private static final Comparator<NodeWeights> BY_SCORE = Comparator
            .comparingDouble(NodeWeights::delta)
            .thenComparingDouble(NodeWeights::total)
            .thenComparingInt(NodeWeights::seq);

    /**
     * Orders every node that appears in {@code edges}. Parallel edges add up; self loops
     * count towards both weights of their node.
     *
     * @return a permutation of the edge list's nodes; for acyclic input every edge points
     *         forward
     */
    public CompletableFuture<List<String>> sort(List<WeightedEdge> edges) {
        return new Run(edges).execute();
    }

    /**
     * State of a single sort. The adjacency maps are consumed as nodes are removed.
     */
    private static final class Run {
        private final Set<String> remaining = new LinkedHashSet<>();
        private final Map<String, Object2DoubleLinkedOpenHashMap<String>> outgoing = new HashMap<>();
        private final Map<String, Object2DoubleLinkedOpenHashMap<String>> incoming = new HashMap<>();
        private final Map<String, QueuedItem<NodeWeights>> entries = new HashMap<>();
        private final MultiViewQueue<NodeWeights, View> queue;
        private final String[] order;
        private int left;
        private int right;

        Run(List<WeightedEdge> edges) {
            for (WeightedEdge edge : edges) {
                remaining.add(edge.source());
                remaining.add(edge.target());
            }
            for (String node : remaining) {
                outgoing.put(node, new Object2DoubleLinkedOpenHashMap<>());
                incoming.put(node, new Object2DoubleLinkedOpenHashMap<>());
            }
            for (WeightedEdge edge : edges) {
                outgoing.get(edge.source()).addTo(edge.target(), edge.weight());
                incoming.get(edge.target()).addTo(edge.source(), edge.weight());
            }

            Map<View, AsyncComparator<NodeWeights>> views = new EnumMap<>(View.class);
            views.put(View.OUT_WEIGHT, AsyncComparator.of(BY_OUT_WEIGHT));
            views.put(View.IN_WEIGHT, AsyncComparator.of(BY_IN_WEIGHT));
            views.put(View.SCORE, AsyncComparator.of(BY_SCORE));
            this.queue = new MultiViewQueue<>(View.class, views);

            this.order = new String[remaining.size()];
            this.left = 0;
            this.right = order.length - 1;
        }

        CompletableFuture<List<String>> execute() {
            Map<String, NodeWeights> initial = new LinkedHashMap<>();
            int seq = 0;
            for (String node : remaining) {
                initial.put(node, new NodeWeights(node, seq++, sum(outgoing.get(node)), sum(incoming.get(node))));
            }

            return AsyncLoop.forEach(initial.values(), weights -> queue.push(weights)
                            .thenAccept(item -> entries.put(weights.token(), item)))
                    .thenCompose(v -> AsyncLoop.repeatWhile(this::step))
                    .thenApply(v -> {
                        List<String> result = Arrays.asList(order);
                        if (logger.isLoggable(Level.FINE)) {
                            logger.fine("Greedy FAS order: " + result);
                        }
                        return result;
                    });
        }

        private CompletableFuture<Boolean> step() {
            return drain(View.OUT_WEIGHT, NodeWeights::outWeight, false)
                    .thenCompose(v -> drain(View.IN_WEIGHT, NodeWeights::inWeight, true))
                    .thenCompose(v -> queue.pop(View.SCORE))
                    .thenCompose(best -> {
                        if (best.isEmpty()) {
                            return CompletableFuture.completedFuture(false);
                        }
                        order[left++] = best.get().token();
                        return remove(best.get().token()).thenApply(ignored -> true);
                    });
        }

        /**
         * Places nodes while the top of {@code view} has no weight in that direction. Edge
         * weights are positive and sums are recomputed from the remaining edges, so a zero
         * sum means no edge is left.
         */
        private CompletableFuture<Void> drain(View view, ToDoubleFunction<NodeWeights> weight,
                                              boolean fromLeft) {
            return AsyncLoop.repeatWhile(() -> queue.peek(view).thenCompose(top -> {
                if (top.isEmpty() || weight.applyAsDouble(top.get()) > 0) {
                    return CompletableFuture.completedFuture(false);
                }
                return queue.pop(view).thenCompose(popped -> {
                    String token = popped.orElseThrow().token();
                    if (fromLeft) {
                        order[left++] = token;
                    } else {
                        order[right--] = token;
                    }
                    return remove(token).thenApply(ignored -> true);
                });
            }));
        }

        private CompletableFuture<Void> remove(String node) {
            remaining.remove(node);
            Object2DoubleMap<String> outs = outgoing.remove(node);
            Object2DoubleMap<String> ins = incoming.remove(node);
            entries.remove(node);

            return AsyncLoop.forEach(outs.keySet(), target -> detach(incoming.get(target), node,
                            target, NodeWeights::withInWeight))
                    .thenCompose(v -> AsyncLoop.forEach(ins.keySet(), source -> detach(outgoing.get(source), node,
                            source, NodeWeights::withOutWeight)));
        }

        /**
         * Drops the edges between {@code removed} and {@code neighbour} from the neighbour's
         * adjacency and resubmits it with the recomputed sum.
         */
        private CompletableFuture<Void> detach(Object2DoubleMap<String> adjacency, String removed,
                                               String neighbour,
                                               BiFunction<NodeWeights, Double, NodeWeights> update) {
            if (adjacency == null) {
                return CompletableFuture.completedFuture(null);
            }
            adjacency.removeDouble(removed);
            double total = sum(adjacency);
            return resubmit(neighbour, weights -> update.apply(weights, total));
        }

        private CompletableFuture<Void> resubmit(String neighbour,
                                                 UnaryOperator<NodeWeights> update) {
            if (!remaining.contains(neighbour)) {
                return CompletableFuture.completedFuture(null);
            }
            QueuedItem<NodeWeights> old = entries.get(neighbour);
            queue.delete(old.id());
            return queue.push(update.apply(old.payload()))
                    .thenAccept(item -> entries.put(neighbour, item));
        }

        private static double sum(Object2DoubleMap<String> weights) {
            double total = 0;
            DoubleIterator it = weights.values().iterator();
            while (it.hasNext()) {
                total += it.nextDouble();
            }
            return total;
        }
    }
}

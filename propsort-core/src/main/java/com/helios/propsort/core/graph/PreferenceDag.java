/*
 * Copyright (c) 2025 Helios Prop Sorter
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.propsort.core.graph;

import com.helios.propsort.core.queue.AsyncComparator;
import com.helios.propsort.core.queue.AsyncLoop;
import com.helios.propsort.core.queue.PriorityQueue;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Acyclic precedence graph over a fixed set of tokens.
 *
 * <p>Edges come from hints: ordered lists of tokens or patterns, each meaning "nothing
 * here sorts after a later entry". An edge is only added when its target cannot already
 * reach its source, so the graph stays acyclic no matter how the hints contradict each
 * other. Only the contradicting edges are dropped; everything else from a hint is kept.
 *
 * <p>The node set is fixed at construction. Hint entries that match no node are ignored.
 */
public class PreferenceDag {
    private static final Logger logger = Logger.getLogger(PreferenceDag.class.getName());

    private final Map<String, Set<String>> graph = new LinkedHashMap<>();
    private final TokenMatcher matcher;
    private int edgeCount = 0;

    public PreferenceDag(Collection<String> nodes) {
        this(nodes, WildcardTokenMatcher.INSTANCE);
    }

    public PreferenceDag(Collection<String> nodes, TokenMatcher matcher) {
        this.matcher = Objects.requireNonNull(matcher, "matcher");
        for (String node : nodes) {
            graph.putIfAbsent(Objects.requireNonNull(node, "node"), new LinkedHashSet<>());
        }
    }

    /**
     * Nodes in insertion order.
     */
    public Set<String> nodes() {
        return Collections.unmodifiableSet(graph.keySet());
    }

    public int edgeCount() {
        return edgeCount;
    }

    public boolean hasEdge(String from, String to) {
        Set<String> successors = graph.get(from);
        return successors != null && successors.contains(to);
    }

    public Set<String> successors(String node) {
        Set<String> successors = graph.get(node);
        return successors == null ? Set.of() : Collections.unmodifiableSet(successors);
    }

    /**
     * Resolves a hint entry to the nodes it names.
     *
     * @return every node matching a pattern, in node order; the token itself if it is a
     *         node; otherwise an empty list
     */
    public List<String> matchNodes(String entry) {
        if (entry == null || entry.isEmpty()) {
            return List.of();
        }
        if (matcher.isPattern(entry)) {
            List<String> matched = new ArrayList<>();
            for (String node : graph.keySet()) {
                if (matcher.matches(entry, node)) {
                    matched.add(node);
                }
            }
            return matched;
        }
        return graph.containsKey(entry) ? List.of(entry) : List.of();
    }

    /**
     * Depth-first reachability from {@code source}. A node reaches itself.
     *
     * @return for each destination, whether it is reachable
     */
    public boolean[] hasPath(String source, List<String> destinations) {
        boolean[] result = new boolean[destinations.size()];
        if (destinations.isEmpty()) {
            return result;
        }

        Set<String> targets = new HashSet<>(destinations);
        Set<String> reached = new HashSet<>();
        Set<String> visited = new HashSet<>();
        Deque<String> stack = new ArrayDeque<>();
        stack.push(source);

        while (!stack.isEmpty()) {
            String node = stack.pop();
            if (targets.contains(node)) {
                reached.add(node);
                if (reached.size() == targets.size()) {
                    break;
                }
            }
            if (visited.add(node)) {
                for (String next : graph.getOrDefault(node, Set.of())) {
                    stack.push(next);
                }
            }
        }

        for (int i = 0; i < result.length; i++) {
            result[i] = reached.contains(destinations.get(i));
        }
        return result;
    }

    /**
     * Adds the precedence edges implied by one hint.
     *
     * <p>Entries are scanned left to right. The frontier holds the matched nodes that have
     * not yet been linked to a later entry. Each frontier node {@code u} gets an edge to
     * every node {@code v} of the next matched entry unless {@code v} already reaches
     * {@code u}. Frontier nodes that received no edge stay in the frontier.
     *
     * @param hint tokens or patterns, highest precedence first
     * @return the number of edges added
     */
    public int addEdges(List<String> hint) {
        int added = 0;
        int skipped = 0;
        int i = 0;
        int length = hint.size();

        List<String> frontier = List.of();
        while (i < length && frontier.isEmpty()) {
            frontier = matchNodes(hint.get(i++));
        }

        while (i < length) {
            List<String> group = matchNodes(hint.get(i++));
            if (group.isEmpty()) {
                continue;
            }

            Set<String> open = new LinkedHashSet<>(frontier);
            for (String v : group) {
                boolean[] reachable = hasPath(v, frontier);
                for (int j = 0; j < frontier.size(); j++) {
                    String u = frontier.get(j);
                    if (reachable[j]) {
                        skipped++;
                        continue;
                    }
                    if (graph.get(u).add(v)) {
                        edgeCount++;
                        added++;
                    }
                    open.remove(u);
                }
            }

            Set<String> next = new LinkedHashSet<>(open);
            next.addAll(group);
            frontier = new ArrayList<>(next);
        }

        if (logger.isLoggable(Level.FINE)) {
            logger.fine(String.format("Hint of %d entries: %d edges added, %d skipped, %d total",
                    length, added, skipped, edgeCount));
        }
        return added;
    }

    /**
     * Kahn's algorithm over all nodes. Among the nodes whose predecessors have all been
     * emitted, {@code tieBreaker} picks the next one.
     *
     * @return every node exactly once, each edge's source before its target
     */
    public CompletableFuture<List<String>> topoSort(AsyncComparator<String> tieBreaker) {
        Object2IntMap<String> inDegree = new Object2IntOpenHashMap<>();
        for (Map.Entry<String, Set<String>> entry : graph.entrySet()) {
            inDegree.putIfAbsent(entry.getKey(), 0);
            for (String v : entry.getValue()) {
                inDegree.put(v, inDegree.getInt(v) + 1);
            }
        }

        List<String> roots = new ArrayList<>();
        for (String node : graph.keySet()) {
            if (inDegree.getInt(node) == 0) {
                roots.add(node);
            }
        }

        PriorityQueue<String> ready = new PriorityQueue<>(tieBreaker);
        List<String> result = new ArrayList<>(graph.size());

        return AsyncLoop.forEach(roots, ready::push)
                .thenCompose(v -> AsyncLoop.repeatWhile(() -> ready.pop().thenCompose(next -> {
                    if (next.isEmpty()) {
                        return CompletableFuture.completedFuture(false);
                    }
                    String u = next.get();
                    result.add(u);

                    List<String> released = new ArrayList<>();
                    for (String successor : graph.get(u)) {
                        int degree = inDegree.getInt(successor) - 1;
                        inDegree.put(successor, degree);
                        if (degree == 0) {
                            released.add(successor);
                        }
                    }
                    return AsyncLoop.forEach(released, ready::push).thenApply(ignored -> true);
                })))
                .thenApply(v -> result);
    }

    /**
     * {@link #topoSort(AsyncComparator)} with a synchronous tie-breaker.
     */
    public List<String> topoSortSync(Comparator<String> tieBreaker) {
        return topoSort(AsyncComparator.of(tieBreaker)).join();
    }
}

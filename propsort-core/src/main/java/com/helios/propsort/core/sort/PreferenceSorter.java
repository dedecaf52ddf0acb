/*
 * Copyright (c) 2025 Helios Prop Sorter
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.propsort.core.sort;

import com.helios.propsort.api.IPreferenceSorter;
import com.helios.propsort.api.PairwiseComparator;
import com.helios.propsort.api.model.SortMode;
import com.helios.propsort.core.comparator.CachingPairwiseComparator;
import com.helios.propsort.core.graph.PreferenceDag;
import com.helios.propsort.core.normalize.IdentifierNormalizer;
import com.helios.propsort.core.order.CanonicalOrder;
import com.helios.propsort.core.queue.AsyncComparator;
import com.helios.propsort.core.queue.AsyncLoop;
import com.helios.propsort.core.ranking.BradleyTerryEstimator;
import com.helios.propsort.core.ranking.RankEstimator;
import com.helios.propsort.core.telemetry.TracingService;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.Scope;
import it.unimi.dsi.fastutil.objects.Object2IntLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Orders one group of tokens from precedence hints plus a mode-specific tie-break.
 *
 * <p>Hints are applied in priority order: the custom order, then the canonical table.
 * Each token's <em>tier</em> is the index of the first hint naming it; tokens no hint
 * names share the last tier. Among tokens whose predecessors have all been placed, the
 * lower tier goes first, then the mode decides:
 * <ul>
 *   <li>{@link SortMode#OFF}: the hint-free tokens also get their input order as a hint;
 *       remaining ties go by input position.</li>
 *   <li>{@link SortMode#STABILIZED}: every pair is scored with
 *       {@link PairwiseComparator#rawCompare}, strengths are estimated from the scores, and
 *       the hint-free tokens get the strength order as a hint; remaining ties go by that
 *       order. Tokens with an undefined strength keep their input position.</li>
 *   <li>{@link SortMode#DIRECT}: remaining ties are asked of
 *       {@link PairwiseComparator#compare}; {@code NaN} counts as no preference.</li>
 * </ul>
 *
 * <p>A token occurring several times is ordered once and repeated in place.
 */
public class PreferenceSorter implements IPreferenceSorter {
    private static final Logger logger = Logger.getLogger(PreferenceSorter.class.getName());

    private final SortMode mode;
    private final List<String> customOrder;
    private final CanonicalOrder canonicalOrder;
    private final PairwiseComparator comparator;
    private final RankEstimator rankEstimator;
    private final Tracer tracer;

    private PreferenceSorter(Builder builder) {
        this.mode = builder.mode;
        this.customOrder = builder.customOrder;
        this.canonicalOrder = builder.canonicalOrder != null ? builder.canonicalOrder : CanonicalOrder.defaults();
        this.comparator = builder.comparator;
        this.rankEstimator = builder.rankEstimator != null ? builder.rankEstimator : new BradleyTerryEstimator();
        this.tracer = builder.tracer != null ? builder.tracer : TracingService.getInstance().getTracer();

        logger.info(String.format("PreferenceSorter initialized: mode=%s, customOrder=%d entries, canonicalOrder=%d entries",
                mode.value(), customOrder.size(), canonicalOrder.size()));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * A sorter configured from {@code config}. The comparator, if given, is wrapped in a
     * {@link CachingPairwiseComparator} sized by the configuration.
     *
     * @param comparator may be {@code null} when the configured mode does not need one
     */
    public static PreferenceSorter fromConfig(SorterConfig config, PairwiseComparator comparator) {
        Builder builder = builder()
                .mode(config.mode())
                .customOrder(config.customOrder())
                .rankEstimator(new BradleyTerryEstimator(config.rankMaxIterations()));
        if (comparator != null) {
            builder.comparator(CachingPairwiseComparator.builder(comparator)
                    .maxSize(config.cacheMaxSize())
                    .recordStats(config.cacheRecordStats())
                    .build());
        }
        return builder.build();
    }

    public SortMode mode() {
        return mode;
    }

    /**
     * The custom order as normalized tokens and patterns.
     */
    public List<String> customOrder() {
        return customOrder;
    }

    @Override
    public CompletableFuture<List<String>> sort(List<String> tokens) {
        Objects.requireNonNull(tokens, "tokens");
        Object2IntLinkedOpenHashMap<String> counts = new Object2IntLinkedOpenHashMap<>();
        for (String token : tokens) {
            if (token == null) {
                throw new IllegalArgumentException("tokens must not contain null");
            }
            counts.addTo(token, 1);
        }
        if (counts.size() < 2) {
            return CompletableFuture.completedFuture(new ArrayList<>(tokens));
        }

        List<List<String>> hints = hints();
        Span span = tracer.spanBuilder("sort-group").startSpan();
        CompletableFuture<List<String>> sorted;
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("groupSize", tokens.size());
            span.setAttribute("mode", mode.value());
            span.setAttribute("hintCount", hints.size());

            List<String> distinct = new ArrayList<>(counts.keySet());
            sorted = sortDistinct(distinct, hints, span)
                    .thenApply(order -> expand(order, counts));
        } catch (RuntimeException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR);
            span.end();
            throw e;
        }

        return sorted.whenComplete((order, error) -> {
            if (error != null) {
                span.recordException(unwrap(error));
                span.setStatus(StatusCode.ERROR);
            } else if (logger.isLoggable(Level.FINE)) {
                logger.fine(String.format("Sorted %d tokens (%s): %s", tokens.size(), mode.value(), order));
            }
            span.end();
        });
    }

    @Override
    public CompletableFuture<List<String>> sortNames(List<String> names) {
        Objects.requireNonNull(names, "names");
        if (names.size() < 2) {
            return CompletableFuture.completedFuture(new ArrayList<>(names));
        }

        Map<String, Deque<String>> namesByToken = new LinkedHashMap<>();
        List<String> tokens = new ArrayList<>(names.size());
        for (String name : names) {
            String token = IdentifierNormalizer.normalize(Objects.requireNonNull(name, "name"));
            tokens.add(token);
            namesByToken.computeIfAbsent(token, k -> new ArrayDeque<>()).add(name);
        }

        return sort(tokens).thenApply(order -> {
            List<String> result = new ArrayList<>(order.size());
            for (String token : order) {
                result.add(namesByToken.get(token).poll());
            }
            return result;
        });
    }

    private List<List<String>> hints() {
        List<List<String>> hints = new ArrayList<>(2);
        if (!customOrder.isEmpty()) {
            hints.add(customOrder);
        }
        if (!canonicalOrder.isEmpty()) {
            hints.add(canonicalOrder.entries());
        }
        return hints;
    }

    private CompletableFuture<List<String>> sortDistinct(List<String> distinct, List<List<String>> hints, Span span) {
        PreferenceDag dag = new PreferenceDag(distinct);
        Object2IntMap<String> tiers = new Object2IntOpenHashMap<>();
        tiers.defaultReturnValue(hints.size());

        for (int h = 0; h < hints.size(); h++) {
            List<String> hint = hints.get(h);
            dag.addEdges(hint);
            for (String entry : hint) {
                for (String node : dag.matchNodes(entry)) {
                    if (!tiers.containsKey(node)) {
                        tiers.put(node, h);
                    }
                }
            }
        }

        List<String> unhinted = new ArrayList<>();
        for (String token : distinct) {
            if (!tiers.containsKey(token)) {
                unhinted.add(token);
            }
        }

        if (logger.isLoggable(Level.FINE)) {
            logger.fine(String.format("Group of %d distinct tokens: %d edges from %d hints, %d tokens unhinted",
                    distinct.size(), dag.edgeCount(), hints.size(), unhinted.size()));
        }

        switch (mode) {
            case DIRECT:
                return dag.topoSort(byTier(tiers, (a, b) -> comparator.compare(a, b)
                        .thenApply(PreferenceSorter::signum)));
            case OFF:
                return stabilizeAndSort(dag, tiers, unhinted, distinct);
            case STABILIZED:
                return collectScores(distinct)
                        .thenApply(wins -> rankOrder(distinct, wins, span))
                        .thenCompose(ranked -> stabilizeAndSort(dag, tiers, unhinted, ranked));
            default:
                throw new IllegalStateException("Unhandled sort mode: " + mode);
        }
    }

    /**
     * Adds {@code reference} (restricted to unhinted tokens) as a final hint and sorts with
     * reference position as the tie-break after tier.
     */
    private CompletableFuture<List<String>> stabilizeAndSort(PreferenceDag dag, Object2IntMap<String> tiers,
                                                             List<String> unhinted, List<String> reference) {
        Object2IntMap<String> position = new Object2IntOpenHashMap<>();
        for (int i = 0; i < reference.size(); i++) {
            position.put(reference.get(i), i);
        }

        List<String> stabilizer = new ArrayList<>(unhinted);
        stabilizer.sort((a, b) -> Integer.compare(position.getInt(a), position.getInt(b)));
        dag.addEdges(stabilizer);

        return dag.topoSort(byTier(tiers, AsyncComparator.of(
                (String a, String b) -> Integer.compare(position.getInt(a), position.getInt(b)))));
    }

    private static AsyncComparator<String> byTier(Object2IntMap<String> tiers, AsyncComparator<String> next) {
        return (a, b) -> {
            int byTier = Integer.compare(tiers.getInt(a), tiers.getInt(b));
            if (byTier != 0) {
                return CompletableFuture.completedFuture(byTier);
            }
            return next.compare(a, b);
        };
    }

    /**
     * Scores every pair {@code i < j} one at a time; {@code wins[i][j]} holds the
     * preference for {@code i} before {@code j}.
     */
    private CompletableFuture<double[][]> collectScores(List<String> distinct) {
        int n = distinct.size();
        double[][] wins = new double[n][n];
        List<int[]> pairs = new ArrayList<>(n * (n - 1) / 2);
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                pairs.add(new int[]{i, j});
            }
        }

        return AsyncLoop.forEach(pairs, pair -> comparator.rawCompare(distinct.get(pair[0]), distinct.get(pair[1]))
                        .thenAccept(scores -> {
                            wins[pair[0]][pair[1]] = scores.forward();
                            wins[pair[1]][pair[0]] = scores.reverse();
                        }))
                .thenApply(v -> wins);
    }

    private List<String> rankOrder(List<String> distinct, double[][] wins, Span parent) {
        Span span = tracer.spanBuilder("rank-estimation")
                .setParent(Context.current().with(parent))
                .startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("itemCount", distinct.size());
            double[] strengths = rankEstimator.estimate(wins);
            List<String> ranked = orderByStrength(distinct, strengths);
            if (logger.isLoggable(Level.FINE)) {
                logger.fine("Rank order: " + ranked);
            }
            return ranked;
        } catch (RuntimeException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Orders items by descending strength, keeping equal strengths in input order. Items
     * with a {@code NaN} strength stay at their input index and the others fill the
     * remaining slots.
     */
    static List<String> orderByStrength(List<String> items, double[] strengths) {
        if (strengths.length != items.size()) {
            throw new IllegalStateException(String.format(
                    "Rank estimator returned %d strengths for %d items", strengths.length, items.size()));
        }

        List<Integer> ranked = new ArrayList<>();
        for (int i = 0; i < strengths.length; i++) {
            if (!Double.isNaN(strengths[i])) {
                ranked.add(i);
            }
        }
        ranked.sort((x, y) -> Double.compare(strengths[y], strengths[x]));

        List<String> result = new ArrayList<>(items.size());
        int next = 0;
        for (int i = 0; i < items.size(); i++) {
            if (Double.isNaN(strengths[i])) {
                result.add(items.get(i));
            } else {
                result.add(items.get(ranked.get(next++)));
            }
        }
        return result;
    }

    private static List<String> expand(List<String> order, Object2IntMap<String> counts) {
        List<String> result = new ArrayList<>();
        for (String token : order) {
            for (int k = counts.getInt(token); k > 0; k--) {
                result.add(token);
            }
        }
        return result;
    }

    private static int signum(Double score) {
        if (score == null || score.isNaN()) {
            return 0;
        }
        return score < 0 ? -1 : (score > 0 ? 1 : 0);
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }

    public static final class Builder {
        private SortMode mode = SortMode.OFF;
        private List<String> customOrder = List.of();
        private CanonicalOrder canonicalOrder;
        private PairwiseComparator comparator;
        private RankEstimator rankEstimator;
        private Tracer tracer;

        private Builder() {
        }

        public Builder mode(SortMode mode) {
            this.mode = Objects.requireNonNull(mode, "mode");
            return this;
        }

        /**
         * @throws IllegalArgumentException if {@code mode} names no {@link SortMode}
         */
        public Builder mode(String mode) {
            return mode(SortMode.fromString(mode));
        }

        /**
         * Highest-priority hint, as raw names or patterns such as {@code "data-*"}.
         */
        public Builder customOrder(List<String> rawNames) {
            List<String> normalized = new ArrayList<>(rawNames.size());
            for (String token : IdentifierNormalizer.normalizeAll(rawNames)) {
                if (!token.isEmpty()) {
                    normalized.add(token);
                }
            }
            this.customOrder = List.copyOf(normalized);
            return this;
        }

        public Builder canonicalOrder(CanonicalOrder canonicalOrder) {
            this.canonicalOrder = canonicalOrder;
            return this;
        }

        public Builder comparator(PairwiseComparator comparator) {
            this.comparator = comparator;
            return this;
        }

        public Builder rankEstimator(RankEstimator rankEstimator) {
            this.rankEstimator = rankEstimator;
            return this;
        }

        public Builder tracer(Tracer tracer) {
            this.tracer = tracer;
            return this;
        }

        /**
         * @throws IllegalStateException if the mode needs a comparator and none was given
         */
        public PreferenceSorter build() {
            if (mode.requiresComparator() && comparator == null) {
                throw new IllegalStateException("Sort mode '" + mode.value() + "' requires a PairwiseComparator");
            }
            return new PreferenceSorter(this);
        }
    }
}

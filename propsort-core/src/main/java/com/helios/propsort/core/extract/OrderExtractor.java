/*
 * Copyright (c) 2025 Helios Prop Sorter
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.propsort.core.extract;

import com.helios.propsort.api.IOrderExtractor;
import com.helios.propsort.api.model.WeightedEdge;
import com.helios.propsort.core.graph.GreedyFasSorter;
import com.helios.propsort.core.graph.WildcardTokenMatcher;
import com.helios.propsort.core.telemetry.TracingService;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import it.unimi.dsi.fastutil.objects.Object2IntLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2IntMap;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Learns a custom order from groups seen in existing code.
 *
 * <p>Every observed group adds one unit of weight to {@code group[i] -> group[j]} for each
 * {@code i < j}. Tokens of a prop family ({@code data }, {@code test }, {@code aria } by
 * default) are folded into the family pattern, so {@code "data id"} counts as
 * {@code "data *"}. The extracted order is the weighted graph sorted by
 * {@link GreedyFasSorter}, ready to be used as a custom order.
 *
 * <p>Not thread-safe.
 */
public class OrderExtractor implements IOrderExtractor {
    private static final Logger logger = Logger.getLogger(OrderExtractor.class.getName());

    public static final List<String> DEFAULT_FAMILY_PREFIXES = List.of("data ", "test ", "aria ");

    private final List<String> familyPrefixes;
    private final GreedyFasSorter fasSorter;
    private final Tracer tracer;
    private final Map<String, Object2IntLinkedOpenHashMap<String>> weights = new LinkedHashMap<>();
    private int groupCount = 0;

    public OrderExtractor() {
        this(DEFAULT_FAMILY_PREFIXES, TracingService.getInstance().getTracer());
    }

    public OrderExtractor(Tracer tracer) {
        this(DEFAULT_FAMILY_PREFIXES, tracer);
    }

    public OrderExtractor(List<String> familyPrefixes, Tracer tracer) {
        this.familyPrefixes = List.copyOf(familyPrefixes);
        this.fasSorter = new GreedyFasSorter();
        this.tracer = Objects.requireNonNull(tracer, "tracer");
    }

    @Override
    public void observe(List<String> group) {
        List<String> folded = new ArrayList<>(group.size());
        for (String token : group) {
            folded.add(fold(Objects.requireNonNull(token, "token")));
        }

        for (int i = 0; i < folded.size(); i++) {
            Object2IntLinkedOpenHashMap<String> row =
                    weights.computeIfAbsent(folded.get(i), k -> new Object2IntLinkedOpenHashMap<>());
            for (int j = i + 1; j < folded.size(); j++) {
                row.addTo(folded.get(j), 1);
            }
        }
        groupCount++;
    }

    /**
     * The family pattern for {@code token}, or {@code token} itself.
     */
    String fold(String token) {
        for (String prefix : familyPrefixes) {
            if (token.startsWith(prefix)) {
                return WildcardTokenMatcher.patternFor(prefix);
            }
        }
        return token;
    }

    @Override
    public List<WeightedEdge> edges() {
        List<WeightedEdge> edges = new ArrayList<>();
        for (Map.Entry<String, Object2IntLinkedOpenHashMap<String>> row : weights.entrySet()) {
            for (Object2IntMap.Entry<String> cell : row.getValue().object2IntEntrySet()) {
                edges.add(new WeightedEdge(row.getKey(), cell.getKey(), cell.getIntValue()));
            }
        }
        return edges;
    }

    public int groupCount() {
        return groupCount;
    }

    @Override
    public CompletableFuture<List<String>> extractOrder() {
        List<WeightedEdge> edges = edges();
        Span span = tracer.spanBuilder("extract-order").startSpan();
        CompletableFuture<List<String>> order;
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("groupCount", groupCount);
            span.setAttribute("edgeCount", edges.size());
            order = fasSorter.sort(edges);
        } catch (RuntimeException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR);
            span.end();
            throw e;
        }

        return order.whenComplete((result, error) -> {
            if (error != null) {
                Throwable cause = error instanceof CompletionException && error.getCause() != null
                        ? error.getCause() : error;
                span.recordException(cause);
                span.setStatus(StatusCode.ERROR);
            } else if (logger.isLoggable(Level.FINE)) {
                logger.fine(String.format("Extracted order from %d groups, %d edges: %s",
                        groupCount, edges.size(), result));
            }
            span.end();
        });
    }
}

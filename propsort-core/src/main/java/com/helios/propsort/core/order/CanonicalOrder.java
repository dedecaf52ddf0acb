/*
 * Copyright (c) 2025 Helios Prop Sorter
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.propsort.core.order;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.helios.propsort.core.normalize.IdentifierNormalizer;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Built-in precedence table applied after any custom order.
 *
 * <p>Entries are normalized tokens or trailing-wildcard patterns. The default table is
 * read once from the classpath resource {@value #DEFAULT_RESOURCE}:
 * <pre>
 * { "order": ["key", "ref", "id", ..., "aria *", "data *", "on *", "children"] }
 * </pre>
 * Entries are normalized on load, so raw spellings such as {@code "className"} or
 * {@code "data-*"} are accepted.
 */
public final class CanonicalOrder {
    private static final Logger logger = Logger.getLogger(CanonicalOrder.class.getName());

    public static final String DEFAULT_RESOURCE = "canonical-order.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final List<String> entries;

    private CanonicalOrder(List<String> entries) {
        this.entries = List.copyOf(entries);
    }

    /**
     * The bundled table, parsed on first use.
     *
     * @throws OrderTableException if the bundled resource is missing or malformed
     */
    public static CanonicalOrder defaults() {
        return DefaultHolder.INSTANCE;
    }

    /**
     * A table with no entries.
     */
    public static CanonicalOrder empty() {
        return new CanonicalOrder(List.of());
    }

    /**
     * A table from raw names or patterns, normalized in order.
     */
    public static CanonicalOrder of(List<String> rawEntries) {
        return new CanonicalOrder(normalize(rawEntries));
    }

    /**
     * Loads a table from a classpath resource.
     */
    public static CanonicalOrder fromResource(String resource) {
        ClassLoader loader = CanonicalOrder.class.getClassLoader();
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new OrderTableException("Precedence table resource not found: " + resource);
            }
            CanonicalOrder order = parse(in);
            logger.info(String.format("Loaded precedence table '%s' with %d entries", resource, order.size()));
            return order;
        } catch (IOException e) {
            throw new OrderTableException("Failed to read precedence table: " + resource, e);
        }
    }

    /**
     * Parses a {@code {"order": [...]}} document. The caller owns the stream.
     */
    public static CanonicalOrder parse(InputStream in) {
        JsonNode root;
        try {
            root = MAPPER.readTree(in);
        } catch (IOException e) {
            throw new OrderTableException("Malformed precedence table", e);
        }
        JsonNode order = root == null ? null : root.get("order");
        if (order == null || !order.isArray()) {
            throw new OrderTableException("Precedence table must contain an \"order\" array");
        }

        List<String> raw = new ArrayList<>(order.size());
        for (JsonNode entry : order) {
            if (!entry.isTextual()) {
                throw new OrderTableException("Precedence table entries must be strings, got: " + entry);
            }
            raw.add(entry.asText());
        }
        return of(raw);
    }

    public List<String> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    private static List<String> normalize(List<String> raw) {
        List<String> normalized = new ArrayList<>(raw.size());
        for (String entry : IdentifierNormalizer.normalizeAll(raw)) {
            if (!entry.isEmpty()) {
                normalized.add(entry);
            }
        }
        return normalized;
    }

    private static final class DefaultHolder {
        private static final CanonicalOrder INSTANCE = fromResource(DEFAULT_RESOURCE);
    }
}

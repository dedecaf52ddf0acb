/*
 * Copyright (c) 2025 Helios Prop Sorter
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.propsort.core.normalize;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Folds identifier spellings into one comparable token: camelCase, PascalCase,
 * snake_case, kebab-case and dotted names all become lowercase words separated by
 * single spaces ({@code "aria-labelledBy" -> "aria labelled by"}).
 *
 * <p>A trailing {@code *} is kept, so {@code "data-*"} normalizes to the pattern
 * {@code "data *"}.
 */
public final class IdentifierNormalizer {

    private static final Pattern SEPARATORS = Pattern.compile("[_\\-.:]+");
    private static final Pattern LOWER_TO_UPPER = Pattern.compile("([a-z0-9])([A-Z])");
    private static final Pattern ACRONYM_TO_WORD = Pattern.compile("([A-Z]+)([A-Z][a-z])");
    private static final Pattern EDGE_PADDING = Pattern.compile("^[_\\s]+|[_\\s]+$");

    private IdentifierNormalizer() {
    }

    public static String normalize(String raw) {
        String s = SEPARATORS.matcher(raw.strip()).replaceAll(" ");
        s = LOWER_TO_UPPER.matcher(s).replaceAll("$1 $2");
        s = ACRONYM_TO_WORD.matcher(s).replaceAll("$1 $2");
        s = EDGE_PADDING.matcher(s).replaceAll("");
        return s.toLowerCase(Locale.ROOT);
    }

    public static List<String> normalizeAll(List<String> raw) {
        List<String> tokens = new ArrayList<>(raw.size());
        for (String name : raw) {
            tokens.add(normalize(name));
        }
        return tokens;
    }
}

/*
 * Copyright (c) 2025 Helios Prop Sorter
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.propsort.core.sort;

import com.helios.propsort.api.model.SortMode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SorterConfigTest {

    private static final List<String> PROPERTIES = List.of(
            SorterConfig.ENV_MODE,
            SorterConfig.ENV_CUSTOM_ORDER,
            SorterConfig.ENV_CACHE_MAX_SIZE,
            SorterConfig.ENV_CACHE_RECORD_STATS,
            SorterConfig.ENV_RANK_MAX_ITERATIONS);

    @AfterEach
    void clearProperties() {
        PROPERTIES.forEach(System::clearProperty);
    }

    private static InputStream json(String content) {
        return new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Defaults should need no comparator")
    void testDefaults() {
        SorterConfig config = SorterConfig.defaults().build();

        assertThat(config.mode()).isEqualTo(SortMode.OFF);
        assertThat(config.customOrder()).isEmpty();
        assertThat(config.cacheMaxSize()).isEqualTo(10_000);
        assertThat(config.cacheRecordStats()).isFalse();
        assertThat(config.rankMaxIterations()).isEqualTo(10);
    }

    @Test
    @DisplayName("System properties should override the defaults")
    void testPropertyOverrides() {
        System.setProperty(SorterConfig.ENV_MODE, "stable");
        System.setProperty(SorterConfig.ENV_CUSTOM_ORDER, " key, id ,, onClick ");
        System.setProperty(SorterConfig.ENV_CACHE_MAX_SIZE, "500");
        System.setProperty(SorterConfig.ENV_CACHE_RECORD_STATS, "yes");
        System.setProperty(SorterConfig.ENV_RANK_MAX_ITERATIONS, "25");

        SorterConfig config = SorterConfig.fromEnvironment();

        assertThat(config.mode()).isEqualTo(SortMode.STABILIZED);
        assertThat(config.customOrder()).containsExactly("key", "id", "onClick");
        assertThat(config.cacheMaxSize()).isEqualTo(500);
        assertThat(config.cacheRecordStats()).isTrue();
        assertThat(config.rankMaxIterations()).isEqualTo(25);
    }

    @Test
    @DisplayName("Unparsable overrides should be ignored")
    void testInvalidOverridesIgnored() {
        System.setProperty(SorterConfig.ENV_MODE, "sometimes");
        System.setProperty(SorterConfig.ENV_CACHE_MAX_SIZE, "lots");

        SorterConfig config = SorterConfig.fromEnvironment();

        assertThat(config.mode()).isEqualTo(SortMode.OFF);
        assertThat(config.cacheMaxSize()).isEqualTo(10_000);
    }

    @Test
    @DisplayName("Non-positive overrides should fall back to the defaults")
    void testOutOfRangeOverridesIgnored() {
        System.setProperty(SorterConfig.ENV_CACHE_MAX_SIZE, "0");
        System.setProperty(SorterConfig.ENV_RANK_MAX_ITERATIONS, "-3");

        SorterConfig config = SorterConfig.fromEnvironment();

        assertThat(config.cacheMaxSize()).isEqualTo(10_000);
        assertThat(config.rankMaxIterations()).isEqualTo(10);
        assertThatThrownBy(() -> SorterConfig.defaults().cacheMaxSize(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("cacheMaxSize");
    }

    @Test
    @DisplayName("Explicit builder values should win over overrides")
    void testBuilderWins() {
        System.setProperty(SorterConfig.ENV_MODE, "direct");

        SorterConfig config = SorterConfig.builder().mode("off").build();

        assertThat(config.mode()).isEqualTo(SortMode.OFF);
    }

    @Test
    @DisplayName("Should read plugin-style option names from JSON")
    void testFromJson() {
        SorterConfig config = SorterConfig.fromJson(json("""
                {
                  "sortPropsUseAI": "yes",
                  "sortPropsCustomOrder": ["key", "data-*"],
                  "cacheMaxSize": 42,
                  "cacheRecordStats": true,
                  "rankMaxIterations": 3
                }
                """));

        assertThat(config.mode()).isEqualTo(SortMode.DIRECT);
        assertThat(config.customOrder()).containsExactly("key", "data-*");
        assertThat(config.cacheMaxSize()).isEqualTo(42);
        assertThat(config.cacheRecordStats()).isTrue();
        assertThat(config.rankMaxIterations()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should reject malformed JSON, unknown modes and invalid sizes")
    void testInvalidJson() {
        assertThatThrownBy(() -> SorterConfig.fromJson(json("[1, 2]")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SorterConfig.fromJson(json("{broken")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SorterConfig.fromJson(json("{\"sortPropsUseAI\": \"maybe\"}")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maybe");
        assertThatThrownBy(() -> SorterConfig.defaults().rankMaxIterations(0).build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}

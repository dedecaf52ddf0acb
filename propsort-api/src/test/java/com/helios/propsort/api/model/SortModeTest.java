/*
 * Copyright (c) 2025 Helios Prop Sorter
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.propsort.api.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SortModeTest {

    @Test
    @DisplayName("Should parse canonical names and plugin aliases case-insensitively")
    void testFromString() {
        assertThat(SortMode.fromString("direct")).isEqualTo(SortMode.DIRECT);
        assertThat(SortMode.fromString("yes")).isEqualTo(SortMode.DIRECT);
        assertThat(SortMode.fromString("OFF")).isEqualTo(SortMode.OFF);
        assertThat(SortMode.fromString(" no ")).isEqualTo(SortMode.OFF);
        assertThat(SortMode.fromString("Stabilized")).isEqualTo(SortMode.STABILIZED);
        assertThat(SortMode.fromString("stable")).isEqualTo(SortMode.STABILIZED);
    }

    @Test
    @DisplayName("Should reject unknown and null selectors")
    void testRejectInvalid() {
        assertThatThrownBy(() -> SortMode.fromString("sometimes"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("sometimes");
        assertThatThrownBy(() -> SortMode.fromString(null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Only OFF works without a comparator")
    void testRequiresComparator() {
        assertThat(SortMode.OFF.requiresComparator()).isFalse();
        assertThat(SortMode.DIRECT.requiresComparator()).isTrue();
        assertThat(SortMode.STABILIZED.requiresComparator()).isTrue();
    }
}

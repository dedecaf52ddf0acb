/*
 * Copyright (c) 2025 Helios Prop Sorter
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.propsort.core.normalize;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class IdentifierNormalizerTest {

    static Stream<Arguments> identifiers() {
        return Stream.of(
                Arguments.of("camelCaseString", "camel case string"),
                Arguments.of("PascalCaseString", "pascal case string"),
                Arguments.of("snake_case_string", "snake case string"),
                Arguments.of("kebab-case-string", "kebab case string"),
                Arguments.of("dot.case.string", "dot case string"),
                Arguments.of("UPPER_CASE_STRING", "upper case string"),
                Arguments.of("MiXeD_CaSe-STRING.Value123", "mi xe d ca se string value123"),
                Arguments.of("test123String", "test123 string"),
                Arguments.of("  _leading-Test_  ", "leading test"),
                Arguments.of("word1  __--word2..word3", "word1   word2 word3"),
                Arguments.of("IDENTIFIER_fooIdentifier", "identifier foo identifier"),
                Arguments.of("fooIdentifierBARIdentifier", "foo identifier bar identifier"),
                Arguments.of("TARGET_buildVersion", "target build version"),
                Arguments.of("Target_Build_Version", "target build version"),
                Arguments.of("TargetBuildVersion", "target build version"),
                Arguments.of("XMLDocument", "xml document"),
                Arguments.of("CIACMELCase", "ciacmel case"),
                Arguments.of("aria-labelledBy", "aria labelled by"),
                Arguments.of("xlink:href", "xlink href"),
                Arguments.of("", ""),
                Arguments.of(" __ ", "")
        );
    }

    @ParameterizedTest(name = "\"{0}\" -> \"{1}\"")
    @MethodSource("identifiers")
    @DisplayName("Should fold identifier spellings into lowercase words")
    void testNormalize(String raw, String expected) {
        assertThat(IdentifierNormalizer.normalize(raw)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Should keep a trailing wildcard so raw patterns become token patterns")
    void testWildcardPatterns() {
        assertThat(IdentifierNormalizer.normalizeAll(List.of("data-*", "onClick", "aria*")))
                .containsExactly("data *", "on click", "aria*");
    }
}

package com.purchasingpower.thesugraph.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Phase Reference Parser Tests")
class PhasesRefParserTest {

    @Test
    @DisplayName("Should expand mixed single phases, ranges and whole groups")
    void testParse_MixedExpression() {
        // When
        Map<Integer, List<Integer>> result = PhasesRefParser.parse("1.1,1.4-5,2");

        // Then
        assertEquals(List.of(1, 4, 5), result.get(1));
        assertEquals(List.of(), result.get(2), "Bare group means every phase of it");
        assertEquals(2, result.size());
    }

    @Test
    @DisplayName("Should accept a range written with the group on both ends")
    void testParse_FullyQualifiedRange() {
        Map<Integer, List<Integer>> result = PhasesRefParser.parse("3.2-3.4");

        assertEquals(List.of(2, 3, 4), result.get(3));
    }

    @Test
    @DisplayName("Should expand a range of groups into whole groups")
    void testParse_GroupRange() {
        Map<Integer, List<Integer>> result = PhasesRefParser.parse("1-3");

        assertEquals(List.of(1, 2, 3), List.copyOf(result.keySet()));
        result.values().forEach(phases -> assertTrue(phases.isEmpty()));
    }

    @Test
    @DisplayName("Should return nothing for slash, blank or null")
    void testParse_NoReference() {
        assertTrue(PhasesRefParser.parse("/").isEmpty());
        assertTrue(PhasesRefParser.parse("  ").isEmpty());
        assertTrue(PhasesRefParser.parse(null).isEmpty());
    }

    @Test
    @DisplayName("Should skip malformed parts and keep the valid ones")
    void testParse_MalformedPartSkipped() {
        Map<Integer, List<Integer>> result = PhasesRefParser.parse("x.1,2.2,1.2.3");

        assertEquals(Map.of(2, List.of(2)), result);
    }

    @Test
    @DisplayName("Should skip ranges that are reversed or too wide without expanding them")
    void testParse_OutOfBoundsRangesSkipped() {
        // When
        Map<Integer, List<Integer>> result = assertTimeoutPreemptively(Duration.ofSeconds(5),
                () -> PhasesRefParser.parse("1.2147483647-2147483647,2.1"));

        // Then
        assertEquals(Map.of(2, List.of(1)), result);
        assertTrue(PhasesRefParser.parse("1-2000000000").isEmpty());
        assertTrue(PhasesRefParser.parse("1.1-100000000").isEmpty());
        assertTrue(PhasesRefParser.parse("1.5-3").isEmpty(), "Reversed range must not read as the whole group");
    }
}

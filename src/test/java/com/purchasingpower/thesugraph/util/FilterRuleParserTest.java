package com.purchasingpower.thesugraph.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Custom Filter Rule Parser Tests")
class FilterRuleParserTest {

    @Test
    @DisplayName("Should group thesis ids by target and strip leading hashes")
    void testParse_GroupsByTarget() {
        // Given
        List<String> rules = List.of("#T1 to #P1", "T2 to P1", "T1 to P1", "T3 to P2.Q1");

        // When
        Map<String, List<String>> result = FilterRuleParser.parse(rules);

        // Then
        assertEquals(List.of("T1", "T2"), result.get("P1"), "Duplicates are collapsed");
        assertEquals(List.of("T3"), result.get("P2.Q1"));
    }

    @Test
    @DisplayName("Should skip rules without exactly one separator")
    void testParse_InvalidRulesSkipped() {
        Map<String, List<String>> result = FilterRuleParser.parse(
                Arrays.asList("T1 P1", " to P1", "T1 to ", "T1 to P1 to P2", null, "T9 to P9"));

        assertEquals(Map.of("P9", List.of("T9")), result);
    }

    @Test
    @DisplayName("Should treat a missing rule list as empty")
    void testParse_NullList() {
        assertTrue(FilterRuleParser.parse(null).isEmpty());
    }
}

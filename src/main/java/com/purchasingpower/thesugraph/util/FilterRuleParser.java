package com.purchasingpower.thesugraph.util;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses custom exclusion rules of the form {@code "<thesisId> to <targetId>"} into
 * {@code targetId -> [thesisId, ...]}.
 */
@Slf4j
public final class FilterRuleParser {

    private static final String SEPARATOR = " to ";

    private FilterRuleParser() {
    }

    public static Map<String, List<String>> parse(List<String> rules) {
        Map<String, List<String>> result = new LinkedHashMap<>();
        if (rules == null) {
            return result;
        }
        for (String rule : rules) {
            String[] parts = rule == null ? new String[0] : rule.split(SEPARATOR, -1);
            if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
                log.warn("⚠️ Invalid custom filter rule skipped: '{}'", rule);
                continue;
            }
            String thesisId = stripHash(parts[0].trim());
            String targetId = stripHash(parts[1].trim());
            List<String> theses = result.computeIfAbsent(targetId, k -> new ArrayList<>());
            if (!theses.contains(thesisId)) {
                theses.add(thesisId);
            }
        }
        return result;
    }

    public static String stripHash(String id) {
        String value = id;
        while (value.startsWith("#")) {
            value = value.substring(1);
        }
        return value;
    }
}

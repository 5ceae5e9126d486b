package com.purchasingpower.thesugraph.util;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses phase range expressions such as {@code "1.1,1.4-5,2"}.
 *
 * <p>Result maps a phase group number to the phase numbers referenced in it. An empty list
 * means every phase of that group.
 * <ul>
 *   <li>{@code "/"} or blank: no reference at all</li>
 *   <li>{@code g.a-b} and {@code g.a-g.b}: phases a..b of group g</li>
 *   <li>{@code g1-g2}: every phase of groups g1..g2</li>
 *   <li>{@code g.p}: phase p of group g</li>
 *   <li>{@code g}: every phase of group g</li>
 * </ul>
 * Malformed parts are skipped, as are reversed ranges and ranges
 * with an end above {@link #MAX_RANGE_END}.
 */
@Slf4j
public final class PhasesRefParser {

    public static final int MAX_RANGE_END = 10_000;

    private PhasesRefParser() {
    }

    public static Map<Integer, List<Integer>> parse(String phasesRef) {
        Map<Integer, List<Integer>> result = new LinkedHashMap<>();
        if (phasesRef == null || phasesRef.isBlank() || phasesRef.trim().equals("/")) {
            return result;
        }
        for (String part : phasesRef.split(",")) {
            try {
                parsePart(part.trim(), result);
            } catch (NumberFormatException | ArrayIndexOutOfBoundsException e) {
                log.warn("⚠️ Skipping malformed phase reference '{}' in '{}'", part, phasesRef);
            }
        }
        return result;
    }

    private static void parsePart(String part, Map<Integer, List<Integer>> result) {
        if (part.contains("-")) {
            String[] range = part.split("-");
            if (range.length != 2) {
                throw new NumberFormatException("Invalid range: " + part);
            }
            if (range[0].contains(".")) {
                int[] start = groupAndPhase(range[0]);
                int end = range[1].contains(".") ? groupAndPhase(range[1])[1] : Integer.parseInt(range[1].trim());
                checkRange(start[1], end, part);
                List<Integer> phases = result.computeIfAbsent(start[0], k -> new ArrayList<>());
                for (int phase = start[1]; phase <= end; phase++) {
                    phases.add(phase);
                }
            } else {
                int startGroup = Integer.parseInt(range[0].trim());
                int endGroup = Integer.parseInt(range[1].trim());
                checkRange(startGroup, endGroup, part);
                for (int group = startGroup; group <= endGroup; group++) {
                    result.computeIfAbsent(group, k -> new ArrayList<>());
                }
            }
        } else if (part.contains(".")) {
            int[] gp = groupAndPhase(part);
            result.computeIfAbsent(gp[0], k -> new ArrayList<>()).add(gp[1]);
        } else {
            result.computeIfAbsent(Integer.parseInt(part), k -> new ArrayList<>());
        }
    }

    private static void checkRange(int start, int end, String part) {
        if (start > end || end > MAX_RANGE_END) {
            throw new NumberFormatException("Range out of bounds: " + part);
        }
    }

    private static int[] groupAndPhase(String value) {
        String[] pieces = value.trim().split("\\.");
        if (pieces.length != 2) {
            throw new NumberFormatException("Expected group.phase: " + value);
        }
        return new int[]{Integer.parseInt(pieces[0].trim()), Integer.parseInt(pieces[1].trim())};
    }
}

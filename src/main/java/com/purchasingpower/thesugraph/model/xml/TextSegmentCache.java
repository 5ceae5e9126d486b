package com.purchasingpower.thesugraph.model.xml;

import lombok.Value;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Resolved segment text keyed by (file, from id, to id).
 */
public class TextSegmentCache {

    private final Map<Key, SegmentText> segments = new HashMap<>();

    public SegmentText get(String file, String fromId, String toId, Supplier<SegmentText> resolver) {
        return segments.computeIfAbsent(new Key(file, fromId, toId), k -> resolver.get());
    }

    public int size() {
        return segments.size();
    }

    @Value
    static class Key {
        String file;
        String fromId;
        String toId;
    }
}

package com.purchasingpower.thesugraph.model.xml;

import org.w3c.dom.Document;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Parsed auxiliary documents keyed by normalized path. Failed parses are remembered as empty
 * so a broken file is only reported once per run.
 */
public class DocumentCache {

    private final Map<Path, Optional<Document>> documents = new HashMap<>();

    public Optional<Document> get(Path path, Function<Path, Optional<Document>> loader) {
        Path key = path.toAbsolutePath().normalize();
        Optional<Document> cached = documents.get(key);
        if (cached != null) {
            return cached;
        }
        Optional<Document> loaded = loader.apply(key);
        documents.put(key, loaded);
        return loaded;
    }

    public int size() {
        return documents.size();
    }
}

package com.purchasingpower.thesugraph.service;

import com.purchasingpower.thesugraph.model.xml.LoadedDocument;
import com.purchasingpower.thesugraph.model.xml.RunCaches;
import org.w3c.dom.Document;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads TheSu documents and the files they include.
 */
public interface ThesuDocumentLoader {

    /**
     * Parses the primary document, snapshots it and collects its propositions.
     *
     * @throws com.purchasingpower.thesugraph.exception.DocumentLoadException if the file cannot be parsed
     */
    LoadedDocument load(Path xmlFile, Path baseDir, RunCaches caches);

    /**
     * Parses an auxiliary document through the run cache; failures are logged and yield empty.
     */
    Optional<Document> loadAuxiliary(Path path, RunCaches caches);
}

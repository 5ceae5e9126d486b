package com.purchasingpower.thesugraph.model.xml;

import lombok.Builder;
import lombok.Getter;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.nio.file.Path;
import java.util.Map;

/**
 * The primary TheSu document of a run together with everything loaded alongside it.
 */
@Getter
@Builder
public class LoadedDocument {

    private final Path xmlFile;
    private final Path baseDir;

    /** Working tree; mutated by the document filters. */
    private final Document document;

    /** Deep copy taken before filtering, used to type placeholders for excluded elements. */
    private final Document originalDocument;

    /** PROPOSITION elements by id, from the main document and included proposition files. Mutable. */
    private final Map<String, Element> propositions;

    private final RunCaches caches;

    public Element root() {
        return document.getDocumentElement();
    }
}

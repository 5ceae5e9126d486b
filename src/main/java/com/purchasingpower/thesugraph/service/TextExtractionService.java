package com.purchasingpower.thesugraph.service;

import com.purchasingpower.thesugraph.model.xml.ElementText;
import com.purchasingpower.thesugraph.model.xml.LoadedDocument;
import org.w3c.dom.Element;

/**
 * Resolves the passage an argumentative element quotes, through its {@code thesu:segment} references.
 */
public interface TextExtractionService {

    /**
     * Text, snippet and locus for {@code element}; {@link ElementText#EMPTY} when nothing resolves.
     */
    ElementText extract(Element element, LoadedDocument document);
}

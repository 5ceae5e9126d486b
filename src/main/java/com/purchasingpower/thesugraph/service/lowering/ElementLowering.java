package com.purchasingpower.thesugraph.service.lowering;

import org.w3c.dom.Element;

/**
 * Turns one argumentative element into graph statements.
 */
public interface ElementLowering {

    boolean supports(Element element);

    /**
     * @param sourceId id of the enclosing source, or {@code null} for elements outside any source
     */
    void lower(Element element, String sourceId, LoweringContext context);
}

package com.purchasingpower.thesugraph.model.style;

import com.purchasingpower.thesugraph.util.XmlNodes;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * Boolean qualifiers on {@code matchingProposition} and {@code matchingPropositionPhases}.
 */
@Getter
@RequiredArgsConstructor
public enum MatchingQualifier {
    EXTENDED("extended", "extending", "extends", "exts"),
    PARTIAL("partial", "being part of", "is part of", "part"),
    GENERALIZED("generalized", "generalizing", "generalizes", "gens"),
    SPECIFIED("specified", "specifying", "specifies", "spec"),
    QUOTED("quoted", "being quoted", "is quoted in", "qted"),
    ALTERED("altered", "altering", "alters", "alts");

    private final String attribute;
    /** Wording on a proposition-level MATCHES mediator. */
    private final String participle;
    /** Wording on a phase-to-phase link. */
    private final String verb;
    private final String gephiLabel;

    public static List<MatchingQualifier> of(Element element) {
        List<MatchingQualifier> result = new ArrayList<>();
        for (MatchingQualifier qualifier : values()) {
            if ("true".equals(XmlNodes.thesuAttr(element, qualifier.attribute))) {
                result.add(qualifier);
            }
        }
        return result;
    }
}

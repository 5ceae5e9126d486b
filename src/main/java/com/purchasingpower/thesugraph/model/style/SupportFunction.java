package com.purchasingpower.thesugraph.model.style;

import com.purchasingpower.thesugraph.util.XmlNodes;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.w3c.dom.Element;

import java.util.Optional;

/**
 * Rhetorical function of a SUPPORT towards its targets, with its visual encoding.
 */
@Getter
@RequiredArgsConstructor
public enum SupportFunction {
    JUSTIFIES("JUSTIFIES", "jus", new Palette("#dae8fc", "#7c9ac7"), new Palette("#f5f8fd", "#949ebf"), "diamond"),
    REFUTES("REFUTES", "ref", new Palette("#f8cecc", "#b95753"), new Palette("#fdf6f6", "#a89794"), "diamond"),
    DISCUSSES("DISCUSSES", "dis", new Palette("#ffff99", "#b3b300"), new Palette("#ffffe6", "#999966"), "diamond"),
    EXPLAINS("EXPLAINS", "exp", new Palette("#edffc4", "#927b89"), new Palette("#f9facb", "#a59ba1"), "parallelogram"),
    EXPANDS_ON("EXPANDS ON", "exc", new Palette("#999999", "#4d4d4d"), new Palette("#cccccc", "#828282"), "invhouse"),
    CONTEXTUALIZES("CONTEXTUALIZES", "con", new Palette("#ecd4bb", "#b39c84"), new Palette("#f6ede6", "#b3a89a"), "cylinder");

    private final String label;
    private final String gephiLabel;
    private final Palette explicitPalette;
    private final Palette implicitPalette;
    private final String shape;

    public Palette palette(boolean unstated) {
        return unstated ? implicitPalette : explicitPalette;
    }

    public String gephiLabel(boolean unstated) {
        return unstated ? "(" + gephiLabel + ")" : gephiLabel;
    }

    /**
     * Function carried by a {@code supportFunctionsGroup} member; {@code argumentation} maps on
     * its {@code thesu:for} aim, a missing aim counting as acceptance.
     */
    public static Optional<SupportFunction> fromElement(Element function) {
        if (XmlNodes.is(function, "argumentation")) {
            String aim = XmlNodes.thesuAttr(function, "for");
            if (aim == null || "acc".equals(aim)) {
                return Optional.of(JUSTIFIES);
            }
            if ("rej".equals(aim)) {
                return Optional.of(REFUTES);
            }
            if ("mix".equals(aim)) {
                return Optional.of(DISCUSSES);
            }
            return Optional.empty();
        }
        if (XmlNodes.is(function, "exposition")) {
            return Optional.of(EXPLAINS);
        }
        if (XmlNodes.is(function, "expansion")) {
            return Optional.of(EXPANDS_ON);
        }
        if (XmlNodes.is(function, "contextualization")) {
            return Optional.of(CONTEXTUALIZES);
        }
        return Optional.empty();
    }
}

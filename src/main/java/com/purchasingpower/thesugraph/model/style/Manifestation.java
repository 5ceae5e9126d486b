package com.purchasingpower.thesugraph.model.style;

import com.purchasingpower.thesugraph.util.XmlNodes;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.w3c.dom.Element;

/**
 * Whether an entity is stated in the text, left implicit, or brought in from outside it.
 */
@Getter
@RequiredArgsConstructor
public enum Manifestation {
    EXPLICIT("explicit", ""),
    IMPLICIT("implicit", "impl. "),
    EXTRINSIC("extrinsic", "extr. ");

    private final String attributeValue;
    private final String labelPrefix;

    /**
     * {@code thesu:extrinsic} wins over {@code thesu:implicit}.
     */
    public static Manifestation of(Element element) {
        if ("true".equals(XmlNodes.thesuAttr(element, "extrinsic"))) {
            return EXTRINSIC;
        }
        if ("true".equals(XmlNodes.thesuAttr(element, "implicit"))) {
            return IMPLICIT;
        }
        return EXPLICIT;
    }

    public boolean isUnstated() {
        return this != EXPLICIT;
    }
}

package com.purchasingpower.thesugraph.service.lowering;

import com.purchasingpower.thesugraph.model.graph.GraphNode;
import com.purchasingpower.thesugraph.model.graph.NodeKind;
import com.purchasingpower.thesugraph.model.ids.IdSeed;
import com.purchasingpower.thesugraph.model.ids.MediatorId;
import com.purchasingpower.thesugraph.model.ids.RelationRole;
import com.purchasingpower.thesugraph.model.style.Palette;
import com.purchasingpower.thesugraph.model.style.SupportFunction;
import com.purchasingpower.thesugraph.service.ids.MediatorIdGenerator;
import com.purchasingpower.thesugraph.util.XmlNodes;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the placeholder nodes that stand for relation members a SUPPORT leaves out.
 *
 * <p>An empty container yields one unspecified ELEMENTS node. Typed children
 * ({@code omittedTHESES}, {@code omittedMISCS}, {@code omittedSUPPORTS}) yield {@code number}
 * nodes, or a single dotted node when no number is given.
 */
@Component
@RequiredArgsConstructor
public class OmittedMembers {

    private static final String UNSPECIFIED = "unspecified";

    private final MediatorIdGenerator idGenerator;

    /**
     * Emits the placeholder nodes for one omission container.
     *
     * @param idPrefix middle part of the generated ids, e.g. {@code omitted_TARGET_}
     * @return the emitted nodes, in order
     */
    public List<GraphNode> emit(Element container, String ownerId, String idPrefix, String sourceId, GraphEmitter emitter) {
        List<GraphNode> result = new ArrayList<>();
        List<Element> children = XmlNodes.childElements(container);
        if (children.isEmpty()) {
            MediatorId id = idGenerator.allocate(emitter, RelationRole.TARGET, ownerId, "omitted_ELEMENTS", IdSeed.label(UNSPECIFIED));
            result.add(emitter.node(GraphNode.of(id.getValue(), NodeKind.OMITTED)
                    .put("label", "<<b>ELEMENTS</b><br/><i>(unspecified,<br/>omitted,<br/>one or more)</i>>")
                    .put("gephi_label", "ELEM")
                    .put("gephi_omitted", "true")
                    .put("gephi_unspecified", "true")
                    .put("fontsize", "11")
                    .put("fillcolor", Palette.UNSPECIFIED.fill())
                    .put("color", Palette.UNSPECIFIED.border())
                    .put("style", "dotted,filled,rounded")
                    .put("shape", "box")
                    .put("source", sourceId)));
            return result;
        }

        for (Element child : children) {
            OmittedType type = OmittedType.of(child);
            if (type == null) {
                continue;
            }
            String related = idPrefix + type.displayType;
            String number = XmlNodes.thesuAttr(child, "number");
            if (number != null && !number.isEmpty() && number.chars().allMatch(Character::isDigit)) {
                int count = Integer.parseInt(number);
                for (int i = 0; i < count; i++) {
                    MediatorId id = idGenerator.allocate(emitter, RelationRole.TARGET, ownerId, related, IdSeed.numeric(i + 1));
                    result.add(emitter.node(placeholder(id, type, child, "<<b>" + type.displayType + "</b><br/><i>(omitted)</i>>",
                            false, sourceId)));
                }
            } else {
                MediatorId id = idGenerator.allocate(emitter, RelationRole.TARGET, ownerId, related, IdSeed.label(UNSPECIFIED));
                result.add(emitter.node(placeholder(id, type, child,
                        "<<b>" + type.displayType + "</b><br/><i>(omitted,<br/>one or more)</i>>", true, sourceId)));
            }
        }
        return result;
    }

    private static GraphNode placeholder(MediatorId id, OmittedType type, Element child, String label,
                                         boolean unspecified, String sourceId) {
        Palette palette = type.palette(child);
        return GraphNode.of(id.getValue(), NodeKind.OMITTED)
                .put("label", label)
                .put("gephi_label", type.displayType.substring(0, 4))
                .put("gephi_omitted", "true")
                .put("gephi_unspecified", unspecified ? "true" : null)
                .put("fontsize", "11")
                .put("fillcolor", palette.fill())
                .put("color", palette.border())
                .put("style", unspecified ? "dotted,filled" : type.style)
                .put("shape", type.shape)
                .put("source", sourceId);
    }

    /**
     * Function an omitted SUPPORT most likely has: the lowest of the declared omitted ranks,
     * each defaulting to 4.
     */
    static SupportFunction dominantOmittedFunction(Element omittedSupports) {
        Map<SupportFunction, Integer> ranks = new LinkedHashMap<>();
        ranks.put(SupportFunction.JUSTIFIES, 4);
        ranks.put(SupportFunction.EXPLAINS, 4);
        ranks.put(SupportFunction.EXPANDS_ON, 4);
        ranks.put(SupportFunction.CONTEXTUALIZES, 4);
        XmlNodes.firstDescendant(omittedSupports, "omittedSupportsFunctions").ifPresent(functions -> {
            rank(functions, "omittedArgumentationRank", SupportFunction.JUSTIFIES, ranks);
            rank(functions, "omittedExpositionRank", SupportFunction.EXPLAINS, ranks);
            rank(functions, "omittedExpansionRank", SupportFunction.EXPANDS_ON, ranks);
            rank(functions, "omittedContextualisationRank", SupportFunction.CONTEXTUALIZES, ranks);
        });
        SupportFunction dominant = SupportFunction.JUSTIFIES;
        for (Map.Entry<SupportFunction, Integer> entry : ranks.entrySet()) {
            if (entry.getValue() < ranks.get(dominant)) {
                dominant = entry.getKey();
            }
        }
        return dominant;
    }

    private static void rank(Element functions, String attribute, SupportFunction function, Map<SupportFunction, Integer> ranks) {
        String value = XmlNodes.thesuAttr(functions, attribute);
        if (value != null && !value.isEmpty() && value.chars().allMatch(Character::isDigit)) {
            ranks.put(function, Integer.parseInt(value));
        }
    }

    private enum OmittedType {
        THESES("omittedTHESES", "THESIS", "box", "rounded,filled"),
        MISCS("omittedMISCS", "MISC", "cylinder", "filled"),
        SUPPORTS("omittedSUPPORTS", "SUPPORT", "ellipse", "rounded,filled");

        private final String elementName;
        private final String displayType;
        private final String shape;
        private final String style;

        OmittedType(String elementName, String displayType, String shape, String style) {
            this.elementName = elementName;
            this.displayType = displayType;
            this.shape = shape;
            this.style = style;
        }

        static OmittedType of(Element element) {
            for (OmittedType type : values()) {
                if (XmlNodes.is(element, type.elementName)) {
                    return type;
                }
            }
            return null;
        }

        Palette palette(Element element) {
            return switch (this) {
                case THESES -> Palette.THESIS;
                case MISCS -> Palette.MISC;
                case SUPPORTS -> dominantOmittedFunction(element).getExplicitPalette();
            };
        }
    }
}

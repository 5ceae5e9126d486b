package com.purchasingpower.thesugraph.service.lowering;

import com.purchasingpower.thesugraph.model.graph.GraphEdge;
import com.purchasingpower.thesugraph.model.graph.GraphNode;
import com.purchasingpower.thesugraph.model.graph.NodeKind;
import com.purchasingpower.thesugraph.model.style.Manifestation;
import com.purchasingpower.thesugraph.model.style.Palette;
import com.purchasingpower.thesugraph.model.style.SupportFunction;
import com.purchasingpower.thesugraph.model.xml.ElementText;
import com.purchasingpower.thesugraph.service.TextExtractionService;
import com.purchasingpower.thesugraph.util.DotText;
import com.purchasingpower.thesugraph.util.XmlNodes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.w3c.dom.Element;

import java.util.List;
import java.util.Optional;

/**
 * Lowers a SUPPORT: a shared function mediator ({@code <id>_func}) pointing at every explicit and
 * omitted target, a shared {@code <id>_employed} mediator collecting employed elements, and the
 * SUPPORT node itself.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SupportLowering implements ElementLowering {

    static final String UNKNOWN_FUNCTION = "SUPPORTS";

    private final TextExtractionService textExtractionService;
    private final OmittedMembers omittedMembers;

    @Override
    public boolean supports(Element element) {
        return XmlNodes.is(element, "SUPPORT");
    }

    @Override
    public void lower(Element element, String sourceId, LoweringContext context) {
        String id = XmlNodes.elementId(element);
        Manifestation manifestation = Manifestation.of(element);
        boolean unstated = manifestation.isUnstated();
        String lineStyle = unstated ? "dashed,filled" : "filled";

        Optional<SupportFunction> function = primaryFunction(element);
        if (function.isEmpty()) {
            log.debug("SUPPORT {} has no recognised function, using default colours", id);
        }
        Palette supportPalette = function.map(f -> f.palette(unstated)).orElse(Palette.THESIS);
        Palette targetPalette = function.map(f -> f.palette(unstated)).orElse(Palette.TARGET_DEFAULT);
        FunctionMediator mediator = new FunctionMediator(id, function, unstated, supportPalette, lineStyle, context.getEmitter());

        for (Element targetsGroup : XmlNodes.ownDescendants(element, "targetsGroup")) {
            for (Element target : XmlNodes.children(targetsGroup, "target")) {
                String ref = XmlNodes.thesuAttr(target, "ref");
                if (ref != null) {
                    mediator.pointAt(DotText.afterHash(ref), targetPalette.border(), lineStyle);
                }
            }
            for (Element omitted : XmlNodes.children(targetsGroup, "omittedTargets")) {
                String prefix = "omitted_TARGET_";
                for (GraphNode placeholder : omittedMembers.emit(omitted, id, prefix, sourceId, context.getEmitter())) {
                    mediator.pointAt(placeholder.getId(), targetPalette.border(), lineStyle);
                }
            }
        }

        lowerEmployedElements(element, id, sourceId, context.getEmitter());
        context.getEmitter().node(supportNode(element, id, sourceId, manifestation, supportPalette, lineStyle, context));
    }

    private void lowerEmployedElements(Element element, String id, String sourceId, GraphEmitter emitter) {
        EmployedMediator employed = new EmployedMediator(id, emitter);
        for (Element group : XmlNodes.ownDescendants(element, "employedElements")) {
            for (Element elementRef : XmlNodes.children(group, "elementRef")) {
                String ref = XmlNodes.thesuAttr(elementRef, "ref");
                if (ref != null) {
                    employed.collect(DotText.afterHash(ref));
                }
            }
            for (Element omitted : XmlNodes.children(group, "omittedEmployedElements")) {
                for (GraphNode placeholder : omittedMembers.emit(omitted, id, "omitted_", sourceId, emitter)) {
                    employed.collect(placeholder.getId());
                }
            }
        }
    }

    private GraphNode supportNode(Element element, String id, String sourceId, Manifestation manifestation,
                                  Palette palette, String style, LoweringContext context) {
        ElementText text = textExtractionService.extract(element, context.getDocument());
        String speakers = EntityDescriptions.speakers(element);
        String form = form(element);
        String paraphrasisText = EntityDescriptions.paraphrasisText(element);
        String label = "<<b>" + manifestation.getLabelPrefix() + "SUPPORT</b><br/>"
                + EntityDescriptions.speakerLine(speakers) + "<br/>"
                + DotText.escapeHtml(text.getLocus()) + "<br/>"
                + "<i>form: " + DotText.escapeHtml(form == null ? "unspecified" : form) + "</i><br/>"
                + "<font point-size=\"12\">\"" + DotText.escapeHtml(text.getSnippet()) + "\"</font>>";
        return GraphNode.of(id, NodeKind.SUPPORT)
                .put("label", label)
                .put("gephi_label", "SUPP")
                .put("text", text.getText())
                .put("locus", text.getLocus())
                .put("speaker", speakers)
                .put("form", form == null ? "None" : form)
                .put("paraphrasis", paraphrasisText.isEmpty() ? "/" : paraphrasisText)
                .put("manifestation", manifestation.getAttributeValue())
                .put("fillcolor", palette.fill())
                .put("color", palette.border())
                .put("style", style)
                .put("shape", "ellipse")
                .put("margin", "0.05,0.02")
                .put("source", sourceId);
    }

    /**
     * Lowest-ranked member of {@code supportFunctionsGroup}; members without a numeric
     * {@code thesu:rank} rank last.
     */
    static Optional<SupportFunction> primaryFunction(Element element) {
        List<Element> groups = XmlNodes.ownDescendants(element, "supportFunctionsGroup");
        if (groups.isEmpty()) {
            return Optional.empty();
        }
        Element best = null;
        long bestRank = Long.MAX_VALUE;
        for (Element function : XmlNodes.childElements(groups.get(0))) {
            String rank = XmlNodes.thesuAttr(function, "rank");
            long value = rank != null && !rank.isEmpty() && rank.chars().allMatch(Character::isDigit)
                    ? Long.parseLong(rank) : Long.MAX_VALUE;
            if (best == null || value < bestRank) {
                best = function;
                bestRank = value;
            }
        }
        return best == null ? Optional.empty() : SupportFunction.fromElement(best);
    }

    private static String form(Element element) {
        for (Element type : XmlNodes.ownDescendants(element, "supportType")) {
            Optional<Element> form = XmlNodes.firstChild(type, "supportForm");
            if (form.isPresent()) {
                return DotText.afterHash(XmlNodes.thesuAttr(form.get(), "formTag"));
            }
        }
        return null;
    }

    /**
     * The {@code <id>_func} node, emitted together with its link from the SUPPORT on first use.
     */
    private static final class FunctionMediator {

        private final String supportId;
        private final Optional<SupportFunction> function;
        private final boolean unstated;
        private final Palette palette;
        private final String style;
        private final GraphEmitter emitter;
        private String nodeId;

        FunctionMediator(String supportId, Optional<SupportFunction> function, boolean unstated, Palette palette,
                         String style, GraphEmitter emitter) {
            this.supportId = supportId;
            this.function = function;
            this.unstated = unstated;
            this.palette = palette;
            this.style = style;
            this.emitter = emitter;
        }

        void pointAt(String target, String color, String edgeStyle) {
            if (nodeId == null) {
                nodeId = supportId + "_func";
                emitter.node(GraphNode.of(nodeId, NodeKind.MEDIATOR)
                        .put("label", function.map(SupportFunction::getLabel).orElse(UNKNOWN_FUNCTION))
                        .put("gephi_label", function.map(f -> f.gephiLabel(unstated)).orElse("tar"))
                        .put("gephi_omitted", "false")
                        .put("fontsize", "11")
                        .put("fillcolor", palette.fill())
                        .put("color", palette.border())
                        .put("style", style)
                        .put("shape", "ellipse"));
                emitter.edge(GraphEdge.of(supportId, nodeId)
                        .put("dir", "none")
                        .put("color", palette.border())
                        .put("style", style));
            }
            emitter.edge(GraphEdge.of(nodeId, target).put("color", color).put("style", edgeStyle));
        }
    }

    /**
     * The {@code <id>_employed} node, emitted with its link to the SUPPORT on first use.
     */
    private static final class EmployedMediator {

        private final String supportId;
        private final GraphEmitter emitter;
        private String nodeId;

        EmployedMediator(String supportId, GraphEmitter emitter) {
            this.supportId = supportId;
            this.emitter = emitter;
        }

        void collect(String employedId) {
            if (nodeId == null) {
                nodeId = supportId + "_employed";
                emitter.node(GraphNode.of(nodeId, NodeKind.MEDIATOR)
                        .put("label", "EMPLOYED IN")
                        .put("gephi_label", "in")
                        .put("fontsize", "11")
                        .put("fillcolor", Palette.EMPLOYED.fill())
                        .put("color", Palette.EMPLOYED.border())
                        .put("gephi_omitted", "false")
                        .put("shape", "ellipse")
                        .put("style", "filled"));
                emitter.edge(GraphEdge.of(nodeId, supportId)
                        .put("color", Palette.EMPLOYED.border())
                        .put("style", "solid"));
            }
            emitter.edge(GraphEdge.of(employedId, nodeId)
                    .put("dir", "none")
                    .put("color", Palette.EMPLOYED.border())
                    .put("style", "solid"));
        }
    }
}

package com.purchasingpower.thesugraph.service.lowering;

import com.purchasingpower.thesugraph.model.graph.GraphEdge;
import com.purchasingpower.thesugraph.model.graph.GraphNode;
import com.purchasingpower.thesugraph.model.graph.NodeKind;
import com.purchasingpower.thesugraph.model.graph.Subgraph;
import com.purchasingpower.thesugraph.model.graph.SubgraphKind;
import com.purchasingpower.thesugraph.model.ids.IdSeed;
import com.purchasingpower.thesugraph.model.ids.MediatorId;
import com.purchasingpower.thesugraph.model.ids.RelationRole;
import com.purchasingpower.thesugraph.model.style.Manifestation;
import com.purchasingpower.thesugraph.model.style.MatchingQualifier;
import com.purchasingpower.thesugraph.model.style.Palette;
import com.purchasingpower.thesugraph.model.xml.ElementText;
import com.purchasingpower.thesugraph.service.TextExtractionService;
import com.purchasingpower.thesugraph.service.ids.MediatorIdGenerator;
import com.purchasingpower.thesugraph.util.DotText;
import com.purchasingpower.thesugraph.util.XmlNodes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.w3c.dom.Element;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Lowers a THESIS: its node (inside an "Entailed" cluster when it is entailed), one mediator per
 * entailment, etiology, analogy, reference and matching proposition, then its sequence.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ThesisLowering implements ElementLowering {

    private final MediatorIdGenerator idGenerator;
    private final TextExtractionService textExtractionService;
    private final PropositionLowering propositionLowering;
    private final SequenceLowering sequenceLowering;

    @Override
    public boolean supports(Element element) {
        return XmlNodes.is(element, "THESIS");
    }

    @Override
    public void lower(Element element, String sourceId, LoweringContext context) {
        String id = XmlNodes.elementId(element);
        GraphEmitter emitter = context.getEmitter();
        ThesisStyle style = ThesisStyle.of(Manifestation.of(element));

        Map<String, String> entailments = entailments(element);
        GraphNode node = thesisNode(element, id, sourceId, style, context);
        if (entailments.isEmpty()) {
            emitter.node(node);
        } else {
            Subgraph cluster = new Subgraph("cluster_" + DotText.toClusterSafe(id) + "_ENTAILED", SubgraphKind.ENTAILMENT)
                    .put("label", "<<font color=\"" + style.palette().border() + "\">Entailed</font>>")
                    .put("style", "dotted");
            emitter.openSubgraph(cluster);
            emitter.node(node);
            emitter.closeSubgraph();
        }

        for (Map.Entry<String, String> entailment : entailments.entrySet()) {
            String label = entailment.getValue() == null
                    ? "ENTAILS"
                    : "by " + DotText.escapeHtml(entailment.getValue()) + ",<br/>ENTAILS";
            MediatorId mediator = idGenerator.allocate(emitter, RelationRole.ENTAILMENT, id, entailment.getKey(), IdSeed.numeric(1));
            twoHop(emitter, entailment.getKey(), id, mediatorNode(mediator, label, style.style(), style.palette(), "house"),
                    style.palette().border());
        }

        for (Map.Entry<String, String> etiology : etiologies(element, id, context).entrySet()) {
            MediatorId mediator = idGenerator.allocate(emitter, RelationRole.ETIOLOGY, id, etiology.getKey(), IdSeed.numeric(1));
            twoHop(emitter, etiology.getKey(), id,
                    mediatorNode(mediator, etiology.getValue() + "<br/>in etiology", style.style(), Palette.ETIOLOGY, "diamond"),
                    Palette.ETIOLOGY.border());
        }

        for (Map.Entry<String, Boolean> analogy : analogies(element).entrySet()) {
            String label = analogy.getValue() ? "<i>as source</i>,<br/>COMPARED IN" : "COMPARED IN";
            MediatorId mediator = idGenerator.allocate(emitter, RelationRole.ANALOGY, id, analogy.getKey(), IdSeed.numeric(1));
            twoHop(emitter, analogy.getKey(), id, mediatorNode(mediator, label, style.style(), Palette.ANALOGY, "diamond"),
                    Palette.ANALOGY.border());
        }

        for (String referenced : references(element)) {
            MediatorId mediator = idGenerator.allocate(emitter, RelationRole.REFERENCE, id, referenced, IdSeed.numeric(1));
            twoHop(emitter, referenced, id,
                    mediatorNode(mediator, "IS REFERENCED IN", "rounded,filled", Palette.REFERENCE, "note"),
                    Palette.REFERENCE.border());
        }

        lowerMatchingPropositions(element, id, context);
        sequenceLowering.lowerThesisSequence(element, id, style, context);
    }

    private GraphNode thesisNode(Element element, String id, String sourceId, ThesisStyle style, LoweringContext context) {
        ElementText text = textExtractionService.extract(element, context.getDocument());
        String speakers = EntityDescriptions.speakers(element);
        String paraphrasisText = EntityDescriptions.paraphrasisText(element);
        String label = "<<b>" + style.manifestation().getLabelPrefix() + "THESIS</b><br/>"
                + EntityDescriptions.speakerLine(speakers) + "<br/>"
                + DotText.escapeHtml(text.getLocus()) + "<br/>"
                + "<i>" + DotText.paraphrasis(paraphrasisText, EntityDescriptions.PARAPHRASIS_WIDTH) + "</i>"
                + "<font point-size=\"12\">\"" + DotText.escapeHtml(text.getSnippet()) + "\"</font>>";
        return GraphNode.of(id, NodeKind.THESIS)
                .put("label", label)
                .put("gephi_label", "THES")
                .put("locus", text.getLocus())
                .put("speaker", speakers)
                .put("text", text.getText())
                .put("paraphrasis", paraphrasisText.isEmpty() ? "/" : paraphrasisText)
                .put("manifestation", style.manifestation().getAttributeValue())
                .put("source", sourceId)
                .put("fillcolor", style.palette().fill())
                .put("color", style.palette().border())
                .put("style", style.style())
                .put("shape", "box")
                .put("margin", "0.30,0.1");
    }

    private void lowerMatchingPropositions(Element element, String id, LoweringContext context) {
        Map<String, List<MatchingQualifier>> matches = new LinkedHashMap<>();
        for (Element group : XmlNodes.children(element, "matchingPropositionsGroup")) {
            for (Element match : XmlNodes.descendants(group, "matchingProposition")) {
                String propRef = XmlNodes.thesuAttr(match, "propRef");
                if (propRef != null) {
                    matches.put(DotText.afterHash(propRef), MatchingQualifier.of(match));
                }
            }
        }
        GraphEmitter emitter = context.getEmitter();
        for (Map.Entry<String, List<MatchingQualifier>> match : matches.entrySet()) {
            String propositionId = match.getKey();
            if (!context.getProcessedPropositions().contains(propositionId)) {
                Element proposition = context.getDocument().getPropositions().get(propositionId);
                if (proposition != null) {
                    propositionLowering.lowerProposition(propositionId, proposition, context);
                } else {
                    log.debug("Proposition {} matched by {} is not loaded", propositionId, id);
                }
            }
            String types = match.getValue().stream()
                    .map(MatchingQualifier::getParticiple)
                    .collect(Collectors.joining(",<br/>"));
            String label = types.isEmpty() ? "<MATCHES>" : "<MATCHES<br/><i>" + types + "</i>>";
            MediatorId mediator = idGenerator.allocate(emitter, RelationRole.MATCHING_PROPOSITION, id, propositionId, IdSeed.numeric(1));
            emitter.node(GraphNode.of(mediator.getValue(), NodeKind.MEDIATOR)
                    .put("label", label)
                    .put("gephi_label", "matc")
                    .put("fontsize", "11")
                    .put("shape", "doubleoctagon")
                    .put("style", "rounded,filled")
                    .put("fillcolor", Palette.PROPOSITION.fill())
                    .put("color", Palette.PROPOSITION.border()));
            context.defer(GraphEdge.of(propositionId, mediator.getValue())
                    .put("dir", "none")
                    .put("color", Palette.PROPOSITION.border()));
            context.defer(GraphEdge.of(mediator.getValue(), id)
                    .put("color", Palette.PROPOSITION.border()));
        }
    }

    private static GraphNode mediatorNode(MediatorId id, String label, String style, Palette palette, String shape) {
        return GraphNode.of(id.getValue(), NodeKind.MEDIATOR)
                .put("label", "<" + label + ">")
                .put("fontsize", "11")
                .put("style", style)
                .put("fillcolor", palette.fill())
                .put("color", palette.border())
                .put("shape", shape);
    }

    /**
     * {@code anchor -> mediator -> owner}, the first hop undirected.
     */
    private static void twoHop(GraphEmitter emitter, String anchor, String owner, GraphNode mediator, String color) {
        emitter.node(mediator);
        emitter.edge(GraphEdge.of(anchor, mediator.getId()).put("dir", "none").put("color", color));
        emitter.edge(GraphEdge.of(mediator.getId(), owner).put("color", color));
    }

    /**
     * Entailing thesis id to the role it entails as; {@code null} when no role is given.
     */
    static Map<String, String> entailments(Element element) {
        Map<String, String> result = new LinkedHashMap<>();
        for (Element entailment : XmlNodes.children(element, "entailment")) {
            for (Element entailedBy : XmlNodes.descendants(entailment, "entailedBy")) {
                String ref = XmlNodes.thesuAttr(entailedBy, "ref");
                if (ref != null) {
                    result.put(DotText.afterHash(ref), DotText.afterHash(XmlNodes.thesuAttr(entailedBy, "entailedAs")));
                }
            }
        }
        return result;
    }

    /**
     * Referenced element id to etiology label. References to the thesis itself or to elements
     * nested inside it are skipped.
     */
    static Map<String, String> etiologies(Element element, String id, LoweringContext context) {
        Map<String, String> result = new LinkedHashMap<>();
        Element root = context.getDocument().root();
        for (Element etiology : XmlNodes.path(element, "thesisType", "etiologiesGroup", "etiology")) {
            List<Element> members = XmlNodes.children(etiology, "etiologyMember");
            boolean causeSiblings = members.stream().anyMatch(m -> "true".equals(XmlNodes.thesuAttr(m, "cause")));
            boolean endSiblings = members.stream().anyMatch(m -> "true".equals(XmlNodes.thesuAttr(m, "end")));
            for (Element member : members) {
                for (Element elementRef : XmlNodes.children(member, "elementRef")) {
                    String referenced = DotText.afterHash(XmlNodes.thesuAttr(elementRef, "ref"));
                    if (referenced == null || referenced.equals(id)) {
                        continue;
                    }
                    List<Element> targets = XmlNodes.findByXmlId(root, referenced);
                    if (targets.isEmpty() || XmlNodes.isDescendantOf(targets.get(0), element)) {
                        continue;
                    }
                    result.put(referenced, etiologyLabel(
                            "true".equals(XmlNodes.thesuAttr(member, "cause")),
                            "true".equals(XmlNodes.thesuAttr(member, "end")),
                            causeSiblings, endSiblings));
                }
            }
        }
        return result;
    }

    static String etiologyLabel(boolean cause, boolean end, boolean causeSiblings, boolean endSiblings) {
        if (cause) {
            return "ITS EFFECT";
        }
        if (end) {
            return "ITS MEANS";
        }
        if (causeSiblings && endSiblings) {
            return "ITS CAUSE &amp; PURPOSE";
        }
        if (causeSiblings) {
            return "ITS CAUSE";
        }
        if (endSiblings) {
            return "ITS PURPOSE";
        }
        return "CORRELATED";
    }

    /**
     * Referenced element id to whether it is the comparans (source) of the analogy.
     */
    static Map<String, Boolean> analogies(Element element) {
        Map<String, Boolean> result = new LinkedHashMap<>();
        for (Element analogy : XmlNodes.path(element, "thesisType", "analogiesGroup", "analogy")) {
            for (Element member : XmlNodes.children(analogy, "analogyMember")) {
                boolean comparans = "true".equals(XmlNodes.thesuAttr(member, "comparans"));
                for (Element elementRef : XmlNodes.children(member, "elementRef")) {
                    String ref = XmlNodes.thesuAttr(elementRef, "ref");
                    if (ref != null) {
                        result.put(DotText.afterHash(ref), comparans);
                    }
                }
            }
        }
        return result;
    }

    /**
     * Ids referenced through {@code includedRef} or the macro themes.
     */
    static List<String> references(Element element) {
        Map<String, String> result = new LinkedHashMap<>();
        for (Element includedRef : XmlNodes.ownDescendants(element, "includedRef")) {
            for (Element elementRef : XmlNodes.descendants(includedRef, "elementRef")) {
                String ref = XmlNodes.thesuAttr(elementRef, "ref");
                if (ref != null && !ref.isEmpty()) {
                    result.put(DotText.afterHash(ref), "includedRef");
                }
            }
        }
        for (Element group : XmlNodes.path(element, "thesisType", "macroThemesGroup")) {
            for (Element elementRef : XmlNodes.descendants(group, "elementRef")) {
                String ref = XmlNodes.thesuAttr(elementRef, "ref");
                if (ref != null && !ref.isEmpty()) {
                    result.put(DotText.afterHash(ref), "macroThemes");
                }
            }
        }
        return List.copyOf(result.keySet());
    }
}

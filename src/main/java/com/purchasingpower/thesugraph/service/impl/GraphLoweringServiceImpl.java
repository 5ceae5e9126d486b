package com.purchasingpower.thesugraph.service.impl;

import com.google.common.base.Preconditions;
import com.purchasingpower.thesugraph.model.filter.FilterSettings;
import com.purchasingpower.thesugraph.model.graph.GraphDocument;
import com.purchasingpower.thesugraph.model.graph.GraphEdge;
import com.purchasingpower.thesugraph.model.graph.Subgraph;
import com.purchasingpower.thesugraph.model.graph.SubgraphKind;
import com.purchasingpower.thesugraph.model.xml.LoadedDocument;
import com.purchasingpower.thesugraph.service.GraphLoweringService;
import com.purchasingpower.thesugraph.service.lowering.ElementLowering;
import com.purchasingpower.thesugraph.service.lowering.GraphEmitter;
import com.purchasingpower.thesugraph.service.lowering.LoweringContext;
import com.purchasingpower.thesugraph.service.lowering.PropositionLowering;
import com.purchasingpower.thesugraph.util.DotText;
import com.purchasingpower.thesugraph.util.XmlNodes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class GraphLoweringServiceImpl implements GraphLoweringService {

    private final List<ElementLowering> lowerings;
    private final PropositionLowering propositionLowering;

    @Override
    public GraphDocument lower(LoadedDocument document, FilterSettings settings) {
        Preconditions.checkNotNull(document, "Document cannot be null");
        Preconditions.checkNotNull(settings, "Filter settings cannot be null");

        GraphEmitter emitter = new GraphEmitter(GraphDocument.withDefaultHeader());
        LoweringContext context = new LoweringContext(document, settings, emitter);
        Element root = document.root();

        Set<String> seenSources = new LinkedHashSet<>();
        for (Element source : XmlNodes.descendants(root, "source")) {
            String sourceId = XmlNodes.elementId(source);
            if (sourceId == null || !seenSources.add(sourceId)) {
                log.warn("⚠️ Skipping duplicate or anonymous source {}", sourceId);
                continue;
            }
            emitter.openSubgraph(new Subgraph("source_" + DotText.toClusterSafe(sourceId), SubgraphKind.SOURCE)
                    .put("label", sourceId));
            for (Element element : argumentativeDescendants(source)) {
                lowerOnce(element, nearestSourceId(element).orElse(sourceId), context);
            }
            emitter.closeSubgraph();
        }

        List<Element> topLevel = topLevelElements(root);
        for (Element element : topLevel) {
            lowerOnce(element, nearestSourceId(element).orElse(null), context);
        }

        for (Element element : topLevel) {
            for (Element group : XmlNodes.children(element, "matchingPropositionsGroup")) {
                for (Element match : XmlNodes.descendants(group, "matchingProposition")) {
                    String propositionId = DotText.afterHash(XmlNodes.thesuAttr(match, "propRef"));
                    Element proposition = propositionId == null ? null : document.getPropositions().get(propositionId);
                    if (proposition != null) {
                        propositionLowering.lowerProposition(propositionId, proposition, context);
                    }
                }
            }
        }

        for (GraphEdge edge : context.getDeferredEdges()) {
            emitter.appendToRoot(edge);
        }

        GraphDocument graph = emitter.getDocument();
        log.info("✅ Lowered {} element(s) and {} proposition(s) into {} node(s), {} edge(s)",
                context.getProcessedElements().size(), context.getProcessedPropositions().size(),
                graph.nodes().size(), graph.edges().size());
        return graph;
    }

    private void lowerOnce(Element element, String sourceId, LoweringContext context) {
        String id = XmlNodes.elementId(element);
        if (id == null) {
            log.warn("⚠️ Skipping {} without id", element.getLocalName());
            return;
        }
        if (!context.getProcessedElements().add(id)) {
            return;
        }
        for (ElementLowering lowering : lowerings) {
            if (lowering.supports(element)) {
                log.debug("Lowering {} {}", element.getLocalName(), id);
                context.getEmitter().beginOwner(id);
                try {
                    lowering.lower(element, sourceId, context);
                } finally {
                    context.getEmitter().endOwner();
                }
                return;
            }
        }
    }

    private static boolean isArgumentative(Element element) {
        return XmlNodes.is(element, "THESIS") || XmlNodes.is(element, "SUPPORT") || XmlNodes.is(element, "MISC");
    }

    private static List<Element> argumentativeDescendants(Element source) {
        List<Element> result = new ArrayList<>();
        NodeList all = source.getElementsByTagName("*");
        for (int i = 0; i < all.getLength(); i++) {
            Element element = (Element) all.item(i);
            if (isArgumentative(element)) {
                result.add(element);
            }
        }
        return result;
    }

    /**
     * THESIS, SUPPORT and MISC children of every {@code AEsystem}.
     */
    private static List<Element> topLevelElements(Element root) {
        List<Element> result = new ArrayList<>();
        List<Element> systems = new ArrayList<>(XmlNodes.descendants(root, "AEsystem"));
        if (XmlNodes.is(root, "AEsystem")) {
            systems.add(0, root);
        }
        for (Element system : systems) {
            for (Element child : XmlNodes.childElements(system)) {
                if (isArgumentative(child)) {
                    result.add(child);
                }
            }
        }
        return result;
    }

    private static Optional<String> nearestSourceId(Element element) {
        return XmlNodes.nearestAncestor(element, "source").map(XmlNodes::elementId);
    }
}

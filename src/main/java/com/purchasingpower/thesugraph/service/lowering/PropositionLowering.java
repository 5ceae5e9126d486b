package com.purchasingpower.thesugraph.service.lowering;

import com.purchasingpower.thesugraph.model.graph.GraphEdge;
import com.purchasingpower.thesugraph.model.graph.GraphNode;
import com.purchasingpower.thesugraph.model.graph.NodeKind;
import com.purchasingpower.thesugraph.model.graph.Subgraph;
import com.purchasingpower.thesugraph.model.graph.SubgraphKind;
import com.purchasingpower.thesugraph.model.style.Palette;
import com.purchasingpower.thesugraph.util.DotText;
import com.purchasingpower.thesugraph.util.XmlNodes;
import org.springframework.stereotype.Component;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * Lowers a PROPOSITION node and the phase clusters of its sequences.
 */
@Component
public class PropositionLowering {

    static final int SEQUENCE_NUMBER_BASE = 100_000;

    public void lowerProposition(String propositionId, Element proposition, LoweringContext context) {
        if (!context.getProcessedPropositions().add(propositionId)) {
            return;
        }
        GraphEmitter emitter = context.getEmitter();
        emitter.beginOwner(propositionId);
        try {
            emitProposition(propositionId, proposition, context);
        } finally {
            emitter.endOwner();
        }
    }

    private void emitProposition(String propositionId, Element proposition, LoweringContext context) {
        GraphEmitter emitter = context.getEmitter();
        String paraphrasis = DotText.paraphrasis(EntityDescriptions.paraphrasisText(proposition),
                EntityDescriptions.PARAPHRASIS_WIDTH);
        emitter.node(GraphNode.of(propositionId, NodeKind.PROPOSITION)
                .put("label", "<<b>PROPOSITION</b><br/><i>" + paraphrasis + "</i>>")
                .put("gephi_label", "PROP")
                .put("shape", "doubleoctagon")
                .put("style", "rounded,filled")
                .put("fillcolor", Palette.PROPOSITION.fill())
                .put("color", Palette.PROPOSITION.border()));

        int unnamed = 0;
        for (Element sequence : sequences(proposition)) {
            String sequenceId = XmlNodes.elementId(sequence);
            if (sequenceId == null) {
                sequenceId = propositionId + "_Q" + (SEQUENCE_NUMBER_BASE + unnamed++);
            }
            lowerSequence(propositionId, sequenceId, sequence, context);
        }
    }

    private void lowerSequence(String propositionId, String sequenceId, Element sequence, LoweringContext context) {
        String clusterId = (propositionId + "_" + sequenceId).replace('.', '_');
        List<PhaseRecord> phases = new ArrayList<>();
        int number = 0;
        List<Element> groups = XmlNodes.descendants(sequence, "phasesGroup");
        for (int g = 0; g < groups.size(); g++) {
            int inGroup = 0;
            List<Element> newPhases = XmlNodes.descendants(groups.get(g), "newPhases");
            if (newPhases.isEmpty()) {
                continue;
            }
            for (Element phase : XmlNodes.descendants(newPhases.get(0), "phase")) {
                number++;
                inGroup++;
                phases.add(PhaseRecord.builder()
                        .phaseId(sequenceId.replace("Q", "q") + String.format("%03d", number))
                        .sequenceId(sequenceId)
                        .clusterId(clusterId)
                        .phaseNumber(number)
                        .groupNumber(g + 1)
                        .numberInGroup(inGroup)
                        .paraphrasis(DotText.paraphrasis(EntityDescriptions.phaseText(phase),
                                EntityDescriptions.PHASE_PARAPHRASIS_WIDTH))
                        .element(phase)
                        .build());
            }
        }
        if (phases.isEmpty()) {
            return;
        }

        GraphEmitter emitter = context.getEmitter();
        emitter.openSubgraph(new Subgraph("cluster_" + clusterId, SubgraphKind.SEQUENCE)
                .put("label", "<<font color='" + Palette.PROPOSITION.border() + "'>Sequence</font>>")
                .put("peripheries", "1"));
        for (PhaseRecord phase : phases) {
            context.getPropositionPhases().put(phase.getPhaseId(), phase);
            emitter.node(GraphNode.of(phase.getPhaseId(), NodeKind.PHASE)
                    .put("label", "<<b>" + phase.getPhaseNumber() + "</b><br/><i>" + phase.getParaphrasis() + "</i>>")
                    .put("gephi_label", "ph.")
                    .put("phase_number", String.valueOf(phase.getPhaseNumber()))
                    .put("paraphrasis", EntityDescriptions.phaseText(phase.getElement()))
                    .put("shape", "box")
                    .put("style", "rounded,filled")
                    .put("color", Palette.PROPOSITION.border())
                    .put("fillcolor", Palette.PROPOSITION.fill()));
        }
        for (int i = 0; i + 1 < phases.size(); i++) {
            emitter.edge(GraphEdge.of(phases.get(i).getPhaseId(), phases.get(i + 1).getPhaseId())
                    .put("dir", "none")
                    .put("color", Palette.PROPOSITION.border()));
        }
        emitter.closeSubgraph();
        emitter.edge(GraphEdge.of(propositionId, phases.get(0).getPhaseId())
                .put("dir", "none")
                .put("lhead", "cluster_" + clusterId)
                .put("color", Palette.PROPOSITION.border()));
    }

    private static List<Element> sequences(Element proposition) {
        List<Element> result = new ArrayList<>();
        for (Element type : XmlNodes.ownDescendants(proposition, "propositionType")) {
            for (Element group : XmlNodes.children(type, "sequencesGroup")) {
                result.addAll(XmlNodes.descendants(group, "sequence"));
            }
        }
        return result;
    }
}

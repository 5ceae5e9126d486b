package com.purchasingpower.thesugraph.service.impl;

import com.purchasingpower.thesugraph.TestDocuments;
import com.purchasingpower.thesugraph.model.filter.FilterSettings;
import com.purchasingpower.thesugraph.model.graph.GraphDocument;
import com.purchasingpower.thesugraph.model.graph.GraphEdge;
import com.purchasingpower.thesugraph.model.graph.GraphNode;
import com.purchasingpower.thesugraph.model.graph.NodeKind;
import com.purchasingpower.thesugraph.model.graph.Subgraph;
import com.purchasingpower.thesugraph.model.graph.SubgraphKind;
import com.purchasingpower.thesugraph.model.xml.LoadedDocument;
import com.purchasingpower.thesugraph.model.xml.RunCaches;
import com.purchasingpower.thesugraph.service.TextExtractionService;
import com.purchasingpower.thesugraph.service.ids.MediatorIdGenerator;
import com.purchasingpower.thesugraph.service.lowering.MiscLowering;
import com.purchasingpower.thesugraph.service.lowering.OmittedMembers;
import com.purchasingpower.thesugraph.service.lowering.PropositionLowering;
import com.purchasingpower.thesugraph.service.lowering.SequenceLowering;
import com.purchasingpower.thesugraph.service.lowering.SupportLowering;
import com.purchasingpower.thesugraph.service.lowering.ThesisLowering;
import com.purchasingpower.thesugraph.util.DotWriter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Graph Lowering Service Tests")
class GraphLoweringServiceImplTest {

    private static final FilterSettings WITH_MATCHING = FilterSettings.builder()
            .filterMatchingPropositionSequences(false)
            .build();

    private ThesuDocumentLoaderImpl loader;
    private GraphLoweringServiceImpl loweringService;

    @BeforeEach
    void setUp() {
        loader = new ThesuDocumentLoaderImpl();
        MediatorIdGenerator idGenerator = new MediatorIdGenerator();
        TextExtractionService textExtraction = new TextExtractionServiceImpl(loader);
        PropositionLowering propositionLowering = new PropositionLowering();
        loweringService = new GraphLoweringServiceImpl(List.of(
                new ThesisLowering(idGenerator, textExtraction, propositionLowering, new SequenceLowering(idGenerator)),
                new SupportLowering(textExtraction, new OmittedMembers(idGenerator)),
                new MiscLowering(textExtraction)),
                propositionLowering);
    }

    private GraphDocument lower(String fixture, FilterSettings settings) {
        LoadedDocument document = loader.load(TestDocuments.fixture(fixture), null, new RunCaches());
        return loweringService.lower(document, settings);
    }

    private static boolean hasEdge(GraphDocument graph, String source, String target) {
        return graph.edges().stream().anyMatch(e -> e.getSource().equals(source) && e.getTarget().equals(target));
    }

    @Test
    @DisplayName("Should lower theses, supports and omitted targets with stable mediator ids")
    void testLower_ArgumentationScenario() {
        // When
        GraphDocument graph = lower("argumentation.xml", FilterSettings.defaults());

        // Then: every element becomes a node inside its source
        Subgraph source = graph.subgraphs().stream()
                .filter(s -> s.getKind() == SubgraphKind.SOURCE)
                .findFirst()
                .orElseThrow(() -> new AssertionError("Source subgraph missing"));
        assertEquals("source_src_A", source.getName());
        for (String id : List.of("src.A.T1", "src.A.T2", "src.A.S1", "src.A.S2", "src.A.M1")) {
            assertTrue(graph.findNode(id).isPresent(), "Missing node " + id);
        }

        // Entailment: T2 -> mediator -> T1, T1 wrapped in an Entailed cluster
        GraphNode entailment = graph.findNode("src.A.T2_to_src.A.T1_1").orElseThrow();
        assertEquals("<by premise,<br/>ENTAILS>", entailment.get("label"));
        assertTrue(hasEdge(graph, "src.A.T2", "src.A.T2_to_src.A.T1_1"));
        assertTrue(hasEdge(graph, "src.A.T2_to_src.A.T1_1", "src.A.T1"));
        Subgraph entailed = graph.subgraphs().stream()
                .filter(s -> s.getName().equals("cluster_src_A_T1_ENTAILED"))
                .findFirst()
                .orElseThrow();
        assertTrue(entailed.getStatements().stream()
                .anyMatch(s -> s instanceof GraphNode node && node.getId().equals("src.A.T1")));

        // Support function mediator
        GraphNode function = graph.findNode("src.A.S1_func").orElseThrow();
        assertEquals("JUSTIFIES", function.get("label"));
        assertEquals("src.A.S1", function.getOwner());
        assertTrue(hasEdge(graph, "src.A.S1", "src.A.S1_func"));
        assertTrue(hasEdge(graph, "src.A.S1_func", "src.A.T2"));

        // Omitted targets: one placeholder per declared member
        for (int i = 1; i <= 3; i++) {
            String id = "src.A.S2_to_omitted_TARGET_SUPPORT_" + i;
            assertEquals(NodeKind.OMITTED, graph.findNode(id).orElseThrow().getKind());
            assertTrue(hasEdge(graph, "src.A.S2_func", id));
        }
        assertEquals("(exp)", graph.findNode("src.A.S2_func").orElseThrow().get("gephi_label"),
                "Implicit supports get the bracketed code");
    }

    @Test
    @DisplayName("Should define every node id once")
    void testLower_UniqueDefinitions() {
        for (String fixture : List.of("argumentation.xml", "matching.xml")) {
            GraphDocument graph = lower(fixture, WITH_MATCHING);

            List<String> ids = graph.nodes().stream().map(GraphNode::getId).collect(Collectors.toList());
            assertEquals(ids.size(), graph.nodeIds().size(), "Duplicate definitions in " + fixture);
        }
    }

    @Test
    @DisplayName("Should produce identical output for identical input")
    void testLower_Deterministic() {
        String first = DotWriter.write(lower("matching.xml", WITH_MATCHING));
        String second = DotWriter.write(lower("matching.xml", WITH_MATCHING));

        assertEquals(first, second);
    }

    @Test
    @DisplayName("Should link thesis phases to the proposition phases they match")
    void testLower_MatchingScenario() {
        // When
        GraphDocument graph = lower("matching.xml", WITH_MATCHING);

        // Then: propositions and their phase chains
        assertEquals(NodeKind.PROPOSITION, graph.findNode("P1").orElseThrow().getKind());
        assertEquals(NodeKind.PHASE, graph.findNode("P1.q200001001").orElseThrow().getKind());
        assertTrue(hasEdge(graph, "P1.q200001001", "P1.q200001002"));
        assertTrue(hasEdge(graph, "P1", "P1.q200001001"));

        // Thesis phases keep their document id for later reconciliation
        GraphNode thesisPhase = graph.findNode("src.B.q100001001").orElseThrow();
        assertEquals("src.B.H100001", thesisPhase.get("original_xml_id"));
        assertTrue(hasEdge(graph, "src.B.T1", "src.B.q100001001"));

        // Phase-to-phase links, aligned by record position
        assertTrue(hasEdge(graph, "P1.q200001001", "src.B.q100001001"));
        assertTrue(hasEdge(graph, "P2.q300001002", "src.B.q100001001"));
        assertTrue(hasEdge(graph, "P1.q200001002", "src.B.q100001002"));
        assertTrue(hasEdge(graph, "P2.q300001001", "src.B.q100001002"));
        assertTrue(hasEdge(graph, "P2.q300001002", "src.B.q100001002"));
        GraphEdge link = graph.edges().stream()
                .filter(e -> e.getSource().equals("P1.q200001001") && e.getTarget().equals("src.B.q100001001"))
                .findFirst()
                .orElseThrow();
        assertEquals("dotted", link.get("style"));
        assertEquals("<matches>", link.get("xlabel"));

        // One invisible bridge per matched sequence
        GraphNode bridge = graph.findNode("src_B_T1_src_B_Q100001_to_P1_P1_Q200001_1").orElseThrow();
        assertEquals("invis", bridge.get("style"));

        // MATCHES mediator with qualifiers; its proposition edges are appended at the root
        GraphNode matches = graph.findNode("P1_to_src.B.T1_1").orElseThrow();
        assertEquals("<MATCHES<br/><i>extending</i>>", matches.get("label"));
        assertTrue(graph.getStatements().stream()
                .anyMatch(s -> s instanceof GraphEdge e && e.getSource().equals("P1") && e.getTarget().equals("P1_to_src.B.T1_1")));
    }

    @Test
    @DisplayName("Should link only the phases of the exact matched sequence, not of one sharing its prefix")
    void testLower_MatchedSequenceIdIsExact() {
        // When
        GraphDocument graph = lower("sequence-prefix.xml", WITH_MATCHING);

        // Then
        assertTrue(graph.findNode("P1.q10001").isPresent(), "Both proposition sequences are drawn");
        assertTrue(hasEdge(graph, "P1.q1001", "src.C.q100001001"));
        assertFalse(hasEdge(graph, "P1.q10001", "src.C.q100001001"));
    }
}

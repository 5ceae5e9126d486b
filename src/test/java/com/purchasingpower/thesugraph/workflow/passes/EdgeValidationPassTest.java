package com.purchasingpower.thesugraph.workflow.passes;

import com.purchasingpower.thesugraph.TestDocuments;
import com.purchasingpower.thesugraph.model.graph.GraphDocument;
import com.purchasingpower.thesugraph.model.graph.GraphEdge;
import com.purchasingpower.thesugraph.model.graph.GraphNode;
import com.purchasingpower.thesugraph.model.graph.NodeKind;
import com.purchasingpower.thesugraph.model.style.Palette;
import com.purchasingpower.thesugraph.workflow.pipeline.RewriteContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Edge Validation Pass Tests")
class EdgeValidationPassTest {

    private static final Document ORIGINAL = TestDocuments.parse(
            "<thesu:AEsystem " + TestDocuments.NS + ">"
                    + "<thesu:source xml:id=\"src.A\">"
                    + "<thesu:THESIS xml:id=\"src.A.T1\">"
                    + "<thesu:thesisType><thesu:sequencesGroup><thesu:sequence>"
                    + "<thesu:phasesGroup><thesu:newPhases><thesu:phase xml:id=\"src.A.H100009\"/></thesu:newPhases></thesu:phasesGroup>"
                    + "</thesu:sequence></thesu:sequencesGroup></thesu:thesisType>"
                    + "</thesu:THESIS>"
                    + "<thesu:THESIS xml:id=\"src.A.T2\"/>"
                    + "<thesu:SUPPORT xml:id=\"src.A.S1\"/>"
                    + "<thesu:SUPPORT xml:id=\"src.A.S2\"/>"
                    + "</thesu:source></thesu:AEsystem>");

    private GraphDocument graph;
    private EdgeValidationPass pass;

    @BeforeEach
    void setUp() {
        graph = GraphDocument.withDefaultHeader();
        graph.add(GraphNode.of("src.A.T1", NodeKind.THESIS));
        graph.add(GraphNode.of("src.A.S1", NodeKind.SUPPORT));
        graph.add(GraphNode.of("src.A.S1_func", NodeKind.MEDIATOR));
        pass = new EdgeValidationPass();
    }

    @Test
    @DisplayName("Should substitute a typed placeholder for an excluded endpoint")
    void testApply_ExcludedEndpointGetsPlaceholder() {
        // Given
        GraphEdge toThesis = GraphEdge.of("src.A.S1_func", "src.A.T2").put("color", "#123456");
        GraphEdge fromSupport = GraphEdge.of("src.A.S2", "src.A.T1");
        graph.add(toThesis);
        graph.add(fromSupport);
        RewriteContext context = new RewriteContext(graph, ORIGINAL, Set.of("src.A.T2", "src.A.S2"));

        // When
        pass.apply(context);

        // Then
        assertEquals("src.A.T2_filtered", toThesis.getTarget());
        assertEquals("#123456", toThesis.get("color"));
        assertEquals("src.A.S2_filtered", fromSupport.getSource());

        GraphNode thesis = graph.findNode("src.A.T2_filtered").orElseThrow();
        assertEquals(NodeKind.FILTERED_PLACEHOLDER, thesis.getKind());
        assertEquals("THES", thesis.get("gephi_label"));
        assertEquals("box", thesis.get("shape"));
        assertEquals("src.A", thesis.get("source"));

        GraphNode support = graph.findNode("src.A.S2_filtered").orElseThrow();
        assertEquals("SUPP", support.get("gephi_label"));
        assertEquals("ellipse", support.get("shape"));
        assertEquals(Palette.SUPPORT_DEFAULT.fill(), support.get("fillcolor"));
        assertEquals(2, context.countOf("nodes.placeholders"));
    }

    @Test
    @DisplayName("Should create one placeholder per excluded id however many edges need it")
    void testApply_PlaceholderCreatedOnce() {
        graph.add(GraphEdge.of("src.A.S1_func", "src.A.T2"));
        graph.add(GraphEdge.of("src.A.T1", "src.A.T2"));

        pass.apply(new RewriteContext(graph, ORIGINAL, Set.of("src.A.T2")));

        assertEquals(1, graph.nodes().stream().filter(n -> n.getId().equals("src.A.T2_filtered")).count());
    }

    @Test
    @DisplayName("Should redirect a missing nested element to its enclosing thesis")
    void testApply_RedirectsToThesis() {
        GraphEdge edge = GraphEdge.of("src.A.S1_func", "src.A.H100009");
        graph.add(edge);

        pass.apply(new RewriteContext(graph, ORIGINAL, Set.of()));

        assertEquals("src.A.T1", edge.getTarget());
    }

    @Test
    @DisplayName("Should drop unrepairable edges and self-loops created by a redirect")
    void testApply_DropsUnrepairable() {
        graph.add(GraphEdge.of("src.A.S1_func", "nowhere"));
        graph.add(GraphEdge.of("src.A.T1", "src.A.H100009"));
        graph.add(GraphEdge.of("src.A.S1", "src.A.S1_func"));
        RewriteContext context = new RewriteContext(graph, ORIGINAL, Set.of());

        pass.apply(context);

        assertEquals(1, graph.edges().size());
        assertEquals(2, context.countOf("edges.dropped"));
    }

    @Test
    @DisplayName("Should leave every edge endpoint defined")
    void testApply_EdgeClosure() {
        graph.add(GraphEdge.of("src.A.S1_func", "src.A.T2"));
        graph.add(GraphEdge.of("ghost", "src.A.T1"));
        graph.add(GraphEdge.of("src.A.S1_func", "src.A.H100009"));

        pass.apply(new RewriteContext(graph, ORIGINAL, Set.of("src.A.T2")));

        Set<String> defined = graph.nodeIds();
        for (GraphEdge edge : graph.edges()) {
            assertTrue(defined.contains(edge.getSource()), "Undefined source in " + edge);
            assertTrue(defined.contains(edge.getTarget()), "Undefined target in " + edge);
        }
    }
}

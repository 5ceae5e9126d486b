package com.purchasingpower.thesugraph.service.impl;

import com.google.common.base.Preconditions;
import com.purchasingpower.thesugraph.configuration.ThesuProperties;
import com.purchasingpower.thesugraph.model.filter.FilterSettings;
import com.purchasingpower.thesugraph.model.graph.GraphDocument;
import com.purchasingpower.thesugraph.model.graph.GraphNode;
import com.purchasingpower.thesugraph.model.graph.NodeKind;
import com.purchasingpower.thesugraph.model.render.RenderResult;
import com.purchasingpower.thesugraph.model.xml.LoadedDocument;
import com.purchasingpower.thesugraph.model.xml.RunCaches;
import com.purchasingpower.thesugraph.service.DocumentFilterService;
import com.purchasingpower.thesugraph.service.GraphLoweringService;
import com.purchasingpower.thesugraph.service.GraphRenderService;
import com.purchasingpower.thesugraph.service.ThesuDocumentLoader;
import com.purchasingpower.thesugraph.service.layout.DirectionCorrector;
import com.purchasingpower.thesugraph.util.DotWriter;
import com.purchasingpower.thesugraph.workflow.pipeline.RewriteContext;
import com.purchasingpower.thesugraph.workflow.pipeline.RewritePipelineEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class GraphRenderServiceImpl implements GraphRenderService {

    private final ThesuProperties properties;
    private final ThesuDocumentLoader documentLoader;
    private final DocumentFilterService filterService;
    private final GraphLoweringService loweringService;
    private final RewritePipelineEngine rewritePipeline;
    private final DirectionCorrector directionCorrector;

    @Override
    public RenderResult render() {
        return render(properties.getPaths().xmlFile(), Path.of(properties.getPaths().getBaseDir()),
                properties.getPaths().dotFile(), FilterSettings.from(properties.getFilters()));
    }

    @Override
    public RenderResult render(Path xmlFile, Path baseDir, Path dotFile, FilterSettings settings) {
        Preconditions.checkNotNull(dotFile, "Output file cannot be null");
        long startTime = System.currentTimeMillis();

        Rendered rendered = build(xmlFile, baseDir, settings);
        String dot = DotWriter.write(rendered.graph());
        write(dotFile, dot);

        GraphDocument graph = rendered.graph();
        RenderResult result = RenderResult.builder()
                .outputFile(dotFile.toAbsolutePath().toString())
                .nodeCount(graph.nodes().size())
                .edgeCount(graph.edges().size())
                .placeholderCount((int) graph.nodes().stream()
                        .map(GraphNode::getKind)
                        .filter(NodeKind.FILTERED_PLACEHOLDER::equals)
                        .count())
                .directionCorrected(rendered.reversedEdges() >= 0)
                .reversedEdges(Math.max(rendered.reversedEdges(), 0))
                .filterRemovals(rendered.filterRemovals())
                .rewriteStatistics(rendered.rewrite().getStatistics())
                .durationMs(System.currentTimeMillis() - startTime)
                .build();
        log.info("✅ Wrote {} ({} nodes, {} edges) in {}ms",
                dotFile, result.getNodeCount(), result.getEdgeCount(), result.getDurationMs());
        return result;
    }

    @Override
    public String renderToText(Path xmlFile, Path baseDir, FilterSettings settings) {
        return DotWriter.write(build(xmlFile, baseDir, settings).graph());
    }

    private Rendered build(Path xmlFile, Path baseDir, FilterSettings settings) {
        Preconditions.checkNotNull(xmlFile, "Input file cannot be null");
        Preconditions.checkNotNull(settings, "Filter settings cannot be null");

        RunCaches caches = new RunCaches();
        LoadedDocument document = documentLoader.load(xmlFile, baseDir, caches);
        Map<String, Integer> removals = filterService.applyFilters(document, settings);
        GraphDocument graph = loweringService.lower(document, settings);

        RewriteContext rewrite = rewritePipeline.run(
                new RewriteContext(graph, document.getOriginalDocument(), settings.getElementsToExclude()));

        int reversed = -1;
        if (properties.getLayout().isDirectionCorrection()) {
            reversed = directionCorrector.correct(graph);
        }
        return new Rendered(graph, removals, rewrite, reversed);
    }

    private static void write(Path dotFile, String dot) {
        try {
            Path parent = dotFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(dotFile, dot, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("❌ Failed to write {}", dotFile, e);
            throw new UncheckedIOException("Failed to write DOT file " + dotFile, e);
        }
    }

    private record Rendered(GraphDocument graph, Map<String, Integer> filterRemovals, RewriteContext rewrite,
                            int reversedEdges) {
    }
}

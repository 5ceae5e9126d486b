package com.purchasingpower.thesugraph.util;

import com.purchasingpower.thesugraph.model.graph.AttributedStatement;
import com.purchasingpower.thesugraph.model.graph.Comment;
import com.purchasingpower.thesugraph.model.graph.GraphDocument;
import com.purchasingpower.thesugraph.model.graph.GraphEdge;
import com.purchasingpower.thesugraph.model.graph.GraphNode;
import com.purchasingpower.thesugraph.model.graph.GraphStatement;
import com.purchasingpower.thesugraph.model.graph.Subgraph;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Serializes a {@link GraphDocument} to DOT text.
 *
 * <p>Layout rules applied while writing:
 * <ul>
 *   <li>header declarations contiguous, followed by one blank line</li>
 *   <li>a blank line before every subgraph; its declaration lines stay contiguous</li>
 *   <li>a blank line wherever a run of node statements meets a run of edge statements</li>
 *   <li>runs of blank lines collapse to one</li>
 * </ul>
 */
public final class DotWriter {

    private static final String INDENT = "  ";

    private DotWriter() {
    }

    public static String write(GraphDocument document) {
        List<String> lines = new ArrayList<>();
        lines.add("digraph " + document.getName() + " {");
        for (Map.Entry<String, String> attribute : document.getGraphAttributes().entrySet()) {
            lines.add(attribute.getKey() + "=" + formatValue(attribute.getValue()) + ";");
        }
        lines.add("");
        writeStatements(document.getStatements(), "", lines);
        lines.add("}");
        return String.join("\n", normalizeBlankLines(lines)) + "\n";
    }

    /**
     * Single-line rendering of a node, edge or comment, without indentation.
     */
    public static String render(GraphStatement statement) {
        if (statement instanceof GraphNode node) {
            return quoteId(node.getId()) + formatAttributes(node) + ";";
        }
        if (statement instanceof GraphEdge edge) {
            return quoteId(edge.getSource()) + " -> " + quoteId(edge.getTarget()) + formatAttributes(edge) + ";";
        }
        if (statement instanceof Comment comment) {
            return "// " + comment.getText();
        }
        if (statement instanceof Subgraph subgraph) {
            return "subgraph " + subgraph.getName();
        }
        throw new IllegalArgumentException("Unsupported statement: " + statement);
    }

    /**
     * HTML-like labels ({@code <...>}) are written verbatim, everything else as a quoted string.
     */
    public static String formatValue(String value) {
        if (value.length() >= 2 && value.startsWith("<") && value.endsWith(">")) {
            return value;
        }
        return "\"" + value.replace("\"", "\\\"") + "\"";
    }

    public static String quoteId(String id) {
        return "\"" + id.replace("\"", "\\\"") + "\"";
    }

    private static void writeStatements(List<GraphStatement> statements, String indent, List<String> lines) {
        Class<?> previous = null;
        for (GraphStatement statement : statements) {
            if (statement instanceof Subgraph subgraph) {
                lines.add("");
                writeSubgraph(subgraph, indent, lines);
                lines.add("");
                previous = null;
                continue;
            }
            boolean nodeOrEdge = statement instanceof GraphNode || statement instanceof GraphEdge;
            if (nodeOrEdge && previous != null && previous != statement.getClass()) {
                lines.add("");
            }
            lines.add(indent + render(statement));
            previous = nodeOrEdge ? statement.getClass() : previous;
        }
    }

    private static void writeSubgraph(Subgraph subgraph, String indent, List<String> lines) {
        lines.add(indent + "subgraph " + subgraph.getName() + " {");
        for (Map.Entry<String, String> attribute : subgraph.getAttributes().entrySet()) {
            lines.add(indent + INDENT + attribute.getKey() + "=" + formatValue(attribute.getValue()) + ";");
        }
        writeStatements(subgraph.getStatements(), indent + INDENT, lines);
        lines.add(indent + "}");
    }

    private static String formatAttributes(AttributedStatement<?> statement) {
        if (statement.getAttributes().isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder(" [");
        boolean first = true;
        for (Map.Entry<String, String> attribute : statement.getAttributes().entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(attribute.getKey()).append('=').append(formatValue(attribute.getValue()));
            first = false;
        }
        return sb.append(']').toString();
    }

    private static List<String> normalizeBlankLines(List<String> lines) {
        List<String> result = new ArrayList<>();
        for (String line : lines) {
            String last = result.isEmpty() ? null : result.get(result.size() - 1);
            if (line.isBlank()) {
                if (last != null && !last.isBlank() && !last.endsWith("{")) {
                    result.add("");
                }
                continue;
            }
            if (line.trim().equals("}") && last != null && last.isBlank()) {
                result.remove(result.size() - 1);
            }
            result.add(line);
        }
        return result;
    }
}

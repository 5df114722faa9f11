package com.sqlsignal.core.generator.impl;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sqlsignal.core.callgraph.CallGraph;
import com.sqlsignal.core.callgraph.CallGraphEdge;
import com.sqlsignal.core.callgraph.CallGraphNode;
import com.sqlsignal.core.flow.ControlFlowGraph;
import com.sqlsignal.core.flow.FlowEdge;
import com.sqlsignal.core.flow.FlowNode;
import com.sqlsignal.core.generator.DiagramGenerator;
import com.sqlsignal.core.generator.DiagramModel;
import com.sqlsignal.core.generator.DiagramType;
import com.sqlsignal.core.generator.GeneratedDiagram;

/**
 * Generates Mermaid diagrams embedded in Markdown.
 *
 * <h2>Supported Diagram Types</h2>
 * <ul>
 *   <li><b>Control flow:</b> {@code flowchart TD}; decisions as rhombi, loops as hexagons,
 *       entry/exit and jumps as stadiums</li>
 *   <li><b>Call graph:</b> {@code graph LR}; edges labelled with call kind and count</li>
 * </ul>
 *
 * <p>Mermaid node ids are positional ({@code N0}, {@code N1}, ...) in the graph's own node order, so
 * object names never need to be valid Mermaid identifiers and {@code end} never collides with the
 * Mermaid keyword. Names appear only in quoted labels.
 */
public class MermaidGenerator implements DiagramGenerator {

    private static final Logger log = LoggerFactory.getLogger(MermaidGenerator.class);

    private static final String GENERATOR_ID = "mermaid";
    private static final String GENERATOR_DISPLAY_NAME = "Mermaid Diagram Generator";
    private static final String FILE_EXTENSION = "md";

    private static final String MARKDOWN_HEADER_PREFIX = "# ";
    private static final String CODE_BLOCK_START = "```mermaid\n";
    private static final String CODE_BLOCK_END = "```\n";

    private static final String FLOWCHART_TD = "flowchart TD\n";
    private static final String GRAPH_LR = "graph LR\n";

    private static final String FILE_NAME_SANITIZATION_PATTERN = "[^a-zA-Z0-9_.-]";

    private static final String NO_FLOW_NODE = "  A[No control flow found]\n";
    private static final String NO_OBJECTS_NODE = "  A[No objects found]\n";

    @Override
    public String getId() {
        return GENERATOR_ID;
    }

    @Override
    public String getDisplayName() {
        return GENERATOR_DISPLAY_NAME;
    }

    @Override
    public String getFileExtension() {
        return FILE_EXTENSION;
    }

    @Override
    public Set<DiagramType> getSupportedDiagramTypes() {
        return Set.of(DiagramType.CONTROL_FLOW, DiagramType.CALL_GRAPH);
    }

    @Override
    public GeneratedDiagram generate(DiagramModel model, DiagramType type) {
        Objects.requireNonNull(model, "model must not be null");
        Objects.requireNonNull(type, "type must not be null");
        log.debug("Generating {} diagram for {}", type, model.name());

        return switch (type) {
            case CONTROL_FLOW -> new GeneratedDiagram(
                sanitizeFileName(model.name()) + "-control-flow",
                type,
                generateControlFlow(model.name(), model.controlFlow()),
                FILE_EXTENSION);
            case CALL_GRAPH -> new GeneratedDiagram(
                sanitizeFileName(model.name()) + "-call-graph",
                type,
                generateCallGraph(model.name(), model.callGraph()),
                FILE_EXTENSION);
        };
    }

    private String generateControlFlow(String name, ControlFlowGraph graph) {
        StringBuilder sb = new StringBuilder();
        appendHeader(sb, "Control Flow: " + name);
        sb.append(FLOWCHART_TD);

        if (graph == null || graph.nodes().isEmpty()) {
            sb.append(NO_FLOW_NODE);
        } else {
            Map<String, String> ids = positionalIds(graph.nodes().stream().map(FlowNode::id).toList());
            for (FlowNode node : graph.nodes()) {
                sb.append("  ").append(ids.get(node.id())).append(flowShape(node)).append('\n');
            }
            for (FlowEdge edge : graph.edges()) {
                appendEdge(sb, ids.get(edge.from()), ids.get(edge.to()), edge.label());
            }
        }

        sb.append(CODE_BLOCK_END);
        return sb.toString();
    }

    private String generateCallGraph(String name, CallGraph graph) {
        StringBuilder sb = new StringBuilder();
        appendHeader(sb, "Call Graph: " + name);
        sb.append(GRAPH_LR);

        if (graph == null || graph.nodes().isEmpty()) {
            sb.append(NO_OBJECTS_NODE);
        } else {
            Map<String, String> ids = positionalIds(graph.nodes().stream().map(CallGraphNode::id).toList());
            for (CallGraphNode node : graph.nodes()) {
                String label = escape(node.id()) + "<br/>" + escape(node.type());
                sb.append("  ").append(ids.get(node.id())).append("[\"").append(label).append("\"]\n");
            }
            for (CallGraphEdge edge : graph.edges()) {
                String label = edge.count() > 1 ? edge.kind() + " x" + edge.count() : edge.kind();
                appendEdge(sb, ids.get(edge.from()), ids.get(edge.to()), label);
            }
        }

        sb.append(CODE_BLOCK_END);
        return sb.toString();
    }

    private void appendHeader(StringBuilder sb, String title) {
        sb.append(MARKDOWN_HEADER_PREFIX).append(escape(title)).append("\n\n");
        sb.append(CODE_BLOCK_START);
    }

    private void appendEdge(StringBuilder sb, String from, String to, String label) {
        if (from == null || to == null) {
            return;
        }
        sb.append("  ").append(from).append(" -->|").append(escape(label)).append("| ").append(to).append('\n');
    }

    private String flowShape(FlowNode node) {
        String label = "\"" + escape(node.label()) + "\"";
        return switch (node.type()) {
            case "if" -> "{" + label + "}";
            case "while" -> "{{" + label + "}}";
            case "try", "catch" -> "[" + label + "]";
            default -> "([" + label + "])";
        };
    }

    private static Map<String, String> positionalIds(List<String> ids) {
        Map<String, String> mermaidIds = new HashMap<>();
        for (int i = 0; i < ids.size(); i++) {
            mermaidIds.putIfAbsent(ids.get(i), "N" + i);
        }
        return mermaidIds;
    }

    /**
     * Converts a diagram subject into a safe file name stem.
     *
     * @param name subject name (may be null)
     * @return sanitized name, or "unnamed" if input is null or blank
     */
    private String sanitizeFileName(String name) {
        if (name == null || name.isBlank()) {
            return "unnamed";
        }
        return name.replaceAll(FILE_NAME_SANITIZATION_PATTERN, "_");
    }

    /**
     * Escapes text for quoted Mermaid labels: double quotes become single quotes, pipes and angle
     * brackets become HTML entities.
     */
    private String escape(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("\"", "'")
            .replace("|", "#124;")
            .replace("<", "#lt;")
            .replace(">", "#gt;");
    }
}

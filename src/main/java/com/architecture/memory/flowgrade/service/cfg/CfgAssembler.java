package com.architecture.memory.flowgrade.service.cfg;

import com.architecture.memory.flowgrade.dto.cfg.CfgEdgeRecord;
import com.architecture.memory.flowgrade.dto.cfg.CfgNodeRecord;
import com.architecture.memory.flowgrade.dto.cfg.CfgRecord;
import com.architecture.memory.flowgrade.exception.CfgStructureException;
import com.architecture.memory.flowgrade.model.cfg.CfgEdge;
import com.architecture.memory.flowgrade.model.cfg.CfgNode;
import com.architecture.memory.flowgrade.model.cfg.CfgNodeType;
import com.architecture.memory.flowgrade.model.cfg.ControlFlowGraph;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Converts between validated graph records and {@link ControlFlowGraph}.
 * {@code toRecord(toEntity(r))} reproduces the field values of a validated record {@code r}.
 */
@Component
public class CfgAssembler {

    /**
     * Build the graph entity from a record that already went through {@link CfgRecordValidator}.
     *
     * @throws CfgStructureException if node ids repeat or an edge references a node that does not exist
     */
    public ControlFlowGraph toEntity(CfgRecord validated) {
        Set<String> nodeIds = new HashSet<>();
        Set<String> duplicates = new LinkedHashSet<>();
        List<CfgNode> nodes = new ArrayList<>();

        for (CfgNodeRecord record : validated.getNodes()) {
            if (!nodeIds.add(record.getId())) {
                duplicates.add(record.getId());
            }
            nodes.add(CfgNode.builder()
                    .id(record.getId())
                    .type(toNodeType(record.getType()))
                    .label(record.getLabel())
                    .nextNodeIds(List.copyOf(record.getNextNodeIds()))
                    .condition(record.getCondition())
                    .build());
        }

        if (!duplicates.isEmpty()) {
            throw new CfgStructureException("Graph contains duplicate node ids", List.copyOf(duplicates));
        }

        Set<String> dangling = new LinkedHashSet<>();
        List<CfgEdge> edges = new ArrayList<>();
        for (CfgEdgeRecord record : validated.getEdges()) {
            if (!nodeIds.contains(record.getFrom())) {
                dangling.add(record.getFrom());
            }
            if (!nodeIds.contains(record.getTo())) {
                dangling.add(record.getTo());
            }
            edges.add(CfgEdge.builder()
                    .from(record.getFrom())
                    .to(record.getTo())
                    .label(record.getLabel())
                    .build());
        }

        if (!dangling.isEmpty()) {
            throw new CfgStructureException("Edges reference unknown node ids", List.copyOf(dangling));
        }

        return ControlFlowGraph.builder()
                .nodes(List.copyOf(nodes))
                .edges(List.copyOf(edges))
                .complexity(validated.getComplexity())
                .numPaths(validated.getNumPaths())
                .nestingDepth(validated.getNestingDepth())
                .build();
    }

    public CfgRecord toRecord(ControlFlowGraph graph) {
        List<CfgNodeRecord> nodes = graph.getNodes().stream()
                .map(node -> CfgNodeRecord.builder()
                        .id(node.getId())
                        .type(node.getType().name())
                        .label(node.getLabel())
                        .nextNodeIds(new ArrayList<>(node.getNextNodeIds()))
                        .condition(node.getCondition())
                        .build())
                .collect(Collectors.toList());

        List<CfgEdgeRecord> edges = graph.getEdges().stream()
                .map(edge -> CfgEdgeRecord.builder()
                        .from(edge.getFrom())
                        .to(edge.getTo())
                        .label(edge.getLabel())
                        .build())
                .collect(Collectors.toList());

        return CfgRecord.builder()
                .nodes(nodes)
                .edges(edges)
                .complexity(graph.getComplexity())
                .numPaths(graph.getNumPaths())
                .nestingDepth(graph.getNestingDepth())
                .build();
    }

    /**
     * Minimal START -> PROCESS(label) -> END graph returned when model output cannot be parsed.
     */
    public ControlFlowGraph fallbackGraph(String errorLabel) {
        return ControlFlowGraph.builder()
                .nodes(List.of(
                        fallbackNode("node1", CfgNodeType.START, "Start", List.of("node2")),
                        fallbackNode("node2", CfgNodeType.PROCESS, errorLabel, List.of("node3")),
                        fallbackNode("node3", CfgNodeType.END, "End", List.of())))
                .edges(List.of(
                        CfgEdge.builder().from("node1").to("node2").label("").build(),
                        CfgEdge.builder().from("node2").to("node3").label("").build()))
                .complexity(CfgRecordValidator.DEFAULT_COMPLEXITY)
                .numPaths(CfgRecordValidator.DEFAULT_NUM_PATHS)
                .nestingDepth(CfgRecordValidator.DEFAULT_NESTING_DEPTH)
                .build();
    }

    private CfgNode fallbackNode(String id, CfgNodeType type, String label, List<String> next) {
        return CfgNode.builder()
                .id(id)
                .type(type)
                .label(label)
                .nextNodeIds(next)
                .condition(null)
                .build();
    }

    private CfgNodeType toNodeType(String type) {
        CfgNodeType parsed = CfgNodeType.fromString(type);
        return parsed != null ? parsed : CfgNodeType.PROCESS;
    }
}

package com.architecture.memory.flowgrade.service.cfg;

import com.architecture.memory.flowgrade.dto.cfg.CfgEdgeRecord;
import com.architecture.memory.flowgrade.dto.cfg.CfgNodeRecord;
import com.architecture.memory.flowgrade.dto.cfg.CfgRecord;
import com.architecture.memory.flowgrade.model.cfg.CfgNodeType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Repairs a possibly incomplete graph record into one with every field present.
 * Runs on fresh model output and on cache hits alike, so both converge to the same graph.
 *
 * Never fails and never mutates its input. Missing fields get defaults; edges missing an
 * endpoint are dropped. Edges naming an unknown node are left for the assembler to reject.
 */
@Component
@Slf4j
public class CfgRecordValidator {

    static final int DEFAULT_COMPLEXITY = 1;
    static final int DEFAULT_NUM_PATHS = 1;
    static final int DEFAULT_NESTING_DEPTH = 0;

    public CfgRecord validate(CfgRecord raw) {
        CfgRecord source = raw != null ? raw : new CfgRecord();

        List<CfgNodeRecord> nodes = new ArrayList<>();
        List<CfgNodeRecord> rawNodes = source.getNodes() != null ? source.getNodes() : List.of();
        for (int i = 0; i < rawNodes.size(); i++) {
            nodes.add(validateNode(rawNodes.get(i), i));
        }

        List<CfgEdgeRecord> edges = new ArrayList<>();
        List<CfgEdgeRecord> rawEdges = source.getEdges() != null ? source.getEdges() : List.of();
        for (CfgEdgeRecord rawEdge : rawEdges) {
            CfgEdgeRecord edge = validateEdge(rawEdge);
            if (edge.getFrom().isEmpty() || edge.getTo().isEmpty()) {
                log.debug("[CFG] Dropping edge with missing endpoint: {} -> {}", edge.getFrom(), edge.getTo());
                continue;
            }
            edges.add(edge);
        }

        if (edges.size() < rawEdges.size()) {
            log.warn("[CFG] Dropped {} of {} edges with a missing endpoint", rawEdges.size() - edges.size(), rawEdges.size());
        }

        return CfgRecord.builder()
                .nodes(nodes)
                .edges(edges)
                .complexity(source.getComplexity() != null ? source.getComplexity() : DEFAULT_COMPLEXITY)
                .numPaths(source.getNumPaths() != null ? source.getNumPaths() : DEFAULT_NUM_PATHS)
                .nestingDepth(source.getNestingDepth() != null ? source.getNestingDepth() : DEFAULT_NESTING_DEPTH)
                .build();
    }

    private CfgNodeRecord validateNode(CfgNodeRecord raw, int position) {
        CfgNodeRecord node = raw != null ? raw : new CfgNodeRecord();
        int ordinal = position + 1;

        return CfgNodeRecord.builder()
                .id(node.getId() != null ? node.getId() : "node" + ordinal)
                .type(normalizeType(node.getType()))
                .label(node.getLabel() != null ? node.getLabel() : "Node " + ordinal)
                .nextNodeIds(node.getNextNodeIds() != null ? copyIds(node.getNextNodeIds()) : new ArrayList<>())
                .condition(node.getCondition())
                .build();
    }

    private List<String> copyIds(List<String> ids) {
        List<String> copy = new ArrayList<>(ids);
        copy.removeIf(Objects::isNull);
        return copy;
    }

    private CfgEdgeRecord validateEdge(CfgEdgeRecord raw) {
        CfgEdgeRecord edge = raw != null ? raw : new CfgEdgeRecord();
        return CfgEdgeRecord.builder()
                .from(edge.getFrom() != null ? edge.getFrom() : "")
                .to(edge.getTo() != null ? edge.getTo() : "")
                .label(edge.getLabel() != null ? edge.getLabel() : "")
                .build();
    }

    /**
     * Missing or unrecognised kinds (e.g. "INPUT" from a flowchart) become PROCESS.
     */
    private String normalizeType(String type) {
        if (type == null) {
            return CfgNodeType.PROCESS.name();
        }
        CfgNodeType parsed = CfgNodeType.fromString(type);
        if (parsed == null) {
            log.debug("[CFG] Unknown node type '{}', using PROCESS", type);
            return CfgNodeType.PROCESS.name();
        }
        return parsed.name();
    }
}

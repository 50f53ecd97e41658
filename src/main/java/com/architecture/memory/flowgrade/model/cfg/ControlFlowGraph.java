package com.architecture.memory.flowgrade.model.cfg;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Immutable control-flow graph of one solution. Nodes are statements or decisions,
 * edges are the possible transitions between them. Summary metrics come from the
 * inference model and are not derived from the node and edge lists.
 */
@Value
@Builder
public class ControlFlowGraph {
    List<CfgNode> nodes;
    List<CfgEdge> edges;
    int complexity;
    int numPaths;
    int nestingDepth;

    public Optional<CfgNode> findNode(String nodeId) {
        return nodes.stream()
                .filter(node -> node.getId().equals(nodeId))
                .findFirst();
    }
}

package com.architecture.memory.flowgrade.dto.cfg;

import com.architecture.memory.flowgrade.model.cfg.ControlFlowGraph;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Size and shape figures of one graph, handed to the model next to the graphs themselves.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StructuralMetrics {

    @JsonProperty("num_nodes")
    private int numNodes;

    @JsonProperty("num_edges")
    private int numEdges;

    private int complexity;

    @JsonProperty("num_paths")
    private int numPaths;

    @JsonProperty("nesting_depth")
    private int nestingDepth;

    public static StructuralMetrics of(ControlFlowGraph graph) {
        return StructuralMetrics.builder()
                .numNodes(graph.getNodes().size())
                .numEdges(graph.getEdges().size())
                .complexity(graph.getComplexity())
                .numPaths(graph.getNumPaths())
                .nestingDepth(graph.getNestingDepth())
                .build();
    }
}

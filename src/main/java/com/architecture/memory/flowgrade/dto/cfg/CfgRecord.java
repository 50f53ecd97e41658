package com.architecture.memory.flowgrade.dto.cfg;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Control-flow graph as it travels over the wire and sits in the cache.
 * Every field may be missing on input; {@code CfgRecordValidator} fills the gaps.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CfgRecord {

    private List<CfgNodeRecord> nodes;
    private List<CfgEdgeRecord> edges;

    // Cyclomatic complexity as reported by the model, not recomputed here
    private Integer complexity;

    @JsonProperty("num_paths")
    private Integer numPaths;

    @JsonProperty("nesting_depth")
    private Integer nestingDepth;
}

package com.architecture.memory.flowgrade.model.cfg;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class CfgNode {
    String id;
    CfgNodeType type;
    String label;
    List<String> nextNodeIds;
    String condition;
}

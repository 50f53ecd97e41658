package com.architecture.memory.flowgrade.model.cfg;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CfgEdge {
    String from;
    String to;
    String label;   // empty for unconditional fall-through
}

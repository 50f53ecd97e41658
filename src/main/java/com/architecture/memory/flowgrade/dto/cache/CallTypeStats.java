package com.architecture.memory.flowgrade.dto.cache;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CallTypeStats {
    private String callType;
    private long entries;
    private long hits;
}

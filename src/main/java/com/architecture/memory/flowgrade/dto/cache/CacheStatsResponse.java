package com.architecture.memory.flowgrade.dto.cache;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Aggregate view of the AI response cache for the admin endpoint.
 * Hit totals and the per-call-type breakdown cover live entries only.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CacheStatsResponse {
    private long totalEntries;
    private long activeEntries;
    private long expiredEntries;
    private long totalCacheHits;
    private long ttlHours;
    private List<CallTypeStats> byCallType;

    // Set only when the store could not be read
    private String error;
}

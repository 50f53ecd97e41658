package com.architecture.memory.flowgrade.service.cache;

/**
 * Call type tags. Part of every cache key, so the same content cached for
 * two operations never collides.
 */
public final class CacheCallTypes {

    public static final String PSEUDOCODE_TO_CFG = "pseudocode_to_cfg";
    public static final String FLOWCHART_TO_CFG = "flowchart_to_cfg";
    public static final String ANALYZE_PROBLEM = "analyze_problem";
    public static final String COMPARE_CFGS = "compare_cfgs";

    private CacheCallTypes() {
    }
}

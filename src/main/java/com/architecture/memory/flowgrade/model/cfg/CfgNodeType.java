package com.architecture.memory.flowgrade.model.cfg;

import java.util.Locale;

/**
 * Kinds of statements a control-flow graph node can represent.
 */
public enum CfgNodeType {
    START,
    END,
    PROCESS,
    DECISION,
    LOOP,
    FUNCTION_CALL,
    RETURN;

    /**
     * Get the enum value from a string, case-insensitive. Spaces and dashes count as underscores.
     */
    public static CfgNodeType fromString(String value) {
        if (value == null) return null;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT).replace(' ', '_').replace('-', '_'));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}

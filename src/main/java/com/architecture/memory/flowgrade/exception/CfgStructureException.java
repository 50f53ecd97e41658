package com.architecture.memory.flowgrade.exception;

import java.util.List;

/**
 * A graph record is internally inconsistent beyond field repair: an edge points at a node
 * that does not exist, or two nodes share an id.
 */
public class CfgStructureException extends RuntimeException {

    private final List<String> offendingNodeIds;

    public CfgStructureException(String message, List<String> offendingNodeIds) {
        super(message + ": " + offendingNodeIds);
        this.offendingNodeIds = List.copyOf(offendingNodeIds);
    }

    public List<String> getOffendingNodeIds() {
        return offendingNodeIds;
    }
}

package com.fibagent.agent.ecmp;

/**
 * Raised when next-hop group bookkeeping detects an inconsistency, such as a
 * removed route whose group has no identifier or a population dropping below
 * zero. These point at a defect in delta derivation or snapshot sequencing;
 * the operation that detected them is aborted.
 */
public class NextHopGroupInvariantException extends IllegalStateException {
    public NextHopGroupInvariantException(String message) {
        super(message);
    }
}

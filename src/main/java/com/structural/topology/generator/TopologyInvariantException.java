package com.structural.topology.generator;

/**
 * A generated model broke one of its structural invariants. Signals a generator bug,
 * never a user error.
 */
public class TopologyInvariantException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public TopologyInvariantException(String message) {
        super(message);
    }
}

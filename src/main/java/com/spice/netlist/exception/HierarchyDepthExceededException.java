package com.spice.netlist.exception;

/**
 * Raised when expanding the hierarchy would not terminate: a subcircuit instantiates itself
 * (directly or through other subcircuits) or nesting exceeds the configured limit.
 */
public class HierarchyDepthExceededException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String instancePath;

    public HierarchyDepthExceededException(String instancePath, String message) {
        super(message);
        this.instancePath = instancePath;
    }

    public String getInstancePath() {
        return instancePath;
    }
}

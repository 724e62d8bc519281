package com.spice.netlist.exception;

public class TopCellNotFoundException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String topCellName;

    public TopCellNotFoundException(String topCellName) {
        super("Top cell '" + topCellName + "' not found in netlist.");
        this.topCellName = topCellName;
    }

    public String getTopCellName() {
        return topCellName;
    }
}

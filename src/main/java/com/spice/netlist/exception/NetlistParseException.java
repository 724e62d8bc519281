package com.spice.netlist.exception;

import com.spice.netlist.diagnostics.Severity;

/**
 * Thrown while handling a single logical line. The parse loop catches it, records a
 * diagnostic and continues with the next line.
 */
public class NetlistParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final Severity severity;

    public NetlistParseException(String message) {
        this(message, Severity.WARNING);
    }

    public NetlistParseException(String message, Severity severity) {
        super(message);
        this.severity = severity;
    }

    public Severity getSeverity() {
        return severity;
    }
}

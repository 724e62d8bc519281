package com.spice.netlist.cli.exception;

import java.nio.file.Path;
import java.util.List;

/**
 * Every problem found in the analyze command line, reported together.
 */
public class OptionsValidationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient Path netlistFile;
    private final List<String> errors;

    /**
     * @param netlistFile the netlist named on the command line, or {@code null} when none was given
     */
    public OptionsValidationException(Path netlistFile, List<String> errors) {
        super(buildMessage(netlistFile, errors));
        this.netlistFile = netlistFile;
        this.errors = List.copyOf(errors);
    }

    public Path getNetlistFile() {
        return netlistFile;
    }

    public List<String> getErrors() {
        return errors;
    }

    private static String buildMessage(Path netlistFile, List<String> errors) {
        String subject = netlistFile != null ? "netlist-analyzer " + netlistFile : "netlist-analyzer";
        return errors.size() + " invalid option(s) for " + subject + ": " + String.join("; ", errors);
    }
}

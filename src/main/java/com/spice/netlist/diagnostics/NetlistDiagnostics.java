package com.spice.netlist.diagnostics;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

/**
 * Diagnostics accumulated while parsing one or more netlist files.
 *
 * Pure structure only: no logging, no formatting, no IO.
 */
@Getter
public class NetlistDiagnostics {
    private final List<ParseDiagnostic> errors = new ArrayList<>();
    private final List<ParseDiagnostic> warnings = new ArrayList<>();

    public void add(ParseDiagnostic diagnostic) {
        if (diagnostic.getSeverity() == Severity.ERROR) {
            errors.add(diagnostic);
        } else {
            warnings.add(diagnostic);
        }
    }

    public List<ParseDiagnostic> getAll() {
        List<ParseDiagnostic> all = new ArrayList<>(errors);
        all.addAll(warnings);
        return all;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public boolean isEmpty() {
        return errors.isEmpty() && warnings.isEmpty();
    }
}

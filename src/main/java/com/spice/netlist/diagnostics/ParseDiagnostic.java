package com.spice.netlist.diagnostics;

import lombok.Builder;
import lombok.Value;

/**
 * One problem found while reading a netlist. {@code line} is 1-based; 0 means the problem
 * is not tied to a specific line.
 */
@Value
@Builder
public class ParseDiagnostic {
    Severity severity;
    String sourceFile;
    int line;
    String sourceText;
    String message;

    public String format() {
        StringBuilder sb = new StringBuilder();
        if (sourceFile != null) {
            sb.append(sourceFile);
            if (line > 0) {
                sb.append(':').append(line);
            }
            sb.append(": ");
        } else if (line > 0) {
            sb.append("line ").append(line).append(": ");
        }
        sb.append(message);
        if (sourceText != null && !sourceText.isEmpty()) {
            sb.append(" [").append(sourceText).append(']');
        }
        return sb.toString();
    }
}

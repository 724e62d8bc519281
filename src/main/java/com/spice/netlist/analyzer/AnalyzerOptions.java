package com.spice.netlist.analyzer;

import lombok.Builder;
import lombok.Value;

/**
 * Tunables for a {@link NetlistAnalyzer}.
 */
@Value
@Builder(toBuilder = true)
public class AnalyzerOptions {

    public static final int DEFAULT_MAX_DEPTH = 256;

    /**
     * Subcircuit to analyze as the design root; {@code null} selects the root automatically.
     */
    String topCellName;

    /**
     * Deepest instance nesting flattening will follow before giving up.
     */
    @Builder.Default
    int maxDepth = DEFAULT_MAX_DEPTH;

    public static AnalyzerOptions defaults() {
        return AnalyzerOptions.builder().build();
    }

    public static AnalyzerOptions forTopCell(String topCellName) {
        return AnalyzerOptions.builder().topCellName(topCellName).build();
    }
}

package com.spice.netlist.cli.model;

import java.nio.file.Path;

import com.spice.netlist.analyzer.AnalyzerOptions;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps AnalyzeCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedAnalyzeOptions {
    Path netlistFile;
    AnalyzerOptions analyzerOptions;
    boolean anyReportSelected;
}

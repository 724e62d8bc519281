package com.spice.netlist.cli.model;

import java.nio.file.Path;

import com.spice.netlist.analyzer.AnalyzerOptions;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds all CLI options for the analyze command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class AnalyzeOptions {

    @Parameters(index = "0", paramLabel = "FILE", description = "Path to SPICE netlist file")
    private Path netlistFile;

    @Option(names = { "--stats" }, description = "Print component statistics")
    private boolean stats;

    @Option(names = { "--flatten" }, description = "Flatten hierarchy and print simplified netlist")
    private boolean flatten;

    @Option(names = {
            "--count-transistors" }, description = "Count total transistors (MOS+BJT) in flattened circuit")
    private boolean countTransistors;

    @Option(names = { "--model-usage" }, description = "Count usage of each device model in flattened circuit")
    private boolean modelUsage;

    @Option(names = { "--find-model" }, paramLabel = "MODEL_NAME", description = "Find all subcircuits that use the specified model name")
    private String findModel;

    @Option(names = { "--tree" }, description = "Print hierarchy tree (subcircuit instances only)")
    private boolean tree;

    @Option(names = {
            "--list-top-cells" }, description = "List all potential top-level subcircuits (not instantiated by others)")
    private boolean listTopCells;

    @Option(names = {
            "--top-cell" }, paramLabel = "TOP_CELL_NAME", description = "Name of the top-level subcircuit to analyze")
    private String topCell;

    @Option(names = {
            "--resolve-includes" }, description = "Parse .INCLUDE/.LIB targets and merge their subcircuits and models")
    private boolean resolveIncludes;

    @Option(names = {
            "--max-depth" }, defaultValue = "" + AnalyzerOptions.DEFAULT_MAX_DEPTH, description = "Maximum instance nesting followed when flattening (default: ${DEFAULT-VALUE})")
    private int maxDepth;

}

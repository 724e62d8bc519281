package com.spice.netlist;

import com.spice.netlist.cli.AnalyzeCommand;
import picocli.CommandLine;

/**
 * Main entry point for the SPICE netlist analyzer.
 * Parses SPICE, CDL and HSPICE netlists and reports on their subcircuit hierarchy.
 */
public class NetlistAnalyzerApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new AnalyzeCommand()).execute(args);
        System.exit(exitCode);
    }
}

package com.spice.netlist.cli;

import java.io.IOException;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.spice.netlist.analyzer.NetlistAnalyzer;
import com.spice.netlist.cli.exception.OptionsValidationException;
import com.spice.netlist.cli.model.AnalyzeOptions;
import com.spice.netlist.cli.model.ValidatedAnalyzeOptions;
import com.spice.netlist.cli.output.AnalyzeResultsPrinter;
import com.spice.netlist.cli.validation.AnalyzeOptionsValidator;
import com.spice.netlist.diagnostics.NetlistDiagnostics;
import com.spice.netlist.exception.HierarchyDepthExceededException;
import com.spice.netlist.exception.TopCellNotFoundException;
import com.spice.netlist.model.Circuit;
import com.spice.netlist.parser.IncludeResolver;
import com.spice.netlist.parser.SpiceParser;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command that parses a SPICE netlist and prints the requested hierarchy reports.
 */
@Command(
        name = "netlist-analyzer",
        mixinStandardHelpOptions = true,
        version = "spice-netlist-analyzer 1.0.0",
        description = "Parses a SPICE/CDL/HSPICE netlist and analyzes its subcircuit hierarchy."
)
public class AnalyzeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AnalyzeCommand.class);

    @Mixin
    private AnalyzeOptions options = new AnalyzeOptions();

    private final AnalyzeOptionsValidator validator = new AnalyzeOptionsValidator();
    private final AnalyzeResultsPrinter printer = new AnalyzeResultsPrinter();

    @Override
    public Integer call() {
        try {
            ValidatedAnalyzeOptions v = validator.validate(options);

            NetlistDiagnostics diagnostics = new NetlistDiagnostics();
            Circuit circuit = options.isResolveIncludes()
                    ? new IncludeResolver().load(v.getNetlistFile(), diagnostics)
                    : new SpiceParser().parseFile(v.getNetlistFile(), diagnostics);

            printer.printBanner(v, circuit);
            printer.printDiagnostics(diagnostics);

            NetlistAnalyzer analyzer = new NetlistAnalyzer(circuit, v.getAnalyzerOptions());
            runReports(analyzer, v);
            return 0;

        } catch (OptionsValidationException e) {
            printer.printValidationErrors(e);
            return 1;
        } catch (TopCellNotFoundException | HierarchyDepthExceededException e) {
            printer.printFailure(e.getMessage());
            return 1;
        } catch (IOException e) {
            log.error("Failed to read netlist {}", options.getNetlistFile(), e);
            printer.printFailure("Could not read '" + options.getNetlistFile() + "': " + e.getMessage());
            return 1;
        }
    }

    private void runReports(NetlistAnalyzer analyzer, ValidatedAnalyzeOptions v) {
        if (!v.isAnyReportSelected()) {
            printer.printStats("Component statistics", analyzer.getStats());
            printer.printTopCells(analyzer.getTopCells());
            return;
        }

        if (options.isStats()) {
            printer.printStats("Component statistics", analyzer.getStats());
            printer.printStats("Hierarchical statistics (flattened)", analyzer.getHierarchicalStats());
        }
        if (options.isCountTransistors()) {
            printer.printTransistorCount(analyzer.getTransistorCount());
        }
        if (options.isModelUsage()) {
            printer.printModelUsage(analyzer.getModelUsage(), analyzer.getUnresolvedSubckts());
        }
        if (options.getFindModel() != null) {
            printer.printSubcktsUsingModel(options.getFindModel(),
                    analyzer.getSubcktsUsingModel(options.getFindModel()));
        }
        if (options.isTree()) {
            printer.printTree(analyzer.getHierarchy());
        }
        if (options.isListTopCells()) {
            printer.printTopCells(analyzer.getTopCells());
        }
        if (options.isFlatten()) {
            printer.printFlattened(analyzer.flatten());
        }
    }
}

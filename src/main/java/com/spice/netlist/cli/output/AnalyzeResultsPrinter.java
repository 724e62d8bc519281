package com.spice.netlist.cli.output;

import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.spice.netlist.analyzer.HierarchyNode;
import com.spice.netlist.cli.exception.OptionsValidationException;
import com.spice.netlist.cli.model.ValidatedAnalyzeOptions;
import com.spice.netlist.diagnostics.NetlistDiagnostics;
import com.spice.netlist.diagnostics.ParseDiagnostic;
import com.spice.netlist.model.Circuit;
import com.spice.netlist.model.Component;

/**
 * Responsible only for printing CLI output for the "analyze" command.
 * No validation, no execution.
 */
public class AnalyzeResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(AnalyzeResultsPrinter.class);

    private static final String BRANCH = "├── ";
    private static final String LAST_BRANCH = "└── ";
    private static final String PIPE = "│   ";
    private static final String SPACE = "    ";

    public void printBanner(ValidatedAnalyzeOptions v, Circuit circuit) {
        log.info("=================================================");
        log.info("SPICE Netlist Analyzer");
        log.info("=================================================");
        log.info("Netlist File: {}", v.getNetlistFile().toAbsolutePath());
        log.info("Circuit: {}", circuit.getName());
        log.info("Top Cell: {}", v.getAnalyzerOptions().getTopCellName() != null
                ? v.getAnalyzerOptions().getTopCellName() : "auto");
        log.info("Subcircuits: {}", circuit.getSubcircuits().size());
        log.info("Models: {}", circuit.getModels().size());
        log.info("=================================================");
    }

    public void printDiagnostics(NetlistDiagnostics diagnostics) {
        if (diagnostics.isEmpty()) {
            return;
        }
        for (ParseDiagnostic diagnostic : diagnostics.getAll()) {
            log.warn(diagnostic.format());
        }
    }

    public void printStats(String title, Map<String, Integer> stats) {
        log.info("");
        log.info("{}:", title);
        if (stats.isEmpty()) {
            log.info("  (no components)");
            return;
        }
        int total = 0;
        for (Map.Entry<String, Integer> entry : stats.entrySet()) {
            log.info("  {}: {}", String.format("%-16s", entry.getKey()), entry.getValue());
            total += entry.getValue();
        }
        log.info("  {}: {}", String.format("%-16s", "Total"), total);
    }

    public void printTransistorCount(int count) {
        log.info("");
        log.info("Total transistors (MOS+BJT): {}", count);
    }

    public void printModelUsage(Map<String, Integer> usage, Set<String> unresolved) {
        log.info("");
        log.info("Model usage:");
        if (usage.isEmpty()) {
            log.info("  (no models referenced)");
        }
        usage.forEach((model, count) -> log.info("  {}: {}", model, count));

        if (!unresolved.isEmpty()) {
            log.warn("Undefined subcircuits (treated as black boxes): {}", String.join(", ", unresolved));
        }
    }

    public void printSubcktsUsingModel(String modelName, List<String> subckts) {
        log.info("");
        if (subckts.isEmpty()) {
            log.info("No subcircuits use model '{}'.", modelName);
            return;
        }
        log.info("Subcircuits using model '{}':", modelName);
        subckts.forEach(name -> log.info("  {}", name));
    }

    public void printTree(HierarchyNode root) {
        log.info("");
        log.info("Hierarchy:");
        log.info(root.getLabel());
        List<HierarchyNode> children = root.getChildren();
        for (int i = 0; i < children.size(); i++) {
            printTreeNode(children.get(i), "", i == children.size() - 1);
        }
    }

    private void printTreeNode(HierarchyNode node, String prefix, boolean last) {
        String label = node.getLabel();
        if (node.isCyclic()) {
            label += " [cycle]";
        } else if (node.isDepthLimited()) {
            label += " [depth limit]";
        }
        log.info("{}{}{}", prefix, last ? LAST_BRANCH : BRANCH, label);

        String childPrefix = prefix + (last ? SPACE : PIPE);
        List<HierarchyNode> children = node.getChildren();
        for (int i = 0; i < children.size(); i++) {
            printTreeNode(children.get(i), childPrefix, i == children.size() - 1);
        }
    }

    public void printTopCells(List<String> topCells) {
        log.info("");
        if (topCells.isEmpty()) {
            log.info("No subcircuits found (flat design).");
            return;
        }
        log.info("Top cells:");
        topCells.forEach(name -> log.info("  {}", name));
    }

    public void printFlattened(Circuit flat) {
        log.info("");
        log.info("Flattened netlist ({} components):", flat.getComponents().size());
        for (Component component : flat.getComponents()) {
            log.info("{} {}", component.getName(), String.join(" ", component.getNodes()));
        }
    }

    public void printFailure(String message) {
        log.error("ERROR: {}", message);
    }

    public void printValidationErrors(OptionsValidationException e) {
        if (e.getNetlistFile() != null) {
            log.error("Invalid options for {}:", e.getNetlistFile());
        } else {
            log.error("Invalid options:");
        }
        e.getErrors().forEach(error -> log.error("  - {}", error));
    }
}

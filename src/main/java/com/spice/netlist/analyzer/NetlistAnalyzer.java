package com.spice.netlist.analyzer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.spice.netlist.exception.TopCellNotFoundException;
import com.spice.netlist.model.Circuit;
import com.spice.netlist.model.Component;
import com.spice.netlist.model.ComponentKind;
import com.spice.netlist.model.Subckt;

/**
 * Hierarchical analysis of a parsed circuit: flattening, top-cell detection, component
 * classification, statistics and model usage.
 *
 * The source circuit is never modified; every query works on copies. Names of subcircuits
 * found to be undefined while flattening accumulate per analyzer instance, so use one
 * analyzer per thread.
 */
public class NetlistAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(NetlistAnalyzer.class);

    private final Circuit circuit;
    private final AnalyzerOptions options;
    private final Map<String, Subckt> subcktsByName;
    private final Set<String> unresolvedSubckts = new TreeSet<>();

    private final TopCellDetector topCellDetector;
    private final ComponentClassifier classifier;
    private final HierarchyFlattener flattener;
    private final ModelUsageIndexer modelUsageIndexer = new ModelUsageIndexer();
    private final HierarchyTreeBuilder treeBuilder;

    public NetlistAnalyzer(Circuit circuit) {
        this(circuit, AnalyzerOptions.defaults());
    }

    public NetlistAnalyzer(Circuit circuit, String topCellName) {
        this(circuit, AnalyzerOptions.forTopCell(topCellName));
    }

    /**
     * @throws TopCellNotFoundException if an explicit top cell is not defined in the circuit
     */
    public NetlistAnalyzer(Circuit circuit, AnalyzerOptions options) {
        this.circuit = Objects.requireNonNull(circuit, "circuit");
        this.options = Objects.requireNonNull(options, "options");
        this.subcktsByName = circuit.getSubcktsByName();

        if (options.getTopCellName() != null && !subcktsByName.containsKey(options.getTopCellName())) {
            throw new TopCellNotFoundException(options.getTopCellName());
        }

        this.topCellDetector = new TopCellDetector(circuit);
        this.classifier = new ComponentClassifier(subcktsByName);
        this.flattener = new HierarchyFlattener(circuit, subcktsByName, unresolvedSubckts, options.getMaxDepth());
        this.treeBuilder = new HierarchyTreeBuilder(subcktsByName, options.getMaxDepth());
    }

    public Circuit getCircuit() {
        return circuit;
    }

    /**
     * Components the analysis starts from: the explicit top cell's body, else the circuit's own
     * top-level components, else the body of the detected top cell, else nothing.
     */
    public List<Component> getRootComponents() {
        String topCellName = options.getTopCellName();
        if (topCellName != null) {
            Subckt topCell = circuit.findSubckt(topCellName)
                    .orElseThrow(() -> new TopCellNotFoundException(topCellName));
            return copyOf(topCell.getComponents());
        }

        if (!circuit.getComponents().isEmpty()) {
            return copyOf(circuit.getComponents());
        }

        return topCellDetector.findTopCell()
                .map(topCell -> copyOf(topCell.getComponents()))
                .orElseGet(ArrayList::new);
    }

    /**
     * Name shown at the root of reports: the explicit top cell, else the circuit name.
     */
    public String getRootName() {
        return options.getTopCellName() != null ? options.getTopCellName() : circuit.getName();
    }

    public Circuit flatten() {
        return flattener.flatten(getRootComponents());
    }

    public ComponentKind classify(Component component) {
        return classifier.classify(component);
    }

    /**
     * Component counts of the root list, without expanding instances.
     */
    public Map<String, Integer> getStats() {
        List<Component> roots;
        try {
            roots = getRootComponents();
        } catch (TopCellNotFoundException e) {
            log.warn(e.getMessage());
            return new LinkedHashMap<>();
        }
        return countByKind(roots);
    }

    /**
     * Component counts of the flattened circuit.
     */
    public Map<String, Integer> getHierarchicalStats() {
        Circuit flat;
        try {
            flat = flatten();
        } catch (TopCellNotFoundException e) {
            log.warn(e.getMessage());
            return new LinkedHashMap<>();
        }
        return countByKind(flat.getComponents());
    }

    /**
     * MOSFETs plus BJTs after flattening, black-box transistors included.
     */
    public int getTransistorCount() {
        int count = 0;
        for (Component component : flatten().getComponents()) {
            if (classify(component).isTransistor()) {
                count++;
            }
        }
        return count;
    }

    public Map<String, Integer> getModelUsage() {
        return modelUsageIndexer.index(flatten());
    }

    public List<String> getSubcktsUsingModel(String modelName) {
        return modelUsageIndexer.findSubcktsUsingModel(circuit, modelName);
    }

    /**
     * Subcircuits referenced but not defined, collected by every flatten run of this analyzer.
     */
    public Set<String> getUnresolvedSubckts() {
        return Collections.unmodifiableSet(unresolvedSubckts);
    }

    public List<String> getTopCells() {
        return topCellDetector.getTopCells();
    }

    public Optional<Subckt> findTopCell() {
        return topCellDetector.findTopCell();
    }

    public HierarchyNode getHierarchy() {
        return treeBuilder.build(getRootName(), getRootComponents());
    }

    private Map<String, Integer> countByKind(List<Component> components) {
        Map<String, Integer> stats = new LinkedHashMap<>();
        for (Component component : components) {
            stats.merge(classify(component).getTag(), 1, Integer::sum);
        }
        return stats;
    }

    private static List<Component> copyOf(List<Component> components) {
        List<Component> copies = new ArrayList<>(components.size());
        for (Component component : components) {
            copies.add(component.copy());
        }
        return copies;
    }
}

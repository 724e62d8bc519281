package com.spice.netlist.analyzer;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.spice.netlist.model.Circuit;
import com.spice.netlist.model.Component;
import com.spice.netlist.model.Subckt;
import com.spice.netlist.model.SubcktInstance;

/**
 * Finds subcircuits that no other subcircuit instantiates.
 *
 * Works on the static reference graph (one level of instance edges per definition);
 * instances in the top-level component list are not counted as references.
 */
public class TopCellDetector {
    private static final Logger log = LoggerFactory.getLogger(TopCellDetector.class);

    private final Circuit circuit;

    public TopCellDetector(Circuit circuit) {
        this.circuit = circuit;
    }

    public List<String> getTopCells() {
        Set<String> defined = new TreeSet<>();
        Set<String> instantiated = new HashSet<>();

        for (Subckt subckt : circuit.getSubcircuits()) {
            defined.add(subckt.getName());
            for (Component component : subckt.getComponents()) {
                if (component instanceof SubcktInstance instance) {
                    instantiated.add(instance.getSubcktName());
                }
            }
        }

        defined.removeAll(instantiated);
        return new ArrayList<>(defined);
    }

    /**
     * The single root, or the lexicographically smallest when there are several.
     */
    public Optional<Subckt> findTopCell() {
        List<String> roots = getTopCells();
        if (roots.isEmpty()) {
            return Optional.empty();
        }
        if (roots.size() > 1) {
            log.warn("Multiple top cells found {}; using '{}'. Pass an explicit top cell to choose another.",
                    roots, roots.get(0));
        }
        return circuit.findSubckt(roots.get(0));
    }
}

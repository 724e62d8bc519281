package com.spice.netlist.analyzer;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import com.spice.netlist.model.Circuit;
import com.spice.netlist.model.Component;
import com.spice.netlist.model.Subckt;
import com.spice.netlist.model.SubcktInstance;

/**
 * Model usage queries.
 *
 * Stateless: callers provide the circuit.
 */
public class ModelUsageIndexer {

    /**
     * Counts devices per model in a flattened circuit. Remaining subcircuit instances are
     * black boxes and count under their subcircuit name, which stands in for a device model
     * in CDL-style netlists.
     */
    public Map<String, Integer> index(Circuit flat) {
        Map<String, Integer> usage = new TreeMap<>();
        for (Component component : flat.getComponents()) {
            if (component.hasModel()) {
                usage.merge(component.getModel(), 1, Integer::sum);
            } else if (component instanceof SubcktInstance instance) {
                usage.merge(instance.getSubcktName(), 1, Integer::sum);
            }
        }
        return usage;
    }

    /**
     * Names of subcircuits whose own body (one level, not flattened) references the model.
     * The circuit name is included when a top-level component references it.
     */
    public List<String> findSubcktsUsingModel(Circuit circuit, String modelName) {
        Set<String> users = new TreeSet<>();

        for (Subckt subckt : circuit.getSubcircuits()) {
            if (usesModel(subckt.getComponents(), modelName)) {
                users.add(subckt.getName());
            }
        }
        if (usesModel(circuit.getComponents(), modelName)) {
            users.add(circuit.getName());
        }

        return new ArrayList<>(users);
    }

    private static boolean usesModel(List<Component> components, String modelName) {
        for (Component component : components) {
            if (component.hasModel() && component.getModel().equals(modelName)) {
                return true;
            }
        }
        return false;
    }
}

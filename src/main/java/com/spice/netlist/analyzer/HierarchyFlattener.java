package com.spice.netlist.analyzer;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.spice.netlist.exception.HierarchyDepthExceededException;
import com.spice.netlist.model.Circuit;
import com.spice.netlist.model.Component;
import com.spice.netlist.model.Model;
import com.spice.netlist.model.Nets;
import com.spice.netlist.model.Subckt;
import com.spice.netlist.model.SubcktInstance;

/**
 * Expands subcircuit instances into one scoped component list.
 *
 * Every component is copied before it is renamed, so the source circuit is never touched.
 * Names are prefixed with the dot-joined instance path. Inside an expanded body a node is
 * - the bound actual net, when it names a port;
 * - the global ground {@code 0}, when it is {@code 0} or {@code GND};
 * - {@code <instancePath>.<net>} otherwise.
 * Instances of undefined or empty subcircuits stay in the output as opaque leaves.
 */
public class HierarchyFlattener {
    private static final Logger log = LoggerFactory.getLogger(HierarchyFlattener.class);

    private final Circuit circuit;
    private final Map<String, Subckt> subcktsByName;
    private final Set<String> unresolvedSubckts;
    private final int maxDepth;

    /**
     * @param unresolvedSubckts sink for names of subcircuits that are referenced but not defined
     */
    public HierarchyFlattener(Circuit circuit, Map<String, Subckt> subcktsByName,
                              Set<String> unresolvedSubckts, int maxDepth) {
        this.circuit = circuit;
        this.subcktsByName = subcktsByName;
        this.unresolvedSubckts = unresolvedSubckts;
        this.maxDepth = maxDepth;
    }

    public Circuit flatten(List<Component> roots) {
        Circuit flat = Circuit.builder()
                .name(circuit.getName() + "_flat")
                .sourceFile(circuit.getSourceFile())
                .build();
        for (Model model : circuit.getModels()) {
            flat.addModel(model.copy());
        }
        flat.getParameters().putAll(circuit.getParameters());
        flat.getIncludes().addAll(circuit.getIncludes());

        // The root scope follows the same ground rule as every expanded body
        List<Component> scoped = new ArrayList<>(roots.size());
        for (Component root : roots) {
            Component copy = root.copy();
            copy.setNodes(Nets.normalizeGround(copy.getNodes()));
            scoped.add(copy);
        }

        expand(scoped, "", flat, new ArrayDeque<>());

        log.debug("Flattened '{}' into {} components", circuit.getName(), flat.getComponents().size());
        return flat;
    }

    private void expand(List<Component> components, String path, Circuit flat, Deque<String> expansionStack) {
        for (Component component : components) {
            switch (component.getKind()) {
                case RESISTOR, CAPACITOR, INDUCTOR, MOSFET, BJT, DIODE, VOLTAGE_SOURCE, CURRENT_SOURCE ->
                        flat.addComponent(copyWithPath(component, path));
                case SUBCKT_INSTANCE -> expandInstance((SubcktInstance) component, path, flat, expansionStack);
            }
        }
    }

    private void expandInstance(SubcktInstance instance, String path, Circuit flat, Deque<String> expansionStack) {
        Subckt definition = subcktsByName.get(instance.getSubcktName());

        if (definition == null) {
            if (unresolvedSubckts.add(instance.getSubcktName())) {
                log.warn("Subcircuit '{}' is instantiated but not defined; treating it as a black box",
                        instance.getSubcktName());
            }
            flat.addComponent(copyWithPath(instance, path));
            return;
        }

        if (definition.isLeaf()) {
            flat.addComponent(copyWithPath(instance, path));
            return;
        }

        String instancePath = Nets.qualify(path, instance.getName());

        if (expansionStack.contains(definition.getName())) {
            throw new HierarchyDepthExceededException(instancePath,
                    "Subcircuit '" + definition.getName() + "' instantiates itself via " + instancePath);
        }
        if (expansionStack.size() >= maxDepth) {
            throw new HierarchyDepthExceededException(instancePath,
                    "Hierarchy deeper than " + maxDepth + " levels at " + instancePath);
        }

        Map<String, String> portMap = bindPorts(definition, instance, instancePath);

        List<Component> body = new ArrayList<>(definition.getComponents().size());
        for (Component child : definition.getComponents()) {
            Component copy = child.copy();
            List<String> nodes = new ArrayList<>(copy.getNodes().size());
            for (String node : copy.getNodes()) {
                nodes.add(resolveNode(node, portMap, instancePath));
            }
            copy.setNodes(nodes);
            body.add(copy);
        }

        log.debug("Expanding {} ({}) with {} components", instancePath, definition.getName(), body.size());

        expansionStack.push(definition.getName());
        try {
            expand(body, instancePath, flat, expansionStack);
        } finally {
            expansionStack.pop();
        }
    }

    /**
     * Zips ports with actual nodes. On a length mismatch the shorter list wins and the rest is dropped.
     */
    private Map<String, String> bindPorts(Subckt definition, SubcktInstance instance, String instancePath) {
        List<String> ports = definition.getPorts();
        List<String> actuals = instance.getNodes();

        if (ports.size() != actuals.size()) {
            log.warn("Port count mismatch at {}: subcircuit '{}' has {} ports, instance binds {} nodes",
                    instancePath, definition.getName(), ports.size(), actuals.size());
        }

        Map<String, String> portMap = new LinkedHashMap<>();
        int bound = Math.min(ports.size(), actuals.size());
        for (int i = 0; i < bound; i++) {
            portMap.put(ports.get(i), actuals.get(i));
        }
        return portMap;
    }

    private static String resolveNode(String node, Map<String, String> portMap, String instancePath) {
        String actual = portMap.get(node);
        if (actual != null) {
            return actual;
        }
        if (Nets.isGround(node)) {
            return Nets.GROUND;
        }
        return instancePath + "." + node;
    }

    private static Component copyWithPath(Component component, String path) {
        Component copy = component.copy();
        copy.setName(Nets.qualify(path, component.getName()));
        return copy;
    }
}

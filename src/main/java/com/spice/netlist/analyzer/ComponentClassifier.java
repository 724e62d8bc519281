package com.spice.netlist.analyzer;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

import com.spice.netlist.model.Component;
import com.spice.netlist.model.ComponentKind;
import com.spice.netlist.model.Subckt;
import com.spice.netlist.model.SubcktInstance;

/**
 * Decides what kind of device a component stands for.
 *
 * Primitives are what they are. A subcircuit instance is structural when its definition has a body;
 * otherwise it is a black box and the subcircuit name is used to guess the device it models
 * (CDL netlists commonly describe transistors this way).
 */
public class ComponentClassifier {

    private final Map<String, Subckt> subcktsByName;

    public ComponentClassifier(Map<String, Subckt> subcktsByName) {
        this.subcktsByName = subcktsByName;
    }

    public ComponentKind classify(Component component) {
        return switch (component.getKind()) {
            case RESISTOR, CAPACITOR, INDUCTOR, MOSFET, BJT, DIODE, VOLTAGE_SOURCE, CURRENT_SOURCE ->
                    component.getKind();
            case SUBCKT_INSTANCE -> classifyInstance((SubcktInstance) component);
        };
    }

    private ComponentKind classifyInstance(SubcktInstance instance) {
        Subckt definition = subcktsByName.get(instance.getSubcktName());
        if (definition != null && !definition.isLeaf()) {
            return ComponentKind.SUBCKT_INSTANCE;
        }

        String name = instance.getSubcktName().toLowerCase(Locale.ROOT);

        if (name.contains("fet") || name.contains("mos")) {
            Set<String> keys = instance.getParameterKeysUpperCase();
            if (keys.contains("W") && keys.contains("L")) {
                return ComponentKind.MOSFET;
            }
        }
        if (name.contains("bjt") || name.contains("npn") || name.contains("pnp")) {
            return ComponentKind.BJT;
        }
        if (name.contains("diode")) {
            return ComponentKind.DIODE;
        }
        return ComponentKind.SUBCKT_INSTANCE;
    }
}

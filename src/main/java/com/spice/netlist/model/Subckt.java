package com.spice.netlist.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.Data;

/**
 * Definition of a subcircuit. Ports are order-significant.
 *
 * A definition without components is a black box (typically a device characterized
 * outside the netlist) and is never expanded.
 */
@Data
@Builder
public class Subckt implements ComponentContainer {
    private String name;
    private List<String> ports;
    private List<Component> components;
    private Map<String, String> parameters;
    private int sourceLine;

    public static SubcktBuilder builder() {
        return new SubcktBuilder()
                .ports(new ArrayList<>())
                .components(new ArrayList<>())
                .parameters(new LinkedHashMap<>());
    }

    public boolean isLeaf() {
        return components == null || components.isEmpty();
    }

    public Subckt copy() {
        List<Component> body = new ArrayList<>();
        for (Component component : components) {
            body.add(component.copy());
        }
        return Subckt.builder()
                .name(name)
                .ports(new ArrayList<>(ports))
                .components(body)
                .parameters(new LinkedHashMap<>(parameters))
                .sourceLine(sourceLine)
                .build();
    }
}

package com.spice.netlist.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.Builder;
import lombok.Data;

/**
 * Root of a parsed netlist.
 *
 * Subcircuit and model names are expected to be unique; when a name is defined twice the
 * last definition wins on lookup.
 */
@Data
@Builder
public class Circuit implements ComponentContainer {
    private String name;
    private String sourceFile;
    private List<Component> components;
    private List<Subckt> subcircuits;
    private List<Model> models;
    private Map<String, String> parameters;
    private List<String> includes;

    public static CircuitBuilder builder() {
        return new CircuitBuilder()
                .components(new ArrayList<>())
                .subcircuits(new ArrayList<>())
                .models(new ArrayList<>())
                .parameters(new LinkedHashMap<>())
                .includes(new ArrayList<>());
    }

    public void addSubckt(Subckt subckt) {
        subcircuits.add(subckt);
    }

    public void addModel(Model model) {
        models.add(model);
    }

    public void addInclude(String include) {
        includes.add(include);
    }

    /**
     * Subcircuits keyed by name, in definition order. Later duplicates replace earlier ones.
     */
    public Map<String, Subckt> getSubcktsByName() {
        Map<String, Subckt> byName = new LinkedHashMap<>();
        for (Subckt subckt : subcircuits) {
            byName.put(subckt.getName(), subckt);
        }
        return byName;
    }

    public Optional<Subckt> findSubckt(String subcktName) {
        return Optional.ofNullable(getSubcktsByName().get(subcktName));
    }

    public Optional<Model> findModel(String modelName) {
        Model found = null;
        for (Model model : models) {
            if (model.getName().equals(modelName)) {
                found = model;
            }
        }
        return Optional.ofNullable(found);
    }

    public Circuit copy() {
        Circuit copy = Circuit.builder()
                .name(name)
                .sourceFile(sourceFile)
                .parameters(new LinkedHashMap<>(parameters))
                .includes(new ArrayList<>(includes))
                .build();
        for (Component component : components) {
            copy.addComponent(component.copy());
        }
        for (Subckt subckt : subcircuits) {
            copy.addSubckt(subckt.copy());
        }
        for (Model model : models) {
            copy.addModel(model.copy());
        }
        return copy;
    }
}

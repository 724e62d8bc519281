package com.spice.netlist.model;

import java.util.List;
import java.util.Map;

/**
 * A scope that owns components and parameters: the top-level circuit or a subcircuit body.
 */
public interface ComponentContainer {

    String getName();

    List<Component> getComponents();

    Map<String, String> getParameters();

    default void addComponent(Component component) {
        getComponents().add(component);
    }
}

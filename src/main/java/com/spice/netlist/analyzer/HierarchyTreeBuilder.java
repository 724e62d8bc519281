package com.spice.netlist.analyzer;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;

import com.spice.netlist.model.Component;
import com.spice.netlist.model.Subckt;
import com.spice.netlist.model.SubcktInstance;

/**
 * Builds the instance tree of a design: subcircuit instances only, sorted by instance name
 * at every level. Instance names are local (not path-prefixed).
 */
public class HierarchyTreeBuilder {

    private final Map<String, Subckt> subcktsByName;
    private final int maxDepth;

    public HierarchyTreeBuilder(Map<String, Subckt> subcktsByName, int maxDepth) {
        this.subcktsByName = subcktsByName;
        this.maxDepth = maxDepth;
    }

    public HierarchyNode build(String rootName, List<Component> roots) {
        HierarchyNode root = new HierarchyNode(rootName, null);
        addInstances(root, roots, new ArrayDeque<>());
        return root;
    }

    private void addInstances(HierarchyNode parent, List<Component> components, Deque<String> path) {
        List<SubcktInstance> instances = new ArrayList<>();
        for (Component component : components) {
            if (component instanceof SubcktInstance instance) {
                instances.add(instance);
            }
        }
        instances.sort(Comparator.comparing(SubcktInstance::getName));

        for (SubcktInstance instance : instances) {
            HierarchyNode node = new HierarchyNode(instance.getName(), instance.getSubcktName());
            parent.addChild(node);

            Subckt definition = subcktsByName.get(instance.getSubcktName());
            if (definition == null) {
                continue;
            }
            if (path.contains(definition.getName())) {
                node.setCyclic(true);
                continue;
            }
            if (path.size() >= maxDepth) {
                node.setDepthLimited(true);
                continue;
            }

            path.push(definition.getName());
            try {
                addInstances(node, definition.getComponents(), path);
            } finally {
                path.pop();
            }
        }
    }
}

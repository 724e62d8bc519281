package com.spice.netlist.analyzer;

import java.util.ArrayList;
import java.util.List;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One subcircuit-instance edge of the hierarchy tree. The root node carries the design name
 * and no subcircuit name.
 */
@Data
@NoArgsConstructor
public class HierarchyNode {
    private String instanceName;
    private String subcktName;
    private List<HierarchyNode> children = new ArrayList<>();
    /** Set when the subcircuit is already being expanded higher up; such nodes are not expanded. */
    private boolean cyclic;
    /** Set when the node sits at the depth limit; its children are not listed. */
    private boolean depthLimited;

    public HierarchyNode(String instanceName, String subcktName) {
        this.instanceName = instanceName;
        this.subcktName = subcktName;
    }

    public void addChild(HierarchyNode child) {
        children.add(child);
    }

    public String getLabel() {
        return subcktName == null ? instanceName : instanceName + " (" + subcktName + ")";
    }
}

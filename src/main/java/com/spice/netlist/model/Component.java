package com.spice.netlist.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Base class for every device or instance line of a netlist.
 *
 * Nodes are kept in the order they were written; parameter values are literal strings
 * and are never evaluated. Bare trailing tokens without '=' end up in {@link #extra}.
 */
@Data
@NoArgsConstructor
public abstract class Component {
    protected String name;
    protected List<String> nodes = new ArrayList<>();
    protected Map<String, String> parameters = new LinkedHashMap<>();
    protected List<String> extra = new ArrayList<>();
    protected String model;
    protected int sourceLine;

    protected Component(String name, List<String> nodes, Map<String, String> parameters,
                        List<String> extra, String model, int sourceLine) {
        this.name = name;
        this.nodes = nodes != null ? new ArrayList<>(nodes) : new ArrayList<>();
        this.parameters = parameters != null ? new LinkedHashMap<>(parameters) : new LinkedHashMap<>();
        this.extra = extra != null ? new ArrayList<>(extra) : new ArrayList<>();
        this.model = model;
        this.sourceLine = sourceLine;
    }

    /**
     * Variant tag used by classification and flattening.
     */
    public abstract ComponentKind getKind();

    /**
     * Deep copy of this component; the copy shares no mutable state with the original.
     */
    public abstract Component copy();

    public boolean hasModel() {
        return model != null && !model.isEmpty();
    }

    public Set<String> getParameterKeysUpperCase() {
        Set<String> keys = new LinkedHashSet<>();
        for (String key : parameters.keySet()) {
            keys.add(key.toUpperCase(Locale.ROOT));
        }
        return keys;
    }

    protected <T extends Component> T copyBaseInto(T target) {
        target.name = name;
        target.nodes = new ArrayList<>(nodes);
        target.parameters = new LinkedHashMap<>(parameters);
        target.extra = new ArrayList<>(extra);
        target.model = model;
        target.sourceLine = sourceLine;
        return target;
    }
}

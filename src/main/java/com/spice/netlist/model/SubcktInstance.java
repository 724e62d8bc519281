package com.spice.netlist.model;

import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * X-element: a use of a subcircuit. Its nodes are the actual nets bound, in order,
 * to the ports of the referenced {@link Subckt}.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@NoArgsConstructor
public class SubcktInstance extends Component {
    private String subcktName = "";

    @Builder
    public SubcktInstance(String name, List<String> nodes, String subcktName,
                          Map<String, String> parameters, List<String> extra, int sourceLine) {
        super(name, nodes, parameters, extra, null, sourceLine);
        this.subcktName = subcktName != null ? subcktName : "";
    }

    @Override
    public ComponentKind getKind() {
        return ComponentKind.SUBCKT_INSTANCE;
    }

    @Override
    public SubcktInstance copy() {
        SubcktInstance copy = copyBaseInto(new SubcktInstance());
        copy.subcktName = subcktName;
        return copy;
    }
}

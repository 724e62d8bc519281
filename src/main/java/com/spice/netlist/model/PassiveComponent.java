package com.spice.netlist.model;

import java.util.List;
import java.util.Map;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Two-terminal R/C/L element carrying a single literal value.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@NoArgsConstructor
public abstract class PassiveComponent extends Component {
    protected String value = "0";

    protected PassiveComponent(String name, List<String> nodes, Map<String, String> parameters,
                               List<String> extra, int sourceLine, String value) {
        super(name, nodes, parameters, extra, null, sourceLine);
        this.value = value != null ? value : "0";
    }
}

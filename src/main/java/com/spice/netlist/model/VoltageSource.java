package com.spice.netlist.model;

import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Independent voltage source with literal DC and AC values.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@NoArgsConstructor
public class VoltageSource extends Component {
    private String dcValue = "0";
    private String acValue = "0";

    @Builder
    public VoltageSource(String name, List<String> nodes, String dcValue, String acValue,
                         Map<String, String> parameters, List<String> extra, int sourceLine) {
        super(name, nodes, parameters, extra, null, sourceLine);
        this.dcValue = dcValue != null ? dcValue : "0";
        this.acValue = acValue != null ? acValue : "0";
    }

    @Override
    public ComponentKind getKind() {
        return ComponentKind.VOLTAGE_SOURCE;
    }

    @Override
    public VoltageSource copy() {
        VoltageSource copy = copyBaseInto(new VoltageSource());
        copy.dcValue = dcValue;
        copy.acValue = acValue;
        return copy;
    }
}

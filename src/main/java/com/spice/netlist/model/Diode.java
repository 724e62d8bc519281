package com.spice.netlist.model;

import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@NoArgsConstructor
public class Diode extends Component {

    @Builder
    public Diode(String name, List<String> nodes, String model, Map<String, String> parameters,
                 List<String> extra, int sourceLine) {
        super(name, nodes, parameters, extra, model != null ? model : "", sourceLine);
    }

    @Override
    public ComponentKind getKind() {
        return ComponentKind.DIODE;
    }

    @Override
    public Diode copy() {
        return copyBaseInto(new Diode());
    }
}

package com.spice.netlist.model;

import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * MOSFET line: {@code Mname d g s b model [key=value...]}.
 */
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@NoArgsConstructor
public class Mosfet extends Component {

    @Builder
    public Mosfet(String name, List<String> nodes, String model, Map<String, String> parameters,
                  List<String> extra, int sourceLine) {
        super(name, nodes, parameters, extra, model != null ? model : "", sourceLine);
    }

    @Override
    public ComponentKind getKind() {
        return ComponentKind.MOSFET;
    }

    @Override
    public Mosfet copy() {
        return copyBaseInto(new Mosfet());
    }
}

package com.spice.netlist.model;

import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Resistor line: {@code Rname n+ n- value [key=value...]}.
 */
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@NoArgsConstructor
public class Resistor extends PassiveComponent {

    @Builder
    public Resistor(String name, List<String> nodes, String value, Map<String, String> parameters,
                    List<String> extra, int sourceLine) {
        super(name, nodes, parameters, extra, sourceLine, value);
    }

    @Override
    public ComponentKind getKind() {
        return ComponentKind.RESISTOR;
    }

    @Override
    public Resistor copy() {
        Resistor copy = copyBaseInto(new Resistor());
        copy.setValue(value);
        return copy;
    }
}

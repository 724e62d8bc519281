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
public class Capacitor extends PassiveComponent {

    @Builder
    public Capacitor(String name, List<String> nodes, String value, Map<String, String> parameters,
                     List<String> extra, int sourceLine) {
        super(name, nodes, parameters, extra, sourceLine, value);
    }

    @Override
    public ComponentKind getKind() {
        return ComponentKind.CAPACITOR;
    }

    @Override
    public Capacitor copy() {
        Capacitor copy = copyBaseInto(new Capacitor());
        copy.setValue(value);
        return copy;
    }
}

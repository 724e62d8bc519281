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
public class Inductor extends PassiveComponent {

    @Builder
    public Inductor(String name, List<String> nodes, String value, Map<String, String> parameters,
                    List<String> extra, int sourceLine) {
        super(name, nodes, parameters, extra, sourceLine, value);
    }

    @Override
    public ComponentKind getKind() {
        return ComponentKind.INDUCTOR;
    }

    @Override
    public Inductor copy() {
        Inductor copy = copyBaseInto(new Inductor());
        copy.setValue(value);
        return copy;
    }
}

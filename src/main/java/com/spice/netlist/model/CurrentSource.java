package com.spice.netlist.model;

import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@NoArgsConstructor
public class CurrentSource extends Component {
    private String dcValue = "0";

    @Builder
    public CurrentSource(String name, List<String> nodes, String dcValue,
                         Map<String, String> parameters, List<String> extra, int sourceLine) {
        super(name, nodes, parameters, extra, null, sourceLine);
        this.dcValue = dcValue != null ? dcValue : "0";
    }

    @Override
    public ComponentKind getKind() {
        return ComponentKind.CURRENT_SOURCE;
    }

    @Override
    public CurrentSource copy() {
        CurrentSource copy = copyBaseInto(new CurrentSource());
        copy.dcValue = dcValue;
        return copy;
    }
}

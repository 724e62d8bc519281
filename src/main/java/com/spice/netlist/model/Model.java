package com.spice.netlist.model;

import java.util.LinkedHashMap;
import java.util.Map;

import lombok.Builder;
import lombok.Data;

/**
 * A {@code .MODEL} statement. Descriptive only; never expanded.
 */
@Data
@Builder
public class Model {
    private String name;
    private String type;
    private Map<String, String> parameters;
    private int sourceLine;

    public static ModelBuilder builder() {
        return new ModelBuilder().parameters(new LinkedHashMap<>());
    }

    public Model copy() {
        return Model.builder()
                .name(name)
                .type(type)
                .parameters(new LinkedHashMap<>(parameters))
                .sourceLine(sourceLine)
                .build();
    }
}
